package com.nikl.script.parser;

import java.math.BigDecimal;
import java.util.List;

public class Value {
    public enum Type { INTEGER, FLOAT, BOOL, STRING, ARRAY, TUPLE, HASHMAP, FUNCTION, BUILTIN, NULL }

    private static final Value NULL = new Value(Type.NULL, null);

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    /** One key/value pair of a HashMap value. Pairs keep insertion order and keys may repeat. */
    public static final class Entry {
        public final Value key;
        public final Value value;

        public Entry(Value key, Value value) {
            this.key = key;
            this.value = value;
        }
    }

    public static Value integer(long l) { return new Value(Type.INTEGER, l); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value array(List<Value> a) { return new Value(Type.ARRAY, a); }
    public static Value tuple(List<Value> t) { return new Value(Type.TUPLE, t); }
    public static Value hashMap(List<Entry> entries) { return new Value(Type.HASHMAP, entries); }
    public static Value function(UserFunction fn) { return new Value(Type.FUNCTION, fn); }
    public static Value builtin(BuiltinFunction fn) { return new Value(Type.BUILTIN, fn); }
    public static Value nil() { return NULL; }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }

    public long asInteger() {
        if (type != Type.INTEGER) throw new RuntimeError("Expected Integer, got " + typeName());
        return (long) value;
    }

    public double asFloat() {
        if (type != Type.FLOAT) throw new RuntimeError("Expected Float, got " + typeName());
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new RuntimeError("Expected Boolean, got " + typeName());
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new RuntimeError("Expected String, got " + typeName());
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw new RuntimeError("Expected Array, got " + typeName());
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asTuple() {
        if (type != Type.TUPLE) throw new RuntimeError("Expected Tuple, got " + typeName());
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public List<Entry> asHashMap() {
        if (type != Type.HASHMAP) throw new RuntimeError("Expected HashMap, got " + typeName());
        return (List<Entry>) value;
    }

    public UserFunction asFunction() {
        if (type != Type.FUNCTION) throw new RuntimeError("Expected Function, got " + typeName());
        return (UserFunction) value;
    }

    public BuiltinFunction asBuiltin() {
        if (type != Type.BUILTIN) throw new RuntimeError("Expected BuiltinFunction, got " + typeName());
        return (BuiltinFunction) value;
    }

    /**
     * Linear scan for the first String key equal to {@code key}.
     * Returns null when this map has no such key.
     */
    public Value lookup(String key) {
        for (Entry e : asHashMap()) {
            if (e.key.type == Type.STRING && key.equals(e.key.value)) return e.value;
        }
        return null;
    }

    /** Name reported by the {@code type()} builtin and used in error messages. */
    public String typeName() {
        switch (type) {
            case INTEGER: return "Integer";
            case FLOAT: return "Float";
            case BOOL: return "Boolean";
            case STRING: return "String";
            case ARRAY: return "Array";
            case TUPLE: return "Tuple";
            case HASHMAP: return "HashMap";
            case FUNCTION: return "Function";
            case BUILTIN: return "BuiltinFunction";
            default: return "None";
        }
    }

    public static String formatFloat(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        String plain = new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
        if (plain.indexOf('.') < 0) plain = plain + ".0";
        return plain;
    }

    /** Display form, as written by {@code print} and {@code str}. */
    @Override
    public String toString() {
        switch (type) {
            case INTEGER:
                return Long.toString(asInteger());
            case FLOAT:
                return formatFloat(asFloat());
            case BOOL:
                return asBool() ? "True" : "False";
            case STRING:
                return asString();
            case ARRAY:
                return "[" + join(asArray()) + "]";
            case TUPLE:
                return "(" + join(asTuple()) + ")";
            case HASHMAP: {
                StringBuilder sb = new StringBuilder("{");
                List<Entry> entries = asHashMap();
                for (int i = 0; i < entries.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(entries.get(i).key).append(": ").append(entries.get(i).value);
                }
                return sb.append("}").toString();
            }
            case FUNCTION:
                return "<function " + asFunction().name + ">";
            case BUILTIN:
                return "<builtin function>";
            default:
                return "None";
        }
    }

    private static String join(List<Value> items) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(items.get(i));
        }
        return sb.toString();
    }
}
