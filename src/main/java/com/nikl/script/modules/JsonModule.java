package com.nikl.script.modules;

import static com.nikl.script.modules.Args.requireArgs;
import static com.nikl.script.modules.Args.str;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nikl.script.parser.BuiltinFunction;
import com.nikl.script.parser.RuntimeError;
import com.nikl.script.parser.Value;

/**
 * The {@code "json"} import.
 *
 * parse: objects become HashMaps with String keys in document order, arrays
 * become Arrays, integral numbers that fit 64 bits become Integers and other
 * numbers Floats, null becomes None.
 *
 * stringify: Tuples are written as arrays; HashMap keys must be Strings;
 * functions cannot be written.
 */
public final class JsonModule {

    private static final ObjectMapper om = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonModule() {}

    public static Value create() {
        Map<String, BuiltinFunction> fns = new LinkedHashMap<>();

        fns.put("parse", args -> {
            requireArgs("parse", args, 1);
            String text = str("parse", args, 0);
            try {
                return fromJson(om.readTree(text));
            } catch (JsonProcessingException e) {
                throw new RuntimeError("json.parse error: " + e.getOriginalMessage(), e);
            }
        });

        fns.put("stringify", args -> {
            requireArgs("stringify", args, 1);
            try {
                return Value.string(om.writeValueAsString(toJson(args.get(0))));
            } catch (JsonProcessingException e) {
                throw new RuntimeError("json.stringify error: " + e.getOriginalMessage(), e);
            }
        });

        return Args.module(fns);
    }

    static Value fromJson(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return Value.nil();
        if (n.isBoolean()) return Value.bool(n.booleanValue());
        if (n.isIntegralNumber() && n.canConvertToLong()) return Value.integer(n.longValue());
        if (n.isNumber()) return Value.floating(n.doubleValue());
        if (n.isTextual()) return Value.string(n.textValue());
        if (n.isArray()) {
            List<Value> items = new ArrayList<>(n.size());
            for (JsonNode item : n) items.add(fromJson(item));
            return Value.array(Collections.unmodifiableList(items));
        }
        if (n.isObject()) {
            List<Value.Entry> entries = new ArrayList<>(n.size());
            Iterator<Map.Entry<String, JsonNode>> it = n.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                entries.add(new Value.Entry(Value.string(e.getKey()), fromJson(e.getValue())));
            }
            return Value.hashMap(Collections.unmodifiableList(entries));
        }
        throw new RuntimeError("json.parse error: unsupported node " + n.getNodeType());
    }

    static JsonNode toJson(Value v) {
        switch (v.getType()) {
            case NULL:
                return om.nullNode();
            case BOOL:
                return om.getNodeFactory().booleanNode(v.asBool());
            case INTEGER:
                return om.getNodeFactory().numberNode(v.asInteger());
            case FLOAT: {
                double d = v.asFloat();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new RuntimeError("json.stringify error: " + Value.formatFloat(d) + " has no JSON form");
                }
                return om.getNodeFactory().numberNode(d);
            }
            case STRING:
                return om.getNodeFactory().textNode(v.asString());
            case ARRAY:
            case TUPLE: {
                ArrayNode a = om.createArrayNode();
                List<Value> items = v.getType() == Value.Type.ARRAY ? v.asArray() : v.asTuple();
                for (Value item : items) a.add(toJson(item));
                return a;
            }
            case HASHMAP: {
                ObjectNode o = om.createObjectNode();
                for (Value.Entry e : v.asHashMap()) {
                    if (e.key.getType() != Value.Type.STRING) {
                        throw new RuntimeError("json.stringify error: object keys must be Strings, got " + e.key.typeName());
                    }
                    o.set(e.key.asString(), toJson(e.value));
                }
                return o;
            }
            default:
                throw new RuntimeError("json.stringify error: cannot serialize " + v.typeName());
        }
    }
}
