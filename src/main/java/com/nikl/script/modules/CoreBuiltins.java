package com.nikl.script.modules;

import static com.nikl.script.modules.Args.requireArgs;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

import com.nikl.script.parser.BuiltinFunction;
import com.nikl.script.parser.RuntimeError;
import com.nikl.script.parser.Value;

/**
 * Functions bound in every root scope: print, input, len, str, int, float,
 * bool and type.
 */
public final class CoreBuiltins {

    private CoreBuiltins() {}

    public static Map<String, BuiltinFunction> create(PrintStream out, BufferedReader in) {
        Map<String, BuiltinFunction> fns = new LinkedHashMap<>();

        fns.put("print", args -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(args.get(i));
            }
            out.println(sb);
            out.flush();
            return Value.nil();
        });

        fns.put("input", args -> {
            String prompt = "> ";
            if (args.size() == 1) {
                prompt = Args.str("input", args, 0);
            } else if (args.size() > 1) {
                throw new RuntimeError("input() takes at most 1 argument, got " + args.size());
            }
            out.print(prompt);
            out.flush();
            try {
                String line = in.readLine();
                return Value.string(line == null ? "" : line.trim());
            } catch (IOException e) {
                throw new RuntimeError("Failed to read input: " + e.getMessage(), e);
            }
        });

        fns.put("len", args -> {
            requireArgs("len", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING: {
                    String s = v.asString();
                    return Value.integer(s.codePointCount(0, s.length()));
                }
                case ARRAY: return Value.integer(v.asArray().size());
                case TUPLE: return Value.integer(v.asTuple().size());
                case HASHMAP: return Value.integer(v.asHashMap().size());
                default:
                    throw new RuntimeError("len() does not support " + v.typeName());
            }
        });

        fns.put("str", args -> {
            requireArgs("str", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING:
                case INTEGER:
                case FLOAT:
                case BOOL:
                    return Value.string(v.toString());
                default:
                    throw new RuntimeError("str() only converts String, Integer, Float and Boolean, got " + v.typeName());
            }
        });

        fns.put("int", args -> {
            requireArgs("int", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING:
                    try {
                        return Value.integer(Long.parseLong(v.asString()));
                    } catch (NumberFormatException e) {
                        throw new RuntimeError("Invalid string for int conversion: " + v.asString(), e);
                    }
                case INTEGER:
                    return v;
                case FLOAT:
                    return Value.integer((long) v.asFloat());
                default:
                    throw new RuntimeError("int() only converts String, Integer and Float, got " + v.typeName());
            }
        });

        fns.put("float", args -> {
            requireArgs("float", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING:
                    return Value.floating(parseFloat(v.asString()));
                case INTEGER:
                    return Value.floating((double) v.asInteger());
                case FLOAT:
                    return v;
                default:
                    throw new RuntimeError("float() only converts String, Integer and Float, got " + v.typeName());
            }
        });

        fns.put("bool", args -> {
            requireArgs("bool", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING: return Value.bool(!v.asString().isEmpty());
                case INTEGER: return Value.bool(v.asInteger() != 0);
                case FLOAT: return Value.bool(v.asFloat() != 0.0);
                default:
                    throw new RuntimeError("bool() only converts String, Integer and Float, got " + v.typeName());
            }
        });

        fns.put("type", args -> {
            requireArgs("type", args, 1);
            return Value.string(args.get(0).typeName());
        });

        return fns;
    }

    private static double parseFloat(String s) {
        // Double.parseDouble also accepts surrounding blanks and a trailing d/f suffix
        char last = s.isEmpty() ? ' ' : Character.toLowerCase(s.charAt(s.length() - 1));
        if (!s.equals(s.trim()) || last == 'd' || last == 'f') {
            throw new RuntimeError("Invalid string for float conversion: " + s);
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new RuntimeError("Invalid string for float conversion: " + s, e);
        }
    }
}
