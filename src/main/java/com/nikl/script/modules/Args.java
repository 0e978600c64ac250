package com.nikl.script.modules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.nikl.script.parser.BuiltinFunction;
import com.nikl.script.parser.RuntimeError;
import com.nikl.script.parser.Value;

/** Argument checks shared by the builtins and host modules. */
final class Args {

    private Args() {}

    static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new RuntimeError(fn + "() expects " + n + " argument" + (n == 1 ? "" : "s") + ", got " + args.size());
        }
    }

    static String str(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.getType() != Value.Type.STRING) {
            throw new RuntimeError(fn + "() expects a String as argument " + (idx + 1) + ", got " + v.typeName());
        }
        return v.asString();
    }

    /** Packs named functions into the HashMap record an {@code import} binds. */
    static Value module(Map<String, BuiltinFunction> functions) {
        List<Value.Entry> entries = new ArrayList<>(functions.size());
        for (Map.Entry<String, BuiltinFunction> e : functions.entrySet()) {
            entries.add(new Value.Entry(Value.string(e.getKey()), Value.builtin(e.getValue())));
        }
        return Value.hashMap(Collections.unmodifiableList(entries));
    }
}
