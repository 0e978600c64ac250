package com.nikl.script.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scope of the lexical scope chain. Lookups, assignments and deletes
 * walk outward through {@link #parent}; {@link #define} only looks at this
 * scope, so shadowing an outer name is always allowed.
 */
public class Environment {

    static final class Binding {
        Value value;
        final boolean mutable;

        Binding(Value value, boolean mutable) {
            this.value = value;
            this.mutable = mutable;
        }
    }

    public final Environment parent;
    private final Map<String, Binding> values = new LinkedHashMap<>();

    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment child() {
        return new Environment(this);
    }

    // -------------------------
    // Vars API
    // -------------------------
    public void define(String name, Value value, boolean mutable) {
        if (values.containsKey(name)) {
            throw new RuntimeError("Variable already defined: " + name);
        }
        values.put(name, new Binding(value, mutable));
    }

    /** Like {@link #define} but silently replaces an existing binding in this scope. */
    public void defineOrReplace(String name, Value value, boolean mutable) {
        values.put(name, new Binding(value, mutable));
    }

    public Value get(String name) {
        Binding b = find(name);
        if (b == null) throw new RuntimeError("Undefined variable: " + name);
        return b.value;
    }

    public boolean exists(String name) {
        return find(name) != null;
    }

    public boolean existsLocal(String name) {
        return values.containsKey(name);
    }

    public void assign(String name, Value value) {
        Binding b = find(name);
        if (b == null) throw new RuntimeError("Undefined variable: " + name);
        if (!b.mutable) throw new RuntimeError("Cannot assign to constant: " + name);
        b.value = value;
    }

    public void delete(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.remove(name) != null) return;
        }
        throw new RuntimeError("Cannot delete undefined variable: " + name);
    }

    /**
     * Every binding visible from this scope, outermost first, with inner
     * bindings replacing outer ones of the same name.
     */
    public LinkedHashMap<String, Value> flatten() {
        Deque<Environment> chain = new ArrayDeque<>();
        for (Environment e = this; e != null; e = e.parent) chain.push(e);

        LinkedHashMap<String, Value> out = new LinkedHashMap<>();
        for (Environment e : chain) {
            for (Map.Entry<String, Binding> entry : e.values.entrySet()) {
                out.put(entry.getKey(), entry.getValue().value);
            }
        }
        return out;
    }

    private Binding find(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Binding b = e.values.get(name);
            if (b != null) return b;
        }
        return null;
    }
}
