package com.nikl.script.modules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.nikl.script.parser.Value;

/** Import names that resolve to host-provided modules instead of files. */
public final class ModuleRegistry {

    private final Map<String, Supplier<Value>> modules = new LinkedHashMap<>();

    /** Registry with {@code os}, {@code regex} and {@code json}. */
    public static ModuleRegistry withDefaults(OsModule os) {
        ModuleRegistry r = new ModuleRegistry();
        r.register("os", os::toValue);
        r.register("regex", RegexModule::create);
        r.register("json", JsonModule::create);
        return r;
    }

    public void register(String name, Supplier<Value> factory) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("module name must not be empty");
        modules.put(name, factory);
    }

    /** Live read-only view; modules registered later are visible through it. */
    public Map<String, Supplier<Value>> asMap() {
        return Collections.unmodifiableMap(modules);
    }
}
