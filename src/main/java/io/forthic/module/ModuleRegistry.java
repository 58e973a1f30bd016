package io.forthic.module;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ModuleRegistry {
    private final Map<String, Module> modules = new LinkedHashMap<>();
    private boolean frozen;

    public synchronized void register(Module module) {
        register(module.name(), module);
    }

    public synchronized void register(String name, Module module) {
        if (frozen) {
            throw new IllegalStateException("module registry is frozen, cannot register '" + name + "'");
        }
        modules.put(name, module);
    }

    public synchronized Optional<Module> find(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    public synchronized List<String> names() {
        return new ArrayList<>(modules.keySet());
    }

    public synchronized Map<String, Module> asMap() {
        return new LinkedHashMap<>(modules);
    }

    public synchronized void freeze() {
        frozen = true;
        for (Module module : modules.values()) {
            module.freeze();
        }
    }

    public synchronized boolean isFrozen() {
        return frozen;
    }
}
