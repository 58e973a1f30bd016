package io.forthic.config;

import io.forthic.bridge.RemoteRuntimeModule;
import io.forthic.runtime.CoreModule;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ModuleFactoryRegistry {
    private final Map<String, ModuleFactory> factories = new ConcurrentHashMap<>();

    public static ModuleFactoryRegistry withBuiltins() {
        ModuleFactoryRegistry registry = new ModuleFactoryRegistry();
        registry.register(CoreModule.NAME, CoreModule::new);
        registry.register(RemoteRuntimeModule.NAME, RemoteRuntimeModule::new);
        return registry;
    }

    public void register(String key, ModuleFactory factory) {
        factories.put(key, factory);
    }

    public Optional<ModuleFactory> find(String key) {
        return Optional.ofNullable(factories.get(key));
    }

    public Collection<String> keys() {
        return factories.keySet();
    }

    public ModuleFactory resolve(String importPath) throws ReflectiveOperationException {
        ModuleFactory builtin = factories.get(importPath);
        if (builtin != null) {
            return builtin;
        }
        Class<?> type = Class.forName(importPath);
        if (!ModuleFactory.class.isAssignableFrom(type)) {
            throw new ClassNotFoundException(importPath + " does not implement " + ModuleFactory.class.getName());
        }
        return (ModuleFactory) type.getDeclaredConstructor().newInstance();
    }
}
