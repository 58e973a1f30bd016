package io.forthic.config;

import io.forthic.error.ModuleLoadException;
import io.forthic.module.Module;
import io.forthic.module.ModuleRegistry;
import io.forthic.runtime.CoreModule;
import io.forthic.runtime.Interpreter;
import io.forthic.runtime.StandardInterpreter;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Builds the shared module registry at startup. The core module is always present;
 * configured modules follow in file order. The registry is frozen before it is returned.
 */
public final class ModuleLoader {
    private final ModuleFactoryRegistry factories;
    private final PrintStream warnings;

    public ModuleLoader() {
        this(ModuleFactoryRegistry.withBuiltins(), System.err);
    }

    public ModuleLoader(ModuleFactoryRegistry factories, PrintStream warnings) {
        this.factories = factories;
        this.warnings = warnings;
    }

    public ModuleRegistry load(ForthicConfig config) {
        if (!config.hasModulesConfig()) {
            return load(List.of(), config);
        }
        List<ModuleConfig> modules;
        try {
            modules = ModuleConfig.read(config.modulesConfig());
        } catch (IOException | IllegalArgumentException e) {
            throw new ModuleLoadException("<config>", "cannot read " + config.modulesConfig() + ": " + e.getMessage(), e);
        }
        return load(modules, config);
    }

    public ModuleRegistry load(List<ModuleConfig> modules, ForthicConfig config) {
        ModuleRegistry registry = new ModuleRegistry();
        registry.register(new CoreModule());
        Interpreter bootstrap = new StandardInterpreter(registry, config.timezone());
        for (ModuleConfig module : modules) {
            try {
                registry.register(module.name(), create(module, bootstrap));
            } catch (ModuleLoadException e) {
                if (!module.optional()) {
                    throw e;
                }
                warnings.println("WARN optional module '" + module.name() + "' not loaded: " + e.getMessage());
            }
        }
        registry.freeze();
        return registry;
    }

    private Module create(ModuleConfig config, Interpreter bootstrap) {
        Module module;
        try {
            module = factories.resolve(config.importPath()).create();
        } catch (Exception e) {
            throw new ModuleLoadException(config.name(), e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
        if (module == null) {
            throw new ModuleLoadException(config.name(), "factory " + config.importPath() + " returned no module", null);
        }
        if (!CoreModule.NAME.equals(config.importPath())) {
            module.setRuntimeSpecific(true);
        }
        bootstrap.runModuleCode(module);
        return module;
    }
}
