package io.forthic.runtime;

import io.forthic.module.Module;
import io.forthic.module.ModuleRegistry;

import java.time.ZoneId;
import java.time.ZoneOffset;

public class StandardInterpreter extends Interpreter {
    public StandardInterpreter() {
        this(new ModuleRegistry(), ZoneOffset.UTC);
    }

    public StandardInterpreter(ModuleRegistry sharedModules, ZoneId timezone) {
        super(sharedModules, timezone);
        Module core = sharedModules().find(CoreModule.NAME).orElseGet(CoreModule::new);
        appModule().addImport(core, "");
    }
}
