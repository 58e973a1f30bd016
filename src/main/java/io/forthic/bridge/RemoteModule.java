package io.forthic.bridge;

import io.forthic.module.Module;
import io.forthic.wire.ModuleInfo;
import io.forthic.wire.WordInfo;

public final class RemoteModule extends Module {
    private final RuntimeClient client;
    private final String runtimeName;
    private boolean initialized;

    public RemoteModule(String moduleName, String runtimeName, RuntimeClient client) {
        super(moduleName, "Remote module from " + runtimeName + " runtime");
        this.client = client;
        this.runtimeName = runtimeName;
        setRuntimeSpecific(true);
    }

    public String runtimeName() {
        return runtimeName;
    }

    public synchronized RemoteModule initialize() {
        if (initialized) {
            return this;
        }
        ModuleInfo info = client.getModuleInfo(name());
        for (WordInfo word : info.words()) {
            addExportableWord(new RemoteWord(word.name(), word.stackEffect(), word.description(), client, name()));
        }
        initialized = true;
        return this;
    }

    public boolean isInitialized() {
        return initialized;
    }
}
