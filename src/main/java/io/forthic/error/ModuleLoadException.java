package io.forthic.error;

public class ModuleLoadException extends ForthicException {
    private final String moduleName;

    public ModuleLoadException(String moduleName, String message, Throwable cause) {
        super("Failed to load module '" + moduleName + "': " + message, cause);
        this.moduleName = moduleName;
    }

    @Override
    public String moduleName() {
        return moduleName;
    }

    @Override
    public String errorType() {
        return "ModuleLoadError";
    }
}
