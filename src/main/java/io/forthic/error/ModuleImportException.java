package io.forthic.error;

public class ModuleImportException extends ForthicException {
    private final String moduleName;

    public ModuleImportException(String moduleName) {
        super("Unknown module: " + moduleName);
        this.moduleName = moduleName;
    }

    @Override
    public String moduleName() {
        return moduleName;
    }

    @Override
    public String errorType() {
        return "ModuleImportError";
    }
}
