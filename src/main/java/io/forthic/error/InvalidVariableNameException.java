package io.forthic.error;

public class InvalidVariableNameException extends ForthicException {
    public InvalidVariableNameException(String name) {
        super("Invalid variable name: " + name + " (names starting with '__' are reserved)");
    }

    @Override
    public String errorType() {
        return "InvalidVariableNameError";
    }
}
