package io.forthic.error;

public class StackUnderflowException extends ForthicException {
    public StackUnderflowException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "StackUnderflowError";
    }
}
