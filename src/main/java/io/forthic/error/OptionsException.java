package io.forthic.error;

public class OptionsException extends ForthicException {
    public OptionsException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "OptionsError";
    }
}
