package io.forthic.error;

public class IntentionalStopException extends ForthicException {
    public IntentionalStopException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "IntentionalStopError";
    }
}
