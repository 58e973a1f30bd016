package io.forthic.error;

public class TooManyAttemptsException extends ForthicException {
    public TooManyAttemptsException(int maxAttempts, ForthicException lastError) {
        super("Gave up after " + maxAttempts + " recovery attempt(s): " + lastError.getMessage(), lastError);
    }

    @Override
    public String errorType() {
        return "TooManyAttemptsError";
    }
}
