package io.forthic.error;

import io.forthic.token.CodeLocation;

public class TokenizeException extends ForthicException {
    public TokenizeException(String message, String forthic, CodeLocation location) {
        super(message, forthic, location);
    }

    @Override
    public String errorType() {
        return "TokenizeError";
    }
}
