package io.forthic.error;

import io.forthic.token.CodeLocation;

public class ExtraSemicolonException extends ForthicException {
    public ExtraSemicolonException(String forthic, CodeLocation location) {
        super("Unexpected semicolon outside a definition", forthic, location);
    }

    @Override
    public String errorType() {
        return "ExtraSemicolonError";
    }
}
