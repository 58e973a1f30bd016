package io.forthic.error;

import io.forthic.token.CodeLocation;

public class MissingSemicolonException extends ForthicException {
    public MissingSemicolonException(String definitionName, String forthic, CodeLocation location) {
        super("Missing semicolon to end definition of " + definitionName, forthic, location);
    }

    @Override
    public String errorType() {
        return "MissingSemicolonError";
    }
}
