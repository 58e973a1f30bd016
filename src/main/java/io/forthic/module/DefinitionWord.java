package io.forthic.module;

import io.forthic.runtime.Interpreter;
import io.forthic.token.CodeLocation;
import io.forthic.token.Token;

import java.util.List;

public final class DefinitionWord extends Word {
    private final List<Token> body;
    private final String source;

    public DefinitionWord(String name, List<Token> body, String source, CodeLocation location) {
        super(name);
        this.body = List.copyOf(body);
        this.source = source;
        setLocation(location);
    }

    public List<Token> body() {
        return body;
    }

    public String source() {
        return source;
    }

    @Override
    protected void run(Interpreter interp) {
        interp.executeDefinition(this);
    }
}
