package io.forthic.module;

import io.forthic.runtime.Interpreter;

public final class PrefixedWord extends Word {
    private final Word target;

    public PrefixedWord(String name, Word target) {
        super(name, target.stackEffect(), target.description());
        this.target = target;
    }

    public Word target() {
        return target;
    }

    @Override
    protected void run(Interpreter interp) {
        target.execute(interp);
    }

    @Override
    public String qualifiedName() {
        return target.qualifiedName();
    }
}
