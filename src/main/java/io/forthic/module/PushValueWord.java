package io.forthic.module;

import io.forthic.model.RuntimeValue;
import io.forthic.runtime.Interpreter;

public final class PushValueWord extends Word {
    private final RuntimeValue value;

    public PushValueWord(String name, RuntimeValue value) {
        super(name);
        this.value = value;
    }

    public RuntimeValue value() {
        return value;
    }

    @Override
    protected void run(Interpreter interp) {
        interp.push(value);
    }

    @Override
    public boolean profiled() {
        return false;
    }
}
