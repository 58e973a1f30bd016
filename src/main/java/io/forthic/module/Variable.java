package io.forthic.module;

import io.forthic.model.RuntimeValue;

public final class Variable {
    private final String name;
    private RuntimeValue value;

    public Variable(String name) {
        this(name, RuntimeValue.NULL);
    }

    public Variable(String name, RuntimeValue value) {
        this.name = name;
        this.value = value == null ? RuntimeValue.NULL : value;
    }

    public String name() {
        return name;
    }

    public RuntimeValue value() {
        return value;
    }

    public void set(RuntimeValue value) {
        this.value = value == null ? RuntimeValue.NULL : value;
    }

    public Variable copy() {
        return new Variable(name, value);
    }
}
