package io.forthic.module;

import io.forthic.model.RuntimeValue;
import io.forthic.runtime.Interpreter;

/**
 * Caches the single value produced by a definition declared with {@code @:}. The cache
 * lives as long as the owning module instance; concurrent first calls may each compute
 * the value, and the last one stored wins.
 */
public final class MemoWord extends Word {
    private final DefinitionWord definition;
    private volatile RuntimeValue cached;

    public MemoWord(DefinitionWord definition) {
        super(definition.name());
        this.definition = definition;
        setLocation(definition.location());
    }

    public DefinitionWord definition() {
        return definition;
    }

    public boolean hasValue() {
        return cached != null;
    }

    public RuntimeValue refresh(Interpreter interp) {
        interp.dispatch(definition);
        RuntimeValue value = interp.pop();
        cached = value;
        return value;
    }

    @Override
    protected void run(Interpreter interp) {
        RuntimeValue value = cached;
        if (value == null) {
            value = refresh(interp);
        }
        interp.push(value);
    }

    @Override
    public boolean profiled() {
        return false;
    }
}
