package io.forthic.module;

import io.forthic.error.ForthicException;
import io.forthic.error.NativeWordException;
import io.forthic.model.RuntimeValue;
import io.forthic.runtime.Interpreter;

import java.util.List;

public final class NativeWord extends Word {
    private final WordBinding binding;

    public NativeWord(WordBinding binding) {
        super(binding.name(), binding.stackEffect().text(), binding.description());
        this.binding = binding;
    }

    public WordBinding binding() {
        return binding;
    }

    @Override
    protected void run(Interpreter interp) {
        WordOptions options = WordOptions.EMPTY;
        if (binding.stackEffect().hasOptions()) {
            options = interp.popOptionsIfPresent();
        }
        List<RuntimeValue> inputs = interp.popInputs(binding.stackEffect().inputCount());
        RuntimeValue result;
        try {
            result = binding.impl().invoke(inputs, options);
        } catch (ForthicException e) {
            throw e;
        } catch (Exception e) {
            throw new NativeWordException(name(), module() == null ? null : module().name(), e);
        }
        if (result != null) {
            interp.push(result);
        }
    }
}
