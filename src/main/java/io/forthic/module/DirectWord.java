package io.forthic.module;

import io.forthic.error.ForthicException;
import io.forthic.error.NativeWordException;
import io.forthic.runtime.Interpreter;

public final class DirectWord extends Word {
    private final DirectImpl impl;

    public DirectWord(String name, String stackEffect, String description, DirectImpl impl) {
        super(name, stackEffect, description);
        this.impl = impl;
    }

    @Override
    protected void run(Interpreter interp) {
        try {
            impl.execute(interp);
        } catch (ForthicException e) {
            throw e;
        } catch (Exception e) {
            throw new NativeWordException(name(), module() == null ? null : module().name(), e);
        }
    }
}
