package io.forthic.module;

import io.forthic.runtime.Interpreter;

@FunctionalInterface
public interface DirectImpl {
    void execute(Interpreter interp) throws Exception;
}
