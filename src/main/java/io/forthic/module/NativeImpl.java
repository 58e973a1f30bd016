package io.forthic.module;

import io.forthic.model.RuntimeValue;

import java.util.List;

/**
 * Host implementation of a word. Inputs arrive in push order; returning {@code null}
 * pushes nothing, returning {@link RuntimeValue#NULL} pushes a null value.
 */
@FunctionalInterface
public interface NativeImpl {
    RuntimeValue invoke(List<RuntimeValue> inputs, WordOptions options) throws Exception;
}
