package io.forthic.runtime;

import io.forthic.model.RuntimeValue;

import java.util.Optional;

@FunctionalInterface
public interface LiteralHandler {
    Optional<RuntimeValue> parse(String text);
}
