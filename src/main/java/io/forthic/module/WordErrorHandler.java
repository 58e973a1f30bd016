package io.forthic.module;

import io.forthic.runtime.Interpreter;

/**
 * Recovery hook attached to a word. Returning normally marks the failure as handled;
 * throwing passes it on to the next handler.
 */
@FunctionalInterface
public interface WordErrorHandler {
    void handle(RuntimeException error, Word word, Interpreter interp) throws Exception;
}
