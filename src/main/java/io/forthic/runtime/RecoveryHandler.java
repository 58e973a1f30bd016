package io.forthic.runtime;

import io.forthic.error.ForthicException;

/**
 * Gets a chance to repair interpreter state after a failed top-level token, for example
 * by pushing a substitute value. Throwing ends the run with that exception.
 */
@FunctionalInterface
public interface RecoveryHandler {
    void recover(ForthicException error, Interpreter interp);
}
