/**
 * Interpreter engine.
 *
 * <p>{@link io.forthic.runtime.Interpreter} owns the token loop, word resolution over the
 * module stack, array and module brackets, definitions and profiling.
 * {@link io.forthic.runtime.CoreModule} supplies the words the engine's own semantics
 * depend on.
 */
package io.forthic.runtime;
