/**
 * Forthic runtime source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.forthic.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.forthic.cli.ForthicCommand} maps commands to the interpreter and bridge.</li>
 *   <li>{@code io.forthic.runtime.Interpreter} executes Forthic source.</li>
 *   <li>{@code io.forthic.bridge.ForthicRuntimeService} executes words on behalf of remote runtimes.</li>
 * </ul>
 */
package io.forthic;
