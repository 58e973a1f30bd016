/**
 * Execution bridge between runtimes.
 *
 * <p>{@link io.forthic.bridge.ForthicRuntimeService} executes words for callers and
 * {@link io.forthic.bridge.RuntimeServer} exposes it over HTTP/JSON. On the calling side
 * {@link io.forthic.bridge.RuntimeClient} talks to a server and
 * {@link io.forthic.bridge.RemoteRuntimeModule} lets Forthic code import remote modules.
 */
package io.forthic.bridge;
