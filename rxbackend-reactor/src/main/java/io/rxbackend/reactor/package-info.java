/**
 * Project Reactor views of the RxJava 3 adapters.
 *
 * <p>Listener streams become {@code Flux} with the backpressure handling of the configured
 * {@link io.rxbackend.core.AdapterOptions}; single-shot calls become {@code Mono}.
 */
package io.rxbackend.reactor;
