package io.rxbackend.core;

import java.util.function.Consumer;

/**
 * Registers a vendor listener that the SDK detaches after its first event.
 *
 * @param <T> element type
 */
@FunctionalInterface
public interface OnceRegistration<T> {

    void register(Consumer<T> handler);
}
