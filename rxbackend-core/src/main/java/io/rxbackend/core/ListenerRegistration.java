package io.rxbackend.core;

import io.reactivex.rxjava3.functions.Cancellable;

import java.util.function.Consumer;

/**
 * Registers a vendor listener that fires until it is removed.
 *
 * @param <T> element type
 */
@FunctionalInterface
public interface ListenerRegistration<T> {

    /**
     * @return action calling the vendor's remove primitive with the handle it returned
     */
    Cancellable register(Consumer<T> handler);
}
