package io.rxbackend.core;

import io.reactivex.rxjava3.functions.Cancellable;

/**
 * Starts a vendor operation for one subscription.
 *
 * @param <T> element type
 */
@FunctionalInterface
public interface CallbackSource<T> {

    /**
     * Invokes the vendor and wires its callbacks to {@code sink}.
     *
     * @return action releasing what the vendor returned (listener handle, running task), or
     *         {@code null} if there is nothing to release
     */
    Cancellable start(CallbackSink<T> sink) throws Throwable;
}
