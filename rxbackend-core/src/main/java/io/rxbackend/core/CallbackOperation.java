package io.rxbackend.core;

import io.reactivex.rxjava3.functions.Cancellable;
import io.rxbackend.vendor.ResultCallback;

import java.util.function.Consumer;

/**
 * A vendor call reporting through one {@link ResultCallback}.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface CallbackOperation<T> {

    /**
     * @return cancel action for the dispatched call, or {@code null} if the vendor offers none
     */
    Cancellable start(ResultCallback<T> callback) throws Throwable;

    /**
     * Adapts a call that returns nothing to cancel.
     */
    static <T> CallbackOperation<T> of(Consumer<ResultCallback<T>> call) {
        return callback -> {
            call.accept(callback);
            return null;
        };
    }
}
