package io.rxbackend.core;

/**
 * Receiving end of a vendor callback, bound to one subscription.
 *
 * <p>Safe to call from any thread. Once {@link #error} or {@link #complete} has been called, or the
 * subscriber has disposed, every further call is dropped.
 *
 * @param <T> element type
 */
public interface CallbackSink<T> {

    void next(T value);

    void error(Throwable error);

    void complete();

    /**
     * Whether signals are still delivered.
     */
    boolean isActive();
}
