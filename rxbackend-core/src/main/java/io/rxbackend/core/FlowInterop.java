package io.rxbackend.core;

import io.reactivex.rxjava3.core.BackpressureStrategy;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Observable;
import org.reactivestreams.FlowAdapters;

import java.util.Objects;
import java.util.concurrent.Flow;

/**
 * Exposes adapter streams as Reactive Streams and JDK {@link Flow} publishers.
 */
public final class FlowInterop {
    private FlowInterop() {}

    /**
     * Applies the backpressure handling configured in {@code options}.
     */
    public static <T> Flowable<T> toFlowable(Observable<T> source, AdapterOptions options) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
        if (options.backpressure() == BackpressureStrategy.BUFFER && options.bufferCapacity() > 0) {
            return source.toFlowable(BackpressureStrategy.MISSING).onBackpressureBuffer(options.bufferCapacity());
        }
        return source.toFlowable(options.backpressure());
    }

    public static <T> Flow.Publisher<T> toFlow(Observable<T> source, AdapterOptions options) {
        return FlowAdapters.toFlowPublisher(toFlowable(source, options));
    }
}
