package io.rxbackend.core;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.ObservableEmitter;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.functions.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds RxJava streams out of vendor callbacks.
 *
 * <p>All streams are cold: the vendor is invoked on subscription and again for every further
 * subscription. The cleanup returned by a {@link CallbackSource} runs exactly once per subscription,
 * on completion, error or disposal, whichever comes first. Vendor errors are delivered unchanged.
 *
 * <p>Callbacks the vendor makes after the stream has terminated or been disposed are dropped and
 * logged at DEBUG. They never reach the subscriber nor the RxJava error hook.
 */
public final class CallbackObservables {

    private static final Logger logger = LoggerFactory.getLogger(CallbackObservables.class);

    private static final Cancellable NO_CLEANUP = () -> { };

    private CallbackObservables() {}

    /**
     * Generic constructor: {@code source} starts the vendor operation and returns its cleanup.
     */
    public static <T> Observable<T> create(CallbackSource<T> source) {
        Objects.requireNonNull(source, "source");
        return Observable.create(emitter -> {
            EmitterSink<T> sink = new EmitterSink<>(emitter);
            Cancellable cleanup = source.start(sink);
            // runs immediately if the vendor already called back synchronously
            emitter.setCancellable(cleanup != null ? cleanup : NO_CLEANUP);
        });
    }

    /**
     * Single-shot call: emits the payload, if any, then completes; or fails with the vendor error.
     */
    public static <T> Observable<T> single(CallbackOperation<T> operation) {
        Objects.requireNonNull(operation, "operation");
        return create(sink -> operation.start((result, error) -> {
            if (error != null) {
                sink.error(error);
                return;
            }
            if (result != null) {
                sink.next(result);
            }
            sink.complete();
        }));
    }

    /**
     * Single-shot call whose success always carries a payload.
     */
    public static <T> Single<T> singleResult(CallbackOperation<T> operation) {
        return single(operation).singleOrError();
    }

    /**
     * Single-shot call whose success may carry no payload.
     */
    public static <T> Maybe<T> maybeResult(CallbackOperation<T> operation) {
        return single(operation).singleElement();
    }

    /**
     * Single-shot call whose payload, if any, is irrelevant.
     */
    public static <T> Completable completion(CallbackOperation<T> operation) {
        return single(operation).ignoreElements();
    }

    /**
     * Listener that fires until removed. The stream never completes on its own; disposing it
     * removes the listener.
     */
    public static <T> Observable<T> listener(ListenerRegistration<T> registration) {
        Objects.requireNonNull(registration, "registration");
        return create(sink -> registration.register(sink::next));
    }

    /**
     * Listener the vendor detaches after one event: emits that event then completes.
     */
    public static <T> Observable<T> once(OnceRegistration<T> registration) {
        Objects.requireNonNull(registration, "registration");
        return create(sink -> {
            registration.register(value -> {
                sink.next(value);
                sink.complete();
            });
            return NO_CLEANUP;
        });
    }

    static void dropped(String signal, Throwable error) {
        if (error != null) {
            logger.debug("Dropped {} signal received after the stream terminated", signal, error);
        } else {
            logger.debug("Dropped {} signal received after the stream terminated", signal);
        }
    }

    private static final class EmitterSink<T> implements CallbackSink<T> {

        private final ObservableEmitter<T> emitter;
        private final AtomicBoolean terminated = new AtomicBoolean();

        EmitterSink(ObservableEmitter<T> emitter) {
            this.emitter = emitter.serialize();
        }

        @Override
        public void next(T value) {
            if (!isActive()) {
                dropped("next", null);
                return;
            }
            emitter.onNext(value);
        }

        @Override
        public void error(Throwable error) {
            if (!terminated.compareAndSet(false, true) || !emitter.tryOnError(error)) {
                dropped("error", error);
            }
        }

        @Override
        public void complete() {
            if (!terminated.compareAndSet(false, true) || emitter.isDisposed()) {
                dropped("complete", null);
                return;
            }
            emitter.onComplete();
        }

        @Override
        public boolean isActive() {
            return !terminated.get() && !emitter.isDisposed();
        }
    }
}
