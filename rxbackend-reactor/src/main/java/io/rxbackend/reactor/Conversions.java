package io.rxbackend.reactor;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import io.rxbackend.core.AdapterOptions;
import io.rxbackend.core.FlowInterop;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

final class Conversions {
    private Conversions() {}

    static <T> Flux<T> flux(Observable<T> source, AdapterOptions options) {
        return Flux.from(FlowInterop.toFlowable(source, options));
    }

    static <T> Mono<T> mono(Single<T> source) {
        return Mono.from(source.toFlowable());
    }

    static <T> Mono<T> mono(Maybe<T> source) {
        return Mono.from(source.toFlowable());
    }

    static Mono<Void> mono(Completable source) {
        return Mono.from(source.<Void>toFlowable());
    }
}
