package io.rxbackend.reactor;

import io.rxbackend.rxjava3.RxRemoteConfig;
import io.rxbackend.vendor.remoteconfig.RemoteConfig;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reactor adapter over {@link RxRemoteConfig}.
 */
public final class ReactorRemoteConfig {

    public Mono<RemoteConfig> fetch(RemoteConfig config, Duration expiration) {
        return Conversions.mono(RxRemoteConfig.fetch(config, expiration));
    }

    public Mono<Boolean> activate(RemoteConfig config) {
        return Conversions.mono(RxRemoteConfig.activate(config));
    }

    public Mono<Boolean> fetchAndActivate(RemoteConfig config) {
        return Conversions.mono(RxRemoteConfig.fetchAndActivate(config));
    }
}
