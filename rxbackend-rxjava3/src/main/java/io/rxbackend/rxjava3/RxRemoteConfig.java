package io.rxbackend.rxjava3;

import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import io.rxbackend.core.CallbackObservables;
import io.rxbackend.core.CallbackOperation;
import io.rxbackend.vendor.remoteconfig.FetchStatus;
import io.rxbackend.vendor.remoteconfig.RemoteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Remote config fetches as RxJava streams.
 */
public final class RxRemoteConfig {

    private static final Logger logger = LoggerFactory.getLogger(RxRemoteConfig.class);

    private RxRemoteConfig() {}

    /**
     * Fetches values younger than {@code expiration} and activates them.
     *
     * <p>Emits the config once fetched values are active. Fails with the SDK error if the fetch
     * reported one. Completes empty if the fetch did not succeed and the SDK gave no error, e.g. a
     * throttled fetch served from cache.
     */
    public static Maybe<RemoteConfig> fetch(RemoteConfig config, Duration expiration) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(expiration, "expiration");
        return CallbackObservables.maybeResult(CallbackOperation.<RemoteConfig>of(callback -> config.fetch(expiration, (status, error) -> {
            if (status == FetchStatus.SUCCESS) {
                boolean activated = config.activateFetched();
                logger.debug("Fetched remote config, activated new values: {}", activated);
                callback.onComplete(config, null);
            } else if (error != null) {
                callback.onComplete(null, error);
            } else {
                logger.debug("Remote config fetch ended with status {} and no error", status);
                callback.onComplete(null, null);
            }
        })));
    }

    /**
     * Activates fetched values; emits whether anything changed.
     */
    public static Single<Boolean> activate(RemoteConfig config) {
        Objects.requireNonNull(config, "config");
        return CallbackObservables.singleResult(CallbackOperation.of(config::activate));
    }

    /**
     * Fetches with the SDK's default expiration and activates; emits whether anything changed.
     */
    public static Single<Boolean> fetchAndActivate(RemoteConfig config) {
        Objects.requireNonNull(config, "config");
        return CallbackObservables.singleResult(CallbackOperation.of(config::fetchAndActivate));
    }
}
