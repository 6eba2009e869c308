package io.rxbackend.testing;

import io.rxbackend.vendor.ResultCallback;
import io.rxbackend.vendor.remoteconfig.FetchCallback;
import io.rxbackend.vendor.remoteconfig.FetchStatus;
import io.rxbackend.vendor.remoteconfig.RemoteConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Remote config with staged values and test-answered fetches.
 */
public final class FakeRemoteConfig implements RemoteConfig {

    private final Map<String, String> active = new HashMap<>();
    private final Map<String, String> fetched = new HashMap<>();
    private final List<FetchCallback> fetches = new ArrayList<>();
    private final List<Duration> expirations = new ArrayList<>();
    private final PendingCalls<Boolean> activations = new PendingCalls<>();
    private FetchStatus lastFetchStatus = FetchStatus.NO_FETCH_YET;
    private int activateFetchedCalls;

    /**
     * Stages a value that the next activation makes visible.
     */
    public synchronized FakeRemoteConfig stage(String key, String value) {
        fetched.put(key, value);
        return this;
    }

    @Override
    public synchronized void fetch(Duration expiration, FetchCallback callback) {
        expirations.add(expiration);
        fetches.add(callback);
    }

    /**
     * Answers the oldest pending fetch.
     */
    public void completeFetch(FetchStatus status, Throwable error) {
        FetchCallback callback;
        synchronized (this) {
            if (fetches.isEmpty()) {
                throw new IllegalStateException("no pending fetch");
            }
            callback = fetches.remove(0);
            lastFetchStatus = status;
        }
        callback.onComplete(status, error);
    }

    public synchronized List<Duration> expirations() {
        return List.copyOf(expirations);
    }

    @Override
    public synchronized boolean activateFetched() {
        activateFetchedCalls++;
        if (fetched.isEmpty()) {
            return false;
        }
        active.putAll(fetched);
        fetched.clear();
        return true;
    }

    public synchronized int activateFetchedCalls() {
        return activateFetchedCalls;
    }

    @Override
    public void activate(ResultCallback<Boolean> callback) {
        activations.add("activate", callback);
    }

    @Override
    public void fetchAndActivate(ResultCallback<Boolean> callback) {
        activations.add("fetchAndActivate", callback);
    }

    public PendingCalls<Boolean> activations() {
        return activations;
    }

    @Override
    public synchronized String getValue(String key) {
        return active.get(key);
    }

    @Override
    public synchronized FetchStatus lastFetchStatus() {
        return lastFetchStatus;
    }
}
