package io.rxbackend.testing;

import io.rxbackend.vendor.ListenerHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Handle-keyed listener table with removal accounting.
 */
public final class Listeners<L> {

    private final Map<ListenerHandle, L> active = new LinkedHashMap<>();
    private int removals;

    public synchronized ListenerHandle add(L listener) {
        ListenerHandle handle = FakeListenerHandle.next();
        active.put(handle, listener);
        return handle;
    }

    public synchronized void remove(ListenerHandle handle) {
        removals++;
        active.remove(handle);
    }

    public synchronized void clear() {
        active.clear();
    }

    public void forEach(Consumer<L> action) {
        List<L> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(active.values());
        }
        snapshot.forEach(action);
    }

    public synchronized int activeCount() {
        return active.size();
    }

    /**
     * Number of remove calls, including calls for unknown or already removed handles.
     */
    public synchronized int removals() {
        return removals;
    }
}
