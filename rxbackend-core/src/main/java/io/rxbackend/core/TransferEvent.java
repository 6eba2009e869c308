package io.rxbackend.core;

import io.rxbackend.vendor.storage.TaskSnapshot;
import io.rxbackend.vendor.storage.TaskStatus;

import java.util.Objects;

/**
 * One status report of an upload or download.
 *
 * @param status the status observer that fired
 * @param snapshot task state at that moment
 * @param <R> task result type
 */
public record TransferEvent<R>(TaskStatus status, TaskSnapshot<R> snapshot) {

    public TransferEvent {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(snapshot, "snapshot");
    }

    /**
     * Task result; only present on {@link TaskStatus#SUCCESS} events.
     */
    public R result() {
        return snapshot.result();
    }

    /**
     * Fraction transferred in {@code [0, 1]}, or {@code -1} when the total size is unknown.
     */
    public double fraction() {
        long total = snapshot.totalBytes();
        if (total <= 0) {
            return -1;
        }
        return Math.min(1.0, (double) snapshot.bytesTransferred() / total);
    }
}
