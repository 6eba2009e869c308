package io.rxbackend.core;

import io.reactivex.rxjava3.core.Observable;
import io.rxbackend.vendor.BackendException;
import io.rxbackend.vendor.ListenerHandle;
import io.rxbackend.vendor.storage.StorageTask;
import io.rxbackend.vendor.storage.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Status streams of storage tasks.
 *
 * <p>A task reports each status to the observers registered for it. {@link #observeStatus} turns one
 * such registration into a stream; {@link #transferEvents} merges the progress, success and failure
 * registrations into the lifecycle of the whole transfer.
 */
public final class StorageTaskObservables {

    private static final Logger logger = LoggerFactory.getLogger(StorageTaskObservables.class);

    private StorageTaskObservables() {}

    /**
     * Observes one status of {@code task}.
     *
     * <p>A snapshot carrying an error fails the stream. A {@link TaskStatus#FAILURE} report without an
     * error fails it with an {@code unknown} storage error. A {@link TaskStatus#SUCCESS} snapshot is
     * forwarded and completes the stream. Every other report is forwarded as it arrives. Terminating
     * or disposing the stream removes the observer.
     */
    public static <R> Observable<TransferEvent<R>> observeStatus(StorageTask<R> task, TaskStatus status) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(status, "status");
        return CallbackObservables.create(sink -> {
            ListenerHandle handle = task.observe(status, snapshot -> {
                if (snapshot.error() != null) {
                    sink.error(snapshot.error());
                    return;
                }
                if (status == TaskStatus.FAILURE) {
                    sink.error(new BackendException.StorageException("unknown", "Task failed without reporting an error"));
                    return;
                }
                sink.next(new TransferEvent<>(status, snapshot));
                if (status == TaskStatus.SUCCESS) {
                    sink.complete();
                }
            });
            logger.debug("Registered {} observer on {}", status, task);
            return () -> {
                task.removeObserver(handle);
                logger.debug("Removed {} observer from {}", status, task);
            };
        });
    }

    /**
     * Progress and outcome of {@code task}, in the order the task reports them.
     *
     * <p>Completes right after forwarding the success event. Fails on the first error-bearing
     * snapshot of any status. Either way all three observers are removed and later reports are
     * never seen.
     */
    public static <R> Observable<TransferEvent<R>> transferEvents(StorageTask<R> task) {
        Objects.requireNonNull(task, "task");
        return Observable.merge(
                        observeStatus(task, TaskStatus.PROGRESS),
                        observeStatus(task, TaskStatus.SUCCESS),
                        observeStatus(task, TaskStatus.FAILURE))
                .takeUntil((TransferEvent<R> event) -> event.status().isTerminal());
    }

    /**
     * Starts a task on subscription and streams its {@link #transferEvents}.
     *
     * <p>The task is cancelled once the stream is over, after its observers have been removed.
     * Cancelling a finished task has no effect, so in practice this only stops transfers the
     * subscriber abandoned.
     */
    public static <R, T extends StorageTask<R>> Observable<TransferEvent<R>> transfer(Supplier<T> start) {
        Objects.requireNonNull(start, "start");
        return Observable.<TransferEvent<R>, T>using(start::get, task -> transferEvents(task), StorageTask::cancel, false);
    }
}
