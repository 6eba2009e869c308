package io.rxbackend.rxjava3;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.functions.Cancellable;
import io.rxbackend.core.CallbackObservables;
import io.rxbackend.core.CallbackOperation;
import io.rxbackend.vendor.ListenerHandle;
import io.rxbackend.vendor.ResultCallback;
import io.rxbackend.vendor.database.DataEventType;
import io.rxbackend.vendor.database.DataSnapshot;
import io.rxbackend.vendor.database.DatabaseQuery;
import io.rxbackend.vendor.database.DatabaseReference;
import io.rxbackend.vendor.database.TransactionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Database reads and writes as RxJava streams.
 *
 * <p>Writes succeed with the reference that was written. Writes are not cancellable once dispatched:
 * disposing only stops the result from being delivered.
 */
public final class RxDatabase {

    private static final Logger logger = LoggerFactory.getLogger(RxDatabase.class);

    private RxDatabase() {}

    /**
     * Listens for {@code eventType} at the query's location: the initial data, then every change.
     * Disposing removes the listener.
     */
    public static Observable<DataSnapshot> observe(DatabaseQuery query, DataEventType eventType) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(eventType, "eventType");
        return CallbackObservables.<DataSnapshot>listener(handler -> {
            ListenerHandle handle = query.observe(eventType, snapshot -> handler.accept(snapshot));
            return registered(query, eventType, handle);
        });
    }

    /**
     * Like {@link #observe}, also reporting the previous sibling's key for child events.
     */
    public static Observable<SnapshotWithSiblingKey> observeWithSiblingKey(DatabaseQuery query, DataEventType eventType) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(eventType, "eventType");
        return CallbackObservables.<SnapshotWithSiblingKey>listener(handler -> {
            ListenerHandle handle = query.observe(eventType,
                    (snapshot, siblingKey) -> handler.accept(SnapshotWithSiblingKey.of(snapshot, siblingKey)));
            return registered(query, eventType, handle);
        });
    }

    /**
     * Emits the first {@code eventType} event then completes.
     */
    public static Single<DataSnapshot> observeSingleEvent(DatabaseQuery query, DataEventType eventType) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(eventType, "eventType");
        return CallbackObservables.<DataSnapshot>once(handler -> query.observeSingleEvent(eventType, snapshot -> handler.accept(snapshot)))
                .singleOrError();
    }

    public static Single<SnapshotWithSiblingKey> observeSingleEventWithSiblingKey(DatabaseQuery query, DataEventType eventType) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(eventType, "eventType");
        return CallbackObservables.<SnapshotWithSiblingKey>once(handler -> query.observeSingleEvent(eventType,
                        (snapshot, siblingKey) -> handler.accept(SnapshotWithSiblingKey.of(snapshot, siblingKey))))
                .singleOrError();
    }

    /**
     * Overwrites the location; a {@code null} value removes it.
     */
    public static Single<DatabaseReference> setValue(DatabaseReference ref, Object value) {
        return setValue(ref, value, null);
    }

    public static Single<DatabaseReference> setValue(DatabaseReference ref, Object value, Object priority) {
        Objects.requireNonNull(ref, "ref");
        return write(callback -> ref.setValue(value, priority, callback));
    }

    /**
     * Changes the given children without touching the others.
     */
    public static Single<DatabaseReference> updateChildValues(DatabaseReference ref, Map<String, Object> values) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(values, "values");
        return write(callback -> ref.updateChildValues(values, callback));
    }

    public static Single<DatabaseReference> removeValue(DatabaseReference ref) {
        Objects.requireNonNull(ref, "ref");
        return write(ref::removeValue);
    }

    public static Single<DatabaseReference> setPriority(DatabaseReference ref, Object priority) {
        Objects.requireNonNull(ref, "ref");
        return write(callback -> ref.setPriority(priority, callback));
    }

    /**
     * Runs an optimistic transaction. {@code handler} may be called more than once by the SDK.
     */
    public static Single<TransactionOutcome> runTransaction(DatabaseReference ref, TransactionHandler handler) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(handler, "handler");
        return CallbackObservables.singleResult(CallbackOperation.<TransactionOutcome>of(callback ->
                ref.runTransaction(handler, (error, committed, snapshot) ->
                        callback.onComplete(new TransactionOutcome(committed, Optional.ofNullable(snapshot)), error))));
    }

    /**
     * Schedules a write the server performs when this client disconnects.
     */
    public static Single<DatabaseReference> onDisconnectSetValue(DatabaseReference ref, Object value) {
        return onDisconnectSetValue(ref, value, null);
    }

    public static Single<DatabaseReference> onDisconnectSetValue(DatabaseReference ref, Object value, Object priority) {
        Objects.requireNonNull(ref, "ref");
        return write(callback -> ref.onDisconnectSetValue(value, priority, callback));
    }

    public static Single<DatabaseReference> onDisconnectUpdateChildValues(DatabaseReference ref, Map<String, Object> values) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(values, "values");
        return write(callback -> ref.onDisconnectUpdateChildValues(values, callback));
    }

    public static Single<DatabaseReference> onDisconnectRemoveValue(DatabaseReference ref) {
        Objects.requireNonNull(ref, "ref");
        return write(ref::onDisconnectRemoveValue);
    }

    /**
     * Drops every disconnect operation scheduled at this location.
     */
    public static Single<DatabaseReference> cancelDisconnectOperations(DatabaseReference ref) {
        Objects.requireNonNull(ref, "ref");
        return write(ref::cancelDisconnectOperations);
    }

    private static Cancellable registered(DatabaseQuery query, DataEventType eventType, ListenerHandle handle) {
        logger.debug("Registered {} listener on {}", eventType, query);
        return () -> {
            query.removeObserver(handle);
            logger.debug("Removed {} listener from {}", eventType, query);
        };
    }

    private static Single<DatabaseReference> write(Consumer<ResultCallback<DatabaseReference>> call) {
        return CallbackObservables.singleResult(CallbackOperation.of(call));
    }
}
