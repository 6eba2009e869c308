package io.rxbackend.reactor;

import io.rxbackend.core.AdapterOptions;
import io.rxbackend.rxjava3.RxDatabase;
import io.rxbackend.rxjava3.SnapshotWithSiblingKey;
import io.rxbackend.rxjava3.TransactionOutcome;
import io.rxbackend.vendor.database.DataEventType;
import io.rxbackend.vendor.database.DataSnapshot;
import io.rxbackend.vendor.database.DatabaseQuery;
import io.rxbackend.vendor.database.DatabaseReference;
import io.rxbackend.vendor.database.TransactionHandler;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;

/**
 * Reactor adapter over {@link RxDatabase}.
 */
public final class ReactorDatabase {

    private final AdapterOptions options;

    public ReactorDatabase() {
        this(AdapterOptions.load());
    }

    public ReactorDatabase(AdapterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public AdapterOptions options() {
        return options;
    }

    public Flux<DataSnapshot> observe(DatabaseQuery query, DataEventType eventType) {
        return Conversions.flux(RxDatabase.observe(query, eventType), options);
    }

    public Flux<SnapshotWithSiblingKey> observeWithSiblingKey(DatabaseQuery query, DataEventType eventType) {
        return Conversions.flux(RxDatabase.observeWithSiblingKey(query, eventType), options);
    }

    public Mono<DataSnapshot> observeSingleEvent(DatabaseQuery query, DataEventType eventType) {
        return Conversions.mono(RxDatabase.observeSingleEvent(query, eventType));
    }

    public Mono<SnapshotWithSiblingKey> observeSingleEventWithSiblingKey(DatabaseQuery query, DataEventType eventType) {
        return Conversions.mono(RxDatabase.observeSingleEventWithSiblingKey(query, eventType));
    }

    public Mono<DatabaseReference> setValue(DatabaseReference ref, Object value) {
        return Conversions.mono(RxDatabase.setValue(ref, value));
    }

    public Mono<DatabaseReference> setValue(DatabaseReference ref, Object value, Object priority) {
        return Conversions.mono(RxDatabase.setValue(ref, value, priority));
    }

    public Mono<DatabaseReference> updateChildValues(DatabaseReference ref, Map<String, Object> values) {
        return Conversions.mono(RxDatabase.updateChildValues(ref, values));
    }

    public Mono<DatabaseReference> removeValue(DatabaseReference ref) {
        return Conversions.mono(RxDatabase.removeValue(ref));
    }

    public Mono<DatabaseReference> setPriority(DatabaseReference ref, Object priority) {
        return Conversions.mono(RxDatabase.setPriority(ref, priority));
    }

    public Mono<TransactionOutcome> runTransaction(DatabaseReference ref, TransactionHandler handler) {
        return Conversions.mono(RxDatabase.runTransaction(ref, handler));
    }

    public Mono<DatabaseReference> onDisconnectSetValue(DatabaseReference ref, Object value, Object priority) {
        return Conversions.mono(RxDatabase.onDisconnectSetValue(ref, value, priority));
    }

    public Mono<DatabaseReference> onDisconnectUpdateChildValues(DatabaseReference ref, Map<String, Object> values) {
        return Conversions.mono(RxDatabase.onDisconnectUpdateChildValues(ref, values));
    }

    public Mono<DatabaseReference> onDisconnectRemoveValue(DatabaseReference ref) {
        return Conversions.mono(RxDatabase.onDisconnectRemoveValue(ref));
    }

    public Mono<DatabaseReference> cancelDisconnectOperations(DatabaseReference ref) {
        return Conversions.mono(RxDatabase.cancelDisconnectOperations(ref));
    }
}
