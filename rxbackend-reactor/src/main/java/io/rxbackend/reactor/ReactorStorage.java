package io.rxbackend.reactor;

import io.rxbackend.core.AdapterOptions;
import io.rxbackend.core.TransferEvent;
import io.rxbackend.rxjava3.RxStorage;
import io.rxbackend.vendor.storage.StorageMetadata;
import io.rxbackend.vendor.storage.StorageReference;
import io.rxbackend.vendor.storage.StorageTask;
import io.rxbackend.vendor.storage.TaskStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reactor adapter over {@link RxStorage}.
 */
public final class ReactorStorage {

    private final AdapterOptions options;

    public ReactorStorage() {
        this(AdapterOptions.load());
    }

    public ReactorStorage(AdapterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public AdapterOptions options() {
        return options;
    }

    public Mono<StorageMetadata> putData(StorageReference ref, byte[] data, StorageMetadata metadata) {
        return Conversions.mono(RxStorage.putData(ref, data, metadata));
    }

    public Flux<TransferEvent<StorageMetadata>> putDataWithProgress(StorageReference ref, byte[] data, StorageMetadata metadata) {
        return Conversions.flux(RxStorage.putDataWithProgress(ref, data, metadata), options);
    }

    public Mono<StorageMetadata> putFile(StorageReference ref, Path file, StorageMetadata metadata) {
        return Conversions.mono(RxStorage.putFile(ref, file, metadata));
    }

    public Flux<TransferEvent<StorageMetadata>> putFileWithProgress(StorageReference ref, Path file, StorageMetadata metadata) {
        return Conversions.flux(RxStorage.putFileWithProgress(ref, file, metadata), options);
    }

    public Mono<byte[]> getBytes(StorageReference ref, long maxSize) {
        return Conversions.mono(RxStorage.getBytes(ref, maxSize));
    }

    public Flux<TransferEvent<byte[]>> getBytesWithProgress(StorageReference ref, long maxSize) {
        return Conversions.flux(RxStorage.getBytesWithProgress(ref, maxSize), options);
    }

    public Mono<Path> writeToFile(StorageReference ref, Path destination) {
        return Conversions.mono(RxStorage.writeToFile(ref, destination));
    }

    public Flux<TransferEvent<Path>> writeToFileWithProgress(StorageReference ref, Path destination) {
        return Conversions.flux(RxStorage.writeToFileWithProgress(ref, destination), options);
    }

    public <R> Flux<TransferEvent<R>> observeStatus(StorageTask<R> task, TaskStatus status) {
        return Conversions.flux(RxStorage.observeStatus(task, status), options);
    }

    public <R> Flux<TransferEvent<R>> transferEvents(StorageTask<R> task) {
        return Conversions.flux(RxStorage.transferEvents(task), options);
    }

    public Mono<URI> downloadUrl(StorageReference ref) {
        return Conversions.mono(RxStorage.downloadUrl(ref));
    }

    public Mono<Void> delete(StorageReference ref) {
        return Conversions.mono(RxStorage.delete(ref));
    }

    public Mono<StorageMetadata> metadata(StorageReference ref) {
        return Conversions.mono(RxStorage.metadata(ref));
    }

    public Mono<StorageMetadata> updateMetadata(StorageReference ref, StorageMetadata metadata) {
        return Conversions.mono(RxStorage.updateMetadata(ref, metadata));
    }
}
