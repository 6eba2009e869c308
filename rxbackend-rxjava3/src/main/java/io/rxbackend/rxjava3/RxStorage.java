package io.rxbackend.rxjava3;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import io.rxbackend.core.CallbackObservables;
import io.rxbackend.core.CallbackOperation;
import io.rxbackend.core.StorageTaskObservables;
import io.rxbackend.core.TransferEvent;
import io.rxbackend.vendor.ResultCallback;
import io.rxbackend.vendor.storage.DownloadTask;
import io.rxbackend.vendor.storage.StorageMetadata;
import io.rxbackend.vendor.storage.StorageReference;
import io.rxbackend.vendor.storage.StorageTask;
import io.rxbackend.vendor.storage.TaskStatus;
import io.rxbackend.vendor.storage.UploadTask;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Storage transfers and object operations as RxJava streams.
 *
 * <p>Transfers come in two forms. The plain form ({@link #putData}, {@link #getBytes}, ...) emits the
 * result once the transfer finished. The {@code WithProgress} form emits a {@link TransferEvent} per
 * progress report and ends with the success event. In both forms the transfer starts on subscription
 * and disposing an unfinished transfer cancels it.
 */
public final class RxStorage {

    private static final ResultCallback<Object> IGNORE = (result, error) -> { };

    private RxStorage() {}

    /**
     * Uploads an in-memory payload. {@code metadata} may be {@code null}.
     */
    public static Single<StorageMetadata> putData(StorageReference ref, byte[] data, StorageMetadata metadata) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(data, "data");
        return CallbackObservables.singleResult(callback -> {
            UploadTask task = ref.putData(data, metadata, callback);
            return task::cancel;
        });
    }

    public static Observable<TransferEvent<StorageMetadata>> putDataWithProgress(StorageReference ref, byte[] data, StorageMetadata metadata) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(data, "data");
        return StorageTaskObservables.transfer(() -> ref.putData(data, metadata, ignore()));
    }

    public static Single<StorageMetadata> putFile(StorageReference ref, Path file, StorageMetadata metadata) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(file, "file");
        return CallbackObservables.singleResult(callback -> {
            UploadTask task = ref.putFile(file, metadata, callback);
            return task::cancel;
        });
    }

    public static Observable<TransferEvent<StorageMetadata>> putFileWithProgress(StorageReference ref, Path file, StorageMetadata metadata) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(file, "file");
        return StorageTaskObservables.transfer(() -> ref.putFile(file, metadata, ignore()));
    }

    /**
     * Downloads the object into memory; fails if it is larger than {@code maxSize} bytes.
     */
    public static Single<byte[]> getBytes(StorageReference ref, long maxSize) {
        Objects.requireNonNull(ref, "ref");
        return CallbackObservables.singleResult(callback -> {
            DownloadTask<byte[]> task = ref.getBytes(maxSize, callback);
            return task::cancel;
        });
    }

    /**
     * Downloads into memory reporting progress; the success event carries the bytes.
     */
    public static Observable<TransferEvent<byte[]>> getBytesWithProgress(StorageReference ref, long maxSize) {
        Objects.requireNonNull(ref, "ref");
        return StorageTaskObservables.transfer(() -> ref.getBytes(maxSize, ignore()));
    }

    /**
     * Downloads to a local file and emits its path.
     */
    public static Single<Path> writeToFile(StorageReference ref, Path destination) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(destination, "destination");
        return CallbackObservables.singleResult(callback -> {
            DownloadTask<Path> task = ref.writeToFile(destination, callback);
            return task::cancel;
        });
    }

    public static Observable<TransferEvent<Path>> writeToFileWithProgress(StorageReference ref, Path destination) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(destination, "destination");
        return StorageTaskObservables.transfer(() -> ref.writeToFile(destination, ignore()));
    }

    /**
     * Reports of one status of a task the caller already started.
     */
    public static <R> Observable<TransferEvent<R>> observeStatus(StorageTask<R> task, TaskStatus status) {
        return StorageTaskObservables.observeStatus(task, status);
    }

    /**
     * Progress and outcome of a task the caller already started. Disposing does not cancel the task.
     */
    public static <R> Observable<TransferEvent<R>> transferEvents(StorageTask<R> task) {
        return StorageTaskObservables.transferEvents(task);
    }

    /**
     * Long-lived download URL, revocable from the console.
     */
    public static Single<URI> downloadUrl(StorageReference ref) {
        Objects.requireNonNull(ref, "ref");
        return CallbackObservables.singleResult(CallbackOperation.of(ref::downloadUrl));
    }

    public static Completable delete(StorageReference ref) {
        Objects.requireNonNull(ref, "ref");
        return CallbackObservables.completion(CallbackOperation.<Void>of(ref::delete));
    }

    public static Single<StorageMetadata> metadata(StorageReference ref) {
        Objects.requireNonNull(ref, "ref");
        return CallbackObservables.singleResult(CallbackOperation.of(ref::metadata));
    }

    /**
     * Updates the object's metadata and emits the stored result.
     */
    public static Single<StorageMetadata> updateMetadata(StorageReference ref, StorageMetadata metadata) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(metadata, "metadata");
        return CallbackObservables.singleResult(CallbackOperation.of(callback -> ref.updateMetadata(metadata, callback)));
    }

    @SuppressWarnings("unchecked")
    private static <T> ResultCallback<T> ignore() {
        return (ResultCallback<T>) IGNORE;
    }
}
