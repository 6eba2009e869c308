package io.rxbackend.reactor;

import io.rxbackend.core.AdapterOptions;
import io.rxbackend.core.TransferEvent;
import io.rxbackend.testing.FakeStorageReference;
import io.rxbackend.testing.FakeUploadTask;
import io.rxbackend.vendor.BackendException;
import io.rxbackend.vendor.storage.StorageMetadata;
import io.rxbackend.vendor.storage.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ReactorStorageTest {

    private static final byte[] PAYLOAD = "hello".getBytes(StandardCharsets.UTF_8);
    private static final StorageMetadata STORED = StorageMetadata.ofContentType("text/plain");

    private FakeStorageReference ref;
    private ReactorStorage storage;

    @BeforeEach
    void setUp() {
        ref = new FakeStorageReference("notes/a.txt");
        storage = new ReactorStorage(AdapterOptions.defaults());
    }

    @Test
    void uploadProgressThenSuccess() {
        StepVerifier.create(storage.putDataWithProgress(ref, PAYLOAD, null))
                .then(() -> {
                    FakeUploadTask task = ref.lastUpload();
                    task.progress(2, 5);
                    task.progress(4, 5);
                    task.succeed(STORED);
                })
                .expectNextMatches(e -> e.status() == TaskStatus.PROGRESS)
                .expectNextMatches(e -> e.status() == TaskStatus.PROGRESS)
                .expectNextMatches(e -> e.status() == TaskStatus.SUCCESS && STORED.equals(e.result()))
                .verifyComplete();
    }

    @Test
    void cancellingUploadCancelsTask() {
        StepVerifier.create(storage.putDataWithProgress(ref, PAYLOAD, null))
                .then(() -> ref.lastUpload().progress(1, 5))
                .expectNextMatches(e -> e.fraction() == 0.2)
                .thenCancel()
                .verify();

        assertThat(ref.lastUpload().cancels()).isEqualTo(1);
    }

    @Test
    void deleteFailureIsRelayed() {
        BackendException.StorageException error = new BackendException.StorageException("object-not-found", "missing");

        StepVerifier.create(storage.delete(ref))
                .then(() -> ref.deletes().fail(error))
                .expectErrorMatches(e -> e == error)
                .verify();
    }

    @Test
    void getBytesEmitsData() {
        StepVerifier.<byte[]>create(storage.getBytes(ref, 10))
                .then(() -> ref.<byte[]>lastDownload().succeed(PAYLOAD))
                .expectNext(PAYLOAD)
                .verifyComplete();
    }

    @Test
    void transferEventsOfExistingTask() {
        FakeUploadTask task = (FakeUploadTask) ref.putData(PAYLOAD, null, (r, e) -> { });

        StepVerifier.<TransferEvent<StorageMetadata>>create(storage.transferEvents(task))
                .then(() -> task.succeed(STORED))
                .expectNextCount(1)
                .verifyComplete();
    }
}
