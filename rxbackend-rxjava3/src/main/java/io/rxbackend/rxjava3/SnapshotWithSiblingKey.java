package io.rxbackend.rxjava3;

import io.rxbackend.vendor.database.DataSnapshot;

import java.util.Objects;
import java.util.Optional;

/**
 * A data event together with the key of the child preceding it in query order.
 *
 * @param snapshot changed data
 * @param previousSiblingKey preceding child's key, empty for the first child
 */
public record SnapshotWithSiblingKey(DataSnapshot snapshot, Optional<String> previousSiblingKey) {

    public SnapshotWithSiblingKey {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(previousSiblingKey, "previousSiblingKey");
    }

    static SnapshotWithSiblingKey of(DataSnapshot snapshot, String previousSiblingKey) {
        return new SnapshotWithSiblingKey(snapshot, Optional.ofNullable(previousSiblingKey));
    }
}
