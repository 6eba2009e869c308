package io.rxbackend.rxjava3;

import io.reactivex.rxjava3.core.ObservableTransformer;
import io.rxbackend.vendor.database.DataSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Operators over streams of snapshots, for use with {@code compose}.
 *
 * <pre>{@code
 * RxDatabase.observe(ref, DataEventType.VALUE)
 *         .compose(Snapshots.filterNotNull())
 *         .compose(Snapshots.children())
 * }</pre>
 */
public final class Snapshots {

    private Snapshots() {}

    /**
     * Keeps snapshots of locations without data.
     */
    public static <S extends DataSnapshot> ObservableTransformer<S, S> filterNull() {
        return upstream -> upstream.filter(snapshot -> snapshot.value() == null);
    }

    /**
     * Keeps snapshots of locations holding data.
     */
    public static <S extends DataSnapshot> ObservableTransformer<S, S> filterNotNull() {
        return upstream -> upstream.filter(snapshot -> snapshot.value() != null);
    }

    /**
     * Replaces each snapshot by its direct children, one element per child.
     */
    public static <S extends DataSnapshot> ObservableTransformer<S, DataSnapshot> children() {
        return upstream -> upstream.concatMapIterable(DataSnapshot::children);
    }

    /**
     * Replaces each snapshot by a single list of its direct children.
     */
    public static <S extends DataSnapshot> ObservableTransformer<S, List<DataSnapshot>> childrenAsList() {
        return upstream -> upstream.map(snapshot -> {
            List<DataSnapshot> children = new ArrayList<>();
            snapshot.children().forEach(children::add);
            return children;
        });
    }
}
