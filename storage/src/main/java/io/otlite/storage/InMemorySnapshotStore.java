// file: src/main/java/io/otlite/storage/InMemorySnapshotStore.java
package io.otlite.storage;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshot store that lives and dies with the process. Used for tests and
 * for servers started without a snapshot directory.
 */
public final class InMemorySnapshotStore implements SnapshotStore {
    private final Map<String, DocumentSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void write(DocumentSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        snapshots.put(snapshot.documentId(), snapshot);
    }

    @Override
    public Optional<DocumentSnapshot> load(String documentId) {
        return Optional.ofNullable(snapshots.get(documentId));
    }

    /** Number of documents with a stored snapshot. */
    public int size() {
        return snapshots.size();
    }
}
