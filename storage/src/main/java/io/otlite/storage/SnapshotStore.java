// file: src/main/java/io/otlite/storage/SnapshotStore.java
package io.otlite.storage;

import java.util.Optional;

/**
 * Persistence collaborator for document snapshots.
 * <p>
 * A snapshot is the full (content, version) of one document. The engine
 * keeps no write-ahead log: a restarted document resumes from its last
 * snapshot, and clients whose base version predates it resync.
 */
public interface SnapshotStore {

    /** Persist {@code snapshot}, replacing any earlier one for the same document. */
    void write(DocumentSnapshot snapshot);

    /** Latest persisted snapshot for {@code documentId}, if any. */
    Optional<DocumentSnapshot> load(String documentId);
}
