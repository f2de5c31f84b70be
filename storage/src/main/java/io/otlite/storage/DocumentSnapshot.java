// file: src/main/java/io/otlite/storage/DocumentSnapshot.java
package io.otlite.storage;

import java.util.Objects;

/**
 * Immutable point-in-time copy of a document: what resync hands to clients
 * and what the snapshot store persists.
 */
public record DocumentSnapshot(String documentId, String content, long version) {
    public DocumentSnapshot {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(content, "content");
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0, got " + version);
        }
    }

    /** Version-zero snapshot of a new document. */
    public static DocumentSnapshot empty(String documentId) {
        return new DocumentSnapshot(documentId, "", 0L);
    }
}
