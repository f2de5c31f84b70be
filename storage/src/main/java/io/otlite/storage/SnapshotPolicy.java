// file: src/main/java/io/otlite/storage/SnapshotPolicy.java
package io.otlite.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that triggers a full snapshot after every N applied operations.
 * <p>
 * One instance per document. Simple but effective:
 *  - Bounds how much work is lost when a process dies between snapshots.
 *  - Does not consider content size or time.
 */
public final class SnapshotPolicy {
    public static final int DEFAULT_EVERY_OPS = 100;

    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /**
     * Call after each applied operation. Writes {@code current} when the
     * threshold is hit.
     *
     * @return true if a snapshot was written
     */
    public boolean maybeSnapshot(DocumentSnapshot current, SnapshotStore store) {
        if (sinceLast.incrementAndGet() >= everyOps) {
            store.write(current);
            sinceLast.set(0);
            return true;
        }
        return false;
    }

    /** Restart the count, e.g. after an out-of-band snapshot on close or reset. */
    public void reset() {
        sinceLast.set(0);
    }

    public int everyOps() {
        return everyOps;
    }
}
