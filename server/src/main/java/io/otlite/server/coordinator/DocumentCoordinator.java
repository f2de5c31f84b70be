// file: src/main/java/io/otlite/server/coordinator/DocumentCoordinator.java
package io.otlite.server.coordinator;

import io.otlite.core.InternalInvariantViolationException;
import io.otlite.core.Operation;
import io.otlite.core.SubmitResult;
import io.otlite.core.TransformEngine;
import io.otlite.storage.DocumentSnapshot;
import io.otlite.storage.DocumentState;
import io.otlite.storage.SnapshotPolicy;
import io.otlite.storage.SnapshotStore;
import io.otlite.storage.TtlOpIdDeduper;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serializes every mutation of one document.
 * <p>
 * Submit flow (under the document lock):
 *  1) A known operationId returns its recorded result; nothing is reapplied.
 *  2) The base version is checked against the head and the history floor.
 *  3) The operation is validated against the content length at its base.
 *  4) It is rebased across history (baseVersion, version] and applied.
 *  5) The result is handed to the broadcast sink and the snapshot policy.
 * <p>
 * Steps 1-4 either complete or leave the state untouched. A rebased
 * operation that does not fit the head poisons the document until
 * {@link #reset()}. Failures in step 5 are logged only.
 */
public final class DocumentCoordinator {
    private static final Logger log = Logger.getLogger(DocumentCoordinator.class.getName());

    private final String documentId;
    private final TransformEngine engine;
    private final SnapshotStore snapshots;
    private final BroadcastSink broadcast;
    private final CoordinatorOptions options;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock.
    private DocumentState state;
    private SnapshotPolicy snapshotPolicy;
    private boolean closed;

    private volatile long lastTouchedMillis;

    public DocumentCoordinator(DocumentSnapshot seed,
                               TransformEngine engine,
                               SnapshotStore snapshots,
                               BroadcastSink broadcast,
                               CoordinatorOptions options,
                               Clock clock) {
        Objects.requireNonNull(seed, "seed");
        this.documentId = seed.documentId();
        this.engine = Objects.requireNonNull(engine, "engine");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.broadcast = Objects.requireNonNull(broadcast, "broadcast");
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.state = newState(seed);
        this.snapshotPolicy = new SnapshotPolicy(options.snapshotEvery());
        this.lastTouchedMillis = clock.millis();
    }

    public String documentId() {
        return documentId;
    }

    // ---------- submit ----------

    /** Submit, waiting for the document lock as long as it takes. */
    public SubmitResult submit(Operation op, long baseVersion) {
        Objects.requireNonNull(op, "op");
        lock.lock();
        try {
            return submitLocked(op, baseVersion);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Submit, giving up with {@link SubmitTimeoutException} if the document
     * lock is not free within {@code timeout}. A timed-out call has no effect.
     */
    public SubmitResult submit(Operation op, long baseVersion, Duration timeout) {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(timeout, "timeout");
        try {
            if (!lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new SubmitTimeoutException(documentId, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SubmitTimeoutException(documentId, e);
        }
        try {
            return submitLocked(op, baseVersion);
        } finally {
            lock.unlock();
        }
    }

    private SubmitResult submitLocked(Operation op, long baseVersion) {
        ensureOpen();
        touch();

        Optional<SubmitResult> prior = state.lookupApplied(op.operationId());
        if (prior.isPresent()) {
            log.fine(() -> "doc=" + documentId + " replay of " + op.operationId() + " -> v" + prior.get().version());
            return prior.get();
        }

        if (state.isPoisoned()) {
            throw new InternalInvariantViolationException(
                    "document " + documentId + " is poisoned (" + state.poisonCause() + "); reset required");
        }

        op.validateAgainst(state.lengthAt(baseVersion));
        List<Operation> concurrent = state.operationsSince(baseVersion);

        SubmitResult result;
        try {
            Operation rebased = engine.rebase(op, concurrent);
            result = state.apply(rebased);
        } catch (InternalInvariantViolationException e) {
            if (!state.isPoisoned()) {
                state.poison(e.getMessage());
            }
            log.log(Level.SEVERE, "doc=" + documentId + " poisoned while applying " + op
                    + " at base " + baseVersion, e);
            throw e;
        }

        publish(result);
        maybeSnapshot();
        return result;
    }

    private void publish(SubmitResult result) {
        try {
            broadcast.publish(documentId, result);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "doc=" + documentId + " broadcast of v" + result.version() + " failed", e);
        }
    }

    private void maybeSnapshot() {
        try {
            snapshotPolicy.maybeSnapshot(state.snapshot(), snapshots);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "doc=" + documentId + " snapshot at v" + state.version() + " failed", e);
        }
    }

    // ---------- resync / lifecycle ----------

    /** Current (content, version), bypassing transform. */
    public DocumentSnapshot snapshot() {
        lock.lock();
        try {
            ensureOpen();
            touch();
            return state.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace a poisoned state with the last persisted snapshot, or an empty
     * document if none exists. A healthy document is left as it is.
     */
    public DocumentSnapshot reset() {
        lock.lock();
        try {
            ensureOpen();
            touch();
            if (!state.isPoisoned()) {
                return state.snapshot();
            }
            DocumentSnapshot restored = snapshots.load(documentId).orElseGet(() -> DocumentSnapshot.empty(documentId));
            log.warning(String.format("doc=%s reset from poisoned v%d to persisted v%d (cause: %s)",
                    documentId, state.version(), restored.version(), state.poisonCause()));
            state = newState(restored);
            snapshotPolicy = new SnapshotPolicy(options.snapshotEvery());
            return restored;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Persist a final snapshot and refuse further use. A poisoned state is
     * not persisted. Idempotent.
     */
    public DocumentSnapshot close() {
        lock.lock();
        try {
            return closeLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close only if nothing touched this document for longer than
     * {@code idle}; checked under the lock so a concurrent submit wins.
     *
     * @return true if this call closed the coordinator
     */
    boolean closeIfIdle(Duration idle) {
        lock.lock();
        try {
            if (closed || clock.millis() - lastTouchedMillis <= idle.toMillis()) {
                return false;
            }
            closeLocked();
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Approximate: read without the lock. */
    long lastTouchedMillis() {
        return lastTouchedMillis;
    }

    private DocumentSnapshot closeLocked() {
        DocumentSnapshot last = state.snapshot();
        if (closed) {
            return last;
        }
        closed = true;
        if (state.isPoisoned()) {
            log.warning("doc=" + documentId + " closed while poisoned; final snapshot skipped");
            return last;
        }
        snapshots.write(last);
        log.info(() -> "doc=" + documentId + " closed at v" + last.version());
        return last;
    }

    private DocumentState newState(DocumentSnapshot seed) {
        return new DocumentState(seed, options.historyWindow(), new TtlOpIdDeduper(options.dedupeTtl(), clock));
    }

    private void ensureOpen() {
        if (closed) {
            throw new CoordinatorClosedException(documentId);
        }
    }

    private void touch() {
        lastTouchedMillis = clock.millis();
    }
}
