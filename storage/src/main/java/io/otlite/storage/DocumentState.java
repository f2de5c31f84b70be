// file: src/main/java/io/otlite/storage/DocumentState.java
package io.otlite.storage;

import io.otlite.core.InternalInvariantViolationException;
import io.otlite.core.InvalidOperationException;
import io.otlite.core.InvalidOperationException.Reason;
import io.otlite.core.Operation;
import io.otlite.core.StaleClientException;
import io.otlite.core.SubmitResult;
import io.otlite.core.TextUnits;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Authoritative state of one document.
 * <p>
 * Responsibilities:
 *  - Hold the materialized content and its version (+1 per applied operation).
 *  - Keep a bounded log of applied operations so late submissions can be
 *    rebased. The entry that produced version v stays available while
 *    {@code v > version - historyWindow}.
 *  - Remember applied results by operationId for idempotent replay.
 *  - Refuse mutation once poisoned by an internal invariant violation.
 * <p>
 * Not thread-safe: a state is owned by exactly one coordinator, which
 * serializes access to it.
 */
public final class DocumentState {
    public static final int DEFAULT_HISTORY_WINDOW = 256;
    public static final int MAX_HISTORY_WINDOW = 100_000;

    /** One applied operation plus the document length it was applied to. */
    private record HistoryEntry(long version, Operation operation, int lengthBefore) {}

    private final String documentId;
    private final int historyWindow;
    private final OpIdDeduper applied;
    private final Deque<HistoryEntry> history = new ArrayDeque<>();

    private String content;
    private int contentLength;
    private long version;

    private boolean poisoned;
    private String poisonCause;

    public DocumentState(DocumentSnapshot seed, int historyWindow, OpIdDeduper applied) {
        Objects.requireNonNull(seed, "seed");
        if (historyWindow < 1 || historyWindow > MAX_HISTORY_WINDOW) {
            throw new IllegalArgumentException(
                    "historyWindow must be in [1, " + MAX_HISTORY_WINDOW + "], got " + historyWindow);
        }
        this.documentId = seed.documentId();
        this.historyWindow = historyWindow;
        this.applied = Objects.requireNonNull(applied, "applied");
        this.content = seed.content();
        this.contentLength = TextUnits.length(seed.content());
        this.version = seed.version();
    }

    // ---------- reads ----------

    public String documentId() { return documentId; }

    public String content() { return content; }

    public int contentLength() { return contentLength; }

    public long version() { return version; }

    public int historyWindow() { return historyWindow; }

    public int historySize() { return history.size(); }

    /** Oldest base version that can still be rebased onto the head. */
    public long historyFloor() {
        return version - history.size();
    }

    public boolean isPoisoned() { return poisoned; }

    public String poisonCause() { return poisonCause; }

    public DocumentSnapshot snapshot() {
        return new DocumentSnapshot(documentId, content, version);
    }

    /**
     * Result previously recorded for {@code operationId}. The result cache is
     * consulted first, then the retained history: any replay whose base is
     * at or above {@link #historyFloor()} committed inside the history, so it
     * is found even after the cache has forgotten it or was rebuilt.
     */
    public Optional<SubmitResult> lookupApplied(String operationId) {
        Optional<SubmitResult> cached = applied.lookup(operationId);
        if (cached.isPresent()) {
            return cached;
        }
        for (Iterator<HistoryEntry> it = history.descendingIterator(); it.hasNext(); ) {
            HistoryEntry e = it.next();
            if (e.operation().operationId().equals(operationId)) {
                return Optional.of(new SubmitResult(e.operation(), e.version()));
            }
        }
        return Optional.empty();
    }

    /**
     * Check that {@code baseVersion} can be rebased onto the head.
     *
     * @throws InvalidOperationException NEGATIVE_VALUE or OUT_OF_BOUNDS (base from the future)
     * @throws StaleClientException      base is older than the retained history
     */
    public void checkBaseVersion(long baseVersion) {
        if (baseVersion < 0) {
            throw new InvalidOperationException(Reason.NEGATIVE_VALUE,
                    "baseVersion must be >= 0, got " + baseVersion);
        }
        if (baseVersion > version) {
            throw new InvalidOperationException(Reason.OUT_OF_BOUNDS, String.format(
                    "document %s: baseVersion %d is ahead of current version %d", documentId, baseVersion, version));
        }
        long floor = historyFloor();
        if (baseVersion < floor) {
            throw new StaleClientException(documentId, baseVersion, version, floor);
        }
    }

    /**
     * Length in code points of the content as it was at {@code baseVersion}.
     */
    public int lengthAt(long baseVersion) {
        checkBaseVersion(baseVersion);
        if (baseVersion == version) {
            return contentLength;
        }
        for (HistoryEntry e : history) {
            if (e.version() == baseVersion + 1) {
                return e.lengthBefore();
            }
        }
        throw new InternalInvariantViolationException(String.format(
                "document %s: no history entry for version %d (floor %d, head %d)",
                documentId, baseVersion + 1, historyFloor(), version));
    }

    /**
     * Operations applied after {@code baseVersion}, oldest first: the
     * history segment (baseVersion, version].
     */
    public List<Operation> operationsSince(long baseVersion) {
        checkBaseVersion(baseVersion);
        int count = (int) (version - baseVersion);
        List<Operation> out = new ArrayList<>(count);
        if (count == 0) {
            return out;
        }
        int skip = history.size() - count;
        for (HistoryEntry e : history) {
            if (skip-- > 0) continue;
            out.add(e.operation());
        }
        return out;
    }

    // ---------- writes ----------

    /**
     * Apply an operation that is already rebased onto the head.
     * <p>
     * A rebased operation that does not fit the current content means the
     * transform rules were violated: the state is poisoned and the failure
     * is reported as {@link InternalInvariantViolationException}.
     */
    public SubmitResult apply(Operation rebased) {
        Objects.requireNonNull(rebased, "rebased");
        ensureWritable();

        String next;
        try {
            next = rebased.applyTo(content);
        } catch (InvalidOperationException e) {
            poison("rebased operation does not fit head: " + e.getMessage());
            throw new InternalInvariantViolationException(String.format(
                    "document %s at version %d: rebased %s rejected", documentId, version, rebased), e);
        }

        int lengthBefore = contentLength;
        content = next;
        contentLength = lengthBefore + rebased.lengthDelta();
        version++;

        history.addLast(new HistoryEntry(version, rebased, lengthBefore));
        while (history.size() > historyWindow) {
            history.removeFirst();
        }

        SubmitResult result = new SubmitResult(rebased, version);
        applied.record(rebased.operationId(), result);
        return result;
    }

    /** Mark this state unusable until it is replaced by {@code reset}. */
    public void poison(String cause) {
        this.poisoned = true;
        this.poisonCause = cause;
    }

    private void ensureWritable() {
        if (poisoned) {
            throw new InternalInvariantViolationException(
                    "document " + documentId + " is poisoned (" + poisonCause + "); reset required");
        }
    }
}
