// file: src/main/java/io/otlite/server/coordinator/DocumentCoordinatorRegistry.java
package io.otlite.server.coordinator;

import io.otlite.core.Operation;
import io.otlite.core.SubmitResult;
import io.otlite.core.TransformEngine;
import io.otlite.core.UnknownDocumentException;
import io.otlite.storage.DocumentSnapshot;
import io.otlite.storage.SnapshotStore;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * documentId -> DocumentCoordinator, created once at startup and passed to
 * whoever needs it.
 * <p>
 * Lookup policy:
 *  - A live coordinator is used as-is.
 *  - Otherwise a persisted snapshot seeds a new coordinator.
 *  - Otherwise the document is created empty when {@code implicitCreate}
 *    is on, or the call fails with {@link UnknownDocumentException}.
 * <p>
 * Closing (explicitly or through idle eviction) persists a final snapshot
 * before the coordinator leaves the map, so a caller that races with the
 * close is retried against a coordinator seeded from that snapshot.
 */
public final class DocumentCoordinatorRegistry {
    private static final Logger log = Logger.getLogger(DocumentCoordinatorRegistry.class.getName());

    private final Map<String, DocumentCoordinator> coordinators = new ConcurrentHashMap<>();
    private final TransformEngine engine;
    private final SnapshotStore snapshots;
    private final BroadcastSink broadcast;
    private final CoordinatorOptions options;
    private final Clock clock;

    public DocumentCoordinatorRegistry(TransformEngine engine,
                                       SnapshotStore snapshots,
                                       BroadcastSink broadcast,
                                       CoordinatorOptions options) {
        this(engine, snapshots, broadcast, options, Clock.systemUTC());
    }

    public DocumentCoordinatorRegistry(TransformEngine engine,
                                       SnapshotStore snapshots,
                                       BroadcastSink broadcast,
                                       CoordinatorOptions options,
                                       Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.broadcast = Objects.requireNonNull(broadcast, "broadcast");
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CoordinatorOptions options() {
        return options;
    }

    // ---------- operations ----------

    public SubmitResult submit(String documentId, Operation op, long baseVersion) {
        return withCoordinator(documentId, c -> c.submit(op, baseVersion));
    }

    public SubmitResult submit(String documentId, Operation op, long baseVersion, Duration timeout) {
        return withCoordinator(documentId, c -> c.submit(op, baseVersion, timeout));
    }

    /** Resync: current (content, version) of the document. */
    public DocumentSnapshot snapshot(String documentId) {
        return withCoordinator(documentId, DocumentCoordinator::snapshot);
    }

    public DocumentSnapshot reset(String documentId) {
        return withCoordinator(documentId, DocumentCoordinator::reset);
    }

    /**
     * Explicitly create a document. If it already exists (live or
     * persisted) its current snapshot is returned and {@code initialContent}
     * is ignored.
     */
    public DocumentSnapshot open(String documentId, String initialContent) {
        requireId(documentId);
        String content = initialContent == null ? "" : initialContent;
        while (true) {
            DocumentCoordinator c = coordinators.computeIfAbsent(documentId, id -> {
                Optional<DocumentSnapshot> stored = snapshots.load(id);
                if (stored.isPresent()) {
                    return newCoordinator(stored.get());
                }
                DocumentSnapshot seed = new DocumentSnapshot(id, content, 0L);
                snapshots.write(seed);
                log.info(() -> "doc=" + id + " opened");
                return newCoordinator(seed);
            });
            try {
                return c.snapshot();
            } catch (CoordinatorClosedException e) {
                coordinators.remove(documentId, c);
            }
        }
    }

    /**
     * Persist and evict a live document.
     *
     * @return true if a live coordinator was closed, false if none was loaded
     */
    public boolean close(String documentId) {
        requireId(documentId);
        DocumentCoordinator c = coordinators.get(documentId);
        if (c == null) {
            return false;
        }
        c.close();
        coordinators.remove(documentId, c);
        return true;
    }

    /**
     * Persist and drop every coordinator untouched for longer than {@code idle}.
     *
     * @return number of documents evicted
     */
    public int evictIdle(Duration idle) {
        Objects.requireNonNull(idle, "idle");
        int evicted = 0;
        for (DocumentCoordinator c : coordinators.values()) {
            try {
                if (c.closeIfIdle(idle)) {
                    coordinators.remove(c.documentId(), c);
                    evicted++;
                }
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "doc=" + c.documentId() + " eviction failed", e);
            }
        }
        if (evicted > 0) {
            int n = evicted;
            log.info(() -> "evicted " + n + " idle document(s); " + coordinators.size() + " live");
        }
        return evicted;
    }

    /** Persist and drop everything, e.g. on shutdown. */
    public void closeAll() {
        for (DocumentCoordinator c : coordinators.values()) {
            try {
                c.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "doc=" + c.documentId() + " final snapshot failed", e);
            }
            coordinators.remove(c.documentId(), c);
        }
    }

    /** Ids of live documents, sorted. */
    public Set<String> documentIds() {
        return new TreeSet<>(coordinators.keySet());
    }

    public int size() {
        return coordinators.size();
    }

    // ---------- internals ----------

    private <T> T withCoordinator(String documentId, Function<DocumentCoordinator, T> call) {
        requireId(documentId);
        while (true) {
            DocumentCoordinator c = resolve(documentId);
            try {
                return call.apply(c);
            } catch (CoordinatorClosedException e) {
                // Closed between lookup and call; its snapshot is persisted.
                coordinators.remove(documentId, c);
            }
        }
    }

    private DocumentCoordinator resolve(String documentId) {
        DocumentCoordinator live = coordinators.get(documentId);
        if (live != null) {
            return live;
        }
        return coordinators.computeIfAbsent(documentId, id -> {
            Optional<DocumentSnapshot> stored = snapshots.load(id);
            if (stored.isPresent()) {
                log.fine(() -> "doc=" + id + " loaded at v" + stored.get().version());
                return newCoordinator(stored.get());
            }
            if (!options.implicitCreate()) {
                throw new UnknownDocumentException(id);
            }
            log.fine(() -> "doc=" + id + " created implicitly");
            return newCoordinator(DocumentSnapshot.empty(id));
        });
    }

    private DocumentCoordinator newCoordinator(DocumentSnapshot seed) {
        return new DocumentCoordinator(seed, engine, snapshots, broadcast, options, clock);
    }

    private static void requireId(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId must not be empty");
        }
    }
}
