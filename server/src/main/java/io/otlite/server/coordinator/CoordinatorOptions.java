// file: src/main/java/io/otlite/server/coordinator/CoordinatorOptions.java
package io.otlite.server.coordinator;

import io.otlite.storage.DocumentState;
import io.otlite.storage.SnapshotPolicy;
import io.otlite.storage.TtlOpIdDeduper;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-document tuning shared by every coordinator a registry creates.
 *
 *  - historyWindow:  applied operations kept for rebasing late submissions.
 *  - snapshotEvery:  applied operations between automatic snapshots.
 *  - dedupeTtl:      how long applied results are remembered for replays.
 *  - implicitCreate: create unknown documents on first use instead of
 *                    failing with UnknownDocumentException.
 */
public record CoordinatorOptions(
        int historyWindow,
        int snapshotEvery,
        Duration dedupeTtl,
        boolean implicitCreate
) {
    public CoordinatorOptions {
        if (historyWindow < 1 || historyWindow > DocumentState.MAX_HISTORY_WINDOW) {
            throw new IllegalArgumentException(
                    "historyWindow must be in [1, " + DocumentState.MAX_HISTORY_WINDOW + "], got " + historyWindow);
        }
        if (snapshotEvery < 1) {
            throw new IllegalArgumentException("snapshotEvery must be > 0, got " + snapshotEvery);
        }
        Objects.requireNonNull(dedupeTtl, "dedupeTtl");
        if (dedupeTtl.isNegative() || dedupeTtl.isZero()) {
            throw new IllegalArgumentException("dedupeTtl must be positive, got " + dedupeTtl);
        }
    }

    public static CoordinatorOptions defaults() {
        return new CoordinatorOptions(
                DocumentState.DEFAULT_HISTORY_WINDOW,
                SnapshotPolicy.DEFAULT_EVERY_OPS,
                TtlOpIdDeduper.DEFAULT_TTL,
                true
        );
    }

    public CoordinatorOptions withHistoryWindow(int window) {
        return new CoordinatorOptions(window, snapshotEvery, dedupeTtl, implicitCreate);
    }

    public CoordinatorOptions withImplicitCreate(boolean implicit) {
        return new CoordinatorOptions(historyWindow, snapshotEvery, dedupeTtl, implicit);
    }
}
