// file: src/main/java/io/otlite/core/TieBreakOrder.java
package io.otlite.core;

import java.util.Comparator;

/**
 * The single conflict-resolution order used by every transform rule:
 * {@code (logicalTime asc, authorId asc, operationId asc)}.
 * <p>
 * The operation that sorts lower is treated as "earlier" when two edits
 * target the same point. The trailing operationId key makes the order
 * strict even when one author reuses a logical time, so both replicas
 * always reach the same decision.
 * <p>
 * Wall-clock time is never consulted: clock skew between clients would
 * break convergence.
 */
public final class TieBreakOrder implements Comparator<Operation> {

    public static final TieBreakOrder INSTANCE = new TieBreakOrder();

    private TieBreakOrder() {
    }

    @Override
    public int compare(Operation a, Operation b) {
        int c = Long.compare(a.logicalTime(), b.logicalTime());
        if (c != 0) return c;
        c = a.authorId().compareTo(b.authorId());
        if (c != 0) return c;
        return a.operationId().compareTo(b.operationId());
    }

    /** True if {@code a} wins a tie against {@code b}. */
    public boolean precedes(Operation a, Operation b) {
        return compare(a, b) < 0;
    }
}
