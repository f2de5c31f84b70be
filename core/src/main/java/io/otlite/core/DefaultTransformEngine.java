// file: src/main/java/io/otlite/core/DefaultTransformEngine.java
package io.otlite.core;

import java.util.Objects;

/**
 * Default transform rules for linear text.
 * <p>
 * Every kind is read as two parts: a span {@code [position, position + length)}
 * that it removes (DELETE, REPLACE) or merely covers (RETAIN), and a text
 * that it splices at {@code position} (INSERT, REPLACE). With {@code b}
 * already applied, {@code a'} is computed as:
 * <p>
 * 1) Span of a'. The characters of a's span that b did not already remove.
 *    They form at most two pieces, one left and one right of b's span.
 *    When b's text landed strictly inside a's span, a's span also covers
 *    that text: a delete absorbs text inserted inside it. That keeps the two
 *    pieces contiguous.
 * <p>
 * 2) Position of a'. Left of b: unchanged. Strictly inside b's span:
 *    collapses to the end of b's text. Right of b's span: shifted by b's
 *    net length change. Exactly at b's position with b carrying text:
 *    <ul>
 *      <li>insert vs insert: the earlier operation in {@link TieBreakOrder} goes first;</li>
 *      <li>pure insert vs replace: the insert goes first;</li>
 *      <li>replace/delete vs pure insert: the insert goes first (a shifts right);</li>
 *      <li>replace vs replace: the earlier replace goes first and absorbs the
 *          other's text; a delete without text goes after b's text.</li>
 *    </ul>
 * <p>
 * 3) Text of a'. Dropped when a's position falls strictly inside b's removed
 *    span, or when a loses a replace-vs-replace tie. This is the mirror image
 *    of the absorption in step 1, which is what makes both orders converge.
 * <p>
 * The result kind follows from what survives: span and text give REPLACE,
 * text only INSERT, span only DELETE, neither RETAIN. A RETAIN input stays
 * RETAIN. A RETAIN on the applied side changes nothing.
 */
public final class DefaultTransformEngine implements TransformEngine {

    private final TieBreakOrder order;

    public DefaultTransformEngine() {
        this(TieBreakOrder.INSTANCE);
    }

    public DefaultTransformEngine(TieBreakOrder order) {
        this.order = Objects.requireNonNull(order, "order");
    }

    @Override
    public Operation transform(Operation a, Operation b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (b.isNoOp()) {
            return a;
        }

        final int pa = a.position();
        final int la = a.length();
        final int ea = a.spanEnd();
        final int pb = b.position();
        final int lb = b.length();
        final int eb = b.spanEnd();
        final int nb = b.contentLength();

        final boolean aHasText = a.kind().carriesText();
        final boolean bHasText = nb > 0;
        final boolean aEarlier = order.precedes(a, b);

        // Does a's span swallow b's text?
        boolean absorbsB = bHasText && la > 0
                && ((pa < pb && pb < ea) || (pa == pb && lb > 0 && aHasText && aEarlier));

        // Is a's text swallowed by b's span?
        boolean aTextDropped = aHasText && lb > 0
                && ((pb < pa && pa < eb) || (pa == pb && la > 0 && bHasText && !aEarlier));

        // Pieces of a's span that b did not remove.
        int leftLen = pa < pb ? Math.min(ea, pb) - pa : 0;
        int rightStart = Math.max(pa, eb);
        int rightLen = Math.max(0, ea - rightStart);
        int newLength = leftLen + rightLen + (absorbsB ? nb : 0);

        int newPosition;
        if (pa < pb) {
            newPosition = pa;
        } else if (pa == pb) {
            newPosition = bHasText && !goesBeforeTextAtSamePoint(a, b, aEarlier) ? pb + nb : pb;
        } else if (pa < eb) {
            newPosition = pb + nb;
        } else {
            newPosition = pa - lb + nb;
        }

        boolean keepsText = aHasText && !aTextDropped;
        return switch (a.kind()) {
            case RETAIN -> a.reshape(OperationKind.RETAIN, newPosition, newLength, "");
            case INSERT, DELETE, REPLACE -> {
                if (keepsText && newLength > 0) {
                    yield a.reshape(OperationKind.REPLACE, newPosition, newLength, a.content());
                } else if (keepsText) {
                    yield a.reshape(OperationKind.INSERT, newPosition, 0, a.content());
                } else if (newLength > 0) {
                    yield a.reshape(OperationKind.DELETE, newPosition, newLength, "");
                } else {
                    // Fully absorbed: keep the operation as a no-op rather than dropping it.
                    yield a.reshape(OperationKind.RETAIN, newPosition, 0, "");
                }
            }
        };
    }

    /**
     * Placement of a relative to b's text when both start at the same point.
     */
    private static boolean goesBeforeTextAtSamePoint(Operation a, Operation b, boolean aEarlier) {
        boolean aSpans = a.length() > 0;
        boolean bSpans = b.length() > 0;
        if (!aSpans && !bSpans) return aEarlier;
        if (!aSpans) return true;
        if (!bSpans) return false;
        return a.kind().carriesText() && aEarlier;
    }
}
