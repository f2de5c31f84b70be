// file: src/main/java/io/otlite/core/Operation.java
package io.otlite.core;

import io.otlite.core.InvalidOperationException.Reason;

import java.util.Objects;

/**
 * Immutable description of a single edit to a linear text document.
 * <p>
 * Fields:
 *  - kind:         INSERT, DELETE, RETAIN or REPLACE.
 *  - position:     code-point offset into the pre-operation content.
 *  - content:      text payload; non-empty for INSERT/REPLACE, empty otherwise.
 *  - length:       code points spanned in the pre-operation content
 *                  (0 for INSERT, at least 1 for DELETE/REPLACE).
 *  - authorId:     originating session; only used for tie-breaking.
 *  - logicalTime:  per-author sequence number; never wall-clock.
 *  - operationId:  globally unique id used to detect replays.
 * <p>
 * Invariants:
 *  - Intrinsic shape rules are checked at construction and reported as
 *    {@link InvalidOperationException}.
 *  - Bounds against a concrete document are checked by {@link #validateAgainst(int)}.
 *  - Transforms produce new instances that keep authorId, logicalTime
 *    and operationId, so a rebased operation is still the same logical edit.
 */
public final class Operation {
    private final OperationKind kind;
    private final int position;
    private final String content;
    private final int length;
    private final String authorId;
    private final long logicalTime;
    private final String operationId;

    // Cached code-point length of content.
    private final int contentLength;

    private Operation(OperationKind kind,
                      int position,
                      String content,
                      int length,
                      String authorId,
                      long logicalTime,
                      String operationId) {
        this.kind = kind;
        this.position = position;
        this.content = content;
        this.length = length;
        this.authorId = authorId;
        this.logicalTime = logicalTime;
        this.operationId = operationId;
        this.contentLength = TextUnits.length(content);
    }

    // ---------- factories ----------

    public static Operation insert(int position, String content, String authorId, long logicalTime, String operationId) {
        return of(OperationKind.INSERT, position, content, 0, authorId, logicalTime, operationId);
    }

    public static Operation delete(int position, int length, String authorId, long logicalTime, String operationId) {
        return of(OperationKind.DELETE, position, "", length, authorId, logicalTime, operationId);
    }

    public static Operation replace(int position, int length, String content, String authorId, long logicalTime, String operationId) {
        return of(OperationKind.REPLACE, position, content, length, authorId, logicalTime, operationId);
    }

    public static Operation retain(int position, int length, String authorId, long logicalTime, String operationId) {
        return of(OperationKind.RETAIN, position, "", length, authorId, logicalTime, operationId);
    }

    /**
     * Generic factory used by wire decoding.
     * A null content is read as empty. The operationId is required: it is
     * the only way a retried submission is recognised.
     */
    public static Operation of(OperationKind kind,
                               int position,
                               String content,
                               int length,
                               String authorId,
                               long logicalTime,
                               String operationId) {
        if (kind == null) {
            throw new InvalidOperationException(Reason.MISSING_IDENTITY, "kind is required");
        }
        if (authorId == null || authorId.isBlank()) {
            throw new InvalidOperationException(Reason.MISSING_IDENTITY, "authorId is required");
        }
        if (operationId == null || operationId.isBlank()) {
            throw new InvalidOperationException(Reason.MISSING_IDENTITY, "operationId is required");
        }
        String text = content == null ? "" : content;

        if (position < 0) {
            throw new InvalidOperationException(Reason.NEGATIVE_VALUE, "position must be >= 0, got " + position);
        }
        if (length < 0) {
            throw new InvalidOperationException(Reason.NEGATIVE_VALUE, "length must be >= 0, got " + length);
        }
        if (logicalTime < 0) {
            throw new InvalidOperationException(Reason.NEGATIVE_VALUE, "logicalTime must be >= 0, got " + logicalTime);
        }

        switch (kind) {
            case INSERT -> {
                if (text.isEmpty()) {
                    throw new InvalidOperationException(Reason.EMPTY_CONTENT, "INSERT requires content");
                }
                if (length != 0) {
                    throw new InvalidOperationException(Reason.UNEXPECTED_LENGTH, "INSERT spans nothing, got length " + length);
                }
            }
            case REPLACE -> {
                if (text.isEmpty()) {
                    throw new InvalidOperationException(Reason.EMPTY_CONTENT, "REPLACE requires content");
                }
                if (length == 0) {
                    throw new InvalidOperationException(Reason.ZERO_LENGTH, "REPLACE requires length >= 1");
                }
            }
            case DELETE -> {
                if (!text.isEmpty()) {
                    throw new InvalidOperationException(Reason.UNEXPECTED_CONTENT, "DELETE must not carry content");
                }
                if (length == 0) {
                    throw new InvalidOperationException(Reason.ZERO_LENGTH, "DELETE requires length >= 1");
                }
            }
            case RETAIN -> {
                if (!text.isEmpty()) {
                    throw new InvalidOperationException(Reason.UNEXPECTED_CONTENT, "RETAIN must not carry content");
                }
            }
        }
        if ((long) position + length > Integer.MAX_VALUE) {
            throw new InvalidOperationException(Reason.OUT_OF_BOUNDS, "span end overflows");
        }
        return new Operation(kind, position, text, length, authorId, logicalTime, operationId);
    }

    /**
     * Same logical edit, different shape. Used by the transform engine; the
     * identity fields are carried over untouched.
     */
    Operation reshape(OperationKind newKind, int newPosition, int newLength, String newContent) {
        if (newPosition < 0 || newLength < 0) {
            throw new InternalInvariantViolationException(String.format(
                    "transform of %s produced negative span (position=%d, length=%d)", this, newPosition, newLength));
        }
        return new Operation(newKind, newPosition, newContent, newLength, authorId, logicalTime, operationId);
    }

    // ---------- behaviour ----------

    /**
     * Check that this operation fits a document of {@code documentLength} code points.
     *
     * @throws InvalidOperationException with reason OUT_OF_BOUNDS otherwise
     */
    public void validateAgainst(int documentLength) {
        if (position > documentLength) {
            throw new InvalidOperationException(Reason.OUT_OF_BOUNDS, String.format(
                    "%s: position %d exceeds document length %d", kind, position, documentLength));
        }
        if (spanEnd() > documentLength) {
            throw new InvalidOperationException(Reason.OUT_OF_BOUNDS, String.format(
                    "%s: span [%d, %d) exceeds document length %d", kind, position, spanEnd(), documentLength));
        }
    }

    /** Return the text that results from applying this operation to {@code text}. */
    public String applyTo(String text) {
        validateAgainst(TextUnits.length(text));
        return switch (kind) {
            case INSERT -> TextUnits.splice(text, position, 0, content);
            case DELETE -> TextUnits.splice(text, position, length, "");
            case REPLACE -> TextUnits.splice(text, position, length, content);
            case RETAIN -> text;
        };
    }

    /** Change in document length caused by applying this operation. */
    public int lengthDelta() {
        return switch (kind) {
            case INSERT -> contentLength;
            case DELETE -> -length;
            case REPLACE -> contentLength - length;
            case RETAIN -> 0;
        };
    }

    /** Exclusive end of the spanned range. */
    public int spanEnd() { return position + length; }

    /** True if this operation leaves the document unchanged. */
    public boolean isNoOp() { return kind == OperationKind.RETAIN; }

    // ---------- accessors ----------

    public OperationKind kind() { return kind; }

    public int position() { return position; }

    public String content() { return content; }

    public int length() { return length; }

    public String authorId() { return authorId; }

    public long logicalTime() { return logicalTime; }

    public String operationId() { return operationId; }

    /** Code-point length of {@link #content()}. */
    public int contentLength() { return contentLength; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operation op)) return false;
        return position == op.position
                && length == op.length
                && logicalTime == op.logicalTime
                && kind == op.kind
                && content.equals(op.content)
                && authorId.equals(op.authorId)
                && operationId.equals(op.operationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, position, content, length, authorId, logicalTime, operationId);
    }

    @Override
    public String toString() {
        String payload = kind.carriesText() ? ", \"" + content + "\"" : "";
        return String.format("%s(%d, %d%s) by %s@%d [%s]",
                kind, position, length, payload, authorId, logicalTime, operationId);
    }
}
