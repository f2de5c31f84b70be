// file: src/main/java/io/otlite/core/OperationKind.java
package io.otlite.core;

/**
 * The closed set of edits an {@link Operation} can describe.
 * <p>
 * Interpretation, with {@code [position, position + length)} measured in
 * code points of the pre-operation content:
 *  - INSERT:  splice {@code content} at {@code position}; spans nothing.
 *  - DELETE:  remove the span.
 *  - RETAIN:  leave the span untouched (a no-op; also the shape a fully
 *             absorbed edit degenerates to after a transform).
 *  - REPLACE: remove the span, then splice {@code content} at its start.
 */
public enum OperationKind {
    INSERT, DELETE, RETAIN, REPLACE;

    /** True for kinds that carry a text payload. */
    public boolean carriesText() {
        return switch (this) {
            case INSERT, REPLACE -> true;
            case DELETE, RETAIN -> false;
        };
    }

    /** True for kinds that remove the span they cover. */
    public boolean removesSpan() {
        return switch (this) {
            case DELETE, REPLACE -> true;
            case INSERT, RETAIN -> false;
        };
    }
}
