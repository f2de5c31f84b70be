package io.otlite.core;

/**
 * Malformed input from a caller: the operation is rejected and must not be
 * retried as-is.
 */
public final class InvalidOperationException extends OtException {

    public enum Reason {
        /** A position, length or logical time below zero. */
        NEGATIVE_VALUE,
        /** INSERT or REPLACE without text. */
        EMPTY_CONTENT,
        /** DELETE or RETAIN carrying text. */
        UNEXPECTED_CONTENT,
        /** DELETE or REPLACE spanning nothing. */
        ZERO_LENGTH,
        /** INSERT declaring a non-zero span. */
        UNEXPECTED_LENGTH,
        /** Missing kind, author id or operation id. */
        MISSING_IDENTITY,
        /** Position or span outside the document it is applied to. */
        OUT_OF_BOUNDS
    }

    private final Reason reason;

    public InvalidOperationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public String code() {
        return "INVALID_OPERATION";
    }
}
