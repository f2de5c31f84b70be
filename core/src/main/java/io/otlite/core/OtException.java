package io.otlite.core;

/**
 * Root of the engine's error taxonomy.
 * <p>
 * All subclasses are unchecked and are reported to the caller as-is.
 * The engine never retries on its own; resync and retry policy belong to
 * the calling layer.
 */
public abstract class OtException extends RuntimeException {

    protected OtException(String message) {
        super(message);
    }

    protected OtException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable machine-readable code, used by adapters when mapping errors. */
    public abstract String code();
}
