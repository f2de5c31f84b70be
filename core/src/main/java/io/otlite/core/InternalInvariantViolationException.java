package io.otlite.core;

/**
 * A bug inside the engine: a transform produced an operation that does not
 * fit the document, or stored state disagrees with itself.
 * <p>
 * Never clamp around this. The owning document refuses further mutation
 * until it is explicitly reset.
 */
public final class InternalInvariantViolationException extends OtException {

    public InternalInvariantViolationException(String message) {
        super(message);
    }

    public InternalInvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "INTERNAL_INVARIANT_VIOLATION";
    }
}
