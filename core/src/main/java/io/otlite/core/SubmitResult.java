// file: src/main/java/io/otlite/core/SubmitResult.java
package io.otlite.core;

import java.util.Objects;

/**
 * Outcome of an accepted submission: the operation as it was actually
 * applied (rebased onto the head) and the version it produced.
 * <p>
 * The same value is returned to the submitter, handed to the broadcast
 * collaborator and replayed for duplicate operation ids.
 */
public record SubmitResult(Operation operation, long version) {
    public SubmitResult {
        Objects.requireNonNull(operation, "operation");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got " + version);
        }
    }
}
