// file: src/main/java/io/otlite/storage/OpIdDeduper.java
package io.otlite.storage;

import io.otlite.core.SubmitResult;

import java.util.Optional;

/**
 * Remembers the result of each applied operation by its operationId.
 * Rationale:
 *  - Clients retry after timeouts or lost responses, so the same logical edit
 *    can arrive more than once.
 *  - A replay must return the original (rebased operation, version) instead
 *    of being transformed and applied a second time.
 */
public interface OpIdDeduper {

    /** Result recorded for {@code opId}, if it is still remembered. */
    Optional<SubmitResult> lookup(String opId);

    /** Remember {@code result} as the outcome of {@code opId}. */
    void record(String opId, SubmitResult result);
}
