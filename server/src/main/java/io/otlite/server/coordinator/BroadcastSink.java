// file: src/main/java/io/otlite/server/coordinator/BroadcastSink.java
package io.otlite.server.coordinator;

import io.otlite.core.SubmitResult;

/**
 * Boundary to whatever fans accepted operations out to connected clients.
 * <p>
 * Called once per applied operation, in version order, while the document
 * is still locked. Implementations should hand off quickly; a failure is
 * logged by the coordinator and never undoes the apply.
 */
@FunctionalInterface
public interface BroadcastSink {
    void publish(String documentId, SubmitResult result);
}
