package io.otlite.server.coordinator;

/**
 * Raised by a coordinator that was closed after a caller looked it up.
 * The registry catches it and retries against a fresh coordinator.
 */
final class CoordinatorClosedException extends RuntimeException {
    CoordinatorClosedException(String documentId) {
        super("coordinator for " + documentId + " is closed", null, false, false);
    }
}
