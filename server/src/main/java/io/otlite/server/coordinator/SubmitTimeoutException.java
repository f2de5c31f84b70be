package io.otlite.server.coordinator;

import io.otlite.core.OtException;

import java.time.Duration;

/**
 * The document lock could not be acquired in time. Nothing was applied;
 * the caller may retry with the same operationId.
 */
public final class SubmitTimeoutException extends OtException {
    private final String documentId;

    public SubmitTimeoutException(String documentId, Duration timeout) {
        super("document " + documentId + " busy: lock not acquired within " + timeout.toMillis() + "ms");
        this.documentId = documentId;
    }

    public SubmitTimeoutException(String documentId, InterruptedException cause) {
        super("document " + documentId + ": interrupted while waiting for lock", cause);
        this.documentId = documentId;
    }

    public String documentId() {
        return documentId;
    }

    @Override
    public String code() {
        return "SUBMIT_TIMEOUT";
    }
}
