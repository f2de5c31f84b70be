package io.otlite.core;

/**
 * The submitted base version predates the retained history window, so the
 * operation cannot be rebased. The caller must fetch a full snapshot and
 * retry against the current version.
 */
public final class StaleClientException extends OtException {
    private final String documentId;
    private final long baseVersion;
    private final long currentVersion;
    private final long oldestRebasableVersion;

    public StaleClientException(String documentId, long baseVersion, long currentVersion, long oldestRebasableVersion) {
        super(String.format(
                "document %s: base version %d is older than the retained history (oldest rebasable %d, current %d)",
                documentId, baseVersion, oldestRebasableVersion, currentVersion));
        this.documentId = documentId;
        this.baseVersion = baseVersion;
        this.currentVersion = currentVersion;
        this.oldestRebasableVersion = oldestRebasableVersion;
    }

    public String documentId() { return documentId; }

    public long baseVersion() { return baseVersion; }

    public long currentVersion() { return currentVersion; }

    public long oldestRebasableVersion() { return oldestRebasableVersion; }

    @Override
    public String code() {
        return "STALE_CLIENT";
    }
}
