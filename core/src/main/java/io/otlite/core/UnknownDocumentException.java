package io.otlite.core;

/** No state exists for the document and implicit creation is disabled. */
public final class UnknownDocumentException extends OtException {
    private final String documentId;

    public UnknownDocumentException(String documentId) {
        super("unknown document: " + documentId);
        this.documentId = documentId;
    }

    public String documentId() {
        return documentId;
    }

    @Override
    public String code() {
        return "UNKNOWN_DOCUMENT";
    }
}
