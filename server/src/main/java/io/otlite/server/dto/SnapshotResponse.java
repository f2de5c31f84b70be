package io.otlite.server.dto;

import io.otlite.storage.DocumentSnapshot;

/**
 * JSON response for GET /docs/{id}, PUT /docs/{id} and POST /docs/{id}/reset.
 *   { "documentId": "notes", "content": "hello", "version": 5 }
 */
public class SnapshotResponse {
    public String documentId;
    public String content;
    public long version;

    public static SnapshotResponse from(DocumentSnapshot s) {
        var dto = new SnapshotResponse();
        dto.documentId = s.documentId();
        dto.content = s.content();
        dto.version = s.version();
        return dto;
    }
}
