// file: src/main/java/io/otlite/server/dto/SubmitRequest.java
package io.otlite.server.dto;

/**
 * JSON body for POST /docs/{id}/ops.
 * Example:
 *   {
 *     "baseVersion": 12,
 *     "operation": { "kind": "INSERT", "position": 3, "content": "X", "authorId": "alice", "logicalTime": 4 }
 *   }
 */
public class SubmitRequest {
    public Long baseVersion;           // version the client last saw; required
    public OperationPayload operation; // required
}
