// file: src/main/java/io/otlite/server/dto/SubmitResponse.java
package io.otlite.server.dto;

import io.otlite.core.SubmitResult;

/**
 * JSON response for an accepted POST /docs/{id}/ops: the operation as it
 * was applied (possibly rebased) and the version it produced.
 */
public class SubmitResponse {
    public OperationPayload operation;
    public long version;

    public static SubmitResponse from(SubmitResult r) {
        var dto = new SubmitResponse();
        dto.operation = OperationPayload.from(r.operation());
        dto.version = r.version();
        return dto;
    }
}
