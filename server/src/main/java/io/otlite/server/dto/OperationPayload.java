// file: src/main/java/io/otlite/server/dto/OperationPayload.java
package io.otlite.server.dto;

import io.otlite.core.Operation;
import io.otlite.core.OperationKind;

import java.util.Locale;

/**
 * Wire form of an operation.
 * Example:
 *   {
 *     "kind": "REPLACE",
 *     "position": 4,
 *     "length": 2,
 *     "content": "hi",
 *     "authorId": "alice",
 *     "logicalTime": 7,
 *     "operationId": "6f1c..."
 *   }
 * content may be omitted for DELETE/RETAIN and length for INSERT. Every
 * other field is required; an absent number is not read as 0.
 */
public class OperationPayload {
    public String kind;
    public Integer position;
    public String content;
    public Integer length;
    public String authorId;
    public Long logicalTime;
    public String operationId;

    /**
     * Decode into a validated Operation.
     *
     * @throws IllegalArgumentException         for a missing or unknown kind, or a missing number
     * @throws io.otlite.core.InvalidOperationException for shape violations
     */
    public Operation toOperation() {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("operation.kind is required");
        }
        OperationKind k;
        try {
            k = OperationKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown operation kind: " + kind);
        }
        if (position == null) {
            throw new IllegalArgumentException("operation.position is required");
        }
        if (logicalTime == null) {
            throw new IllegalArgumentException("operation.logicalTime is required");
        }
        if (length == null && k != OperationKind.INSERT) {
            throw new IllegalArgumentException("operation.length is required for " + k);
        }
        int span = length == null ? 0 : length;
        return Operation.of(k, position, content, span, authorId, logicalTime, operationId);
    }

    public static OperationPayload from(Operation op) {
        var p = new OperationPayload();
        p.kind = op.kind().name();
        p.position = op.position();
        p.content = op.content();
        p.length = op.length();
        p.authorId = op.authorId();
        p.logicalTime = op.logicalTime();
        p.operationId = op.operationId();
        return p;
    }
}
