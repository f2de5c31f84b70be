// file: server/src/main/java/io/otlite/server/RequestLogger.java
package io.otlite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for request-level logging.
 *
 * Responsibilities:
 *  - Log method/path/status, latency and correlation id for every request.
 *  - Keep the level policy in one spot: 5xx at WARNING (with the cause),
 *    everything else at INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method            HTTP method (GET, PUT, POST, DELETE)
     * @param path              request path
     * @param status            HTTP status code
     * @param totalMillis       wall-clock latency for the whole request
     * @param coordinatorMillis time spent inside the coordinator, or -1 if not reached
     * @param correlationId     value of X-Correlation-Id for this request
     * @param error             optional exception, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long coordinatorMillis,
            String correlationId,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s) cid=%s%s",
                method,
                path,
                status,
                totalMillis,
                coordinatorMillis >= 0 ? ", coordinator=" + coordinatorMillis + "ms" : "",
                correlationId,
                error != null && status < 500 ? " error=" + error.getMessage() : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
