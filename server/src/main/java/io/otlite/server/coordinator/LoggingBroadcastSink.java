// file: src/main/java/io/otlite/server/coordinator/LoggingBroadcastSink.java
package io.otlite.server.coordinator;

import io.otlite.core.SubmitResult;

import java.util.logging.Level;
import java.util.logging.Logger;

/** Default sink for a standalone server: nothing to fan out to, so just log. */
public final class LoggingBroadcastSink implements BroadcastSink {
    private static final Logger log = Logger.getLogger(LoggingBroadcastSink.class.getName());

    @Override
    public void publish(String documentId, SubmitResult result) {
        if (log.isLoggable(Level.FINE)) {
            log.fine(String.format("broadcast doc=%s v=%d %s", documentId, result.version(), result.operation()));
        }
    }
}
