// file: server/src/main/java/io/otlite/server/Main.java
package io.otlite.server;

import io.otlite.core.DefaultTransformEngine;
import io.otlite.server.coordinator.DocumentCoordinatorRegistry;
import io.otlite.server.coordinator.IdleEvictionDaemon;
import io.otlite.server.coordinator.LoggingBroadcastSink;
import io.otlite.storage.FileSnapshotStore;
import io.otlite.storage.InMemorySnapshotStore;
import io.otlite.storage.SnapshotStore;

import java.nio.file.Path;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for an OT-Lite server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire the transform engine, snapshot store and broadcast sink into
 *    one coordinator registry.
 *  - Start the HTTP adapter and the idle-eviction daemon.
 *  - Persist every live document on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        ServerConfig cfg;
        try {
            cfg = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.err.println(ServerConfig.helpText());
            System.exit(1);
            return;
        }

        // ------ Storage layer -------
        SnapshotStore snapshots = cfg.snapDir() == null
                ? new InMemorySnapshotStore()
                : new FileSnapshotStore(Path.of(cfg.snapDir()));

        // ------ Coordination -------
        var registry = new DocumentCoordinatorRegistry(
                new DefaultTransformEngine(),
                snapshots,
                new LoggingBroadcastSink(),
                cfg.coordinatorOptions()
        );

        IdleEvictionDaemon eviction = null;
        if (cfg.idleEvictSeconds() > 0) {
            eviction = new IdleEvictionDaemon(registry, Duration.ofSeconds(cfg.idleEvictSeconds()));
            eviction.start();
        }

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), registry, cfg.submitTimeout());
        web.start();

        log.info(String.format("OT-Lite listening on http://localhost:%d (snapshots: %s, history window: %d)",
                cfg.httpPort(), cfg.snapDir() == null ? "in-memory" : cfg.snapDir(), cfg.historyWindow()));

        // Shutdown hook
        IdleEvictionDaemon evictionRef = eviction;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                if (evictionRef != null) {
                    evictionRef.stop();
                }
                web.stop();
                registry.closeAll();
            } catch (Exception e) {
                log.log(Level.WARNING, "shutdown incomplete", e);
            }
        }, "shutdown"));
    }
}
