// file: server/src/main/java/io/otlite/server/ServerConfig.java
package io.otlite.server;

import io.otlite.server.coordinator.CoordinatorOptions;

import java.time.Duration;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:          external HTTP API port
 *  - snapDir:           directory for document snapshots; null keeps them in memory
 *  - historyWindow:     applied operations kept per document for rebasing
 *  - snapshotEvery:     applied operations between automatic snapshots
 *  - dedupeTtlSeconds:  how long applied results are remembered for retries
 *  - idleEvictSeconds:  evict documents idle this long; 0 disables eviction
 *  - submitTimeoutMs:   how long an HTTP submit waits for a busy document
 *  - implicitCreate:    create unknown documents on first use
 */
public record ServerConfig(
        int httpPort,
        String snapDir,
        int historyWindow,
        int snapshotEvery,
        long dedupeTtlSeconds,
        long idleEvictSeconds,
        long submitTimeoutMs,
        boolean implicitCreate
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,  -p  <port>
     *   --snap,       -s  <path>
     *   --history-window  <ops>
     *   --snapshot-every  <ops>
     *   --dedupe-ttl-seconds <seconds>
     *   --idle-evict-seconds <seconds>
     *   --submit-timeout-ms  <millis>
     *   --no-implicit-create
     *   --help,       -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     * Malformed values are reported as IllegalArgumentException.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        int httpPort = 8080;
        String snap = "./data/snap";
        int historyWindow = 256;
        int snapshotEvery = 100;
        long dedupeTtlSeconds = 600; // default: 10 minutes
        long idleEvictSeconds = 900;
        long submitTimeoutMs = 2_000;
        boolean implicitCreate = true;

        // CLIArg Parser
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt(args[i], args[++i]);
                }

                case "--snap", "-s" -> {
                    ensureValue(args, i);
                    String v = args[++i];
                    snap = "none".equals(v) ? null : v;
                }

                case "--history-window" -> {
                    ensureValue(args, i);
                    historyWindow = parseInt(args[i], args[++i]);
                }

                case "--snapshot-every" -> {
                    ensureValue(args, i);
                    snapshotEvery = parseInt(args[i], args[++i]);
                }

                case "--dedupe-ttl-seconds" -> {
                    ensureValue(args, i);
                    dedupeTtlSeconds = parseLong(args[i], args[++i]);
                }

                case "--idle-evict-seconds" -> {
                    ensureValue(args, i);
                    idleEvictSeconds = parseLong(args[i], args[++i]);
                }

                case "--submit-timeout-ms" -> {
                    ensureValue(args, i);
                    submitTimeoutMs = parseLong(args[i], args[++i]);
                }

                case "--no-implicit-create" -> implicitCreate = false;

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        var cfg = new ServerConfig(
                httpPort,
                snap,
                historyWindow,
                snapshotEvery,
                dedupeTtlSeconds,
                idleEvictSeconds,
                submitTimeoutMs,
                implicitCreate
        );
        cfg.coordinatorOptions(); // range checks
        return cfg;
    }

    public ServerConfig {
        if (httpPort < 0 || httpPort > 65_535) {
            throw new IllegalArgumentException("http-port out of range: " + httpPort);
        }
        if (idleEvictSeconds < 0) {
            throw new IllegalArgumentException("idle-evict-seconds must be >= 0, got " + idleEvictSeconds);
        }
        if (submitTimeoutMs <= 0) {
            throw new IllegalArgumentException("submit-timeout-ms must be > 0, got " + submitTimeoutMs);
        }
    }

    public CoordinatorOptions coordinatorOptions() {
        if (dedupeTtlSeconds <= 0) {
            throw new IllegalArgumentException("dedupe-ttl-seconds must be > 0, got " + dedupeTtlSeconds);
        }
        return new CoordinatorOptions(historyWindow, snapshotEvery, Duration.ofSeconds(dedupeTtlSeconds), implicitCreate);
    }

    public Duration submitTimeout() {
        return Duration.ofMillis(submitTimeoutMs);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag.substring(2) + ": " + value);
        }
    }

    private static long parseLong(String flag, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag.substring(2) + ": " + value);
        }
    }

    static String helpText() {
        return """
            Usage: server [options]

            Options:
              --http-port,      -p   HTTP port (default: 8080)
              --snap,           -s   Snapshot directory, or "none" for in-memory (default: ./data/snap)
              --history-window       Operations kept per document for rebasing, 1..100000 (default: 256)
              --snapshot-every       Applied operations between snapshots (default: 100)
              --dedupe-ttl-seconds   How long applied results are kept for retries (default: 600)
              --idle-evict-seconds   Evict documents idle this long, 0 = never (default: 900)
              --submit-timeout-ms    Max wait for a busy document on submit (default: 2000)
              --no-implicit-create   Reject operations on documents that were never opened
              --help,           -h   Show this help message
            """;
    }

    private static void printHelpAndExit() {
        System.out.println(helpText());
        System.exit(0);
    }
}
