package io.otlite.server.coordinator;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background task that periodically persists and drops documents nobody
 * has touched for {@code idleAfter}.
 * <p>
 * Single-threaded scheduler with a fixed delay, so at most one sweep runs
 * at a time. A failing sweep is logged and the next one runs as scheduled.
 */
public final class IdleEvictionDaemon {
    private static final Logger log = Logger.getLogger(IdleEvictionDaemon.class.getName());

    private final DocumentCoordinatorRegistry registry;
    private final Duration idleAfter;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public IdleEvictionDaemon(DocumentCoordinatorRegistry registry, Duration idleAfter) {
        this(registry, idleAfter, sweepInterval(idleAfter));
    }

    public IdleEvictionDaemon(DocumentCoordinatorRegistry registry, Duration idleAfter, Duration interval) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.idleAfter = Objects.requireNonNull(idleAfter, "idleAfter");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (idleAfter.isNegative() || idleAfter.isZero() || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("idleAfter and interval must be positive");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "idle-eviction");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::tickSafe, millis, millis, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    // ---------- internals ----------

    void tickSafe() {
        try {
            registry.evictIdle(idleAfter);
        } catch (Exception e) {
            log.log(Level.WARNING, "idle eviction sweep failed", e);
        }
    }

    /** Sweep four times per idle window, but not more often than once a second. */
    private static Duration sweepInterval(Duration idleAfter) {
        Duration quarter = idleAfter.dividedBy(4);
        return quarter.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : quarter;
    }
}
