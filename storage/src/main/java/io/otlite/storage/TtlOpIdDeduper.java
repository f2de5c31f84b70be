// file: src/main/java/io/otlite/storage/TtlOpIdDeduper.java
package io.otlite.storage;

import io.otlite.core.SubmitResult;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL-bounded result cache keyed by operationId.
 *
 * Semantics:
 *  - lookup(opId): the recorded result while it is inside the TTL window,
 *    empty once it has expired or was never recorded.
 *  - record(opId, result): stores the result with a fresh expiry.
 *
 * Implementation notes:
 *  - Backed by a ConcurrentHashMap<opId, Entry(result, expireAtMillis)>.
 *  - Lazy cleanup: expired entries are removed opportunistically on record,
 *    a bounded number per call. No background threads.
 *  - Time comes from an injected Clock so tests can move it.
 */
public final class TtlOpIdDeduper implements OpIdDeduper {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);

    private static final int SCAN_LIMIT = 64;

    private record Entry(SubmitResult result, long expireAtMillis) {}

    private final Map<String, Entry> seen = new ConcurrentHashMap<>();
    private final Clock clock;

    private final long ttlMillis;

    public TtlOpIdDeduper(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public TtlOpIdDeduper(Duration ttl, Clock clock) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttlMillis = ttl.toMillis();
    }

    @Override
    public Optional<SubmitResult> lookup(String opId) {
        Objects.requireNonNull(opId, "opId");
        Entry e = seen.get(opId);
        if (e == null) {
            return Optional.empty();
        }
        if (e.expireAtMillis() < clock.millis()) {
            seen.remove(opId, e);
            return Optional.empty();
        }
        return Optional.of(e.result());
    }

    @Override
    public void record(String opId, SubmitResult result) {
        Objects.requireNonNull(opId, "opId");
        Objects.requireNonNull(result, "result");
        long now = clock.millis();
        seen.put(opId, new Entry(result, now + ttlMillis));
        maybeCleanup(now);
    }

    /** Number of ids currently held, expired or not. */
    int size() {
        return seen.size();
    }

    /**
     * Remove expired entries from a bounded slice of the map so a single
     * call never does O(map.size()) work.
     */
    private void maybeCleanup(long now) {
        int scanned = 0;
        for (var it = seen.entrySet().iterator(); it.hasNext() && scanned < SCAN_LIMIT; scanned++) {
            var e = it.next();
            if (e.getValue().expireAtMillis() < now) {
                it.remove();
            }
        }
    }
}
