// file: src/test/java/io/otlite/server/coordinator/DocumentCoordinatorTest.java
package io.otlite.server.coordinator;

import io.otlite.core.DefaultTransformEngine;
import io.otlite.core.InternalInvariantViolationException;
import io.otlite.core.InvalidOperationException;
import io.otlite.core.Operation;
import io.otlite.core.StaleClientException;
import io.otlite.core.SubmitResult;
import io.otlite.core.TransformEngine;
import io.otlite.storage.DocumentSnapshot;
import io.otlite.storage.InMemorySnapshotStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Submit semantics of a single document: ordering scenarios, idempotence,
 * staleness, poisoning and locking.
 */
class DocumentCoordinatorTest {

    private final InMemorySnapshotStore store = new InMemorySnapshotStore();
    private final CapturingSink sink = new CapturingSink();

    private DocumentCoordinator coordinator(String content, CoordinatorOptions options) {
        return coordinator(content, options, new DefaultTransformEngine(), sink);
    }

    private DocumentCoordinator coordinator(String content, CoordinatorOptions options,
                                            TransformEngine engine, BroadcastSink broadcast) {
        return new DocumentCoordinator(new DocumentSnapshot("doc", content, 0), engine, store, broadcast,
                options, Clock.systemUTC());
    }

    private DocumentCoordinator coordinator(String content) {
        return coordinator(content, CoordinatorOptions.defaults());
    }

    private static Operation ins(int pos, String text, String author, long lt, String id) {
        return Operation.insert(pos, text, author, lt, id);
    }

    // ---------- scenarios ----------

    @Test
    void sequential_operations_build_on_each_other() {
        var c = coordinator("abc");

        SubmitResult r1 = c.submit(ins(1, "X", "alice", 1, "op-1"), 0);
        assertEquals(1, r1.version());
        assertEquals("aXbc", c.snapshot().content());

        // Written against v0, after the insert landed.
        SubmitResult r2 = c.submit(Operation.delete(0, 1, "bob", 1, "op-2"), 0);
        assertEquals(2, r2.version());
        assertEquals("Xbc", c.snapshot().content());
    }

    @Test
    void simultaneous_inserts_at_same_position_converge_in_either_arrival_order() {
        var alice = ins(2, "A", "alice", 5, "op-a");
        var bob = ins(2, "B", "bob", 3, "op-b");

        var first = coordinator("ab");
        first.submit(alice, 0);
        first.submit(bob, 0);

        var second = coordinator("ab");
        second.submit(bob, 0);
        second.submit(alice, 0);

        assertEquals("abBA", first.snapshot().content());
        assertEquals(first.snapshot().content(), second.snapshot().content());
    }

    @Test
    void overlapping_deletes_remove_the_union() {
        var c = coordinator("hello world");
        c.submit(Operation.delete(0, 5, "alice", 1, "op-a"), 0);
        SubmitResult r = c.submit(Operation.delete(3, 5, "bob", 1, "op-b"), 0);

        assertEquals("rld", c.snapshot().content());
        assertEquals(0, r.operation().position());
        assertEquals(3, r.operation().length());
    }

    @Test
    void concurrent_insert_inside_a_deleted_span_is_absorbed() {
        var c = coordinator("abcdef");
        c.submit(Operation.delete(1, 3, "alice", 1, "del"), 0);
        SubmitResult r = c.submit(ins(2, "XY", "bob", 1, "ins"), 0);

        assertEquals("aef", c.snapshot().content());
        assertTrue(r.operation().isNoOp());
        assertEquals(2, r.version(), "an absorbed operation still takes a version");
    }

    // ---------- idempotence ----------

    @Test
    void duplicate_submission_returns_recorded_result_without_reapplying() {
        var c = coordinator("abc");
        var op = ins(0, "z", "alice", 1, "op-1");

        SubmitResult first = c.submit(op, 0);
        SubmitResult again = c.submit(op, 0);

        assertEquals(first, again);
        assertEquals("zabc", c.snapshot().content());
        assertEquals(1, c.snapshot().version());
        assertEquals(1, sink.published.size(), "a replay is not broadcast again");
    }

    @Test
    void replay_is_recognised_even_after_its_base_left_the_history_window() {
        var c = coordinator("", CoordinatorOptions.defaults().withHistoryWindow(2));
        var op = ins(0, "a", "alice", 1, "op-1");
        SubmitResult first = c.submit(op, 0);
        c.submit(ins(1, "b", "alice", 2, "op-2"), 1);
        c.submit(ins(2, "c", "alice", 3, "op-3"), 2);
        c.submit(ins(3, "d", "alice", 4, "op-4"), 3);

        assertEquals(first, c.submit(op, 0));
    }

    @Test
    void replay_after_the_result_cache_expired_is_found_in_history() {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var c = new DocumentCoordinator(new DocumentSnapshot("doc", "abc", 0), new DefaultTransformEngine(),
                store, sink, CoordinatorOptions.defaults(), clock);
        var op = ins(0, "z", "alice", 1, "op-1");
        SubmitResult first = c.submit(op, 0);

        clock.advance(CoordinatorOptions.defaults().dedupeTtl().plusMinutes(1));
        SubmitResult again = c.submit(op, 0);

        assertEquals(first, again);
        assertEquals(new DocumentSnapshot("doc", "zabc", 1), c.snapshot());
        assertEquals(1, sink.published.size());
    }

    @Test
    void replay_arriving_after_later_edits_and_cache_expiry_is_not_reapplied() {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var c = new DocumentCoordinator(new DocumentSnapshot("doc", "abc", 0), new DefaultTransformEngine(),
                store, sink, CoordinatorOptions.defaults(), clock);
        var op = ins(0, "z", "alice", 1, "op-1");
        SubmitResult first = c.submit(op, 0);
        c.submit(ins(4, "!", "bob", 1, "op-2"), 1);

        clock.advance(Duration.ofHours(1));

        assertEquals(first, c.submit(op, 0));
        assertEquals(new DocumentSnapshot("doc", "zabc!", 2), c.snapshot());
    }

    // ---------- rejection ----------

    @Test
    void base_older_than_history_window_is_stale() {
        var c = coordinator("", CoordinatorOptions.defaults().withHistoryWindow(2));
        c.submit(ins(0, "a", "alice", 1, "op-1"), 0);
        c.submit(ins(1, "b", "alice", 2, "op-2"), 1);
        c.submit(ins(2, "c", "alice", 3, "op-3"), 2);

        var ex = assertThrows(StaleClientException.class,
                () -> c.submit(ins(0, "x", "bob", 1, "late"), 0));
        assertEquals(3, ex.currentVersion());
        assertEquals(1, ex.oldestRebasableVersion());

        // The floor itself is still rebasable.
        assertEquals(4, c.submit(ins(0, "x", "bob", 1, "ok"), 1).version());
    }

    @Test
    void base_version_ahead_of_head_is_rejected() {
        var c = coordinator("abc");
        var ex = assertThrows(InvalidOperationException.class,
                () -> c.submit(ins(0, "x", "alice", 1, "op-1"), 5));
        assertEquals(InvalidOperationException.Reason.OUT_OF_BOUNDS, ex.reason());
    }

    @Test
    void operation_out_of_bounds_at_its_base_is_rejected_and_changes_nothing() {
        var c = coordinator("abc");
        c.submit(ins(3, "defg", "alice", 1, "grow"), 0);

        // Fits the head ("abcdefg") but not its base ("abc").
        var ex = assertThrows(InvalidOperationException.class,
                () -> c.submit(Operation.delete(2, 3, "bob", 1, "too-long"), 0));
        assertEquals(InvalidOperationException.Reason.OUT_OF_BOUNDS, ex.reason());
        assertEquals(new DocumentSnapshot("doc", "abcdefg", 1), c.snapshot());
        assertEquals(1, sink.published.size());
    }

    // ---------- side effects ----------

    @Test
    void accepted_operations_are_broadcast_in_version_order() {
        var c = coordinator("");
        c.submit(ins(0, "a", "alice", 1, "op-1"), 0);
        c.submit(ins(0, "b", "bob", 1, "op-2"), 0);

        assertEquals(2, sink.published.size());
        assertEquals(1, sink.published.get(0).result().version());
        assertEquals(2, sink.published.get(1).result().version());
        assertEquals("doc", sink.published.get(1).documentId());
    }

    @Test
    void broadcast_failure_does_not_undo_the_apply() {
        BroadcastSink failing = (id, r) -> {
            throw new IllegalStateException("socket gone");
        };
        var c = coordinator("abc", CoordinatorOptions.defaults(), new DefaultTransformEngine(), failing);

        SubmitResult r = c.submit(ins(0, "x", "alice", 1, "op-1"), 0);

        assertEquals(1, r.version());
        assertEquals("xabc", c.snapshot().content());
    }

    @Test
    void snapshot_policy_persists_every_n_operations() {
        var options = new CoordinatorOptions(16, 2, Duration.ofMinutes(1), true);
        var c = coordinator("", options);

        c.submit(ins(0, "a", "alice", 1, "op-1"), 0);
        assertTrue(store.load("doc").isEmpty());

        c.submit(ins(1, "b", "alice", 2, "op-2"), 1);
        assertEquals(new DocumentSnapshot("doc", "ab", 2), store.load("doc").orElseThrow());
    }

    // ---------- poisoning ----------

    @Test
    void invariant_violation_poisons_until_reset() {
        TransformEngine broken = new TransformEngine() {
            @Override
            public Operation transform(Operation a, Operation b) {
                return a;
            }

            @Override
            public Operation rebase(Operation op, List<Operation> applied) {
                if (applied.isEmpty()) {
                    return op;
                }
                // Pretend a bug mapped the delete far past the end.
                return Operation.delete(100, 1, op.authorId(), op.logicalTime(), op.operationId());
            }
        };
        var c = coordinator("abc", CoordinatorOptions.defaults(), broken, sink);
        store.write(new DocumentSnapshot("doc", "persisted", 7));

        c.submit(ins(0, "x", "alice", 1, "op-1"), 0);
        assertThrows(InternalInvariantViolationException.class,
                () -> c.submit(Operation.delete(0, 1, "bob", 1, "op-2"), 0));

        // Poisoned: even a fresh operation at the head is refused.
        assertThrows(InternalInvariantViolationException.class,
                () -> c.submit(ins(0, "y", "carol", 1, "op-3"), 1));
        assertEquals("xabc", c.snapshot().content(), "failed apply left content untouched");

        DocumentSnapshot restored = c.reset();
        assertEquals(new DocumentSnapshot("doc", "persisted", 7), restored);
        assertEquals(8, c.submit(ins(0, "y", "carol", 1, "op-3"), 7).version());
    }

    @Test
    void reset_of_a_healthy_document_keeps_its_state() {
        var c = coordinator("abc");
        c.submit(ins(0, "x", "alice", 1, "op-1"), 0);

        assertEquals(new DocumentSnapshot("doc", "xabc", 1), c.reset());
    }

    // ---------- locking ----------

    @Test
    void submit_times_out_while_document_is_busy_and_leaves_state_alone() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        BroadcastSink slow = (id, r) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        var c = coordinator("abc", CoordinatorOptions.defaults(), new DefaultTransformEngine(), slow);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<SubmitResult> holder = pool.submit(() -> c.submit(ins(0, "x", "alice", 1, "op-1"), 0));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertThrows(SubmitTimeoutException.class,
                    () -> c.submit(ins(0, "y", "bob", 1, "op-2"), 0, Duration.ofMillis(50)));

            release.countDown();
            assertEquals(1, holder.get(5, TimeUnit.SECONDS).version());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }

        assertEquals(new DocumentSnapshot("doc", "xabc", 1), c.snapshot());
        assertEquals(2, c.submit(ins(0, "y", "bob", 1, "op-2"), 0, Duration.ofSeconds(1)).version());
    }

    @Test
    void concurrent_submitters_are_serialized() throws Exception {
        int threads = 8;
        int perThread = 50;
        var c = coordinator("", CoordinatorOptions.defaults().withHistoryWindow(threads * perThread));

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String author = "author-" + t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        // Every client edits blind against the empty base.
                        c.submit(ins(0, "x", author, i, author + "-" + i), 0);
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        DocumentSnapshot s = c.snapshot();
        assertEquals(threads * perThread, s.version());
        assertEquals("x".repeat(threads * perThread), s.content());

        long[] versions = sink.published.stream().mapToLong(p -> p.result().version()).toArray();
        for (int i = 0; i < versions.length; i++) {
            assertEquals(i + 1, versions[i], "broadcast order follows version order");
        }
    }

    // ---------- lifecycle ----------

    @Test
    void close_persists_final_snapshot_and_refuses_further_use() {
        var c = coordinator("abc");
        c.submit(ins(0, "x", "alice", 1, "op-1"), 0);

        c.close();

        assertEquals(new DocumentSnapshot("doc", "xabc", 1), store.load("doc").orElseThrow());
        assertTrue(c.isClosed());
        assertThrows(CoordinatorClosedException.class, c::snapshot);
    }
}
