package io.queuebench.worker;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

import io.queuebench.backend.DeleteReturningBackend;
import io.queuebench.backend.PendingReclaimer;
import io.queuebench.backend.QueueBackend;
import io.queuebench.backend.SkipLockedBackend;
import io.queuebench.backend.StreamGroupBackend;
import io.queuebench.metrics.MetricsAggregator;
import io.queuebench.model.Job;
import io.queuebench.store.InMemoryRowQueue;
import io.queuebench.store.InMemoryStreamStore;
import io.queuebench.store.RowQueueTable;
import io.queuebench.store.StreamEntry;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

class WorkerLoopTest {

    private static final Duration T = Duration.ofSeconds(5);
    private static final Duration BACKOFF = Duration.ofMillis(1);

    private final MetricsAggregator metrics = new MetricsAggregator();
    private final AtomicBoolean running = new AtomicBoolean(true);

    private WorkerLoop loop(QueueBackend backend, JobProcessor processor) {
        return new WorkerLoop(backend, processor, metrics, BACKOFF, BACKOFF, running::get, Clock.systemUTC());
    }

    private static int iterate(WorkerLoop loop) {
        return loop.iteration().await().atMost(T);
    }

    private InMemoryStreamStore streamWith(int entries) {
        InMemoryStreamStore store = new InMemoryStreamStore();
        store.createGroup().await().atMost(T);
        for (int i = 0; i < entries; i++) {
            store.append(Map.of(
                    StreamEntry.FIELD_PAYLOAD, "{\"n\":" + i + "}",
                    StreamEntry.FIELD_PRIORITY, "1",
                    StreamEntry.FIELD_CREATED_AT, Instant.now().minusMillis(20).toString())).await().atMost(T);
        }
        return store;
    }

    private StreamGroupBackend streamBackend(InMemoryStreamStore store) {
        return streamBackend("worker_0", store, 100);
    }

    private StreamGroupBackend streamBackend(String workerId, InMemoryStreamStore store, int reclaimEvery) {
        return new StreamGroupBackend(workerId, store, 10, Duration.ofMillis(5),
                new PendingReclaimer(store, Duration.ofSeconds(30), 100), reclaimEvery);
    }

    @Test
    @DisplayName("Empty fetch backs off and completes nothing")
    void emptyFetchBacksOff() {
        InMemoryRowQueue q = new InMemoryRowQueue(RowQueueTable.SKIP_LOCKED);
        WorkerLoop loop = loop(new SkipLockedBackend("worker_0", q), new SimulatedProcessor(Duration.ZERO));

        assertEquals(0, iterate(loop));
        assertEquals(WorkerState.BACKING_OFF, loop.state());
        assertEquals(0, metrics.processed());
    }

    @Test
    @DisplayName("A fetched batch is processed, acked once and recorded once")
    void batchIsAckedAndRecorded() {
        InMemoryStreamStore store = streamWith(3);
        WorkerLoop loop = loop(streamBackend(store), new SimulatedProcessor(Duration.ZERO));

        assertEquals(3, iterate(loop));
        assertEquals(1, store.acknowledgeCalls());
        assertEquals(0, store.pendingCount());
        assertEquals(3, metrics.processed());
        assertEquals(3, loop.completed());
        assertTrue(metrics.snapshot().orElseThrow().min() >= 20.0, "latency measured from enqueue time");
    }

    @Test
    @DisplayName("Partial batch failure acks the rest and leaves the failed entry pending")
    void partialBatchFailureOnStream() {
        InMemoryStreamStore store = streamWith(3);
        AtomicInteger calls = new AtomicInteger();
        JobProcessor failSecond = job -> calls.incrementAndGet() == 2
                ? Uni.createFrom().failure(new IllegalStateException("bad job"))
                : Uni.createFrom().voidItem();
        WorkerLoop loop = loop(streamBackend(store), failSecond);

        assertEquals(2, iterate(loop));
        assertEquals(1, loop.failed());
        assertEquals(2, metrics.processed());
        assertEquals(1, store.pendingCount());
        assertEquals("worker_0", store.ownerOf(store.ids().get(1)));
    }

    @Test
    @DisplayName("An entry reclaimed and acked by another worker is counted once")
    void reclaimedEntryIsCountedOnce() throws Exception {
        InMemoryStreamStore store = streamWith(1);
        String id = store.ids().get(0);
        CompletableFuture<Void> release = new CompletableFuture<>();
        AtomicBoolean slowStarted = new AtomicBoolean();
        WorkerLoop slow = loop(streamBackend("worker_0", store, 100), job -> {
            slowStarted.set(true);
            return Uni.createFrom().completionStage(release);
        });
        WorkerLoop fast = loop(streamBackend("worker_1", store, 1), new SimulatedProcessor(Duration.ZERO));

        CompletableFuture<Integer> slowIteration = slow.iteration().subscribeAsCompletionStage();
        await().atMost(T).untilTrue(slowStarted);
        store.advance(Duration.ofSeconds(31));

        assertEquals(1, iterate(fast));
        release.complete(null);
        assertEquals(Integer.valueOf(0), slowIteration.get(5, TimeUnit.SECONDS));

        assertEquals(Integer.valueOf(2), store.acks().get(id));
        assertEquals(1, metrics.processed());
        assertEquals(1, fast.completed());
        assertEquals(0, slow.completed());
    }

    @Test
    @DisplayName("A failed row job is handed back to the store")
    void failedRowJobIsRequeued() {
        InMemoryRowQueue q = new InMemoryRowQueue(RowQueueTable.SKIP_LOCKED);
        Job job = q.enqueue(null);
        WorkerLoop loop = loop(new SkipLockedBackend("worker_0", q),
                j -> Uni.createFrom().failure(new IllegalStateException("bad job")));

        assertEquals(0, iterate(loop));
        assertEquals(1, q.fails());
        assertEquals(1, q.pendingCount());
        assertFalse(q.completions().containsKey(job.id()));
        assertEquals(0, metrics.processed());
    }

    @Test
    @DisplayName("Fetch errors are absorbed with a backoff")
    void fetchErrorDoesNotEscape() {
        InMemoryRowQueue q = new InMemoryRowQueue(RowQueueTable.SKIP_LOCKED);
        q.enqueue(null);
        q.failNextGets(1);
        WorkerLoop loop = loop(new SkipLockedBackend("worker_0", q), new SimulatedProcessor(Duration.ZERO));

        assertEquals(0, iterate(loop));
        assertEquals(WorkerState.BACKING_OFF, loop.state());
        assertEquals(1, iterate(loop));
    }

    @Test
    @DisplayName("Latencies are not recorded when the acknowledge fails")
    void failedAckRecordsNothing() {
        InMemoryStreamStore store = streamWith(2);
        JobProcessor dropGroupWhileProcessing = job -> {
            store.dropGroup();
            return Uni.createFrom().voidItem();
        };
        WorkerLoop loop = loop(streamBackend(store), dropGroupWhileProcessing);

        assertEquals(0, iterate(loop));
        assertEquals(0, metrics.processed());
        assertEquals(0, loop.completed());
    }

    @Test
    @DisplayName("Run drains the queue and stops when the flag clears")
    void runUntilStopped() {
        InMemoryRowQueue q = new InMemoryRowQueue(RowQueueTable.DELETE_RETURNING);
        for (int i = 0; i < 25; i++) {
            q.enqueue(null);
        }
        JobProcessor stopWhenDrained = job -> {
            if (q.pendingCount() == 0) {
                running.set(false);
            }
            return Uni.createFrom().voidItem();
        };
        WorkerLoop loop = loop(new DeleteReturningBackend("worker_0", q), stopWhenDrained);

        loop.run().await().atMost(T);
        assertEquals(WorkerState.STOPPED, loop.state());
        assertEquals(25, loop.completed());
        assertEquals(25, q.completions().size());
    }
}
