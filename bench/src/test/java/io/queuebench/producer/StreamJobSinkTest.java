package io.queuebench.producer;

import static org.junit.jupiter.api.Assertions.*;

import io.queuebench.model.Job;
import io.queuebench.store.InMemoryStreamStore;
import io.queuebench.store.StreamEntry;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

class StreamJobSinkTest {

    private static final Duration T = Duration.ofSeconds(5);
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private static Job job(String id, int priority) {
        return new Job(id, ("{\"id\":" + id + "}").getBytes(StandardCharsets.UTF_8), priority, NOW, null);
    }

    @Test
    void appendsOneEntryPerJobWithWireFields() {
        InMemoryStreamStore store = new InMemoryStreamStore();
        store.createGroup().await().atMost(T);
        AtomicBoolean closed = new AtomicBoolean();
        try (StreamJobSink sink = new StreamJobSink(store, () -> closed.set(true))) {
            sink.appendBatch(List.of(job("1", 3), job("2", 9))).await().atMost(T);
        }
        assertTrue(closed.get());

        List<StreamEntry> entries = store.readGroup("worker_0", 10, Duration.ZERO).await().atMost(T);
        assertEquals(2, entries.size());
        Map<String, String> f = entries.get(1).fields();
        assertEquals("{\"id\":2}", f.get(StreamEntry.FIELD_PAYLOAD));
        assertEquals("9", f.get(StreamEntry.FIELD_PRIORITY));
        assertEquals(NOW.toString(), f.get(StreamEntry.FIELD_CREATED_AT));
    }

    @Test
    void batchFailsWhenAnyAppendFails() {
        AtomicInteger appends = new AtomicInteger();
        InMemoryStreamStore store = new InMemoryStreamStore() {
            @Override
            public synchronized Uni<String> append(Map<String, String> fields) {
                if (appends.incrementAndGet() == 2) {
                    return Uni.createFrom().failure(new IllegalStateException("OOM command not allowed"));
                }
                return super.append(fields);
            }
        };
        StreamJobSink sink = new StreamJobSink(store, () -> { });

        assertThrows(IllegalStateException.class,
                () -> sink.appendBatch(List.of(job("1", 0), job("2", 0), job("3", 0))).await().atMost(T));
    }
}
