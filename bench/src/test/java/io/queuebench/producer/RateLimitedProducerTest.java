package io.queuebench.producer;

import static org.junit.jupiter.api.Assertions.*;

import io.queuebench.model.Job;
import io.queuebench.util.ManualTicker;
import io.queuebench.util.Ticker;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

class RateLimitedProducerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    /**
     * Collects successful batches; {@code onBatch} decides per batch number whether it fails.
     */
    static final class RecordingSink implements JobSink {
        final List<List<Job>> batches = new CopyOnWriteArrayList<>();
        final AtomicInteger calls = new AtomicInteger();
        final AtomicBoolean closed = new AtomicBoolean();
        final Function<Integer, Uni<Void>> onBatch;

        RecordingSink(Function<Integer, Uni<Void>> onBatch) {
            this.onBatch = onBatch;
        }

        RecordingSink() {
            this(n -> Uni.createFrom().voidItem());
        }

        @Override
        public Uni<Void> appendBatch(List<Job> jobs) {
            int n = calls.incrementAndGet();
            return onBatch.apply(n).invoke(() -> batches.add(jobs));
        }

        long jobs() {
            return batches.stream().mapToLong(List::size).sum();
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }

    private RateLimitedProducer producer(JobSink sink, Ticker ticker) {
        return new RateLimitedProducer(() -> sink, new PayloadGenerator(200, 0), ticker,
                Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("1000 jobs/sec for 10s produces 10000 jobs in 10 virtual seconds")
    void sustainedRateInVirtualTime() {
        RecordingSink sink = new RecordingSink();
        ManualTicker ticker = new ManualTicker();

        ProducerReport report = producer(sink, ticker).run(1000, Duration.ofSeconds(10));

        assertEquals(10_000, report.jobsProduced());
        assertEquals(10_000, report.targetJobs());
        assertEquals(10_000, sink.jobs());
        assertEquals(1000, sink.batches.size());
        sink.batches.forEach(b -> assertEquals(10, b.size()));
        assertEquals(10.0, report.elapsedSeconds(), 0.01);
        assertTrue(report.achievedRate() >= 900 && report.achievedRate() <= 1100, "rate " + report.achievedRate());
        assertEquals(0, report.failedBatches());
        assertFalse(report.interrupted());
        assertTrue(sink.closed.get());
        sink.batches.get(0).forEach(j -> assertEquals(NOW, j.enqueuedAt()));
    }

    @Test
    @DisplayName("Real clock: 200 jobs/sec for one second stays close to one second")
    void sustainedRateInRealTime() {
        RecordingSink sink = new RecordingSink();

        ProducerReport report = producer(sink, Ticker.SYSTEM).run(200, Duration.ofSeconds(1));

        assertEquals(200, report.jobsProduced());
        assertTrue(report.elapsedSeconds() >= 0.9 && report.elapsedSeconds() < 3.0, "elapsed " + report.elapsedSeconds());
    }

    @Test
    @DisplayName("Failed batches are not credited and production carries on")
    void failedBatchesAreNotCredited() {
        RecordingSink sink = new RecordingSink(n -> n <= 3
                ? Uni.createFrom().failure(new IllegalStateException("write failed"))
                : Uni.createFrom().voidItem());

        ProducerReport report = producer(sink, new ManualTicker()).run(100, Duration.ofSeconds(2));

        assertEquals(3, report.failedBatches());
        assertEquals(200, report.jobsProduced());
        assertEquals(200, sink.jobs());
        assertEquals(203, sink.calls.get());
        assertFalse(report.interrupted());
    }

    @Test
    @DisplayName("Stop ends the run after the current batch with a partial report")
    void stopReturnsPartialReport() {
        RateLimitedProducer[] ref = new RateLimitedProducer[1];
        RecordingSink sink = new RecordingSink(n -> {
            if (n == 5) {
                ref[0].stop();
            }
            return Uni.createFrom().voidItem();
        });
        ref[0] = producer(sink, new ManualTicker());

        ProducerReport report = ref[0].run(1000, Duration.ofSeconds(10));

        assertEquals(50, report.jobsProduced());
        assertTrue(report.interrupted());
        assertTrue(sink.closed.get());
    }

    @Test
    @DisplayName("Interruption while waiting for the schedule returns a report and keeps the flag")
    void interruptReturnsReport() {
        ManualTicker ticker = new ManualTicker();
        ticker.interruptAfterSleeps(3);
        RecordingSink sink = new RecordingSink();

        ProducerReport report = producer(sink, ticker).run(1000, Duration.ofSeconds(10));

        assertTrue(Thread.interrupted(), "interrupt flag restored");
        assertEquals(40, report.jobsProduced());
        assertTrue(report.interrupted());
        assertTrue(sink.closed.get());
    }

    @Test
    @DisplayName("Interruption still closes a sink whose close awaits its session")
    void interruptClosesAwaitingSink() {
        ManualTicker ticker = new ManualTicker();
        ticker.interruptAfterSleeps(3);
        AtomicBoolean closed = new AtomicBoolean();
        JobSink awaitingSink = new JobSink() {
            @Override
            public Uni<Void> appendBatch(List<Job> jobs) {
                return Uni.createFrom().voidItem();
            }

            @Override
            public void close() {
                Uni.createFrom().voidItem().await().indefinitely();
                closed.set(true);
            }
        };

        ProducerReport report = producer(awaitingSink, ticker).run(1000, Duration.ofSeconds(10));

        assertTrue(Thread.interrupted(), "interrupt flag restored after close");
        assertTrue(closed.get());
        assertEquals(40, report.jobsProduced());
        assertTrue(report.interrupted());
    }

    @Test
    @DisplayName("A sink that cannot be opened fails the run before producing anything")
    void sinkOpenFailurePropagates() {
        AtomicInteger opens = new AtomicInteger();
        RateLimitedProducer p = new RateLimitedProducer(() -> {
            if (opens.incrementAndGet() == 1) {
                throw new IllegalStateException("connection refused");
            }
            return new RecordingSink();
        }, new PayloadGenerator(200, 0), new ManualTicker(), Clock.systemUTC(), Duration.ofSeconds(5));

        assertThrows(IllegalStateException.class, () -> p.run(100, Duration.ofSeconds(1)));
        assertEquals(100, p.run(100, Duration.ofSeconds(1)).jobsProduced(), "producer reusable after failure");
    }

    @Test
    void rejectsBadArguments() {
        RateLimitedProducer p = producer(new RecordingSink(), new ManualTicker());
        assertThrows(IllegalArgumentException.class, () -> p.run(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> p.run(10, Duration.ZERO));
    }

    @ParameterizedTest
    @CsvSource({
            "1,1",
            "50,1",
            "100,1",
            "250,2",
            "1000,10",
            "5000,50"
    })
    void batchSizeTargetsHundredBatchesPerSecond(int rate, int expected) {
        assertEquals(expected, RateLimitedProducer.batchSize(rate));
    }
}
