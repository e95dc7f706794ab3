package io.queuebench.producer;

import io.queuebench.model.Job;
import io.queuebench.util.Ticker;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Open-loop producer emitting {@code rate * duration} jobs at a sustained target rate.
 *
 * <p>Jobs go out in batches sized for roughly 100 batches per second. Batch deadlines advance by a
 * fixed interval from the start time rather than from "now", so a slow batch is followed by
 * back-to-back batches until the schedule is caught up. Consumer speed never slows the producer.</p>
 *
 * <p>{@link #run} blocks the calling thread; it returns when the target is reached, when
 * {@link #stop()} is called or when the thread is interrupted.</p>
 */
public class RateLimitedProducer {

    private static final Logger LOG = Logger.getLogger(RateLimitedProducer.class);

    static final int BATCHES_PER_SECOND = 100;
    static final int PROGRESS_EVERY_SECONDS = 10;

    final Supplier<JobSink> sinkOpener;
    final PayloadGenerator generator;
    final Ticker ticker;
    final Clock clock;
    final Duration batchTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RateLimitedProducer(Supplier<JobSink> sinkOpener, PayloadGenerator generator, Ticker ticker,
                               Clock clock, Duration batchTimeout) {
        this.sinkOpener = sinkOpener;
        this.generator = generator;
        this.ticker = ticker;
        this.clock = clock;
        this.batchTimeout = batchTimeout;
    }

    public static int batchSize(int targetRate) {
        return Math.max(1, targetRate / BATCHES_PER_SECOND);
    }

    /**
     * Opens a sink, produces until the target count is reached and closes the sink.
     *
     * @throws RuntimeException if the sink cannot be opened; nothing has been produced in that case
     */
    public ProducerReport run(int targetRate, Duration duration) {
        if (targetRate < 1) throw new IllegalArgumentException("targetRate must be >= 1");
        if (duration.isNegative() || duration.isZero()) throw new IllegalArgumentException("duration must be positive");
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("producer already running");
        }
        try {
            JobSink sink = sinkOpener.get();
            try {
                return produce(sink, targetRate, duration);
            } finally {
                closeKeepingInterrupt(sink);
            }
        } finally {
            running.set(false);
        }
    }

    /**
     * Sinks close by awaiting their session, which fails at once on an interrupted thread. The flag is
     * cleared for the close and restored afterwards.
     */
    private static void closeKeepingInterrupt(JobSink sink) {
        boolean interrupted = Thread.interrupted();
        try {
            sink.close();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Asks a running producer to finish after the current batch.
     */
    public void stop() {
        running.set(false);
    }

    private ProducerReport produce(JobSink sink, int targetRate, Duration duration) {
        long total = (long) targetRate * duration.toSeconds();
        int batchSize = batchSize(targetRate);
        long intervalNanos = Math.round(batchSize * 1_000_000_000.0 / targetRate);
        long progressEvery = (long) targetRate * PROGRESS_EVERY_SECONDS;

        LOG.infof("Starting producer: rate=%d jobs/sec, duration=%ds, total=%d, batch=%d",
                targetRate, duration.toSeconds(), total, batchSize);

        long start = ticker.nanoTime();
        long nextBatchAt = start;
        long produced = 0;
        long failedBatches = 0;
        long sequence = 0;
        boolean interrupted = false;
        try {
            while (produced < total && running.get()) {
                int n = (int) Math.min(batchSize, total - produced);
                Instant now = clock.instant();
                List<Job> batch = new ArrayList<>(n);
                for (int i = 0; i < n; i++) {
                    batch.add(generator.next(sequence++, now));
                }

                try {
                    sink.appendBatch(batch).await().atMost(batchTimeout);
                    long before = produced;
                    produced += n;
                    if (produced / progressEvery > before / progressEvery) {
                        double elapsed = (ticker.nanoTime() - start) / 1e9;
                        LOG.infof("Produced: %d/%d (%.0f jobs/sec)", produced, total, elapsed > 0 ? produced / elapsed : 0.0);
                    }
                } catch (RuntimeException e) {
                    if (e.getCause() instanceof InterruptedException) {
                        throw (InterruptedException) e.getCause();
                    }
                    failedBatches++;
                    LOG.errorf("Error producing batch: %s", e.getMessage());
                }

                nextBatchAt += intervalNanos;
                long sleep = nextBatchAt - ticker.nanoTime();
                if (sleep > 0) {
                    ticker.sleepNanos(sleep);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Producer interrupted");
            interrupted = true;
        }

        double elapsed = (ticker.nanoTime() - start) / 1e9;
        double rate = elapsed > 0 ? produced / elapsed : 0.0;
        interrupted = interrupted || produced < total;
        LOG.infof("Producer finished: produced=%d, elapsed=%.1fs, actual rate=%.0f jobs/sec, failed batches=%d",
                produced, elapsed, rate, failedBatches);
        return new ProducerReport(produced, total, elapsed, rate, failedBatches, interrupted);
    }
}
