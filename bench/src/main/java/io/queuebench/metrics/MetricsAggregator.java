package io.queuebench.metrics;

import io.queuebench.model.MetricsSnapshot;
import io.queuebench.util.Ticker;

import java.time.Clock;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Run-wide latency and throughput accumulator shared by all workers.
 *
 * <p>One lock guards the sample buffer, the processed counter and the per-worker counters; they are
 * updated in the same critical section, so at any instant the processed count equals both the number
 * of stored samples and the sum of the per-worker counts. The lock is held only for the append or for
 * copying, never for sorting.</p>
 *
 * <p>Snapshots are cumulative: percentiles are exact nearest-rank values over every sample recorded
 * since creation ({@code sorted[floor(p * n)]}) and throughput is total jobs over total elapsed time.
 * Each snapshot sorts a full copy, which is O(n log n) and grows with the run length.</p>
 */
public class MetricsAggregator {

    private static final int INITIAL_CAPACITY = 4096;

    private final Lock lock = new ReentrantLock();
    private double[] samples = new double[INITIAL_CAPACITY];
    private int size;
    private long processed;
    private final Map<String, Long> processedByWorker = new HashMap<>();

    private final Clock clock;
    private final Ticker ticker;
    private final long createdAtNanos;

    public MetricsAggregator() {
        this(Clock.systemUTC(), Ticker.SYSTEM);
    }

    public MetricsAggregator(Clock clock, Ticker ticker) {
        this.clock = clock;
        this.ticker = ticker;
        this.createdAtNanos = ticker.nanoTime();
    }

    /**
     * Records the latency of one job completed by {@code workerId}.
     */
    public void record(String workerId, double latencyMs) {
        lock.lock();
        try {
            ensureCapacity(1);
            samples[size++] = latencyMs;
            processed++;
            processedByWorker.merge(workerId, 1L, Long::sum);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the latencies of one acknowledged batch of {@code workerId} in a single update.
     */
    public void record(String workerId, Collection<Double> latenciesMs) {
        if (latenciesMs.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            ensureCapacity(latenciesMs.size());
            for (double v : latenciesMs) {
                samples[size++] = v;
            }
            processed += latenciesMs.size();
            processedByWorker.merge(workerId, (long) latenciesMs.size(), Long::sum);
        } finally {
            lock.unlock();
        }
    }

    public long processed() {
        lock.lock();
        try {
            return processed;
        } finally {
            lock.unlock();
        }
    }

    public long processed(String workerId) {
        lock.lock();
        try {
            return processedByWorker.getOrDefault(workerId, 0L);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Long> processedByWorker() {
        lock.lock();
        try {
            return Map.copyOf(processedByWorker);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the cumulative snapshot, or empty while nothing has been recorded
     */
    public Optional<MetricsSnapshot> snapshot() {
        double[] copy;
        long jobs;
        Map<String, Long> byWorker;
        lock.lock();
        try {
            copy = Arrays.copyOf(samples, size);
            jobs = processed;
            byWorker = Map.copyOf(processedByWorker);
        } finally {
            lock.unlock();
        }
        double elapsed = (ticker.nanoTime() - createdAtNanos) / 1e9;
        int n = copy.length;
        if (n == 0) {
            return Optional.empty();
        }
        Arrays.sort(copy);
        double sum = 0;
        for (double v : copy) {
            sum += v;
        }
        return Optional.of(new MetricsSnapshot(
                clock.instant(),
                elapsed,
                jobs,
                elapsed > 0 ? jobs / elapsed : 0.0,
                percentile(copy, 0.50),
                percentile(copy, 0.95),
                percentile(copy, 0.99),
                copy[0],
                copy[n - 1],
                sum / n,
                byWorker));
    }

    /**
     * Nearest-rank percentile over an ascending array: {@code sorted[floor(p * n)]}, clamped to the last
     * element.
     */
    public static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("no samples");
        }
        int idx = (int) Math.floor(p * sorted.length);
        return sorted[Math.min(Math.max(idx, 0), sorted.length - 1)];
    }

    private void ensureCapacity(int extra) {
        long needed = (long) size + extra;
        if (needed > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("latency sample buffer full");
        }
        if (needed > samples.length) {
            int cap = samples.length;
            while (cap < needed) {
                cap = (int) Math.min((long) cap * 2, Integer.MAX_VALUE - 8);
            }
            samples = Arrays.copyOf(samples, cap);
        }
    }
}
