package io.queuebench;

import io.queuebench.backend.BackendKind;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Benchmark parameters, captured once at startup and passed down to every component.
 */
public record BenchmarkConfig(
        Role role,
        BackendKind backend,
        int workers,
        int producerRate,
        Duration producerDuration,
        int payloadBytes,
        Duration processingTime,
        Duration pgPollInterval,
        int partitions,
        String streamName,
        String streamGroup,
        int streamBatchSize,
        Duration streamPollInterval,
        int reclaimEvery,
        Duration reclaimIdle,
        int reclaimScanCount,
        Duration metricsInterval,
        Path metricsOutput) {

    public enum Role {
        WORKERS, PRODUCER
    }

    public BenchmarkConfig {
        requirePositive("workers", workers);
        requirePositive("producerRate", producerRate);
        requirePositive("partitions", partitions);
        requirePositive("streamBatchSize", streamBatchSize);
        requirePositive("reclaimEvery", reclaimEvery);
        requirePositive("reclaimScanCount", reclaimScanCount);
        if (producerDuration.isNegative() || producerDuration.isZero()) {
            throw new IllegalArgumentException("producerDuration must be positive");
        }
        if (metricsInterval.isNegative() || metricsInterval.isZero()) {
            throw new IllegalArgumentException("metricsInterval must be positive");
        }
        if (payloadBytes < 100) {
            throw new IllegalArgumentException("payloadBytes must be at least 100, got " + payloadBytes);
        }
    }

    /**
     * Fixed backoff applied after an empty fetch. The stream variant waits inside its blocking read
     * instead, so its backoff is zero.
     */
    public Duration emptyBackoff() {
        return backend.streamStore() ? Duration.ZERO : pgPollInterval;
    }

    /**
     * Fixed backoff applied after a failed iteration: the variant's poll interval.
     */
    public Duration errorBackoff() {
        return backend.streamStore() ? streamPollInterval : pgPollInterval;
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got " + value);
        }
    }
}
