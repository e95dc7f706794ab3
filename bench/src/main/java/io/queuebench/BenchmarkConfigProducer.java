package io.queuebench;

import io.queuebench.backend.BackendKind;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Reads {@code bench.*} configuration once and exposes it as an immutable {@link BenchmarkConfig}.
 */
@ApplicationScoped
public class BenchmarkConfigProducer {

    @ConfigProperty(name = "bench.role", defaultValue = "workers")
    String role;

    @ConfigProperty(name = "bench.backend", defaultValue = "skip_locked")
    String backend;

    @ConfigProperty(name = "bench.workers", defaultValue = "10")
    int workers;

    @ConfigProperty(name = "bench.producer.rate", defaultValue = "1000")
    int producerRate;

    @ConfigProperty(name = "bench.producer.duration-seconds", defaultValue = "180")
    long producerDurationSeconds;

    @ConfigProperty(name = "bench.job.payload-bytes", defaultValue = "512")
    int payloadBytes;

    @ConfigProperty(name = "bench.job.processing-ms", defaultValue = "5")
    long processingMs;

    @ConfigProperty(name = "bench.pg.poll-interval-ms", defaultValue = "10")
    long pgPollIntervalMs;

    @ConfigProperty(name = "bench.pg.partitions", defaultValue = "16")
    int partitions;

    @ConfigProperty(name = "bench.stream.name", defaultValue = "bench_queue")
    String streamName;

    @ConfigProperty(name = "bench.stream.group", defaultValue = "bench_workers")
    String streamGroup;

    @ConfigProperty(name = "bench.stream.batch-size", defaultValue = "50")
    int streamBatchSize;

    @ConfigProperty(name = "bench.stream.poll-interval-ms", defaultValue = "100")
    long streamPollIntervalMs;

    @ConfigProperty(name = "bench.stream.reclaim-every", defaultValue = "10")
    int reclaimEvery;

    @ConfigProperty(name = "bench.stream.reclaim-idle-ms", defaultValue = "5000")
    long reclaimIdleMs;

    @ConfigProperty(name = "bench.stream.reclaim-scan-count", defaultValue = "10")
    int reclaimScanCount;

    @ConfigProperty(name = "bench.metrics.interval-seconds", defaultValue = "1")
    long metricsIntervalSeconds;

    @ConfigProperty(name = "bench.metrics.output", defaultValue = "metrics.jsonl")
    String metricsOutput;

    @Produces
    @Singleton
    BenchmarkConfig benchmarkConfig() {
        return new BenchmarkConfig(
                BenchmarkConfig.Role.valueOf(role.trim().toUpperCase(Locale.ROOT)),
                BackendKind.fromConfigName(backend),
                workers,
                producerRate,
                Duration.ofSeconds(producerDurationSeconds),
                payloadBytes,
                Duration.ofMillis(processingMs),
                Duration.ofMillis(pgPollIntervalMs),
                partitions,
                streamName,
                streamGroup,
                streamBatchSize,
                Duration.ofMillis(streamPollIntervalMs),
                reclaimEvery,
                Duration.ofMillis(reclaimIdleMs),
                reclaimScanCount,
                Duration.ofSeconds(metricsIntervalSeconds),
                Path.of(metricsOutput));
    }
}
