package io.queuebench.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Map;

/**
 * Cumulative point-in-time view of a run: every field covers all samples recorded since the
 * aggregator was created. Serialized as one JSON line per snapshot; the per-worker counts, taken in
 * the same instant as {@code jobs_processed}, are not part of the line.
 */
@JsonPropertyOrder({"timestamp", "elapsed", "jobs_processed", "throughput",
        "latency_p50", "latency_p95", "latency_p99", "latency_min", "latency_max", "latency_avg"})
public record MetricsSnapshot(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("elapsed") double elapsedSeconds,
        @JsonProperty("jobs_processed") long jobsProcessed,
        @JsonProperty("throughput") double throughput,
        @JsonProperty("latency_p50") double p50,
        @JsonProperty("latency_p95") double p95,
        @JsonProperty("latency_p99") double p99,
        @JsonProperty("latency_min") double min,
        @JsonProperty("latency_max") double max,
        @JsonProperty("latency_avg") double avg,
        @JsonIgnore Map<String, Long> processedByWorker) {
}
