package io.queuebench.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Unit of work moved through a queue backend.
 *
 * <p>{@code id} is store-assigned (row id or stream entry id) once the job has been read back from a
 * backend; jobs created by the producer carry the producer sequence number instead.
 * {@code partitionKey} is {@code null} for every variant except the partitioned row queue.</p>
 *
 * <p>Equality compares the payload by content.</p>
 */
public record Job(String id, byte[] payload, int priority, Instant enqueuedAt, Integer partitionKey) {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 10;

    public Job {
        if (id == null) throw new IllegalArgumentException("id is required");
        if (payload == null) throw new IllegalArgumentException("payload is required");
        if (enqueuedAt == null) throw new IllegalArgumentException("enqueuedAt is required");
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("priority out of range: " + priority);
        }
    }

    public String payloadText() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    /**
     * Milliseconds between enqueue and {@code completedAt}.
     */
    public double latencyMillis(Instant completedAt) {
        long nanos = java.time.Duration.between(enqueuedAt, completedAt).toNanos();
        return nanos / 1_000_000.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Job)) return false;
        Job other = (Job) o;
        return priority == other.priority
                && id.equals(other.id)
                && Arrays.equals(payload, other.payload)
                && enqueuedAt.equals(other.enqueuedAt)
                && Objects.equals(partitionKey, other.partitionKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, Arrays.hashCode(payload), priority, enqueuedAt, partitionKey);
    }

    @Override
    public String toString() {
        return "Job[id=" + id + ", priority=" + priority + ", partition=" + partitionKey
                + ", enqueuedAt=" + enqueuedAt + ", payloadBytes=" + payload.length + "]";
    }
}
