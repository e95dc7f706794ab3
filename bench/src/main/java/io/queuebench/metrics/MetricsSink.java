package io.queuebench.metrics;

import io.queuebench.model.MetricsSnapshot;

import java.io.IOException;

/**
 * Append-only destination for periodic snapshots.
 */
public interface MetricsSink {

    void write(MetricsSnapshot snapshot) throws IOException;
}
