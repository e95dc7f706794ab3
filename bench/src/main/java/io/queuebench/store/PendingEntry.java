package io.queuebench.store;

import java.time.Duration;

/**
 * Delivered-but-unacknowledged entry of a consumer group, with its idle time since last delivery.
 */
public record PendingEntry(String id, String consumer, Duration idle, long deliveries) {
}
