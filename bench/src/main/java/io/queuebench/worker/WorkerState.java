package io.queuebench.worker;

/**
 * Where a worker loop currently is. {@code STOPPED} is entered at the first loop boundary after the
 * pool's stop flag is cleared.
 */
public enum WorkerState {
    FETCHING,
    PROCESSING,
    ACKNOWLEDGING,
    BACKING_OFF,
    STOPPED
}
