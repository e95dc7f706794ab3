package io.queuebench.backend;

import io.queuebench.producer.JobSink;
import io.smallrye.mutiny.Uni;

import java.util.function.Function;

/**
 * Opens store sessions for workers and for the producer.
 */
public interface BackendFactory {

    /**
     * Round trip to the configured store; fails if it cannot be reached.
     */
    Uni<Void> verifyConnectivity();

    /**
     * Acquires a private session for worker {@code workerIndex}, builds the configured backend variant on
     * it and runs {@code session}. The session is released when the returned {@link Uni} terminates.
     */
    Uni<Void> withBackend(int workerIndex, Function<QueueBackend, Uni<Void>> session);

    /**
     * Opens the producer's write session. Blocking; the caller closes the sink.
     */
    JobSink openSink();

    static String workerId(int workerIndex) {
        return "worker_" + workerIndex;
    }
}
