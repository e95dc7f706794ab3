package io.queuebench.store;

import io.queuebench.model.Job;
import io.smallrye.mutiny.Uni;

import java.util.Optional;

/**
 * Stored operations exposed by a row-store queue: get-next, complete and fail/requeue.
 *
 * <p>Implementations are bound to one session and must not be shared between workers.</p>
 */
public interface RowQueueProcedures {

    /**
     * Claims the next visible job.
     *
     * @param workerId     identity recorded against the claim
     * @param partitionKey partition to read from, or {@code null} for unpartitioned variants
     * @return the claimed job, or empty when nothing is visible
     */
    Uni<Optional<Job>> getNext(String workerId, Integer partitionKey);

    /**
     * Marks a claimed job as done.
     *
     * @return {@code true} if the store found the job
     */
    Uni<Boolean> complete(Job job, String workerId);

    /**
     * Rejects a claimed job so it becomes visible again (or is retired by the store once its attempts
     * are exhausted).
     */
    Uni<Void> fail(Job job, String workerId, String error);
}
