package io.queuebench.backend;

import io.queuebench.model.Job;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Row-store queue variants, which can hand a failed job back to the store.
 */
public sealed interface RowQueueBackend extends QueueBackend
        permits SkipLockedBackend, DeleteReturningBackend, PartitionedBackend {

    /**
     * @return {@code true} if the store still held the job
     */
    Uni<Boolean> acknowledge(Job job);

    /**
     * Rejects a fetched job and makes it visible again.
     */
    Uni<Void> failOrRequeue(Job job, Throwable cause);

    @Override
    default Uni<Integer> acknowledge(List<Job> jobs) {
        return Multi.createFrom().iterable(jobs)
                .onItem().transformToUniAndConcatenate(this::acknowledge)
                .collect().asList()
                .onItem().transform(found -> (int) found.stream().filter(Boolean.TRUE::equals).count());
    }
}
