package io.queuebench.backend;

import io.queuebench.model.Job;
import io.queuebench.store.RowQueueProcedures;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Remove-and-return queue: get-next deletes the row and returns its full contents in one statement,
 * so there is no in-flight state in the store. Acknowledge writes the already removed job to the
 * archive table; a failed job is re-inserted with its original contents.
 *
 * <p>A worker crashing between fetch and acknowledge loses the job from the queue table. This is the
 * trade the design makes for having no lease to expire.</p>
 */
public final class DeleteReturningBackend implements RowQueueBackend {

    final String workerId;
    final RowQueueProcedures procedures;

    public DeleteReturningBackend(String workerId, RowQueueProcedures procedures) {
        this.workerId = workerId;
        this.procedures = procedures;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.DELETE_RETURNING;
    }

    @Override
    public String workerId() {
        return workerId;
    }

    @Override
    public Uni<List<Job>> fetch() {
        return procedures.getNext(workerId, null)
                .onItem().transform(job -> job.map(List::of).orElse(List.of()));
    }

    @Override
    public Uni<Boolean> acknowledge(Job job) {
        return procedures.complete(job, workerId);
    }

    @Override
    public Uni<Void> failOrRequeue(Job job, Throwable cause) {
        return procedures.fail(job, workerId, cause == null ? null : cause.getMessage());
    }
}
