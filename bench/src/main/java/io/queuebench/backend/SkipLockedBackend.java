package io.queuebench.backend;

import io.queuebench.model.Job;
import io.queuebench.store.RowQueueProcedures;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Row lease queue: get-next locks one pending row with {@code FOR UPDATE SKIP LOCKED} and flips it to
 * {@code processing}; the row stays in the table, invisible to other fetchers, until completed or
 * failed back to {@code pending}.
 */
public final class SkipLockedBackend implements RowQueueBackend {

    private static final Logger LOG = Logger.getLogger(SkipLockedBackend.class);

    final String workerId;
    final RowQueueProcedures procedures;

    public SkipLockedBackend(String workerId, RowQueueProcedures procedures) {
        this.workerId = workerId;
        this.procedures = procedures;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.SKIP_LOCKED;
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
        return procedures.complete(job, workerId)
                .invoke(found -> {
                    if (!found) {
                        LOG.warnf("[%s] complete found no row for job %s", workerId, job.id());
                    }
                });
    }

    @Override
    public Uni<Void> failOrRequeue(Job job, Throwable cause) {
        return procedures.fail(job, workerId, cause == null ? null : cause.getMessage());
    }
}
