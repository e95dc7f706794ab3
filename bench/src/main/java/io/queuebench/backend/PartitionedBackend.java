package io.queuebench.backend;

import io.queuebench.model.Job;
import io.queuebench.store.RowQueueProcedures;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Partition-sharded row lease queue. One fetch is a poll cycle over the partitions this worker owns,
 * in order, returning the first job found. The cycle starts one partition further each time so a busy
 * low partition cannot starve the others.
 *
 * <p>An error on one partition is logged and the cycle moves on to the next partition.</p>
 */
public final class PartitionedBackend implements RowQueueBackend {

    private static final Logger LOG = Logger.getLogger(PartitionedBackend.class);

    final String workerId;
    final RowQueueProcedures procedures;
    final List<Integer> partitions;
    private int cursor;

    public PartitionedBackend(String workerId, RowQueueProcedures procedures, List<Integer> partitions) {
        if (partitions.isEmpty()) {
            throw new IllegalArgumentException("worker " + workerId + " owns no partitions");
        }
        this.workerId = workerId;
        this.procedures = procedures;
        this.partitions = List.copyOf(partitions);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.PARTITIONED;
    }

    @Override
    public String workerId() {
        return workerId;
    }

    @Override
    public Uni<List<Job>> fetch() {
        int start = cursor;
        cursor = (cursor + 1) % partitions.size();
        return tryPartition(start, 0);
    }

    private Uni<List<Job>> tryPartition(int start, int attempt) {
        if (attempt >= partitions.size()) {
            return Uni.createFrom().item(List.of());
        }
        int partition = partitions.get((start + attempt) % partitions.size());
        return procedures.getNext(workerId, partition)
                .onFailure().invoke(e ->
                        LOG.errorf("[%s] Error fetching from partition %d: %s", workerId, partition, e.getMessage()))
                .onFailure().recoverWithItem(Optional.empty())
                .onItem().transformToUni(job -> job.isPresent()
                        ? Uni.createFrom().item(List.of(job.get()))
                        : tryPartition(start, attempt + 1));
    }

    /**
     * Completes the job in the partition it was fetched from.
     */
    @Override
    public Uni<Boolean> acknowledge(Job job) {
        if (job.partitionKey() == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("job " + job.id() + " has no partition key"));
        }
        return procedures.complete(job, workerId)
                .invoke(found -> {
                    if (!found) {
                        LOG.warnf("[%s] complete found no row for %d:%s", workerId, job.partitionKey(), job.id());
                    }
                });
    }

    @Override
    public Uni<Void> failOrRequeue(Job job, Throwable cause) {
        return procedures.fail(job, workerId, cause == null ? null : cause.getMessage());
    }
}
