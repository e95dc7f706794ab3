package io.queuebench.producer;

import io.queuebench.model.Job;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Write side of a queue store, held open by the producer for the whole run.
 */
public interface JobSink extends AutoCloseable {

    /**
     * Writes a batch. When the returned {@link Uni} fails, none of the batch counts as produced.
     */
    Uni<Void> appendBatch(List<Job> jobs);

    @Override
    void close();
}
