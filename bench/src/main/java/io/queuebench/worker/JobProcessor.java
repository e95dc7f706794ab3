package io.queuebench.worker;

import io.queuebench.model.Job;
import io.smallrye.mutiny.Uni;

/**
 * Work performed on each fetched job between fetch and acknowledge.
 */
@FunctionalInterface
public interface JobProcessor {

    Uni<Void> process(Job job);
}
