package io.queuebench.backend;

import io.queuebench.model.Job;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Fetch/acknowledge contract shared by every queue design under benchmark.
 *
 * <p>Delivery is at-least-once: a job fetched but never acknowledged (worker crash, lease expiry,
 * pending entry reclaimed) may be delivered again. An instance is bound to one worker and owns that
 * worker's session with the store; it is never shared between workers.</p>
 */
public sealed interface QueueBackend permits RowQueueBackend, StreamGroupBackend {

    BackendKind kind();

    String workerId();

    /**
     * Fetches the next delivery for this worker.
     *
     * @return zero or one job for the row variants, up to the batch size for the stream variant;
     * an empty list means nothing was available
     */
    Uni<List<Job>> fetch();

    /**
     * Acknowledges jobs from one fetch. Row variants issue one stored call per job, the stream variant
     * a single batched call.
     *
     * @return how many of {@code jobs} the store confirmed; jobs it no longer held for this worker (a
     * reclaimed stream entry already acknowledged elsewhere, a lease row gone) are not counted
     */
    Uni<Integer> acknowledge(List<Job> jobs);
}
