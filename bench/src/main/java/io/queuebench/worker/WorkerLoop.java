package io.queuebench.worker;

import io.queuebench.backend.QueueBackend;
import io.queuebench.backend.RowQueueBackend;
import io.queuebench.metrics.MetricsAggregator;
import io.queuebench.model.Job;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * One consumer driving one {@link QueueBackend}.
 *
 * <p>Each iteration walks {@code FETCHING -> PROCESSING -> ACKNOWLEDGING}, or
 * {@code FETCHING -> BACKING_OFF} when the fetch is empty or fails. Jobs of one fetch are processed
 * in order; the ones that succeeded are acknowledged together and their latencies reach the
 * aggregator in one update after the acknowledge succeeded. Only as many samples as the store
 * confirmed are recorded, so an entry that was reclaimed and acknowledged elsewhere meanwhile is
 * counted once. A job whose processing failed is handed back to row stores and left pending on the
 * stream store.</p>
 *
 * <p>The stop flag is read between iterations only, so a fetched batch is always finished.</p>
 */
public class WorkerLoop {

    private static final Logger LOG = Logger.getLogger(WorkerLoop.class);

    final QueueBackend backend;
    final JobProcessor processor;
    final MetricsAggregator metrics;
    final Duration emptyBackoff;
    final Duration errorBackoff;
    final BooleanSupplier running;
    final Clock clock;

    private volatile WorkerState state = WorkerState.FETCHING;
    private final AtomicLong failed = new AtomicLong();

    public WorkerLoop(QueueBackend backend, JobProcessor processor, MetricsAggregator metrics,
                      Duration emptyBackoff, Duration errorBackoff, BooleanSupplier running, Clock clock) {
        this.backend = backend;
        this.processor = processor;
        this.metrics = metrics;
        this.emptyBackoff = emptyBackoff;
        this.errorBackoff = errorBackoff;
        this.running = running;
        this.clock = clock;
    }

    public String workerId() {
        return backend.workerId();
    }

    public WorkerState state() {
        return state;
    }

    /**
     * @return jobs acknowledged by this worker id and recorded in the aggregator, read under the
     * aggregator's lock
     */
    public long completed() {
        return metrics.processed(workerId());
    }

    public long failed() {
        return failed.get();
    }

    /**
     * Runs iterations until the stop flag is cleared.
     *
     * @return completes once the loop has stopped
     */
    public Uni<Void> run() {
        LOG.infof("[%s] Started (%s)", workerId(), backend.kind().configName());
        return Multi.createBy().repeating()
                .uni(this::iteration)
                .until(ignored -> !running.getAsBoolean())
                .onItem().ignoreAsUni()
                .eventually(() -> {
                    state = WorkerState.STOPPED;
                    LOG.infof("[%s] Stopped. Processed %d jobs", workerId(), completed());
                });
    }

    /**
     * One pass of the state machine.
     *
     * @return number of jobs completed by this pass
     */
    Uni<Integer> iteration() {
        if (!running.getAsBoolean()) {
            return Uni.createFrom().item(0);
        }
        state = WorkerState.FETCHING;
        return backend.fetch()
                .onItem().transformToUni(jobs -> jobs.isEmpty()
                        ? backOff(emptyBackoff).replaceWith(0)
                        : processAndAcknowledge(jobs))
                .onFailure().invoke(e -> LOG.errorf("[%s] Error processing job: %s", workerId(), e.getMessage()))
                .onFailure().recoverWithUni(() -> backOff(errorBackoff).replaceWith(0));
    }

    private Uni<Integer> processAndAcknowledge(List<Job> jobs) {
        state = WorkerState.PROCESSING;
        return Multi.createFrom().iterable(jobs)
                .onItem().transformToUniAndConcatenate(job -> processor.process(job)
                        .onItem().transform(v -> Outcome.done(job, job.latencyMillis(clock.instant())))
                        .onFailure().recoverWithUni(err -> handleFailure(job, err)))
                .collect().asList()
                .onItem().transformToUni(this::acknowledge);
    }

    private Uni<Outcome> handleFailure(Job job, Throwable err) {
        failed.incrementAndGet();
        LOG.errorf("[%s] Error processing job %s: %s", workerId(), job.id(), err.getMessage());
        if (backend instanceof RowQueueBackend) {
            return ((RowQueueBackend) backend).failOrRequeue(job, err)
                    .onFailure().invoke(e2 ->
                            LOG.errorf("[%s] Requeue also failed for job %s: %s", workerId(), job.id(), e2.getMessage()))
                    .onFailure().recoverWithNull()
                    .replaceWith(Outcome.failed(job));
        }
        // stream entries stay pending and come back through reclamation
        return Uni.createFrom().item(Outcome.failed(job));
    }

    private Uni<Integer> acknowledge(List<Outcome> outcomes) {
        List<Job> done = new ArrayList<>(outcomes.size());
        List<Double> latencies = new ArrayList<>(outcomes.size());
        for (Outcome o : outcomes) {
            if (o.ok()) {
                done.add(o.job());
                latencies.add(o.latencyMs());
            }
        }
        if (done.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        state = WorkerState.ACKNOWLEDGING;
        // the store reports how many it removed, not which; samples are taken from the front of the batch
        return backend.acknowledge(done)
                .onItem().transform(acked -> {
                    int counted = Math.max(0, Math.min(acked, latencies.size()));
                    metrics.record(workerId(), latencies.subList(0, counted));
                    return counted;
                });
    }

    private Uni<Void> backOff(Duration d) {
        state = WorkerState.BACKING_OFF;
        if (d.isZero() || d.isNegative()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom().voidItem()
                .onItem().delayIt().by(d);
    }

    private record Outcome(Job job, boolean ok, double latencyMs) {

        static Outcome done(Job job, double latencyMs) {
            return new Outcome(job, true, latencyMs);
        }

        static Outcome failed(Job job) {
            return new Outcome(job, false, 0);
        }
    }
}
