package io.queuebench.worker;

import io.queuebench.backend.BackendFactory;
import io.queuebench.metrics.MetricsAggregator;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs {@code W} independent {@link WorkerLoop}s over one backend variant.
 *
 * <p>Every worker opens its own backend session through the {@link BackendFactory} and keeps it for
 * its whole life; sessions are never shared. The only state shared between workers is the
 * {@link MetricsAggregator}. A worker whose session breaks is restarted with a fresh session while the
 * pool is running.</p>
 */
public class WorkerPool {

    private static final Logger LOG = Logger.getLogger(WorkerPool.class);

    final BackendFactory factory;
    final JobProcessor processor;
    final MetricsAggregator metrics;
    final int workers;
    final Duration emptyBackoff;
    final Duration errorBackoff;
    final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<WorkerLoop> loops = new CopyOnWriteArrayList<>();
    private final Map<Integer, CompletableFuture<Void>> runners = new ConcurrentHashMap<>();

    public WorkerPool(BackendFactory factory, JobProcessor processor, MetricsAggregator metrics, int workers,
                      Duration emptyBackoff, Duration errorBackoff, Clock clock) {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        this.factory = factory;
        this.processor = processor;
        this.metrics = metrics;
        this.workers = workers;
        this.emptyBackoff = emptyBackoff;
        this.errorBackoff = errorBackoff;
        this.clock = clock;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            LOG.warn("WorkerPool already running; start() ignored.");
            return;
        }
        for (int i = 0; i < workers; i++) {
            startRunner(i);
        }
        LOG.infof("WorkerPool started with %d worker(s), emptyBackoff=%dms, errorBackoff=%dms",
                workers, emptyBackoff.toMillis(), errorBackoff.toMillis());
    }

    private void startRunner(int idx) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        runners.put(idx, done);
        factory.withBackend(idx, backend -> {
                    WorkerLoop loop = new WorkerLoop(backend, processor, metrics,
                            emptyBackoff, errorBackoff, running::get, clock);
                    loops.add(loop);
                    return loop.run();
                })
                .subscribe().with(
                        v -> done.complete(null),
                        err -> {
                            LOG.errorf(err, "Worker %d crashed", idx);
                            if (!running.get()) {
                                done.complete(null);
                                return;
                            }
                            LOG.warnf("Restarting worker %d after crash...", idx);
                            restartDelay().subscribe().with(v -> {
                                if (running.get()) {
                                    startRunner(idx);
                                }
                                done.complete(null);
                            });
                        }
                );
    }

    private Uni<Void> restartDelay() {
        if (errorBackoff.isZero() || errorBackoff.isNegative()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom().voidItem().onItem().delayIt().by(errorBackoff);
    }

    /**
     * Clears the stop flag and waits for every worker to finish its in-flight jobs.
     *
     * @return {@code true} if all workers stopped within {@code timeout}
     */
    public boolean stop(Duration timeout) {
        running.set(false);
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (;;) {
                List<CompletableFuture<Void>> pending = runners.values().stream().filter(f -> !f.isDone()).toList();
                if (pending.isEmpty()) {
                    break;
                }
                long left = deadline - System.nanoTime();
                if (left <= 0) {
                    throw new TimeoutException();
                }
                CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new)).get(left, TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            LOG.warnf("WorkerPool stop timed out after %dms", timeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            LOG.warn("Worker completed exceptionally during stop", e.getCause());
        }
        LOG.infof("WorkerPool stopped. Total processed: %d jobs", completedJobs());
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Loops started so far, including ones replaced after a crash.
     */
    public List<WorkerLoop> loops() {
        return List.copyOf(loops);
    }

    /**
     * Sum of per-worker completed counts. A restarted worker keeps its id, so its count carries over.
     */
    public long completedJobs() {
        long sum = 0;
        for (long n : metrics.processedByWorker().values()) {
            sum += n;
        }
        return sum;
    }
}
