package io.queuebench.metrics;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scheduled task writing one cumulative snapshot per tick to a {@link MetricsSink}.
 *
 * <p>Ticks that arrive while a write is still running are dropped. Nothing is written while the
 * aggregator is empty. Stopping writes one final snapshot.</p>
 */
public class MetricsEmitter {

    private static final Logger LOG = Logger.getLogger(MetricsEmitter.class);

    final MetricsAggregator aggregator;
    final MetricsSink sink;

    private final AtomicReference<Cancellable> tickSub = new AtomicReference<>();
    private final AtomicLong written = new AtomicLong();

    public MetricsEmitter(MetricsAggregator aggregator, MetricsSink sink) {
        this.aggregator = aggregator;
        this.sink = sink;
    }

    public void emitPeriodically(Duration interval) {
        Cancellable sub = Multi.createFrom().ticks()
                .every(interval)
                .onOverflow().drop()
                .call(t -> emitOnce()
                        .onFailure().invoke(err -> LOG.warn("Metrics tick failed", err))
                        .onFailure().recoverWithUni(Uni.createFrom().voidItem())
                )
                .subscribe().with(
                        v -> { /* every tick no-op */ },
                        e -> LOG.error("Metrics stream failed", e)
                );
        Cancellable previous = tickSub.getAndSet(sub);
        if (previous != null) previous.cancel();
        LOG.infof("Metrics emitter started (interval=%dms)", interval.toMillis());
    }

    /**
     * Takes one snapshot and appends it to the sink, on the worker pool.
     */
    public Uni<Void> emitOnce() {
        return Uni.createFrom().<Void>emitter(em -> {
                    try {
                        var snapshot = aggregator.snapshot();
                        if (snapshot.isPresent()) {
                            sink.write(snapshot.get());
                            written.incrementAndGet();
                        }
                        em.complete(null);
                    } catch (Throwable t) {
                        em.fail(t);
                    }
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    public long snapshotsWritten() {
        return written.get();
    }

    public void stop() {
        Cancellable s = tickSub.getAndSet(null);
        if (s != null) s.cancel();
        emitOnce()
                .onFailure().invoke(err -> LOG.warn("Final metrics snapshot failed", err))
                .onFailure().recoverWithNull()
                .await().atMost(Duration.ofSeconds(10));
        LOG.infof("Metrics emitter stopped (%d snapshots written)", written.get());
    }
}
