package io.queuebench;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.queuebench.backend.BackendFactory;
import io.queuebench.backend.BackendKind;
import io.queuebench.metrics.JsonlMetricsSink;
import io.queuebench.metrics.MetricsAggregator;
import io.queuebench.metrics.MetricsEmitter;
import io.queuebench.producer.PayloadGenerator;
import io.queuebench.producer.ProducerReport;
import io.queuebench.producer.RateLimitedProducer;
import io.queuebench.util.Ticker;
import io.queuebench.worker.SimulatedProcessor;
import io.queuebench.worker.WorkerPool;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;

/**
 * Boots either side of a benchmark run: the worker pool with its metrics emitter, or the producer.
 */
@ApplicationScoped
public class MainStartup {

    private static final Logger LOG = Logger.getLogger(MainStartup.class);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    final BenchmarkConfig config;
    final BackendFactory backends;

    private volatile WorkerPool pool;
    private volatile MetricsEmitter emitter;
    private volatile RateLimitedProducer producer;
    private volatile Thread producerThread;

    public MainStartup(BenchmarkConfig config, BackendFactory backends) {
        this.config = config;
        this.backends = backends;
    }

    void onStart(@Observes StartupEvent ev) {
        try {
            switch (config.role()) {
                case WORKERS -> startWorkers();
                case PRODUCER -> startProducer();
            }
        } catch (BenchmarkStartupException e) {
            LOG.errorf(e, "Startup failed: %s", e.getMessage());
            Quarkus.asyncExit(1);
        }
    }

    void onStop(@Observes ShutdownEvent ev) {
        RateLimitedProducer p = producer;
        Thread t = producerThread;
        if (p != null && t != null && t.isAlive()) {
            LOG.info("Stopping producer...");
            p.stop();
            t.interrupt();
            try {
                t.join(STOP_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        WorkerPool wp = pool;
        if (wp != null) {
            LOG.info("Stopping workers...");
            wp.stop(STOP_TIMEOUT);
        }
        MetricsEmitter em = emitter;
        if (em != null) {
            em.stop();
        }
    }

    private void startWorkers() {
        backends.verifyConnectivity().await().indefinitely();

        LOG.infof("Starting %d %s workers, metrics output: %s",
                config.workers(), config.backend().configName(), config.metricsOutput());
        MetricsAggregator metrics = new MetricsAggregator();
        emitter = new MetricsEmitter(metrics, new JsonlMetricsSink(config.metricsOutput()));
        pool = new WorkerPool(backends, new SimulatedProcessor(config.processingTime()), metrics,
                config.workers(), config.emptyBackoff(), config.errorBackoff(), Clock.systemUTC());
        pool.start();
        emitter.emitPeriodically(config.metricsInterval());
    }

    private void startProducer() {
        backends.verifyConnectivity().await().indefinitely();

        int partitions = config.backend() == BackendKind.PARTITIONED ? config.partitions() : 0;
        producer = new RateLimitedProducer(backends::openSink, new PayloadGenerator(config.payloadBytes(), partitions),
                Ticker.SYSTEM, Clock.systemUTC(), STOP_TIMEOUT);
        producerThread = new Thread(() -> {
            try {
                ProducerReport report = producer.run(config.producerRate(), config.producerDuration());
                LOG.infof("Producer report: %s", report);
                Quarkus.asyncExit(0);
            } catch (BenchmarkStartupException e) {
                LOG.errorf(e, "Startup failed: %s", e.getMessage());
                Quarkus.asyncExit(1);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Producer failed: %s", e.getMessage());
                Quarkus.asyncExit(1);
            }
        }, "producer");
        producerThread.start();
    }
}
