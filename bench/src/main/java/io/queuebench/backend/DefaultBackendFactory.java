package io.queuebench.backend;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.queuebench.BenchmarkConfig;
import io.queuebench.BenchmarkStartupException;
import io.queuebench.producer.JobSink;
import io.queuebench.producer.PgJobSink;
import io.queuebench.producer.StreamJobSink;
import io.queuebench.store.PgRowQueueProcedures;
import io.queuebench.store.RedisStreamStore;
import io.queuebench.store.RowQueueTable;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.SqlConnection;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.function.Function;

/**
 * Builds backend variants on PostgreSQL connections from the reactive pool or on single Redis
 * connections, depending on {@code bench.backend}.
 */
@ApplicationScoped
public class DefaultBackendFactory implements BackendFactory {

    private static final Logger LOG = Logger.getLogger(DefaultBackendFactory.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

    final Pool pg;
    final ReactiveRedisDataSource redis;
    final BenchmarkConfig config;

    public DefaultBackendFactory(Pool pg, ReactiveRedisDataSource redis, BenchmarkConfig config) {
        this.pg = pg;
        this.redis = redis;
        this.config = config;
    }

    @Override
    public Uni<Void> verifyConnectivity() {
        Uni<Void> connectivity = config.backend().streamStore()
                ? redis.execute("PING").replaceWithVoid()
                : pg.query("SELECT 1").execute().replaceWithVoid();
        return connectivity
                .ifNoItem().after(CONNECT_TIMEOUT).fail()
                .onFailure().transform(e -> new BenchmarkStartupException(
                        "Cannot connect to " + storeName() + " for backend " + config.backend().configName(), e))
                .invoke(() -> LOG.infof("Connected to %s", storeName()));
    }

    @Override
    public Uni<Void> withBackend(int workerIndex, Function<QueueBackend, Uni<Void>> session) {
        String workerId = BackendFactory.workerId(workerIndex);
        return switch (config.backend()) {
            case SKIP_LOCKED -> pg.withConnection(conn -> session.apply(
                    new SkipLockedBackend(workerId, new PgRowQueueProcedures(conn, RowQueueTable.SKIP_LOCKED))));
            case DELETE_RETURNING -> pg.withConnection(conn -> session.apply(
                    new DeleteReturningBackend(workerId, new PgRowQueueProcedures(conn, RowQueueTable.DELETE_RETURNING))));
            case PARTITIONED -> pg.withConnection(conn -> session.apply(
                    new PartitionedBackend(workerId, new PgRowQueueProcedures(conn, RowQueueTable.PARTITIONED),
                            PartitionAssignment.forWorker(workerIndex, config.workers(), config.partitions()))));
            case STREAM_GROUP -> redis.withConnection(ds -> {
                RedisStreamStore store = new RedisStreamStore(ds.stream(String.class), config.streamName(), config.streamGroup());
                PendingReclaimer reclaimer = new PendingReclaimer(store, config.reclaimIdle(), config.reclaimScanCount());
                return store.createGroup().chain(() -> session.apply(new StreamGroupBackend(
                        workerId, store, config.streamBatchSize(), config.streamPollInterval(),
                        reclaimer, config.reclaimEvery())));
            });
        };
    }

    @Override
    public JobSink openSink() {
        try {
            if (config.backend().streamStore()) {
                RedisStreamStore store = new RedisStreamStore(redis.stream(String.class), config.streamName(), config.streamGroup());
                store.createGroup().await().atMost(CONNECT_TIMEOUT);
                LOG.infof("Producer writing to stream %s (group %s)", config.streamName(), config.streamGroup());
                return new StreamJobSink(store, () -> LOG.debug("Producer stream session closed"));
            }
            RowQueueTable table = tableFor(config.backend());
            SqlConnection conn = pg.getConnection().await().atMost(CONNECT_TIMEOUT);
            LOG.infof("Producer writing to table %s", table.table());
            return new PgJobSink(conn, table);
        } catch (RuntimeException e) {
            throw new BenchmarkStartupException("Cannot open producer session on " + storeName(), e);
        }
    }

    static RowQueueTable tableFor(BackendKind kind) {
        return switch (kind) {
            case SKIP_LOCKED -> RowQueueTable.SKIP_LOCKED;
            case DELETE_RETURNING -> RowQueueTable.DELETE_RETURNING;
            case PARTITIONED -> RowQueueTable.PARTITIONED;
            case STREAM_GROUP -> throw new IllegalArgumentException("stream backend has no row table");
        };
    }

    private String storeName() {
        return config.backend().streamStore() ? "stream store" : "PostgreSQL";
    }
}
