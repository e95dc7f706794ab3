package io.queuebench.producer;

import io.queuebench.model.Job;
import io.queuebench.store.RowQueueTable;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.sqlclient.SqlConnection;
import io.vertx.mutiny.sqlclient.Tuple;
import org.jboss.logging.Logger;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Inserts producer batches into a row-queue table on one dedicated connection, one transaction per
 * batch. A failed batch is rolled back as a unit.
 */
public class PgJobSink implements JobSink {

    private static final Logger LOG = Logger.getLogger(PgJobSink.class);

    final SqlConnection conn;
    final RowQueueTable table;

    public PgJobSink(SqlConnection conn, RowQueueTable table) {
        this.conn = conn;
        this.table = table;
    }

    @Override
    public Uni<Void> appendBatch(List<Job> jobs) {
        if (jobs.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        List<Tuple> rows = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            rows.add(toTuple(job));
        }
        return conn.begin().onItem().transformToUni(tx ->
                conn.preparedQuery(table.insertSql()).executeBatch(rows)
                        .onItem().transformToUni(ignored -> tx.commit())
                        .onFailure().call(err -> tx.rollback()
                                .onFailure().invoke(rb -> LOG.warnf("Rollback failed on %s: %s", table.table(), rb.getMessage()))
                                .onFailure().recoverWithNull()));
    }

    private Tuple toTuple(Job job) {
        JsonObject payload = new JsonObject(job.payloadText());
        LocalDateTime createdAt = LocalDateTime.ofInstant(job.enqueuedAt(), ZoneOffset.UTC);
        if (table.partitioned()) {
            if (job.partitionKey() == null) {
                throw new IllegalArgumentException("job " + job.id() + " has no partition key for " + table.table());
            }
            return Tuple.of(job.partitionKey(), payload, job.priority(), createdAt);
        }
        return Tuple.of(payload, job.priority(), createdAt);
    }

    @Override
    public void close() {
        conn.closeAndAwait();
        LOG.debugf("Producer connection for %s closed", table.table());
    }
}
