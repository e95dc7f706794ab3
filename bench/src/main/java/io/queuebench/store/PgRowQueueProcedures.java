package io.queuebench.store;

import io.queuebench.model.Job;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.RowSet;
import io.vertx.mutiny.sqlclient.SqlClient;
import io.vertx.mutiny.sqlclient.Tuple;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * PostgreSQL implementation of the stored queue operations.
 *
 * <p>Each call is a single {@code SELECT fn(...)} round trip on the client this instance was built
 * with. Timestamps are exchanged as UTC {@code timestamp without time zone} values.</p>
 */
public class PgRowQueueProcedures implements RowQueueProcedures {

    private static final Logger LOG = Logger.getLogger(PgRowQueueProcedures.class);

    /** Matches the {@code max_attempts} default of the delete-returning table. */
    static final int DR_MAX_ATTEMPTS = 3;

    final SqlClient client;
    final RowQueueTable table;

    public PgRowQueueProcedures(SqlClient client, RowQueueTable table) {
        this.client = client;
        this.table = table;
    }

    @Override
    public Uni<Optional<Job>> getNext(String workerId, Integer partitionKey) {
        String sql;
        Tuple args;
        if (table.partitioned()) {
            if (partitionKey == null) {
                return Uni.createFrom().failure(
                        new IllegalArgumentException(table.table() + " requires a partition key"));
            }
            sql = "SELECT * FROM " + table.getFunction() + "($1, $2)";
            args = Tuple.of(partitionKey, workerId);
        } else {
            sql = "SELECT * FROM " + table.getFunction() + "($1)";
            args = Tuple.of(workerId);
        }
        return client.preparedQuery(sql).execute(args)
                .onItem().transform(rows -> {
                    for (Row r : rows) {
                        if (r.getLong("job_id") == null) {
                            continue;
                        }
                        return Optional.of(toJob(r, partitionKey));
                    }
                    return Optional.<Job>empty();
                });
    }

    @Override
    public Uni<Boolean> complete(Job job, String workerId) {
        long id = Long.parseLong(job.id());
        return switch (table) {
            case SKIP_LOCKED -> client.preparedQuery(call(table.completeFunction(), 1) + " AS found")
                    .execute(Tuple.of(id))
                    .onItem().transform(PgRowQueueProcedures::found);
            case PARTITIONED -> client.preparedQuery(call(table.completeFunction(), 2) + " AS found")
                    .execute(Tuple.of(job.partitionKey(), id))
                    .onItem().transform(PgRowQueueProcedures::found);
            case DELETE_RETURNING -> client.preparedQuery(call(table.completeFunction(), 5))
                    .execute(Tuple.tuple()
                            .addLong(id)
                            .addValue(parseToJsonObject(job.payloadText()))
                            .addInteger(job.priority())
                            .addLocalDateTime(toUtc(job))
                            .addString(workerId))
                    .replaceWith(Boolean.TRUE);
        };
    }

    @Override
    public Uni<Void> fail(Job job, String workerId, String error) {
        long id = Long.parseLong(job.id());
        String err = errMessage(error);
        return switch (table) {
            case SKIP_LOCKED -> client.preparedQuery(call(table.failFunction(), 2))
                    .execute(Tuple.of(id, err))
                    .replaceWithVoid();
            case PARTITIONED -> client.preparedQuery(call(table.failFunction(), 3))
                    .execute(Tuple.of(job.partitionKey(), id, err))
                    .replaceWithVoid();
            // the row was already removed by get-next: put it back with its original contents
            case DELETE_RETURNING -> client.preparedQuery(call(table.failFunction(), 7))
                    .execute(Tuple.tuple()
                            .addLong(id)
                            .addValue(parseToJsonObject(job.payloadText()))
                            .addInteger(job.priority())
                            .addLocalDateTime(toUtc(job))
                            .addInteger(1)
                            .addInteger(DR_MAX_ATTEMPTS)
                            .addString(err))
                    .replaceWithVoid();
        };
    }

    /**
     * {@code SELECT fn($1, .., $n)}.
     */
    static String call(String function, int arity) {
        StringBuilder sql = new StringBuilder("SELECT ").append(function).append('(');
        for (int i = 1; i <= arity; i++) {
            if (i > 1) sql.append(", ");
            sql.append('$').append(i);
        }
        return sql.append(')').toString();
    }

    private Job toJob(Row r, Integer partitionKey) {
        Object json = r.getJson("job_payload");
        String payload = json == null ? "{}" : json.toString();
        Integer priority = r.getInteger("job_priority");
        LocalDateTime createdAt = r.getLocalDateTime("job_created_at");
        return new Job(
                String.valueOf(r.getLong("job_id")),
                payload.getBytes(StandardCharsets.UTF_8),
                priority == null ? 0 : priority,
                createdAt.toInstant(ZoneOffset.UTC),
                partitionKey);
    }

    private static Boolean found(RowSet<Row> rows) {
        for (Row r : rows) {
            Boolean found = r.getBoolean("found");
            return found != null && found;
        }
        return Boolean.FALSE;
    }

    static LocalDateTime toUtc(Job job) {
        return LocalDateTime.ofInstant(job.enqueuedAt(), ZoneOffset.UTC);
    }

    static JsonObject parseToJsonObject(String payload) {
        if (payload == null || payload.isBlank()) {
            return new JsonObject();
        }
        try {
            return new JsonObject(payload);
        } catch (Exception e) {
            LOG.errorf("JSON parse failed, storing empty payload. Error: %s", e.getMessage());
            return new JsonObject();
        }
    }

    private static String errMessage(String m) {
        if (m == null) return "error";
        return m.length() > 500 ? m.substring(0, 500) : m;
    }
}
