package io.queuebench.store;

/**
 * Tables and stored functions backing each row-store queue variant.
 */
public enum RowQueueTable {
    SKIP_LOCKED("queue_jobs", "get_next_job", "complete_job", "fail_job", false),
    DELETE_RETURNING("queue_jobs_dr", "get_next_job_dr", "complete_job_dr", "requeue_job_dr", false),
    PARTITIONED("queue_jobs_part", "get_next_job_part", "complete_job_part", "fail_job_part", true);

    private final String table;
    private final String getFunction;
    private final String completeFunction;
    private final String failFunction;
    private final boolean partitioned;

    RowQueueTable(String table, String getFunction, String completeFunction, String failFunction,
                  boolean partitioned) {
        this.table = table;
        this.getFunction = getFunction;
        this.completeFunction = completeFunction;
        this.failFunction = failFunction;
        this.partitioned = partitioned;
    }

    public String table() {
        return table;
    }

    public String getFunction() {
        return getFunction;
    }

    public String completeFunction() {
        return completeFunction;
    }

    public String failFunction() {
        return failFunction;
    }

    public boolean partitioned() {
        return partitioned;
    }

    /**
     * Single-row insert the producer runs as a prepared batch; {@code created_at} is written explicitly in UTC.
     */
    public String insertSql() {
        return partitioned
                ? "INSERT INTO " + table + " (partition_key, payload, priority, created_at) VALUES ($1, $2, $3, $4)"
                : "INSERT INTO " + table + " (payload, priority, created_at) VALUES ($1, $2, $3)";
    }
}
