package io.queuebench.backend;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed set of queue designs under benchmark, keyed by their configuration name.
 */
public enum BackendKind {
    SKIP_LOCKED("skip_locked", false),
    DELETE_RETURNING("delete_returning", false),
    PARTITIONED("partitioned", false),
    STREAM_GROUP("stream", true);

    private final String configName;
    private final boolean streamStore;

    BackendKind(String configName, boolean streamStore) {
        this.configName = configName;
        this.streamStore = streamStore;
    }

    public String configName() {
        return configName;
    }

    /**
     * @return {@code true} when the variant runs against the stream store rather than PostgreSQL
     */
    public boolean streamStore() {
        return streamStore;
    }

    public static BackendKind fromConfigName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (BackendKind kind : values()) {
            if (kind.configName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown backend '" + name + "', expected one of "
                + Arrays.stream(values()).map(BackendKind::configName).collect(Collectors.joining(", ")));
    }
}
