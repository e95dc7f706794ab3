package io.queuebench.store;

import java.util.Map;

/**
 * One stream entry as delivered to a consumer: its id plus its field map.
 */
public record StreamEntry(String id, Map<String, String> fields) {

    public static final String FIELD_PAYLOAD = "payload";
    public static final String FIELD_PRIORITY = "priority";
    public static final String FIELD_CREATED_AT = "created_at";

    public StreamEntry {
        fields = Map.copyOf(fields);
    }
}
