package io.queuebench.store;

import io.smallrye.mutiny.Uni;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Consumer-group operations of an append-only stream store, bound to one stream and one group.
 *
 * <p>Operations against a group that does not exist fail with {@link MissingConsumerGroupException}.</p>
 */
public interface StreamStore {

    /**
     * Creates the group (and the stream if needed) reading from the start of the stream.
     * Succeeds silently when the group already exists.
     */
    Uni<Void> createGroup();

    Uni<String> append(Map<String, String> fields);

    /**
     * Reads up to {@code count} entries never delivered to this group, waiting up to {@code block}
     * when none are immediately available.
     */
    Uni<List<StreamEntry>> readGroup(String consumer, int count, Duration block);

    /**
     * Acknowledges all {@code ids} in one call.
     *
     * @return number of entries the store actually removed from the pending list
     */
    Uni<Integer> acknowledge(List<String> ids);

    Uni<List<PendingEntry>> pending(int count);

    /**
     * Transfers ownership of the given pending entries to {@code consumer}. Entries idle for less than
     * {@code minIdle} at the time of the call are left untouched and not returned.
     */
    Uni<List<StreamEntry>> claim(String consumer, Duration minIdle, List<String> ids);
}
