package io.queuebench.backend;

import io.queuebench.model.Job;
import io.queuebench.store.MissingConsumerGroupException;
import io.queuebench.store.StreamEntry;
import io.queuebench.store.StreamStore;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Consumer-group stream queue.
 *
 * <p>A fetch is one blocking group read for up to {@code batchSize} new entries. Every
 * {@code reclaimEvery}-th fetch also runs the {@link PendingReclaimer} and appends whatever it claimed,
 * so reclaimed entries are processed and acknowledged in the same batch as fresh ones. A missing group
 * is recreated on the spot and the fetch returns empty.</p>
 *
 * <p>Entries that cannot be decoded into a {@link Job} are logged and left pending; they come back
 * through reclamation.</p>
 */
public final class StreamGroupBackend implements QueueBackend {

    private static final Logger LOG = Logger.getLogger(StreamGroupBackend.class);

    final String workerId;
    final StreamStore store;
    final int batchSize;
    final Duration block;
    final PendingReclaimer reclaimer;
    final int reclaimEvery;
    private long fetches;

    public StreamGroupBackend(String workerId, StreamStore store, int batchSize, Duration block,
                              PendingReclaimer reclaimer, int reclaimEvery) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        if (reclaimEvery < 1) throw new IllegalArgumentException("reclaimEvery must be >= 1");
        this.workerId = workerId;
        this.store = store;
        this.batchSize = batchSize;
        this.block = block;
        this.reclaimer = reclaimer;
        this.reclaimEvery = reclaimEvery;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.STREAM_GROUP;
    }

    @Override
    public String workerId() {
        return workerId;
    }

    @Override
    public Uni<List<Job>> fetch() {
        fetches++;
        boolean sweep = fetches % reclaimEvery == 0;

        Uni<List<StreamEntry>> fresh = store.readGroup(workerId, batchSize, block)
                .onFailure(MissingConsumerGroupException.class).recoverWithUni(e -> {
                    LOG.warnf("[%s] Consumer group not found, recreating...", workerId);
                    return store.createGroup().replaceWith(List.<StreamEntry>of());
                });

        if (!sweep) {
            return fresh.onItem().transform(this::decode);
        }
        return fresh.onItem().transformToUni(entries -> reclaimer.reclaim(workerId)
                        .onFailure().invoke(e ->
                                LOG.errorf("[%s] Error claiming pending messages: %s", workerId, e.getMessage()))
                        .onFailure().recoverWithItem(List.of())
                        .onItem().transform(claimed -> {
                            if (claimed.isEmpty()) return entries;
                            List<StreamEntry> merged = new ArrayList<>(entries.size() + claimed.size());
                            merged.addAll(entries);
                            merged.addAll(claimed);
                            return merged;
                        }))
                .onItem().transform(this::decode);
    }

    /**
     * Acknowledges every job of one fetch with a single call.
     *
     * @return entries the store removed from the pending list; an entry reclaimed and acknowledged by
     * another worker while this one was still processing it is not counted again
     */
    @Override
    public Uni<Integer> acknowledge(List<Job> jobs) {
        if (jobs.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        List<String> ids = jobs.stream().map(Job::id).toList();
        return store.acknowledge(ids)
                .invoke(acked -> {
                    if (acked < ids.size()) {
                        LOG.warnf("[%s] %d of %d entries were no longer pending", workerId, ids.size() - acked, ids.size());
                    }
                });
    }

    private List<Job> decode(List<StreamEntry> entries) {
        if (entries.isEmpty()) {
            return List.of();
        }
        List<Job> jobs = new ArrayList<>(entries.size());
        for (StreamEntry entry : entries) {
            try {
                jobs.add(toJob(entry));
            } catch (RuntimeException e) {
                LOG.errorf("[%s] Error processing message %s: %s", workerId, entry.id(), e.getMessage());
            }
        }
        return jobs;
    }

    static Job toJob(StreamEntry entry) {
        Map<String, String> f = entry.fields();
        String createdAt = f.get(StreamEntry.FIELD_CREATED_AT);
        String priority = f.get(StreamEntry.FIELD_PRIORITY);
        String payload = f.getOrDefault(StreamEntry.FIELD_PAYLOAD, "");
        return new Job(
                entry.id(),
                payload.getBytes(StandardCharsets.UTF_8),
                priority == null || priority.isBlank() ? 0 : Integer.parseInt(priority.trim()),
                createdAt == null || createdAt.isBlank() ? Instant.now() : Instant.parse(createdAt),
                null);
    }
}
