package io.queuebench.backend;

import io.queuebench.store.PendingEntry;
import io.queuebench.store.StreamEntry;
import io.queuebench.store.StreamStore;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;

/**
 * Crash recovery for the stream variant: takes over pending entries whose consumer has gone quiet.
 *
 * <p>One sweep lists up to {@code scanCount} pending entries of the group, keeps those idle for longer
 * than the threshold and claims them for the calling consumer with the same threshold as minimum idle
 * time. The store re-checks idle time atomically on claim, so when several workers sweep at once each
 * stalled entry goes to exactly one of them.</p>
 */
public class PendingReclaimer {

    private static final Logger LOG = Logger.getLogger(PendingReclaimer.class);

    final StreamStore store;
    final Duration idleThreshold;
    final int scanCount;

    public PendingReclaimer(StreamStore store, Duration idleThreshold, int scanCount) {
        this.store = store;
        this.idleThreshold = idleThreshold;
        this.scanCount = scanCount;
    }

    /**
     * @return entries now owned by {@code consumer}, to be processed like a normal fetch result
     */
    public Uni<List<StreamEntry>> reclaim(String consumer) {
        return store.pending(scanCount)
                .onItem().transformToUni(pending -> {
                    List<String> stalled = pending.stream()
                            .filter(p -> p.idle().compareTo(idleThreshold) > 0)
                            .map(PendingEntry::id)
                            .toList();
                    if (stalled.isEmpty()) {
                        return Uni.createFrom().item(List.<StreamEntry>of());
                    }
                    return store.claim(consumer, idleThreshold, stalled);
                })
                .invoke(claimed -> {
                    if (!claimed.isEmpty()) {
                        LOG.infof("[%s] Claimed %d stalled pending entries", consumer, claimed.size());
                    }
                });
    }
}
