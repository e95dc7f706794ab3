package io.queuebench.producer;

import io.queuebench.model.Job;
import io.queuebench.store.StreamEntry;
import io.queuebench.store.StreamStore;
import io.smallrye.mutiny.Uni;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Appends producer batches to the stream. The appends of one batch are issued together and pipelined
 * by the client; the batch only counts as produced when every append succeeded.
 */
public class StreamJobSink implements JobSink {

    final StreamStore store;
    final Runnable onClose;

    public StreamJobSink(StreamStore store, Runnable onClose) {
        this.store = store;
        this.onClose = onClose;
    }

    @Override
    public Uni<Void> appendBatch(List<Job> jobs) {
        if (jobs.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        List<Uni<String>> appends = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            appends.add(store.append(Map.of(
                    StreamEntry.FIELD_PAYLOAD, job.payloadText(),
                    StreamEntry.FIELD_PRIORITY, String.valueOf(job.priority()),
                    StreamEntry.FIELD_CREATED_AT, job.enqueuedAt().toString())));
        }
        return Uni.join().all(appends).andFailFast().replaceWithVoid();
    }

    @Override
    public void close() {
        onClose.run();
    }
}
