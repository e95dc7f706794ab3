package io.queuebench.store;

import io.quarkus.redis.datasource.stream.PendingMessage;
import io.quarkus.redis.datasource.stream.ReactiveStreamCommands;
import io.quarkus.redis.datasource.stream.StreamMessage;
import io.quarkus.redis.datasource.stream.StreamRange;
import io.quarkus.redis.datasource.stream.XGroupCreateArgs;
import io.quarkus.redis.datasource.stream.XReadGroupArgs;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link StreamStore} over Redis/Valkey streams (XADD, XREADGROUP, XACK, XPENDING, XCLAIM).
 */
public class RedisStreamStore implements StreamStore {

    private static final Logger LOG = Logger.getLogger(RedisStreamStore.class);

    final ReactiveStreamCommands<String, String, String> commands;
    final String stream;
    final String group;

    public RedisStreamStore(ReactiveStreamCommands<String, String, String> commands, String stream, String group) {
        this.commands = commands;
        this.stream = stream;
        this.group = group;
    }

    @Override
    public Uni<Void> createGroup() {
        return commands.xgroupCreate(stream, group, "0", new XGroupCreateArgs().mkstream())
                .onFailure(t -> messageContains(t, "BUSYGROUP")).recoverWithNull()
                .invoke(() -> LOG.debugf("Consumer group %s on %s ready", group, stream))
                .replaceWithVoid();
    }

    @Override
    public Uni<String> append(Map<String, String> fields) {
        return commands.xadd(stream, fields);
    }

    @Override
    public Uni<List<StreamEntry>> readGroup(String consumer, int count, Duration block) {
        return mapMissingGroup(commands.xreadgroup(group, consumer, stream, ">",
                        new XReadGroupArgs().count(count).block(block)))
                .onItem().transform(RedisStreamStore::toEntries);
    }

    @Override
    public Uni<Integer> acknowledge(List<String> ids) {
        if (ids.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        return mapMissingGroup(commands.xack(stream, group, ids.toArray(String[]::new)));
    }

    @Override
    public Uni<List<PendingEntry>> pending(int count) {
        return mapMissingGroup(commands.xpending(stream, group, new StreamRange("-", "+"), count))
                .onItem().transform(list -> {
                    List<PendingEntry> out = new ArrayList<>(list == null ? 0 : list.size());
                    if (list != null) {
                        for (PendingMessage m : list) {
                            out.add(new PendingEntry(m.getMessageId(), m.getConsumer(),
                                    m.getDurationSinceLastDelivery(), m.getDeliveryCount()));
                        }
                    }
                    return out;
                });
    }

    @Override
    public Uni<List<StreamEntry>> claim(String consumer, Duration minIdle, List<String> ids) {
        if (ids.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        return mapMissingGroup(commands.xclaim(stream, group, consumer, minIdle, ids.toArray(String[]::new)))
                .onItem().transform(RedisStreamStore::toEntries);
    }

    private <T> Uni<T> mapMissingGroup(Uni<T> call) {
        return call.onFailure(t -> messageContains(t, "NOGROUP"))
                .transform(t -> new MissingConsumerGroupException(
                        "Consumer group " + group + " missing on stream " + stream, t));
    }

    private static List<StreamEntry> toEntries(List<StreamMessage<String, String, String>> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<StreamEntry> out = new ArrayList<>(messages.size());
        for (StreamMessage<String, String, String> m : messages) {
            // XCLAIM can return entries deleted from the stream with a null body
            if (m.payload() == null) {
                continue;
            }
            out.add(new StreamEntry(m.id(), m.payload()));
        }
        return out;
    }

    private static boolean messageContains(Throwable t, String code) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            String m = c.getMessage();
            if (m != null && m.contains(code)) {
                return true;
            }
        }
        return false;
    }
}
