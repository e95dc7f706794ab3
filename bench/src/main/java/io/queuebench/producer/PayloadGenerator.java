package io.queuebench.producer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.queuebench.model.Job;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds synthetic jobs: a JSON body {@code {id, timestamp, data}} whose random alphanumeric
 * {@code data} is sized from the configured payload budget, a uniform priority and, for partitioned
 * queues, a uniform partition key.
 */
public class PayloadGenerator {

    /** Room left in the budget for the JSON envelope around {@code data}. */
    static final int ENVELOPE_BYTES = 100;
    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    final int payloadBytes;
    final int partitions;

    /**
     * @param partitions number of partitions to spread jobs over, or {@code 0} for unpartitioned queues
     */
    public PayloadGenerator(int payloadBytes, int partitions) {
        if (payloadBytes < ENVELOPE_BYTES) {
            throw new IllegalArgumentException("payloadBytes must be >= " + ENVELOPE_BYTES);
        }
        this.payloadBytes = payloadBytes;
        this.partitions = partitions;
    }

    record Body(long id, Instant timestamp, String data) {
    }

    @SuppressWarnings("java:S2245")
    public Job next(long sequence, Instant enqueuedAt) {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        char[] data = new char[payloadBytes - ENVELOPE_BYTES];
        for (int i = 0; i < data.length; i++) {
            data[i] = ALPHABET[rnd.nextInt(ALPHABET.length)];
        }
        byte[] payload;
        try {
            payload = om.writeValueAsBytes(new Body(sequence, enqueuedAt, new String(data)));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        int priority = rnd.nextInt(Job.MIN_PRIORITY, Job.MAX_PRIORITY + 1);
        Integer partitionKey = partitions > 0 ? rnd.nextInt(partitions) : null;
        return new Job(Long.toString(sequence), payload, priority, enqueuedAt, partitionKey);
    }
}
