package io.queuebench.backend;

import java.util.ArrayList;
import java.util.List;

/**
 * Static partition ownership for the partitioned row queue.
 *
 * <p>Each of {@code W} workers owns {@code ceil(P / W)} consecutive partitions starting at
 * {@code (workerIndex * ceil(P / W)) mod P}, wrapping around. Whenever {@code W <= P} every
 * partition is owned by at least one worker; with more workers than partitions each worker owns
 * partition {@code workerIndex mod P}.</p>
 */
public final class PartitionAssignment {

    private PartitionAssignment() {
    }

    public static int partitionsPerWorker(int partitions, int workers) {
        requirePositive(partitions, workers);
        return (partitions + workers - 1) / workers;
    }

    public static List<Integer> forWorker(int workerIndex, int workers, int partitions) {
        requirePositive(partitions, workers);
        if (workerIndex < 0 || workerIndex >= workers) {
            throw new IllegalArgumentException("workerIndex " + workerIndex + " outside 0.." + (workers - 1));
        }
        int perWorker = partitionsPerWorker(partitions, workers);
        int start = (int) (((long) workerIndex * perWorker) % partitions);
        List<Integer> owned = new ArrayList<>(perWorker);
        for (int i = 0; i < perWorker; i++) {
            owned.add((start + i) % partitions);
        }
        return List.copyOf(owned);
    }

    private static void requirePositive(int partitions, int workers) {
        if (partitions < 1 || workers < 1) {
            throw new IllegalArgumentException("partitions and workers must be >= 1");
        }
    }
}
