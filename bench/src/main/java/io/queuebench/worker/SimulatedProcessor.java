package io.queuebench.worker;

import io.queuebench.model.Job;
import io.smallrye.mutiny.Uni;

import java.time.Duration;

/**
 * Stands in for real job handling with a fixed delay.
 */
public class SimulatedProcessor implements JobProcessor {

    final Duration processingTime;

    public SimulatedProcessor(Duration processingTime) {
        this.processingTime = processingTime;
    }

    @Override
    public Uni<Void> process(Job job) {
        if (processingTime.isZero() || processingTime.isNegative()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom().voidItem()
                .onItem().delayIt().by(processingTime);
    }
}
