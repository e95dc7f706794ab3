package io.queuebench.producer;

/**
 * Outcome of one producer run.
 *
 * @param jobsProduced  jobs written by successful batches
 * @param targetJobs    {@code rate * duration}
 * @param failedBatches batches rolled back and not credited
 * @param interrupted   {@code true} if the run was stopped before reaching the target
 */
public record ProducerReport(long jobsProduced, long targetJobs, double elapsedSeconds, double achievedRate,
                             long failedBatches, boolean interrupted) {
}
