package io.queuebench;

/**
 * Raised when the benchmark cannot reach its backend before any worker or producer starts.
 */
public class BenchmarkStartupException extends RuntimeException {

    public BenchmarkStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
