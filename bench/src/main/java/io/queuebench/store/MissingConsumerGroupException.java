package io.queuebench.store;

/**
 * The consumer group (or the stream itself) no longer exists on the server.
 */
public class MissingConsumerGroupException extends RuntimeException {

    public MissingConsumerGroupException(String message, Throwable cause) {
        super(message, cause);
    }
}
