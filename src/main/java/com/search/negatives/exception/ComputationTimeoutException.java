package com.search.negatives.exception;

import java.time.Duration;

/**
 * Thrown when a unit of work exceeds its wall-clock budget and is cancelled.
 */
public class ComputationTimeoutException extends NegativeFilterException {

    private final Duration timeout;

    public ComputationTimeoutException(String message, Duration timeout) {
        super(message);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
