package com.search.negatives.exception;

/**
 * Base type for failures raised by the negative keyword engine.
 * All subclasses are unchecked; callers that need per-unit isolation
 * use the batch orchestrator, which converts them into unit outcomes.
 */
public class NegativeFilterException extends RuntimeException {

    public NegativeFilterException(String message) {
        super(message);
    }

    public NegativeFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
