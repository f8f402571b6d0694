package com.search.negatives.batch;

/**
 * Aggregate status of a batch.
 */
public enum BatchStatus {
    /** Every unit succeeded (or the batch was empty). */
    SUCCESS,
    /** Some units succeeded and some failed. */
    PARTIAL,
    /** No unit succeeded. */
    FAILED
}
