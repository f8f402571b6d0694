package com.search.negatives.batch;

import com.search.negatives.exception.ComputationTimeoutException;
import com.search.negatives.exception.InvalidRecordException;
import com.search.negatives.exception.InvalidRuleException;

/**
 * Why a batch unit failed.
 */
public enum ErrorKind {
    /** Unrecognized match type or empty keyword. */
    INVALID_RULE,
    /** Structurally malformed term record. */
    INVALID_RECORD,
    /** The unit exceeded its wall-clock budget and was cancelled. */
    TIMEOUT,
    /** Any other failure inside the unit. */
    INTERNAL;

    public static ErrorKind classify(Throwable t) {
        if (t instanceof InvalidRuleException) {
            return INVALID_RULE;
        } else if (t instanceof InvalidRecordException) {
            return INVALID_RECORD;
        } else if (t instanceof ComputationTimeoutException) {
            return TIMEOUT;
        }
        return INTERNAL;
    }
}
