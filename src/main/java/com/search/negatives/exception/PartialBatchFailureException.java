package com.search.negatives.exception;

import com.search.negatives.batch.BatchReport;

/**
 * Batch-level failure raised on demand by {@link BatchReport#throwIfFailed()}
 * when at least one unit did not succeed. Carries the full report so callers
 * can still reach the successful outcomes.
 */
public class PartialBatchFailureException extends NegativeFilterException {

    private final transient BatchReport report;

    public PartialBatchFailureException(BatchReport report) {
        super("Batch " + report.batchId() + " finished with " + report.failureCount()
                + " failed unit(s) out of " + report.totalUnits());
        this.report = report;
    }

    public BatchReport getReport() {
        return report;
    }
}
