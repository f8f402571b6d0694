package com.search.negatives.batch;

import com.search.negatives.exception.PartialBatchFailureException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Combined result of a batch run. Lists every unit's outcome in submission order.
 */
public record BatchReport(String batchId, List<UnitOutcome> outcomes, Duration duration) {

    public BatchReport {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public int totalUnits() {
        return outcomes.size();
    }

    public int successCount() {
        return (int) outcomes.stream().filter(UnitOutcome::isSuccess).count();
    }

    public int failureCount() {
        return totalUnits() - successCount();
    }

    /**
     * Success rate in percent, 0 for an empty batch.
     */
    public double successRate() {
        return outcomes.isEmpty() ? 0.0 : successCount() * 100.0 / totalUnits();
    }

    public BatchStatus status() {
        int failures = failureCount();
        if (failures == 0) {
            return BatchStatus.SUCCESS;
        }
        return failures == totalUnits() ? BatchStatus.FAILED : BatchStatus.PARTIAL;
    }

    /**
     * Looks up a unit's outcome by identity.
     */
    public Optional<UnitOutcome> outcome(String unitId) {
        return outcomes.stream().filter(o -> o.unitId().equals(unitId)).findFirst();
    }

    public List<UnitOutcome> successes() {
        return outcomes.stream().filter(UnitOutcome::isSuccess).toList();
    }

    public List<UnitOutcome> failures() {
        return outcomes.stream().filter(o -> !o.isSuccess()).toList();
    }

    /**
     * Throws if any unit failed. Returns this report otherwise, for chaining.
     *
     * @throws PartialBatchFailureException carrying this report
     */
    public BatchReport throwIfFailed() {
        if (failureCount() > 0) {
            throw new PartialBatchFailureException(this);
        }
        return this;
    }

    @Override
    public String toString() {
        return String.format("BatchReport{batchId=%s, status=%s, units=%d, succeeded=%d, failed=%d, successRate=%.1f%%, durationMs=%d}",
                batchId, status(), totalUnits(), successCount(), failureCount(), successRate(), duration.toMillis());
    }
}
