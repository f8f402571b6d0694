package com.search.negatives.batch;

import com.search.negatives.core.model.AnalyticsSummary;
import com.search.negatives.core.model.CandidateSuggestion;
import com.search.negatives.core.model.FilterResult;
import com.search.negatives.core.model.SearchTermRecord;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Definite outcome of one batch unit: either a full result or a failure, never both.
 *
 * @param unitId    the unit's identity
 * @param result    the pipeline result, present only on success
 * @param errorKind failure category, present only on failure
 * @param message   failure message, present only on failure
 * @param duration  wall-clock time the unit ran
 */
public record UnitOutcome(
        String unitId,
        FilterResult result,
        ErrorKind errorKind,
        String message,
        Duration duration
) {
    public UnitOutcome {
        Objects.requireNonNull(unitId, "unitId is required");
        if ((result == null) == (errorKind == null)) {
            throw new IllegalArgumentException("Exactly one of result or errorKind must be set");
        }
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static UnitOutcome success(String unitId, FilterResult result, Duration duration) {
        return new UnitOutcome(unitId, Objects.requireNonNull(result, "result is required"), null, null, duration);
    }

    public static UnitOutcome failure(String unitId, ErrorKind errorKind, String message, Duration duration) {
        return new UnitOutcome(unitId, null, Objects.requireNonNull(errorKind, "errorKind is required"),
                message, duration);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public AnalyticsSummary summary() {
        return result != null ? result.summary() : null;
    }

    public List<SearchTermRecord> classifiedRecords() {
        return result != null ? result.records() : List.of();
    }

    public List<CandidateSuggestion> candidates() {
        return result != null ? result.candidates() : List.of();
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "UnitOutcome{unitId='" + unitId + "', success, " + result.summary() + '}'
                : "UnitOutcome{unitId='" + unitId + "', failure=" + errorKind + ", message='" + message + "'}";
    }
}
