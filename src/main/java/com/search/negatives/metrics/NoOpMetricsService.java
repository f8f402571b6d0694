package com.search.negatives.metrics;

import com.search.negatives.core.model.MatchType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(Duration duration) {
    }

    @Override
    public void incrementTermExcluded(MatchType matchType) {
    }

    @Override
    public void recordSuggestionConfidence(double confidence) {
    }

    @Override
    public void recordUnitOutcome(String outcome, Duration duration) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
