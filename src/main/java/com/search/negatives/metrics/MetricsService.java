package com.search.negatives.metrics;

import com.search.negatives.core.model.MatchType;

import java.time.Duration;

/**
 * Interface for recording filtering metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordMatchDuration(Duration duration);

    void incrementTermExcluded(MatchType matchType);

    void recordSuggestionConfidence(double confidence);

    void recordUnitOutcome(String outcome, Duration duration);

    void recordBatchSize(int size);
}
