package com.search.negatives.metrics;

import com.search.negatives.core.model.MatchType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code negatives.match.duration} - Timer</li>
 *   <li>{@code negatives.terms.excluded} - Counter (tag: matchType)</li>
 *   <li>{@code negatives.suggestion.confidence} - DistributionSummary</li>
 *   <li>{@code negatives.batch.unit} - Timer (tag: outcome)</li>
 *   <li>{@code negatives.batch.size} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Timer matchTimer;
    private final Map<MatchType, Counter> excludedCounters = new ConcurrentHashMap<>();
    private final Map<String, Timer> unitTimers = new ConcurrentHashMap<>();
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.matchTimer = Timer.builder("negatives.match.duration")
                .description("Duration of matching a term list against the negative keywords")
                .register(registry);
        this.confidenceSummary = DistributionSummary.builder("negatives.suggestion.confidence")
                .description("Distribution of suggestion confidence scores")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("negatives.batch.size")
                .description("Number of units per batch")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(Duration duration) {
        matchTimer.record(duration);
    }

    @Override
    public void incrementTermExcluded(MatchType matchType) {
        Counter counter = excludedCounters.computeIfAbsent(matchType, type ->
                Counter.builder("negatives.terms.excluded")
                        .description("Number of search terms excluded by a negative keyword")
                        .tag("matchType", type.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSuggestionConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void recordUnitOutcome(String outcome, Duration duration) {
        Timer timer = unitTimers.computeIfAbsent(outcome, o ->
                Timer.builder("negatives.batch.unit")
                        .description("Duration and outcome of batch units")
                        .tag("outcome", o)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
