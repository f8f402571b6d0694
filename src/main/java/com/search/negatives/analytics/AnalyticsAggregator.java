package com.search.negatives.analytics;

import com.search.negatives.core.CancellationToken;
import com.search.negatives.core.model.AnalyticsSummary;
import com.search.negatives.core.model.CandidateSuggestion;
import com.search.negatives.core.model.HighRiskTerm;
import com.search.negatives.core.model.Ratio;
import com.search.negatives.core.model.SearchTermRecord;
import com.search.negatives.rules.TermNormalizer;
import com.search.negatives.suggestion.SuggestionImpact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reduces classified records and ranked suggestions into an {@link AnalyticsSummary}.
 *
 * <p>Cost-based figures only count records that carry a cost. When no record has
 * one, waste prevented is 0 rather than an estimate. Every ratio has a defined
 * value for a zero denominator.</p>
 */
public class AnalyticsAggregator {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsAggregator.class);

    private static final Comparator<SearchTermRecord> BY_COST_DESC =
            Comparator.comparingDouble(SearchTermRecord::costOrZero).reversed()
                    .thenComparing(r -> r.getTerm() != null ? r.getTerm() : "");

    private final AnalyticsOptions options;
    private final TermNormalizer normalizer;
    private final Clock clock;

    public AnalyticsAggregator() {
        this(AnalyticsOptions.defaults(), TermNormalizer.defaultNormalizer(), Clock.systemUTC());
    }

    public AnalyticsAggregator(AnalyticsOptions options, TermNormalizer normalizer, Clock clock) {
        this.options = options != null ? options : AnalyticsOptions.defaults();
        this.normalizer = normalizer != null ? normalizer : TermNormalizer.defaultNormalizer();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Aggregates a run. Records must already be classified.
     *
     * @throws IllegalStateException if any record has not been through the matcher
     */
    public AnalyticsSummary aggregate(List<SearchTermRecord> records, List<CandidateSuggestion> candidates) {
        return aggregate(records, candidates, CancellationToken.none());
    }

    /**
     * Aggregates a run, checking for cancellation between records.
     *
     * @throws com.search.negatives.exception.ComputationTimeoutException if cancelled
     */
    public AnalyticsSummary aggregate(List<SearchTermRecord> records, List<CandidateSuggestion> candidates,
                                      CancellationToken token) {
        int excludedCount = 0;
        double wastePrevented = 0.0;
        double remainingSpend = 0.0;
        long impressionsEliminated = 0;
        List<SearchTermRecord> highRisk = new ArrayList<>();

        for (SearchTermRecord record : records) {
            token.throwIfCancelled("aggregation");
            if (!record.isClassified()) {
                throw new IllegalStateException("Record was not classified before aggregation: " + record);
            }
            if (record.isExcluded()) {
                excludedCount++;
                if (record.hasCost()) {
                    wastePrevented += record.getCost();
                }
                impressionsEliminated += (long) record.impressionsOrZero();
            } else {
                if (record.hasCost()) {
                    remainingSpend += record.getCost();
                }
                if (options.getHighRiskPredicate().test(record)) {
                    highRisk.add(record);
                }
            }
        }

        int total = records.size();
        int remainingCount = total - excludedCount;
        double qualityScore = round1(Ratio.of(remainingCount, total).value() * 100.0);
        double costReduction = round1(Ratio.of(wastePrevented, wastePrevented + remainingSpend).value() * 100.0);

        double actionScore = actionScore(Ratio.of(excludedCount, total), candidates);
        double potentialSavings = SuggestionImpact.estimate(records, candidates, normalizer, token).potentialCostSavings();
        List<HighRiskTerm> highRiskTerms = rankHighRisk(highRisk);

        AnalyticsSnapshot snapshot = new AnalyticsSnapshot(total, excludedCount, remainingCount,
                round2(wastePrevented), round2(remainingSpend), costReduction, qualityScore, actionScore,
                potentialSavings, highRisk.size(), candidates);

        AnalyticsSummary summary = new AnalyticsSummary(
                total,
                excludedCount,
                remainingCount,
                snapshot.costWastePrevented(),
                snapshot.totalRemainingSpend(),
                costReduction,
                impressionsEliminated,
                qualityScore,
                actionScore,
                potentialSavings,
                highRiskTerms,
                recommend(snapshot),
                clock.instant());

        log.debug("aggregate.completed summary={}", summary);
        return summary;
    }

    private double actionScore(Ratio excludedFraction, List<CandidateSuggestion> candidates) {
        int n = Math.min(options.getConfidenceTopN(), candidates.size());
        double confidenceSum = 0.0;
        for (int i = 0; i < n; i++) {
            confidenceSum += candidates.get(i).confidenceScore();
        }
        Ratio meanConfidence = n > 0 ? new Ratio(confidenceSum / n / 100.0) : Ratio.ZERO;

        double blended = excludedFraction.weighted(options.getExcludedWeight())
                + meanConfidence.weighted(options.getConfidenceWeight());
        return round1(Math.max(0.0, Math.min(100.0, blended * 100.0)));
    }

    private List<HighRiskTerm> rankHighRisk(List<SearchTermRecord> highRisk) {
        if (highRisk.isEmpty() || options.getHighRiskLimit() == 0) {
            return List.of();
        }
        double meanCost = highRisk.stream().mapToDouble(SearchTermRecord::costOrZero).average().orElse(0.0);

        List<SearchTermRecord> sorted = new ArrayList<>(highRisk);
        sorted.sort(BY_COST_DESC);

        List<HighRiskTerm> result = new ArrayList<>();
        for (SearchTermRecord record : sorted.subList(0, Math.min(options.getHighRiskLimit(), sorted.size()))) {
            HighRiskTerm.RiskLevel level = meanCost > 0 && record.costOrZero() >= 2 * meanCost
                    ? HighRiskTerm.RiskLevel.CRITICAL
                    : HighRiskTerm.RiskLevel.HIGH;
            result.add(new HighRiskTerm(
                    record.getTerm() != null ? record.getTerm() : "",
                    record.impressionsOrZero(),
                    record.clicksOrZero(),
                    record.costOrZero(),
                    level));
        }
        return result;
    }

    private List<String> recommend(AnalyticsSnapshot snapshot) {
        List<String> messages = new ArrayList<>();
        for (RecommendationRule rule : options.getRecommendationRules()) {
            if (messages.size() >= options.getRecommendationLimit()) {
                break;
            }
            if (rule.appliesTo(snapshot)) {
                messages.add(rule.render(snapshot));
            }
        }
        if (messages.isEmpty()) {
            messages.add(DefaultRecommendationRules.FALLBACK);
        }
        return messages;
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
