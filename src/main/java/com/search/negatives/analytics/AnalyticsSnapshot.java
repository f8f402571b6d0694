package com.search.negatives.analytics;

import com.search.negatives.core.model.CandidateSuggestion;

import java.util.List;

/**
 * The computed metrics that recommendation rules are evaluated against.
 */
public record AnalyticsSnapshot(
        int totalTerms,
        int excludedCount,
        int remainingCount,
        double costWastePrevented,
        double totalRemainingSpend,
        double costReductionPercentage,
        double qualityScore,
        double actionScore,
        double potentialSavings,
        int highRiskCount,
        List<CandidateSuggestion> candidates
) {
    public AnalyticsSnapshot {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    /**
     * Number of candidates at or above the given confidence.
     */
    public long candidatesAtLeast(double confidence) {
        return candidates.stream().filter(c -> c.confidenceScore() >= confidence).count();
    }
}
