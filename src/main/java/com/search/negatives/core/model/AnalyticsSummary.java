package com.search.negatives.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one filtering run.
 *
 * @param totalTerms              number of records analyzed
 * @param excludedCount           records excluded by a negative keyword
 * @param remainingCount          records left for review
 * @param costWastePrevented      summed cost of excluded records (0 when no record has a cost)
 * @param totalRemainingSpend     summed cost of remaining records
 * @param costReductionPercentage share of total spend removed by the exclusions, in percent
 * @param impressionsEliminated   summed impressions of excluded records
 * @param qualityScore            remaining share of all terms, in percent
 * @param actionScore             0-100 urgency of acting on the results
 * @param potentialSavings        summed wasted cost of the suggested negatives
 * @param highRiskTerms           remaining poor performers, highest cost first
 * @param recommendations         ordered action recommendations
 * @param generatedAt             when the summary was computed
 */
public record AnalyticsSummary(
        int totalTerms,
        int excludedCount,
        int remainingCount,
        double costWastePrevented,
        double totalRemainingSpend,
        double costReductionPercentage,
        long impressionsEliminated,
        double qualityScore,
        double actionScore,
        double potentialSavings,
        List<HighRiskTerm> highRiskTerms,
        List<String> recommendations,
        Instant generatedAt
) {
    public static final double ACTION_REQUIRED_THRESHOLD = 60.0;

    public AnalyticsSummary {
        if (excludedCount + remainingCount != totalTerms) {
            throw new IllegalArgumentException("excludedCount + remainingCount must equal totalTerms ("
                    + excludedCount + " + " + remainingCount + " != " + totalTerms + ")");
        }
        if (actionScore < 0.0 || actionScore > 100.0) {
            throw new IllegalArgumentException("actionScore must be between 0 and 100");
        }
        highRiskTerms = highRiskTerms != null ? List.copyOf(highRiskTerms) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    /**
     * Returns true if the action score says the negatives should be applied now.
     */
    public boolean isActionRequired() {
        return actionScore >= ACTION_REQUIRED_THRESHOLD;
    }

    @Override
    public String toString() {
        return "AnalyticsSummary{total=" + totalTerms +
                ", excluded=" + excludedCount +
                ", remaining=" + remainingCount +
                ", costWastePrevented=" + costWastePrevented +
                ", qualityScore=" + qualityScore +
                ", actionScore=" + actionScore +
                ", highRisk=" + highRiskTerms.size() + '}';
    }
}
