package com.search.negatives.core.model;

/**
 * A remaining (not excluded) term that is still spending without converting.
 */
public record HighRiskTerm(
        String term,
        double impressions,
        double clicks,
        double cost,
        RiskLevel riskLevel
) {
    public enum RiskLevel { CRITICAL, HIGH }
}
