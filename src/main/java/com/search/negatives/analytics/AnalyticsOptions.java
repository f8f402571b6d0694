package com.search.negatives.analytics;

import com.search.negatives.suggestion.PoorPerformerPredicate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Options for the analytics aggregator.
 *
 * <p>The action score is
 * {@code 100 * (excludedWeight * excludedFraction + confidenceWeight * meanTopConfidence / 100)},
 * where the mean is taken over the first {@code confidenceTopN} suggestions.</p>
 */
public class AnalyticsOptions {

    private final int highRiskLimit;
    private final int recommendationLimit;
    private final double excludedWeight;
    private final double confidenceWeight;
    private final int confidenceTopN;
    private final PoorPerformerPredicate highRiskPredicate;
    private final List<RecommendationRule> recommendationRules;

    private AnalyticsOptions(Builder builder) {
        this.highRiskLimit = builder.highRiskLimit;
        this.recommendationLimit = builder.recommendationLimit;
        this.excludedWeight = builder.excludedWeight;
        this.confidenceWeight = builder.confidenceWeight;
        this.confidenceTopN = builder.confidenceTopN;
        this.highRiskPredicate = builder.highRiskPredicate;
        List<RecommendationRule> sorted = new ArrayList<>(builder.recommendationRules);
        sorted.sort(Comparator.comparingInt(RecommendationRule::priority));
        this.recommendationRules = List.copyOf(sorted);
    }

    public static AnalyticsOptions defaults() {
        return builder().build();
    }

    public int getHighRiskLimit() {
        return highRiskLimit;
    }

    public int getRecommendationLimit() {
        return recommendationLimit;
    }

    public double getExcludedWeight() {
        return excludedWeight;
    }

    public double getConfidenceWeight() {
        return confidenceWeight;
    }

    public int getConfidenceTopN() {
        return confidenceTopN;
    }

    public PoorPerformerPredicate getHighRiskPredicate() {
        return highRiskPredicate;
    }

    public List<RecommendationRule> getRecommendationRules() {
        return recommendationRules;
    }

    /**
     * Copy of these options that flags high-risk terms with the given predicate.
     */
    public AnalyticsOptions withHighRiskPredicate(PoorPerformerPredicate predicate) {
        return builder()
                .highRiskLimit(highRiskLimit)
                .recommendationLimit(recommendationLimit)
                .actionWeights(excludedWeight, confidenceWeight)
                .confidenceTopN(confidenceTopN)
                .highRiskPredicate(predicate)
                .recommendationRules(recommendationRules)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int highRiskLimit = 10;
        private int recommendationLimit = 3;
        private double excludedWeight = 0.5;
        private double confidenceWeight = 0.5;
        private int confidenceTopN = 10;
        private PoorPerformerPredicate highRiskPredicate = PoorPerformerPredicate.WASTED_SPEND;
        private List<RecommendationRule> recommendationRules = DefaultRecommendationRules.getRules();

        public Builder highRiskLimit(int highRiskLimit) {
            if (highRiskLimit < 0) {
                throw new IllegalArgumentException("highRiskLimit must be non-negative");
            }
            this.highRiskLimit = highRiskLimit;
            return this;
        }

        public Builder recommendationLimit(int recommendationLimit) {
            if (recommendationLimit < 1) {
                throw new IllegalArgumentException("recommendationLimit must be at least 1");
            }
            this.recommendationLimit = recommendationLimit;
            return this;
        }

        public Builder actionWeights(double excludedWeight, double confidenceWeight) {
            if (excludedWeight < 0 || confidenceWeight < 0) {
                throw new IllegalArgumentException("Weights must be non-negative");
            }
            double sum = excludedWeight + confidenceWeight;
            if (Math.abs(sum - 1.0) > 0.001) {
                throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
            }
            this.excludedWeight = excludedWeight;
            this.confidenceWeight = confidenceWeight;
            return this;
        }

        public Builder confidenceTopN(int confidenceTopN) {
            if (confidenceTopN < 1) {
                throw new IllegalArgumentException("confidenceTopN must be at least 1");
            }
            this.confidenceTopN = confidenceTopN;
            return this;
        }

        public Builder highRiskPredicate(PoorPerformerPredicate highRiskPredicate) {
            if (highRiskPredicate == null) {
                throw new IllegalArgumentException("highRiskPredicate is required");
            }
            this.highRiskPredicate = highRiskPredicate;
            return this;
        }

        public Builder recommendationRules(List<RecommendationRule> recommendationRules) {
            this.recommendationRules = recommendationRules != null ? List.copyOf(recommendationRules) : List.of();
            return this;
        }

        public AnalyticsOptions build() {
            return new AnalyticsOptions(this);
        }
    }
}
