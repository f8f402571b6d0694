package com.search.negatives.suggestion;

/**
 * Weights of the three confidence sub-scores.
 * Non-negative and summing to 1.0, so the weighted sum of [0,1] sub-scores stays in [0,1].
 */
public record ScoreWeights(
        double occurrenceWeight,
        double costImpactWeight,
        double zeroConversionWeight
) {
    public ScoreWeights {
        if (occurrenceWeight < 0 || costImpactWeight < 0 || zeroConversionWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = occurrenceWeight + costImpactWeight + zeroConversionWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 0.30 occurrence, 0.40 cost impact, 0.30 zero conversion.
     */
    public static ScoreWeights defaultWeights() {
        return new ScoreWeights(0.30, 0.40, 0.30);
    }

    /**
     * Weights favoring spend, for accounts where a few expensive terms dominate.
     */
    public static ScoreWeights costFocused() {
        return new ScoreWeights(0.20, 0.60, 0.20);
    }
}
