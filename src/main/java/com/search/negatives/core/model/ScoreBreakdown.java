package com.search.negatives.core.model;

import java.util.Objects;

/**
 * The three sub-scores behind a candidate's confidence.
 *
 * @param occurrence     share of poor performers containing the candidate
 * @param costImpact     share of overall wasted cost attributable to the candidate
 * @param zeroConversion share of the candidate's occurrences that had no conversions
 */
public record ScoreBreakdown(Ratio occurrence, Ratio costImpact, Ratio zeroConversion) {

    public ScoreBreakdown {
        Objects.requireNonNull(occurrence, "occurrence is required");
        Objects.requireNonNull(costImpact, "costImpact is required");
        Objects.requireNonNull(zeroConversion, "zeroConversion is required");
    }

    @Override
    public String toString() {
        return String.format("ScoreBreakdown{occurrence=%.4f, costImpact=%.4f, zeroConversion=%.4f}",
                occurrence.value(), costImpact.value(), zeroConversion.value());
    }
}
