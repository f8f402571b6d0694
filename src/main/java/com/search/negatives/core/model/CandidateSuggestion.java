package com.search.negatives.core.model;

import java.util.Objects;

/**
 * A suggested new negative keyword mined from poorly performing search terms.
 *
 * @param text                candidate keyword (normalized n-gram)
 * @param wordCount           number of tokens in the candidate
 * @param occurrenceCount     number of poor-performer records containing the candidate
 * @param totalCostWaste      summed cost of those records
 * @param confidenceScore     0-100 estimate of how strongly the candidate should be negated
 * @param supportingTermCount number of distinct normalized terms containing the candidate
 * @param zeroConversionCount occurrences that had no conversions
 * @param suggestedMatchType  BROAD for single words, PHRASE for multi-word candidates
 * @param impactRating        priority derived from confidence and waste
 * @param breakdown           the sub-scores behind the confidence
 */
public record CandidateSuggestion(
        String text,
        int wordCount,
        int occurrenceCount,
        double totalCostWaste,
        double confidenceScore,
        int supportingTermCount,
        int zeroConversionCount,
        MatchType suggestedMatchType,
        ImpactRating impactRating,
        ScoreBreakdown breakdown
) {
    public CandidateSuggestion {
        Objects.requireNonNull(text, "text is required");
        if (Double.isNaN(confidenceScore) || confidenceScore < 0.0 || confidenceScore > 100.0) {
            throw new IllegalArgumentException("confidenceScore must be between 0 and 100, got " + confidenceScore);
        }
        if (occurrenceCount < 0 || supportingTermCount < 0 || zeroConversionCount < 0) {
            throw new IllegalArgumentException("counts must be non-negative");
        }
    }
}
