package com.search.negatives.core.model;

/**
 * Unvalidated negative keyword row as supplied by a loader.
 * Validation into a {@link NegativeKeywordRule} happens inside the unit that uses it,
 * so one bad row only fails that unit.
 *
 * @param keyword    raw keyword text
 * @param matchType  raw match type value (case-insensitive Exact, Phrase or Broad)
 * @param lineNumber 1-based source line, or -1 when not loaded from a file
 */
public record NegativeKeywordEntry(String keyword, String matchType, long lineNumber) {

    public static NegativeKeywordEntry of(String keyword, String matchType) {
        return new NegativeKeywordEntry(keyword, matchType, -1);
    }
}
