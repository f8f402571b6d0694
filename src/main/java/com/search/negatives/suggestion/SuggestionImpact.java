package com.search.negatives.suggestion;

import com.search.negatives.core.CancellationToken;
import com.search.negatives.core.model.CandidateSuggestion;
import com.search.negatives.core.model.NegativeKeywordRule;
import com.search.negatives.core.model.SearchTermRecord;
import com.search.negatives.matcher.MatchOutcome;
import com.search.negatives.matcher.NegativeKeywordMatcher;
import com.search.negatives.rules.TermNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * What applying a list of suggestions would save.
 *
 * @param totalSuggested          number of suggestions
 * @param potentialCostSavings    summed cost of remaining records that at least one suggestion would exclude
 * @param potentialImpressionReduction summed impressions of those records
 * @param affectedTerms           number of those records
 * @param topPriority             highest-ranked suggestion text, or {@code null} when there are none
 */
public record SuggestionImpact(
        int totalSuggested,
        double potentialCostSavings,
        long potentialImpressionReduction,
        int affectedTerms,
        String topPriority
) {
    public static SuggestionImpact none() {
        return new SuggestionImpact(0, 0.0, 0, 0, null);
    }

    /**
     * Replays the suggestions as negatives over the remaining records.
     * Each record counts once, however many suggestions would catch it,
     * so overlapping n-grams ("free" and "free shipping") do not double the savings.
     */
    public static SuggestionImpact estimate(List<SearchTermRecord> records,
                                            List<CandidateSuggestion> candidates,
                                            TermNormalizer normalizer) {
        return estimate(records, candidates, normalizer, CancellationToken.none());
    }

    /**
     * Same as {@link #estimate(List, List, TermNormalizer)}, checking for cancellation between records.
     * Candidates whose text normalizes to nothing cannot match and are skipped.
     *
     * @throws com.search.negatives.exception.ComputationTimeoutException if cancelled
     */
    public static SuggestionImpact estimate(List<SearchTermRecord> records,
                                            List<CandidateSuggestion> candidates,
                                            TermNormalizer normalizer,
                                            CancellationToken token) {
        if (candidates.isEmpty()) {
            return none();
        }
        List<NegativeKeywordRule> rules = new ArrayList<>(candidates.size());
        for (CandidateSuggestion candidate : candidates) {
            if (normalizer.tokenize(candidate.text()).isEmpty()) {
                continue;
            }
            rules.add(NegativeKeywordRule.compile(candidate.text(), candidate.suggestedMatchType(), normalizer));
        }
        NegativeKeywordMatcher matcher = new NegativeKeywordMatcher(rules, normalizer, null, null);

        double savings = 0.0;
        long impressions = 0;
        int affected = 0;
        for (SearchTermRecord record : records) {
            token.throwIfCancelled("impact estimation");
            if (record.isExcluded()) {
                continue;
            }
            MatchOutcome outcome = matcher.matchOne(record.getTerm());
            if (outcome.isExcluded()) {
                savings += record.costOrZero();
                impressions += (long) record.impressionsOrZero();
                affected++;
            }
        }
        return new SuggestionImpact(candidates.size(), Math.round(savings * 100.0) / 100.0,
                impressions, affected, candidates.get(0).text());
    }
}
