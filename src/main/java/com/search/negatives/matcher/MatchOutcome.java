package com.search.negatives.matcher;

import com.search.negatives.core.model.MatchType;
import com.search.negatives.core.model.NegativeKeywordRule;
import com.search.negatives.core.model.SearchTermRecord;

/**
 * Result of checking one term against the rule set.
 *
 * @param rule the first rule that matched, or {@code null} when none did
 */
public record MatchOutcome(NegativeKeywordRule rule) {

    private static final MatchOutcome NO_MATCH = new MatchOutcome(null);

    public static MatchOutcome noMatch() {
        return NO_MATCH;
    }

    public boolean isExcluded() {
        return rule != null;
    }

    public MatchType matchType() {
        return rule != null ? rule.getMatchType() : null;
    }

    public String reason() {
        if (rule == null) {
            return SearchTermRecord.NOT_MATCHED;
        }
        return "Excluded by " + rule.getMatchType().name() + " negative: " + rule.getKeyword();
    }
}
