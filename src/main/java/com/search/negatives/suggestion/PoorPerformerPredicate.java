package com.search.negatives.suggestion;

import com.search.negatives.core.model.SearchTermRecord;

/**
 * Decides whether a search term is wasting spend.
 */
@FunctionalInterface
public interface PoorPerformerPredicate {

    /**
     * Spent money and converted nothing. Missing conversions count as zero.
     */
    PoorPerformerPredicate WASTED_SPEND = r -> r.costOrZero() > 0 && r.conversionsOrZero() == 0;

    boolean test(SearchTermRecord record);

    /**
     * Shown more than {@code minImpressions} times without a single click.
     * With 10 this is the classic "high impressions, zero clicks" rule.
     */
    static PoorPerformerPredicate zeroClickImpressions(double minImpressions) {
        return r -> r.impressionsOrZero() > minImpressions && r.clickThroughRate() == 0.0;
    }

    /**
     * Spent at least {@code minCost} without converting.
     */
    static PoorPerformerPredicate minimumWaste(double minCost) {
        return r -> r.costOrZero() >= minCost && r.costOrZero() > 0 && r.conversionsOrZero() == 0;
    }

    default PoorPerformerPredicate or(PoorPerformerPredicate other) {
        return r -> test(r) || other.test(r);
    }
}
