package com.search.negatives.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Output of one full matcher, suggestion and analytics pass over a unit of work.
 *
 * @param unitId     caller-supplied identity of the unit
 * @param records    classified records, in input order
 * @param candidates ranked negative keyword suggestions
 * @param summary    aggregated analytics
 */
public record FilterResult(
        String unitId,
        List<SearchTermRecord> records,
        List<CandidateSuggestion> candidates,
        AnalyticsSummary summary
) {
    public FilterResult {
        Objects.requireNonNull(summary, "summary is required");
        records = records != null ? List.copyOf(records) : List.of();
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    /**
     * Records left for manual review (not excluded).
     */
    public List<SearchTermRecord> reviewRecords() {
        return records.stream().filter(r -> !r.isExcluded()).toList();
    }

    /**
     * All records, excluded or not, for the audit trail.
     */
    public List<SearchTermRecord> auditRecords() {
        return records;
    }

    /**
     * Records excluded by a negative keyword.
     */
    public List<SearchTermRecord> excludedRecords() {
        return records.stream().filter(SearchTermRecord::isExcluded).toList();
    }
}
