package com.search.negatives.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a search term report.
 *
 * <p>Performance metrics are nullable: a missing or non-finite value is stored as
 * {@code null} and treated as absent, never as an error. The classification fields
 * are written exactly once by the matcher and are read-only afterwards.</p>
 *
 * <p>Instances are not thread-safe. A record belongs to the unit of work that
 * created it and must not be shared between concurrently running units.</p>
 */
public class SearchTermRecord {

    public static final String NOT_MATCHED = "Not matched by any negative";

    private final String term;
    private final Double impressions;
    private final Double clicks;
    private final Double cost;
    private final Double conversions;
    private final Map<String, String> attributes;
    private final long lineNumber;

    private boolean classified;
    private boolean excluded;
    private String exclusionReason;
    private String matchedKeyword;
    private MatchType matchedMatchType;
    private Instant checkedAt;

    private SearchTermRecord(Builder builder) {
        this.term = builder.term;
        this.impressions = repair(builder.impressions);
        this.clicks = repair(builder.clicks);
        this.cost = repair(builder.cost);
        this.conversions = repair(builder.conversions);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.lineNumber = builder.lineNumber;
    }

    private SearchTermRecord(SearchTermRecord source) {
        this.term = source.term;
        this.impressions = source.impressions;
        this.clicks = source.clicks;
        this.cost = source.cost;
        this.conversions = source.conversions;
        this.attributes = source.attributes;
        this.lineNumber = source.lineNumber;
    }

    /**
     * Shorthand for a record with only a term and a cost.
     */
    public static SearchTermRecord of(String term, Double cost) {
        return builder().term(term).cost(cost).build();
    }

    /**
     * Marks this record as excluded by the given rule.
     *
     * @throws IllegalStateException if the record was already classified
     */
    public void markExcluded(NegativeKeywordRule rule, Instant checkedAt) {
        Objects.requireNonNull(rule, "rule is required");
        checkNotClassified();
        this.excluded = true;
        this.exclusionReason = "Excluded by " + rule.getMatchType().name() + " negative: " + rule.getKeyword();
        this.matchedKeyword = rule.getKeyword();
        this.matchedMatchType = rule.getMatchType();
        this.checkedAt = checkedAt;
        this.classified = true;
    }

    /**
     * Marks this record as checked and not matched by any rule.
     *
     * @throws IllegalStateException if the record was already classified
     */
    public void markRetained(Instant checkedAt) {
        checkNotClassified();
        this.excluded = false;
        this.exclusionReason = null;
        this.matchedKeyword = null;
        this.matchedMatchType = null;
        this.checkedAt = checkedAt;
        this.classified = true;
    }

    /**
     * Same term and metrics, not yet classified. Lets a unit classify privately and
     * publish only once it has finished.
     */
    public SearchTermRecord unclassifiedCopy() {
        return new SearchTermRecord(this);
    }

    /**
     * Takes over the classification of a copy made with {@link #unclassifiedCopy()}.
     *
     * @throws IllegalStateException if the source is unclassified or this record already is classified
     */
    public void adoptClassification(SearchTermRecord source) {
        if (!source.classified) {
            throw new IllegalStateException("Source record is not classified: " + source.term);
        }
        checkNotClassified();
        this.excluded = source.excluded;
        this.exclusionReason = source.exclusionReason;
        this.matchedKeyword = source.matchedKeyword;
        this.matchedMatchType = source.matchedMatchType;
        this.checkedAt = source.checkedAt;
        this.classified = true;
    }

    private void checkNotClassified() {
        if (classified) {
            throw new IllegalStateException("Search term record is already classified: " + term);
        }
    }

    /**
     * Click-through rate in percent, or 0 when impressions are missing or zero.
     */
    public double clickThroughRate() {
        double imps = impressionsOrZero();
        return imps > 0 ? clicksOrZero() / imps * 100.0 : 0.0;
    }

    /**
     * Cost per click, or 0 when clicks are missing or zero.
     */
    public double costPerClick() {
        double c = clicksOrZero();
        return c > 0 ? costOrZero() / c : 0.0;
    }

    /**
     * Human-readable classification status, suitable for an audit column.
     */
    public String statusDescription() {
        if (!classified) {
            return "Not checked";
        }
        return excluded ? exclusionReason : NOT_MATCHED;
    }

    public String getTerm() {
        return term;
    }

    public Double getImpressions() {
        return impressions;
    }

    public Double getClicks() {
        return clicks;
    }

    public Double getCost() {
        return cost;
    }

    public Double getConversions() {
        return conversions;
    }

    public double impressionsOrZero() {
        return impressions != null ? impressions : 0.0;
    }

    public double clicksOrZero() {
        return clicks != null ? clicks : 0.0;
    }

    public double costOrZero() {
        return cost != null ? cost : 0.0;
    }

    public double conversionsOrZero() {
        return conversions != null ? conversions : 0.0;
    }

    public boolean hasCost() {
        return cost != null;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public boolean isClassified() {
        return classified;
    }

    public boolean isExcluded() {
        return excluded;
    }

    public String getExclusionReason() {
        return exclusionReason;
    }

    public String getMatchedKeyword() {
        return matchedKeyword;
    }

    public MatchType getMatchedMatchType() {
        return matchedMatchType;
    }

    public Instant getCheckedAt() {
        return checkedAt;
    }

    private static Double repair(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return value;
    }

    @Override
    public String toString() {
        return "SearchTermRecord{" +
                "term='" + term + '\'' +
                ", cost=" + cost +
                ", excluded=" + excluded +
                (matchedKeyword != null ? ", matchedKeyword='" + matchedKeyword + '\'' : "") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String term;
        private Double impressions;
        private Double clicks;
        private Double cost;
        private Double conversions;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private long lineNumber = -1;

        public Builder term(String term) {
            this.term = term;
            return this;
        }

        public Builder impressions(Double impressions) {
            this.impressions = impressions;
            return this;
        }

        public Builder clicks(Double clicks) {
            this.clicks = clicks;
            return this;
        }

        public Builder cost(Double cost) {
            this.cost = cost;
            return this;
        }

        public Builder conversions(Double conversions) {
            this.conversions = conversions;
            return this;
        }

        public Builder attribute(String name, String value) {
            this.attributes.put(Objects.requireNonNull(name, "attribute name is required"), value);
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        public Builder lineNumber(long lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public SearchTermRecord build() {
            return new SearchTermRecord(this);
        }
    }
}
