package com.search.negatives.api;

import com.search.negatives.analytics.AnalyticsOptions;
import com.search.negatives.batch.BatchOptions;
import com.search.negatives.suggestion.PoorPerformerPredicate;
import com.search.negatives.suggestion.SuggestionOptions;

import java.time.Duration;
import java.util.Properties;

/**
 * Groups the option objects of every stage, plus normalizer selection.
 *
 * <p>Can be read from a {@link Properties} source. Recognized keys:</p>
 * <pre>
 * negatives.normalizer.stripPunctuation   boolean
 * negatives.suggestion.topK               int
 * negatives.suggestion.maxNgramLength     int
 * negatives.suggestion.minTokenLength     int
 * negatives.suggestion.minOccurrences     int
 * negatives.suggestion.minConfidence      double
 * negatives.suggestion.includeExcluded    boolean
 * negatives.suggestion.minWastedCost      double, poor performer: spent at least this without converting
 * negatives.suggestion.minZeroClickImpressions double, poor performer: more impressions than this, no click
 * negatives.analytics.highRiskLimit       int
 * negatives.analytics.recommendationLimit int
 * negatives.batch.parallelism             int
 * negatives.batch.unitTimeoutMs           long
 * negatives.batch.queueCapacity           int
 * </pre>
 * Missing keys keep their defaults. When both poor-performer keys are set, a term
 * meeting either one is a poor performer.
 *
 * <p>The poor-performer predicate of the suggestion options also decides which
 * remaining terms the analytics report as high risk.</p>
 */
public class FilterOptions {

    public static final String PREFIX = "negatives.";

    private final boolean stripPunctuation;
    private final SuggestionOptions suggestionOptions;
    private final AnalyticsOptions analyticsOptions;
    private final BatchOptions batchOptions;

    private FilterOptions(Builder builder) {
        this.stripPunctuation = builder.stripPunctuation;
        this.suggestionOptions = builder.suggestionOptions;
        this.analyticsOptions = builder.analyticsOptions
                .withHighRiskPredicate(builder.suggestionOptions.getPoorPerformer());
        this.batchOptions = builder.batchOptions;
    }

    public static FilterOptions defaults() {
        return builder().build();
    }

    /**
     * Reads options from {@code negatives.*} properties.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or fails validation
     */
    public static FilterOptions fromProperties(Properties props) {
        SuggestionOptions.Builder suggestion = SuggestionOptions.builder();
        SuggestionOptions defaultsSuggestion = SuggestionOptions.defaults();
        suggestion.topK(intValue(props, "suggestion.topK", defaultsSuggestion.getTopK()))
                .maxNgramLength(intValue(props, "suggestion.maxNgramLength", defaultsSuggestion.getMaxNgramLength()))
                .minTokenLength(intValue(props, "suggestion.minTokenLength", defaultsSuggestion.getMinTokenLength()))
                .minOccurrences(intValue(props, "suggestion.minOccurrences", defaultsSuggestion.getMinOccurrences()))
                .minConfidence(doubleValue(props, "suggestion.minConfidence", defaultsSuggestion.getMinConfidence()))
                .includeExcluded(booleanValue(props, "suggestion.includeExcluded", defaultsSuggestion.isIncludeExcluded()));
        PoorPerformerPredicate poorPerformer = poorPerformer(props);
        if (poorPerformer != null) {
            suggestion.poorPerformer(poorPerformer);
        }

        AnalyticsOptions defaultsAnalytics = AnalyticsOptions.defaults();
        AnalyticsOptions analytics = AnalyticsOptions.builder()
                .highRiskLimit(intValue(props, "analytics.highRiskLimit", defaultsAnalytics.getHighRiskLimit()))
                .recommendationLimit(intValue(props, "analytics.recommendationLimit",
                        defaultsAnalytics.getRecommendationLimit()))
                .build();

        BatchOptions defaultsBatch = BatchOptions.defaults();
        BatchOptions batch = new BatchOptions(
                intValue(props, "batch.parallelism", defaultsBatch.parallelism()),
                Duration.ofMillis(longValue(props, "batch.unitTimeoutMs", defaultsBatch.unitTimeout().toMillis())),
                intValue(props, "batch.queueCapacity", defaultsBatch.queueCapacity()),
                defaultsBatch.hardStopGrace());

        return builder()
                .stripPunctuation(booleanValue(props, "normalizer.stripPunctuation", false))
                .suggestionOptions(suggestion.build())
                .analyticsOptions(analytics)
                .batchOptions(batch)
                .build();
    }

    private static PoorPerformerPredicate poorPerformer(Properties props) {
        PoorPerformerPredicate predicate = null;
        if (raw(props, "suggestion.minWastedCost") != null) {
            predicate = PoorPerformerPredicate.minimumWaste(doubleValue(props, "suggestion.minWastedCost", 0.0));
        }
        if (raw(props, "suggestion.minZeroClickImpressions") != null) {
            PoorPerformerPredicate zeroClick = PoorPerformerPredicate.zeroClickImpressions(
                    doubleValue(props, "suggestion.minZeroClickImpressions", 0.0));
            predicate = predicate != null ? predicate.or(zeroClick) : zeroClick;
        }
        return predicate;
    }

    private static String raw(Properties props, String key) {
        String value = props.getProperty(PREFIX + key);
        return value != null && !value.isBlank() ? value.trim() : null;
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        String value = raw(props, key);
        try {
            return value != null ? Integer.parseInt(value) : defaultValue;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static long longValue(Properties props, String key, long defaultValue) {
        String value = raw(props, key);
        try {
            return value != null ? Long.parseLong(value) : defaultValue;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties props, String key, double defaultValue) {
        String value = raw(props, key);
        try {
            return value != null ? Double.parseDouble(value) : defaultValue;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": " + value, e);
        }
    }

    private static boolean booleanValue(Properties props, String key, boolean defaultValue) {
        String value = raw(props, key);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + PREFIX + key + ": " + value);
    }

    public boolean isStripPunctuation() {
        return stripPunctuation;
    }

    public SuggestionOptions getSuggestionOptions() {
        return suggestionOptions;
    }

    public AnalyticsOptions getAnalyticsOptions() {
        return analyticsOptions;
    }

    public BatchOptions getBatchOptions() {
        return batchOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean stripPunctuation = false;
        private SuggestionOptions suggestionOptions = SuggestionOptions.defaults();
        private AnalyticsOptions analyticsOptions = AnalyticsOptions.defaults();
        private BatchOptions batchOptions = BatchOptions.defaults();

        public Builder stripPunctuation(boolean stripPunctuation) {
            this.stripPunctuation = stripPunctuation;
            return this;
        }

        public Builder suggestionOptions(SuggestionOptions suggestionOptions) {
            if (suggestionOptions == null) {
                throw new IllegalArgumentException("suggestionOptions is required");
            }
            this.suggestionOptions = suggestionOptions;
            return this;
        }

        public Builder analyticsOptions(AnalyticsOptions analyticsOptions) {
            if (analyticsOptions == null) {
                throw new IllegalArgumentException("analyticsOptions is required");
            }
            this.analyticsOptions = analyticsOptions;
            return this;
        }

        public Builder batchOptions(BatchOptions batchOptions) {
            if (batchOptions == null) {
                throw new IllegalArgumentException("batchOptions is required");
            }
            this.batchOptions = batchOptions;
            return this;
        }

        public FilterOptions build() {
            return new FilterOptions(this);
        }
    }
}
