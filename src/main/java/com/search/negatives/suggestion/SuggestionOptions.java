package com.search.negatives.suggestion;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Options for negative keyword suggestion.
 */
public class SuggestionOptions {

    private static final int DEFAULT_TOP_K = 50;
    private static final int DEFAULT_MAX_NGRAM_LENGTH = 3;
    private static final int DEFAULT_MIN_TOKEN_LENGTH = 3;
    private static final double DEFAULT_COST_EPSILON = 1e-9;

    /**
     * English function words that never make a useful negative on their own.
     */
    public static final Set<String> DEFAULT_STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "can", "do", "for", "from",
            "how", "i", "in", "is", "it", "me", "my", "near", "of", "on", "or", "the",
            "to", "vs", "what", "when", "where", "which", "who", "why", "with", "you", "your");

    private final int topK;
    private final int maxNgramLength;
    private final int minTokenLength;
    private final Set<String> stopWords;
    private final PoorPerformerPredicate poorPerformer;
    private final boolean includeExcluded;
    private final double minConfidence;
    private final int minOccurrences;
    private final ScoreWeights weights;
    private final double costEpsilon;

    private SuggestionOptions(Builder builder) {
        this.topK = builder.topK;
        this.maxNgramLength = builder.maxNgramLength;
        this.minTokenLength = builder.minTokenLength;
        this.stopWords = builder.stopWords;
        this.poorPerformer = builder.poorPerformer;
        this.includeExcluded = builder.includeExcluded;
        this.minConfidence = builder.minConfidence;
        this.minOccurrences = builder.minOccurrences;
        this.weights = builder.weights;
        this.costEpsilon = builder.costEpsilon;
    }

    public static SuggestionOptions defaults() {
        return builder().build();
    }

    public int getTopK() {
        return topK;
    }

    public int getMaxNgramLength() {
        return maxNgramLength;
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }

    public Set<String> getStopWords() {
        return stopWords;
    }

    public PoorPerformerPredicate getPoorPerformer() {
        return poorPerformer;
    }

    /**
     * Whether records already excluded by an existing negative are mined too.
     * Off by default: suggestions target what the current list lets through.
     */
    public boolean isIncludeExcluded() {
        return includeExcluded;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public int getMinOccurrences() {
        return minOccurrences;
    }

    public ScoreWeights getWeights() {
        return weights;
    }

    public double getCostEpsilon() {
        return costEpsilon;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int topK = DEFAULT_TOP_K;
        private int maxNgramLength = DEFAULT_MAX_NGRAM_LENGTH;
        private int minTokenLength = DEFAULT_MIN_TOKEN_LENGTH;
        private Set<String> stopWords = DEFAULT_STOP_WORDS;
        private PoorPerformerPredicate poorPerformer = PoorPerformerPredicate.WASTED_SPEND;
        private boolean includeExcluded = false;
        private double minConfidence = 0.0;
        private int minOccurrences = 1;
        private ScoreWeights weights = ScoreWeights.defaultWeights();
        private double costEpsilon = DEFAULT_COST_EPSILON;

        public Builder topK(int topK) {
            if (topK <= 0) {
                throw new IllegalArgumentException("topK must be positive");
            }
            this.topK = topK;
            return this;
        }

        public Builder maxNgramLength(int maxNgramLength) {
            if (maxNgramLength <= 0) {
                throw new IllegalArgumentException("maxNgramLength must be positive");
            }
            this.maxNgramLength = maxNgramLength;
            return this;
        }

        public Builder minTokenLength(int minTokenLength) {
            if (minTokenLength < 1) {
                throw new IllegalArgumentException("minTokenLength must be at least 1");
            }
            this.minTokenLength = minTokenLength;
            return this;
        }

        public Builder stopWords(Set<String> stopWords) {
            this.stopWords = stopWords == null ? Set.of() : stopWords.stream()
                    .map(w -> w.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
            return this;
        }

        public Builder poorPerformer(PoorPerformerPredicate poorPerformer) {
            if (poorPerformer == null) {
                throw new IllegalArgumentException("poorPerformer is required");
            }
            this.poorPerformer = poorPerformer;
            return this;
        }

        public Builder includeExcluded(boolean includeExcluded) {
            this.includeExcluded = includeExcluded;
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            if (minConfidence < 0.0 || minConfidence > 100.0) {
                throw new IllegalArgumentException("minConfidence must be between 0 and 100");
            }
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder minOccurrences(int minOccurrences) {
            if (minOccurrences < 1) {
                throw new IllegalArgumentException("minOccurrences must be at least 1");
            }
            this.minOccurrences = minOccurrences;
            return this;
        }

        public Builder weights(ScoreWeights weights) {
            if (weights == null) {
                throw new IllegalArgumentException("weights is required");
            }
            this.weights = weights;
            return this;
        }

        public Builder costEpsilon(double costEpsilon) {
            if (!(costEpsilon > 0.0)) {
                throw new IllegalArgumentException("costEpsilon must be positive");
            }
            this.costEpsilon = costEpsilon;
            return this;
        }

        public SuggestionOptions build() {
            return new SuggestionOptions(this);
        }
    }
}
