package com.search.negatives.rules;

import java.util.List;

/**
 * Built-in normalization rules for ad platform exports.
 */
public final class DefaultTermRules {

    private DefaultTermRules() {
        // Utility class
    }

    /**
     * Rules applied by {@link TermNormalizer#defaultNormalizer()}.
     */
    public static List<NormalizationRule> getStandardRules() {
        return List.of(surroundingQuotes());
    }

    /**
     * Standard rules plus punctuation stripping, for exports where terms carry
     * possessives or stray symbols ({@code kids' shoes} becomes {@code kids shoes}).
     */
    public static List<NormalizationRule> getPunctuationStrippingRules() {
        return List.of(surroundingQuotes(), punctuation());
    }

    /**
     * Removes one pair of surrounding quotes or brackets, the notation ad platforms
     * use for phrase ({@code "running shoes"}) and exact ({@code [running shoes]}) keywords.
     */
    public static NormalizationRule surroundingQuotes() {
        return NormalizationRule.of("surrounding-quotes", "^(?:\"(.*)\"|'(.*)'|\\[(.*)\\])$", "$1$2$3", 10);
    }

    /**
     * Replaces anything that is not a letter, digit or whitespace with a space.
     */
    public static NormalizationRule punctuation() {
        return NormalizationRule.of("punctuation", "[^\\p{L}\\p{N}\\s]", " ", 50);
    }
}
