package com.search.negatives.core.model;

import com.search.negatives.exception.InvalidRuleException;

import java.util.Locale;

/**
 * Matching semantics for a negative keyword.
 */
public enum MatchType {
    /**
     * The whole normalized term must equal the normalized keyword.
     */
    EXACT("Exact"),

    /**
     * The keyword tokens must appear as a contiguous run inside the term tokens.
     */
    PHRASE("Phrase"),

    /**
     * Every keyword token must appear somewhere in the term, in any order.
     */
    BROAD("Broad");

    private final String label;

    MatchType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a match type value case-insensitively.
     * Unrecognized values are rejected rather than coerced to a default.
     *
     * @throws InvalidRuleException if the value is blank or not one of Exact, Phrase, Broad
     */
    public static MatchType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRuleException("Match type is required", null, value);
        }
        String upper = value.trim().toUpperCase(Locale.ROOT);
        for (MatchType type : values()) {
            if (type.name().equals(upper)) {
                return type;
            }
        }
        throw new InvalidRuleException("Unrecognized match type '" + value.trim()
                + "' (expected Exact, Phrase or Broad)", null, value);
    }
}
