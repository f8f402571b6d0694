package com.search.negatives.exception;

/**
 * Thrown when a negative keyword rule cannot be built: an unrecognized
 * match type or a keyword that is empty after normalization.
 */
public class InvalidRuleException extends NegativeFilterException {

    private final String keyword;
    private final String matchType;

    public InvalidRuleException(String message, String keyword, String matchType) {
        super(message);
        this.keyword = keyword;
        this.matchType = matchType;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getMatchType() {
        return matchType;
    }
}
