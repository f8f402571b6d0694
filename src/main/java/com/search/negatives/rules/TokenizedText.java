package com.search.negatives.rules;

import java.util.List;
import java.util.Set;

/**
 * Normalized text with its whitespace tokens, computed once and reused for every rule.
 *
 * @param normalized normalized text (lowercase, single-spaced, trimmed)
 * @param tokens     tokens in order, duplicates kept
 * @param tokenSet   distinct tokens, for order-insensitive lookups
 */
public record TokenizedText(String normalized, List<String> tokens, Set<String> tokenSet) {

    public static final TokenizedText EMPTY = new TokenizedText("", List.of(), Set.of());

    public TokenizedText {
        tokens = List.copyOf(tokens);
        tokenSet = Set.copyOf(tokenSet);
    }

    public static TokenizedText of(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return EMPTY;
        }
        List<String> tokens = List.of(normalized.split(" "));
        return new TokenizedText(normalized, tokens, Set.copyOf(tokens));
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }
}
