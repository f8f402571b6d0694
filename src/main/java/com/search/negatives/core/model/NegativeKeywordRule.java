package com.search.negatives.core.model;

import com.search.negatives.exception.InvalidRuleException;
import com.search.negatives.rules.TermNormalizer;
import com.search.negatives.rules.TokenizedText;

import java.util.List;
import java.util.Objects;

/**
 * An immutable, pre-normalized negative keyword.
 * The keyword is normalized and tokenized once, when the rule is compiled.
 * Position in the rule list is significant: the first rule that matches a term wins.
 */
public final class NegativeKeywordRule {

    private final String keyword;
    private final TokenizedText text;
    private final MatchType matchType;

    private NegativeKeywordRule(String keyword, TokenizedText text, MatchType matchType) {
        this.keyword = keyword;
        this.text = text;
        this.matchType = matchType;
    }

    /**
     * Compiles a rule using the default normalizer.
     */
    public static NegativeKeywordRule of(String keyword, MatchType matchType) {
        return compile(keyword, matchType, TermNormalizer.defaultNormalizer());
    }

    /**
     * Compiles a rule, normalizing the keyword with the given normalizer.
     *
     * @throws InvalidRuleException if the keyword is empty after normalization
     */
    public static NegativeKeywordRule compile(String keyword, MatchType matchType, TermNormalizer normalizer) {
        Objects.requireNonNull(matchType, "matchType is required");
        TokenizedText text = normalizer.tokenize(keyword);
        if (text.isEmpty()) {
            throw new InvalidRuleException("Negative keyword is empty after normalization",
                    keyword, matchType.name());
        }
        return new NegativeKeywordRule(keyword.trim(), text, matchType);
    }

    /**
     * Validates a raw loader row and compiles it.
     *
     * @throws InvalidRuleException if the match type is unrecognized or the keyword is empty
     */
    public static NegativeKeywordRule fromEntry(NegativeKeywordEntry entry, TermNormalizer normalizer) {
        MatchType type;
        try {
            type = MatchType.parse(entry.matchType());
        } catch (InvalidRuleException e) {
            throw new InvalidRuleException(describe(entry) + e.getMessage(), entry.keyword(), entry.matchType());
        }
        if (entry.keyword() == null) {
            throw new InvalidRuleException(describe(entry) + "Negative keyword is required",
                    null, entry.matchType());
        }
        try {
            return compile(entry.keyword(), type, normalizer);
        } catch (InvalidRuleException e) {
            throw new InvalidRuleException(describe(entry) + e.getMessage(), entry.keyword(), entry.matchType());
        }
    }

    private static String describe(NegativeKeywordEntry entry) {
        return entry.lineNumber() > 0 ? "Line " + entry.lineNumber() + ": " : "";
    }

    /**
     * Returns the keyword as supplied, trimmed but not normalized.
     */
    public String getKeyword() {
        return keyword;
    }

    public String getNormalizedKeyword() {
        return text.normalized();
    }

    public List<String> getTokens() {
        return text.tokens();
    }

    public TokenizedText getText() {
        return text;
    }

    public MatchType getMatchType() {
        return matchType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NegativeKeywordRule that = (NegativeKeywordRule) o;
        return text.normalized().equals(that.text.normalized()) && matchType == that.matchType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text.normalized(), matchType);
    }

    @Override
    public String toString() {
        return "NegativeKeywordRule{" +
                "keyword='" + keyword + '\'' +
                ", matchType=" + matchType +
                '}';
    }
}
