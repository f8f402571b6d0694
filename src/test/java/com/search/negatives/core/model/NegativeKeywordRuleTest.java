package com.search.negatives.core.model;

import com.search.negatives.exception.InvalidRuleException;
import com.search.negatives.rules.TermNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NegativeKeywordRuleTest {

    private final TermNormalizer normalizer = TermNormalizer.defaultNormalizer();

    @Test
    @DisplayName("Keyword is normalized and tokenized once at compile time")
    void compiles() {
        NegativeKeywordRule rule = NegativeKeywordRule.compile("  \"Free  Shipping\" ", MatchType.PHRASE, normalizer);

        assertEquals("\"Free  Shipping\"", rule.getKeyword());
        assertEquals("free shipping", rule.getNormalizedKeyword());
        assertEquals(List.of("free", "shipping"), rule.getTokens());
        assertEquals(MatchType.PHRASE, rule.getMatchType());
    }

    @Test
    @DisplayName("Keyword that normalizes to nothing is rejected")
    void emptyKeyword() {
        assertThrows(InvalidRuleException.class, () -> NegativeKeywordRule.compile("   ", MatchType.EXACT, normalizer));
        assertThrows(InvalidRuleException.class, () -> NegativeKeywordRule.compile("[]", MatchType.EXACT, normalizer));
    }

    @Test
    @DisplayName("Loader rows report their line number on failure")
    void fromEntryReportsLine() {
        NegativeKeywordEntry entry = new NegativeKeywordEntry("free", "EXACTISH", 7);

        InvalidRuleException e = assertThrows(InvalidRuleException.class,
                () -> NegativeKeywordRule.fromEntry(entry, normalizer));

        assertTrue(e.getMessage().startsWith("Line 7: "), e.getMessage());
        assertEquals("free", e.getKeyword());
        assertEquals("EXACTISH", e.getMatchType());
    }

    @Test
    @DisplayName("Missing keyword is rejected")
    void missingKeyword() {
        assertThrows(InvalidRuleException.class,
                () -> NegativeKeywordRule.fromEntry(NegativeKeywordEntry.of(null, "BROAD"), normalizer));
    }
}
