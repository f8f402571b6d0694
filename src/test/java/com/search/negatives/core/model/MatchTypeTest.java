package com.search.negatives.core.model;

import com.search.negatives.exception.InvalidRuleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class MatchTypeTest {

    @ParameterizedTest
    @DisplayName("Parses match types case-insensitively")
    @CsvSource({
            "EXACT, EXACT",
            "exact, EXACT",
            "' Phrase ', PHRASE",
            "broad, BROAD"
    })
    void parses(String input, MatchType expected) {
        assertEquals(expected, MatchType.parse(input));
    }

    @ParameterizedTest
    @DisplayName("Rejects unknown values instead of defaulting")
    @ValueSource(strings = {"EXACTISH", "modified broad", "negative"})
    void rejectsUnknown(String input) {
        InvalidRuleException e = assertThrows(InvalidRuleException.class, () -> MatchType.parse(input));
        assertEquals(input, e.getMatchType());
        assertTrue(e.getMessage().contains("Unrecognized match type"));
    }

    @Test
    @DisplayName("Rejects blank and missing values")
    void rejectsBlank() {
        assertThrows(InvalidRuleException.class, () -> MatchType.parse(null));
        assertThrows(InvalidRuleException.class, () -> MatchType.parse("  "));
    }

    @ParameterizedTest
    @DisplayName("Impact rating thresholds")
    @CsvSource({
            "90, 150, CRITICAL",
            "90, 100, HIGH",
            "80, 60, HIGH",
            "80, 50, MEDIUM",
            "65, 0, MEDIUM",
            "64.9, 500, LOW"
    })
    void impactRating(double confidence, double waste, ImpactRating expected) {
        assertEquals(expected, ImpactRating.of(confidence, waste));
    }
}
