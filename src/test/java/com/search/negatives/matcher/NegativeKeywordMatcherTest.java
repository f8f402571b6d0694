package com.search.negatives.matcher;

import com.search.negatives.core.CancellationToken;
import com.search.negatives.core.model.MatchType;
import com.search.negatives.core.model.NegativeKeywordEntry;
import com.search.negatives.core.model.NegativeKeywordRule;
import com.search.negatives.core.model.SearchTermRecord;
import com.search.negatives.exception.ComputationTimeoutException;
import com.search.negatives.exception.InvalidRuleException;
import com.search.negatives.metrics.MetricsService;
import com.search.negatives.rules.TermNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("NegativeKeywordMatcher Tests")
class NegativeKeywordMatcherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private static NegativeKeywordMatcher matcher(NegativeKeywordRule... rules) {
        return new NegativeKeywordMatcher(List.of(rules), TermNormalizer.defaultNormalizer(), CLOCK, null);
    }

    @Nested
    @DisplayName("Match semantics")
    class Semantics {

        @ParameterizedTest
        @DisplayName("Keyword against term")
        @CsvSource({
                "free, EXACT, free, true",
                "free, EXACT, FREE, true",
                "free, EXACT, free shipping, false",
                "free shipping, EXACT, free  shipping, true",
                "free shipping, PHRASE, best free shipping deals, true",
                "free shipping, PHRASE, shipping free, false",
                "free shipping, PHRASE, free overnight shipping, false",
                "free, PHRASE, freedom shoes, false",
                "shipping free, BROAD, free overnight shipping, true",
                "shipping free, BROAD, free shoes, false",
                "free, BROAD, freedom, false",
                "[free], EXACT, free, true",
                "\"free shipping\", PHRASE, free shipping today, true"
        })
        void matches(String keyword, MatchType type, String term, boolean expected) {
            MatchOutcome outcome = matcher(NegativeKeywordRule.of(keyword, type)).matchOne(term);
            assertEquals(expected, outcome.isExcluded());
        }

        @Test
        @DisplayName("Empty and non-string terms never match")
        void emptyNeverMatches() {
            NegativeKeywordMatcher matcher = matcher(NegativeKeywordRule.of("free", MatchType.BROAD));

            assertFalse(matcher.matchOne("").isExcluded());
            assertFalse(matcher.matchOne(null).isExcluded());
            assertFalse(matcher.matchOne(12.0).isExcluded());
        }

        @Test
        @DisplayName("Repeated keyword tokens need a contiguous repeat for PHRASE")
        void repeatedTokens() {
            NegativeKeywordMatcher matcher = matcher(NegativeKeywordRule.of("free free", MatchType.PHRASE));

            assertTrue(matcher.matchOne("get free free stuff").isExcluded());
            assertFalse(matcher.matchOne("free stuff free").isExcluded());
        }
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("First matching rule in list order wins")
        void firstRuleWins() {
            NegativeKeywordMatcher matcher = matcher(
                    NegativeKeywordRule.of("shipping", MatchType.BROAD),
                    NegativeKeywordRule.of("free shipping", MatchType.PHRASE));
            SearchTermRecord record = SearchTermRecord.of("free shipping", 2.0);

            matcher.match(List.of(record));

            assertEquals("shipping", record.getMatchedKeyword());
            assertEquals(MatchType.BROAD, record.getMatchedMatchType());
            assertEquals("Excluded by BROAD negative: shipping", record.getExclusionReason());
        }

        @Test
        @DisplayName("Every record is classified with the same timestamp, in input order")
        void classifiesAll() {
            List<SearchTermRecord> records = List.of(
                    SearchTermRecord.of("free", 1.0),
                    SearchTermRecord.of("running shoes", 1.0),
                    SearchTermRecord.of("free shipping", 1.0));

            List<SearchTermRecord> result = matcher(NegativeKeywordRule.of("free", MatchType.EXACT)).match(records);

            assertSame(records, result);
            assertTrue(records.get(0).isExcluded());
            assertFalse(records.get(1).isExcluded());
            assertFalse(records.get(2).isExcluded());
            assertTrue(records.stream().allMatch(SearchTermRecord::isClassified));
            assertTrue(records.stream().allMatch(r -> CLOCK.instant().equals(r.getCheckedAt())));
        }

        @Test
        @DisplayName("Matching the same terms twice gives the same answers")
        void deterministic() {
            NegativeKeywordMatcher matcher = matcher(
                    NegativeKeywordRule.of("cheap", MatchType.BROAD),
                    NegativeKeywordRule.of("free shipping", MatchType.PHRASE));
            List<String> terms = List.of("cheap shoes", "free shipping deal", "shoes", "shipping free");

            List<SearchTermRecord> first = matcher.match(terms.stream().map(t -> SearchTermRecord.of(t, 1.0)).toList());
            List<SearchTermRecord> second = matcher.match(terms.stream().map(t -> SearchTermRecord.of(t, 1.0)).toList());

            for (int i = 0; i < terms.size(); i++) {
                assertEquals(first.get(i).isExcluded(), second.get(i).isExcluded());
                assertEquals(first.get(i).getExclusionReason(), second.get(i).getExclusionReason());
            }
        }

        @Test
        @DisplayName("Cancelled token stops matching")
        void cancelled() {
            CancellationToken token = CancellationToken.withTimeout(java.time.Duration.ofMinutes(1));
            token.cancel();

            assertThrows(ComputationTimeoutException.class,
                    () -> matcher(NegativeKeywordRule.of("free", MatchType.EXACT))
                            .match(List.of(SearchTermRecord.of("free", 1.0)), token));
        }

        @Test
        @DisplayName("Exclusions and duration are reported to metrics")
        void reportsMetrics() {
            MetricsService metrics = mock(MetricsService.class);
            NegativeKeywordMatcher matcher = new NegativeKeywordMatcher(
                    List.of(NegativeKeywordRule.of("free", MatchType.EXACT)), null, CLOCK, metrics);

            matcher.match(List.of(SearchTermRecord.of("free", 1.0), SearchTermRecord.of("shoes", 1.0)));

            verify(metrics, times(1)).incrementTermExcluded(MatchType.EXACT);
            verify(metrics).recordMatchDuration(any());
        }
    }

    @Test
    @DisplayName("compileRules keeps order and rejects invalid rows")
    void compileRules() {
        List<NegativeKeywordRule> rules = NegativeKeywordMatcher.compileRules(List.of(
                NegativeKeywordEntry.of("free", "exact"),
                NegativeKeywordEntry.of("cheap", "Broad")), TermNormalizer.defaultNormalizer());

        assertEquals(2, rules.size());
        assertEquals(MatchType.EXACT, rules.get(0).getMatchType());

        assertThrows(InvalidRuleException.class, () -> NegativeKeywordMatcher.compileRules(
                List.of(NegativeKeywordEntry.of("free", "EXACTISH")), TermNormalizer.defaultNormalizer()));
    }
}
