package com.search.negatives.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchTermRecord Tests")
class SearchTermRecordTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Nested
    @DisplayName("Metric repair")
    class MetricRepair {

        @Test
        @DisplayName("NaN and infinite metrics are stored as absent")
        void nonFiniteBecomesNull() {
            SearchTermRecord record = SearchTermRecord.builder()
                    .term("shoes")
                    .cost(Double.NaN)
                    .clicks(Double.POSITIVE_INFINITY)
                    .impressions(10.0)
                    .build();

            assertNull(record.getCost());
            assertNull(record.getClicks());
            assertFalse(record.hasCost());
            assertEquals(0.0, record.costOrZero());
            assertEquals(10.0, record.getImpressions());
        }

        @Test
        @DisplayName("Zero clicks and zero impressions never raise")
        void zeroDenominators() {
            SearchTermRecord record = SearchTermRecord.builder()
                    .term("shoes").impressions(0.0).clicks(0.0).cost(3.0).build();

            assertEquals(0.0, record.clickThroughRate());
            assertEquals(0.0, record.costPerClick());
        }

        @Test
        @DisplayName("CTR and CPC use impressions and clicks")
        void ratesComputed() {
            SearchTermRecord record = SearchTermRecord.builder()
                    .term("shoes").impressions(200.0).clicks(10.0).cost(5.0).build();

            assertEquals(5.0, record.clickThroughRate(), 1e-9);
            assertEquals(0.5, record.costPerClick(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("markExcluded records rule, reason and time")
        void markExcluded() {
            SearchTermRecord record = SearchTermRecord.of("free", 1.0);
            record.markExcluded(NegativeKeywordRule.of("Free", MatchType.EXACT), NOW);

            assertTrue(record.isClassified());
            assertTrue(record.isExcluded());
            assertEquals("Free", record.getMatchedKeyword());
            assertEquals(MatchType.EXACT, record.getMatchedMatchType());
            assertEquals("Excluded by EXACT negative: Free", record.getExclusionReason());
            assertEquals(NOW, record.getCheckedAt());
        }

        @Test
        @DisplayName("Retained record has no reason but a readable status")
        void markRetained() {
            SearchTermRecord record = SearchTermRecord.of("running shoes", 1.0);
            assertEquals("Not checked", record.statusDescription());

            record.markRetained(NOW);

            assertFalse(record.isExcluded());
            assertNull(record.getExclusionReason());
            assertNull(record.getMatchedKeyword());
            assertEquals(SearchTermRecord.NOT_MATCHED, record.statusDescription());
        }

        @Test
        @DisplayName("A record can only be classified once")
        void classifiedOnce() {
            SearchTermRecord record = SearchTermRecord.of("free", 1.0);
            record.markRetained(NOW);

            assertThrows(IllegalStateException.class, () -> record.markRetained(NOW));
            assertThrows(IllegalStateException.class,
                    () -> record.markExcluded(NegativeKeywordRule.of("free", MatchType.EXACT), NOW));
        }
    }

    @Test
    @DisplayName("Attributes keep insertion order and are read-only")
    void attributes() {
        SearchTermRecord record = SearchTermRecord.builder()
                .term("shoes")
                .attribute("Campaign", "Brand")
                .attribute("Ad group", "Shoes")
                .build();

        assertEquals("Brand", record.getAttribute("Campaign"));
        assertEquals("[Campaign, Ad group]", record.getAttributes().keySet().toString());
        assertThrows(UnsupportedOperationException.class, () -> record.getAttributes().put("x", "y"));
    }
}
