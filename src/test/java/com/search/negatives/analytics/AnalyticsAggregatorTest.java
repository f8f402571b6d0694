package com.search.negatives.analytics;

import com.search.negatives.core.model.AnalyticsSummary;
import com.search.negatives.core.model.CandidateSuggestion;
import com.search.negatives.core.model.HighRiskTerm;
import com.search.negatives.core.model.MatchType;
import com.search.negatives.core.model.NegativeKeywordRule;
import com.search.negatives.core.model.SearchTermRecord;
import com.search.negatives.matcher.NegativeKeywordMatcher;
import com.search.negatives.rules.TermNormalizer;
import com.search.negatives.suggestion.SuggestionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalyticsAggregator Tests")
class AnalyticsAggregatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private AnalyticsAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new AnalyticsAggregator(AnalyticsOptions.defaults(), TermNormalizer.defaultNormalizer(), CLOCK);
    }

    private static SearchTermRecord term(String text, double cost, double impressions, double clicks,
                                         double conversions) {
        return SearchTermRecord.builder()
                .term(text).cost(cost).impressions(impressions).clicks(clicks).conversions(conversions).build();
    }

    private static List<SearchTermRecord> classified() {
        List<SearchTermRecord> records = List.of(
                term("free", 5.0, 100.0, 0.0, 0.0),
                term("best free shipping deals", 20.0, 50.0, 1.0, 0.0),
                term("cheap nike shoes", 15.0, 30.0, 1.0, 0.0),
                term("nike running shoes", 40.0, 200.0, 10.0, 3.0),
                term("nike shoes outlet", 25.0, 80.0, 4.0, 0.0));
        new NegativeKeywordMatcher(List.of(
                NegativeKeywordRule.of("free", MatchType.EXACT),
                NegativeKeywordRule.of("free shipping", MatchType.PHRASE),
                NegativeKeywordRule.of("cheap", MatchType.BROAD))).match(records);
        return records;
    }

    @Nested
    @DisplayName("Summary figures")
    class Figures {

        @Test
        @DisplayName("Counts, spend and percentages")
        void figures() {
            List<SearchTermRecord> records = classified();
            List<CandidateSuggestion> candidates = new SuggestionEngine().suggest(records);

            AnalyticsSummary summary = aggregator.aggregate(records, candidates);

            assertEquals(5, summary.totalTerms());
            assertEquals(3, summary.excludedCount());
            assertEquals(2, summary.remainingCount());
            assertEquals(40.0, summary.costWastePrevented(), 1e-9);
            assertEquals(65.0, summary.totalRemainingSpend(), 1e-9);
            assertEquals(38.1, summary.costReductionPercentage(), 1e-9);
            assertEquals(180, summary.impressionsEliminated());
            assertEquals(40.0, summary.qualityScore(), 1e-9);
            assertEquals(80.0, summary.actionScore(), 1e-9);
            assertTrue(summary.isActionRequired());
            assertEquals(65.0, summary.potentialSavings(), 1e-9);
            assertEquals(CLOCK.instant(), summary.generatedAt());
        }

        @Test
        @DisplayName("High-risk terms are remaining poor performers")
        void highRisk() {
            List<SearchTermRecord> records = classified();

            AnalyticsSummary summary = aggregator.aggregate(records, List.of());

            assertEquals(1, summary.highRiskTerms().size());
            HighRiskTerm risk = summary.highRiskTerms().get(0);
            assertEquals("nike shoes outlet", risk.term());
            assertEquals(25.0, risk.cost(), 1e-9);
            assertEquals(HighRiskTerm.RiskLevel.HIGH, risk.riskLevel());
        }

        @Test
        @DisplayName("Terms costing at least twice the mean are CRITICAL, list is capped")
        void criticalAndCapped() {
            List<SearchTermRecord> records = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                records.add(term("wasted term " + i, 1.0, 10.0, 1.0, 0.0));
            }
            records.add(term("very expensive term", 100.0, 10.0, 1.0, 0.0));
            new NegativeKeywordMatcher(List.of()).match(records);

            AnalyticsSummary summary = aggregator.aggregate(records, List.of());

            assertEquals(10, summary.highRiskTerms().size());
            assertEquals("very expensive term", summary.highRiskTerms().get(0).term());
            assertEquals(HighRiskTerm.RiskLevel.CRITICAL, summary.highRiskTerms().get(0).riskLevel());
            assertEquals(HighRiskTerm.RiskLevel.HIGH, summary.highRiskTerms().get(1).riskLevel());
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("Empty input gives zero scores and the fallback recommendation")
        void emptyInput() {
            AnalyticsSummary summary = aggregator.aggregate(List.of(), List.of());

            assertEquals(0, summary.totalTerms());
            assertEquals(0.0, summary.qualityScore());
            assertEquals(0.0, summary.costReductionPercentage());
            assertEquals(0.0, summary.actionScore());
            assertEquals(List.of(DefaultRecommendationRules.FALLBACK), summary.recommendations());
        }

        @Test
        @DisplayName("Waste prevented is zero when no record has a cost")
        void missingCost() {
            List<SearchTermRecord> records = List.of(
                    SearchTermRecord.builder().term("free").impressions(10.0).build(),
                    SearchTermRecord.builder().term("shoes").impressions(10.0).build());
            new NegativeKeywordMatcher(List.of(NegativeKeywordRule.of("free", MatchType.EXACT))).match(records);

            AnalyticsSummary summary = aggregator.aggregate(records, List.of());

            assertEquals(0.0, summary.costWastePrevented());
            assertEquals(0.0, summary.costReductionPercentage());
            assertEquals(10, summary.impressionsEliminated());
        }

        @Test
        @DisplayName("Unclassified records are rejected")
        void unclassified() {
            assertThrows(IllegalStateException.class,
                    () -> aggregator.aggregate(List.of(SearchTermRecord.of("free", 1.0)), List.of()));
        }

        @Test
        @DisplayName("Aggregation is idempotent for fixed inputs and clock")
        void idempotent() {
            List<SearchTermRecord> records = classified();
            List<CandidateSuggestion> candidates = new SuggestionEngine().suggest(records);

            assertEquals(aggregator.aggregate(records, candidates), aggregator.aggregate(records, candidates));
        }
    }

    @Nested
    @DisplayName("Recommendations")
    class Recommendations {

        @Test
        @DisplayName("First three matching rules in priority order")
        void firstThree() {
            List<SearchTermRecord> records = classified();
            List<CandidateSuggestion> candidates = new SuggestionEngine().suggest(records);

            List<String> recommendations = aggregator.aggregate(records, candidates).recommendations();

            assertEquals(3, recommendations.size());
            assertEquals("Aggressive negative keyword implementation will significantly improve ROI",
                    recommendations.get(0));
            assertEquals("6 high-confidence negative keyword suggestions ready to apply (top: 'nike')",
                    recommendations.get(1));
            assertTrue(recommendations.get(2).startsWith("Over half of search terms are excluded"));
        }

        @Test
        @DisplayName("Urgent waste message formats the amount")
        void urgent() {
            List<SearchTermRecord> records = List.of(term("free", 1500.0, 10.0, 1.0, 0.0),
                    term("shoes", 10.0, 10.0, 1.0, 1.0));
            new NegativeKeywordMatcher(List.of(NegativeKeywordRule.of("free", MatchType.EXACT))).match(records);

            List<String> recommendations = aggregator.aggregate(records, List.of()).recommendations();

            assertEquals("URGENT: $1,500 in preventable spend identified", recommendations.get(0));
        }

        @Test
        @DisplayName("Custom rule table and limit")
        void customRules() {
            AnalyticsOptions options = AnalyticsOptions.builder()
                    .recommendationLimit(1)
                    .recommendationRules(List.of(
                            new RecommendationRule("always", 1, s -> true, s -> "terms=" + s.totalTerms())))
                    .build();
            AnalyticsAggregator custom = new AnalyticsAggregator(options, null, CLOCK);

            assertEquals(List.of("terms=5"), custom.aggregate(classified(), List.of()).recommendations());
        }
    }

    @Test
    @DisplayName("Action weights must sum to one")
    void optionsValidated() {
        assertThrows(IllegalArgumentException.class, () -> AnalyticsOptions.builder().actionWeights(0.7, 0.7));
        assertThrows(IllegalArgumentException.class, () -> AnalyticsOptions.builder().highRiskLimit(-1));
    }
}
