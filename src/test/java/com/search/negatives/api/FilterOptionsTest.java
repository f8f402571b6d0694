package com.search.negatives.api;

import com.search.negatives.analytics.AnalyticsOptions;
import com.search.negatives.core.model.SearchTermRecord;
import com.search.negatives.suggestion.PoorPerformerPredicate;
import com.search.negatives.suggestion.SuggestionOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilterOptions Tests")
class FilterOptionsTest {

    @Test
    @DisplayName("Empty properties give the defaults")
    void emptyProperties() {
        FilterOptions options = FilterOptions.fromProperties(new Properties());
        FilterOptions defaults = FilterOptions.defaults();

        assertFalse(options.isStripPunctuation());
        assertEquals(defaults.getSuggestionOptions().getTopK(), options.getSuggestionOptions().getTopK());
        assertEquals(defaults.getBatchOptions(), options.getBatchOptions());
        assertEquals(defaults.getAnalyticsOptions().getHighRiskLimit(),
                options.getAnalyticsOptions().getHighRiskLimit());
    }

    @Test
    @DisplayName("Recognized keys override the defaults")
    void overrides() {
        Properties props = new Properties();
        props.setProperty("negatives.normalizer.stripPunctuation", "TRUE");
        props.setProperty("negatives.suggestion.topK", "5");
        props.setProperty("negatives.suggestion.maxNgramLength", "2");
        props.setProperty("negatives.suggestion.minConfidence", " 40.5 ");
        props.setProperty("negatives.suggestion.includeExcluded", "true");
        props.setProperty("negatives.analytics.highRiskLimit", "3");
        props.setProperty("negatives.batch.parallelism", "2");
        props.setProperty("negatives.batch.unitTimeoutMs", "1500");
        props.setProperty("negatives.batch.queueCapacity", "7");

        FilterOptions options = FilterOptions.fromProperties(props);

        assertTrue(options.isStripPunctuation());
        assertEquals(5, options.getSuggestionOptions().getTopK());
        assertEquals(2, options.getSuggestionOptions().getMaxNgramLength());
        assertEquals(40.5, options.getSuggestionOptions().getMinConfidence());
        assertTrue(options.getSuggestionOptions().isIncludeExcluded());
        assertEquals(3, options.getAnalyticsOptions().getHighRiskLimit());
        assertEquals(2, options.getBatchOptions().parallelism());
        assertEquals(Duration.ofMillis(1500), options.getBatchOptions().unitTimeout());
        assertEquals(7, options.getBatchOptions().queueCapacity());
    }

    @Test
    @DisplayName("Poor-performer keys drive suggestions and high-risk terms alike")
    void poorPerformerKeys() {
        Properties props = new Properties();
        props.setProperty("negatives.suggestion.minWastedCost", "20");
        props.setProperty("negatives.suggestion.minZeroClickImpressions", "10");

        FilterOptions options = FilterOptions.fromProperties(props);
        PoorPerformerPredicate suggestion = options.getSuggestionOptions().getPoorPerformer();
        PoorPerformerPredicate highRisk = options.getAnalyticsOptions().getHighRiskPredicate();

        SearchTermRecord cheap = SearchTermRecord.builder().term("cheap hats").impressions(5.0).clicks(1.0)
                .cost(10.0).conversions(0.0).build();
        SearchTermRecord wasteful = SearchTermRecord.builder().term("designer hats").impressions(5.0).clicks(1.0)
                .cost(25.0).conversions(0.0).build();
        SearchTermRecord unclicked = SearchTermRecord.builder().term("hat shop").impressions(50.0).clicks(0.0)
                .cost(0.0).build();

        assertFalse(suggestion.test(cheap));
        assertTrue(suggestion.test(wasteful));
        assertTrue(suggestion.test(unclicked));
        assertFalse(highRisk.test(cheap));
        assertTrue(highRisk.test(wasteful));
        assertTrue(highRisk.test(unclicked));
    }

    @Test
    @DisplayName("Builder applies the suggestion poor-performer rule to high-risk terms")
    void highRiskPredicateFollowsSuggestionOptions() {
        PoorPerformerPredicate predicate = PoorPerformerPredicate.minimumWaste(50.0);
        FilterOptions options = FilterOptions.builder()
                .suggestionOptions(SuggestionOptions.builder().poorPerformer(predicate).build())
                .analyticsOptions(AnalyticsOptions.builder().highRiskLimit(4).build())
                .build();

        assertSame(predicate, options.getAnalyticsOptions().getHighRiskPredicate());
        assertEquals(4, options.getAnalyticsOptions().getHighRiskLimit());
    }

    @Test
    @DisplayName("Unparsable values name the key")
    void invalidValues() {
        Properties props = new Properties();
        props.setProperty("negatives.suggestion.topK", "many");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> FilterOptions.fromProperties(props));
        assertTrue(e.getMessage().contains("negatives.suggestion.topK"));

        Properties bool = new Properties();
        bool.setProperty("negatives.normalizer.stripPunctuation", "yes");
        assertThrows(IllegalArgumentException.class, () -> FilterOptions.fromProperties(bool));
    }

    @Test
    @DisplayName("Out of range values fail validation")
    void outOfRange() {
        Properties props = new Properties();
        props.setProperty("negatives.batch.parallelism", "0");

        assertThrows(IllegalArgumentException.class, () -> FilterOptions.fromProperties(props));
    }

    @Test
    @DisplayName("Builder rejects missing option groups")
    void builderValidation() {
        assertThrows(IllegalArgumentException.class, () -> FilterOptions.builder().suggestionOptions(null));
        assertThrows(IllegalArgumentException.class, () -> FilterOptions.builder().batchOptions(null));
    }
}
