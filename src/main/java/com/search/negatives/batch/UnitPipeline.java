package com.search.negatives.batch;

import com.search.negatives.analytics.AnalyticsAggregator;
import com.search.negatives.core.CancellationToken;
import com.search.negatives.core.model.AnalyticsSummary;
import com.search.negatives.core.model.CandidateSuggestion;
import com.search.negatives.core.model.FilterResult;
import com.search.negatives.core.model.NegativeKeywordEntry;
import com.search.negatives.core.model.NegativeKeywordRule;
import com.search.negatives.core.model.SearchTermRecord;
import com.search.negatives.exception.InvalidRecordException;
import com.search.negatives.matcher.NegativeKeywordMatcher;
import com.search.negatives.metrics.MetricsService;
import com.search.negatives.metrics.NoOpMetricsService;
import com.search.negatives.rules.TermNormalizer;
import com.search.negatives.suggestion.SuggestionEngine;
import com.search.negatives.suggestion.SuggestionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one unit of work end to end: validate, match, suggest, aggregate.
 *
 * <p>The pipeline holds no per-unit state, so a single instance is shared by all
 * workers of a batch. Stages run against private copies of the records. The caller's
 * records are classified only after every stage has completed and the deadline has
 * been checked one final time, so a cancelled or failed unit leaves them untouched.</p>
 */
public class UnitPipeline {
    private static final Logger log = LoggerFactory.getLogger(UnitPipeline.class);

    private final TermNormalizer normalizer;
    private final Clock clock;
    private final MetricsService metricsService;
    private final SuggestionEngine suggestionEngine;
    private final SuggestionOptions suggestionOptions;
    private final AnalyticsAggregator aggregator;

    public UnitPipeline() {
        this(TermNormalizer.defaultNormalizer(), Clock.systemUTC(), new NoOpMetricsService(),
                SuggestionOptions.defaults(), null);
    }

    public UnitPipeline(TermNormalizer normalizer, Clock clock, MetricsService metricsService,
                        SuggestionOptions suggestionOptions, AnalyticsAggregator aggregator) {
        this.normalizer = normalizer != null ? normalizer : TermNormalizer.defaultNormalizer();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.suggestionEngine = new SuggestionEngine(this.normalizer, this.metricsService);
        this.suggestionOptions = suggestionOptions != null ? suggestionOptions : SuggestionOptions.defaults();
        this.aggregator = aggregator != null
                ? aggregator
                : new AnalyticsAggregator(null, this.normalizer, this.clock);
    }

    /**
     * Compiles the unit's raw rule rows, then runs the full pipeline.
     *
     * @throws com.search.negatives.exception.InvalidRuleException   if a rule row is invalid
     * @throws InvalidRecordException                                 if a record is missing or already classified
     * @throws com.search.negatives.exception.ComputationTimeoutException if the token is cancelled
     */
    public FilterResult run(BatchUnit unit, CancellationToken token) {
        List<NegativeKeywordRule> rules = compile(unit.rules());
        return run(unit.unitId(), unit.terms(), rules, token);
    }

    /**
     * Runs the pipeline over already compiled rules.
     */
    public FilterResult run(String unitId, List<SearchTermRecord> terms, List<NegativeKeywordRule> rules,
                            CancellationToken token) {
        validate(terms);

        List<SearchTermRecord> working = new ArrayList<>(terms.size());
        for (SearchTermRecord record : terms) {
            working.add(record.unclassifiedCopy());
        }

        NegativeKeywordMatcher matcher = new NegativeKeywordMatcher(rules, normalizer, clock, metricsService);
        matcher.match(working, token);

        List<CandidateSuggestion> candidates = suggestionEngine.suggest(working, suggestionOptions, token);
        token.throwIfCancelled("aggregation");
        AnalyticsSummary summary = aggregator.aggregate(working, candidates, token);

        // last deadline check; past this point the caller's records are written in one pass
        token.throwIfCancelled("publish");
        for (int i = 0; i < terms.size(); i++) {
            terms.get(i).adoptClassification(working.get(i));
        }

        log.debug("unit.pipeline.completed unitId={} terms={} excluded={} candidates={}",
                unitId, summary.totalTerms(), summary.excludedCount(), candidates.size());
        return new FilterResult(unitId, terms, candidates, summary);
    }

    public List<NegativeKeywordRule> compile(List<NegativeKeywordEntry> entries) {
        return NegativeKeywordMatcher.compileRules(entries, normalizer);
    }

    private static void validate(List<SearchTermRecord> terms) {
        for (int i = 0; i < terms.size(); i++) {
            SearchTermRecord record = terms.get(i);
            if (record == null) {
                throw new InvalidRecordException("Record at index " + i + " is null");
            }
            if (record.isClassified()) {
                throw new InvalidRecordException("Record was already classified by another run: "
                        + record.getTerm(), record.getLineNumber());
            }
        }
    }
}
