package com.search.negatives.api;

import com.search.negatives.analytics.AnalyticsAggregator;
import com.search.negatives.batch.BatchOptions;
import com.search.negatives.batch.BatchOrchestrator;
import com.search.negatives.batch.BatchReport;
import com.search.negatives.batch.BatchUnit;
import com.search.negatives.batch.UnitPipeline;
import com.search.negatives.core.CancellationToken;
import com.search.negatives.core.model.AnalyticsSummary;
import com.search.negatives.core.model.CandidateSuggestion;
import com.search.negatives.core.model.FilterResult;
import com.search.negatives.core.model.MatchType;
import com.search.negatives.core.model.NegativeKeywordEntry;
import com.search.negatives.core.model.NegativeKeywordRule;
import com.search.negatives.core.model.SearchTermRecord;
import com.search.negatives.logging.LogContext;
import com.search.negatives.matcher.MatchOutcome;
import com.search.negatives.matcher.NegativeKeywordMatcher;
import com.search.negatives.metrics.MetricsService;
import com.search.negatives.metrics.NoOpMetricsService;
import com.search.negatives.rules.DefaultTermRules;
import com.search.negatives.rules.TermNormalizer;
import com.search.negatives.suggestion.SuggestionEngine;
import com.search.negatives.suggestion.SuggestionOptions;
import com.search.negatives.tracing.NoOpTracingService;
import com.search.negatives.tracing.Span;
import com.search.negatives.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Main entry point for negative keyword filtering.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * NegativeKeywordFilter filter = NegativeKeywordFilter.builder()
 *     .metricsService(new MicrometerMetricsService(registry))
 *     .build();
 *
 * // One dataset
 * FilterResult result = filter.process("brand-campaign", terms, negatives);
 * result.summary().recommendations().forEach(System.out::println);
 *
 * // Many independent datasets
 * BatchReport report = filter.runBatch(units, 4, Duration.ofMinutes(2));
 * report.outcome("brand-campaign").ifPresent(o -&gt; ...);
 * </pre>
 *
 * <p>The filter is immutable and thread-safe. Records passed in are classified in
 * place and belong to the call that received them.</p>
 */
public class NegativeKeywordFilter {
    private static final Logger log = LoggerFactory.getLogger(NegativeKeywordFilter.class);

    private final TermNormalizer normalizer;
    private final Clock clock;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final FilterOptions options;
    private final SuggestionEngine suggestionEngine;
    private final AnalyticsAggregator aggregator;
    private final UnitPipeline pipeline;

    private NegativeKeywordFilter(Builder builder) {
        this.options = builder.options;
        this.normalizer = builder.normalizer != null
                ? builder.normalizer
                : new TermNormalizer(options.isStripPunctuation()
                        ? DefaultTermRules.getPunctuationStrippingRules()
                        : DefaultTermRules.getStandardRules());
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.suggestionEngine = new SuggestionEngine(normalizer, metricsService);
        this.aggregator = new AnalyticsAggregator(options.getAnalyticsOptions(), normalizer, clock);
        this.pipeline = new UnitPipeline(normalizer, clock, metricsService,
                options.getSuggestionOptions(), aggregator);
    }

    /**
     * Compiles raw negative keyword rows into rules.
     *
     * @throws com.search.negatives.exception.InvalidRuleException on the first invalid row
     */
    public List<NegativeKeywordRule> compileRules(List<NegativeKeywordEntry> entries) {
        return NegativeKeywordMatcher.compileRules(entries, normalizer);
    }

    /**
     * Compiles one rule with this filter's normalizer.
     */
    public NegativeKeywordRule rule(String keyword, MatchType matchType) {
        return NegativeKeywordRule.compile(keyword, matchType, normalizer);
    }

    /**
     * Classifies every record in place against the rules, first matching rule wins.
     */
    public List<SearchTermRecord> match(List<SearchTermRecord> terms, List<NegativeKeywordRule> rules) {
        return new NegativeKeywordMatcher(rules, normalizer, clock, metricsService).match(terms);
    }

    /**
     * Checks a single term without a record.
     */
    public MatchOutcome matchOne(String term, List<NegativeKeywordRule> rules) {
        return new NegativeKeywordMatcher(rules, normalizer, clock, metricsService).matchOne(term);
    }

    public List<CandidateSuggestion> suggest(List<SearchTermRecord> records) {
        return suggestionEngine.suggest(records, options.getSuggestionOptions());
    }

    public List<CandidateSuggestion> suggest(List<SearchTermRecord> records, SuggestionOptions suggestionOptions) {
        return suggestionEngine.suggest(records, suggestionOptions);
    }

    /**
     * Summarizes classified records and ranked candidates.
     */
    public AnalyticsSummary aggregate(List<SearchTermRecord> records, List<CandidateSuggestion> candidates) {
        return aggregator.aggregate(records, candidates);
    }

    /**
     * Runs match, suggest and aggregate over one dataset on the calling thread.
     */
    public FilterResult process(String unitId, List<SearchTermRecord> terms, List<NegativeKeywordRule> rules) {
        try (LogContext ctx = LogContext.forUnit(LogContext.generateCorrelationId(), unitId);
             Span span = tracingService.startSpan(TracingService.UNIT_SPAN, Map.of("unit.id", unitId))) {
            try {
                FilterResult result = pipeline.run(unitId, terms, rules, CancellationToken.none());
                span.setAttribute("unit.excluded", result.summary().excludedCount());
                span.setStatus(Span.SpanStatus.OK);
                log.info("unit.processed unitId={} terms={} excluded={} candidates={}",
                        unitId, result.summary().totalTerms(), result.summary().excludedCount(),
                        result.candidates().size());
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    /**
     * Runs independent units in parallel with a per-unit timeout.
     */
    public BatchReport runBatch(List<BatchUnit> units, int parallelism, Duration timeout) {
        BatchOptions defaults = options.getBatchOptions();
        return runBatch(units, new BatchOptions(parallelism, timeout,
                defaults.queueCapacity(), defaults.hardStopGrace()));
    }

    /**
     * Runs independent units with the configured batch options.
     */
    public BatchReport runBatch(List<BatchUnit> units) {
        return runBatch(units, options.getBatchOptions());
    }

    public BatchReport runBatch(List<BatchUnit> units, BatchOptions batchOptions) {
        return new BatchOrchestrator(pipeline, metricsService, tracingService).run(units, batchOptions);
    }

    public TermNormalizer getNormalizer() {
        return normalizer;
    }

    public FilterOptions getOptions() {
        return options;
    }

    public static NegativeKeywordFilter defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TermNormalizer normalizer;
        private Clock clock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private FilterOptions options = FilterOptions.defaults();

        /**
         * Overrides the normalizer. Takes precedence over {@link FilterOptions#isStripPunctuation()}.
         */
        public Builder normalizer(TermNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder options(FilterOptions options) {
            if (options == null) {
                throw new IllegalArgumentException("options is required");
            }
            this.options = options;
            return this;
        }

        public NegativeKeywordFilter build() {
            return new NegativeKeywordFilter(this);
        }
    }
}
