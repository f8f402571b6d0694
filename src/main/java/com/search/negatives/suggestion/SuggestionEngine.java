package com.search.negatives.suggestion;

import com.search.negatives.core.CancellationToken;
import com.search.negatives.core.model.CandidateSuggestion;
import com.search.negatives.core.model.ImpactRating;
import com.search.negatives.core.model.MatchType;
import com.search.negatives.core.model.Ratio;
import com.search.negatives.core.model.ScoreBreakdown;
import com.search.negatives.core.model.SearchTermRecord;
import com.search.negatives.metrics.MetricsService;
import com.search.negatives.metrics.NoOpMetricsService;
import com.search.negatives.rules.TermNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mines poorly performing search terms for new negative keyword candidates.
 *
 * <p>Candidates are the distinct n-grams (1 to {@code maxNgramLength} tokens) of each
 * poor performer's normalized term. Each candidate is scored as:</p>
 * <pre>
 * confidence = 100 * (wOcc * occurrence + wCost * costImpact + wZero * zeroConversion)
 *
 * occurrence     = occurrences / max(poorPerformers, 1)
 * costImpact     = candidateWaste / max(totalWaste, epsilon)
 * zeroConversion = zeroConversionOccurrences / occurrences
 * </pre>
 *
 * <p>Every sub-score is a {@link Ratio}, clamped to [0, 1] before weighting, and the
 * weights sum to 1, so the confidence cannot leave [0, 100].</p>
 */
public class SuggestionEngine {
    private static final Logger log = LoggerFactory.getLogger(SuggestionEngine.class);

    private static final Comparator<CandidateSuggestion> RANKING =
            Comparator.comparingDouble(CandidateSuggestion::confidenceScore).reversed()
                    .thenComparing(Comparator.comparingInt(CandidateSuggestion::occurrenceCount).reversed())
                    .thenComparing(CandidateSuggestion::text);

    private final TermNormalizer normalizer;
    private final MetricsService metricsService;

    public SuggestionEngine() {
        this(TermNormalizer.defaultNormalizer(), new NoOpMetricsService());
    }

    public SuggestionEngine(TermNormalizer normalizer, MetricsService metricsService) {
        this.normalizer = normalizer != null ? normalizer : TermNormalizer.defaultNormalizer();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Ranks candidates using default options.
     */
    public List<CandidateSuggestion> suggest(List<SearchTermRecord> records) {
        return suggest(records, SuggestionOptions.defaults(), CancellationToken.none());
    }

    public List<CandidateSuggestion> suggest(List<SearchTermRecord> records, SuggestionOptions options) {
        return suggest(records, options, CancellationToken.none());
    }

    /**
     * Ranks candidates, checking for cancellation between records and between candidates.
     *
     * @throws com.search.negatives.exception.ComputationTimeoutException if cancelled
     */
    public List<CandidateSuggestion> suggest(List<SearchTermRecord> records, SuggestionOptions options,
                                             CancellationToken token) {
        SuggestionOptions opts = options != null ? options : SuggestionOptions.defaults();

        List<SearchTermRecord> poorPerformers = new ArrayList<>();
        double totalWaste = 0.0;
        for (SearchTermRecord record : records) {
            token.throwIfCancelled("poor performer selection");
            if (record.isExcluded() && !opts.isIncludeExcluded()) {
                continue;
            }
            if (opts.getPoorPerformer().test(record)) {
                poorPerformers.add(record);
                totalWaste += record.costOrZero();
            }
        }

        if (poorPerformers.isEmpty()) {
            log.debug("suggest.skipped reason=no-poor-performers terms={}", records.size());
            return List.of();
        }

        Map<String, Tally> tallies = new HashMap<>();
        for (SearchTermRecord record : poorPerformers) {
            token.throwIfCancelled("suggestion extraction");
            List<String> tokens = normalizer.tokenize(record.getTerm()).tokens();
            if (tokens.isEmpty()) {
                continue;
            }
            String normalizedTerm = String.join(" ", tokens);
            for (String gram : extractCandidates(tokens, opts)) {
                tallies.computeIfAbsent(gram, Tally::new).add(record, normalizedTerm);
            }
        }

        int totalPoor = poorPerformers.size();
        List<CandidateSuggestion> candidates = new ArrayList<>();
        for (Tally tally : tallies.values()) {
            token.throwIfCancelled("suggestion scoring");
            if (tally.occurrences < opts.getMinOccurrences()) {
                continue;
            }
            CandidateSuggestion candidate = score(tally, totalPoor, totalWaste, opts);
            if (candidate.confidenceScore() >= opts.getMinConfidence()) {
                candidates.add(candidate);
            }
        }

        candidates.sort(RANKING);
        List<CandidateSuggestion> ranked = candidates.size() > opts.getTopK()
                ? List.copyOf(candidates.subList(0, opts.getTopK()))
                : List.copyOf(candidates);

        for (CandidateSuggestion candidate : ranked) {
            metricsService.recordSuggestionConfidence(candidate.confidenceScore());
        }
        log.debug("suggest.completed poorPerformers={} candidates={} returned={} totalWaste={}",
                totalPoor, candidates.size(), ranked.size(), totalWaste);
        return ranked;
    }

    /**
     * Computes the confidence score for the given sub-scores and weights,
     * rounded to one decimal.
     */
    public static double confidence(ScoreBreakdown breakdown, ScoreWeights weights) {
        double sum = breakdown.occurrence().weighted(weights.occurrenceWeight())
                + breakdown.costImpact().weighted(weights.costImpactWeight())
                + breakdown.zeroConversion().weighted(weights.zeroConversionWeight());
        double score = Math.max(0.0, Math.min(100.0, sum * 100.0));
        return Math.round(score * 10.0) / 10.0;
    }

    private CandidateSuggestion score(Tally tally, int totalPoor, double totalWaste, SuggestionOptions opts) {
        ScoreBreakdown breakdown = new ScoreBreakdown(
                Ratio.of(tally.occurrences, Math.max(totalPoor, 1)),
                Ratio.of(tally.cost, Math.max(totalWaste, opts.getCostEpsilon())),
                Ratio.of(tally.zeroConversions, tally.occurrences));
        double confidence = confidence(breakdown, opts.getWeights());
        double waste = Math.round(tally.cost * 100.0) / 100.0;
        return new CandidateSuggestion(
                tally.text,
                tally.wordCount,
                tally.occurrences,
                waste,
                confidence,
                tally.distinctTerms.size(),
                tally.zeroConversions,
                tally.wordCount == 1 ? MatchType.BROAD : MatchType.PHRASE,
                ImpactRating.of(confidence, waste),
                breakdown);
    }

    /**
     * Distinct n-grams of one term, in first-seen order. A single-token candidate
     * must be long enough and not a stop word; a multi-token candidate must start
     * and end on such a token.
     */
    static Set<String> extractCandidates(List<String> tokens, SuggestionOptions opts) {
        Set<String> grams = new LinkedHashSet<>();
        boolean[] eligible = new boolean[tokens.size()];
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            eligible[i] = token.length() >= opts.getMinTokenLength() && !opts.getStopWords().contains(token);
        }
        int maxN = Math.min(opts.getMaxNgramLength(), tokens.size());
        for (int n = 1; n <= maxN; n++) {
            for (int i = 0; i + n <= tokens.size(); i++) {
                if (eligible[i] && eligible[i + n - 1]) {
                    grams.add(String.join(" ", tokens.subList(i, i + n)));
                }
            }
        }
        return grams;
    }

    private static final class Tally {
        private final String text;
        private final int wordCount;
        private int occurrences;
        private int zeroConversions;
        private double cost;
        private final Set<String> distinctTerms = new HashSet<>();

        Tally(String text) {
            this.text = text;
            this.wordCount = text.split(" ").length;
        }

        void add(SearchTermRecord record, String normalizedTerm) {
            occurrences++;
            cost += record.costOrZero();
            if (record.conversionsOrZero() == 0) {
                zeroConversions++;
            }
            distinctTerms.add(normalizedTerm);
        }
    }
}
