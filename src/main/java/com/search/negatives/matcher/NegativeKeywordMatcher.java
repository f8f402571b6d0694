package com.search.negatives.matcher;

import com.search.negatives.core.CancellationToken;
import com.search.negatives.core.model.NegativeKeywordEntry;
import com.search.negatives.core.model.NegativeKeywordRule;
import com.search.negatives.core.model.SearchTermRecord;
import com.search.negatives.metrics.MetricsService;
import com.search.negatives.metrics.NoOpMetricsService;
import com.search.negatives.rules.TermNormalizer;
import com.search.negatives.rules.TokenizedText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classifies search terms against an ordered list of negative keywords.
 *
 * <p>Match semantics:</p>
 * <ul>
 *   <li>EXACT: the normalized term equals the normalized keyword</li>
 *   <li>PHRASE: the keyword tokens occur as a contiguous run of term tokens</li>
 *   <li>BROAD: every keyword token occurs somewhere in the term</li>
 * </ul>
 *
 * <p>Rules are evaluated in list order and the first satisfied rule wins.
 * Each term is normalized and tokenized once per call; keywords are tokenized when
 * the rules are compiled. The matcher holds no mutable state and can be shared by
 * concurrent units.</p>
 */
public class NegativeKeywordMatcher {
    private static final Logger log = LoggerFactory.getLogger(NegativeKeywordMatcher.class);

    private final List<NegativeKeywordRule> rules;
    private final TermNormalizer normalizer;
    private final Clock clock;
    private final MetricsService metricsService;

    public NegativeKeywordMatcher(List<NegativeKeywordRule> rules) {
        this(rules, TermNormalizer.defaultNormalizer(), Clock.systemUTC(), new NoOpMetricsService());
    }

    public NegativeKeywordMatcher(List<NegativeKeywordRule> rules, TermNormalizer normalizer,
                                  Clock clock, MetricsService metricsService) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules is required"));
        this.normalizer = normalizer != null ? normalizer : TermNormalizer.defaultNormalizer();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Validates raw loader rows and compiles them in order.
     *
     * @throws com.search.negatives.exception.InvalidRuleException on the first invalid row
     */
    public static List<NegativeKeywordRule> compileRules(List<NegativeKeywordEntry> entries,
                                                         TermNormalizer normalizer) {
        List<NegativeKeywordRule> compiled = new ArrayList<>(entries.size());
        for (NegativeKeywordEntry entry : entries) {
            compiled.add(NegativeKeywordRule.fromEntry(entry, normalizer));
        }
        return compiled;
    }

    /**
     * Classifies every record in place and returns the same list.
     *
     * @throws IllegalStateException if a record was already classified
     */
    public List<SearchTermRecord> match(List<SearchTermRecord> records) {
        return match(records, CancellationToken.none());
    }

    /**
     * Classifies every record in place, checking for cancellation between records.
     *
     * @throws com.search.negatives.exception.ComputationTimeoutException if cancelled
     */
    public List<SearchTermRecord> match(List<SearchTermRecord> records, CancellationToken token) {
        long start = System.nanoTime();
        Instant checkedAt = clock.instant();
        int excluded = 0;

        for (SearchTermRecord record : records) {
            token.throwIfCancelled("matching");
            MatchOutcome outcome = matchOne(record.getTerm());
            if (outcome.isExcluded()) {
                record.markExcluded(outcome.rule(), checkedAt);
                metricsService.incrementTermExcluded(outcome.matchType());
                excluded++;
            } else {
                record.markRetained(checkedAt);
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metricsService.recordMatchDuration(elapsed);
        log.debug("match.completed terms={} rules={} excluded={} durationMs={}",
                records.size(), rules.size(), excluded, elapsed.toMillis());
        return records;
    }

    /**
     * Checks one raw term value without touching any record.
     * Non-string and missing values are treated as the empty term, which never matches.
     */
    public MatchOutcome matchOne(Object term) {
        TokenizedText text = normalizer.tokenize(term);
        if (text.isEmpty()) {
            return MatchOutcome.noMatch();
        }
        for (NegativeKeywordRule rule : rules) {
            if (satisfies(rule, text)) {
                return new MatchOutcome(rule);
            }
        }
        return MatchOutcome.noMatch();
    }

    public List<NegativeKeywordRule> getRules() {
        return rules;
    }

    static boolean satisfies(NegativeKeywordRule rule, TokenizedText term) {
        TokenizedText keyword = rule.getText();
        return switch (rule.getMatchType()) {
            case EXACT -> term.normalized().equals(keyword.normalized());
            case PHRASE -> containsContiguous(term.tokens(), keyword.tokens());
            case BROAD -> term.tokenSet().containsAll(keyword.tokenSet());
        };
    }

    static boolean containsContiguous(List<String> haystack, List<String> needle) {
        int n = needle.size();
        int limit = haystack.size() - n;
        for (int i = 0; i <= limit; i++) {
            int j = 0;
            while (j < n && haystack.get(i + j).equals(needle.get(j))) {
                j++;
            }
            if (j == n) {
                return true;
            }
        }
        return false;
    }
}
