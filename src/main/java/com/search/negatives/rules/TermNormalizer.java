package com.search.negatives.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes search terms and negative keywords into comparable token sequences.
 *
 * <p>Every input is lowercased and whitespace-collapsed, then the configured
 * {@link NormalizationRule}s run in priority order (lower number first), then
 * whitespace is collapsed and trimmed again. Non-string input normalizes to the
 * empty string.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public class TermNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TermNormalizer.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final TermNormalizer DEFAULT = new TermNormalizer(DefaultTermRules.getStandardRules());

    private final List<NormalizationRule> rules;

    public TermNormalizer() {
        this(List.of());
    }

    public TermNormalizer(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Returns the shared normalizer with the standard rules.
     */
    public static TermNormalizer defaultNormalizer() {
        return DEFAULT;
    }

    /**
     * Returns a new normalizer with the given rule added.
     */
    public TermNormalizer withRule(NormalizationRule rule) {
        List<NormalizationRule> combined = new ArrayList<>(rules);
        combined.add(rule);
        return new TermNormalizer(combined);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes a raw cell value. Anything that is not a string becomes {@code ""}.
     */
    public String normalize(Object value) {
        if (!(value instanceof String)) {
            return "";
        }
        String text = (String) value;
        if (text.isBlank()) {
            return "";
        }

        String result = collapse(text.toLowerCase(Locale.ROOT));

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }

        return collapse(result);
    }

    /**
     * Normalizes and splits on whitespace, once.
     */
    public TokenizedText tokenize(Object value) {
        return TokenizedText.of(normalize(value));
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
