package com.search.negatives.rules;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A regex rewrite applied to search terms and keywords after lowercasing.
 * Rules run in ascending priority; two rules with the same name are the same rule.
 *
 * @param name        identifies the rule in trace logs
 * @param pattern     compiled case-insensitively
 * @param replacement replacement string, may reference groups ({@code $1})
 * @param priority    lower runs first
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public static final int DEFAULT_PRIORITY = 100;

    public NormalizationRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("pattern is required");
        }
        if (replacement == null) {
            throw new IllegalArgumentException("replacement is required");
        }
    }

    /**
     * Compiles {@code regex} case-insensitively (Unicode aware).
     *
     * @throws IllegalArgumentException if the regex does not compile
     */
    public static NormalizationRule of(String name, String regex, String replacement, int priority) {
        if (regex == null) {
            throw new IllegalArgumentException("pattern is required");
        }
        try {
            Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            return new NormalizationRule(name, pattern, replacement, priority);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern for rule '" + name + "': " + e.getDescription(), e);
        }
    }

    public static NormalizationRule of(String name, String regex, String replacement) {
        return of(name, regex, replacement, DEFAULT_PRIORITY);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof NormalizationRule other && name.equals(other.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "NormalizationRule{name='" + name + "', pattern=" + pattern.pattern() + ", priority=" + priority + '}';
    }
}
