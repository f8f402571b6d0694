package com.search.negatives.analytics;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of the threshold-to-message table.
 * Rules are evaluated in ascending priority; the first matching rules supply the recommendations.
 */
public record RecommendationRule(
        String name,
        int priority,
        Predicate<AnalyticsSnapshot> condition,
        Function<AnalyticsSnapshot, String> message
) {
    public RecommendationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(condition, "condition is required");
        Objects.requireNonNull(message, "message is required");
    }

    public boolean appliesTo(AnalyticsSnapshot snapshot) {
        return condition.test(snapshot);
    }

    public String render(AnalyticsSnapshot snapshot) {
        return message.apply(snapshot);
    }
}
