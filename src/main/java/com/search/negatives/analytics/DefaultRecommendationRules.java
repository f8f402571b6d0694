package com.search.negatives.analytics;

import java.util.List;
import java.util.Locale;

/**
 * Built-in recommendation table, highest priority first.
 */
public final class DefaultRecommendationRules {

    public static final String FALLBACK = "Continue current strategy - campaigns are well-optimized";

    static final double URGENT_WASTE = 1000.0;
    static final int DRAINING_TERMS = 5;
    static final double AGGRESSIVE_REDUCTION_PERCENT = 30.0;
    static final double HIGH_CONFIDENCE = 75.0;
    static final double LOW_QUALITY_PERCENT = 50.0;

    private DefaultRecommendationRules() {
        // Utility class
    }

    public static List<RecommendationRule> getRules() {
        return List.of(
                new RecommendationRule("urgent-waste", 10,
                        s -> s.costWastePrevented() > URGENT_WASTE,
                        s -> String.format(Locale.US, "URGENT: $%,.0f in preventable spend identified",
                                s.costWastePrevented())),

                new RecommendationRule("draining-terms", 20,
                        s -> s.highRiskCount() > DRAINING_TERMS,
                        s -> s.highRiskCount() + " terms actively draining budget - implement negatives immediately"),

                new RecommendationRule("aggressive-reduction", 30,
                        s -> s.costReductionPercentage() > AGGRESSIVE_REDUCTION_PERCENT,
                        s -> "Aggressive negative keyword implementation will significantly improve ROI"),

                new RecommendationRule("high-confidence-suggestions", 40,
                        s -> s.candidatesAtLeast(HIGH_CONFIDENCE) > 0,
                        s -> String.format(Locale.US,
                                "%d high-confidence negative keyword suggestions ready to apply (top: '%s')",
                                s.candidatesAtLeast(HIGH_CONFIDENCE), s.candidates().get(0).text())),

                new RecommendationRule("low-quality", 50,
                        s -> s.totalTerms() > 0 && s.qualityScore() < LOW_QUALITY_PERCENT,
                        s -> "Over half of search terms are excluded - review keyword targeting and match types"),

                new RecommendationRule("additional-savings", 60,
                        s -> s.potentialSavings() > 0,
                        s -> String.format(Locale.US,
                                "Applying suggested negatives could save an additional $%,.2f",
                                s.potentialSavings()))
        );
    }
}
