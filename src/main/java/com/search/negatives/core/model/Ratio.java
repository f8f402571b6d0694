package com.search.negatives.core.model;

/**
 * A ratio constrained to [0.0, 1.0].
 * Out-of-range inputs are clamped when the value is constructed, and NaN becomes 0,
 * so any weighted sum of ratios with weights summing to 1 stays within [0, 1].
 */
public record Ratio(double value) {

    public static final Ratio ZERO = new Ratio(0.0);
    public static final Ratio ONE = new Ratio(1.0);

    public Ratio {
        if (Double.isNaN(value)) {
            value = 0.0;
        }
        value = Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Computes {@code numerator / denominator}, substituting 0 when the denominator
     * is zero, negative or not finite.
     */
    public static Ratio of(double numerator, double denominator) {
        if (denominator <= 0.0 || Double.isNaN(denominator) || Double.isInfinite(denominator)) {
            return ZERO;
        }
        return new Ratio(numerator / denominator);
    }

    /**
     * Returns {@code weight * value}.
     */
    public double weighted(double weight) {
        return weight * value;
    }
}
