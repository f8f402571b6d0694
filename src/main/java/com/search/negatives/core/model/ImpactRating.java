package com.search.negatives.core.model;

/**
 * Coarse priority of a negative keyword suggestion, from confidence and wasted cost.
 */
public enum ImpactRating {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static ImpactRating of(double confidence, double wastedCost) {
        if (confidence >= 85 && wastedCost > 100) {
            return CRITICAL;
        } else if (confidence >= 75 && wastedCost > 50) {
            return HIGH;
        } else if (confidence >= 65) {
            return MEDIUM;
        }
        return LOW;
    }
}
