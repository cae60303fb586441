package org.catalogsearch.ranking.model;

/**
 * Numeric helpers shared by the scorers.
 */
public final class Scores {

    private Scores() {}

    /**
     * Clamps a score into [0,1]; NaN becomes 0.
     */
    public static double clamp(double value) {
        if (Double.isNaN(value) || value <= 0.0d) {
            return 0.0d;
        }
        return Math.min(value, 1.0d);
    }

    /**
     * Returns {@code value / cap} capped at 1, or 0 for a missing or non-positive value.
     */
    public static double normalize(Number value, double cap) {
        if (value == null || cap <= 0.0d) {
            return 0.0d;
        }
        return clamp(value.doubleValue() / cap);
    }
}
