package org.catalogsearch.ranking.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregate metrics reported per variant.
 */
public enum PerformanceMetric {

    /** Distinct clicked pairs divided by distinct impressed pairs. */
    CTR("ctr"),

    /** Distinct purchased pairs divided by distinct clicked pairs. */
    CONVERSION("conversion");

    private final String key;

    PerformanceMetric(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static PerformanceMetric fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Metric is required");
        }
        String normalized = key.trim().toLowerCase();
        return switch (normalized) {
            case "ctr", "click_through_rate" -> CTR;
            case "conversion", "conversion_rate" -> CONVERSION;
            default -> throw new IllegalArgumentException("Unknown metric: " + key);
        };
    }
}
