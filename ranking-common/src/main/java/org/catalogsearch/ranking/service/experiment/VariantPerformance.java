package org.catalogsearch.ranking.service.experiment;

import org.catalogsearch.ranking.model.PerformanceMetric;

/**
 * Aggregated experiment results of one variant within the retention window.
 *
 * @param variant        variant name
 * @param impressions    distinct impressed (session, candidate) pairs
 * @param clicks         distinct clicked pairs
 * @param purchases      distinct purchased pairs
 * @param ctr            clicks / impressions, 0 without impressions
 * @param conversionRate purchases / clicks, 0 without clicks
 * @param eventCount     raw events in the window
 */
public record VariantPerformance(
        String variant,
        long impressions,
        long clicks,
        long purchases,
        double ctr,
        double conversionRate,
        long eventCount
) {

    public static VariantPerformance empty(String variant) {
        return new VariantPerformance(variant, 0L, 0L, 0L, 0.0d, 0.0d, 0L);
    }

    public double value(PerformanceMetric metric) {
        return switch (metric) {
            case CTR -> ctr;
            case CONVERSION -> conversionRate;
        };
    }

    /**
     * Trials behind a metric: impressions for CTR, clicks for conversion.
     */
    public long sampleSize(PerformanceMetric metric) {
        return switch (metric) {
            case CTR -> impressions;
            case CONVERSION -> clicks;
        };
    }
}
