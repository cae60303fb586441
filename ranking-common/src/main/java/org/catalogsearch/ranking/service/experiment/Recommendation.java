package org.catalogsearch.ranking.service.experiment;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.catalogsearch.ranking.model.PerformanceMetric;

/**
 * Best variant for one metric.
 *
 * @param metric      compared metric
 * @param variant     leading variant, {@code null} when no variant reached the minimum sample
 * @param value       leader's metric value
 * @param sampleSize  leader's trials (impressions for CTR, clicks for conversion)
 * @param runnerUp    second-best eligible variant, if any
 * @param zScore      two-proportion z-score of leader versus runner-up
 * @param significant whether {@code zScore} reached the configured threshold
 * @param message     short human-readable summary
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Recommendation(
        PerformanceMetric metric,
        String variant,
        double value,
        long sampleSize,
        String runnerUp,
        double zScore,
        boolean significant,
        String message
) {

    public static Recommendation insufficientData(PerformanceMetric metric, long minimumSample) {
        return new Recommendation(metric, null, 0.0d, 0L, null, 0.0d, false,
                "No variant has reached " + minimumSample + " samples for " + metric.key());
    }

    public boolean hasVariant() {
        return variant != null;
    }
}
