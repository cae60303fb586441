package org.catalogsearch.ranking.config;

import java.time.Duration;

/**
 * Experiment tracking settings.
 *
 * @param minImpressionSample impressions a variant needs before its CTR can be recommended
 * @param minClickSample      clicks a variant needs before its conversion rate can be recommended
 * @param significanceZ       z-score a leader must reach over the runner-up to be flagged significant
 * @param retention           how long events count towards metrics
 */
public record ExperimentSettings(
        int minImpressionSample,
        int minClickSample,
        double significanceZ,
        Duration retention
) {

    public static ExperimentSettings defaults() {
        return new ExperimentSettings(100, 50, 1.96, Duration.ofDays(30));
    }

    void validate() {
        if (minImpressionSample < 1 || minClickSample < 1) {
            throw new ConfigurationException("Minimum sample sizes must be at least 1");
        }
        if (Double.isNaN(significanceZ) || significanceZ < 0.0d) {
            throw new ConfigurationException("significance-z must not be negative");
        }
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new ConfigurationException("retention must be positive");
        }
    }
}
