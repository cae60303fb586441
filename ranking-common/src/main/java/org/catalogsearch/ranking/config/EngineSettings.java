package org.catalogsearch.ranking.config;

import java.time.Duration;

/**
 * Request-level behaviour of the ranking engine.
 *
 * @param defaultTimeout             deadline applied when the caller supplies none
 * @param reasonThreshold            sub-score above which a signal yields an explanation reason
 * @param maxReasons                 maximum number of reasons per candidate
 * @param mobileSimilarityMultiplier factor applied to the similarity weight for mobile users
 *                                   before renormalization (1.0 disables the adjustment)
 */
public record EngineSettings(
        Duration defaultTimeout,
        double reasonThreshold,
        int maxReasons,
        double mobileSimilarityMultiplier
) {

    public static EngineSettings defaults() {
        return new EngineSettings(Duration.ofSeconds(2), 0.5, 3, 1.0);
    }

    void validate() {
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new ConfigurationException("default-timeout must be positive");
        }
        if (Double.isNaN(reasonThreshold) || reasonThreshold < 0.0d || reasonThreshold > 1.0d) {
            throw new ConfigurationException("reason-threshold must be within [0,1]");
        }
        if (maxReasons < 0) {
            throw new ConfigurationException("max-reasons must not be negative");
        }
        if (Double.isNaN(mobileSimilarityMultiplier) || mobileSimilarityMultiplier <= 0.0d) {
            throw new ConfigurationException("mobile-similarity-multiplier must be positive");
        }
    }
}
