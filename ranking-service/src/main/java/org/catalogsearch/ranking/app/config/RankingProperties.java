package org.catalogsearch.ranking.app.config;

import lombok.Data;
import org.catalogsearch.ranking.config.ConfigurationException;
import org.catalogsearch.ranking.config.EngineSettings;
import org.catalogsearch.ranking.config.ExperimentSettings;
import org.catalogsearch.ranking.config.RankingConfig;
import org.catalogsearch.ranking.config.ScoringConstants;
import org.catalogsearch.ranking.model.Signal;
import org.catalogsearch.ranking.model.SignalCategory;
import org.catalogsearch.ranking.model.Variant;
import org.catalogsearch.ranking.model.Weights;
import org.catalogsearch.ranking.service.variant.InMemoryAssignmentStore;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for ranking and experiments.
 *
 * <p>Bound from {@code ranking.*} in {@code application.yml}. Empty maps fall back to the
 * built-in variants and weights. {@link #toRankingConfig()} converts the bound values into the
 * validated {@link RankingConfig} used at runtime; invalid values fail startup.</p>
 */
@Data
@Component
@ConfigurationProperties(prefix = "ranking")
public class RankingProperties {

    /** Variants by name; defaults to the five built-in variants with equal traffic. */
    private Map<String, VariantProperties> variants = new LinkedHashMap<>();

    /** Similarity signal weights by key (visual, textual, categorical, behavioral). */
    private Map<String, Double> similarityWeights = new LinkedHashMap<>();

    /** Business signal weights by key (popularity, stock, price, conversion, geographic). */
    private Map<String, Double> businessWeights = new LinkedHashMap<>();

    /** Personalization signal weights by key (preference, behavioral, session, temporal). */
    private Map<String, Double> personalizationWeights = new LinkedHashMap<>();

    private Scoring scoring = new Scoring();

    private Engine engine = new Engine();

    private Experiment experiment = new Experiment();

    public RankingConfig toRankingConfig() {
        return new RankingConfig(
                variants.isEmpty() ? RankingConfig.defaultVariants() : toVariants(),
                signalWeights(SignalCategory.SIMILARITY, similarityWeights, RankingConfig.defaultSimilarityWeights()),
                signalWeights(SignalCategory.BUSINESS, businessWeights, RankingConfig.defaultBusinessWeights()),
                signalWeights(SignalCategory.PERSONALIZATION, personalizationWeights,
                        RankingConfig.defaultPersonalizationWeights()),
                scoring.toConstants(),
                engine.toSettings(),
                experiment.toSettings());
    }

    private Map<String, Variant> toVariants() {
        Map<String, Variant> result = new LinkedHashMap<>();
        variants.forEach((name, props) -> result.put(name, new Variant(name,
                Weights.of(props.getSimilarity(), props.getBusiness(), props.getPersonalization(), props.getGeographic()),
                props.getTrafficShare())));
        return result;
    }

    private static Map<Signal, Double> signalWeights(SignalCategory category, Map<String, Double> configured,
                                                     Map<Signal, Double> defaults) {
        if (configured.isEmpty()) {
            return defaults;
        }
        Map<Signal, Double> weights = new EnumMap<>(Signal.class);
        try {
            configured.forEach((key, value) -> weights.put(Signal.fromKey(category, key), value));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        return weights;
    }

    @Data
    public static class VariantProperties {
        private double similarity;
        private double business;
        private double personalization;
        private double geographic;

        /** Relative share of sessions assigned to the variant. */
        private double trafficShare = 1.0;
    }

    @Data
    public static class Scoring {
        private double logisticSteepness = 10.0;
        private double logisticMidpoint = 0.5;
        private double viewsCap = 10_000;
        private double purchasesCap = 1_000;
        private double reviewsCap = 500;
        private double ratingScale = 5.0;
        private double conversionRateCap = 0.20;
        private double addToCartRateCap = 0.30;
        private double returnRateCap = 0.10;
        private double shippingCostCap = 50.0;
        private double shippingDaysCap = 14.0;
        private int highStockThreshold = 50;
        private int lowStockThreshold = 10;
        private int topCategoryCount = 3;

        /** Category keyword to in-season months; empty uses the built-in calendar. */
        private Map<String, Set<Integer>> seasonalCalendar = new LinkedHashMap<>();

        ScoringConstants toConstants() {
            return new ScoringConstants(logisticSteepness, logisticMidpoint, viewsCap, purchasesCap, reviewsCap,
                    ratingScale, conversionRateCap, addToCartRateCap, returnRateCap, shippingCostCap,
                    shippingDaysCap, highStockThreshold, lowStockThreshold, topCategoryCount,
                    seasonalCalendar.isEmpty() ? ScoringConstants.defaults().seasonalCalendar() : seasonalCalendar);
        }
    }

    @Data
    public static class Engine {

        /** Deadline applied when a request does not carry one. */
        private Duration defaultTimeout = Duration.ofSeconds(2);

        /** Largest accepted per-request deadline. */
        private Duration maxTimeout = Duration.ofSeconds(10);

        private double reasonThreshold = 0.5;
        private int maxReasons = 3;

        /** Factor applied to the similarity weight for mobile users; 1.0 disables it. */
        private double mobileSimilarityMultiplier = 1.0;

        /** Largest accepted {@code topK}. */
        private int maxTopK = 500;

        EngineSettings toSettings() {
            return new EngineSettings(defaultTimeout, reasonThreshold, maxReasons, mobileSimilarityMultiplier);
        }
    }

    @Data
    public static class Experiment {
        private int minImpressionSample = 100;
        private int minClickSample = 50;
        private double significanceZ = 1.96;
        private Duration retention = Duration.ofDays(30);

        /** Record an impression for every returned result of a request carrying a session id. */
        private boolean autoRecordImpressions = false;

        /** Interval between purges of expired events, in milliseconds. */
        private long purgeIntervalMs = 3_600_000L;

        /** Upper bound on remembered variant assignments. */
        private long assignmentMaxSize = InMemoryAssignmentStore.DEFAULT_MAXIMUM_SIZE;

        /** Idle time after which a remembered assignment is evicted. */
        private Duration assignmentExpireAfterAccess = InMemoryAssignmentStore.DEFAULT_EXPIRE_AFTER_ACCESS;

        ExperimentSettings toSettings() {
            return new ExperimentSettings(minImpressionSample, minClickSample, significanceZ, retention);
        }
    }
}
