package org.catalogsearch.ranking.config;

import org.catalogsearch.ranking.model.Signal;
import org.catalogsearch.ranking.model.SignalCategory;
import org.catalogsearch.ranking.model.Variant;
import org.catalogsearch.ranking.model.Weights;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable, validated ranking configuration.
 *
 * <p>Built once at startup. Construction fails with a {@link ConfigurationException} when any
 * variant or intra-category weight set does not sum to 1.0, a weight is negative, or a scoring
 * constant is out of range, so an invalid configuration never reaches request handling.</p>
 *
 * @param variants               variants by name, in configuration order
 * @param similarityWeights      intra-category weights of the similarity signals
 * @param businessWeights        intra-category weights of the business signals
 * @param personalizationWeights intra-category weights of the personalization signals
 * @param scoring                scoring-function constants
 * @param engine                 request-level engine settings
 * @param experiment             experiment tracking settings
 */
public record RankingConfig(
        Map<String, Variant> variants,
        Map<Signal, Double> similarityWeights,
        Map<Signal, Double> businessWeights,
        Map<Signal, Double> personalizationWeights,
        ScoringConstants scoring,
        EngineSettings engine,
        ExperimentSettings experiment
) {

    public static final String SIMILARITY_FIRST = "similarity_first";
    public static final String BUSINESS_FIRST = "business_first";
    public static final String BALANCED = "balanced";
    public static final String PERSONALIZED = "personalized";
    public static final String GEOGRAPHIC = "geographic";

    public RankingConfig {
        if (variants == null || variants.isEmpty()) {
            throw new ConfigurationException("At least one ranking variant must be configured");
        }
        if (scoring == null || engine == null || experiment == null) {
            throw new ConfigurationException("Scoring, engine and experiment settings are required");
        }
        Map<String, Variant> byName = new LinkedHashMap<>();
        double totalShare = 0.0d;
        for (Map.Entry<String, Variant> entry : variants.entrySet()) {
            Variant variant = entry.getValue();
            if (variant == null || !variant.name().equals(entry.getKey())) {
                throw new ConfigurationException("Variant entry '" + entry.getKey() + "' does not match its name");
            }
            byName.put(variant.name(), variant);
            totalShare += variant.trafficShare();
        }
        if (totalShare <= 0.0d) {
            throw new ConfigurationException("At least one variant must receive traffic");
        }
        variants = Collections.unmodifiableMap(byName);
        similarityWeights = validated(SignalCategory.SIMILARITY, similarityWeights);
        businessWeights = validated(SignalCategory.BUSINESS, businessWeights);
        personalizationWeights = validated(SignalCategory.PERSONALIZATION, personalizationWeights);
        scoring.validate();
        engine.validate();
        experiment.validate();
    }

    public static RankingConfig defaults() {
        return new RankingConfig(
                defaultVariants(),
                defaultSimilarityWeights(),
                defaultBusinessWeights(),
                defaultPersonalizationWeights(),
                ScoringConstants.defaults(),
                EngineSettings.defaults(),
                ExperimentSettings.defaults());
    }

    /**
     * The built-in variants, sharing traffic equally.
     */
    public static Map<String, Variant> defaultVariants() {
        Map<String, Variant> variants = new LinkedHashMap<>();
        put(variants, new Variant(SIMILARITY_FIRST, Weights.of(0.7, 0.2, 0.1)));
        put(variants, new Variant(BUSINESS_FIRST, Weights.of(0.3, 0.5, 0.2)));
        put(variants, new Variant(BALANCED, Weights.of(0.4, 0.3, 0.3)));
        put(variants, new Variant(PERSONALIZED, Weights.of(0.2, 0.3, 0.5)));
        put(variants, new Variant(GEOGRAPHIC, Weights.of(0.4, 0.2, 0.2, 0.2)));
        return variants;
    }

    public static Map<Signal, Double> defaultSimilarityWeights() {
        Map<Signal, Double> weights = new EnumMap<>(Signal.class);
        weights.put(Signal.VISUAL, 0.4);
        weights.put(Signal.TEXTUAL, 0.3);
        weights.put(Signal.CATEGORICAL, 0.2);
        weights.put(Signal.SHOPPING_HISTORY, 0.1);
        return weights;
    }

    public static Map<Signal, Double> defaultBusinessWeights() {
        Map<Signal, Double> weights = new EnumMap<>(Signal.class);
        weights.put(Signal.POPULARITY, 0.25);
        weights.put(Signal.STOCK, 0.30);
        weights.put(Signal.PRICE, 0.15);
        weights.put(Signal.CONVERSION, 0.20);
        weights.put(Signal.GEOGRAPHIC, 0.10);
        return weights;
    }

    public static Map<Signal, Double> defaultPersonalizationWeights() {
        Map<Signal, Double> weights = new EnumMap<>(Signal.class);
        weights.put(Signal.PREFERENCE, 0.35);
        weights.put(Signal.ACTIVITY, 0.30);
        weights.put(Signal.SESSION, 0.20);
        weights.put(Signal.TEMPORAL, 0.15);
        return weights;
    }

    public Variant variant(String name) {
        return variants.get(name);
    }

    public Collection<String> variantNames() {
        return variants.keySet();
    }

    public Map<Signal, Double> intraWeights(SignalCategory category) {
        return switch (category) {
            case SIMILARITY -> similarityWeights;
            case BUSINESS -> businessWeights;
            case PERSONALIZATION -> personalizationWeights;
            case GEOGRAPHIC -> Map.of(Signal.GEOGRAPHIC, 1.0d);
        };
    }

    private static void put(Map<String, Variant> variants, Variant variant) {
        variants.put(variant.name(), variant);
    }

    private static Map<Signal, Double> validated(SignalCategory category, Map<Signal, Double> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new ConfigurationException("No " + category.key() + " signal weights configured");
        }
        Map<Signal, Double> copy = new EnumMap<>(Signal.class);
        double sum = 0.0d;
        for (Map.Entry<Signal, Double> entry : weights.entrySet()) {
            Signal signal = entry.getKey();
            Double value = entry.getValue();
            if (signal.category() != category) {
                throw new ConfigurationException(
                        "Signal '" + signal.key() + "' is not a " + category.key() + " signal");
            }
            if (value == null || value.isNaN() || value < 0.0d || value > 1.0d) {
                throw new ConfigurationException(String.format(
                        "%s signal weight '%s' = %s is outside [0,1]", category.key(), signal.key(), value));
            }
            copy.put(signal, value);
            sum += value;
        }
        if (Math.abs(sum - 1.0d) > Weights.EPSILON) {
            throw new ConfigurationException(String.format(
                    "%s signal weights sum to %s instead of 1.0", category.key(), sum));
        }
        return Collections.unmodifiableMap(copy);
    }
}
