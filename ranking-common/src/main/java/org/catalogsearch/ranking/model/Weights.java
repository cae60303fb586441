package org.catalogsearch.ranking.model;

import org.catalogsearch.ranking.config.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Category weights of a ranking variant.
 *
 * <p>Configured weights must lie in [0,1] and sum to 1.0 (within {@link #EPSILON}); see
 * {@link #validate(String)}. Per request, {@link #redistribute(Set)} derives the effective
 * weights over the categories that can actually be scored.</p>
 */
public record Weights(Map<SignalCategory, Double> values) {

    public static final double EPSILON = 1e-6;

    public Weights {
        EnumMap<SignalCategory, Double> copy = new EnumMap<>(SignalCategory.class);
        for (SignalCategory category : SignalCategory.values()) {
            Double value = values.get(category);
            copy.put(category, value == null ? 0.0d : value);
        }
        values = Collections.unmodifiableMap(copy);
    }

    public static Weights of(double similarity, double business, double personalization) {
        return of(similarity, business, personalization, 0.0d);
    }

    public static Weights of(double similarity, double business, double personalization, double geographic) {
        Map<SignalCategory, Double> values = new EnumMap<>(SignalCategory.class);
        values.put(SignalCategory.SIMILARITY, similarity);
        values.put(SignalCategory.BUSINESS, business);
        values.put(SignalCategory.PERSONALIZATION, personalization);
        values.put(SignalCategory.GEOGRAPHIC, geographic);
        return new Weights(values);
    }

    public double get(SignalCategory category) {
        return values.get(category);
    }

    public double sum() {
        double sum = 0.0d;
        for (double value : values.values()) {
            sum += value;
        }
        return sum;
    }

    /**
     * Checks the configuration invariants of a variant's weights.
     *
     * @param variantName name used in the error message
     * @throws ConfigurationException when a weight is outside [0,1], the weights do not sum to
     *                                1.0, or only optional categories carry weight
     */
    public void validate(String variantName) {
        for (Map.Entry<SignalCategory, Double> entry : values.entrySet()) {
            double value = entry.getValue();
            if (Double.isNaN(value) || value < 0.0d || value > 1.0d) {
                throw new ConfigurationException(String.format(
                        "Variant '%s': %s weight %s is outside [0,1]",
                        variantName, entry.getKey().key(), value));
            }
        }
        double sum = sum();
        if (Math.abs(sum - 1.0d) > EPSILON) {
            throw new ConfigurationException(String.format(
                    "Variant '%s': weights sum to %s instead of 1.0", variantName, sum));
        }
        if (get(SignalCategory.SIMILARITY) + get(SignalCategory.BUSINESS) <= 0.0d) {
            throw new ConfigurationException(String.format(
                    "Variant '%s': similarity and business weights cannot both be 0", variantName));
        }
    }

    /**
     * Returns a copy with one category's weight multiplied. The result is generally not
     * normalized; pass it through {@link #redistribute(Set)}.
     */
    public Weights scale(SignalCategory category, double factor) {
        Map<SignalCategory, Double> scaled = new EnumMap<>(values);
        scaled.put(category, get(category) * factor);
        return new Weights(scaled);
    }

    /**
     * Moves the weight of inapplicable categories proportionally onto the applicable ones.
     *
     * <p>The result sums to 1.0 and holds 0 for every category not in {@code applicable}.
     * When no applicable category carries weight, they share it equally.</p>
     *
     * @param applicable categories that can be scored for the request
     * @return effective weights
     */
    public Weights redistribute(Set<SignalCategory> applicable) {
        if (applicable.isEmpty()) {
            throw new IllegalArgumentException("At least one category must be applicable");
        }
        double total = 0.0d;
        for (SignalCategory category : applicable) {
            total += get(category);
        }

        Map<SignalCategory, Double> effective = new EnumMap<>(SignalCategory.class);
        for (SignalCategory category : SignalCategory.values()) {
            if (!applicable.contains(category)) {
                effective.put(category, 0.0d);
            } else if (total > 0.0d) {
                effective.put(category, get(category) / total);
            } else {
                effective.put(category, 1.0d / applicable.size());
            }
        }
        return new Weights(effective);
    }

    /**
     * Returns the weights keyed by category key, in declaration order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        values.forEach((category, value) -> map.put(category.key(), value));
        return map;
    }
}
