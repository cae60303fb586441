package org.catalogsearch.ranking.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Sub-scores produced by one scorer for one candidate.
 *
 * <p>A signal is <em>applicable</em> when the request carried the inputs it needs. Inapplicable
 * signals score 0 and are left out when the scores are reduced to a category score, so the
 * remaining signals share the category's weight.</p>
 */
public record SignalScores(SignalCategory category, Map<Signal, Double> values, Set<Signal> applicable) {

    public SignalScores {
        values = Collections.unmodifiableMap(new EnumMap<>(values));
        applicable = applicable.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Signal.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(applicable));
    }

    /**
     * All signals of the category scored 0 and inapplicable.
     */
    public static SignalScores inapplicable(SignalCategory category) {
        Builder builder = builder(category);
        Signal.of(category).forEach(builder::inapplicable);
        return builder.build();
    }

    public static Builder builder(SignalCategory category) {
        return new Builder(category);
    }

    public double get(Signal signal) {
        return values.getOrDefault(signal, 0.0d);
    }

    public boolean isApplicable(Signal signal) {
        return applicable.contains(signal);
    }

    public boolean anyApplicable() {
        return !applicable.isEmpty();
    }

    /**
     * Reduces the sub-scores to one category score.
     *
     * <p>Weights of inapplicable signals are dropped and the rest renormalized. Returns 0 when
     * no applicable signal carries weight.</p>
     *
     * @param weights intra-category weights, summing to 1.0
     * @return category score in [0,1]
     */
    public double reduce(Map<Signal, Double> weights) {
        double weighted = 0.0d;
        double total = 0.0d;
        for (Map.Entry<Signal, Double> entry : weights.entrySet()) {
            if (!applicable.contains(entry.getKey())) {
                continue;
            }
            weighted += entry.getValue() * get(entry.getKey());
            total += entry.getValue();
        }
        if (total <= 0.0d) {
            return 0.0d;
        }
        return Scores.clamp(weighted / total);
    }

    /**
     * Returns the sub-scores keyed by signal key, in declaration order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (Signal signal : Signal.of(category)) {
            map.put(signal.key(), get(signal));
        }
        return map;
    }

    /**
     * Collects sub-scores for one category.
     */
    public static final class Builder {

        private final SignalCategory category;
        private final Map<Signal, Double> values = new EnumMap<>(Signal.class);
        private final Set<Signal> applicable = EnumSet.noneOf(Signal.class);

        private Builder(SignalCategory category) {
            this.category = category;
        }

        public Builder put(Signal signal, double value) {
            checkCategory(signal);
            values.put(signal, Scores.clamp(value));
            applicable.add(signal);
            return this;
        }

        public Builder inapplicable(Signal signal) {
            checkCategory(signal);
            values.put(signal, 0.0d);
            applicable.remove(signal);
            return this;
        }

        public SignalScores build() {
            return new SignalScores(category, values, applicable);
        }

        private void checkCategory(Signal signal) {
            if (signal.category() != category) {
                throw new IllegalArgumentException(signal + " does not belong to " + category);
            }
        }
    }
}
