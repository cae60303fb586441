package org.catalogsearch.ranking.model;

import org.catalogsearch.ranking.config.ConfigurationException;

/**
 * A named ranking algorithm: a fixed weight vector plus its share of experiment traffic.
 *
 * @param name         variant name, e.g. {@code balanced}
 * @param weights      category weights, summing to 1.0
 * @param trafficShare relative share of sessions assigned to this variant (non-negative)
 */
public record Variant(String name, Weights weights, double trafficShare) {

    public Variant {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Variant name is required");
        }
        if (weights == null) {
            throw new ConfigurationException("Variant '" + name + "' has no weights");
        }
        if (Double.isNaN(trafficShare) || trafficShare < 0.0d) {
            throw new ConfigurationException("Variant '" + name + "' has a negative traffic share");
        }
        weights.validate(name);
    }

    public Variant(String name, Weights weights) {
        this(name, weights, 1.0d);
    }
}
