package org.catalogsearch.ranking.service.facet;

import org.catalogsearch.ranking.model.Candidate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds brand, category, price-range and rating facets for a result list.
 */
public class FacetAggregator {

    private static final double[] PRICE_BOUNDS = {25.0d, 50.0d, 100.0d, 200.0d};
    private static final String[] PRICE_LABELS = {"0-25", "25-50", "50-100", "100-200", "200+"};

    public Facets aggregate(Collection<Candidate> candidates) {
        Map<String, Long> priceRanges = new LinkedHashMap<>();
        for (String label : PRICE_LABELS) {
            priceRanges.put(label, 0L);
        }
        Map<String, Long> ratings = new LinkedHashMap<>();
        for (int stars = 1; stars <= 5; stars++) {
            ratings.put(String.valueOf(stars), 0L);
        }

        for (Candidate candidate : candidates) {
            if (candidate.getPrice() != null && candidate.getPrice() >= 0.0d) {
                priceRanges.merge(priceRange(candidate.getPrice()), 1L, Long::sum);
            }
            if (candidate.getRating() != null && candidate.getRating() > 0.0d) {
                ratings.merge(String.valueOf(stars(candidate.getRating())), 1L, Long::sum);
            }
        }

        return new Facets(
                countBy(candidates, Candidate::getBrand),
                countBy(candidates, Candidate::getCategory),
                priceRanges,
                ratings);
    }

    static String priceRange(double price) {
        for (int i = 0; i < PRICE_BOUNDS.length; i++) {
            if (price < PRICE_BOUNDS[i]) {
                return PRICE_LABELS[i];
            }
        }
        return PRICE_LABELS[PRICE_LABELS.length - 1];
    }

    static int stars(double rating) {
        return (int) Math.max(1L, Math.min(5L, Math.round(rating)));
    }

    private static Map<String, Long> countBy(Collection<Candidate> candidates, Function<Candidate, String> field) {
        Map<String, Long> counts = new HashMap<>();
        for (Candidate candidate : candidates) {
            String value = field.apply(candidate);
            if (value != null && !value.isBlank()) {
                counts.merge(value, 1L, Long::sum);
            }
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        Map<String, Long> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }
}
