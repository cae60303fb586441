package org.catalogsearch.ranking.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tuning constants of the scoring functions.
 *
 * @param logisticSteepness  steepness of the visual-similarity squash
 * @param logisticMidpoint   cosine similarity mapped to 0.5
 * @param viewsCap           view count treated as maximal popularity
 * @param purchasesCap       purchase count treated as maximal popularity
 * @param reviewsCap         review count treated as maximal popularity
 * @param ratingScale        top of the rating scale
 * @param conversionRateCap  conversion rate treated as excellent
 * @param addToCartRateCap   add-to-cart rate treated as excellent
 * @param returnRateCap      return rate at which the return term reaches 0
 * @param shippingCostCap    shipping cost at which the cost term reaches 0
 * @param shippingDaysCap    shipping days at which the speed term reaches 0
 * @param highStockThreshold stock above which availability is full
 * @param lowStockThreshold  smallest stock counted as medium availability
 * @param topCategoryCount   number of most frequent user categories considered "top"
 * @param seasonalCalendar   category keyword to in-season months (1-12)
 */
public record ScoringConstants(
        double logisticSteepness,
        double logisticMidpoint,
        double viewsCap,
        double purchasesCap,
        double reviewsCap,
        double ratingScale,
        double conversionRateCap,
        double addToCartRateCap,
        double returnRateCap,
        double shippingCostCap,
        double shippingDaysCap,
        int highStockThreshold,
        int lowStockThreshold,
        int topCategoryCount,
        Map<String, Set<Integer>> seasonalCalendar
) {

    public ScoringConstants {
        seasonalCalendar = seasonalCalendar == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(seasonalCalendar));
    }

    public static ScoringConstants defaults() {
        Map<String, Set<Integer>> calendar = new LinkedHashMap<>();
        calendar.put("winter", Set.of(11, 12, 1, 2));
        calendar.put("summer", Set.of(5, 6, 7, 8));
        calendar.put("swim", Set.of(5, 6, 7, 8));
        calendar.put("gift", Set.of(11, 12, 2, 5));
        calendar.put("electronics", Set.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12));
        return new ScoringConstants(10.0, 0.5, 10_000, 1_000, 500, 5.0,
                0.20, 0.30, 0.10, 50.0, 14.0, 50, 10, 3, calendar);
    }

    void validate() {
        requirePositive("logistic-steepness", logisticSteepness);
        requireWithin("logistic-midpoint", logisticMidpoint, -1.0, 1.0);
        for (Map.Entry<String, Double> cap : List.of(
                Map.entry("views-cap", viewsCap),
                Map.entry("purchases-cap", purchasesCap),
                Map.entry("reviews-cap", reviewsCap),
                Map.entry("rating-scale", ratingScale),
                Map.entry("conversion-rate-cap", conversionRateCap),
                Map.entry("add-to-cart-rate-cap", addToCartRateCap),
                Map.entry("return-rate-cap", returnRateCap),
                Map.entry("shipping-cost-cap", shippingCostCap),
                Map.entry("shipping-days-cap", shippingDaysCap))) {
            requirePositive(cap.getKey(), cap.getValue());
        }
        if (lowStockThreshold < 1 || highStockThreshold < lowStockThreshold) {
            throw new ConfigurationException(String.format(
                    "Stock thresholds must satisfy 1 <= low (%d) <= high (%d)",
                    lowStockThreshold, highStockThreshold));
        }
        if (topCategoryCount < 1) {
            throw new ConfigurationException("top-category-count must be at least 1");
        }
        seasonalCalendar.forEach((keyword, months) -> {
            for (Integer month : months) {
                if (month == null || month < 1 || month > 12) {
                    throw new ConfigurationException(
                            "Seasonal calendar entry '" + keyword + "' has invalid month " + month);
                }
            }
        });
    }

    private static void requirePositive(String name, double value) {
        if (Double.isNaN(value) || value <= 0.0d) {
            throw new ConfigurationException(name + " must be positive, was " + value);
        }
    }

    private static void requireWithin(String name, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ConfigurationException(name + " must be within [" + min + ", " + max + "], was " + value);
        }
    }
}
