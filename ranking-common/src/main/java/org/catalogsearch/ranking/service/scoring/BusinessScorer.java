package org.catalogsearch.ranking.service.scoring;

import org.catalogsearch.ranking.config.ScoringConstants;
import org.catalogsearch.ranking.model.Candidate;
import org.catalogsearch.ranking.model.GeoContext;
import org.catalogsearch.ranking.model.Scores;
import org.catalogsearch.ranking.model.Signal;
import org.catalogsearch.ranking.model.SignalCategory;
import org.catalogsearch.ranking.model.SignalScores;

import java.util.Map;
import java.util.Set;

import static org.catalogsearch.ranking.service.scoring.ScoringGuard.guard;

/**
 * Commerce value of one candidate: popularity, stock availability, price competitiveness,
 * conversion performance and, when the requester's location is known, geographic relevance.
 *
 * <p>Stateless and safe for concurrent use.</p>
 */
public class BusinessScorer {

    private static final double OUT_OF_STOCK = 0.1;
    private static final double BACKORDER = 0.2;
    private static final double LOW_STOCK = 0.6;
    private static final double MEDIUM_STOCK = 0.8;
    private static final double HIGH_STOCK = 1.0;

    private static final double NEUTRAL_PRICE = 0.5;
    private static final double AVERAGE_PRICE = 0.7;
    private static final double PRICE_SPREAD = 0.3;
    private static final double DISCOUNT_WEIGHT = 0.3;

    private static final double REGION_AVAILABLE = 0.3;
    private static final double SHIPPING_COST_WEIGHT = 0.1;
    private static final double SHIPPING_SPEED_WEIGHT = 0.1;
    private static final double LOCAL_POPULARITY_WEIGHT = 0.1;

    private final ScoringConstants constants;

    public BusinessScorer(ScoringConstants constants) {
        this.constants = constants;
    }

    /**
     * Scores one candidate.
     *
     * @param candidate candidate to score
     * @param geo       optional requester location; without it the geographic sub-score is
     *                  inapplicable
     * @return business sub-scores
     */
    public SignalScores score(Candidate candidate, GeoContext geo) {
        SignalScores.Builder scores = SignalScores.builder(SignalCategory.BUSINESS);
        String candidateId = candidate.getId();

        scores.put(Signal.POPULARITY, guard(Signal.POPULARITY, candidateId, () -> popularity(candidate)));
        scores.put(Signal.STOCK, guard(Signal.STOCK, candidateId, () -> stock(candidate)));
        scores.put(Signal.PRICE, guard(Signal.PRICE, candidateId, () -> price(candidate)));
        scores.put(Signal.CONVERSION, guard(Signal.CONVERSION, candidateId, () -> conversion(candidate)));

        if (geo != null) {
            scores.put(Signal.GEOGRAPHIC, guard(Signal.GEOGRAPHIC, candidateId, () -> geographic(candidate, geo)));
        } else {
            scores.inapplicable(Signal.GEOGRAPHIC);
        }
        return scores.build();
    }

    double popularity(Candidate candidate) {
        double popularity = candidate.getPopularityScore() == null ? 0.0d : Scores.clamp(candidate.getPopularityScore());
        return Scores.clamp(
                popularity * 0.30
                        + Scores.normalize(candidate.getViewCount(), constants.viewsCap()) * 0.20
                        + Scores.normalize(candidate.getPurchaseCount(), constants.purchasesCap()) * 0.30
                        + Scores.normalize(candidate.getRating(), constants.ratingScale()) * 0.15
                        + Scores.normalize(candidate.getReviewCount(), constants.reviewsCap()) * 0.05);
    }

    /**
     * Step function over the stock level. Zero stock is penalized without being zeroed out,
     * since the item may be restocked before the list is consumed.
     */
    double stock(Candidate candidate) {
        int stock = candidate.getStockQuantity() == null ? 0 : candidate.getStockQuantity();
        if (stock > constants.highStockThreshold()) {
            return HIGH_STOCK;
        }
        if (stock >= constants.lowStockThreshold()) {
            return MEDIUM_STOCK;
        }
        if (stock >= 1) {
            return LOW_STOCK;
        }
        return candidate.isBackorderable() ? BACKORDER : OUT_OF_STOCK;
    }

    double price(Candidate candidate) {
        Double price = candidate.getPrice();
        if (price == null || price < 0.0d) {
            return 0.0d;
        }

        double discount = 0.0d;
        Double original = candidate.getOriginalPrice();
        if (original != null && original > 0.0d && original > price) {
            discount = (original - price) / original;
        }

        double competitiveness = NEUTRAL_PRICE;
        Double average = candidate.getCategoryAveragePrice();
        if (average != null && average > 0.0d) {
            competitiveness = AVERAGE_PRICE + (average - price) / average * PRICE_SPREAD;
        }
        return Scores.clamp(competitiveness + discount * DISCOUNT_WEIGHT);
    }

    double conversion(Candidate candidate) {
        Double conversionRate = candidate.getConversionRate();
        if (conversionRate == null) {
            conversionRate = ratio(candidate.getPurchaseCount(), candidate.getViewCount());
        }
        Double returnRate = candidate.getReturnRate();
        if (returnRate == null) {
            returnRate = ratio(candidate.getReturnCount(), candidate.getPurchaseCount());
        }
        Double addToCartRate = candidate.getAddToCartRate();

        double score = 0.0d;
        if (conversionRate != null) {
            score += Scores.normalize(conversionRate, constants.conversionRateCap()) * 0.5;
        }
        if (addToCartRate != null) {
            score += Scores.normalize(addToCartRate, constants.addToCartRateCap()) * 0.3;
        }
        if (returnRate != null) {
            score += Math.max(0.0d, 1.0d - returnRate / constants.returnRateCap()) * 0.2;
        }
        return Scores.clamp(score);
    }

    double geographic(Candidate candidate, GeoContext geo) {
        double score = 0.0d;

        Set<String> regions = candidate.getAvailableRegions();
        if (TextTokens.containsIgnoreCase(regions, geo.getCountry())
                || TextTokens.containsIgnoreCase(regions, geo.getRegion())) {
            score += REGION_AVAILABLE;
        }
        if (candidate.getShippingCost() != null) {
            score += SHIPPING_COST_WEIGHT
                    * Math.max(0.0d, 1.0d - candidate.getShippingCost() / constants.shippingCostCap());
        }
        if (candidate.getShippingDays() != null) {
            score += SHIPPING_SPEED_WEIGHT
                    * Math.max(0.0d, 1.0d - candidate.getShippingDays() / constants.shippingDaysCap());
        }
        score += LOCAL_POPULARITY_WEIGHT * localPopularity(candidate.getRegionalPopularity(), geo);
        return Scores.clamp(score);
    }

    private static double localPopularity(Map<String, Double> regionalPopularity, GeoContext geo) {
        if (regionalPopularity == null || regionalPopularity.isEmpty()) {
            return 0.0d;
        }
        for (Map.Entry<String, Double> entry : regionalPopularity.entrySet()) {
            if (entry.getValue() != null
                    && (TextTokens.equalsIgnoreCase(entry.getKey(), geo.getCountry())
                    || TextTokens.equalsIgnoreCase(entry.getKey(), geo.getRegion()))) {
                return Scores.clamp(entry.getValue());
            }
        }
        return 0.0d;
    }

    private static Double ratio(Long numerator, Long denominator) {
        if (numerator == null || denominator == null || denominator <= 0) {
            return null;
        }
        return (double) numerator / denominator;
    }
}
