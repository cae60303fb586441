package org.catalogsearch.ranking.service.scoring;

import org.catalogsearch.ranking.config.ScoringConstants;
import org.catalogsearch.ranking.model.Candidate;
import org.catalogsearch.ranking.model.Scores;
import org.catalogsearch.ranking.model.ScoringContext;
import org.catalogsearch.ranking.model.SessionContext;
import org.catalogsearch.ranking.model.Signal;
import org.catalogsearch.ranking.model.SignalCategory;
import org.catalogsearch.ranking.model.SignalScores;
import org.catalogsearch.ranking.model.UserContext;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static org.catalogsearch.ranking.service.scoring.ScoringGuard.guard;

/**
 * User-specific alignment of one candidate: stated preferences, past activity, the current
 * session and the time of year.
 *
 * <p>Without a user profile every sub-score is 0 and inapplicable, so the engine moves the
 * personalization weight onto the other categories. Stateless and safe for concurrent use.</p>
 */
public class PersonalizationScorer {

    private static final Set<String> EVENING_CATEGORIES = Set.of("entertainment", "home");
    private static final String BUSINESS_CATEGORY = "business";

    private static final double NEUTRAL_TEMPORAL = 0.5;
    private static final double IN_SEASON_BOOST = 0.3;
    private static final double TRENDING_BOOST = 0.2;

    private final ScoringConstants constants;

    public PersonalizationScorer(ScoringConstants constants) {
        this.constants = constants;
    }

    /**
     * Scores one candidate for the user and session of the request.
     *
     * @param candidate candidate to score
     * @param context   request context; its user and session are optional
     * @return personalization sub-scores
     */
    public SignalScores score(Candidate candidate, ScoringContext context) {
        UserContext user = context.user();
        if (user == null) {
            return SignalScores.inapplicable(SignalCategory.PERSONALIZATION);
        }
        String candidateId = candidate.getId();
        int hour = context.hourOfDay();

        return SignalScores.builder(SignalCategory.PERSONALIZATION)
                .put(Signal.PREFERENCE, guard(Signal.PREFERENCE, candidateId, () -> preference(candidate, user)))
                .put(Signal.ACTIVITY, guard(Signal.ACTIVITY, candidateId, () -> activity(candidate, user, hour)))
                .put(Signal.SESSION, guard(Signal.SESSION, candidateId,
                        () -> session(candidate, user, context.session(), hour)))
                .put(Signal.TEMPORAL, guard(Signal.TEMPORAL, candidateId,
                        () -> temporal(candidate, context.month())))
                .build();
    }

    /**
     * 0.4 category match + 0.3 brand loyalty + 0.3 price-band match.
     */
    double preference(Candidate candidate, UserContext user) {
        double category = TextTokens.containsIgnoreCase(user.getPreferredCategories(), candidate.getCategory())
                ? 1.0d
                : SimilarityScorer.frequencyShare(user.getCategoryFrequencies(), candidate.getCategory());
        double brand = TextTokens.containsIgnoreCase(user.getPreferredBrands(), candidate.getBrand())
                ? 1.0d
                : SimilarityScorer.frequencyShare(user.getBrandFrequencies(), candidate.getBrand());
        double price = priceBandMatch(candidate.getPrice(), user);
        return Scores.clamp(category * 0.4 + brand * 0.3 + price * 0.3);
    }

    /**
     * 1 inside the preferred band; outside it decays with the relative distance to the
     * nearest edge.
     */
    static double priceBandMatch(Double price, UserContext user) {
        if (price == null || !user.hasPriceBand()) {
            return 0.0d;
        }
        Double min = user.getPreferredPriceMin();
        Double max = user.getPreferredPriceMax();
        if (min != null && price < min) {
            return 1.0d / (1.0d + (min - price) / Math.max(min, 1.0d));
        }
        if (max != null && price > max) {
            return 1.0d / (1.0d + (price - max) / Math.max(max, 1.0d));
        }
        return 1.0d;
    }

    /**
     * Purchase-timing regularity, prior views, and past interactions with the category.
     */
    double activity(Candidate candidate, UserContext user, int hour) {
        double score = 0.0d;
        Set<Integer> purchaseHours = user.getPurchaseHours();
        if (purchaseHours != null && purchaseHours.contains(hour)) {
            score += 0.2;
        }
        Set<String> viewed = user.getViewedProductIds();
        if (viewed != null && candidate.getId() != null && viewed.contains(candidate.getId())) {
            score += 0.3;
        }
        int interactions = categoryCount(user.getCategoryFrequencies(), candidate.getCategory());
        if (interactions > 0) {
            score += Math.min(0.5, interactions * 0.1);
        }
        return Scores.clamp(score);
    }

    /**
     * 0.4 search-intent match + 0.3 device fit + 0.3 time-of-day fit.
     */
    double session(Candidate candidate, UserContext user, SessionContext session, int hour) {
        double score = 0.0d;
        if (session != null && session.searchIntent() != null && !session.searchIntent().isBlank()) {
            score += intentMatch(candidate, session.searchIntent()) * 0.4;
        }
        if (user.getDeviceType() != null && !user.getDeviceType().isBlank()) {
            score += deviceFit(candidate, user.getDeviceType()) * 0.3;
        }
        score += timeOfDayFit(candidate, hour) * 0.3;
        return Scores.clamp(score);
    }

    double temporal(Candidate candidate, int month) {
        double score = NEUTRAL_TEMPORAL;
        String category = TextTokens.normalize(candidate.getCategory());
        if (!category.isEmpty()) {
            for (Map.Entry<String, Set<Integer>> season : constants.seasonalCalendar().entrySet()) {
                if (category.contains(TextTokens.normalize(season.getKey())) && season.getValue().contains(month)) {
                    score += IN_SEASON_BOOST;
                    break;
                }
            }
        }
        if (candidate.isTrending()) {
            score += TRENDING_BOOST;
        }
        return Scores.clamp(score);
    }

    static double intentMatch(Candidate candidate, String intent) {
        return switch (intent.trim().toLowerCase(Locale.ROOT)) {
            case "purchase" -> isAvailable(candidate) ? 0.8 : 0.2;
            case "browse" -> 0.7;
            case "research" -> candidate.getReviewCount() != null && candidate.getReviewCount() > 10 ? 0.6 : 0.4;
            case "compare" -> candidate.hasSpecifications() ? 0.8 : 0.5;
            default -> 0.5;
        };
    }

    static double deviceFit(Candidate candidate, String deviceType) {
        return switch (deviceType.trim().toLowerCase(Locale.ROOT)) {
            case "mobile" -> candidate.getPrice() != null && candidate.getPrice() < 100 ? 0.8 : 0.6;
            case "desktop" -> candidate.hasSpecifications() ? 0.8 : 0.6;
            default -> 0.7;
        };
    }

    static double timeOfDayFit(Candidate candidate, int hour) {
        String category = TextTokens.normalize(candidate.getCategory());
        if (hour >= 9 && hour <= 17) {
            return BUSINESS_CATEGORY.equals(category) ? 0.8 : 0.6;
        }
        if (hour >= 18 && hour <= 22) {
            return EVENING_CATEGORIES.contains(category) ? 0.8 : 0.6;
        }
        return 0.5;
    }

    private static boolean isAvailable(Candidate candidate) {
        Integer stock = candidate.getStockQuantity();
        return (stock != null && stock > 0) || candidate.isBackorderable();
    }

    private static int categoryCount(Map<String, Integer> frequencies, String category) {
        if (frequencies == null || category == null) {
            return 0;
        }
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            if (TextTokens.equalsIgnoreCase(entry.getKey(), category) && entry.getValue() != null) {
                return entry.getValue();
            }
        }
        return 0;
    }
}
