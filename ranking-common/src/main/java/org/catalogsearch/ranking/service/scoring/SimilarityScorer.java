package org.catalogsearch.ranking.service.scoring;

import org.catalogsearch.ranking.config.ScoringConstants;
import org.catalogsearch.ranking.model.Candidate;
import org.catalogsearch.ranking.model.QueryContext;
import org.catalogsearch.ranking.model.Signal;
import org.catalogsearch.ranking.model.SignalCategory;
import org.catalogsearch.ranking.model.SignalScores;
import org.catalogsearch.ranking.model.UserContext;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.catalogsearch.ranking.service.scoring.ScoringGuard.guard;

/**
 * Similarity between a query and one candidate.
 *
 * <p>Produces four independent sub-scores in [0,1]:
 * <ul>
 *   <li><b>visual</b>: cosine similarity of the vectors passed through a logistic squash</li>
 *   <li><b>textual</b>: token Jaccard plus title, brand and category boosts</li>
 *   <li><b>categorical</b>: category, sub-category and tag matches</li>
 *   <li><b>behavioral</b>: fit with the user's shopping history</li>
 * </ul>
 *
 * <p>Stateless and safe for concurrent use. Never throws: a sub-score whose inputs are missing
 * is 0 (and inapplicable when the request structurally lacks them).</p>
 */
public class SimilarityScorer {

    private static final double TITLE_BOOST = 0.3;
    private static final double BRAND_BOOST = 0.2;
    private static final double CATEGORY_BOOST = 0.1;

    private static final double CATEGORY_MATCH = 0.4;
    private static final double SUBCATEGORY_MATCH = 0.3;
    private static final double TAG_MATCH = 0.1;
    private static final double TAG_MATCH_CAP = 0.3;

    private static final double TOP_CATEGORY_WEIGHT = 0.4;
    private static final double BRAND_LOYALTY_WEIGHT = 0.3;
    private static final double PRICE_BAND_WEIGHT = 0.3;

    private final ScoringConstants constants;

    public SimilarityScorer(ScoringConstants constants) {
        this.constants = constants;
    }

    /**
     * Scores one candidate against the query.
     *
     * @param query     query context; may carry text, a vector, or neither
     * @param candidate candidate to score
     * @param user      optional user profile, used by the behavioral sub-score
     * @return similarity sub-scores
     */
    public SignalScores score(QueryContext query, Candidate candidate, UserContext user) {
        SignalScores.Builder scores = SignalScores.builder(SignalCategory.SIMILARITY);
        String candidateId = candidate.getId();

        if (query != null && query.hasVector() && candidate.hasVector()) {
            scores.put(Signal.VISUAL, guard(Signal.VISUAL, candidateId,
                    () -> visual(query.getVector(), candidate.getVector())));
        } else {
            scores.inapplicable(Signal.VISUAL);
        }

        if (query != null && query.hasText()) {
            scores.put(Signal.TEXTUAL, guard(Signal.TEXTUAL, candidateId,
                    () -> textual(query.getText(), candidate)));
        } else {
            scores.inapplicable(Signal.TEXTUAL);
        }

        scores.put(Signal.CATEGORICAL, guard(Signal.CATEGORICAL, candidateId,
                () -> categorical(query, candidate)));

        if (user != null) {
            scores.put(Signal.SHOPPING_HISTORY, guard(Signal.SHOPPING_HISTORY, candidateId,
                    () -> behavioral(candidate, user)));
        } else {
            scores.inapplicable(Signal.SHOPPING_HISTORY);
        }

        return scores.build();
    }

    /**
     * Logistic squash of the cosine similarity: {@code 1 / (1 + e^(-k (cos - m)))}.
     *
     * <p>Raw cosine similarities of embeddings cluster around their mean; the squash spreads
     * near-duplicates towards 1 and unrelated vectors towards 0.</p>
     *
     * @throws IllegalArgumentException when the vectors differ in length or one has zero norm
     */
    public double visual(List<Double> queryVector, List<Double> candidateVector) {
        double cosine = cosine(queryVector, candidateVector);
        double squashed = 1.0d / (1.0d + Math.exp(-constants.logisticSteepness()
                * (cosine - constants.logisticMidpoint())));
        return Math.min(1.0d, Math.max(0.0d, squashed));
    }

    static double cosine(List<Double> a, List<Double> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch: query=" + a.size() + ", candidate=" + b.size());
        }
        double dot = 0.0d;
        double normA = 0.0d;
        double normB = 0.0d;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0d || normB == 0.0d) {
            throw new IllegalArgumentException("Cannot compare a zero-norm vector");
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    double textual(String queryText, Candidate candidate) {
        Set<String> queryTokens = TextTokens.tokens(queryText);
        if (queryTokens.isEmpty()) {
            return 0.0d;
        }
        String productText = nullToEmpty(candidate.getTitle()) + " " + nullToEmpty(candidate.getDescription());
        double score = TextTokens.jaccard(queryTokens, TextTokens.tokens(productText));

        String normalizedQuery = TextTokens.normalize(queryText);
        if (!normalizedQuery.isEmpty() && TextTokens.normalize(candidate.getTitle()).contains(normalizedQuery)) {
            score += TITLE_BOOST;
        }
        if (containsAny(TextTokens.tokens(candidate.getBrand()), queryTokens)) {
            score += BRAND_BOOST;
        }
        if (containsAny(TextTokens.tokens(candidate.getCategory()), queryTokens)) {
            score += CATEGORY_BOOST;
        }
        return Math.min(1.0d, score);
    }

    double categorical(QueryContext query, Candidate candidate) {
        Set<String> queryTokens = query == null ? Set.of() : TextTokens.tokens(query.getText());
        String targetCategory = query == null ? null : query.getTargetCategory();
        String targetSubcategory = query == null ? null : query.getTargetSubcategory();

        double score = 0.0d;
        if (TextTokens.equalsIgnoreCase(targetCategory, candidate.getCategory())
                || TextTokens.mentions(candidate.getCategory(), queryTokens)) {
            score += CATEGORY_MATCH;
        }
        if (TextTokens.equalsIgnoreCase(targetSubcategory, candidate.getSubcategory())
                || TextTokens.mentions(candidate.getSubcategory(), queryTokens)) {
            score += SUBCATEGORY_MATCH;
        }

        List<String> tags = candidate.getTags();
        if (tags != null && !tags.isEmpty()) {
            Set<String> targets = TextTokens.tokens(nullToEmpty(targetCategory) + " " + nullToEmpty(targetSubcategory));
            targets.addAll(queryTokens);
            long matchingTags = tags.stream()
                    .filter(tag -> TextTokens.mentions(tag, targets))
                    .count();
            score += Math.min(TAG_MATCH_CAP, matchingTags * TAG_MATCH);
        }
        return Math.min(1.0d, score);
    }

    double behavioral(Candidate candidate, UserContext user) {
        double score = 0.0d;

        Set<String> topCategories = topCategories(user.getCategoryFrequencies(), constants.topCategoryCount());
        if (TextTokens.containsIgnoreCase(topCategories, candidate.getCategory())) {
            score += TOP_CATEGORY_WEIGHT;
        }

        score += BRAND_LOYALTY_WEIGHT * frequencyShare(user.getBrandFrequencies(), candidate.getBrand());

        if (insideBand(candidate.getPrice(), user.getPreferredPriceMin(), user.getPreferredPriceMax())) {
            score += PRICE_BAND_WEIGHT;
        }
        return Math.min(1.0d, score);
    }

    /**
     * Returns the {@code limit} most frequent keys, ties broken alphabetically.
     */
    static Set<String> topCategories(Map<String, Integer> frequencies, int limit) {
        if (frequencies == null || frequencies.isEmpty()) {
            return Set.of();
        }
        return frequencies.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null && e.getValue() > 0)
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Count of {@code key} relative to the largest count, in [0,1].
     */
    static double frequencyShare(Map<String, Integer> frequencies, String key) {
        if (frequencies == null || frequencies.isEmpty() || key == null) {
            return 0.0d;
        }
        int max = 0;
        int count = 0;
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            int value = entry.getValue() == null ? 0 : entry.getValue();
            max = Math.max(max, value);
            if (TextTokens.equalsIgnoreCase(entry.getKey(), key)) {
                count = value;
            }
        }
        return max <= 0 ? 0.0d : (double) count / max;
    }

    static boolean insideBand(Double price, Double min, Double max) {
        if (price == null || (min == null && max == null)) {
            return false;
        }
        return (min == null || price >= min) && (max == null || price <= max);
    }

    private static boolean containsAny(Set<String> fieldTokens, Set<String> queryTokens) {
        for (String token : queryTokens) {
            if (fieldTokens.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
