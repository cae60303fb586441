package org.catalogsearch.ranking.model;

import java.util.List;
import java.util.Map;

/**
 * Explanation of how one candidate's final score was derived.
 *
 * @param categoryScores   reduced score per category, each in [0,1]
 * @param signalScores     sub-scores per category
 * @param effectiveWeights category weights after redistribution
 * @param finalScore       weighted sum of the category scores
 * @param reasons          up to a few human-readable reasons, strongest category first
 */
public record ScoreBreakdown(
        Map<String, Double> categoryScores,
        Map<String, Map<String, Double>> signalScores,
        Map<String, Double> effectiveWeights,
        double finalScore,
        List<String> reasons
) {}
