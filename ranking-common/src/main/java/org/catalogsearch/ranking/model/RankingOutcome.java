package org.catalogsearch.ranking.model;

import java.util.List;
import java.util.Map;

/**
 * Result of one {@code RankingEngine.rank} call.
 *
 * @param variant          name of the applied variant
 * @param results          ranked candidates, best first
 * @param effectiveWeights category weights used for this request
 * @param partial          {@code true} when the deadline expired before every candidate was scored
 * @param droppedCount     candidates dropped because they were not scored in time
 * @param filteredCount    candidates removed before scoring (null entries, price filter)
 * @param elapsedMs        wall-clock ranking time
 */
public record RankingOutcome(
        String variant,
        List<RankedCandidate> results,
        Map<String, Double> effectiveWeights,
        boolean partial,
        int droppedCount,
        int filteredCount,
        long elapsedMs
) {

    public static RankingOutcome empty(String variant, Map<String, Double> effectiveWeights, int filteredCount) {
        return new RankingOutcome(variant, List.of(), effectiveWeights, false, 0, filteredCount, 0L);
    }
}
