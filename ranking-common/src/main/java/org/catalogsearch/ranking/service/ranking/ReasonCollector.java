package org.catalogsearch.ranking.service.ranking;

import org.catalogsearch.ranking.model.Signal;
import org.catalogsearch.ranking.model.SignalScores;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the human-readable reasons shown next to a result.
 *
 * <p>Signals scoring strictly above the threshold contribute their reason, similarity first,
 * then business, then personalization, each in signal declaration order.</p>
 */
public class ReasonCollector {

    private final double threshold;
    private final int maxReasons;

    public ReasonCollector(double threshold, int maxReasons) {
        this.threshold = threshold;
        this.maxReasons = maxReasons;
    }

    public List<String> collect(SignalScores... scoresByPriority) {
        List<String> reasons = new ArrayList<>(maxReasons);
        for (SignalScores scores : scoresByPriority) {
            for (Signal signal : Signal.of(scores.category())) {
                if (reasons.size() >= maxReasons) {
                    return reasons;
                }
                if (scores.isApplicable(signal) && scores.get(signal) > threshold) {
                    reasons.add(signal.reason());
                }
            }
        }
        return reasons;
    }
}
