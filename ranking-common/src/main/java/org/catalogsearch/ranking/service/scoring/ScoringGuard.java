package org.catalogsearch.ranking.service.scoring;

import lombok.extern.slf4j.Slf4j;
import org.catalogsearch.ranking.model.Signal;

import java.util.function.DoubleSupplier;

/**
 * Runs one sub-metric computation, degrading any failure to a 0 score.
 *
 * <p>A malformed candidate only loses the sub-score that could not be computed; the rest of
 * the candidate, and the rest of the batch, are scored normally.</p>
 */
@Slf4j
final class ScoringGuard {

    private ScoringGuard() {}

    static double guard(Signal signal, String candidateId, DoubleSupplier computation) {
        try {
            double value = computation.getAsDouble();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                log.debug("Non-finite {} score for candidate {}; using 0", signal.key(), candidateId);
                return 0.0d;
            }
            return value;
        } catch (RuntimeException e) {
            log.debug("Failed to compute {} score for candidate {}: {}", signal.key(), candidateId, e.toString());
            return 0.0d;
        }
    }
}
