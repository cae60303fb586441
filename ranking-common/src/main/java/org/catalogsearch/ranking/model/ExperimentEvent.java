package org.catalogsearch.ranking.model;

import java.time.Instant;

/**
 * One impression or interaction attributed to a ranking variant.
 *
 * @param sessionId   session that saw the result
 * @param variant     variant that produced the result list
 * @param candidateId product identifier
 * @param kind        impression, click or purchase
 * @param position    1-based position in the result list
 * @param timestamp   when the event happened; stamped on record when {@code null}
 */
public record ExperimentEvent(
        String sessionId,
        String variant,
        String candidateId,
        EventKind kind,
        int position,
        Instant timestamp
) {

    public ExperimentEvent withTimestamp(Instant value) {
        return new ExperimentEvent(sessionId, variant, candidateId, kind, position, value);
    }

    /**
     * Key identifying the (session, candidate) pair, used to count distinct interactions.
     */
    public String pairKey() {
        return sessionId + '\u0000' + candidateId;
    }
}
