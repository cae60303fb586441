package org.catalogsearch.ranking.service.experiment;

import org.catalogsearch.ranking.model.ExperimentEvent;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of experiment events. Implementations must accept concurrent appends
 * without losing events.
 */
public interface ExperimentEventStore {

    void append(ExperimentEvent event);

    /**
     * Events of one variant with a timestamp at or after {@code since}, in append order.
     */
    List<ExperimentEvent> eventsFor(String variant, Instant since);

    /**
     * Removes events older than {@code cutoff}.
     *
     * @return number of removed events
     */
    int evictBefore(Instant cutoff);

    long size();
}
