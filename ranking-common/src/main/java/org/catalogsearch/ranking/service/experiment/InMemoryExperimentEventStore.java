package org.catalogsearch.ranking.service.experiment;

import org.catalogsearch.ranking.model.ExperimentEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local event store: one lock-free queue per variant.
 */
public class InMemoryExperimentEventStore implements ExperimentEventStore {

    private final Map<String, Queue<ExperimentEvent>> eventsByVariant = new ConcurrentHashMap<>();

    @Override
    public void append(ExperimentEvent event) {
        eventsByVariant.computeIfAbsent(event.variant(), v -> new ConcurrentLinkedQueue<>()).add(event);
    }

    @Override
    public List<ExperimentEvent> eventsFor(String variant, Instant since) {
        Queue<ExperimentEvent> events = eventsByVariant.get(variant);
        if (events == null) {
            return Collections.emptyList();
        }
        List<ExperimentEvent> result = new ArrayList<>();
        for (ExperimentEvent event : events) {
            if (since == null || !event.timestamp().isBefore(since)) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public int evictBefore(Instant cutoff) {
        AtomicInteger removed = new AtomicInteger();
        for (Queue<ExperimentEvent> events : eventsByVariant.values()) {
            events.removeIf(event -> {
                boolean expired = event.timestamp().isBefore(cutoff);
                if (expired) {
                    removed.incrementAndGet();
                }
                return expired;
            });
        }
        return removed.get();
    }

    @Override
    public long size() {
        long size = 0L;
        for (Queue<ExperimentEvent> events : eventsByVariant.values()) {
            size += events.size();
        }
        return size;
    }
}
