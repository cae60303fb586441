package org.catalogsearch.ranking.app.service;

import org.catalogsearch.ranking.model.RankingOutcome;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Request counters of the ranking endpoint since startup.
 */
@Component
public class RankingStats {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalLatencyMs = new AtomicLong();
    private final AtomicLong partialRankings = new AtomicLong();
    private final Map<String, LongAdder> variantUsage = new ConcurrentHashMap<>();

    public void record(RankingOutcome outcome) {
        totalRequests.incrementAndGet();
        totalLatencyMs.addAndGet(outcome.elapsedMs());
        if (outcome.partial()) {
            partialRankings.incrementAndGet();
        }
        variantUsage.computeIfAbsent(outcome.variant(), v -> new LongAdder()).increment();
    }

    public Snapshot snapshot() {
        long requests = totalRequests.get();
        Map<String, Long> usage = new TreeMap<>();
        variantUsage.forEach((variant, count) -> usage.put(variant, count.sum()));
        double averageLatency = requests == 0 ? 0.0d : (double) totalLatencyMs.get() / requests;
        return new Snapshot(requests, averageLatency, partialRankings.get(), usage);
    }

    /**
     * Point-in-time copy of the counters.
     *
     * @param totalRequests    ranking requests served
     * @param averageLatencyMs mean ranking time
     * @param partialRankings  requests that hit their deadline
     * @param variantUsage     requests per variant
     */
    public record Snapshot(long totalRequests, double averageLatencyMs, long partialRankings,
                           Map<String, Long> variantUsage) {
    }
}
