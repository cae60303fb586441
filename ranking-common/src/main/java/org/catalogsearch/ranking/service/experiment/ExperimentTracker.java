package org.catalogsearch.ranking.service.experiment;

import lombok.extern.slf4j.Slf4j;
import org.catalogsearch.ranking.config.ExperimentSettings;
import org.catalogsearch.ranking.model.ExperimentEvent;
import org.catalogsearch.ranking.model.PerformanceMetric;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records experiment events and derives per-variant performance.
 *
 * <p>Recording is fire-and-forget: invalid events and store failures are logged and dropped,
 * never thrown to the caller. Metrics only count events inside the retention window and count
 * each (session, candidate) pair once per event kind.</p>
 */
@Slf4j
public class ExperimentTracker {

    private final ExperimentEventStore store;
    private final ExperimentSettings settings;
    private final Clock clock;

    private final AtomicLong recorded = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public ExperimentTracker(ExperimentEventStore store, ExperimentSettings settings, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.clock = clock;
    }

    public ExperimentTracker(ExperimentEventStore store, ExperimentSettings settings) {
        this(store, settings, Clock.systemUTC());
    }

    /**
     * Appends an event. Never throws.
     */
    public void record(ExperimentEvent event) {
        if (event == null || isBlank(event.variant()) || isBlank(event.sessionId())
                || isBlank(event.candidateId()) || event.kind() == null) {
            dropped.incrementAndGet();
            log.warn("Dropping incomplete experiment event: {}", event);
            return;
        }
        try {
            ExperimentEvent stamped = event.timestamp() == null ? event.withTimestamp(clock.instant()) : event;
            store.append(stamped);
            recorded.incrementAndGet();
        } catch (RuntimeException e) {
            dropped.incrementAndGet();
            log.warn("Failed to record {} event for variant {}: {}", event.kind(), event.variant(), e.getMessage());
        }
    }

    /**
     * Performance of one variant within the retention window.
     *
     * <p>Rates are per (session, candidate) pair: CTR is distinct clicked pairs over distinct
     * impressed pairs, conversion is distinct purchased pairs over distinct clicked pairs. The same
     * product shown to two sessions counts twice, unlike a per-candidate reading that would count
     * each product once across all sessions.</p>
     */
    public VariantPerformance performance(String variant) {
        List<ExperimentEvent> events = store.eventsFor(variant, windowStart());
        if (events.isEmpty()) {
            return VariantPerformance.empty(variant);
        }
        Set<String> impressed = new HashSet<>();
        Set<String> clicked = new HashSet<>();
        Set<String> purchased = new HashSet<>();
        for (ExperimentEvent event : events) {
            switch (event.kind()) {
                case IMPRESSION -> impressed.add(event.pairKey());
                case CLICK -> clicked.add(event.pairKey());
                case PURCHASE -> purchased.add(event.pairKey());
            }
        }
        double ctr = ratio(clicked.size(), impressed.size());
        double conversion = ratio(purchased.size(), clicked.size());
        return new VariantPerformance(variant, impressed.size(), clicked.size(), purchased.size(),
                ctr, conversion, events.size());
    }

    public double performance(String variant, PerformanceMetric metric) {
        return performance(variant).value(metric);
    }

    /**
     * Performance of each given variant, by name. Events recorded under other names are ignored.
     */
    public Map<String, VariantPerformance> performanceByVariant(Collection<String> variants) {
        Map<String, VariantPerformance> result = new LinkedHashMap<>();
        for (String variant : variants) {
            result.put(variant, performance(variant));
        }
        return result;
    }

    /**
     * Recommends the best variant per metric among variants with enough samples.
     *
     * @param variants variants to compare; only these can be recommended
     * @return one recommendation per {@link PerformanceMetric}, in declaration order
     */
    public List<Recommendation> recommend(Collection<String> variants) {
        Collection<VariantPerformance> performances = performanceByVariant(variants).values();
        List<Recommendation> recommendations = new ArrayList<>();
        recommendations.add(recommend(performances, PerformanceMetric.CTR, settings.minImpressionSample()));
        recommendations.add(recommend(performances, PerformanceMetric.CONVERSION, settings.minClickSample()));
        return recommendations;
    }

    /**
     * Evicts events that fell out of the retention window.
     *
     * @return number of evicted events
     */
    public int purgeExpired() {
        int removed = store.evictBefore(windowStart());
        if (removed > 0) {
            log.info("Evicted {} experiment events older than {}", removed, settings.retention());
        }
        return removed;
    }

    public long recordedCount() {
        return recorded.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long storedCount() {
        return store.size();
    }

    private Recommendation recommend(Collection<VariantPerformance> performances, PerformanceMetric metric,
                                     long minimumSample) {
        List<VariantPerformance> eligible = new ArrayList<>();
        for (VariantPerformance performance : performances) {
            if (performance.sampleSize(metric) >= minimumSample) {
                eligible.add(performance);
            }
        }
        if (eligible.isEmpty()) {
            return Recommendation.insufficientData(metric, minimumSample);
        }
        eligible.sort(Comparator.comparingDouble((VariantPerformance p) -> p.value(metric)).reversed()
                .thenComparing(VariantPerformance::variant));

        VariantPerformance leader = eligible.get(0);
        if (eligible.size() == 1) {
            return new Recommendation(metric, leader.variant(), leader.value(metric), leader.sampleSize(metric),
                    null, 0.0d, false,
                    leader.variant() + " is the only variant with enough " + metric.key() + " samples");
        }

        VariantPerformance runnerUp = eligible.get(1);
        double z = zScore(leader.value(metric), leader.sampleSize(metric),
                runnerUp.value(metric), runnerUp.sampleSize(metric));
        boolean significant = z >= settings.significanceZ();
        String message = String.format("%s leads %s on %s (%.4f vs %.4f, z=%.2f)%s",
                leader.variant(), runnerUp.variant(), metric.key(),
                leader.value(metric), runnerUp.value(metric), z,
                significant ? "" : "; difference not significant yet");
        return new Recommendation(metric, leader.variant(), leader.value(metric), leader.sampleSize(metric),
                runnerUp.variant(), z, significant, message);
    }

    /**
     * Two-proportion z-score with pooled variance; 0 when the variance is 0.
     */
    static double zScore(double p1, long n1, double p2, long n2) {
        if (n1 <= 0 || n2 <= 0) {
            return 0.0d;
        }
        double pooled = (p1 * n1 + p2 * n2) / (n1 + n2);
        double variance = pooled * (1.0d - pooled) * (1.0d / n1 + 1.0d / n2);
        if (variance <= 0.0d) {
            return 0.0d;
        }
        return (p1 - p2) / Math.sqrt(variance);
    }

    private Instant windowStart() {
        return clock.instant().minus(settings.retention());
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0d : (double) numerator / denominator;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
