package org.catalogsearch.ranking.app.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.catalogsearch.ranking.app.model.InteractionRequest;
import org.catalogsearch.ranking.app.model.PerformanceReport;
import org.catalogsearch.ranking.model.EventKind;
import org.catalogsearch.ranking.model.ExperimentEvent;
import org.catalogsearch.ranking.model.PerformanceMetric;
import org.catalogsearch.ranking.model.Variant;
import org.catalogsearch.ranking.service.experiment.ExperimentTracker;
import org.catalogsearch.ranking.service.experiment.Recommendation;
import org.catalogsearch.ranking.service.experiment.VariantPerformance;
import org.catalogsearch.ranking.service.variant.VariantSelector;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records shopper interactions and reports experiment results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExperimentService {

    private final ExperimentTracker experimentTracker;
    private final VariantSelector variantSelector;
    private final RankingStats rankingStats;

    /**
     * Records an interaction. Incomplete or unattributable interactions are logged and dropped.
     */
    public void recordInteraction(InteractionRequest request) {
        EventKind kind;
        try {
            kind = EventKind.fromValue(request.getEventType());
        } catch (IllegalArgumentException e) {
            log.warn("Dropping interaction for product {}: {}", request.getProductId(), e.getMessage());
            return;
        }

        String variant = request.getVariant();
        if (variant == null || variant.isBlank()) {
            Optional<Variant> assigned = variantSelector.lookup(request.getSessionId());
            if (assigned.isEmpty()) {
                log.warn("Dropping {} for product {}: session {} has no variant assignment",
                        kind.value(), request.getProductId(), request.getSessionId());
                return;
            }
            variant = assigned.get().name();
        } else if (variantSelector.find(variant).isEmpty()) {
            log.warn("Dropping {} for product {}: variant {} is not configured",
                    kind.value(), request.getProductId(), variant);
            return;
        }

        int position = request.getPosition() == null ? 0 : request.getPosition();
        experimentTracker.record(new ExperimentEvent(
                request.getSessionId(), variant, request.getProductId(), kind, position, request.getTimestamp()));
        log.debug("Recorded {} of {} at position {} for variant {}",
                kind.value(), request.getProductId(), position, variant);
    }

    /**
     * Builds the performance report.
     *
     * @param variant optional variant to narrow the report to
     * @param metric  optional metric key ({@code ctr}, {@code conversion})
     * @throws IllegalArgumentException when the metric is unknown
     */
    public PerformanceReport performance(String variant, String metric) {
        PerformanceMetric selected = metric == null || metric.isBlank() ? null : PerformanceMetric.fromKey(metric);

        Map<String, VariantPerformance> performances;
        if (variant != null && !variant.isBlank()) {
            performances = new LinkedHashMap<>();
            performances.put(variant, experimentTracker.performance(variant));
        } else {
            performances = experimentTracker.performanceByVariant(variantNames());
        }

        PerformanceReport.PerformanceReportBuilder report = PerformanceReport.builder()
                .variants(performances)
                .stats(rankingStats.snapshot())
                .recommendations(recommendations());

        if (selected != null) {
            Map<String, Double> values = new LinkedHashMap<>();
            performances.forEach((name, performance) -> values.put(name, performance.value(selected)));
            report.metric(selected.key()).values(values);
        }
        return report.build();
    }

    public List<Recommendation> recommendations() {
        return experimentTracker.recommend(variantNames());
    }

    @Scheduled(fixedDelayString = "${ranking.experiment.purge-interval-ms:3600000}")
    public void purgeExpiredEvents() {
        experimentTracker.purgeExpired();
    }

    private List<String> variantNames() {
        List<String> names = new ArrayList<>();
        for (Variant v : variantSelector.variants()) {
            names.add(v.name());
        }
        return names;
    }
}
