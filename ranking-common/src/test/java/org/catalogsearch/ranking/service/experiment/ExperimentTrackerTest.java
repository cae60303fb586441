package org.catalogsearch.ranking.service.experiment;

import org.catalogsearch.ranking.config.ExperimentSettings;
import org.catalogsearch.ranking.model.EventKind;
import org.catalogsearch.ranking.model.ExperimentEvent;
import org.catalogsearch.ranking.model.PerformanceMetric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class ExperimentTrackerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryExperimentEventStore store;
    private ExperimentTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryExperimentEventStore();
        tracker = new ExperimentTracker(store, ExperimentSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void hundredImpressionsAndFiveClicksGiveFivePercentCtr() {
        recordImpressions("balanced", 100);
        for (int i = 0; i < 5; i++) {
            tracker.record(event("s" + i, "balanced", "p" + i, EventKind.CLICK, NOW));
        }

        assertThat(tracker.performance("balanced", PerformanceMetric.CTR)).isCloseTo(0.05, within(1e-12));
    }

    @Test
    void repeatedInteractionsOnSamePairCountOnce() {
        tracker.record(event("s1", "balanced", "p1", EventKind.IMPRESSION, NOW));
        tracker.record(event("s1", "balanced", "p1", EventKind.IMPRESSION, NOW));
        tracker.record(event("s1", "balanced", "p2", EventKind.IMPRESSION, NOW));
        tracker.record(event("s1", "balanced", "p1", EventKind.CLICK, NOW));
        tracker.record(event("s1", "balanced", "p1", EventKind.CLICK, NOW));

        VariantPerformance performance = tracker.performance("balanced");

        assertThat(performance.impressions()).isEqualTo(2);
        assertThat(performance.clicks()).isEqualTo(1);
        assertThat(performance.ctr()).isEqualTo(0.5);
        assertThat(performance.eventCount()).isEqualTo(5);
    }

    @Test
    void conversionIsPurchasesOverClicks() {
        for (int i = 0; i < 4; i++) {
            tracker.record(event("s" + i, "personalized", "p", EventKind.CLICK, NOW));
        }
        tracker.record(event("s0", "personalized", "p", EventKind.PURCHASE, NOW));

        assertThat(tracker.performance("personalized", PerformanceMetric.CONVERSION)).isEqualTo(0.25);
    }

    @Test
    void unknownVariantHasZeroMetrics() {
        assertThat(tracker.performance("missing")).isEqualTo(VariantPerformance.empty("missing"));
    }

    @Test
    void eventsOutsideRetentionWindowAreIgnoredAndPurged() {
        Instant old = NOW.minus(Duration.ofDays(31));
        tracker.record(event("s1", "balanced", "p1", EventKind.IMPRESSION, old));
        tracker.record(event("s1", "balanced", "p1", EventKind.CLICK, old));
        tracker.record(event("s2", "balanced", "p1", EventKind.IMPRESSION, NOW));

        assertThat(tracker.performance("balanced").impressions()).isEqualTo(1);
        assertThat(tracker.performance("balanced").clicks()).isZero();
        assertThat(tracker.purgeExpired()).isEqualTo(2);
        assertThat(tracker.storedCount()).isEqualTo(1);
    }

    @Test
    void missingTimestampIsStampedWithClock() {
        tracker.record(event("s1", "balanced", "p1", EventKind.IMPRESSION, null));

        assertThat(store.eventsFor("balanced", null)).singleElement()
                .extracting(ExperimentEvent::timestamp).isEqualTo(NOW);
    }

    @Test
    void incompleteEventsAreDroppedWithoutFailing() {
        assertThatCode(() -> {
            tracker.record(null);
            tracker.record(event(null, "balanced", "p1", EventKind.CLICK, NOW));
            tracker.record(event("s1", " ", "p1", EventKind.CLICK, NOW));
            tracker.record(event("s1", "balanced", "p1", null, NOW));
        }).doesNotThrowAnyException();

        assertThat(tracker.droppedCount()).isEqualTo(4);
        assertThat(tracker.recordedCount()).isZero();
    }

    @Test
    void storeFailureIsSwallowed() {
        ExperimentEventStore failing = mock(ExperimentEventStore.class);
        doThrow(new IllegalStateException("disk full")).when(failing).append(any());
        ExperimentTracker failingTracker = new ExperimentTracker(failing, ExperimentSettings.defaults());

        assertThatCode(() -> failingTracker.record(event("s1", "balanced", "p1", EventKind.CLICK, NOW)))
                .doesNotThrowAnyException();
        assertThat(failingTracker.droppedCount()).isEqualTo(1);
    }

    @Test
    void concurrentAppendsAreNotLost() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        tracker.record(event("s" + thread + "-" + i, "balanced", "p", EventKind.IMPRESSION, NOW));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.size()).isEqualTo((long) threads * perThread);
        assertThat(tracker.performance("balanced").impressions()).isEqualTo((long) threads * perThread);
    }

    @Test
    void recommendsSignificantCtrLeader() {
        recordTraffic("balanced", 1_000, 100);
        recordTraffic("similarity_first", 1_000, 40);
        recordTraffic("business_first", 50, 25);

        Recommendation ctr = tracker.recommend(List.of("balanced", "similarity_first", "business_first")).get(0);

        assertThat(ctr.metric()).isEqualTo(PerformanceMetric.CTR);
        assertThat(ctr.variant()).isEqualTo("balanced");
        assertThat(ctr.runnerUp()).isEqualTo("similarity_first");
        assertThat(ctr.significant()).isTrue();
        assertThat(ctr.zScore()).isGreaterThan(1.96);
    }

    @Test
    void closeRacesAreNotSignificant() {
        recordTraffic("balanced", 200, 21);
        recordTraffic("personalized", 200, 20);

        Recommendation ctr = tracker.recommend(List.of("balanced", "personalized")).get(0);

        assertThat(ctr.variant()).isEqualTo("balanced");
        assertThat(ctr.significant()).isFalse();
    }

    @Test
    void noRecommendationBelowMinimumSample() {
        recordTraffic("balanced", 99, 49);

        List<Recommendation> recommendations = tracker.recommend(List.of("balanced"));

        assertThat(recommendations).hasSize(2);
        assertThat(recommendations).noneMatch(Recommendation::hasVariant);
    }

    @Test
    void onlyListedVariantsCanBeRecommended() {
        recordTraffic("typo_variant", 200, 200);
        recordTraffic("balanced", 200, 20);

        List<Recommendation> recommendations = tracker.recommend(List.of("balanced", "personalized"));

        assertThat(recommendations.get(0).variant()).isEqualTo("balanced");
        assertThat(recommendations).noneMatch(r -> "typo_variant".equals(r.variant())
                || "typo_variant".equals(r.runnerUp()));
        assertThat(tracker.performanceByVariant(List.of("balanced"))).containsOnlyKeys("balanced");
    }

    @Test
    void zScoreOfEqualProportionsIsZero() {
        assertThat(ExperimentTracker.zScore(0.1, 500, 0.1, 500)).isZero();
        assertThat(ExperimentTracker.zScore(0.0, 100, 0.0, 100)).isZero();
    }

    private void recordImpressions(String variant, int count) {
        for (int i = 0; i < count; i++) {
            tracker.record(event("s" + i, variant, "p" + i, EventKind.IMPRESSION, NOW));
        }
    }

    private void recordTraffic(String variant, int impressions, int clicks) {
        for (int i = 0; i < impressions; i++) {
            tracker.record(event(variant + "-s" + i, variant, "p", EventKind.IMPRESSION, NOW));
            if (i < clicks) {
                tracker.record(event(variant + "-s" + i, variant, "p", EventKind.CLICK, NOW));
            }
        }
    }

    private static ExperimentEvent event(String session, String variant, String candidate, EventKind kind,
                                         Instant timestamp) {
        return new ExperimentEvent(session, variant, candidate, kind, 1, timestamp);
    }
}
