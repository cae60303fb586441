package org.catalogsearch.ranking.app.service;

import org.catalogsearch.ranking.app.model.InteractionRequest;
import org.catalogsearch.ranking.app.model.PerformanceReport;
import org.catalogsearch.ranking.config.RankingConfig;
import org.catalogsearch.ranking.service.experiment.ExperimentTracker;
import org.catalogsearch.ranking.service.experiment.InMemoryExperimentEventStore;
import org.catalogsearch.ranking.service.variant.InMemoryAssignmentStore;
import org.catalogsearch.ranking.service.variant.VariantSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExperimentServiceTest {

    private VariantSelector variantSelector;
    private ExperimentTracker experimentTracker;
    private ExperimentService experimentService;

    @BeforeEach
    void setUp() {
        RankingConfig config = RankingConfig.defaults();
        variantSelector = new VariantSelector(config, new InMemoryAssignmentStore());
        experimentTracker = new ExperimentTracker(new InMemoryExperimentEventStore(), config.experiment());
        experimentService = new ExperimentService(experimentTracker, variantSelector, new RankingStats());
    }

    @Test
    void interactionWithoutVariantIsAttributedToSessionAssignment() {
        String assigned = variantSelector.assign("s1").name();

        experimentService.recordInteraction(interaction("s1", null, "view"));
        experimentService.recordInteraction(interaction("s1", null, "click"));

        assertThat(experimentTracker.performance(assigned).impressions()).isEqualTo(1);
        assertThat(experimentTracker.performance(assigned).clicks()).isEqualTo(1);
    }

    @Test
    void unattributableInteractionIsDropped() {
        experimentService.recordInteraction(interaction("never-ranked", null, "click"));

        assertThat(experimentTracker.recordedCount()).isZero();
    }

    @Test
    void interactionForUnconfiguredVariantIsDropped() {
        for (int i = 0; i < 200; i++) {
            experimentService.recordInteraction(interaction("s" + i, "typo_variant", "impression"));
            experimentService.recordInteraction(interaction("s" + i, "typo_variant", "click"));
        }

        assertThat(experimentTracker.recordedCount()).isZero();
        assertThat(experimentService.recommendations()).noneMatch(r -> "typo_variant".equals(r.variant()));
    }

    @Test
    void unknownEventTypeIsDropped() {
        experimentService.recordInteraction(interaction("s1", "balanced", "hover"));

        assertThat(experimentTracker.recordedCount()).isZero();
    }

    @Test
    void performanceCanBeNarrowedToVariantAndMetric() {
        for (int i = 0; i < 20; i++) {
            experimentService.recordInteraction(interaction("s" + i, "balanced", "impression"));
        }
        experimentService.recordInteraction(interaction("s0", "balanced", "click"));

        PerformanceReport report = experimentService.performance("balanced", "ctr");

        assertThat(report.getMetric()).isEqualTo("ctr");
        assertThat(report.getValues()).containsOnlyKeys("balanced");
        assertThat(report.getValues().get("balanced")).isEqualTo(0.05);
        assertThat(report.getRecommendations()).hasSize(2);
    }

    @Test
    void fullReportCoversEveryConfiguredVariant() {
        PerformanceReport report = experimentService.performance(null, null);

        assertThat(report.getVariants()).containsKeys(
                "similarity_first", "business_first", "balanced", "personalized", "geographic");
        assertThat(report.getStats()).isNotNull();
    }

    @Test
    void unknownMetricIsRejected() {
        assertThatThrownBy(() -> experimentService.performance(null, "bounce"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static InteractionRequest interaction(String session, String variant, String type) {
        return InteractionRequest.builder()
                .sessionId(session)
                .variant(variant)
                .productId("p1")
                .eventType(type)
                .position(1)
                .build();
    }
}
