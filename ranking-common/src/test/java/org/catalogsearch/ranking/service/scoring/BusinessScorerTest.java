package org.catalogsearch.ranking.service.scoring;

import org.catalogsearch.ranking.config.RankingConfig;
import org.catalogsearch.ranking.config.ScoringConstants;
import org.catalogsearch.ranking.model.Candidate;
import org.catalogsearch.ranking.model.GeoContext;
import org.catalogsearch.ranking.model.Signal;
import org.catalogsearch.ranking.model.SignalScores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.within;

class BusinessScorerTest {

    private final BusinessScorer scorer = new BusinessScorer(ScoringConstants.defaults());

    @ParameterizedTest
    @CsvSource({
            "0, false, 0.1",
            "0, true, 0.2",
            "5, false, 0.6",
            "10, false, 0.8",
            "50, false, 0.8",
            "51, false, 1.0"
    })
    void stockFollowsAvailabilitySteps(int quantity, boolean backorderable, double expected) {
        Candidate candidate = Candidate.builder().id("p1").stockQuantity(quantity).backorderable(backorderable).build();

        assertThat(scorer.score(candidate, null).get(Signal.STOCK)).isEqualTo(expected);
    }

    @Test
    void raisingStockNeverLowersBusinessScore() {
        Candidate base = Candidate.builder()
                .id("p1").price(40.0).categoryAveragePrice(50.0).rating(4.2).reviewCount(80L)
                .viewCount(2_000L).purchaseCount(150L).stockQuantity(0).build();
        Candidate restocked = base.toBuilder().stockQuantity(120).build();

        Map<Signal, Double> weights = RankingConfig.defaultBusinessWeights();
        double before = scorer.score(base, null).reduce(weights);
        double after = scorer.score(restocked, null).reduce(weights);

        assertThat(after).isGreaterThanOrEqualTo(before);
    }

    @Test
    void popularityReachesOneAtEveryCap() {
        Candidate candidate = Candidate.builder()
                .id("p1").popularityScore(1.0).viewCount(10_000L).purchaseCount(1_000L)
                .rating(5.0).reviewCount(500L).build();

        assertThat(scorer.score(candidate, null).get(Signal.POPULARITY)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void priceRewardsBeingBelowCategoryAverage() {
        Candidate candidate = Candidate.builder().id("p1").price(80.0).categoryAveragePrice(100.0).build();

        assertThat(scorer.score(candidate, null).get(Signal.PRICE)).isCloseTo(0.76, within(1e-9));
    }

    @Test
    void priceRewardsDiscountWithoutCategoryAverage() {
        Candidate candidate = Candidate.builder().id("p1").price(80.0).originalPrice(100.0).build();

        assertThat(scorer.score(candidate, null).get(Signal.PRICE)).isCloseTo(0.56, within(1e-9));
    }

    @Test
    void conversionDerivesRateFromCounts() {
        Candidate candidate = Candidate.builder().id("p1").viewCount(100L).purchaseCount(10L).build();

        assertThat(scorer.score(candidate, null).get(Signal.CONVERSION)).isCloseTo(0.25, within(1e-9));
    }

    @Test
    void geographicIsInapplicableWithoutLocation() {
        SignalScores scores = scorer.score(Candidate.builder().id("p1").build(), null);

        assertThat(scores.isApplicable(Signal.GEOGRAPHIC)).isFalse();
        assertThat(scores.get(Signal.GEOGRAPHIC)).isZero();
    }

    @Test
    void geographicCombinesRegionShippingAndLocalTrend() {
        Candidate candidate = Candidate.builder()
                .id("p1")
                .availableRegions(Set.of("US", "CA"))
                .shippingCost(0.0)
                .shippingDays(7)
                .regionalPopularity(Map.of("us", 0.5))
                .build();
        GeoContext geo = GeoContext.builder().country("US").build();

        assertThat(scorer.score(candidate, geo).get(Signal.GEOGRAPHIC)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void emptyCandidateScoresWithoutFailing() {
        Candidate candidate = new Candidate();

        assertThatCode(() -> scorer.score(candidate, GeoContext.builder().country("DE").build()))
                .doesNotThrowAnyException();
        SignalScores scores = scorer.score(candidate, null);
        for (Signal signal : Signal.of(scores.category())) {
            assertThat(scores.get(signal)).isBetween(0.0, 1.0);
        }
    }
}
