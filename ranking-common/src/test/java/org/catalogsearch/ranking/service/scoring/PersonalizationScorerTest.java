package org.catalogsearch.ranking.service.scoring;

import org.catalogsearch.ranking.config.ScoringConstants;
import org.catalogsearch.ranking.model.Candidate;
import org.catalogsearch.ranking.model.QueryContext;
import org.catalogsearch.ranking.model.ScoringContext;
import org.catalogsearch.ranking.model.SessionContext;
import org.catalogsearch.ranking.model.Signal;
import org.catalogsearch.ranking.model.SignalScores;
import org.catalogsearch.ranking.model.UserContext;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PersonalizationScorerTest {

    private static final Instant JANUARY = Instant.parse("2024-01-15T10:00:00Z");
    private static final Instant JULY = Instant.parse("2024-07-15T10:00:00Z");

    private final PersonalizationScorer scorer = new PersonalizationScorer(ScoringConstants.defaults());

    @Test
    void withoutUserEverySignalIsInapplicableAndZero() {
        SignalScores scores = scorer.score(Candidate.builder().id("p1").build(), context(null, null, JANUARY));

        assertThat(scores.anyApplicable()).isFalse();
        for (Signal signal : Signal.of(scores.category())) {
            assertThat(scores.get(signal)).isZero();
        }
    }

    @Test
    void preferenceIsFullForPreferredCategoryBrandAndPrice() {
        UserContext user = UserContext.builder()
                .preferredCategories(Set.of("Shoes"))
                .preferredBrands(Set.of("Acme"))
                .preferredPriceMin(20.0)
                .preferredPriceMax(120.0)
                .build();
        Candidate candidate = Candidate.builder().id("p1").category("shoes").brand("acme").price(60.0).build();

        assertThat(scorer.score(candidate, context(user, null, JANUARY)).get(Signal.PREFERENCE))
                .isCloseTo(1.0, within(1e-9));
    }

    @Test
    void priceBandMatchDecaysOutsideBand() {
        UserContext user = UserContext.builder().preferredPriceMin(50.0).build();

        assertThat(PersonalizationScorer.priceBandMatch(25.0, user)).isCloseTo(1.0 / 1.5, within(1e-9));
        assertThat(PersonalizationScorer.priceBandMatch(75.0, user)).isEqualTo(1.0);
    }

    @Test
    void activityCombinesPurchaseHourViewsAndCategoryInteractions() {
        UserContext user = UserContext.builder()
                .hourOfDay(20)
                .purchaseHours(Set.of(20, 21))
                .viewedProductIds(Set.of("p1"))
                .categoryFrequencies(Map.of("shoes", 3))
                .build();
        Candidate candidate = Candidate.builder().id("p1").category("shoes").build();

        assertThat(scorer.score(candidate, context(user, null, JANUARY)).get(Signal.ACTIVITY))
                .isCloseTo(0.8, within(1e-9));
    }

    @Test
    void sessionCombinesIntentDeviceAndTimeOfDay() {
        UserContext user = UserContext.builder().deviceType("mobile").hourOfDay(20).build();
        Candidate candidate = Candidate.builder().id("p1").category("home").price(50.0).stockQuantity(3).build();

        SignalScores scores = scorer.score(candidate, context(user, new SessionContext("s1", "purchase"), JANUARY));

        assertThat(scores.get(Signal.SESSION)).isCloseTo(0.32 + 0.24 + 0.24, within(1e-9));
    }

    @Test
    void temporalBoostsInSeasonAndTrendingCategories() {
        UserContext user = UserContext.builder().build();
        Candidate coat = Candidate.builder().id("p1").category("Winter coats").trending(true).build();

        assertThat(scorer.score(coat, context(user, null, JANUARY)).get(Signal.TEMPORAL)).isCloseTo(1.0, within(1e-9));
        assertThat(scorer.score(coat, context(user, null, JULY)).get(Signal.TEMPORAL)).isCloseTo(0.7, within(1e-9));
    }

    private static ScoringContext context(UserContext user, SessionContext session, Instant at) {
        return new ScoringContext(QueryContext.builder().build(), user, null, session, at);
    }
}
