package org.catalogsearch.ranking.service.ranking;

import org.catalogsearch.ranking.config.EngineSettings;
import org.catalogsearch.ranking.config.ExperimentSettings;
import org.catalogsearch.ranking.config.RankingConfig;
import org.catalogsearch.ranking.config.ScoringConstants;
import org.catalogsearch.ranking.model.Candidate;
import org.catalogsearch.ranking.model.GeoContext;
import org.catalogsearch.ranking.model.QueryContext;
import org.catalogsearch.ranking.model.RankedCandidate;
import org.catalogsearch.ranking.model.RankingOutcome;
import org.catalogsearch.ranking.model.ScoringContext;
import org.catalogsearch.ranking.model.SignalCategory;
import org.catalogsearch.ranking.model.SignalScores;
import org.catalogsearch.ranking.model.UserContext;
import org.catalogsearch.ranking.model.Variant;
import org.catalogsearch.ranking.model.Weights;
import org.catalogsearch.ranking.service.scoring.BusinessScorer;
import org.catalogsearch.ranking.service.scoring.PersonalizationScorer;
import org.catalogsearch.ranking.service.scoring.SimilarityScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RankingEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-10T14:00:00Z");
    private static final List<Double> QUERY_VECTOR = List.of(1.0, 0.0);

    private final RankingConfig config = RankingConfig.defaults();
    private final ScoringConstants constants = config.scoring();

    private ExecutorService executor;
    private RankingEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        engine = newEngine(new SimilarityScorer(constants), config);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void similarityFirstPrefersCloseMatchOverWellStockedOne() {
        Candidate a = candidate("A", 0.95, 0);
        Candidate b = candidate("B", 0.5, 100);
        Candidate c = candidate("C", 0.0, 10);

        RankingOutcome outcome = engine.rank(vectorQuery(), List.of(c, b, a), variant(RankingConfig.SIMILARITY_FIRST));

        assertThat(ids(outcome)).containsExactly("A", "B", "C");
        assertThat(outcome.results()).extracting(RankedCandidate::rank).containsExactly(1, 2, 3);
        assertThat(outcome.partial()).isFalse();
    }

    @Test
    void identicalInputsRankIdentically() {
        UserContext user = UserContext.builder()
                .preferredCategories(Set.of("shoes"))
                .categoryFrequencies(Map.of("shoes", 4, "bags", 2))
                .deviceType("desktop")
                .build();
        GeoContext geo = GeoContext.builder().country("US").build();
        ScoringContext context = new ScoringContext(
                QueryContext.builder().text("leather shoes").vector(QUERY_VECTOR).build(), user, geo, null, NOW);
        List<Candidate> candidates = List.of(
                candidate("p3", 0.7, 20), candidate("p1", 0.9, 0), candidate("p2", 0.4, 80),
                candidate("p4", 0.7, 20));

        RankingOutcome first = engine.rank(context, candidates, variant(RankingConfig.BALANCED));
        RankingOutcome second = engine.rank(context, candidates, variant(RankingConfig.BALANCED));

        assertThat(ids(second)).isEqualTo(ids(first));
        for (int i = 0; i < first.results().size(); i++) {
            assertThat(second.results().get(i).breakdown()).isEqualTo(first.results().get(i).breakdown());
        }
    }

    @Test
    void effectiveWeightsAlwaysSumToOne() {
        UserContext user = UserContext.builder().userId("u1").deviceType("mobile").build();
        GeoContext geo = GeoContext.builder().country("US").build();
        QueryContext query = QueryContext.builder().text("lamp").build();

        for (Variant variant : config.variants().values()) {
            for (UserContext u : Arrays.asList(user, null)) {
                for (GeoContext g : Arrays.asList(geo, null)) {
                    ScoringContext context = new ScoringContext(query, u, g, null, NOW);

                    Weights effective = engine.effectiveWeights(variant.weights(), context);
                    RankingOutcome outcome = engine.rank(context, List.of(candidate("p1", 0.5, 5)), variant);

                    assertThat(effective.sum()).isCloseTo(1.0, within(1e-6));
                    assertThat(outcome.effectiveWeights().values().stream().mapToDouble(Double::doubleValue).sum())
                            .isCloseTo(1.0, within(1e-6));
                    if (u == null) {
                        assertThat(effective.get(SignalCategory.PERSONALIZATION)).isZero();
                    }
                    if (g == null) {
                        assertThat(effective.get(SignalCategory.GEOGRAPHIC)).isZero();
                    }
                }
            }
        }
    }

    @Test
    void missingUserRedistributesPersonalizationWeight() {
        RankingOutcome outcome = engine.rank(vectorQuery(), List.of(candidate("p1", 0.8, 5)), variant(RankingConfig.BALANCED));

        RankedCandidate ranked = outcome.results().get(0);
        assertThat(ranked.breakdown().categoryScores()).containsEntry("personalization", 0.0);
        assertThat(ranked.breakdown().signalScores().get("personalization").values()).containsOnly(0.0);
        assertThat(outcome.effectiveWeights().get("similarity")).isCloseTo(0.4 / 0.7, within(1e-9));
        assertThat(outcome.effectiveWeights().get("business")).isCloseTo(0.3 / 0.7, within(1e-9));
    }

    @Test
    void mobileMultiplierTiltsTowardsSimilarity() {
        RankingConfig tilted = new RankingConfig(RankingConfig.defaultVariants(),
                RankingConfig.defaultSimilarityWeights(), RankingConfig.defaultBusinessWeights(),
                RankingConfig.defaultPersonalizationWeights(), constants,
                new EngineSettings(Duration.ofSeconds(2), 0.5, 3, 2.0), ExperimentSettings.defaults());
        RankingEngine tiltedEngine = newEngine(new SimilarityScorer(constants), tilted);
        QueryContext query = QueryContext.builder().text("phone").build();
        Weights weights = variant(RankingConfig.BALANCED).weights();

        Weights mobile = tiltedEngine.effectiveWeights(weights,
                new ScoringContext(query, UserContext.builder().deviceType("mobile").build(), null, null, NOW));
        Weights desktop = tiltedEngine.effectiveWeights(weights,
                new ScoringContext(query, UserContext.builder().deviceType("desktop").build(), null, null, NOW));

        assertThat(mobile.get(SignalCategory.SIMILARITY)).isCloseTo(0.8 / 1.4, within(1e-9));
        assertThat(desktop.get(SignalCategory.SIMILARITY)).isCloseTo(0.4, within(1e-9));
        assertThat(mobile.sum()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void tiesAreBrokenByCandidateId() {
        RankingOutcome outcome = engine.rank(vectorQuery(),
                List.of(candidate("b", 0.6, 20), candidate("c", 0.6, 20), candidate("a", 0.6, 20)),
                variant(RankingConfig.BALANCED));

        assertThat(ids(outcome)).containsExactly("a", "b", "c");
    }

    @Test
    void emptyCandidateListIsAValidEmptyResult() {
        RankingOutcome outcome = engine.rank(vectorQuery(), List.of(), variant(RankingConfig.BALANCED));

        assertThat(outcome.results()).isEmpty();
        assertThat(outcome.partial()).isFalse();
        assertThat(outcome.variant()).isEqualTo(RankingConfig.BALANCED);
    }

    @Test
    void missingQueryIsRejected() {
        assertThatThrownBy(() -> engine.rank(null, List.of(candidate("p1", 0.5, 1)), variant(RankingConfig.BALANCED)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.rank(new ScoringContext(null, null, null, null, NOW),
                List.of(candidate("p1", 0.5, 1)), variant(RankingConfig.BALANCED)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void priceFilterAndNullEntriesAreRemovedBeforeScoring() {
        ScoringContext context = new ScoringContext(
                QueryContext.builder().vector(QUERY_VECTOR).minPrice(20.0).maxPrice(50.0).build(), null, null, null, NOW);
        List<Candidate> candidates = new ArrayList<>();
        candidates.add(candidate("cheap", 0.5, 5).toBuilder().price(10.0).build());
        candidates.add(candidate("fits", 0.5, 5).toBuilder().price(30.0).build());
        candidates.add(candidate("unknown", 0.5, 5).toBuilder().price(null).build());
        candidates.add(null);

        RankingOutcome outcome = engine.rank(context, candidates, variant(RankingConfig.BALANCED));

        assertThat(ids(outcome)).containsExactlyInAnyOrder("fits", "unknown");
        assertThat(outcome.filteredCount()).isEqualTo(2);
    }

    @Test
    void malformedCandidateDoesNotBlankTheResults() {
        Candidate broken = Candidate.builder().id("broken").vector(List.of(1.0, 2.0, 3.0)).build();

        RankingOutcome outcome = engine.rank(vectorQuery(),
                List.of(broken, candidate("ok", 0.9, 60)), variant(RankingConfig.BALANCED));

        assertThat(ids(outcome)).containsExactly("ok", "broken");
    }

    @Test
    void expiredDeadlineReturnsScoredSubsetAsPartial() {
        SimilarityScorer slow = new SimilarityScorer(constants) {
            @Override
            public SignalScores score(QueryContext query, Candidate candidate, UserContext user) {
                if ("slow".equals(candidate.getId())) {
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.score(query, candidate, user);
            }
        };
        RankingEngine slowEngine = newEngine(slow, config);

        RankingOutcome outcome = slowEngine.rank(vectorQuery(),
                List.of(candidate("fast-1", 0.9, 5), candidate("slow", 0.99, 100), candidate("fast-2", 0.4, 5)),
                variant(RankingConfig.BALANCED), Duration.ofMillis(300));

        assertThat(outcome.partial()).isTrue();
        assertThat(outcome.droppedCount()).isEqualTo(1);
        assertThat(ids(outcome)).containsExactly("fast-1", "fast-2");
    }

    @Test
    void deadlineHoldsWhenScoringRunsOnTheCallingThread() {
        SimilarityScorer slow = new SimilarityScorer(constants) {
            @Override
            public SignalScores score(QueryContext query, Candidate candidate, UserContext user) {
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.score(query, candidate, user);
            }
        };
        RankingEngine inlineEngine = new RankingEngine(slow, new BusinessScorer(constants),
                new PersonalizationScorer(constants), config, Runnable::run);
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            candidates.add(candidate(String.format("p%02d", i), 0.5, 10));
        }

        long start = System.nanoTime();
        RankingOutcome outcome = inlineEngine.rank(vectorQuery(), candidates,
                variant(RankingConfig.BALANCED), Duration.ofMillis(100));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(outcome.partial()).isTrue();
        assertThat(outcome.results()).hasSizeLessThan(20);
        assertThat(outcome.droppedCount()).isEqualTo(20 - outcome.results().size());
        assertThat(elapsedMs).isLessThan(600);
    }

    @Test
    void strongSignalsProduceAtMostThreeReasonsSimilarityFirst() {
        Candidate strong = candidate("p1", 1.0, 500).toBuilder()
                .popularityScore(1.0).rating(5.0).reviewCount(900L).viewCount(50_000L).purchaseCount(5_000L)
                .conversionRate(0.3)
                .build();

        RankedCandidate ranked = engine.rank(vectorQuery(), List.of(strong), variant(RankingConfig.BALANCED))
                .results().get(0);

        assertThat(ranked.breakdown().reasons()).hasSize(3);
        assertThat(ranked.breakdown().reasons().get(0)).isEqualTo("visually similar");
    }

    @Test
    void rankingWithoutUserNeverFails() {
        assertThatCode(() -> engine.rank(ScoringContext.of(QueryContext.builder().text("desk").build()),
                List.of(new Candidate(), candidate("p1", 0.3, 3)), variant(RankingConfig.PERSONALIZED)))
                .doesNotThrowAnyException();
    }

    private RankingEngine newEngine(SimilarityScorer similarityScorer, RankingConfig rankingConfig) {
        return new RankingEngine(similarityScorer, new BusinessScorer(constants),
                new PersonalizationScorer(constants), rankingConfig, executor);
    }

    private Variant variant(String name) {
        return config.variant(name);
    }

    private static ScoringContext vectorQuery() {
        return new ScoringContext(QueryContext.builder().vector(QUERY_VECTOR).build(), null, null, null, NOW);
    }

    /**
     * A candidate whose vector has the given cosine similarity to {@link #QUERY_VECTOR}.
     */
    private static Candidate candidate(String id, double cosine, int stock) {
        return Candidate.builder()
                .id(id)
                .vector(List.of(cosine, Math.sqrt(1.0 - cosine * cosine)))
                .price(25.0)
                .stockQuantity(stock)
                .build();
    }

    private static List<String> ids(RankingOutcome outcome) {
        List<String> ids = new ArrayList<>();
        for (RankedCandidate ranked : outcome.results()) {
            ids.add(ranked.candidateId());
        }
        return ids;
    }
}
