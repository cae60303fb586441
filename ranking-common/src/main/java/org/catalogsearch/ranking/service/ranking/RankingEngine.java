package org.catalogsearch.ranking.service.ranking;

import lombok.extern.slf4j.Slf4j;
import org.catalogsearch.ranking.config.RankingConfig;
import org.catalogsearch.ranking.model.Candidate;
import org.catalogsearch.ranking.model.RankedCandidate;
import org.catalogsearch.ranking.model.RankingOutcome;
import org.catalogsearch.ranking.model.ScoreBreakdown;
import org.catalogsearch.ranking.model.ScoringContext;
import org.catalogsearch.ranking.model.SignalCategory;
import org.catalogsearch.ranking.model.SignalScores;
import org.catalogsearch.ranking.model.Variant;
import org.catalogsearch.ranking.model.Weights;
import org.catalogsearch.ranking.service.scoring.BusinessScorer;
import org.catalogsearch.ranking.service.scoring.PersonalizationScorer;
import org.catalogsearch.ranking.service.scoring.SimilarityScorer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Combines similarity, business and personalization signals into one ordered result list.
 *
 * <p>Workflow:
 * <ol>
 *   <li>Drop null candidates and candidates outside the query's price filter</li>
 *   <li>Derive the effective category weights: categories the request cannot score (no user,
 *       no location) hand their weight to the others proportionally</li>
 *   <li>Score every candidate independently on the scoring executor</li>
 *   <li>Join until the deadline; candidates not scored by then are dropped</li>
 *   <li>Sort by final score, ties broken by candidate id</li>
 * </ol>
 *
 * <p>The engine holds no mutable state. For identical inputs it returns identical order and
 * identical breakdowns.</p>
 */
@Slf4j
public class RankingEngine {

    private static final Comparator<RankedCandidate> ORDER = Comparator
            .comparingDouble(RankedCandidate::finalScore).reversed()
            .thenComparing(r -> r.candidateId() == null ? "" : r.candidateId());

    private static final String MOBILE = "mobile";

    private final SimilarityScorer similarityScorer;
    private final BusinessScorer businessScorer;
    private final PersonalizationScorer personalizationScorer;
    private final RankingConfig config;
    private final Executor executor;
    private final ReasonCollector reasonCollector;

    public RankingEngine(SimilarityScorer similarityScorer,
                         BusinessScorer businessScorer,
                         PersonalizationScorer personalizationScorer,
                         RankingConfig config,
                         Executor executor) {
        this.similarityScorer = similarityScorer;
        this.businessScorer = businessScorer;
        this.personalizationScorer = personalizationScorer;
        this.config = config;
        this.executor = executor;
        this.reasonCollector = new ReasonCollector(
                config.engine().reasonThreshold(), config.engine().maxReasons());
    }

    /**
     * Ranks candidates with the configured default deadline.
     *
     * @see #rank(ScoringContext, List, Variant, Duration)
     */
    public RankingOutcome rank(ScoringContext context, List<Candidate> candidates, Variant variant) {
        return rank(context, candidates, variant, null);
    }

    /**
     * Ranks candidates for one request.
     *
     * @param context    request context; its query is required, user, geo and session are optional
     * @param candidates candidates to rank; an empty list yields an empty outcome
     * @param variant    variant whose weights combine the category scores
     * @param timeout    deadline for scoring; {@code null} or non-positive uses the configured default
     * @return ranked candidates, possibly partial when the deadline expired
     * @throws IllegalArgumentException when the query context or the variant is missing
     */
    public RankingOutcome rank(ScoringContext context, List<Candidate> candidates, Variant variant, Duration timeout) {
        if (context == null || context.query() == null) {
            throw new IllegalArgumentException("A query context is required to rank candidates");
        }
        if (variant == null) {
            throw new IllegalArgumentException("A ranking variant is required");
        }
        long startTime = System.nanoTime();

        Weights effective = effectiveWeights(variant.weights(), context);
        Map<String, Double> effectiveMap = effective.asMap();

        List<Candidate> eligible = new ArrayList<>();
        if (candidates != null) {
            for (Candidate candidate : candidates) {
                if (candidate != null && context.query().acceptsPrice(candidate.getPrice())) {
                    eligible.add(candidate);
                }
            }
        }
        int filteredCount = (candidates == null ? 0 : candidates.size()) - eligible.size();

        if (eligible.isEmpty()) {
            log.debug("No candidates to rank for variant {} ({} filtered)", variant.name(), filteredCount);
            return RankingOutcome.empty(variant.name(), effectiveMap, filteredCount);
        }

        long deadline = startTime + resolveTimeout(timeout).toNanos();
        List<CompletableFuture<RankedCandidate>> futures = new ArrayList<>(eligible.size());
        boolean timedOut = false;
        for (Candidate candidate : eligible) {
            // a saturated executor scores on this thread, so the deadline is checked per submission
            if (System.nanoTime() - deadline >= 0) {
                timedOut = true;
                break;
            }
            futures.add(submit(() -> scoreCandidate(context, candidate, effective)));
        }

        if (!timedOut) {
            timedOut = awaitAll(futures, deadline - System.nanoTime());
        }

        List<RankedCandidate> scored = new ArrayList<>(futures.size());
        for (CompletableFuture<RankedCandidate> future : futures) {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                scored.add(future.join());
            } else {
                future.cancel(true);
            }
        }
        int droppedCount = eligible.size() - scored.size();

        scored.sort(ORDER);
        List<RankedCandidate> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            RankedCandidate r = scored.get(i);
            ranked.add(new RankedCandidate(r.candidate(), i + 1, r.finalScore(), r.breakdown()));
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
        boolean partial = timedOut || droppedCount > 0;
        if (partial) {
            log.warn("Partial ranking for variant {}: scored {} of {} candidates in {}ms",
                    variant.name(), ranked.size(), eligible.size(), elapsedMs);
        } else {
            log.debug("Ranked {} candidates for variant {} in {}ms", ranked.size(), variant.name(), elapsedMs);
        }

        return new RankingOutcome(variant.name(), ranked, effectiveMap, partial, droppedCount, filteredCount, elapsedMs);
    }

    /**
     * Category weights actually used for a request.
     *
     * <p>Personalization is inapplicable without a user, geographic relevance without a
     * location. For mobile users the similarity weight is first multiplied by the configured
     * factor. The result always sums to 1.0.</p>
     */
    public Weights effectiveWeights(Weights weights, ScoringContext context) {
        Weights base = weights;
        double multiplier = config.engine().mobileSimilarityMultiplier();
        if (multiplier != 1.0d && context.hasUser()
                && MOBILE.equalsIgnoreCase(context.user().getDeviceType())) {
            base = base.scale(SignalCategory.SIMILARITY, multiplier);
        }
        return base.redistribute(applicableCategories(context));
    }

    static Set<SignalCategory> applicableCategories(ScoringContext context) {
        Set<SignalCategory> applicable = EnumSet.noneOf(SignalCategory.class);
        for (SignalCategory category : SignalCategory.values()) {
            if (category.alwaysApplicable()
                    || (category == SignalCategory.PERSONALIZATION && context.hasUser())
                    || (category == SignalCategory.GEOGRAPHIC && context.hasGeo())) {
                applicable.add(category);
            }
        }
        return applicable;
    }

    /**
     * Scores one candidate. Each scorer guards its own sub-metrics, so this never throws for
     * malformed candidate fields.
     */
    RankedCandidate scoreCandidate(ScoringContext context, Candidate candidate, Weights effective) {
        SignalScores similarity = similarityScorer.score(context.query(), candidate, context.user());
        SignalScores business = businessScorer.score(candidate, context.geo());
        SignalScores personalization = personalizationScorer.score(candidate, context);

        Map<SignalCategory, Double> categoryScores = new EnumMap<>(SignalCategory.class);
        categoryScores.put(SignalCategory.SIMILARITY, similarity.reduce(config.intraWeights(SignalCategory.SIMILARITY)));
        categoryScores.put(SignalCategory.BUSINESS, business.reduce(config.intraWeights(SignalCategory.BUSINESS)));
        categoryScores.put(SignalCategory.PERSONALIZATION,
                personalization.reduce(config.intraWeights(SignalCategory.PERSONALIZATION)));
        // the geographic sub-score doubles as its own category
        categoryScores.put(SignalCategory.GEOGRAPHIC, business.reduce(config.intraWeights(SignalCategory.GEOGRAPHIC)));

        double finalScore = 0.0d;
        Map<String, Double> categoryMap = new LinkedHashMap<>();
        for (Map.Entry<SignalCategory, Double> entry : categoryScores.entrySet()) {
            finalScore += effective.get(entry.getKey()) * entry.getValue();
            categoryMap.put(entry.getKey().key(), entry.getValue());
        }

        Map<String, Map<String, Double>> signalMap = new LinkedHashMap<>();
        signalMap.put(SignalCategory.SIMILARITY.key(), similarity.asMap());
        signalMap.put(SignalCategory.BUSINESS.key(), business.asMap());
        signalMap.put(SignalCategory.PERSONALIZATION.key(), personalization.asMap());

        List<String> reasons = reasonCollector.collect(similarity, business, personalization);

        ScoreBreakdown breakdown = new ScoreBreakdown(categoryMap, signalMap, effective.asMap(), finalScore, reasons);
        return new RankedCandidate(candidate, 0, finalScore, breakdown);
    }

    private CompletableFuture<RankedCandidate> submit(Supplier<RankedCandidate> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            log.debug("Scoring executor saturated; scoring on the calling thread");
            return CompletableFuture.completedFuture(task.get());
        }
    }

    /**
     * Waits for every future for at most the remaining time before the deadline.
     *
     * @return {@code true} when the deadline expired (or the wait was interrupted) first
     */
    private boolean awaitAll(List<CompletableFuture<RankedCandidate>> futures, long remainingNanos) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            all.get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS);
            return false;
        } catch (TimeoutException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for candidate scores; returning partial ranking");
            return true;
        } catch (ExecutionException e) {
            log.warn("Candidate scoring failed: {}", e.getCause() != null ? e.getCause().toString() : e.toString());
            return false;
        }
    }

    private Duration resolveTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return config.engine().defaultTimeout();
        }
        return timeout;
    }
}
