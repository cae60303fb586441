package org.catalogsearch.ranking.app.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.catalogsearch.ranking.app.config.RankingProperties;
import org.catalogsearch.ranking.app.model.RankRequest;
import org.catalogsearch.ranking.app.model.RankResponse;
import org.catalogsearch.ranking.app.model.RankResponse.RankedResult;
import org.catalogsearch.ranking.app.model.VariantSummary;
import org.catalogsearch.ranking.model.Candidate;
import org.catalogsearch.ranking.model.EventKind;
import org.catalogsearch.ranking.model.ExperimentEvent;
import org.catalogsearch.ranking.model.RankedCandidate;
import org.catalogsearch.ranking.model.RankingOutcome;
import org.catalogsearch.ranking.model.ScoringContext;
import org.catalogsearch.ranking.model.SessionContext;
import org.catalogsearch.ranking.model.Variant;
import org.catalogsearch.ranking.service.experiment.ExperimentTracker;
import org.catalogsearch.ranking.service.facet.FacetAggregator;
import org.catalogsearch.ranking.service.ranking.RankingEngine;
import org.catalogsearch.ranking.service.variant.VariantSelector;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Service for ranking a candidate list for one search request.
 *
 * <p>Workflow:
 * <ol>
 *   <li>Resolve the variant: the forced one, or the one assigned to the session</li>
 *   <li>Rank the candidates with the variant's weights under the request deadline</li>
 *   <li>Trim to {@code topK}, optionally aggregate facets and record impressions</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RankingService {

    private final RankingEngine rankingEngine;
    private final VariantSelector variantSelector;
    private final ExperimentTracker experimentTracker;
    private final FacetAggregator facetAggregator;
    private final RankingStats rankingStats;
    private final RankingProperties props;

    /**
     * Ranks the request's candidates.
     *
     * @param request ranking parameters; its query is required
     * @return ranked results with score breakdowns
     * @throws IllegalArgumentException when the query is missing or a forced variant is unknown
     */
    public RankResponse rank(RankRequest request) {
        String sessionId = resolveSessionId(request);
        Variant variant = request.getVariant() != null && !request.getVariant().isBlank()
                ? variantSelector.variant(request.getVariant())
                : variantSelector.assign(sessionId);

        ScoringContext context = new ScoringContext(
                request.getQuery(),
                request.getUser(),
                request.getGeo(),
                sessionId == null ? null : new SessionContext(sessionId, request.getSearchIntent()),
                request.getReferenceTime());

        List<Candidate> candidates = request.getCandidates() == null ? List.of() : request.getCandidates();
        log.info("Ranking {} candidates: variant={}, session={}, user={}, geo={}",
                candidates.size(), variant.name(), sessionId, context.hasUser(), context.hasGeo());

        RankingOutcome outcome = rankingEngine.rank(context, candidates, variant, resolveTimeout(request));
        rankingStats.record(outcome);

        List<RankedCandidate> ranked = outcome.results();
        int limit = resolveTopK(request, ranked.size());
        List<RankedResult> results = new ArrayList<>(limit);
        for (RankedCandidate candidate : ranked.subList(0, limit)) {
            results.add(toResult(candidate));
        }

        if (props.getExperiment().isAutoRecordImpressions() && sessionId != null) {
            recordImpressions(sessionId, variant.name(), results);
        }

        RankResponse.RankResponseBuilder response = RankResponse.builder()
                .variant(variant.name())
                .sessionId(sessionId)
                .partial(outcome.partial())
                .resultCount(results.size())
                .totalCandidates(candidates.size())
                .droppedCount(outcome.droppedCount())
                .filteredCount(outcome.filteredCount())
                .rankingTimeMs(outcome.elapsedMs())
                .effectiveWeights(outcome.effectiveWeights())
                .results(results);

        if (request.isIncludeFacets()) {
            List<Candidate> rankedCandidates = new ArrayList<>(ranked.size());
            for (RankedCandidate candidate : ranked) {
                rankedCandidates.add(candidate.candidate());
            }
            response.facets(facetAggregator.aggregate(rankedCandidates));
        }

        log.info("Ranked {} results in {}ms (variant={}, partial={})",
                results.size(), outcome.elapsedMs(), variant.name(), outcome.partial());
        return response.build();
    }

    public List<VariantSummary> variants() {
        List<VariantSummary> summaries = new ArrayList<>();
        for (Variant variant : variantSelector.variants()) {
            summaries.add(VariantSummary.builder()
                    .name(variant.name())
                    .weights(variant.weights().asMap())
                    .trafficShare(variant.trafficShare())
                    .build());
        }
        return summaries;
    }

    public RankingStats.Snapshot stats() {
        return rankingStats.snapshot();
    }

    /**
     * Experiment event counters: recorded, dropped and currently stored.
     */
    public Map<String, Long> trackingCounts() {
        return Map.of(
                "recorded", experimentTracker.recordedCount(),
                "dropped", experimentTracker.droppedCount(),
                "stored", experimentTracker.storedCount());
    }

    private void recordImpressions(String sessionId, String variant, List<RankedResult> results) {
        for (RankedResult result : results) {
            experimentTracker.record(new ExperimentEvent(
                    sessionId, variant, result.getId(), EventKind.IMPRESSION, result.getRank(), null));
        }
    }

    private static RankedResult toResult(RankedCandidate candidate) {
        return RankedResult.builder()
                .rank(candidate.rank())
                .id(candidate.candidateId())
                .score(candidate.finalScore())
                .reasons(candidate.breakdown().reasons())
                .breakdown(candidate.breakdown())
                .product(candidate.candidate())
                .build();
    }

    private static String resolveSessionId(RankRequest request) {
        if (request.getSessionId() != null && !request.getSessionId().isBlank()) {
            return request.getSessionId();
        }
        if (request.getUserId() != null && !request.getUserId().isBlank()) {
            return request.getUserId();
        }
        if (request.getUser() != null && request.getUser().getUserId() != null
                && !request.getUser().getUserId().isBlank()) {
            return request.getUser().getUserId();
        }
        return null;
    }

    private Duration resolveTimeout(RankRequest request) {
        if (request.getTimeoutMs() == null || request.getTimeoutMs() <= 0) {
            return null;
        }
        Duration requested = Duration.ofMillis(request.getTimeoutMs());
        Duration max = props.getEngine().getMaxTimeout();
        return requested.compareTo(max) > 0 ? max : requested;
    }

    private int resolveTopK(RankRequest request, int available) {
        int limit = request.getTopK() == null || request.getTopK() <= 0
                ? available
                : Math.min(request.getTopK(), props.getEngine().getMaxTopK());
        return Math.min(limit, available);
    }
}
