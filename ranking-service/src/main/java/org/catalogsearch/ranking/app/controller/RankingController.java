package org.catalogsearch.ranking.app.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.catalogsearch.ranking.app.model.RankRequest;
import org.catalogsearch.ranking.app.model.RankResponse;
import org.catalogsearch.ranking.app.model.VariantSummary;
import org.catalogsearch.ranking.app.service.RankingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for product ranking.
 *
 * <p>Ranks a candidate list supplied by the caller (usually the hits of a vector search) and
 * returns the ordered products with a score breakdown per product.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/ranking")
@RequiredArgsConstructor
public class RankingController {

    private final RankingService rankingService;

    /**
     * Ranks candidates for a search request.
     *
     * @param request query, candidates and optional user, geo and session context
     * @return ranked results; 400 when the query is missing or a forced variant is unknown
     */
    @PostMapping
    public ResponseEntity<RankResponse> rank(@RequestBody RankRequest request) {
        if (request.getQuery() == null) {
            return ResponseEntity.badRequest().body(
                    RankResponse.builder()
                            .resultCount(0)
                            .results(List.of())
                            .message("query is required")
                            .build()
            );
        }

        log.debug("Ranking request: candidates={}, session={}, variant={}, timeoutMs={}",
                request.getCandidates() == null ? 0 : request.getCandidates().size(),
                request.getSessionId(), request.getVariant(), request.getTimeoutMs());

        try {
            return ResponseEntity.ok(rankingService.rank(request));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected ranking request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    RankResponse.builder()
                            .resultCount(0)
                            .results(List.of())
                            .message(e.getMessage())
                            .build()
            );
        }
    }

    /**
     * Lists the configured variants and their category weights.
     */
    @GetMapping("/variants")
    public ResponseEntity<List<VariantSummary>> variants() {
        return ResponseEntity.ok(rankingService.variants());
    }

    /**
     * Health check endpoint for the ranking subsystem.
     *
     * @return health status including the configured variants, request statistics and event counters
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        try {
            List<VariantSummary> variants = rankingService.variants();
            return ResponseEntity.ok(Map.of(
                    "status", "UP",
                    "variantCount", variants.size(),
                    "stats", rankingService.stats(),
                    "tracking", rankingService.trackingCounts()
            ));
        } catch (Exception e) {
            log.error("Ranking health check failed: {}", e.getMessage());
            return ResponseEntity.ok(Map.of(
                    "status", "DOWN",
                    "error", e.getMessage() != null ? e.getMessage() : "Unknown error"
            ));
        }
    }
}
