package org.catalogsearch.ranking.app.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.catalogsearch.ranking.app.model.InteractionRequest;
import org.catalogsearch.ranking.app.model.PerformanceReport;
import org.catalogsearch.ranking.app.service.ExperimentService;
import org.catalogsearch.ranking.service.experiment.Recommendation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for ranking experiments.
 *
 * <p>Interactions are accepted fire-and-forget: the endpoint answers 202 even when the event
 * is dropped, so analytics problems never surface in the shopper's request path.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/experiments")
@RequiredArgsConstructor
public class ExperimentController {

    private final ExperimentService experimentService;

    @PostMapping("/interactions")
    public ResponseEntity<Void> recordInteraction(@RequestBody InteractionRequest request) {
        try {
            experimentService.recordInteraction(request);
        } catch (RuntimeException e) {
            log.warn("Failed to record interaction for session {}: {}", request.getSessionId(), e.getMessage());
        }
        return ResponseEntity.accepted().build();
    }

    /**
     * Reports experiment performance.
     *
     * @param variant optional variant to narrow the report to
     * @param metric  optional metric ({@code ctr} or {@code conversion})
     * @return per-variant metrics, ranking statistics and recommendations; 400 for an unknown metric
     */
    @GetMapping("/performance")
    public ResponseEntity<PerformanceReport> performance(@RequestParam(required = false) String variant,
                                                         @RequestParam(required = false) String metric) {
        try {
            return ResponseEntity.ok(experimentService.performance(variant, metric));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                    PerformanceReport.builder()
                            .message(e.getMessage())
                            .build()
            );
        }
    }

    @GetMapping("/recommendations")
    public ResponseEntity<List<Recommendation>> recommendations() {
        return ResponseEntity.ok(experimentService.recommendations());
    }
}
