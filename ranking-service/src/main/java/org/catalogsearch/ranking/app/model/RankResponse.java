package org.catalogsearch.ranking.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.catalogsearch.ranking.model.Candidate;
import org.catalogsearch.ranking.model.ScoreBreakdown;
import org.catalogsearch.ranking.service.facet.Facets;

import java.util.List;
import java.util.Map;

/**
 * Response payload for the ranking endpoint.
 *
 * <p>Each result carries its final score and a breakdown of how that score was derived.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RankResponse {

    /** Variant whose weights produced the ranking. */
    private String variant;

    /** Session the variant was assigned to. */
    private String sessionId;

    /** {@code true} when the deadline expired before every candidate was scored. */
    private boolean partial;

    /** Number of results returned. */
    private int resultCount;

    /** Number of candidates received. */
    private int totalCandidates;

    /** Candidates dropped because they were not scored in time. */
    private int droppedCount;

    /** Candidates removed by the price filter or because they were empty. */
    private int filteredCount;

    /** Time taken for the ranking in milliseconds. */
    private long rankingTimeMs;

    /** Category weights applied after redistribution. */
    private Map<String, Double> effectiveWeights;

    /** Ordered results. */
    private List<RankedResult> results;

    /** Facets over all ranked results, when requested. */
    private Facets facets;

    /** Error description for rejected requests. */
    private String message;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RankedResult {

        /** Rank position (1-based). */
        private int rank;

        /** Candidate id. */
        private String id;

        /** Final score (0.0 - 1.0). */
        private double score;

        /** Up to three short explanations. */
        private List<String> reasons;

        /** Category and signal scores behind {@link #score}. */
        private ScoreBreakdown breakdown;

        /** The ranked product as received. */
        private Candidate product;
    }
}
