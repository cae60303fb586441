package org.catalogsearch.ranking.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.catalogsearch.ranking.model.Candidate;
import org.catalogsearch.ranking.model.GeoContext;
import org.catalogsearch.ranking.model.QueryContext;
import org.catalogsearch.ranking.model.UserContext;

import java.time.Instant;
import java.util.List;

/**
 * Request payload for the ranking endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RankRequest {

    /** Query text, vector and filters. Required. */
    private QueryContext query;

    /** Candidates to rank, typically the hits of a vector search. */
    private List<Candidate> candidates;

    /** Optional shopper profile; enables personalization. */
    private UserContext user;

    /** Optional location; enables geographic relevance. */
    private GeoContext geo;

    /** Session id used for variant assignment and experiment attribution. */
    private String sessionId;

    /** User id, used for variant assignment when no session id is given. */
    private String userId;

    /** Inferred search intent of the session (purchase, browse, research, compare). */
    private String searchIntent;

    /** Forces a variant instead of the assigned one. */
    private String variant;

    /** Ranking deadline in milliseconds; the configured default when absent. */
    private Long timeoutMs;

    /** Maximum number of results to return; all when absent. */
    private Integer topK;

    /**
     * Point in time for seasonal and time-of-day signals. When absent the server clock is used,
     * so identical requests may rank differently across an hour or month boundary.
     */
    private Instant referenceTime;

    /** Whether to aggregate facets over the ranked results. */
    private boolean includeFacets;
}
