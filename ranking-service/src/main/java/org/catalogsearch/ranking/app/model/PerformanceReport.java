package org.catalogsearch.ranking.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.catalogsearch.ranking.app.service.RankingStats;
import org.catalogsearch.ranking.service.experiment.Recommendation;
import org.catalogsearch.ranking.service.experiment.VariantPerformance;

import java.util.List;
import java.util.Map;

/**
 * Experiment metrics for operators and analytics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PerformanceReport {

    /** Metric requested, when the report was narrowed to one. */
    private String metric;

    /** Value of {@link #metric} per variant. */
    private Map<String, Double> values;

    /** Full performance per variant. */
    private Map<String, VariantPerformance> variants;

    /** Ranking request statistics since startup. */
    private RankingStats.Snapshot stats;

    private List<Recommendation> recommendations;

    /** Error description for rejected requests. */
    private String message;
}
