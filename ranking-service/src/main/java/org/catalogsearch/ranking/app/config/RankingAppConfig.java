package org.catalogsearch.ranking.app.config;

import lombok.extern.slf4j.Slf4j;
import org.catalogsearch.ranking.config.RankingConfig;
import org.catalogsearch.ranking.service.experiment.ExperimentEventStore;
import org.catalogsearch.ranking.service.experiment.ExperimentTracker;
import org.catalogsearch.ranking.service.experiment.InMemoryExperimentEventStore;
import org.catalogsearch.ranking.service.facet.FacetAggregator;
import org.catalogsearch.ranking.service.ranking.RankingEngine;
import org.catalogsearch.ranking.service.scoring.BusinessScorer;
import org.catalogsearch.ranking.service.scoring.PersonalizationScorer;
import org.catalogsearch.ranking.service.scoring.SimilarityScorer;
import org.catalogsearch.ranking.service.variant.AssignmentStore;
import org.catalogsearch.ranking.service.variant.InMemoryAssignmentStore;
import org.catalogsearch.ranking.service.variant.VariantSelector;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Central Spring configuration for the ranking service.
 *
 * <p>Wires the validated {@link RankingConfig}, the three scorers, the ranking engine, variant
 * selection and experiment tracking. Variant assignments and experiment events are kept in
 * memory.</p>
 */
@Slf4j
@Configuration
public class RankingAppConfig {

    // ----------------------------------------------------------------------
    // Configuration
    // ----------------------------------------------------------------------

    @Bean
    public RankingConfig rankingConfig(RankingProperties props) {
        RankingConfig config = props.toRankingConfig();
        log.info("Loaded ranking configuration with variants {}", config.variantNames());
        return config;
    }

    // ----------------------------------------------------------------------
    // Scoring
    // ----------------------------------------------------------------------

    @Bean
    public SimilarityScorer similarityScorer(RankingConfig config) {
        return new SimilarityScorer(config.scoring());
    }

    @Bean
    public BusinessScorer businessScorer(RankingConfig config) {
        return new BusinessScorer(config.scoring());
    }

    @Bean
    public PersonalizationScorer personalizationScorer(RankingConfig config) {
        return new PersonalizationScorer(config.scoring());
    }

    @Bean
    public RankingEngine rankingEngine(SimilarityScorer similarityScorer,
                                       BusinessScorer businessScorer,
                                       PersonalizationScorer personalizationScorer,
                                       RankingConfig config,
                                       @Qualifier("rankingExecutor") Executor rankingExecutor) {
        return new RankingEngine(similarityScorer, businessScorer, personalizationScorer, config, rankingExecutor);
    }

    @Bean
    public FacetAggregator facetAggregator() {
        return new FacetAggregator();
    }

    // ----------------------------------------------------------------------
    // Experiments
    // ----------------------------------------------------------------------

    @Bean
    public AssignmentStore assignmentStore(RankingProperties props) {
        RankingProperties.Experiment experiment = props.getExperiment();
        return new InMemoryAssignmentStore(
                experiment.getAssignmentMaxSize(), experiment.getAssignmentExpireAfterAccess());
    }

    @Bean
    public VariantSelector variantSelector(RankingConfig config, AssignmentStore assignmentStore) {
        return new VariantSelector(config, assignmentStore);
    }

    @Bean
    public ExperimentEventStore experimentEventStore() {
        return new InMemoryExperimentEventStore();
    }

    @Bean
    public ExperimentTracker experimentTracker(ExperimentEventStore experimentEventStore, RankingConfig config) {
        return new ExperimentTracker(experimentEventStore, config.experiment());
    }
}
