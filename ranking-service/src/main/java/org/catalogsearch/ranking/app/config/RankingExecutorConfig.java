package org.catalogsearch.ranking.app.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executor that scores candidates in parallel.
 *
 * <p>The pool is bounded and sized to the available cores by default. When the queue is
 * full the submitting request thread scores the candidate itself, so a burst of traffic slows
 * requests down instead of failing them.</p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RankingExecutorConfig.RankingExecutorProperties.class)
public class RankingExecutorConfig {

    @Bean(name = "rankingExecutor")
    public Executor rankingExecutor(RankingExecutorProperties props) {
        int processors = Runtime.getRuntime().availableProcessors();
        int coreSize = props.getCoreSize() > 0 ? props.getCoreSize() : processors;
        int maxSize = Math.max(coreSize, props.getMaxSize() > 0 ? props.getMaxSize() : processors);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix("ranking-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.initialize();

        log.info("Ranking executor started: core={}, max={}, queue={}", coreSize, maxSize, props.getQueueCapacity());
        return executor;
    }

    /**
     * Configuration properties for the scoring executor.
     *
     * <p>Bound from {@code ranking.executor.*} in {@code application.yml}.
     */
    @Data
    @ConfigurationProperties(prefix = "ranking.executor")
    public static class RankingExecutorProperties {

        /**
         * Core number of threads; 0 uses the number of available processors.
         */
        private int coreSize = 0;

        /**
         * Maximum number of threads; 0 uses the number of available processors.
         */
        private int maxSize = 0;

        /**
         * Maximum number of queued scoring tasks before callers score inline.
         */
        private int queueCapacity = 10_000;

        /**
         * Seconds to wait during shutdown for running tasks to complete.
         */
        private int awaitTerminationSeconds = 10;
    }
}
