package com.williamcallahan.aivisibility.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors and clock for the orchestration engine.
 */
@Configuration
@EnableScheduling
public class AnalysisConfig {
    /**
     * Runs one task per multi-page session. A full queue rejects new sessions.
     */
    @Bean(name = "orchestrationExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor orchestrationExecutor(AppProperties appProperties) {
        AppProperties.Analysis analysis = appProperties.getAnalysis();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analysis.getOrchestrationThreads());
        executor.setMaxPoolSize(analysis.getOrchestrationThreads());
        executor.setQueueCapacity(analysis.getOrchestrationQueueCapacity());
        executor.setThreadNamePrefix("analysis-session-");
        executor.initialize();
        return executor;
    }

    /**
     * Runs the concurrent analyzer calls of the double-check.
     */
    @Bean(name = "analysisExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor analysisExecutor(AppProperties appProperties) {
        int threads = appProperties.getAnalysis().getAnalysisThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("page-analyzer-");
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
