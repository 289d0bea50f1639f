package com.intellibank.analysis.config;

import java.time.Clock;
import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    /**
     * Runs whole analysis jobs, one task per job.
     */
    @Bean(name = "analysisJobTaskExecutor")
    public Executor analysisJobTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("analysis-job-");
        executor.initialize();
        return executor;
    }

    /**
     * Runs a single stage body so the job thread can enforce the stage's wall-clock budget.
     */
    @Bean(name = "stageTaskExecutor")
    public Executor stageTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("analysis-stage-");
        executor.initialize();
        return executor;
    }

    /**
     * Bounds the number of concurrent classifier invocations across all jobs.
     */
    @Bean(name = "classifierTaskExecutor")
    public Executor classifierTaskExecutor(AnalysisProperties properties) {
        int concurrency = properties.categorization().maxConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("classifier-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
