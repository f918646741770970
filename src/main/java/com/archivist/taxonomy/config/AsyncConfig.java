package com.archivist.taxonomy.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    // Each run holds its thread through batch polling, so runs beyond the limit are rejected rather than queued.
    @Bean(name = "pipelineTaskExecutor")
    public AsyncTaskExecutor pipelineTaskExecutor(@Value("${app.pipeline.max-concurrent-runs:4}") int maxConcurrentRuns) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("pipeline-");
        executor.setCorePoolSize(maxConcurrentRuns);
        executor.setMaxPoolSize(maxConcurrentRuns);
        executor.setQueueCapacity(0);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
