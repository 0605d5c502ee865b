package com.architecture.memory.dbimpact.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    public static final String DEPENDENCY_FETCH_EXECUTOR = "dependencyFetchExecutor";

    @Value("${impact.fetch-executor.core-size:4}")
    private int coreSize;

    @Value("${impact.fetch-executor.max-size:16}")
    private int maxSize;

    @Value("${impact.fetch-executor.queue-capacity:100}")
    private int queueCapacity;

    // Runs the metadata fetch so the caller can wait on it with a deadline
    @Bean(name = DEPENDENCY_FETCH_EXECUTOR)
    public ThreadPoolTaskExecutor dependencyFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("dependency-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
