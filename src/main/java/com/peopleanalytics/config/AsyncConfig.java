package com.peopleanalytics.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String IMPORT_EXECUTOR = "importExecutor";

    /**
     * Worker pool for import jobs. One job occupies one thread for its whole run; the queue
     * bounds how many submitted jobs may wait.
     */
    @Bean(name = IMPORT_EXECUTOR)
    public ThreadPoolTaskExecutor importExecutor(
            @Value("${analytics.import.worker.core-size:2}") int coreSize,
            @Value("${analytics.import.worker.max-size:4}") int maxSize,
            @Value("${analytics.import.worker.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("import-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
