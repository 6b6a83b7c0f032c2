package com.peopleanalytics.health.service;

import com.peopleanalytics.config.AsyncConfig;
import com.peopleanalytics.health.dto.ServiceHealth;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Reports the import worker pool. A full queue means new imports fail on submit.
 */
@Component
public class ImportQueueHealthChecker implements HealthChecker {

    private final ThreadPoolTaskExecutor importExecutor;

    public ImportQueueHealthChecker(@Qualifier(AsyncConfig.IMPORT_EXECUTOR) ThreadPoolTaskExecutor importExecutor) {
        this.importExecutor = importExecutor;
    }

    @Override
    public String name() {
        return "importQueue";
    }

    @Override
    public ServiceHealth check() {
        int active = importExecutor.getActiveCount();
        int queued = importExecutor.getQueueSize();
        int capacity = importExecutor.getQueueCapacity();
        String message = String.format("%d running, %d queued of %d", active, queued, capacity);
        if (queued >= capacity) {
            return ServiceHealth.down("Queue full: " + message);
        }
        return ServiceHealth.up(message, null);
    }
}
