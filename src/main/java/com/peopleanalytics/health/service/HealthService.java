package com.peopleanalytics.health.service;

import com.peopleanalytics.health.dto.HealthResponse;
import com.peopleanalytics.health.dto.ServiceHealth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    private final List<HealthChecker> checkers;

    public HealthResponse checkAll() {
        Map<String, ServiceHealth> services = new TreeMap<>();
        for (HealthChecker checker : checkers) {
            services.put(checker.name(), checker.check());
        }

        boolean allHealthy = services.values().stream().allMatch(ServiceHealth::isUp);
        if (!allHealthy) {
            log.warn("Health check degraded: {}", services);
        }
        return new HealthResponse(allHealthy ? "UP" : "DOWN", services);
    }
}
