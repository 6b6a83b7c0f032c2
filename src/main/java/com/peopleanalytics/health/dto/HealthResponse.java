package com.peopleanalytics.health.dto;

import java.util.Map;

public record HealthResponse(
        String status,
        Map<String, ServiceHealth> services
) {
    public boolean isHealthy() {
        return "UP".equals(status);
    }
}
