package com.peopleanalytics.health.dto;

public record ServiceHealth(
        String status,
        String message,
        Long responseTimeMs
) {
    public static ServiceHealth up(String message, Long responseTimeMs) {
        return new ServiceHealth("UP", message, responseTimeMs);
    }

    public static ServiceHealth down(String message) {
        return new ServiceHealth("DOWN", message, null);
    }

    public boolean isUp() {
        return "UP".equals(status);
    }
}
