package com.peopleanalytics.health.service;

import com.peopleanalytics.health.dto.ServiceHealth;

/**
 * One dependency reported by {@code /health}.
 */
public interface HealthChecker {

    String name();

    ServiceHealth check();
}
