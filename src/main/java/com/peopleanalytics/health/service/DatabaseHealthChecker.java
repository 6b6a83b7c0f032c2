package com.peopleanalytics.health.service;

import com.peopleanalytics.health.dto.ServiceHealth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseHealthChecker implements HealthChecker {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public String name() {
        return "database";
    }

    @Override
    public ServiceHealth check() {
        long startTime = System.currentTimeMillis();
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return ServiceHealth.up("Database reachable", System.currentTimeMillis() - startTime);
        } catch (DataAccessException e) {
            log.error("Database health check failed: {}", e.getMessage());
            return ServiceHealth.down("Database unreachable");
        }
    }
}
