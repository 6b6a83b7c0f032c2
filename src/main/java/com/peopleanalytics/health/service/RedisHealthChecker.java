package com.peopleanalytics.health.service;

import com.peopleanalytics.health.dto.ServiceHealth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Redis backs the employee locks and the search index, so imports and writes stall without it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisHealthChecker implements HealthChecker {

    private final RedisConnectionFactory redisConnectionFactory;

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public ServiceHealth check() {
        long startTime = System.currentTimeMillis();
        try (RedisConnection connection = redisConnectionFactory.getConnection()) {
            connection.ping();
            return ServiceHealth.up("Redis reachable", System.currentTimeMillis() - startTime);
        } catch (DataAccessException e) {
            log.error("Redis health check failed: {}", e.getMessage());
            return ServiceHealth.down("Redis unreachable");
        }
    }
}
