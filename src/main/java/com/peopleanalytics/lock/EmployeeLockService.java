package com.peopleanalytics.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Advisory locks in Redis that serialize writes touching the same employee's daily hours (or
 * the same email) across import jobs and API requests.
 */
@Slf4j
@Service
public class EmployeeLockService {

    private static final String LOCK_PREFIX = "lock:";
    private static final long RETRY_INTERVAL_MS = 50;

    // Deletes the key only while it still holds our token.
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final Duration waitTimeout;
    private final Duration ttl;

    public EmployeeLockService(RedisTemplate<String, String> redisTemplate,
                               @Value("${analytics.lock.wait-timeout:5s}") Duration waitTimeout,
                               @Value("${analytics.lock.ttl:30s}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.waitTimeout = waitTimeout;
        this.ttl = ttl;
    }

    public static String employeeKey(UUID employeeId) {
        return "employee:" + employeeId;
    }

    public static String emailKey(String email) {
        return "employee-email:" + email;
    }

    /**
     * Runs the action while holding the lock. Waits at most the configured timeout for it.
     *
     * @throws LockTimeoutException if the lock stays taken for the whole wait
     */
    public <T> T withLock(String lockKey, Supplier<T> action) {
        String token = acquire(lockKey);
        try {
            return action.get();
        } finally {
            release(lockKey, token);
        }
    }

    String acquire(String lockKey) {
        String key = LOCK_PREFIX + lockKey;
        String token = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + waitTimeout.toNanos();

        while (true) {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(
                    key,
                    token,
                    ttl.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Lock acquired: {}", lockKey);
                return token;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("Lock still held after {}: {}", waitTimeout, lockKey);
                throw new LockTimeoutException(lockKey);
            }
            try {
                Thread.sleep(RETRY_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(lockKey);
            }
        }
    }

    void release(String lockKey, String token) {
        String key = LOCK_PREFIX + lockKey;
        Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key), token);
        if (deleted == null || deleted == 0L) {
            log.warn("Lock {} expired before release", lockKey);
        } else {
            log.debug("Lock released: {}", lockKey);
        }
    }
}
