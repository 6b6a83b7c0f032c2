package com.peopleanalytics.lock;

/**
 * Raised when an advisory lock could not be acquired within the configured wait.
 */
public class LockTimeoutException extends RuntimeException {

    public LockTimeoutException(String lockKey) {
        super("Timed out waiting for lock " + lockKey);
    }
}
