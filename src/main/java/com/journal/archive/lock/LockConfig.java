package com.journal.archive.lock;

/**
 * Configuration for keyed locks.
 *
 * @param timeoutMs maximum time to wait for lock acquisition
 * @param fair      whether waiting threads acquire in arrival order
 */
public record LockConfig(long timeoutMs, boolean fair) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout, fair ordering.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, true);
    }
}
