package com.journal.archive.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process keyed lock backed by one {@link ReentrantLock} per key.
 * Re-entrant, so nested acquisition of the same key by one thread is allowed.
 * A key's lock is dropped once no thread holds or waits for it.
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String key) {
        KeyLock keyLock = locks.compute(key, (k, existing) -> {
            KeyLock entry = existing != null ? existing : new KeyLock(new ReentrantLock(config.fair()));
            entry.users++;
            return entry;
        });
        try {
            if (!keyLock.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                release(key, keyLock);
                throw new LockAcquisitionException(
                        "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.trace("lock.acquired key={}", key);
        } catch (InterruptedException e) {
            release(key, keyLock);
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
    }

    @Override
    public void unlock(String key) {
        KeyLock keyLock = locks.get(key);
        if (keyLock != null && keyLock.lock.isHeldByCurrentThread()) {
            keyLock.lock.unlock();
            release(key, keyLock);
            log.trace("lock.released key={}", key);
        }
    }

    /**
     * Whether any thread currently holds {@code key}.
     */
    public boolean isLocked(String key) {
        KeyLock keyLock = locks.get(key);
        return keyLock != null && keyLock.lock.isLocked();
    }

    /**
     * Number of keys currently held or awaited.
     */
    int activeKeys() {
        return locks.size();
    }

    private void release(String key, KeyLock keyLock) {
        locks.computeIfPresent(key, (k, existing) -> {
            if (existing != keyLock) {
                return existing;
            }
            existing.users--;
            return existing.users == 0 ? null : existing;
        });
    }

    /**
     * A key's lock and the number of acquisitions, pending or held, not yet released.
     * The count is only touched inside the map's per-key compute.
     */
    private static final class KeyLock {
        private final ReentrantLock lock;
        private int users;

        private KeyLock(ReentrantLock lock) {
            this.lock = lock;
        }
    }
}
