package com.journal.archive.lock;

import com.journal.archive.core.model.EntityKind;

import java.time.LocalDate;
import java.util.function.Supplier;

/**
 * Keyed mutual exclusion used by the archive.
 *
 * <p>Two key families are in use: {@code entry:<date>} held for a whole entry
 * reconciliation, and {@code entity:<KIND>:<nameKey>} held only around the
 * resolve-or-create step and around a sweeper purge.</p>
 */
public interface DistributedLock {

    /**
     * Acquires the lock for {@code key}, blocking up to the configured timeout.
     *
     * @throws LockAcquisitionException if the lock is not acquired in time
     */
    void lock(String key);

    /**
     * Releases the lock for {@code key} if held by the current thread.
     */
    void unlock(String key);

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }

    static String entryKey(LocalDate date) {
        return "entry:" + date;
    }

    static String entityKey(EntityKind kind, String nameKey) {
        return "entity:" + kind.name() + ":" + nameKey;
    }
}
