package com.journal.archive.core.model;

/**
 * Lifecycle state of a canonical entity.
 *
 * @see EntityLifecycle
 */
public enum EntityStatus {
    /**
     * Referenced by at least one entry, or newly created.
     */
    ACTIVE,

    /**
     * Lost its last reference. Carries a deletion timestamp and waits out the grace period.
     */
    TOMBSTONED,

    /**
     * Physically removed by the sweeper. Never stored; only reported.
     */
    PURGED
}
