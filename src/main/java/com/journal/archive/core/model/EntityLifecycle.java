package com.journal.archive.core.model;

/**
 * Transition table for {@link EntityStatus}.
 *
 * <pre>
 * ACTIVE --tombstone--> TOMBSTONED --purge--> PURGED
 *            TOMBSTONED --resurrect--> ACTIVE
 * </pre>
 */
public final class EntityLifecycle {

    private EntityLifecycle() {
    }

    public enum Transition {
        TOMBSTONE,
        RESURRECT,
        PURGE
    }

    /**
     * Returns the state reached by applying {@code transition} to {@code from}.
     *
     * @throws IllegalStateException if the transition is not allowed from that state
     */
    public static EntityStatus next(EntityStatus from, Transition transition) {
        EntityStatus to = switch (transition) {
            case TOMBSTONE -> from == EntityStatus.ACTIVE ? EntityStatus.TOMBSTONED : null;
            case RESURRECT -> from == EntityStatus.TOMBSTONED ? EntityStatus.ACTIVE : null;
            case PURGE -> from == EntityStatus.TOMBSTONED ? EntityStatus.PURGED : null;
        };
        if (to == null) {
            throw new IllegalStateException("Illegal lifecycle transition " + transition + " from " + from);
        }
        return to;
    }

    public static boolean canApply(EntityStatus from, Transition transition) {
        return switch (transition) {
            case TOMBSTONE -> from == EntityStatus.ACTIVE;
            case RESURRECT, PURGE -> from == EntityStatus.TOMBSTONED;
        };
    }
}
