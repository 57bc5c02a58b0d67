package com.journal.archive.sweep;

import com.journal.archive.core.model.EntityKind;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * What a sweep intends to do, computed from one read snapshot. Every action is
 * re-checked when the plan is executed.
 *
 * @param takenAt       snapshot time; grace periods are measured against it
 * @param candidates    entity actions in id order
 * @param expiredEntries soft-deleted entries past retention
 */
public record SweepPlan(Instant takenAt, List<Candidate> candidates, List<ExpiredEntry> expiredEntries) {

    public SweepPlan {
        candidates = List.copyOf(candidates);
        expiredEntries = List.copyOf(expiredEntries);
    }

    public enum Action {
        /** Live entity with no references. */
        TOMBSTONE,
        /** Tombstoned entity that is referenced again. */
        RESURRECT,
        /** Tombstoned entity past its grace period with no references. */
        PURGE
    }

    public record Candidate(long entityId, EntityKind kind, String name, String nameKey, Action action,
                            long references) {
    }

    public record ExpiredEntry(long entryId, LocalDate date, Instant deletedAt) {
    }

    public List<Candidate> candidates(Action action) {
        return candidates.stream().filter(c -> c.action() == action).toList();
    }

    public boolean isEmpty() {
        return candidates.isEmpty() && expiredEntries.isEmpty();
    }

    @Override
    public String toString() {
        return "SweepPlan{takenAt=" + takenAt +
                ", tombstone=" + candidates(Action.TOMBSTONE).size() +
                ", resurrect=" + candidates(Action.RESURRECT).size() +
                ", purge=" + candidates(Action.PURGE).size() +
                ", expiredEntries=" + expiredEntries.size() + '}';
    }
}
