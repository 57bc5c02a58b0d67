package com.journal.archive.sweep;

/**
 * Counts of what one sweep actually did.
 *
 * @param skipped candidates whose state changed between plan and execution
 */
public record SweepResult(
        long tombstoned,
        long resurrected,
        long purged,
        long skipped,
        long associationTombstonesExpired,
        long entriesPurged,
        long auditEntriesDeleted
) {
    public static SweepResult empty() {
        return new SweepResult(0, 0, 0, 0, 0, 0, 0);
    }

    public long totalChanges() {
        return tombstoned + resurrected + purged + associationTombstonesExpired + entriesPurged;
    }

    @Override
    public String toString() {
        return "SweepResult{tombstoned=" + tombstoned +
                ", resurrected=" + resurrected +
                ", purged=" + purged +
                ", skipped=" + skipped +
                ", associationTombstonesExpired=" + associationTombstonesExpired +
                ", entriesPurged=" + entriesPurged +
                ", auditEntriesDeleted=" + auditEntriesDeleted + '}';
    }
}
