package com.journal.archive.sweep;

import java.time.Duration;
import java.util.Objects;

/**
 * Retention settings applied by the {@link OrphanSweeper}.
 *
 * @param gracePeriod                   how long an entity stays tombstoned before it may be purged
 * @param associationTombstoneRetention how long removed associations are remembered
 * @param deletedEntryRetention         how long a soft-deleted entry is kept before it may be purged
 * @param auditRetention                how long audit entries are kept
 * @param batchSize                     maximum number of candidates handled in one transaction
 */
public record SweepPolicy(
        Duration gracePeriod,
        Duration associationTombstoneRetention,
        Duration deletedEntryRetention,
        Duration auditRetention,
        int batchSize
) {
    public SweepPolicy {
        Objects.requireNonNull(gracePeriod, "gracePeriod is required");
        Objects.requireNonNull(associationTombstoneRetention, "associationTombstoneRetention is required");
        Objects.requireNonNull(deletedEntryRetention, "deletedEntryRetention is required");
        Objects.requireNonNull(auditRetention, "auditRetention is required");
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative");
        }
        if (associationTombstoneRetention.isNegative()) {
            throw new IllegalArgumentException("associationTombstoneRetention must not be negative");
        }
        if (deletedEntryRetention.isNegative()) {
            throw new IllegalArgumentException("deletedEntryRetention must not be negative");
        }
        if (auditRetention.isNegative()) {
            throw new IllegalArgumentException("auditRetention must not be negative");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
    }

    /**
     * Default policy.
     * - Tombstone grace period: 30 days
     * - Association tombstones: 90 days
     * - Soft-deleted entries: 30 days
     * - Audit entries: 365 days
     * - 500 candidates per transaction
     */
    public static SweepPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration gracePeriod = Duration.ofDays(30);
        private Duration associationTombstoneRetention = Duration.ofDays(90);
        private Duration deletedEntryRetention = Duration.ofDays(30);
        private Duration auditRetention = Duration.ofDays(365);
        private int batchSize = 500;

        public Builder gracePeriod(Duration duration) {
            this.gracePeriod = duration;
            return this;
        }

        public Builder associationTombstoneRetention(Duration duration) {
            this.associationTombstoneRetention = duration;
            return this;
        }

        public Builder deletedEntryRetention(Duration duration) {
            this.deletedEntryRetention = duration;
            return this;
        }

        public Builder auditRetention(Duration duration) {
            this.auditRetention = duration;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public SweepPolicy build() {
            return new SweepPolicy(gracePeriod, associationTombstoneRetention, deletedEntryRetention,
                    auditRetention, batchSize);
        }
    }
}
