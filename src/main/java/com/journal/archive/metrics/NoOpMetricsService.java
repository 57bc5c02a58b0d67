package com.journal.archive.metrics;

import com.journal.archive.core.model.EntityKind;
import com.journal.archive.relation.ReconcileMode;
import com.journal.archive.relation.RelationKind;

import java.time.Duration;

/**
 * Metrics sink that records nothing.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordReconcileDuration(ReconcileMode mode, boolean success, Duration duration) {
    }

    @Override
    public void incrementEntityCreated(EntityKind kind) {
    }

    @Override
    public void incrementEntityResurrected(EntityKind kind) {
    }

    @Override
    public void incrementEntityTombstoned(EntityKind kind) {
    }

    @Override
    public void incrementEntityPurged(EntityKind kind) {
    }

    @Override
    public void recordAssociationChanges(RelationKind kind, int added, int removed) {
    }

    @Override
    public void incrementMergeConflict(EntityKind kind) {
    }

    @Override
    public void incrementSweepSkipped() {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
