package com.journal.archive.metrics;

import com.journal.archive.core.model.EntityKind;
import com.journal.archive.relation.ReconcileMode;
import com.journal.archive.relation.RelationKind;

import java.time.Duration;

/**
 * Abstraction over metrics collection for the archive engine.
 * {@link NoOpMetricsService} is the default; {@link MicrometerMetricsService}
 * publishes to a Micrometer registry.
 */
public interface MetricsService {

    void recordReconcileDuration(ReconcileMode mode, boolean success, Duration duration);

    void incrementEntityCreated(EntityKind kind);

    void incrementEntityResurrected(EntityKind kind);

    void incrementEntityTombstoned(EntityKind kind);

    void incrementEntityPurged(EntityKind kind);

    void recordAssociationChanges(RelationKind kind, int added, int removed);

    void incrementMergeConflict(EntityKind kind);

    void incrementSweepSkipped();

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
