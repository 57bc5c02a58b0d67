package com.journal.archive.metrics;

import com.journal.archive.core.model.EntityKind;
import com.journal.archive.relation.ReconcileMode;
import com.journal.archive.relation.RelationKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordReconcileDuration(ReconcileMode.REPLACE, true, Duration.ofMillis(100));
                noOp.incrementEntityCreated(EntityKind.PERSON);
                noOp.incrementEntityResurrected(EntityKind.CITY);
                noOp.incrementEntityTombstoned(EntityKind.TAG);
                noOp.incrementEntityPurged(EntityKind.TAG);
                noOp.recordAssociationChanges(RelationKind.PEOPLE, 2, 1);
                noOp.incrementMergeConflict(EntityKind.PERSON);
                noOp.incrementSweepSkipped();
                noOp.recordBatchSize(50);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record reconcile duration per mode and outcome")
        void recordReconcileDuration() {
            metrics.recordReconcileDuration(ReconcileMode.REPLACE, true, Duration.ofMillis(150));
            metrics.recordReconcileDuration(ReconcileMode.REPLACE, true, Duration.ofMillis(250));
            metrics.recordReconcileDuration(ReconcileMode.MERGE, false, Duration.ofMillis(20));

            Timer committed = registry.find("archive.reconcile.duration")
                    .tag("mode", "REPLACE")
                    .tag("outcome", "committed")
                    .timer();
            Timer rolledBack = registry.find("archive.reconcile.duration")
                    .tag("mode", "MERGE")
                    .tag("outcome", "rolled_back")
                    .timer();

            assertNotNull(committed);
            assertEquals(2, committed.count());
            assertNotNull(rolledBack);
            assertEquals(1, rolledBack.count());
        }

        @Test
        @DisplayName("Should count lifecycle transitions per kind")
        void lifecycleCounters() {
            metrics.incrementEntityCreated(EntityKind.PERSON);
            metrics.incrementEntityCreated(EntityKind.PERSON);
            metrics.incrementEntityCreated(EntityKind.CITY);
            metrics.incrementEntityTombstoned(EntityKind.PERSON);
            metrics.incrementEntityResurrected(EntityKind.PERSON);
            metrics.incrementEntityPurged(EntityKind.CITY);

            assertEquals(2.0, registry.get("archive.entity.lifecycle")
                    .tag("kind", "PERSON").tag("transition", "created").counter().count());
            assertEquals(1.0, registry.get("archive.entity.lifecycle")
                    .tag("kind", "CITY").tag("transition", "created").counter().count());
            assertEquals(1.0, registry.get("archive.entity.lifecycle")
                    .tag("kind", "PERSON").tag("transition", "tombstoned").counter().count());
            assertEquals(1.0, registry.get("archive.entity.lifecycle")
                    .tag("kind", "PERSON").tag("transition", "resurrected").counter().count());
            assertEquals(1.0, registry.get("archive.entity.lifecycle")
                    .tag("kind", "CITY").tag("transition", "purged").counter().count());
        }

        @Test
        @DisplayName("Should count association changes and skip zero deltas")
        void associationChanges() {
            metrics.recordAssociationChanges(RelationKind.PEOPLE, 3, 1);
            metrics.recordAssociationChanges(RelationKind.PEOPLE, 0, 0);
            metrics.recordAssociationChanges(RelationKind.TAGS, 0, 0);

            Counter added = registry.find("archive.association.changes")
                    .tag("relation", "PEOPLE").tag("change", "added").counter();
            Counter removed = registry.find("archive.association.changes")
                    .tag("relation", "PEOPLE").tag("change", "removed").counter();

            assertNotNull(added);
            assertEquals(3.0, added.count());
            assertNotNull(removed);
            assertEquals(1.0, removed.count());
            assertNull(registry.find("archive.association.changes").tag("relation", "TAGS").counter());
        }

        @Test
        @DisplayName("Should count merge conflicts and skipped sweeps")
        void conflictsAndSkips() {
            metrics.incrementMergeConflict(EntityKind.LOCATION);
            metrics.incrementSweepSkipped();
            metrics.incrementSweepSkipped();

            assertEquals(1.0, registry.get("archive.merge.conflicts").tag("kind", "LOCATION").counter().count());
            assertEquals(2.0, registry.get("archive.sweep.skipped").counter().count());
        }

        @Test
        @DisplayName("Should record batch sizes as distribution summary")
        void recordBatchSize() {
            metrics.recordBatchSize(10);
            metrics.recordBatchSize(20);

            DistributionSummary summary = registry.find("archive.batch.size").summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(30.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void cacheCounters() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.get("archive.cache.hit").counter().count());
            assertEquals(1.0, registry.get("archive.cache.miss").counter().count());
        }
    }
}
