package com.journal.archive.metrics;

import com.journal.archive.core.model.EntityKind;
import com.journal.archive.relation.ReconcileMode;
import com.journal.archive.relation.RelationKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code archive.reconcile.duration} Timer (tags: mode, outcome)</li>
 *   <li>{@code archive.entity.lifecycle} Counter (tags: kind, transition)</li>
 *   <li>{@code archive.association.changes} Counter (tags: relation, change)</li>
 *   <li>{@code archive.merge.conflicts} Counter (tag: kind)</li>
 *   <li>{@code archive.sweep.skipped} Counter</li>
 *   <li>{@code archive.batch.size} DistributionSummary</li>
 *   <li>{@code archive.cache.hit} and {@code archive.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final Counter sweepSkippedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("archive.batch.size")
                .description("Number of entries per batch reconciliation")
                .register(registry);
        this.sweepSkippedCounter = Counter.builder("archive.sweep.skipped")
                .description("Purges skipped because a reference reappeared")
                .register(registry);
        this.cacheHitCounter = Counter.builder("archive.cache.hit")
                .description("Number of resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("archive.cache.miss")
                .description("Number of resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordReconcileDuration(ReconcileMode mode, boolean success, Duration duration) {
        String outcome = success ? "committed" : "rolled_back";
        Timer timer = timerCache.computeIfAbsent(mode.name() + ":" + outcome, k ->
                Timer.builder("archive.reconcile.duration")
                        .description("Duration of entry reconciliation transactions")
                        .tag("mode", mode.name())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementEntityCreated(EntityKind kind) {
        lifecycle(kind, "created").increment();
    }

    @Override
    public void incrementEntityResurrected(EntityKind kind) {
        lifecycle(kind, "resurrected").increment();
    }

    @Override
    public void incrementEntityTombstoned(EntityKind kind) {
        lifecycle(kind, "tombstoned").increment();
    }

    @Override
    public void incrementEntityPurged(EntityKind kind) {
        lifecycle(kind, "purged").increment();
    }

    @Override
    public void recordAssociationChanges(RelationKind kind, int added, int removed) {
        if (added > 0) {
            association(kind, "added").increment(added);
        }
        if (removed > 0) {
            association(kind, "removed").increment(removed);
        }
    }

    @Override
    public void incrementMergeConflict(EntityKind kind) {
        counterCache.computeIfAbsent("conflict:" + kind.name(), k ->
                Counter.builder("archive.merge.conflicts")
                        .description("Fields flagged as conflicting during merge-back")
                        .tag("kind", kind.name())
                        .register(registry)).increment();
    }

    @Override
    public void incrementSweepSkipped() {
        sweepSkippedCounter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter lifecycle(EntityKind kind, String transition) {
        return counterCache.computeIfAbsent("lifecycle:" + kind.name() + ":" + transition, k ->
                Counter.builder("archive.entity.lifecycle")
                        .description("Entity lifecycle transitions")
                        .tag("kind", kind.name())
                        .tag("transition", transition)
                        .register(registry));
    }

    private Counter association(RelationKind kind, String change) {
        return counterCache.computeIfAbsent("association:" + kind.name() + ":" + change, k ->
                Counter.builder("archive.association.changes")
                        .description("Association rows added or removed by reconciliation")
                        .tag("relation", kind.name())
                        .tag("change", change)
                        .register(registry));
    }
}
