package com.journal.archive.sweep;

import com.journal.archive.audit.AuditAction;
import com.journal.archive.audit.AuditService;
import com.journal.archive.audit.AuditSubject;
import com.journal.archive.cache.ResolutionCache;
import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityLifecycle;
import com.journal.archive.core.model.EntityStatus;
import com.journal.archive.core.model.Entry;
import com.journal.archive.lock.DistributedLock;
import com.journal.archive.logging.LogContext;
import com.journal.archive.metrics.MetricsService;
import com.journal.archive.store.Database;
import com.journal.archive.store.EntityRepository;
import com.journal.archive.store.EntryRepository;
import com.journal.archive.store.ReferenceCount;
import com.journal.archive.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background maintenance of entity lifecycles.
 *
 * <p>{@link #plan()} reads every entity's status and reference count in one
 * snapshot. {@link #execute(SweepPlan)} then re-checks each candidate under its
 * natural-key lock inside a write transaction before acting, so an entity that
 * was referenced again after the snapshot is never purged.</p>
 *
 * <p>The sweeper is never invoked by reconciliation. Only one sweep runs at a
 * time; a concurrent attempt fails.</p>
 */
public class OrphanSweeper {
    private static final Logger log = LoggerFactory.getLogger(OrphanSweeper.class);
    private static final String ACTOR = "sweeper";

    private final Database database;
    private final DistributedLock lock;
    private final ResolutionCache cache;
    private final MetricsService metrics;
    private final AuditService audit;
    private final SweepPolicy policy;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public OrphanSweeper(Database database, DistributedLock lock, ResolutionCache cache, MetricsService metrics,
                         AuditService audit, SweepPolicy policy) {
        this.database = database;
        this.lock = lock;
        this.cache = cache;
        this.metrics = metrics;
        this.audit = audit;
        this.policy = policy;
    }

    public SweepPolicy policy() {
        return policy;
    }

    /**
     * Computes the sweep candidates from a single read snapshot without changing anything.
     */
    public SweepPlan plan() {
        Instant now = database.clock().instant();
        List<ReferenceCount> snapshot = database.read(conn -> new EntityRepository(conn, database.json())
                .referenceSnapshot());
        List<Entry> deletedEntries = database.read(conn -> new EntryRepository(conn)
                .findDeletedBefore(now.minus(policy.deletedEntryRetention())));

        List<SweepPlan.Candidate> candidates = new ArrayList<>();
        for (ReferenceCount count : snapshot) {
            classify(count, now).ifPresent(action -> candidates.add(new SweepPlan.Candidate(
                    count.entityId(), count.kind(), count.name(), count.nameKey(), action, count.references())));
        }
        List<SweepPlan.ExpiredEntry> expired = deletedEntries.stream()
                .map(entry -> new SweepPlan.ExpiredEntry(entry.id(), entry.date(), entry.deletedAt()))
                .toList();
        SweepPlan plan = new SweepPlan(now, candidates, expired);
        log.info("sweep.planned entities={} plan={}", snapshot.size(), plan);
        return plan;
    }

    /**
     * Executes a plan, re-checking every candidate before acting on it.
     *
     * @throws IllegalStateException if another sweep is running
     */
    public SweepResult execute(SweepPlan plan) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A sweep is already running");
        }
        try (LogContext ignored = LogContext.forSweep(LogContext.generateCorrelationId())) {
            Tally tally = new Tally();
            List<SweepPlan.Candidate> candidates = plan.candidates();
            for (int from = 0; from < candidates.size(); from += policy.batchSize()) {
                executeBatch(candidates.subList(from, Math.min(from + policy.batchSize(), candidates.size())), tally);
            }
            housekeeping(plan, tally);

            SweepResult result = tally.toResult();
            audit.record(AuditAction.SWEEP_COMPLETED, AuditSubject.archive(), ACTOR, Map.of(
                    "tombstoned", result.tombstoned(),
                    "resurrected", result.resurrected(),
                    "purged", result.purged(),
                    "skipped", result.skipped(),
                    "entriesPurged", result.entriesPurged()));
            log.info("sweep.completed result={}", result);
            return result;
        } finally {
            running.set(false);
        }
    }

    /**
     * {@link #plan()} followed by {@link #execute(SweepPlan)}.
     */
    public SweepResult sweep() {
        return execute(plan());
    }

    public boolean isRunning() {
        return running.get();
    }

    // ========== Planning ==========

    private Optional<SweepPlan.Action> classify(ReferenceCount count, Instant now) {
        if (count.status() == EntityStatus.ACTIVE && count.isOrphan()) {
            return Optional.of(SweepPlan.Action.TOMBSTONE);
        }
        if (count.status() == EntityStatus.TOMBSTONED && !count.isOrphan()) {
            return Optional.of(SweepPlan.Action.RESURRECT);
        }
        if (count.status() == EntityStatus.TOMBSTONED && graceElapsed(count.deletedAt(), now)) {
            return Optional.of(SweepPlan.Action.PURGE);
        }
        return Optional.empty();
    }

    private boolean graceElapsed(Instant deletedAt, Instant now) {
        return deletedAt != null && !deletedAt.plus(policy.gracePeriod()).isAfter(now);
    }

    // ========== Execution ==========

    private void executeBatch(List<SweepPlan.Candidate> batch, Tally tally) {
        try (UnitOfWork uow = database.begin()) {
            List<Runnable> committed = new ArrayList<>();
            for (SweepPlan.Candidate candidate : batch) {
                lock.withLock(DistributedLock.entityKey(candidate.kind(), candidate.nameKey()),
                        () -> apply(uow, candidate, tally, committed));
            }
            committed.forEach(uow::afterCommit);
            uow.commit();
        }
    }

    private Void apply(UnitOfWork uow, SweepPlan.Candidate candidate, Tally tally, List<Runnable> committed) {
        EntityRepository repo = uow.entities();
        Optional<Entity> current = repo.findById(candidate.entityId());
        if (current.isEmpty()) {
            skip(candidate, "entity no longer exists", tally);
            return null;
        }
        Entity entity = current.get();
        long references = repo.referenceCount(entity.getId());
        AuditSubject subject = AuditSubject.entity(entity);

        switch (candidate.action()) {
            case TOMBSTONE -> {
                if (!entity.isActive() || references > 0) {
                    skip(candidate, "referenced again or no longer live", tally);
                    return null;
                }
                EntityLifecycle.next(entity.getStatus(), EntityLifecycle.Transition.TOMBSTONE);
                repo.tombstone(entity.getId(), uow.now());
                tally.tombstoned++;
                committed.add(() -> {
                    cache.invalidate(entity.getId());
                    metrics.incrementEntityTombstoned(entity.getKind());
                    audit.record(AuditAction.ENTITY_TOMBSTONED, subject, ACTOR, Map.of("reason", "orphaned"));
                });
            }
            case RESURRECT -> {
                if (!entity.isTombstoned() || references == 0) {
                    skip(candidate, "no longer tombstoned or no longer referenced", tally);
                    return null;
                }
                boolean liveTwin = repo.findByKey(entity.getKind(), entity.getNameKey(), entity.getDisambiguatorKey())
                        .stream()
                        .anyMatch(Entity::isActive);
                if (liveTwin) {
                    skip(candidate, "a live entity already holds the natural key", tally);
                    return null;
                }
                EntityLifecycle.next(entity.getStatus(), EntityLifecycle.Transition.RESURRECT);
                repo.resurrect(entity.getId(), uow.now());
                tally.resurrected++;
                committed.add(() -> {
                    metrics.incrementEntityResurrected(entity.getKind());
                    audit.record(AuditAction.ENTITY_RESURRECTED, subject, ACTOR, Map.of("references", references));
                });
            }
            case PURGE -> {
                if (!entity.isTombstoned() || references > 0 || !graceElapsed(entity.getDeletedAt(), uow.now())) {
                    skip(candidate, "referenced again or grace period not elapsed", tally);
                    return null;
                }
                EntityLifecycle.next(entity.getStatus(), EntityLifecycle.Transition.PURGE);
                repo.delete(entity.getId());
                tally.purged++;
                committed.add(() -> {
                    cache.invalidate(entity.getId());
                    metrics.incrementEntityPurged(entity.getKind());
                    audit.record(AuditAction.ENTITY_PURGED, subject, ACTOR,
                            Map.of("name", entity.displayKey()));
                });
            }
        }
        return null;
    }

    private void skip(SweepPlan.Candidate candidate, String reason, Tally tally) {
        tally.skipped++;
        metrics.incrementSweepSkipped();
        log.info("sweep.skipped entity={} kind={} action={} reason={}",
                candidate.entityId(), candidate.kind(), candidate.action(), reason);
    }

    private void housekeeping(SweepPlan plan, Tally tally) {
        try (UnitOfWork uow = database.begin()) {
            tally.associationTombstonesExpired = uow.associationTombstones().expire(uow.now());
            List<Entry> purgedEntries = new ArrayList<>();
            for (SweepPlan.ExpiredEntry expired : plan.expiredEntries()) {
                Optional<Entry> entry = uow.entries().findById(expired.entryId());
                if (entry.isPresent() && entry.get().isDeleted() && uow.entries().purge(expired.entryId())) {
                    purgedEntries.add(entry.get());
                } else {
                    log.info("sweep.entryPurgeSkipped entry={} reason=restored or still referenced", expired.date());
                    tally.skipped++;
                }
            }
            uow.afterCommit(() -> purgedEntries.forEach(entry -> audit.record(AuditAction.ENTRY_PURGED,
                    AuditSubject.entry(entry.date()), ACTOR, Map.of("deletedAt", String.valueOf(entry.deletedAt())))));
            tally.entriesPurged = purgedEntries.size();
            uow.commit();
        }
        Instant auditCutoff = database.clock().instant().minus(policy.auditRetention());
        tally.auditEntriesDeleted = audit.getRepository().deleteBefore(auditCutoff);
    }

    private static final class Tally {
        private long tombstoned;
        private long resurrected;
        private long purged;
        private long skipped;
        private long associationTombstonesExpired;
        private long entriesPurged;
        private long auditEntriesDeleted;

        SweepResult toResult() {
            return new SweepResult(tombstoned, resurrected, purged, skipped, associationTombstonesExpired,
                    entriesPurged, auditEntriesDeleted);
        }
    }
}
