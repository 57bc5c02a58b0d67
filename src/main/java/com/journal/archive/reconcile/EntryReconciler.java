package com.journal.archive.reconcile;

import com.journal.archive.audit.AuditAction;
import com.journal.archive.audit.AuditService;
import com.journal.archive.audit.AuditSubject;
import com.journal.archive.core.model.EntityRef;
import com.journal.archive.core.model.Entry;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.lock.DistributedLock;
import com.journal.archive.logging.LogContext;
import com.journal.archive.metrics.MetricsService;
import com.journal.archive.relation.ProcessorRegistry;
import com.journal.archive.relation.ReconcileMode;
import com.journal.archive.relation.ReconciliationContext;
import com.journal.archive.relation.ReconciliationDelta;
import com.journal.archive.relation.RelationKind;
import com.journal.archive.relation.RelationshipProcessor;
import com.journal.archive.resolve.EntityResolver;
import com.journal.archive.resolve.Resolution;
import com.journal.archive.resolve.ResolutionOutcome;
import com.journal.archive.store.Database;
import com.journal.archive.store.EntryRepository;
import com.journal.archive.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies an entry descriptor to the store in one atomic transaction.
 *
 * <p>The entry lock {@code entry:<date>} is held for the whole transaction. The
 * entry row is upserted, then every relationship processor runs in prerequisite
 * order against the same unit of work. Any exception rolls back every change
 * of this call, cache writes included.</p>
 */
public class EntryReconciler {
    private static final Logger log = LoggerFactory.getLogger(EntryReconciler.class);
    private static final String ACTOR = "reconciler";

    private final Database database;
    private final EntityResolver resolver;
    private final ProcessorRegistry processors;
    private final DistributedLock lock;
    private final MetricsService metrics;
    private final AuditService audit;
    private final Duration associationTombstoneRetention;

    public EntryReconciler(Database database, EntityResolver resolver, ProcessorRegistry processors,
                           DistributedLock lock, MetricsService metrics, AuditService audit,
                           Duration associationTombstoneRetention) {
        this.database = database;
        this.resolver = resolver;
        this.processors = processors;
        this.lock = lock;
        this.metrics = metrics;
        this.audit = audit;
        this.associationTombstoneRetention = associationTombstoneRetention;
    }

    /**
     * Reconciles every relationship kind of the entry against {@code descriptor}.
     *
     * @throws com.journal.archive.core.error.ArchiveException if any spec is invalid, ambiguous
     *                                                         or out of order; nothing is committed
     */
    public ReconciliationReport reconcile(EntryDescriptor descriptor, ReconcileMode mode) {
        Objects.requireNonNull(descriptor, "descriptor is required");
        Objects.requireNonNull(mode, "mode is required");
        return run(descriptor, mode, false);
    }

    /**
     * Removes every association of the entry, tombstones entities left without
     * references and soft-deletes the entry row.
     *
     * @return the removal report, or empty if no live entry exists for {@code date}
     */
    public Optional<ReconciliationReport> deleteEntry(LocalDate date) {
        Objects.requireNonNull(date, "date is required");
        boolean exists = database.read(conn -> new EntryRepository(conn)
                .findByDate(date)
                .filter(entry -> !entry.isDeleted())
                .isPresent());
        if (!exists) {
            log.info("reconcile.deleteSkipped entry={} reason=not-found", date);
            return Optional.empty();
        }
        return Optional.of(run(EntryDescriptor.builder(date).build(), ReconcileMode.REPLACE, true));
    }

    private ReconciliationReport run(EntryDescriptor descriptor, ReconcileMode mode, boolean delete) {
        LocalDate date = descriptor.date();
        try (LogContext ignored = LogContext.forReconcile(LogContext.generateCorrelationId(), date, mode.name())) {
            long start = System.nanoTime();
            boolean success = false;
            try {
                ReconciliationReport report = lock.withLock(DistributedLock.entryKey(date),
                        () -> reconcileLocked(descriptor, mode, delete));
                success = true;
                log.info("reconcile.completed entry={} mode={} deleted={} added={} removed={} updated={} "
                                + "created={} tombstoned={}",
                        date, mode, delete, report.totalAdded(), report.totalRemoved(), report.totalUpdated(),
                        report.created().size(), report.tombstoned().size());
                return report;
            } catch (RuntimeException e) {
                log.warn("reconcile.rolledBack entry={} mode={} error={}", date, mode, e.getMessage());
                throw e;
            } finally {
                metrics.recordReconcileDuration(mode, success, Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }

    private ReconciliationReport reconcileLocked(EntryDescriptor descriptor, ReconcileMode mode, boolean delete) {
        try (UnitOfWork uow = database.begin()) {
            String metadataDigest = uow.json().fingerprint(descriptor.metadataOnly());
            Optional<Entry> stored = uow.entries().findByDate(descriptor.date());
            boolean created = stored.isEmpty();
            boolean metadataChanged = created || !metadataDigest.equals(stored.get().metadataDigest());
            Entry entry = upsertEntry(uow, stored, descriptor, metadataDigest);

            ReconciliationContext context = new ReconciliationContext(uow, entry, descriptor, mode, resolver,
                    associationTombstoneRetention);
            Map<RelationKind, ReconciliationDelta> deltas = new LinkedHashMap<>();
            for (RelationshipProcessor<?> processor : processors.ordered()) {
                deltas.put(processor.kind(), apply(processor, context, descriptor, mode));
            }
            if (delete) {
                uow.entries().softDelete(entry.id(), uow.now());
            }

            ReconciliationReport report = new ReconciliationReport(descriptor.date(), mode, created, metadataChanged,
                    deltas,
                    refs(context.resolutions(), ResolutionOutcome.CREATED),
                    refs(context.resolutions(), ResolutionOutcome.RESURRECTED),
                    ReconciliationReport.tombstonedIn(deltas));
            uow.afterCommit(() -> recordCommitted(report, delete));
            uow.commit();
            return report;
        }
    }

    private Entry upsertEntry(UnitOfWork uow, Optional<Entry> stored, EntryDescriptor descriptor,
                              String metadataDigest) {
        if (stored.isEmpty()) {
            return uow.entries().insert(descriptor.date(), descriptor.contentDigest(), metadataDigest,
                    descriptor.wordCount(), uow.now());
        }
        Entry current = stored.get();
        String contentDigest = descriptor.contentDigest() != null ? descriptor.contentDigest() : current.contentDigest();
        boolean changed = current.isDeleted()
                || !Objects.equals(current.contentDigest(), contentDigest)
                || !Objects.equals(current.metadataDigest(), metadataDigest)
                || current.wordCount() != descriptor.wordCount();
        if (!changed) {
            return current;
        }
        uow.entries().update(current.id(), contentDigest, metadataDigest, descriptor.wordCount(), uow.now());
        return new Entry(current.id(), current.date(), contentDigest, metadataDigest, descriptor.wordCount(),
                null, current.createdAt(), uow.now());
    }

    private static <S> ReconciliationDelta apply(RelationshipProcessor<S> processor, ReconciliationContext context,
                                                 EntryDescriptor descriptor, ReconcileMode mode) {
        return processor.apply(context, processor.declaredSpecs(descriptor), mode);
    }

    private static List<EntityRef> refs(List<Resolution> resolutions, ResolutionOutcome outcome) {
        Map<Long, EntityRef> distinct = new LinkedHashMap<>();
        for (Resolution resolution : resolutions) {
            if (resolution.outcome() == outcome) {
                distinct.putIfAbsent(resolution.id(), resolution.ref());
            }
        }
        return List.copyOf(distinct.values());
    }

    private void recordCommitted(ReconciliationReport report, boolean delete) {
        report.deltas().values().forEach(delta ->
                metrics.recordAssociationChanges(delta.kind(), delta.added(), delta.removed()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mode", report.mode().name());
        details.put("added", report.totalAdded());
        details.put("removed", report.totalRemoved());
        details.put("updated", report.totalUpdated());
        details.put("tombstoned", report.tombstoned().size());
        audit.record(delete ? AuditAction.ENTRY_DELETED : AuditAction.ENTRY_RECONCILED,
                AuditSubject.entry(report.entryDate()), ACTOR, details);
    }
}
