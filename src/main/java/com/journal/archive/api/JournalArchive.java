package com.journal.archive.api;

import com.journal.archive.audit.AuditService;
import com.journal.archive.audit.InMemoryAuditRepository;
import com.journal.archive.bulk.DescriptorReadResult;
import com.journal.archive.bulk.EntryDescriptorReader;
import com.journal.archive.bulk.ProgressCallback;
import com.journal.archive.cache.ResolutionCache;
import com.journal.archive.config.ArchiveConfig;
import com.journal.archive.core.model.EntityRef;
import com.journal.archive.core.model.FieldOwnershipRegistry;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.lock.DistributedLock;
import com.journal.archive.lock.LocalDistributedLock;
import com.journal.archive.metrics.MetricsService;
import com.journal.archive.metrics.NoOpMetricsService;
import com.journal.archive.reconcile.BatchReconciler;
import com.journal.archive.reconcile.BatchResult;
import com.journal.archive.reconcile.EntryReconciler;
import com.journal.archive.reconcile.ReconciliationReport;
import com.journal.archive.relation.ProcessorRegistry;
import com.journal.archive.relation.ReconcileMode;
import com.journal.archive.resolve.EntityResolver;
import com.journal.archive.rules.DefaultNormalizationRules;
import com.journal.archive.rules.NormalizationEngine;
import com.journal.archive.store.Database;
import com.journal.archive.store.JsonCodec;
import com.journal.archive.store.StoreConfig;
import com.journal.archive.sweep.OrphanSweeper;
import com.journal.archive.sweep.SweepPlan;
import com.journal.archive.sweep.SweepResult;
import com.journal.archive.sync.EntityStateAssembler;
import com.journal.archive.sync.MergeOutcome;
import com.journal.archive.sync.SyncArbiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the journal archive: wires the store, resolver, processors,
 * reconciler, sweeper and sync arbiter behind one object.
 *
 * <pre>
 * try (JournalArchive archive = JournalArchive.builder().databaseFile(path).build()) {
 *     archive.reconcile(descriptor, ReconcileMode.REPLACE);
 *     archive.sweep();
 * }
 * </pre>
 */
public class JournalArchive implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JournalArchive.class);

    private final ArchiveConfig config;
    private final Database database;
    private final EntityResolver resolver;
    private final EntryReconciler reconciler;
    private final BatchReconciler batchReconciler;
    private final OrphanSweeper sweeper;
    private final SyncArbiter arbiter;
    private final ArchiveReader reader;
    private final EntryDescriptorReader descriptorReader;
    private final ResolutionCache cache;
    private final MetricsService metricsService;
    private final AuditService auditService;

    private JournalArchive(Builder builder) {
        this.config = builder.config;
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        JsonCodec json = new JsonCodec();
        this.database = new Database(config.store(), clock, json);

        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditService != null
                ? builder.auditService : new AuditService(new InMemoryAuditRepository(), clock);

        // Cache and lock
        this.cache = builder.resolutionCache != null ? builder.resolutionCache : config.cache().newCache();
        DistributedLock lock = builder.distributedLock != null
                ? builder.distributedLock : new LocalDistributedLock(config.lock());

        NormalizationEngine normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        FieldOwnershipRegistry ownership = builder.ownership != null
                ? builder.ownership : FieldOwnershipRegistry.defaults();
        ProcessorRegistry processors = builder.processors != null
                ? builder.processors : ProcessorRegistry.defaults();

        this.resolver = new EntityResolver(normalizationEngine, ownership, lock, cache, metricsService, auditService);
        this.reconciler = new EntryReconciler(database, resolver, processors, lock, metricsService, auditService,
                config.sweep().associationTombstoneRetention());
        this.batchReconciler = new BatchReconciler(reconciler, metricsService, config.batchParallelism());
        this.sweeper = new OrphanSweeper(database, lock, cache, metricsService, auditService, config.sweep());
        this.arbiter = new SyncArbiter(database, resolver, ownership, lock, cache, metricsService, auditService);
        this.reader = new ArchiveReader(database, resolver, new EntityStateAssembler(ownership));
        this.descriptorReader = new EntryDescriptorReader(json.mapper());

        log.info("archive.initialized url={} parallelism={}", config.store().jdbcUrl(), config.batchParallelism());
    }

    // ========== Reconciliation API ==========

    public ReconciliationReport reconcile(EntryDescriptor descriptor, ReconcileMode mode) {
        return reconciler.reconcile(descriptor, mode);
    }

    public Optional<ReconciliationReport> deleteEntry(LocalDate date) {
        return reconciler.deleteEntry(date);
    }

    public BatchResult reconcileAll(List<EntryDescriptor> descriptors, ReconcileMode mode) {
        return batchReconciler.reconcileAll(descriptors, mode);
    }

    public BatchResult reconcileAll(List<EntryDescriptor> descriptors, ReconcileMode mode,
                                    ProgressCallback callback) {
        return batchReconciler.reconcileAll(descriptors, mode, callback);
    }

    /**
     * Parses descriptors from JSON and reconciles the valid ones. Records that fail
     * to parse are reported in the returned read result and skipped.
     */
    public ImportOutcome importJson(InputStream input, ReconcileMode mode) {
        DescriptorReadResult parsed = descriptorReader.read(input);
        if (parsed.hasErrors()) {
            log.warn("archive.importParseErrors count={}", parsed.errors().size());
        }
        return new ImportOutcome(parsed, batchReconciler.reconcileAll(parsed.descriptors(), mode));
    }

    // ========== Sweep API ==========

    public SweepPlan planSweep() {
        return sweeper.plan();
    }

    public SweepResult executeSweep(SweepPlan plan) {
        return sweeper.execute(plan);
    }

    public SweepResult sweep() {
        return sweeper.sweep();
    }

    // ========== Sync API ==========

    public MergeOutcome merge(EntityRef entity, Map<String, Object> storeState, Map<String, Object> noteState) {
        return arbiter.merge(entity, storeState, noteState);
    }

    public MergeOutcome mergeBack(EntityRef entity, Map<String, Object> noteState) {
        return arbiter.mergeBack(entity, noteState);
    }

    public void resolveConflict(EntityRef entity, String field, Object value) {
        arbiter.resolveConflict(entity, field, value);
    }

    // ========== Access ==========

    public ArchiveReader reader() {
        return reader;
    }

    public SyncArbiter arbiter() {
        return arbiter;
    }

    public OrphanSweeper sweeper() {
        return sweeper;
    }

    public EntityResolver resolver() {
        return resolver;
    }

    public Database database() {
        return database;
    }

    public ResolutionCache cache() {
        return cache;
    }

    public MetricsService metrics() {
        return metricsService;
    }

    public AuditService audit() {
        return auditService;
    }

    public ArchiveConfig config() {
        return config;
    }

    @Override
    public void close() {
        batchReconciler.close();
        log.info("archive.closed url={}", config.store().jdbcUrl());
    }

    /**
     * Descriptors parsed from a JSON import together with the batch that reconciled them.
     */
    public record ImportOutcome(DescriptorReadResult parsed, BatchResult batch) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ArchiveConfig config;
        private Clock clock;
        private NormalizationEngine normalizationEngine;
        private FieldOwnershipRegistry ownership;
        private ProcessorRegistry processors;
        private ResolutionCache resolutionCache;
        private DistributedLock distributedLock;
        private MetricsService metricsService;
        private AuditService auditService;

        public Builder config(ArchiveConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Default configuration on the given SQLite file.
         */
        public Builder databaseFile(Path file) {
            this.config = ArchiveConfig.defaults(StoreConfig.forFile(file));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine engine) {
            this.normalizationEngine = engine;
            return this;
        }

        public Builder fieldOwnership(FieldOwnershipRegistry ownership) {
            this.ownership = ownership;
            return this;
        }

        public Builder processors(ProcessorRegistry processors) {
            this.processors = processors;
            return this;
        }

        public Builder cache(ResolutionCache cache) {
            this.resolutionCache = cache;
            return this;
        }

        public Builder distributedLock(DistributedLock lock) {
            this.distributedLock = lock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public JournalArchive build() {
            if (config == null) {
                throw new IllegalStateException("config or databaseFile is required");
            }
            return new JournalArchive(this);
        }
    }
}
