package com.journal.archive.sync;

import com.journal.archive.audit.AuditAction;
import com.journal.archive.audit.AuditService;
import com.journal.archive.audit.AuditSubject;
import com.journal.archive.cache.ResolutionCache;
import com.journal.archive.core.error.ArchiveException;
import com.journal.archive.core.error.InvalidAssociationException;
import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.EntityRef;
import com.journal.archive.core.model.FieldOwnership;
import com.journal.archive.core.model.FieldOwnershipRegistry;
import com.journal.archive.lock.DistributedLock;
import com.journal.archive.logging.LogContext;
import com.journal.archive.metrics.MetricsService;
import com.journal.archive.resolve.EntityDescriptor;
import com.journal.archive.resolve.EntityResolver;
import com.journal.archive.resolve.NaturalKey;
import com.journal.archive.store.Database;
import com.journal.archive.store.JsonCodec;
import com.journal.archive.store.SyncStateRepository;
import com.journal.archive.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconciles an entity's store state with the state edited on its note page.
 *
 * <p>A three-way merge against the baseline persisted at the last successful
 * merge decides each field:</p>
 * <ul>
 *   <li>computed fields always take the store value;</li>
 *   <li>editable fields take the note value unless both sides changed to
 *       different values, which is a conflict and keeps the store value;</li>
 *   <li>without a baseline the store counts as unchanged, so the note wins.</li>
 * </ul>
 * <p>The baseline then advances for every field that did not conflict.</p>
 */
public class SyncArbiter {
    private static final Logger log = LoggerFactory.getLogger(SyncArbiter.class);
    private static final String ACTOR = "sync";

    private final Database database;
    private final EntityResolver resolver;
    private final FieldOwnershipRegistry ownership;
    private final EntityStateAssembler assembler;
    private final DistributedLock lock;
    private final ResolutionCache cache;
    private final MetricsService metrics;
    private final AuditService audit;

    public SyncArbiter(Database database, EntityResolver resolver, FieldOwnershipRegistry ownership,
                       DistributedLock lock, ResolutionCache cache, MetricsService metrics, AuditService audit) {
        this.database = database;
        this.resolver = resolver;
        this.ownership = ownership;
        this.assembler = new EntityStateAssembler(ownership);
        this.lock = lock;
        this.cache = cache;
        this.metrics = metrics;
        this.audit = audit;
    }

    /**
     * Merges the two states against the persisted baseline without writing anything.
     */
    public MergeOutcome merge(EntityRef ref, Map<String, Object> storeState, Map<String, Object> noteState) {
        Optional<Map<String, Object>> baseline = database.read(conn ->
                new SyncStateRepository(conn, database.json()).find(ref.getId()))
                .map(SyncStateRepository.SyncState::baseline);
        return threeWay(ref, baseline, storeState, noteState);
    }

    /**
     * Loads the store state, merges the note state into it, applies the merged
     * editable values and advances the baseline, all in one transaction.
     * Conflicts are persisted and returned, not thrown.
     *
     * @throws InvalidAssociationException if a changed reference field would re-key
     *                                     the entity onto an existing one
     */
    public MergeOutcome mergeBack(EntityRef ref, Map<String, Object> noteState) {
        Objects.requireNonNull(noteState, "noteState is required");
        try (LogContext ignored = LogContext.forMerge(LogContext.generateCorrelationId(), ref.getKind().name(),
                ref.getId());
             UnitOfWork uow = database.begin()) {
            Entity entity = liveEntity(uow, ref);
            MergeOutcome outcome = lock.withLock(DistributedLock.entityKey(entity.getKind(), entity.getNameKey()),
                    () -> mergeLocked(uow, ref, entity, noteState));
            uow.commit();
            log.info("merge.completed entity={} conflicts={}", ref, outcome.conflicts().size());
            return outcome;
        }
    }

    /**
     * Open conflicts across all entities, oldest first.
     */
    public List<SyncStateRepository.StoredConflict> openConflicts() {
        return database.read(conn -> new SyncStateRepository(conn, database.json()).openConflicts());
    }

    public List<SyncStateRepository.StoredConflict> openConflicts(EntityRef ref) {
        return database.read(conn -> new SyncStateRepository(conn, database.json()).openConflicts(ref.getId()));
    }

    /**
     * Settles an open conflict by writing {@code value} to the store and the baseline.
     *
     * @throws IllegalArgumentException if {@code field} is not editable for the entity's kind
     * @throws IllegalStateException    if the field has no open conflict
     */
    public void resolveConflict(EntityRef ref, String field, Object value) {
        if (!ownership.isEditable(ref.getKind(), field)) {
            throw new IllegalArgumentException(field + " is not an editable field of " + ref.getKind());
        }
        try (LogContext ignored = LogContext.forMerge(LogContext.generateCorrelationId(), ref.getKind().name(),
                ref.getId());
             UnitOfWork uow = database.begin()) {
            Entity entity = liveEntity(uow, ref);
            lock.withLock(DistributedLock.entityKey(entity.getKind(), entity.getNameKey()), () -> {
                if (uow.syncStates().resolveConflicts(entity.getId(), field, uow.now()) == 0) {
                    throw new IllegalStateException("No open conflict on " + ref + "." + field);
                }
                Map<String, Object> values = new LinkedHashMap<>();
                values.put(field, value);
                applyEditable(uow, entity, values);
                Map<String, Object> baseline = new LinkedHashMap<>(uow.syncStates().find(entity.getId())
                        .map(SyncStateRepository.SyncState::baseline)
                        .orElse(Map.of()));
                putOrRemove(baseline, field, value);
                uow.syncStates().save(entity.getId(), baseline, uow.now());
                return null;
            });
            uow.afterCommit(() -> audit.record(AuditAction.MERGE_CONFLICT_RESOLVED, AuditSubject.entity(ref), ACTOR,
                    Map.of("field", field)));
            uow.commit();
            log.info("merge.conflictResolved entity={} field={}", ref, field);
        }
    }

    // ========== Merge ==========

    private MergeOutcome mergeLocked(UnitOfWork uow, EntityRef ref, Entity entity, Map<String, Object> noteState) {
        Map<String, Object> storeState = assembler.storeState(entity, uow.entities(), uow.associations(),
                uow.poemVersions());
        Optional<Map<String, Object>> baseline = uow.syncStates().find(entity.getId())
                .map(SyncStateRepository.SyncState::baseline);
        MergeOutcome outcome = threeWay(ref, baseline, storeState, noteState);

        Map<String, Object> changed = new LinkedHashMap<>();
        for (String field : ownership.editableFields(entity.getKind())) {
            Object merged = outcome.mergedState().get(field);
            if (!same(uow.json(), merged, storeState.get(field))) {
                changed.put(field, merged);
            }
        }
        applyEditable(uow, entity, changed);

        // this merge supersedes every conflict left open by earlier ones
        for (String field : ownership.editableFields(entity.getKind())) {
            uow.syncStates().resolveConflicts(entity.getId(), field, uow.now());
        }
        for (FieldConflict conflict : outcome.conflicts()) {
            uow.syncStates().insertConflict(entity.getId(), conflict.field(), conflict.storeValue(),
                    conflict.noteValue(), conflict.baselineValue(), uow.now());
        }
        uow.syncStates().save(entity.getId(), outcome.baseline(), uow.now());

        uow.afterCommit(() -> {
            outcome.conflicts().forEach(c -> metrics.incrementMergeConflict(entity.getKind()));
            audit.record(AuditAction.MERGE_APPLIED, AuditSubject.entity(ref), ACTOR, Map.of("changed", List.copyOf(changed.keySet())));
            if (outcome.hasConflicts()) {
                audit.record(AuditAction.MERGE_CONFLICT_DETECTED, AuditSubject.entity(ref), ACTOR,
                        Map.of("fields", outcome.conflicts().stream().map(FieldConflict::field).toList()));
            }
        });
        return outcome;
    }

    MergeOutcome threeWay(EntityRef ref, Optional<Map<String, Object>> baseline, Map<String, Object> storeState,
                          Map<String, Object> noteState) {
        JsonCodec json = database.json();
        Map<String, Object> base = baseline.orElse(Map.of());
        Map<String, Object> merged = new LinkedHashMap<>();
        Map<String, Object> nextBaseline = new LinkedHashMap<>();
        List<FieldConflict> conflicts = new ArrayList<>();

        for (String field : noteState.keySet()) {
            if (ownership.field(ref.getKind(), field).isEmpty()) {
                log.debug("merge.ignoredField entity={} field={}", ref, field);
            }
        }

        for (FieldOwnershipRegistry.FieldDef def : ownership.fields(ref.getKind()).values()) {
            String field = def.name();
            Object store = storeState.get(field);
            if (def.ownership() == FieldOwnership.COMPUTED) {
                putOrRemove(merged, field, store);
                continue;
            }
            Object note = noteState.get(field);
            Object base0 = base.get(field);
            boolean storeChanged = baseline.isPresent() && !same(json, store, base0);
            boolean noteChanged = !same(json, note, base0);

            Object value;
            if (!noteChanged) {
                value = store;
            } else if (!storeChanged || same(json, store, note)) {
                value = note;
            } else {
                conflicts.add(new FieldConflict(field, store, note, base0));
                putOrRemove(merged, field, store);
                putOrRemove(nextBaseline, field, base0);
                continue;
            }
            putOrRemove(merged, field, value);
            putOrRemove(nextBaseline, field, value);
        }
        if (!conflicts.isEmpty()) {
            log.warn("merge.conflicts entity={} fields={}", ref, conflicts.stream().map(FieldConflict::field).toList());
        }
        return new MergeOutcome(ref, merged, nextBaseline, conflicts);
    }

    // ========== Applying ==========

    private void applyEditable(UnitOfWork uow, Entity entity, Map<String, Object> values) {
        Map<String, Object> attributes = new LinkedHashMap<>(entity.getAttributes());
        boolean attributesChanged = false;
        for (Map.Entry<String, Object> change : values.entrySet()) {
            FieldOwnershipRegistry.FieldDef def = ownership.field(entity.getKind(), change.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown field " + change.getKey()));
            if (def.isReference()) {
                rekey(uow, entity, def, change.getValue());
            } else {
                putOrRemove(attributes, def.name(), change.getValue());
                attributesChanged = true;
            }
        }
        if (attributesChanged) {
            uow.entities().updateAttributes(entity.getId(), attributes, uow.now());
        }
    }

    /**
     * Points the entity at a different parent named by a reference field and
     * re-keys it, since the parent is part of its natural key.
     */
    private void rekey(UnitOfWork uow, Entity entity, FieldOwnershipRegistry.FieldDef def, Object value) {
        if (value == null || value.toString().isBlank()) {
            throw new InvalidAssociationException(def.name(), value,
                    entity.getKind().getLabel() + " requires a " + def.name());
        }
        EntityKind parentKind = def.referenceKind();
        Entity parent = resolver.resolve(uow, parentKind, EntityDescriptor.fromDisplayKey(value.toString())).entity();
        if (Objects.equals(parent.getId(), entity.getParentId())) {
            return;
        }
        NaturalKey key = resolver.naturalKey(entity.getKind(), entity.getName(), parent.displayKey());
        boolean collides = uow.entities().findByKey(entity.getKind(), key.nameKey(), key.disambiguatorKey()).stream()
                .anyMatch(other -> other.isActive() && other.getId() != entity.getId());
        if (collides) {
            throw new InvalidAssociationException(def.name(), value, entity.getKind().getLabel() + " '"
                    + entity.getName() + "' already exists under " + parent.displayKey());
        }
        Long previousParent = entity.getParentId();
        uow.entities().updateKey(entity.getId(), parent.displayKey(), key.disambiguatorKey(), parent.getId(),
                uow.now());
        cache.invalidate(entity.getId());
        if (previousParent != null) {
            resolver.tombstoneIfOrphan(uow, previousParent);
        }
        uow.afterCommit(() -> audit.record(AuditAction.ENTITY_REKEYED, AuditSubject.entity(entity), ACTOR,
                Map.of(def.name(), parent.displayKey())));
        log.info("merge.rekeyed entity={} {}={}", entity, def.name(), parent.displayKey());
    }

    // ========== Helpers ==========

    private Entity liveEntity(UnitOfWork uow, EntityRef ref) {
        Entity entity = uow.entities().findById(ref.getId())
                .orElseThrow(() -> new ArchiveException("Unknown entity " + ref));
        if (entity.getKind() != ref.getKind()) {
            throw new ArchiveException("Entity " + ref.getId() + " is a " + entity.getKind() + ", not " + ref.getKind());
        }
        if (!entity.isActive()) {
            throw new ArchiveException("Entity " + ref + " is tombstoned");
        }
        return entity;
    }

    private static boolean same(JsonCodec json, Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        return json.write(a).equals(json.write(b));
    }

    private static void putOrRemove(Map<String, Object> map, String key, Object value) {
        if (value == null) {
            map.remove(key);
        } else {
            map.put(key, value);
        }
    }
}
