package com.journal.archive.relation;

import com.journal.archive.core.model.Association;
import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.Entry;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.resolve.EntityDescriptor;
import com.journal.archive.resolve.EntityResolver;
import com.journal.archive.resolve.Resolution;
import com.journal.archive.store.UnitOfWork;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State shared by the processors of one entry reconciliation: the open unit of
 * work, the entry row, the declared descriptor and what earlier processors produced.
 */
public class ReconciliationContext {

    private final UnitOfWork uow;
    private final Entry entry;
    private final EntryDescriptor descriptor;
    private final ReconcileMode mode;
    private final EntityResolver resolver;
    private final Duration associationTombstoneRetention;
    private final Map<RelationKind, List<Entity>> targets = new EnumMap<>(RelationKind.class);
    private final List<Resolution> resolutions = new ArrayList<>();

    public ReconciliationContext(UnitOfWork uow, Entry entry, EntryDescriptor descriptor, ReconcileMode mode,
                                 EntityResolver resolver, Duration associationTombstoneRetention) {
        this.uow = uow;
        this.entry = entry;
        this.descriptor = descriptor;
        this.mode = mode;
        this.resolver = resolver;
        this.associationTombstoneRetention = associationTombstoneRetention;
    }

    public UnitOfWork uow() {
        return uow;
    }

    public Entry entry() {
        return entry;
    }

    public EntryDescriptor descriptor() {
        return descriptor;
    }

    public ReconcileMode mode() {
        return mode;
    }

    // ========== Entities ==========

    public Resolution resolve(EntityKind kind, EntityDescriptor entityDescriptor) {
        Resolution resolution = resolver.resolve(uow, kind, entityDescriptor);
        resolutions.add(resolution);
        return resolution;
    }

    public Optional<Entity> find(EntityKind kind, EntityDescriptor entityDescriptor) {
        return resolver.find(uow, kind, entityDescriptor);
    }

    public String normalize(EntityKind kind, String value) {
        return resolver.naturalKey(kind, value, null).nameKey();
    }

    /**
     * Every resolution performed so far, in order.
     */
    public List<Resolution> resolutions() {
        return List.copyOf(resolutions);
    }

    Optional<Entity> tombstoneIfOrphan(long entityId) {
        return resolver.tombstoneIfOrphan(uow, entityId);
    }

    // ========== Associations ==========

    Association addAssociation(Association association) {
        Association inserted = uow.associations().insert(association, uow.now());
        uow.associationTombstones().clear(inserted);
        return inserted;
    }

    void removeAssociation(Association association) {
        uow.associations().delete(association.id());
        uow.associationTombstones().record(association, uow.now(), uow.now().plus(associationTombstoneRetention));
    }

    // ========== Results of earlier processors ==========

    void recordTargets(RelationKind kind, List<Entity> entities) {
        targets.put(kind, List.copyOf(entities));
    }

    /**
     * Entities associated through {@code kind} once its processor has run.
     *
     * @throws IllegalStateException if {@code kind} has not been reconciled yet
     */
    public List<Entity> targets(RelationKind kind) {
        List<Entity> result = targets.get(kind);
        if (result == null) {
            throw new IllegalStateException(kind + " has not been reconciled yet");
        }
        return result;
    }

    /**
     * Entities of {@code kind} referred to by {@code reference}, matched on the
     * normalized name or the normalized {@code "name (disambiguator)"} form.
     */
    public List<Entity> matchTargets(RelationKind kind, String reference) {
        EntityKind entityKind = kind.targetKind();
        String key = normalize(entityKind, reference);
        List<Entity> byDisplayKey = targets(kind).stream()
                .filter(e -> normalize(entityKind, e.displayKey()).equals(key))
                .toList();
        if (!byDisplayKey.isEmpty()) {
            return byDisplayKey;
        }
        return targets(kind).stream()
                .filter(e -> e.getNameKey().equals(key))
                .toList();
    }
}
