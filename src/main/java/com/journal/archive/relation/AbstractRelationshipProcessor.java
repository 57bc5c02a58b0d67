package com.journal.archive.relation;

import com.journal.archive.core.error.InvalidAssociationException;
import com.journal.archive.core.model.Association;
import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityRef;
import com.journal.archive.store.ArchiveStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared reconciliation algorithm for one relationship kind.
 *
 * <ol>
 *   <li>Resolve every spec to association targets before touching any association.</li>
 *   <li>Collapse duplicate targets by association key, first one wins.</li>
 *   <li>In REPLACE mode delete stored associations that are not targets.</li>
 *   <li>Insert missing targets, then update role/ordinal of kept ones.</li>
 *   <li>Tombstone entities left without any reference.</li>
 * </ol>
 *
 * @param <S> spec type
 */
public abstract class AbstractRelationshipProcessor<S> implements RelationshipProcessor<S> {
    private static final Logger log = LoggerFactory.getLogger(AbstractRelationshipProcessor.class);

    private final RelationKind kind;

    protected AbstractRelationshipProcessor(RelationKind kind) {
        this.kind = kind;
    }

    @Override
    public RelationKind kind() {
        return kind;
    }

    /**
     * Resolves one spec to the association targets it asks for. Implementations
     * may resolve (and so create) entities but must not write associations.
     */
    protected abstract List<AssociationTarget> targetsFor(ReconciliationContext context, S spec);

    /**
     * Associations currently stored for this kind.
     */
    protected List<Association> currentAssociations(ReconciliationContext context) {
        return context.uow().associations().findForEntry(context.entry().id(), kind.associationName());
    }

    /**
     * Checks the resolved targets before anything is written.
     */
    protected void validate(ReconciliationContext context, Collection<AssociationTarget> targets,
                            List<Association> current, ReconcileMode mode) {
    }

    /**
     * Called before a stored association of this kind is deleted.
     */
    protected void beforeRemove(ReconciliationContext context, Association association, Changes changes) {
    }

    /**
     * Called once the association set of this kind is in place.
     */
    protected void afterSync(ReconciliationContext context, Collection<AssociationTarget> targets,
                             ReconcileMode mode, Changes changes) {
    }

    @Override
    public final ReconciliationDelta apply(ReconciliationContext context, List<S> specs, ReconcileMode mode) {
        Map<Association.Key, AssociationTarget> desired = collect(context, specs);
        List<Association> current = currentAssociations(context);
        validate(context, desired.values(), current, mode);

        Changes changes = new Changes();
        sync(context, kind.associationName(), desired, current, mode, changes);
        context.recordTargets(kind, resultingEntities(context, desired, current, mode));
        afterSync(context, desired.values(), mode, changes);

        List<EntityRef> tombstoned = new ArrayList<>();
        for (Long entityId : changes.touched) {
            context.tombstoneIfOrphan(entityId).map(EntityRef::of).ifPresent(tombstoned::add);
        }
        ReconciliationDelta delta = new ReconciliationDelta(kind, changes.added, changes.removed, changes.updated,
                tombstoned);
        if (!delta.isEmpty()) {
            log.debug("processor.applied kind={} entry={} added={} removed={} updated={} tombstoned={}",
                    kind, context.entry().date(), delta.added(), delta.removed(), delta.updated(),
                    tombstoned.size());
        }
        return delta;
    }

    /**
     * Brings the stored associations named {@code relation} in line with {@code desired}:
     * removals first (REPLACE only), then additions, then metadata updates.
     */
    protected void sync(ReconciliationContext context, String relation,
                        Map<Association.Key, AssociationTarget> desired, List<Association> current,
                        ReconcileMode mode, Changes changes) {
        Map<Association.Key, Association> stored = new LinkedHashMap<>();
        for (Association association : current) {
            stored.put(association.key(), association);
        }

        if (mode == ReconcileMode.REPLACE) {
            for (Association association : current) {
                if (!desired.containsKey(association.key())) {
                    if (relation.equals(kind.associationName())) {
                        beforeRemove(context, association, changes);
                    }
                    remove(context, association, changes);
                }
            }
        }

        for (AssociationTarget target : desired.values()) {
            Association existing = stored.get(target.key());
            if (existing == null) {
                context.addAssociation(target.toAssociation(relation, context.entry().id()));
                changes.added++;
            } else if (!existing.sameMetadata(target.role(), target.ordinal())) {
                context.uow().associations().updateMetadata(existing.id(), target.role(), target.ordinal());
                changes.updated++;
            }
        }
    }

    /**
     * Deletes one association and marks its target for the orphan check.
     */
    protected void remove(ReconciliationContext context, Association association, Changes changes) {
        context.removeAssociation(association);
        changes.removed++;
        changes.touched.add(association.entityId());
    }

    protected InvalidAssociationException invalid(Object spec, String message) {
        return new InvalidAssociationException(kind.name(), spec, message);
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private Map<Association.Key, AssociationTarget> collect(ReconciliationContext context, List<S> specs) {
        Map<Association.Key, AssociationTarget> desired = new LinkedHashMap<>();
        for (S spec : specs) {
            if (spec == null) {
                throw invalid(null, "null spec");
            }
            List<AssociationTarget> targets;
            try {
                targets = targetsFor(context, spec);
            } catch (IllegalArgumentException e) {
                throw new InvalidAssociationException(kind.name(), spec, e.getMessage(), e);
            }
            for (AssociationTarget target : targets) {
                AssociationTarget previous = desired.putIfAbsent(target.key(), target);
                if (previous != null) {
                    log.debug("processor.duplicateSpec kind={} entity={} spec={}",
                            kind, target.entity().displayKey(), spec);
                }
            }
        }
        return desired;
    }

    private List<Entity> resultingEntities(ReconciliationContext context,
                                           Map<Association.Key, AssociationTarget> desired,
                                           List<Association> current, ReconcileMode mode) {
        Map<Long, Entity> entities = new LinkedHashMap<>();
        for (AssociationTarget target : desired.values()) {
            entities.putIfAbsent(target.entity().getId(), target.entity());
        }
        if (mode == ReconcileMode.MERGE) {
            for (Association association : current) {
                if (!entities.containsKey(association.entityId())) {
                    Entity entity = context.uow().entities().findById(association.entityId())
                            .orElseThrow(() -> new ArchiveStoreException(
                                    "Association " + association.id() + " points at missing entity "
                                            + association.entityId()));
                    entities.put(entity.getId(), entity);
                }
            }
        }
        return new ArrayList<>(entities.values());
    }

    /**
     * Running tally of one processor's changes.
     */
    protected static final class Changes {
        private int added;
        private int removed;
        private int updated;
        private final Set<Long> touched = new LinkedHashSet<>();

        public void updated() {
            updated++;
        }

        public int added() {
            return added;
        }

        public int removed() {
            return removed;
        }
    }
}
