package com.journal.archive.reconcile;

import com.journal.archive.core.model.EntityRef;
import com.journal.archive.relation.ReconcileMode;
import com.journal.archive.relation.ReconciliationDelta;
import com.journal.archive.relation.RelationKind;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one committed entry reconciliation.
 *
 * @param entryCreated    the entry row did not exist before
 * @param metadataChanged the declared metadata differs from the previous reconciliation
 * @param deltas          changes per relationship kind
 * @param created         entities created while resolving specs
 * @param resurrected     tombstoned entities brought back by a spec
 * @param tombstoned      entities that lost their last reference
 */
public record ReconciliationReport(
        LocalDate entryDate,
        ReconcileMode mode,
        boolean entryCreated,
        boolean metadataChanged,
        Map<RelationKind, ReconciliationDelta> deltas,
        List<EntityRef> created,
        List<EntityRef> resurrected,
        List<EntityRef> tombstoned
) {
    public ReconciliationReport {
        EnumMap<RelationKind, ReconciliationDelta> copy = new EnumMap<>(RelationKind.class);
        copy.putAll(deltas);
        deltas = Collections.unmodifiableMap(copy);
        created = List.copyOf(created);
        resurrected = List.copyOf(resurrected);
        tombstoned = List.copyOf(tombstoned);
    }

    /**
     * True when no association and no entity changed.
     */
    public boolean isNoop() {
        return totalChanges() == 0 && created.isEmpty() && resurrected.isEmpty() && tombstoned.isEmpty();
    }

    public ReconciliationDelta delta(RelationKind kind) {
        return deltas.getOrDefault(kind, ReconciliationDelta.empty(kind));
    }

    public int totalAdded() {
        return deltas.values().stream().mapToInt(ReconciliationDelta::added).sum();
    }

    public int totalRemoved() {
        return deltas.values().stream().mapToInt(ReconciliationDelta::removed).sum();
    }

    public int totalUpdated() {
        return deltas.values().stream().mapToInt(ReconciliationDelta::updated).sum();
    }

    public int totalChanges() {
        return totalAdded() + totalRemoved() + totalUpdated();
    }

    static List<EntityRef> tombstonedIn(Map<RelationKind, ReconciliationDelta> deltas) {
        List<EntityRef> refs = new ArrayList<>();
        deltas.values().forEach(delta -> refs.addAll(delta.tombstoned()));
        return refs;
    }

    @Override
    public String toString() {
        return "ReconciliationReport{entry=" + entryDate +
                ", mode=" + mode +
                ", added=" + totalAdded() +
                ", removed=" + totalRemoved() +
                ", updated=" + totalUpdated() +
                ", created=" + created.size() +
                ", resurrected=" + resurrected.size() +
                ", tombstoned=" + tombstoned.size() + '}';
    }
}
