package com.journal.archive.relation;

import com.journal.archive.core.model.EntityRef;

import java.util.List;

/**
 * What one processor changed for one entry.
 *
 * @param added      associations inserted
 * @param removed    associations deleted
 * @param updated    kept associations whose metadata changed, plus kind-specific updates such as poem versions
 * @param tombstoned entities that lost their last reference
 */
public record ReconciliationDelta(RelationKind kind, int added, int removed, int updated, List<EntityRef> tombstoned) {

    public ReconciliationDelta {
        tombstoned = tombstoned != null ? List.copyOf(tombstoned) : List.of();
    }

    public static ReconciliationDelta empty(RelationKind kind) {
        return new ReconciliationDelta(kind, 0, 0, 0, List.of());
    }

    public boolean isEmpty() {
        return added == 0 && removed == 0 && updated == 0 && tombstoned.isEmpty();
    }

    public int changes() {
        return added + removed + updated;
    }
}
