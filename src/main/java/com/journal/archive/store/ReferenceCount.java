package com.journal.archive.store;

import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.EntityStatus;

import java.time.Instant;

/**
 * Reference count of one entity at the time it was read.
 */
public record ReferenceCount(
        long entityId,
        EntityKind kind,
        String name,
        String nameKey,
        EntityStatus status,
        Instant deletedAt,
        long references
) {
    public boolean isOrphan() {
        return references == 0;
    }
}
