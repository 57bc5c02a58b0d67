package com.journal.archive.resolve;

import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityRef;

/**
 * Result of resolving a descriptor.
 */
public record Resolution(Entity entity, ResolutionOutcome outcome) {

    public EntityRef ref() {
        return EntityRef.of(entity);
    }

    public long id() {
        return entity.getId();
    }

    public boolean isNewEntity() {
        return outcome == ResolutionOutcome.CREATED;
    }
}
