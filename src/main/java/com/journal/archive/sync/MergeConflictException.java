package com.journal.archive.sync;

import com.journal.archive.core.error.ArchiveException;
import com.journal.archive.core.model.EntityRef;

import java.util.List;

/**
 * Raised by {@link MergeOutcome#orThrow()} when a merge left conflicting fields.
 */
public class MergeConflictException extends ArchiveException {

    private final EntityRef entity;
    private final List<FieldConflict> conflicts;

    public MergeConflictException(EntityRef entity, List<FieldConflict> conflicts) {
        super("Merge of " + entity + " has " + conflicts.size() + " conflicting field(s): "
                + conflicts.stream().map(FieldConflict::field).toList());
        this.entity = entity;
        this.conflicts = List.copyOf(conflicts);
    }

    public EntityRef getEntity() {
        return entity;
    }

    public List<FieldConflict> getConflicts() {
        return conflicts;
    }
}
