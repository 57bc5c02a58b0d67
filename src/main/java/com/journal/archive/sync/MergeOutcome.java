package com.journal.archive.sync;

import com.journal.archive.core.model.EntityRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a three-way merge between the store, a note page and the last baseline.
 *
 * @param mergedState merged field values; conflicting fields keep the store value
 * @param baseline    baseline to persist: merged values for clean fields, the previous baseline for conflicting ones
 */
public record MergeOutcome(EntityRef entity, Map<String, Object> mergedState, Map<String, Object> baseline,
                           List<FieldConflict> conflicts) {

    public MergeOutcome {
        mergedState = Collections.unmodifiableMap(new LinkedHashMap<>(mergedState));
        baseline = Collections.unmodifiableMap(new LinkedHashMap<>(baseline));
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    /**
     * Returns this outcome, or throws if any field conflicted.
     *
     * @throws MergeConflictException carrying both values of every conflicting field
     */
    public MergeOutcome orThrow() {
        if (hasConflicts()) {
            throw new MergeConflictException(entity, conflicts);
        }
        return this;
    }
}
