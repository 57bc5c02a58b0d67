package com.journal.archive.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Values derived from an entity's associations. Never stored, always recomputed.
 *
 * @param entries dates of the entries referencing the entity, oldest first
 */
public record EntityAggregates(long mentionCount, LocalDate firstAppearance, LocalDate lastAppearance,
                               List<LocalDate> entries) {

    public EntityAggregates {
        entries = List.copyOf(entries);
    }

    public static EntityAggregates of(List<LocalDate> sortedEntryDates) {
        if (sortedEntryDates.isEmpty()) {
            return new EntityAggregates(0, null, null, List.of());
        }
        return new EntityAggregates(sortedEntryDates.size(), sortedEntryDates.get(0),
                sortedEntryDates.get(sortedEntryDates.size() - 1), sortedEntryDates);
    }
}
