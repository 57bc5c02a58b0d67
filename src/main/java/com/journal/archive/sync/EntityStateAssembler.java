package com.journal.archive.sync;

import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityAggregates;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.FieldOwnership;
import com.journal.archive.core.model.FieldOwnershipRegistry;
import com.journal.archive.store.AssociationRepository;
import com.journal.archive.store.EntityRepository;
import com.journal.archive.store.PoemVersionRepository;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the store-side field map of an entity: editable attributes, reference
 * fields as the referenced entity's name, and computed aggregates.
 */
public class EntityStateAssembler {

    private final FieldOwnershipRegistry ownership;

    public EntityStateAssembler(FieldOwnershipRegistry ownership) {
        this.ownership = ownership;
    }

    public Map<String, Object> storeState(Entity entity, EntityRepository entities,
                                          AssociationRepository associations, PoemVersionRepository poemVersions) {
        Map<String, Object> state = new LinkedHashMap<>();
        for (FieldOwnershipRegistry.FieldDef field : ownership.fields(entity.getKind()).values()) {
            if (field.ownership() != FieldOwnership.EDITABLE) {
                continue;
            }
            if (field.isReference()) {
                if (entity.getParentId() != null) {
                    entities.findById(entity.getParentId())
                            .ifPresent(parent -> state.put(field.name(), parent.displayKey()));
                }
            } else if (entity.getAttributes().get(field.name()) != null) {
                state.put(field.name(), entity.getAttributes().get(field.name()));
            }
        }

        EntityAggregates aggregates = EntityAggregates.of(associations.entryDates(entity.getId()));
        state.put(FieldOwnershipRegistry.MENTION_COUNT, aggregates.mentionCount());
        if (aggregates.firstAppearance() != null) {
            state.put(FieldOwnershipRegistry.FIRST_APPEARANCE, aggregates.firstAppearance().toString());
            state.put(FieldOwnershipRegistry.LAST_APPEARANCE, aggregates.lastAppearance().toString());
        }
        state.put(FieldOwnershipRegistry.ENTRIES, aggregates.entries().stream().map(LocalDate::toString).toList());
        if (entity.getKind() == EntityKind.TAG) {
            state.put(FieldOwnershipRegistry.USAGE_COUNT, aggregates.mentionCount());
        }
        if (entity.getKind() == EntityKind.POEM) {
            state.put(FieldOwnershipRegistry.VERSION_COUNT, (long) poemVersions.findForPoem(entity.getId()).size());
        }
        return state;
    }
}
