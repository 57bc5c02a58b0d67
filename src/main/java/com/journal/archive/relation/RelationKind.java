package com.journal.archive.relation;

import com.journal.archive.core.model.EntityKind;

import java.util.Set;

/**
 * The relationship kinds reconciled for every entry, with the stored association
 * name, the entity kind they point at and the kinds that must be reconciled first.
 */
public enum RelationKind {
    PEOPLE("entry_person", EntityKind.PERSON),
    CITIES("entry_city", EntityKind.CITY),
    TAGS("entry_tag", EntityKind.TAG),
    THEMES("entry_theme", EntityKind.THEME),
    ARCS("entry_arc", EntityKind.ARC),
    THREADS("entry_thread", EntityKind.THREAD),
    NARRATED_DATES("entry_narrated_date", EntityKind.NARRATED_DATE),
    POEMS("entry_poem", EntityKind.POEM),
    MOTIFS("entry_motif", EntityKind.MOTIF),
    REFERENCES("entry_reference", EntityKind.REFERENCE),
    EVENT_ENTRIES("entry_event", EntityKind.EVENT),
    LOCATIONS("entry_location", EntityKind.LOCATION),
    SCENES("entry_scene", EntityKind.SCENE),
    EVENT_SCENES("scene_event", EntityKind.EVENT);

    private final String associationName;
    private final EntityKind targetKind;

    RelationKind(String associationName, EntityKind targetKind) {
        this.associationName = associationName;
        this.targetKind = targetKind;
    }

    public String associationName() {
        return associationName;
    }

    public EntityKind targetKind() {
        return targetKind;
    }

    /**
     * Kinds whose reconciliation must complete before this one runs.
     */
    public Set<RelationKind> prerequisites() {
        return switch (this) {
            case LOCATIONS -> Set.of(CITIES);
            case SCENES -> Set.of(PEOPLE, LOCATIONS, NARRATED_DATES);
            case EVENT_SCENES -> Set.of(SCENES, EVENT_ENTRIES);
            default -> Set.of();
        };
    }
}
