package com.journal.archive.core.model;

/**
 * The fixed set of canonical entity kinds tracked by the archive.
 */
public enum EntityKind {
    PERSON("Person"),
    CITY("City"),
    LOCATION("Location"),
    EVENT("Event"),
    TAG("Tag"),
    THEME("Theme"),
    POEM("Poem"),
    REFERENCE_SOURCE("Reference Source"),
    REFERENCE("Reference"),
    NARRATED_DATE("Narrated Date"),
    SCENE("Scene"),
    THREAD("Thread"),
    ARC("Arc"),
    MOTIF("Motif");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
