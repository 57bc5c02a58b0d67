package com.journal.archive.core.model;

/**
 * Which representation owns a mutable entity field.
 */
public enum FieldOwnership {
    /**
     * Derived from associations or aggregates. Only the engine writes it;
     * note-page values are display-only.
     */
    COMPUTED,

    /**
     * Set from the note-page representation. The store keeps it as opaque payload.
     */
    EDITABLE
}
