package com.journal.archive.resolve;

/**
 * What the resolver did to produce its answer.
 */
public enum ResolutionOutcome {
    /** An existing live entity matched and nothing changed. */
    MATCHED,
    /** An existing live entity matched and its editable attributes were updated. */
    UPDATED,
    /** A tombstoned entity with the same key was brought back, keeping its id. */
    RESURRECTED,
    /** No entity matched and a new one was inserted. */
    CREATED
}
