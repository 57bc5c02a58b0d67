package com.journal.archive.relation;

/**
 * How declared specs combine with the associations already stored for an entry.
 */
public enum ReconcileMode {
    /** Declared specs are the complete truth; associations not declared are removed. */
    REPLACE,
    /** Declared specs are added; nothing is removed. */
    MERGE
}
