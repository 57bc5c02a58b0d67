package com.journal.archive.audit;

/**
 * Types of auditable actions in the archive.
 */
public enum AuditAction {
    ENTITY_CREATED,
    ENTITY_UPDATED,
    ENTITY_RESURRECTED,
    ENTITY_TOMBSTONED,
    ENTITY_PURGED,
    ENTITY_REKEYED,
    ENTRY_RECONCILED,
    ENTRY_DELETED,
    ENTRY_PURGED,
    SWEEP_COMPLETED,
    MERGE_APPLIED,
    MERGE_CONFLICT_DETECTED,
    MERGE_CONFLICT_RESOLVED
}
