package com.journal.archive.audit;

import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.EntityRef;

import java.time.LocalDate;
import java.util.Objects;

/**
 * What an audit entry is about: one canonical entity, one entry date, or the
 * archive as a whole (sweeps).
 */
public record AuditSubject(EntityKind kind, Long entityId, LocalDate entryDate) {

    private static final AuditSubject ARCHIVE = new AuditSubject(null, null, null);

    public AuditSubject {
        if ((kind == null) != (entityId == null)) {
            throw new IllegalArgumentException("kind and entityId must be given together");
        }
        if (entityId != null && entryDate != null) {
            throw new IllegalArgumentException("a subject is either an entity or an entry");
        }
    }

    public static AuditSubject entity(EntityKind kind, long id) {
        return new AuditSubject(Objects.requireNonNull(kind, "kind is required"), id, null);
    }

    public static AuditSubject entity(Entity entity) {
        return entity(entity.getKind(), entity.getId());
    }

    public static AuditSubject entity(EntityRef ref) {
        return entity(ref.getKind(), ref.getId());
    }

    public static AuditSubject entry(LocalDate date) {
        return new AuditSubject(null, null, Objects.requireNonNull(date, "date is required"));
    }

    public static AuditSubject archive() {
        return ARCHIVE;
    }

    public boolean isEntity() {
        return entityId != null;
    }

    public boolean isEntry() {
        return entryDate != null;
    }

    /**
     * {@code PERSON#12}, {@code ENTRY#2024-03-01} or {@code ARCHIVE}.
     */
    @Override
    public String toString() {
        if (isEntity()) {
            return kind.name() + "#" + entityId;
        }
        return isEntry() ? "ENTRY#" + entryDate : "ARCHIVE";
    }
}
