package com.journal.archive.audit;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findBySubject(AuditSubject subject);

    List<AuditEntry> findByAction(AuditAction action);

    /**
     * Removes entries older than {@code cutoff}.
     *
     * @return number of entries removed
     */
    int deleteBefore(Instant cutoff);

    int count();
}
