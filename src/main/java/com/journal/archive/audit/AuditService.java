package com.journal.archive.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Records and queries the append-only audit trail.
 * Callers record only after the surrounding transaction has committed.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository(), Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public AuditEntry record(AuditAction action, AuditSubject subject, String actor, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder(action, subject)
                .actor(actor)
                .details(details)
                .at(clock.instant())
                .build();
        repository.save(entry);
        log.debug("audit.recorded action={} subject={} actor={}", action, subject, actor);
        return entry;
    }

    public AuditEntry record(AuditAction action, AuditSubject subject, String actor) {
        return record(action, subject, actor, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForSubject(AuditSubject subject) {
        return repository.findBySubject(subject);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public AuditRepository getRepository() {
        return repository;
    }
}
