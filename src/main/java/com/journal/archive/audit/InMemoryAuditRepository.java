package com.journal.archive.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of AuditRepository.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    @Override
    public List<AuditEntry> findBySubject(AuditSubject subject) {
        return entries.stream()
                .filter(e -> e.concerns(subject))
                .toList();
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    @Override
    public int deleteBefore(Instant cutoff) {
        List<AuditEntry> expired = entries.stream()
                .filter(e -> e.timestamp().isBefore(cutoff))
                .toList();
        entries.removeAll(expired);
        return expired.size();
    }

    @Override
    public int count() {
        return entries.size();
    }
}
