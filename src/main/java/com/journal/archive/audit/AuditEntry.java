package com.journal.archive.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One line of the audit trail, written after the unit of work that caused it commits.
 *
 * @param actor   archive component that acted, e.g. {@code reconciler} or {@code sweeper}
 * @param details small scalar facts about the change; copied on construction
 */
public record AuditEntry(
        String id,
        AuditAction action,
        AuditSubject subject,
        String actor,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean concerns(AuditSubject other) {
        return subject.equals(other);
    }

    public static Builder builder(AuditAction action, AuditSubject subject) {
        return new Builder(action, subject);
    }

    public static class Builder {
        private final AuditAction action;
        private final AuditSubject subject;
        private String id = UUID.randomUUID().toString();
        private String actor;
        private Map<String, Object> details;
        private Instant timestamp;

        private Builder(AuditAction action, AuditSubject subject) {
            this.action = action;
            this.subject = subject;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder at(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, subject, actor, details, timestamp);
        }
    }
}
