package com.journal.archive.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A canonical, deduplicated entity row.
 * Identity is the surrogate {@code id}; deduplication uses the natural key
 * {@code (kind, nameKey, disambiguatorKey)}.
 */
public class Entity {
    private final Long id;
    private final EntityKind kind;
    private final String name;
    private final String nameKey;
    private final String disambiguator;
    private final String disambiguatorKey;
    private final Long parentId;
    private final Long ownerEntryId;
    private final Map<String, Object> attributes;
    private final EntityStatus status;
    private final Instant deletedAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Entity(Builder builder) {
        this.id = builder.id;
        this.kind = builder.kind;
        this.name = builder.name;
        this.nameKey = builder.nameKey;
        this.disambiguator = builder.disambiguator;
        this.disambiguatorKey = builder.disambiguatorKey != null ? builder.disambiguatorKey : "";
        this.parentId = builder.parentId;
        this.ownerEntryId = builder.ownerEntryId;
        this.attributes = builder.attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes))
                : Map.of();
        this.status = builder.status != null ? builder.status : EntityStatus.ACTIVE;
        this.deletedAt = builder.deletedAt;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
    }

    public long getId() {
        if (id == null) {
            throw new IllegalStateException("Entity has not been persisted yet");
        }
        return id;
    }

    public boolean isPersisted() {
        return id != null;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getNameKey() {
        return nameKey;
    }

    public String getDisambiguator() {
        return disambiguator;
    }

    public String getDisambiguatorKey() {
        return disambiguatorKey;
    }

    public Long getParentId() {
        return parentId;
    }

    public Long getOwnerEntryId() {
        return ownerEntryId;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public EntityStatus getStatus() {
        return status;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return status == EntityStatus.ACTIVE;
    }

    public boolean isTombstoned() {
        return status == EntityStatus.TOMBSTONED;
    }

    /**
     * Display form of the natural key, e.g. {@code "Alice (Smith)"}.
     */
    public String displayKey() {
        return disambiguator == null || disambiguator.isBlank() ? name : name + " (" + disambiguator + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id) && kind == entity.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id=" + id +
                ", kind=" + kind +
                ", name='" + name + '\'' +
                ", disambiguator='" + disambiguator + '\'' +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Entity entity) {
        return new Builder()
                .id(entity.id)
                .kind(entity.kind)
                .name(entity.name)
                .nameKey(entity.nameKey)
                .disambiguator(entity.disambiguator)
                .disambiguatorKey(entity.disambiguatorKey)
                .parentId(entity.parentId)
                .ownerEntryId(entity.ownerEntryId)
                .attributes(entity.attributes)
                .status(entity.status)
                .deletedAt(entity.deletedAt)
                .createdAt(entity.createdAt)
                .updatedAt(entity.updatedAt);
    }

    public static class Builder {
        private Long id;
        private EntityKind kind;
        private String name;
        private String nameKey;
        private String disambiguator;
        private String disambiguatorKey;
        private Long parentId;
        private Long ownerEntryId;
        private Map<String, Object> attributes;
        private EntityStatus status;
        private Instant deletedAt;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder nameKey(String nameKey) {
            this.nameKey = nameKey;
            return this;
        }

        public Builder disambiguator(String disambiguator) {
            this.disambiguator = disambiguator;
            return this;
        }

        public Builder disambiguatorKey(String disambiguatorKey) {
            this.disambiguatorKey = disambiguatorKey;
            return this;
        }

        public Builder parentId(Long parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder ownerEntryId(Long ownerEntryId) {
            this.ownerEntryId = ownerEntryId;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder status(EntityStatus status) {
            this.status = status;
            return this;
        }

        public Builder deletedAt(Instant deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(nameKey, "nameKey is required");
            if (status == EntityStatus.PURGED) {
                throw new IllegalArgumentException("Purged entities are not materialized");
            }
            return new Entity(this);
        }
    }
}
