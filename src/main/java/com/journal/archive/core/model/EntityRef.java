package com.journal.archive.core.model;

import java.util.Objects;

/**
 * Immutable handle to a canonical entity: its surrogate id, kind and display name.
 * Returned by resolution and used by the read and merge-back APIs.
 */
public final class EntityRef {

    private final long id;
    private final EntityKind kind;
    private final String name;

    private EntityRef(long id, EntityKind kind, String name) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.name = name;
    }

    public static EntityRef of(long id, EntityKind kind, String name) {
        return new EntityRef(id, kind, name);
    }

    public static EntityRef of(Entity entity) {
        return new EntityRef(entity.getId(), entity.getKind(), entity.getName());
    }

    public long getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityRef that = (EntityRef) o;
        return id == that.id && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        return kind + "#" + id + "('" + name + "')";
    }
}
