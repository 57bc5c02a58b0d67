package com.journal.archive.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declares, per entity kind, which fields are computed and which are editable.
 * A field may be registered under exactly one ownership.
 */
public final class FieldOwnershipRegistry {

    public static final String MENTION_COUNT = "mention_count";
    public static final String FIRST_APPEARANCE = "first_appearance";
    public static final String LAST_APPEARANCE = "last_appearance";
    public static final String ENTRIES = "entries";
    public static final String USAGE_COUNT = "usage_count";
    public static final String VERSION_COUNT = "version_count";
    /** Other names an entity is known by: a string or a list of strings. */
    public static final String ALIAS = "alias";

    private final Map<EntityKind, Map<String, FieldDef>> fields;

    private FieldOwnershipRegistry(Map<EntityKind, Map<String, FieldDef>> fields) {
        this.fields = fields;
    }

    /**
     * Definition of one field.
     *
     * @param referenceKind for editable fields naming another entity, that entity's kind
     */
    public record FieldDef(String name, FieldOwnership ownership, EntityKind referenceKind) {

        public boolean isReference() {
            return referenceKind != null;
        }
    }

    public Optional<FieldDef> field(EntityKind kind, String name) {
        return Optional.ofNullable(fields.getOrDefault(kind, Map.of()).get(name));
    }

    public Optional<FieldOwnership> ownership(EntityKind kind, String name) {
        return field(kind, name).map(FieldDef::ownership);
    }

    public Map<String, FieldDef> fields(EntityKind kind) {
        return fields.getOrDefault(kind, Map.of());
    }

    public Set<String> editableFields(EntityKind kind) {
        Set<String> names = new LinkedHashSet<>();
        fields(kind).values().stream()
                .filter(f -> f.ownership() == FieldOwnership.EDITABLE)
                .forEach(f -> names.add(f.name()));
        return names;
    }

    /**
     * Editable fields that are plain payload, i.e. not references to other entities.
     */
    public Set<String> payloadFields(EntityKind kind) {
        Set<String> names = new LinkedHashSet<>();
        fields(kind).values().stream()
                .filter(f -> f.ownership() == FieldOwnership.EDITABLE && !f.isReference())
                .forEach(f -> names.add(f.name()));
        return names;
    }

    public boolean isEditable(EntityKind kind, String name) {
        return ownership(kind, name).orElse(null) == FieldOwnership.EDITABLE;
    }

    /**
     * The default field table of the archive.
     */
    public static FieldOwnershipRegistry defaults() {
        Builder builder = builder();
        for (EntityKind kind : EntityKind.values()) {
            builder.computed(kind, MENTION_COUNT, FIRST_APPEARANCE, LAST_APPEARANCE, ENTRIES);
            builder.editable(kind, "notes");
        }
        builder.computed(EntityKind.TAG, USAGE_COUNT);
        builder.computed(EntityKind.POEM, VERSION_COUNT);

        builder.editable(EntityKind.PERSON, "full_name", ALIAS);
        builder.editable(EntityKind.CITY, "state_province", "country");
        builder.reference(EntityKind.LOCATION, "city", EntityKind.CITY);
        builder.editable(EntityKind.EVENT, "description");
        builder.editable(EntityKind.THEME, "description");
        builder.editable(EntityKind.REFERENCE_SOURCE, "type", "url");
        builder.reference(EntityKind.REFERENCE, "source", EntityKind.REFERENCE_SOURCE);
        builder.editable(EntityKind.REFERENCE, "mode", "description");
        builder.editable(EntityKind.NARRATED_DATE, "context");
        builder.editable(EntityKind.SCENE, "description", "time_of_day");
        builder.editable(EntityKind.THREAD, "description", "from", "to", "content");
        builder.editable(EntityKind.ARC, "description");
        builder.editable(EntityKind.MOTIF, "description");
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<EntityKind, Map<String, FieldDef>> fields = new EnumMap<>(EntityKind.class);

        public Builder computed(EntityKind kind, String... names) {
            for (String name : names) {
                register(new FieldDef(name, FieldOwnership.COMPUTED, null), kind);
            }
            return this;
        }

        public Builder editable(EntityKind kind, String... names) {
            for (String name : names) {
                register(new FieldDef(name, FieldOwnership.EDITABLE, null), kind);
            }
            return this;
        }

        public Builder reference(EntityKind kind, String name, EntityKind referenceKind) {
            return register(new FieldDef(name, FieldOwnership.EDITABLE, referenceKind), kind);
        }

        private Builder register(FieldDef def, EntityKind kind) {
            Map<String, FieldDef> byName = fields.computeIfAbsent(kind, k -> new LinkedHashMap<>());
            FieldDef existing = byName.get(def.name());
            if (existing != null && existing.ownership() != def.ownership()) {
                throw new IllegalStateException(kind + "." + def.name()
                        + " cannot be both " + existing.ownership() + " and " + def.ownership());
            }
            byName.put(def.name(), def);
            return this;
        }

        public FieldOwnershipRegistry build() {
            Map<EntityKind, Map<String, FieldDef>> copy = new EnumMap<>(EntityKind.class);
            fields.forEach((kind, defs) -> copy.put(kind, Collections.unmodifiableMap(new LinkedHashMap<>(defs))));
            return new FieldOwnershipRegistry(Collections.unmodifiableMap(copy));
        }
    }
}
