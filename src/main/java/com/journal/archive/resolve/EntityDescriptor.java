package com.journal.archive.resolve;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Natural-key descriptor handed to the resolver: a display name, an optional
 * disambiguator, and kind-specific extras.
 *
 * @param parentId     owning canonical entity (city of a location, source of a reference)
 * @param ownerEntryId owning entry (scenes)
 * @param attributes   candidate editable attributes; non-editable names are ignored
 */
public record EntityDescriptor(
        String name,
        String disambiguator,
        Long parentId,
        Long ownerEntryId,
        Map<String, Object> attributes
) {
    public EntityDescriptor {
        if (name == null) {
            throw new IllegalArgumentException("name is required");
        }
        name = name.strip();
        disambiguator = disambiguator == null || disambiguator.isBlank() ? null : disambiguator.strip();
        attributes = attributes != null ? Map.copyOf(withoutNulls(attributes)) : Map.of();
    }

    public static EntityDescriptor of(String name) {
        return new EntityDescriptor(name, null, null, null, null);
    }

    public static EntityDescriptor of(String name, String disambiguator) {
        return new EntityDescriptor(name, disambiguator, null, null, null);
    }

    /**
     * Parses a display key of the form {@code Name} or {@code Name (Disambiguator)}.
     */
    public static EntityDescriptor fromDisplayKey(String displayKey) {
        String key = displayKey.strip();
        int open = key.lastIndexOf(" (");
        if (open > 0 && key.endsWith(")")) {
            return of(key.substring(0, open), key.substring(open + 2, key.length() - 1));
        }
        return of(key);
    }

    public boolean hasDisambiguator() {
        return disambiguator != null;
    }

    public EntityDescriptor withAttributes(Map<String, Object> extra) {
        return new EntityDescriptor(name, disambiguator, parentId, ownerEntryId, extra);
    }

    public EntityDescriptor withParent(Long parent) {
        return new EntityDescriptor(name, disambiguator, parent, ownerEntryId, attributes);
    }

    public EntityDescriptor withOwnerEntry(Long entryId) {
        return new EntityDescriptor(name, disambiguator, parentId, entryId, attributes);
    }

    @Override
    public String toString() {
        return disambiguator == null ? "'" + name + "'" : "'" + name + "' (" + disambiguator + ")";
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
