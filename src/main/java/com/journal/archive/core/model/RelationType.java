package com.journal.archive.core.model;

import java.util.Locale;

/**
 * Relationship of a person to the author, recorded per entry.
 */
public enum RelationType {
    FAMILY,
    FRIEND,
    ROMANTIC,
    COLLEAGUE,
    ACQUAINTANCE,
    PROFESSIONAL,
    PUBLIC,
    OTHER;

    /**
     * Parses a declared value, accepting any case and hyphens or spaces for underscores.
     *
     * @throws IllegalArgumentException if the value names no constant
     */
    public static RelationType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RelationType value is blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (RelationType candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown RelationType '" + value + "'");
    }
}
