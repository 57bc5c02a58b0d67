package com.journal.archive.core.model;

import java.util.Locale;

/**
 * How a reference is used in an entry.
 */
public enum ReferenceMode {
    DIRECT,
    INDIRECT,
    PARAPHRASE,
    VISUAL;

    public static ReferenceMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ReferenceMode value is blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (ReferenceMode candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ReferenceMode '" + value + "'");
    }
}
