package com.journal.archive.core.model;

import java.util.Locale;

/**
 * Medium of a reference source.
 */
public enum ReferenceType {
    BOOK,
    POEM,
    ARTICLE,
    FILM,
    SONG,
    PODCAST,
    INTERVIEW,
    SPEECH,
    TV_SHOW,
    VIDEO,
    WEBSITE,
    OTHER;

    public static ReferenceType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ReferenceType value is blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (ReferenceType candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ReferenceType '" + value + "'");
    }
}
