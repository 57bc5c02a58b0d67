package com.journal.archive.resolve;

import com.journal.archive.core.model.EntityKind;

/**
 * Normalized natural key of an entity. An absent disambiguator is the empty string.
 */
public record NaturalKey(EntityKind kind, String nameKey, String disambiguatorKey) {

    public boolean hasDisambiguator() {
        return !disambiguatorKey.isEmpty();
    }
}
