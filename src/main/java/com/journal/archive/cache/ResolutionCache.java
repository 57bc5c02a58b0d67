package com.journal.archive.cache;

import com.journal.archive.core.model.EntityKind;

import java.util.Optional;

/**
 * Natural key to entity id cache used by the resolver as a hint.
 * A hit is always re-validated against the store before use.
 */
public interface ResolutionCache {

    Optional<Long> get(EntityKind kind, String nameKey, String disambiguatorKey);

    void put(EntityKind kind, String nameKey, String disambiguatorKey, long entityId);

    /**
     * Drops every cached key pointing at {@code entityId}.
     */
    void invalidate(long entityId);

    void invalidateAll();

    CacheStats getStats();
}
