package com.journal.archive.cache;

import com.journal.archive.core.model.EntityKind;

import java.util.Optional;

/**
 * Cache that stores nothing; every lookup goes to the store.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<Long> get(EntityKind kind, String nameKey, String disambiguatorKey) {
        return Optional.empty();
    }

    @Override
    public void put(EntityKind kind, String nameKey, String disambiguatorKey, long entityId) {
    }

    @Override
    public void invalidate(long entityId) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
