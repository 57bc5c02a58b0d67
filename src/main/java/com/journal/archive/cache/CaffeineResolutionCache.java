package com.journal.archive.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.journal.archive.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed resolution cache with an entity id index for targeted invalidation.
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<CacheKey, Long> cache;
    // entityId -> keys resolving to it
    private final ConcurrentMap<Long, Set<CacheKey>> entityIndex = new ConcurrentHashMap<>();

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxKeys())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .removalListener((CacheKey key, Long entityId, RemovalCause cause) -> {
                    if (key != null && entityId != null) {
                        Set<CacheKey> keys = entityIndex.get(entityId);
                        if (keys != null) {
                            keys.remove(key);
                        }
                    }
                })
                .build();
        log.info("CaffeineResolutionCache initialized: maxKeys={}, ttl={}", config.maxKeys(), config.ttl());
    }

    @Override
    public Optional<Long> get(EntityKind kind, String nameKey, String disambiguatorKey) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(kind, nameKey, disambiguatorKey)));
    }

    @Override
    public void put(EntityKind kind, String nameKey, String disambiguatorKey, long entityId) {
        CacheKey key = new CacheKey(kind, nameKey, disambiguatorKey);
        cache.put(key, entityId);
        entityIndex.computeIfAbsent(entityId, k -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override
    public void invalidate(long entityId) {
        Set<CacheKey> keys = entityIndex.remove(entityId);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("cache.invalidated entityId={} keys={}", entityId, keys.size());
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        entityIndex.clear();
        log.debug("cache.invalidatedAll");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    record CacheKey(EntityKind kind, String nameKey, String disambiguatorKey) {
    }
}
