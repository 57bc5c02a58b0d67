package com.journal.archive.cache;

import java.time.Duration;

/**
 * Resolution cache tunables. Each cached key is one natural key mapped to an
 * entity id, so {@code maxKeys} bounds how many distinct names are remembered.
 * Sizes are only checked when the cache is enabled.
 *
 * @param ttl how long a natural key stays cached after it was resolved
 */
public record CacheConfig(boolean enabled, int maxKeys, Duration ttl) {

    public static final int DEFAULT_MAX_KEYS = 10_000;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    public CacheConfig {
        if (enabled) {
            if (maxKeys <= 0) {
                throw new IllegalArgumentException("maxKeys must be > 0");
            }
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("ttl must be positive");
            }
        }
    }

    public static CacheConfig defaults() {
        return new CacheConfig(true, DEFAULT_MAX_KEYS, DEFAULT_TTL);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(false, 0, Duration.ZERO);
    }

    /**
     * A Caffeine cache sized by this config, or the pass-through cache when disabled.
     */
    public ResolutionCache newCache() {
        return enabled ? new CaffeineResolutionCache(this) : new NoOpResolutionCache();
    }
}
