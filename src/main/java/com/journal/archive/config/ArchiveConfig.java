package com.journal.archive.config;

import com.journal.archive.cache.CacheConfig;
import com.journal.archive.lock.LockConfig;
import com.journal.archive.store.StoreConfig;
import com.journal.archive.sweep.SweepPolicy;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.time.Duration;
import java.util.Objects;

/**
 * All tunables of an archive instance.
 *
 * <p>Can be read from MicroProfile Config under the {@code archive.} prefix:</p>
 * <pre>
 * archive.store.url                          jdbc:sqlite:journal-archive.db
 * archive.store.busy-timeout-ms              10000
 * archive.store.wal                          true
 * archive.lock.timeout-ms                    5000
 * archive.lock.fair                          true
 * archive.cache.enabled                      true
 * archive.cache.max-size                     10000
 * archive.cache.ttl-seconds                  300
 * archive.sweep.grace-days                   30
 * archive.sweep.association-tombstone-days   90
 * archive.sweep.deleted-entry-days           30
 * archive.sweep.audit-days                   365
 * archive.sweep.batch-size                   500
 * archive.batch.parallelism                  4
 * </pre>
 */
public record ArchiveConfig(
        StoreConfig store,
        LockConfig lock,
        CacheConfig cache,
        SweepPolicy sweep,
        int batchParallelism
) {
    public static final String DEFAULT_URL = "jdbc:sqlite:journal-archive.db";
    public static final int DEFAULT_PARALLELISM = 4;

    public ArchiveConfig {
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(lock, "lock is required");
        Objects.requireNonNull(cache, "cache is required");
        Objects.requireNonNull(sweep, "sweep is required");
        if (batchParallelism <= 0) {
            throw new IllegalArgumentException("batchParallelism must be > 0");
        }
    }

    public static ArchiveConfig defaults(StoreConfig store) {
        return new ArchiveConfig(store, LockConfig.defaults(), CacheConfig.defaults(), SweepPolicy.defaults(),
                DEFAULT_PARALLELISM);
    }

    /**
     * Reads the configuration from the default MicroProfile Config of the current class loader.
     */
    public static ArchiveConfig load() {
        return fromConfig(ConfigProvider.getConfig());
    }

    public static ArchiveConfig fromConfig(Config config) {
        StoreConfig store = new StoreConfig(
                config.getOptionalValue("archive.store.url", String.class).orElse(DEFAULT_URL),
                config.getOptionalValue("archive.store.busy-timeout-ms", Integer.class).orElse(10_000),
                config.getOptionalValue("archive.store.wal", Boolean.class).orElse(true));

        LockConfig defaultLock = LockConfig.defaults();
        LockConfig lock = new LockConfig(
                config.getOptionalValue("archive.lock.timeout-ms", Long.class).orElse(defaultLock.timeoutMs()),
                config.getOptionalValue("archive.lock.fair", Boolean.class).orElse(defaultLock.fair()));

        CacheConfig cache = new CacheConfig(
                config.getOptionalValue("archive.cache.enabled", Boolean.class).orElse(true),
                config.getOptionalValue("archive.cache.max-size", Integer.class).orElse(CacheConfig.DEFAULT_MAX_KEYS),
                config.getOptionalValue("archive.cache.ttl-seconds", Long.class)
                        .map(Duration::ofSeconds)
                        .orElse(CacheConfig.DEFAULT_TTL));

        SweepPolicy defaultSweep = SweepPolicy.defaults();
        SweepPolicy sweep = SweepPolicy.builder()
                .gracePeriod(days(config, "archive.sweep.grace-days", defaultSweep.gracePeriod()))
                .associationTombstoneRetention(days(config, "archive.sweep.association-tombstone-days",
                        defaultSweep.associationTombstoneRetention()))
                .deletedEntryRetention(days(config, "archive.sweep.deleted-entry-days",
                        defaultSweep.deletedEntryRetention()))
                .auditRetention(days(config, "archive.sweep.audit-days", defaultSweep.auditRetention()))
                .batchSize(config.getOptionalValue("archive.sweep.batch-size", Integer.class)
                        .orElse(defaultSweep.batchSize()))
                .build();

        int parallelism = config.getOptionalValue("archive.batch.parallelism", Integer.class)
                .orElse(DEFAULT_PARALLELISM);
        return new ArchiveConfig(store, lock, cache, sweep, parallelism);
    }

    private static Duration days(Config config, String key, Duration fallback) {
        return config.getOptionalValue(key, Long.class).map(Duration::ofDays).orElse(fallback);
    }
}
