package com.journal.archive.config;

import com.journal.archive.cache.CacheConfig;
import com.journal.archive.store.StoreConfig;
import com.journal.archive.sweep.SweepPolicy;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArchiveConfigTest {

    @Mock
    private Config config;

    private Config configOf(Map<String, String> values) {
        when(config.getOptionalValue(anyString(), any())).thenAnswer(invocation -> {
            String raw = values.get(invocation.<String>getArgument(0));
            Class<?> type = invocation.getArgument(1);
            if (raw == null) {
                return Optional.empty();
            }
            if (type == Integer.class) {
                return Optional.of(Integer.valueOf(raw));
            }
            if (type == Long.class) {
                return Optional.of(Long.valueOf(raw));
            }
            if (type == Boolean.class) {
                return Optional.of(Boolean.valueOf(raw));
            }
            return Optional.of(raw);
        });
        return config;
    }

    @Test
    @DisplayName("Should fall back to defaults for missing keys")
    void testDefaults() {
        ArchiveConfig archive = ArchiveConfig.fromConfig(configOf(Map.of()));

        assertEquals(ArchiveConfig.DEFAULT_URL, archive.store().jdbcUrl());
        assertEquals(10_000, archive.store().busyTimeoutMs());
        assertEquals(CacheConfig.defaults(), archive.cache());
        assertEquals(SweepPolicy.defaults().gracePeriod(), archive.sweep().gracePeriod());
        assertEquals(500, archive.sweep().batchSize());
        assertEquals(ArchiveConfig.DEFAULT_PARALLELISM, archive.batchParallelism());
        verify(config, atLeastOnce()).getOptionalValue(eq("archive.store.url"), eq(String.class));
    }

    @Test
    @DisplayName("Should read overrides")
    void testOverrides() {
        Map<String, String> values = new HashMap<>();
        values.put("archive.store.url", "jdbc:sqlite:/tmp/other.db");
        values.put("archive.store.wal", "false");
        values.put("archive.lock.timeout-ms", "250");
        values.put("archive.cache.enabled", "false");
        values.put("archive.cache.ttl-seconds", "60");
        values.put("archive.sweep.grace-days", "3");
        values.put("archive.sweep.audit-days", "10");
        values.put("archive.sweep.batch-size", "20");
        values.put("archive.batch.parallelism", "2");

        ArchiveConfig archive = ArchiveConfig.fromConfig(configOf(values));

        assertEquals("jdbc:sqlite:/tmp/other.db", archive.store().jdbcUrl());
        assertFalse(archive.store().walEnabled());
        assertEquals(250, archive.lock().timeoutMs());
        assertFalse(archive.cache().enabled());
        assertEquals(Duration.ofMinutes(1), archive.cache().ttl());
        assertEquals(Duration.ofDays(3), archive.sweep().gracePeriod());
        assertEquals(Duration.ofDays(10), archive.sweep().auditRetention());
        assertEquals(Duration.ofDays(90), archive.sweep().associationTombstoneRetention());
        assertEquals(20, archive.sweep().batchSize());
        assertEquals(2, archive.batchParallelism());
    }

    @Test
    @DisplayName("Should load from microprofile-config.properties")
    void testLoad() {
        ArchiveConfig archive = ArchiveConfig.load();

        assertEquals(15_000, archive.store().busyTimeoutMs());
        assertEquals(Duration.ofDays(7), archive.sweep().gracePeriod());
        assertEquals(250, archive.cache().maxKeys());
    }

    @Test
    @DisplayName("Should reject a non-positive parallelism")
    void testInvalidParallelism() {
        StoreConfig store = new StoreConfig(ArchiveConfig.DEFAULT_URL, 1000, true);
        ArchiveConfig defaults = ArchiveConfig.defaults(store);

        assertThrows(IllegalArgumentException.class, () -> new ArchiveConfig(store, defaults.lock(),
                defaults.cache(), defaults.sweep(), 0));
    }
}
