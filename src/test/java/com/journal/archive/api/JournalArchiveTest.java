package com.journal.archive.api;

import com.journal.archive.cache.CacheConfig;
import com.journal.archive.cache.CaffeineResolutionCache;
import com.journal.archive.cache.NoOpResolutionCache;
import com.journal.archive.config.ArchiveConfig;
import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.EntityRef;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.lock.LockConfig;
import com.journal.archive.metrics.MicrometerMetricsService;
import com.journal.archive.reconcile.ReconciliationReport;
import com.journal.archive.relation.ReconcileMode;
import com.journal.archive.store.StoreConfig;
import com.journal.archive.support.MutableClock;
import com.journal.archive.sweep.SweepPolicy;
import com.journal.archive.sweep.SweepResult;
import com.journal.archive.sync.MergeOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JournalArchiveTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 1);

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should require a configuration")
    void testBuilderRequiresConfig() {
        assertThrows(IllegalStateException.class, () -> JournalArchive.builder().build());
    }

    @Test
    @DisplayName("Should pick the cache from the configuration")
    void testCacheSelection() {
        try (JournalArchive cached = JournalArchive.builder().databaseFile(dir.resolve("a.db")).build()) {
            assertInstanceOf(CaffeineResolutionCache.class, cached.cache());
        }

        ArchiveConfig noCache = new ArchiveConfig(StoreConfig.forFile(dir.resolve("b.db")), LockConfig.defaults(),
                CacheConfig.disabled(), SweepPolicy.defaults(), 2);
        try (JournalArchive uncached = JournalArchive.builder().config(noCache).build()) {
            assertInstanceOf(NoOpResolutionCache.class, uncached.cache());
            assertEquals(2, uncached.config().batchParallelism());
        }
    }

    @Test
    @DisplayName("Should reconcile, merge notes back and sweep through one facade")
    void testLifecycle() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        try (JournalArchive archive = JournalArchive.builder()
                .databaseFile(dir.resolve("journal.db"))
                .clock(clock)
                .metricsService(new MicrometerMetricsService(registry))
                .build()) {

            ReconciliationReport first = archive.reconcile(
                    EntryDescriptor.builder(DAY).person("Alice").tag("spring").build(), ReconcileMode.REPLACE);
            assertEquals(2, first.created().size());

            Entity alice = archive.reader().findEntity(EntityKind.PERSON, "alice").orElseThrow();
            MergeOutcome outcome = archive.mergeBack(EntityRef.of(alice), Map.of("notes", "neighbour"));
            assertFalse(outcome.hasConflicts());
            assertEquals("neighbour", archive.reader().entity(alice.getId()).orElseThrow()
                    .getAttributes().get("notes"));

            ReconciliationReport second = archive.reconcile(
                    EntryDescriptor.builder(DAY).person("Alice").build(), ReconcileMode.REPLACE);
            assertEquals(1, second.tombstoned().size());
            assertTrue(archive.reader().findEntity(EntityKind.TAG, "spring").isEmpty());

            clock.advance(Duration.ofDays(31));
            SweepResult result = archive.sweep();

            assertEquals(1, result.purged());
            assertEquals(0, result.tombstoned());
            assertTrue(archive.reader().entities(EntityKind.TAG, true).isEmpty());
            assertTrue(archive.reader().entity(alice.getId()).orElseThrow().isActive());
        }
    }

    @Test
    @DisplayName("Should import JSON and report unreadable records")
    void testImportJson() {
        String json = "{\"date\": \"2024-05-01\", \"people\": [\"Alice\"], \"tags\": [\"spring\"]}\n"
                + "{\"people\": [\"Nobody\"]}\n"
                + "{\"date\": \"2024-05-02\", \"people\": [\"Alice\"]}\n";

        try (JournalArchive archive = JournalArchive.builder().databaseFile(dir.resolve("import.db")).build()) {
            JournalArchive.ImportOutcome outcome = archive.importJson(
                    new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), ReconcileMode.REPLACE);

            assertEquals(1, outcome.parsed().errors().size());
            assertEquals(2, outcome.batch().successCount());
            assertEquals(2, archive.reader().entries().size());
            assertEquals(2, archive.reader().aggregates(
                    archive.reader().findEntity(EntityKind.PERSON, "Alice").orElseThrow().getId()).mentionCount());
        }
    }
}
