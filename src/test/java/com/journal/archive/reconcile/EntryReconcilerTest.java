package com.journal.archive.reconcile;

import com.journal.archive.api.ArchiveReader;
import com.journal.archive.audit.AuditAction;
import com.journal.archive.audit.AuditSubject;
import com.journal.archive.core.error.AmbiguousReferenceException;
import com.journal.archive.core.error.InvalidAssociationException;
import com.journal.archive.core.error.OrderingViolationException;
import com.journal.archive.core.model.Association;
import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.EntityRef;
import com.journal.archive.core.model.EntityStatus;
import com.journal.archive.core.model.PoemVersion;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.EventSpec;
import com.journal.archive.descriptor.MotifSpec;
import com.journal.archive.descriptor.PersonSpec;
import com.journal.archive.descriptor.PoemSpec;
import com.journal.archive.descriptor.ReferenceSpec;
import com.journal.archive.descriptor.SceneSpec;
import com.journal.archive.descriptor.SequencedSpec;
import com.journal.archive.descriptor.SourceSpec;
import com.journal.archive.relation.ReconcileMode;
import com.journal.archive.relation.RelationKind;
import com.journal.archive.relation.SceneProcessor;
import com.journal.archive.store.AssociationRepository;
import com.journal.archive.support.ArchiveFixture;
import com.journal.archive.sync.EntityStateAssembler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EntryReconcilerTest {

    private static final LocalDate MARCH_1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate MARCH_10 = LocalDate.of(2024, 3, 10);
    private static final LocalDate MARCH_20 = LocalDate.of(2024, 3, 20);

    @TempDir
    Path dir;

    private ArchiveFixture fixture;
    private EntryReconciler reconciler;
    private ArchiveReader reader;

    @BeforeEach
    void setUp() {
        fixture = new ArchiveFixture(dir);
        reconciler = fixture.reconciler;
        reader = new ArchiveReader(fixture.database, fixture.resolver, new EntityStateAssembler(fixture.ownership));
    }

    private EntryDescriptor aliceBobTravel() {
        return EntryDescriptor.builder(MARCH_1).person("Alice").person("Bob").tag("travel").build();
    }

    private List<String> peopleOn(LocalDate date) {
        return reader.associations(date, RelationKind.PEOPLE).stream()
                .map(a -> reader.entity(a.entityId()).orElseThrow().getName())
                .sorted()
                .toList();
    }

    @Nested
    @DisplayName("Replace mode")
    class ReplaceTests {

        @Test
        @DisplayName("Should create people and tags with one entry reference each")
        void testFirstReconcile() {
            ReconciliationReport report = reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);

            assertTrue(report.entryCreated());
            assertEquals(3, report.totalAdded());
            assertEquals(3, report.created().size());

            Entity alice = fixture.entity(EntityKind.PERSON, "Alice");
            Entity bob = fixture.entity(EntityKind.PERSON, "Bob");
            Entity travel = fixture.entity(EntityKind.TAG, "travel");
            assertEquals(1, fixture.referenceCount(alice.getId()));
            assertEquals(1, fixture.referenceCount(bob.getId()));
            assertEquals(1L, reader.storeState(travel).get("usage_count"));
        }

        @Test
        @DisplayName("Should tombstone an entity that loses its last reference")
        void testRemovalTombstones() {
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);

            ReconciliationReport report = reconciler.reconcile(
                    EntryDescriptor.builder(MARCH_1).person("Alice").tag("travel").build(), ReconcileMode.REPLACE);

            assertEquals(1, report.delta(RelationKind.PEOPLE).removed());
            assertEquals(List.of("Alice"), peopleOn(MARCH_1));
            Entity bob = fixture.entity(EntityKind.PERSON, "Bob");
            assertEquals(EntityStatus.TOMBSTONED, bob.getStatus());
            assertNotNull(bob.getDeletedAt());
            assertEquals(List.of(EntityRef.of(bob)), report.tombstoned());
        }

        @Test
        @DisplayName("Should keep an entity referenced by another entry")
        void testSharedEntitySurvives() {
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);
            reconciler.reconcile(EntryDescriptor.builder(MARCH_10).person("Bob").build(), ReconcileMode.REPLACE);

            reconciler.reconcile(EntryDescriptor.builder(MARCH_1).person("Alice").build(), ReconcileMode.REPLACE);

            assertTrue(fixture.entity(EntityKind.PERSON, "Bob").isActive());
        }

        @Test
        @DisplayName("Should leave exactly the declared associations")
        void testReplaceCompleteness() {
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1).person("Carol").person("Alice").build(),
                    ReconcileMode.REPLACE);

            assertEquals(List.of("Alice", "Carol"), peopleOn(MARCH_1));
            assertTrue(reader.associations(MARCH_1, RelationKind.TAGS).isEmpty());
        }

        @Test
        @DisplayName("Should collapse duplicate specs that resolve to one entity")
        void testDuplicateSpecs() {
            ReconciliationReport report = reconciler.reconcile(
                    EntryDescriptor.builder(MARCH_1).person("Alice").person("alice").person("ÁLICE").build(),
                    ReconcileMode.REPLACE);

            assertEquals(1, report.delta(RelationKind.PEOPLE).added());
            assertEquals(1, fixture.entities(EntityKind.PERSON).size());
        }

        @Test
        @DisplayName("Should update association metadata in place")
        void testMetadataUpdate() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .person(new PersonSpec("Alice", null, "friend", null)).build(), ReconcileMode.REPLACE);

            ReconciliationReport report = reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .person(new PersonSpec("Alice", null, "family", null)).build(), ReconcileMode.REPLACE);

            assertEquals(1, report.delta(RelationKind.PEOPLE).updated());
            assertEquals(0, report.delta(RelationKind.PEOPLE).added());
            assertEquals("FAMILY", reader.associations(MARCH_1, RelationKind.PEOPLE).get(0).role());
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class IdempotenceTests {

        @Test
        @DisplayName("Should report no changes when the same descriptor is reconciled again")
        void testSecondCallIsNoop() {
            EntryDescriptor descriptor = EntryDescriptor.builder(MARCH_1)
                    .person("Alice")
                    .location("Café Olimpico", "Montreal")
                    .scene(new SceneSpec("Breakfast", null, "morning", List.of("2023-11"),
                            List.of("Alice"), List.of("Café Olimpico")))
                    .event(EventSpec.of("Trip", "Breakfast"))
                    .thread(SequencedSpec.of("Move", 1))
                    .motif(MotifSpec.of("Coffee", "paragraph 2"))
                    .poem(PoemSpec.of("Morning", "line one\nline two"))
                    .build();
            reconciler.reconcile(descriptor, ReconcileMode.REPLACE);
            List<Association> before = reader.associations(MARCH_1);

            ReconciliationReport second = reconciler.reconcile(descriptor, ReconcileMode.REPLACE);

            assertTrue(second.isNoop(), second::toString);
            assertFalse(second.entryCreated());
            assertFalse(second.metadataChanged());
            assertEquals(before, reader.associations(MARCH_1));
        }

        @Test
        @DisplayName("Should flag metadata changes")
        void testMetadataChanged() {
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);

            ReconciliationReport report = reconciler.reconcile(
                    EntryDescriptor.builder(MARCH_1).person("Alice").build(), ReconcileMode.REPLACE);

            assertTrue(report.metadataChanged());
        }
    }

    @Nested
    @DisplayName("Merge mode")
    class MergeTests {

        @Test
        @DisplayName("Should only add associations")
        void testMergeIsMonotonic() {
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);

            ReconciliationReport report = reconciler.reconcile(
                    EntryDescriptor.builder(MARCH_1).person("Carol").build(), ReconcileMode.MERGE);

            assertEquals(0, report.totalRemoved());
            assertEquals(List.of("Alice", "Bob", "Carol"), peopleOn(MARCH_1));
            assertEquals(1, reader.associations(MARCH_1, RelationKind.TAGS).size());
            assertTrue(report.tombstoned().isEmpty());
        }

        @Test
        @DisplayName("Should let scenes refer to people already on the entry")
        void testMergeSceneUsesExistingTargets() {
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);

            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .scene(new SceneSpec("Walk", null, null, null, List.of("Bob"), null))
                    .build(), ReconcileMode.MERGE);

            Entity scene = fixture.entity(EntityKind.SCENE, "Walk");
            List<Association> links = fixture.database.read(conn ->
                    new AssociationRepository(conn).findForScene(scene.getId()));
            assertEquals(1, links.size());
            assertEquals(SceneProcessor.SCENE_PERSON, links.get(0).relation());
        }
    }

    @Nested
    @DisplayName("Resurrection")
    class ResurrectionTests {

        @Test
        @DisplayName("Should bring back a tombstoned entity with the same id")
        void testSameId() {
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);
            long bobId = fixture.entity(EntityKind.PERSON, "Bob").getId();
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1).person("Alice").build(), ReconcileMode.REPLACE);

            ReconciliationReport report = reconciler.reconcile(
                    EntryDescriptor.builder(MARCH_10).person("bob").build(), ReconcileMode.REPLACE);

            Entity bob = fixture.entity(EntityKind.PERSON, "Bob");
            assertEquals(bobId, bob.getId());
            assertTrue(bob.isActive());
            assertEquals(List.of(EntityRef.of(bob)), report.resurrected());
            assertTrue(report.created().isEmpty());
        }
    }

    @Nested
    @DisplayName("Cascades and scenes")
    class CascadeTests {

        @Test
        @DisplayName("Should link the city of every location to the entry")
        void testLocationCascade() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1).location("Café Olimpico", "Montreal").build(),
                    ReconcileMode.REPLACE);

            Entity city = fixture.entity(EntityKind.CITY, "Montreal");
            Entity location = fixture.entity(EntityKind.LOCATION, "Café Olimpico");
            assertEquals(city.getId(), location.getParentId());
            assertEquals("Café Olimpico (Montreal)", location.displayKey());
            assertEquals(1, reader.associations(MARCH_1, RelationKind.CITIES).size());
            assertEquals(2, fixture.referenceCount(city.getId()));
        }

        @Test
        @DisplayName("Should keep same-named locations in different cities apart")
        void testLocationsPerCity() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .location("Central Park", "New York")
                    .location("Central Park", "Montreal")
                    .build(), ReconcileMode.REPLACE);

            assertEquals(2, fixture.entities(EntityKind.LOCATION).size());
        }

        @Test
        @DisplayName("Should reject a location without city that matches nothing")
        void testUnknownLocationWithoutCity() {
            EntryDescriptor descriptor = EntryDescriptor.builder(MARCH_1).location("Nowhere", null).build();

            assertThrows(InvalidAssociationException.class,
                    () -> reconciler.reconcile(descriptor, ReconcileMode.REPLACE));
        }

        @Test
        @DisplayName("Should store scene people, locations and dates as scene links")
        void testSceneLinks() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .person("Alice")
                    .location("Café Olimpico", "Montreal")
                    .scene(new SceneSpec("Breakfast", "croissants", "morning", List.of("2023-11"),
                            List.of("alice"), List.of("Café Olimpico")))
                    .build(), ReconcileMode.REPLACE);

            Entity scene = fixture.entity(EntityKind.SCENE, "Breakfast");
            assertEquals("2024-03-01", scene.getDisambiguator());
            assertEquals("croissants", scene.getAttributes().get("description"));
            List<Association> links = fixture.database.read(conn ->
                    new AssociationRepository(conn).findForScene(scene.getId()));
            assertEquals(3, links.size());
            assertEquals(1, reader.associations(MARCH_1, RelationKind.NARRATED_DATES).stream()
                    .filter(a -> a.sceneId() == null)
                    .count());
        }

        @Test
        @DisplayName("Should reject a scene naming a person the entry does not declare")
        void testUndeclaredScenePerson() {
            EntryDescriptor descriptor = EntryDescriptor.builder(MARCH_1)
                    .person("Alice")
                    .scene(new SceneSpec("Walk", null, null, null, List.of("Zed"), null))
                    .build();

            InvalidAssociationException e = assertThrows(InvalidAssociationException.class,
                    () -> reconciler.reconcile(descriptor, ReconcileMode.REPLACE));
            assertEquals("SCENES", e.getRelation());
            assertTrue(reader.entry(MARCH_1).isEmpty());
            assertTrue(fixture.entities(EntityKind.PERSON).isEmpty());
        }

        @Test
        @DisplayName("Should remove scene links together with the scene")
        void testSceneRemoval() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .person("Alice")
                    .scene(new SceneSpec("Walk", null, null, null, List.of("Alice"), null))
                    .build(), ReconcileMode.REPLACE);
            Entity scene = fixture.entity(EntityKind.SCENE, "Walk");

            ReconciliationReport report = reconciler.reconcile(EntryDescriptor.builder(MARCH_1).person("Alice").build(),
                    ReconcileMode.REPLACE);

            assertEquals(2, report.delta(RelationKind.SCENES).removed());
            assertTrue(fixture.entity(EntityKind.SCENE, "Walk").isTombstoned());
            assertEquals(0, fixture.referenceCount(scene.getId()));
            assertTrue(fixture.entity(EntityKind.PERSON, "Alice").isActive());
        }

        @Test
        @DisplayName("Should link events to entries and to their scenes")
        void testEvents() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .scene(SceneSpec.of("Arrival"))
                    .event(EventSpec.of("Trip", "Arrival"))
                    .build(), ReconcileMode.REPLACE);

            Entity scene = fixture.entity(EntityKind.SCENE, "Arrival");
            List<Association> sceneEvents = reader.associations(MARCH_1, RelationKind.EVENT_SCENES);
            assertEquals(1, sceneEvents.size());
            assertEquals(scene.getId(), sceneEvents.get(0).sceneId());
            assertEquals(1, reader.associations(MARCH_1, RelationKind.EVENT_ENTRIES).size());
        }

        @Test
        @DisplayName("Should reject a scene claimed by two events")
        void testSceneInTwoEvents() {
            EntryDescriptor descriptor = EntryDescriptor.builder(MARCH_1)
                    .scene(SceneSpec.of("Arrival"))
                    .event(EventSpec.of("Trip", "Arrival"))
                    .event(EventSpec.of("Visit", "Arrival"))
                    .build();

            assertThrows(InvalidAssociationException.class,
                    () -> reconciler.reconcile(descriptor, ReconcileMode.REPLACE));
        }
    }

    @Nested
    @DisplayName("Threads, motifs, references and poems")
    class KindTests {

        @Test
        @DisplayName("Should reject an out-of-order thread member and leave the thread unchanged")
        void testOrderingViolation() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_10).thread(SequencedSpec.of("Move", 2)).build(),
                    ReconcileMode.REPLACE);
            long thread = fixture.entity(EntityKind.THREAD, "Move").getId();

            EntryDescriptor late = EntryDescriptor.builder(MARCH_20)
                    .person("Zed")
                    .thread(SequencedSpec.of("Move", 1))
                    .build();
            OrderingViolationException e = assertThrows(OrderingViolationException.class,
                    () -> reconciler.reconcile(late, ReconcileMode.REPLACE));

            assertEquals(MARCH_20, e.getEntryDate());
            assertEquals(MARCH_10, e.getConflictingDate());
            assertEquals(1, reader.members(thread).size());
            assertTrue(reader.entry(MARCH_20).isEmpty());
            assertTrue(fixture.entities(EntityKind.PERSON).isEmpty());
        }

        @Test
        @DisplayName("Should read thread members chronologically")
        void testMembersInOrder() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_20).thread(SequencedSpec.of("Move", 3)).build(),
                    ReconcileMode.REPLACE);
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1).thread(SequencedSpec.of("Move", 1)).build(),
                    ReconcileMode.REPLACE);
            reconciler.reconcile(EntryDescriptor.builder(MARCH_10).thread(SequencedSpec.of("Move")).build(),
                    ReconcileMode.REPLACE);

            long thread = fixture.entity(EntityKind.THREAD, "Move").getId();
            List<LocalDate> dates = reader.members(thread).stream()
                    .map(AssociationRepository.Member::entryDate)
                    .toList();
            assertEquals(List.of(MARCH_1, MARCH_10, MARCH_20), dates);
        }

        @Test
        @DisplayName("Should reject a duplicate sequence number")
        void testDuplicateSequence() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1).arc(SequencedSpec.of("Healing", 1)).build(),
                    ReconcileMode.REPLACE);

            assertThrows(OrderingViolationException.class, () -> reconciler.reconcile(
                    EntryDescriptor.builder(MARCH_10).arc(SequencedSpec.of("Healing", 1)).build(),
                    ReconcileMode.REPLACE));
        }

        @Test
        @DisplayName("Should keep one motif instance per locator")
        void testMotifLocators() {
            ReconciliationReport report = reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .motif(MotifSpec.of("Rain", "paragraph 1"))
                    .motif(MotifSpec.of("Rain", "paragraph  1 "))
                    .motif(MotifSpec.of("Rain", "paragraph 4"))
                    .build(), ReconcileMode.REPLACE);

            assertEquals(2, report.delta(RelationKind.MOTIFS).added());
            assertEquals(1, fixture.entities(EntityKind.MOTIF).size());
        }

        @Test
        @DisplayName("Should reject a motif without locator")
        void testMotifWithoutLocator() {
            assertThrows(InvalidAssociationException.class, () -> reconciler.reconcile(
                    EntryDescriptor.builder(MARCH_1).motif(MotifSpec.of("Rain", " ")).build(),
                    ReconcileMode.REPLACE));
        }

        @Test
        @DisplayName("Should key references by their source")
        void testReferences() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .reference(new ReferenceSpec("All happy families", null, "Mother", "direct",
                            new SourceSpec("Anna Karenina", "Tolstoy", "book", null)))
                    .build(), ReconcileMode.REPLACE);

            Entity source = fixture.entity(EntityKind.REFERENCE_SOURCE, "Anna Karenina");
            Entity reference = fixture.entity(EntityKind.REFERENCE, "All happy families");
            assertEquals(source.getId(), reference.getParentId());
            assertEquals("BOOK", source.getAttributes().get("type"));
            assertEquals("DIRECT", reference.getAttributes().get("mode"));
            assertEquals("Mother", reader.associations(MARCH_1, RelationKind.REFERENCES).get(0).role());
        }

        @Test
        @DisplayName("Should tell apart sources sharing a title by their author")
        void testSourcesByAuthor() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .reference(new ReferenceSpec("Because I could not stop for Death", null, null, null,
                            SourceSpec.of("Poems", "Emily Dickinson")))
                    .reference(new ReferenceSpec("Bent double, like old beggars", null, null, null,
                            SourceSpec.of("Poems", "Wilfred Owen")))
                    .build(), ReconcileMode.REPLACE);
            reconciler.reconcile(EntryDescriptor.builder(MARCH_10)
                    .reference(new ReferenceSpec("Because I could not stop for Death", null, null, null,
                            SourceSpec.of("Poems", "emily dickinson")))
                    .build(), ReconcileMode.REPLACE);

            List<Entity> sources = fixture.entities(EntityKind.REFERENCE_SOURCE);
            assertEquals(List.of("Poems (Emily Dickinson)", "Poems (Wilfred Owen)"),
                    sources.stream().map(Entity::displayKey).sorted().toList());
            Entity death = fixture.entity(EntityKind.REFERENCE, "Because I could not stop for Death");
            Entity beggars = fixture.entity(EntityKind.REFERENCE, "Bent double, like old beggars");
            assertNotEquals(death.getParentId(), beggars.getParentId());
            assertEquals(1, fixture.entities(EntityKind.REFERENCE).stream()
                    .filter(e -> e.getName().equals(death.getName()))
                    .count());
        }

        @Test
        @DisplayName("Should reject a reference without source")
        void testReferenceWithoutSource() {
            assertThrows(InvalidAssociationException.class, () -> reconciler.reconcile(
                    EntryDescriptor.builder(MARCH_1)
                            .reference(new ReferenceSpec("quote", null, null, null, null))
                            .build(),
                    ReconcileMode.REPLACE));
        }

        @Test
        @DisplayName("Should append a poem version only when the content changes")
        void testPoemVersions() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1).poem(PoemSpec.of("Rain", "drops\r\nfall")).build(),
                    ReconcileMode.REPLACE);
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1).poem(PoemSpec.of("Rain", "drops\nfall\n")).build(),
                    ReconcileMode.REPLACE);
            reconciler.reconcile(EntryDescriptor.builder(MARCH_10).poem(PoemSpec.of("Rain", "drops\nrise")).build(),
                    ReconcileMode.REPLACE);

            long poem = fixture.entity(EntityKind.POEM, "Rain").getId();
            assertEquals(2, reader.poemVersions(poem).size());
            assertEquals("drops\nfall", reader.poemVersions(poem).get(0).content());
        }

        @Test
        @DisplayName("Should not re-append drafts of a poem shared by two entries")
        void testPoemDraftsConverge() {
            EntryDescriptor first = EntryDescriptor.builder(MARCH_1)
                    .poem(PoemSpec.of("Morning", "draft one")).build();
            EntryDescriptor second = EntryDescriptor.builder(MARCH_10)
                    .poem(PoemSpec.of("Morning", "draft two")).build();
            reconciler.reconcile(first, ReconcileMode.REPLACE);
            reconciler.reconcile(second, ReconcileMode.REPLACE);
            long poem = fixture.entity(EntityKind.POEM, "Morning").getId();
            assertEquals(2, reader.poemVersions(poem).size());

            for (int pass = 0; pass < 3; pass++) {
                assertTrue(reconciler.reconcile(first, ReconcileMode.REPLACE).isNoop());
                assertTrue(reconciler.reconcile(second, ReconcileMode.REPLACE).isNoop());
            }

            assertEquals(List.of("draft one", "draft two"), reader.poemVersions(poem).stream()
                    .map(PoemVersion::content)
                    .toList());
        }

        @Test
        @DisplayName("Should reject a malformed narrated date")
        void testMalformedDate() {
            assertThrows(InvalidAssociationException.class, () -> reconciler.reconcile(
                    EntryDescriptor.builder(MARCH_1).narratedDate("2023-13").build(), ReconcileMode.REPLACE));
        }
    }

    @Nested
    @DisplayName("Ambiguity")
    class AmbiguityTests {

        @Test
        @DisplayName("Should resolve a bare name to the person declaring it as alias")
        void testAliasResolves() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .person(new PersonSpec("Alejandro", null, null, Map.of("alias", "Ale")))
                    .build(), ReconcileMode.REPLACE);
            reconciler.reconcile(EntryDescriptor.builder(MARCH_10).person("Ale").build(), ReconcileMode.REPLACE);

            assertEquals(List.of("Alejandro"), fixture.entities(EntityKind.PERSON).stream()
                    .map(Entity::getName)
                    .toList());
            assertEquals(List.of("Alejandro"), peopleOn(MARCH_10));
            assertTrue(reconciler.reconcile(EntryDescriptor.builder(MARCH_10).person("ale").build(),
                    ReconcileMode.REPLACE).isNoop());
        }

        @Test
        @DisplayName("Should reject an alias shared by several people")
        void testSharedAlias() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .person(new PersonSpec("Alejandro", null, null, Map.of("alias", "Ale")))
                    .person(new PersonSpec("Alessandra", null, null, Map.of("alias", List.of("Ale", "Sandra"))))
                    .build(), ReconcileMode.REPLACE);

            AmbiguousReferenceException e = assertThrows(AmbiguousReferenceException.class,
                    () -> reconciler.reconcile(EntryDescriptor.builder(MARCH_10).person("Ale").build(),
                            ReconcileMode.REPLACE));
            assertEquals(List.of("Alejandro", "Alessandra"), e.getCandidates().stream().sorted().toList());
            assertTrue(reader.entry(MARCH_10).isEmpty());
            assertEquals(2, fixture.entities(EntityKind.PERSON).size());
        }

        @Test
        @DisplayName("Should reject a bare name shared by several live entities")
        void testAmbiguousName() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .person(new PersonSpec("Alex", "Smith", null, null))
                    .person(new PersonSpec("Alex", "Jones", null, null))
                    .build(), ReconcileMode.REPLACE);

            AmbiguousReferenceException e = assertThrows(AmbiguousReferenceException.class,
                    () -> reconciler.reconcile(EntryDescriptor.builder(MARCH_10).person("Alex").build(),
                            ReconcileMode.REPLACE));
            assertEquals(2, e.getCandidates().size());
            assertTrue(reader.entry(MARCH_10).isEmpty());
        }

        @Test
        @DisplayName("Should match a bare name to the only live entity carrying it")
        void testUniqueBareName() {
            reconciler.reconcile(EntryDescriptor.builder(MARCH_1)
                    .person(new PersonSpec("Alex", "Smith", null, null))
                    .build(), ReconcileMode.REPLACE);

            reconciler.reconcile(EntryDescriptor.builder(MARCH_10).person("alex").build(), ReconcileMode.REPLACE);

            assertEquals(1, fixture.entities(EntityKind.PERSON).size());
        }
    }

    @Nested
    @DisplayName("Entry deletion")
    class DeleteTests {

        @Test
        @DisplayName("Should remove associations, tombstone orphans and soft-delete the entry")
        void testDelete() {
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);

            ReconciliationReport report = reconciler.deleteEntry(MARCH_1).orElseThrow();

            assertEquals(3, report.totalRemoved());
            assertEquals(3, report.tombstoned().size());
            assertTrue(reader.entry(MARCH_1).orElseThrow().isDeleted());
            assertTrue(reader.associations(MARCH_1).isEmpty());
            assertFalse(fixture.audit.getEntriesByAction(AuditAction.ENTRY_DELETED).isEmpty());
        }

        @Test
        @DisplayName("Should return empty for an unknown or already deleted entry")
        void testDeleteMissing() {
            assertTrue(reconciler.deleteEntry(MARCH_1).isEmpty());
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);
            reconciler.deleteEntry(MARCH_1);
            assertTrue(reconciler.deleteEntry(MARCH_1).isEmpty());
        }

        @Test
        @DisplayName("Should restore a deleted entry when it is reconciled again")
        void testRestore() {
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);
            reconciler.deleteEntry(MARCH_1);

            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);

            assertFalse(reader.entry(MARCH_1).orElseThrow().isDeleted());
            assertTrue(fixture.entity(EntityKind.PERSON, "Bob").isActive());
        }
    }

    @Nested
    @DisplayName("Side effects")
    class SideEffectTests {

        @Test
        @DisplayName("Should audit and count committed reconciliations")
        void testAuditAndMetrics() {
            reconciler.reconcile(aliceBobTravel(), ReconcileMode.REPLACE);

            assertEquals(1, fixture.audit.getEntriesForSubject(AuditSubject.entry(MARCH_1)).size());
            assertEquals(2.0, fixture.registry.get("archive.entity.lifecycle")
                    .tag("kind", "PERSON").tag("transition", "created").counter().count());
            assertEquals(1L, fixture.registry.get("archive.reconcile.duration")
                    .tag("outcome", "committed").timer().count());
        }

        @Test
        @DisplayName("Should not audit a rolled back reconciliation")
        void testNoAuditOnRollback() {
            EntryDescriptor invalid = EntryDescriptor.builder(MARCH_1).person("Alice").narratedDate("soon").build();

            assertThrows(InvalidAssociationException.class,
                    () -> reconciler.reconcile(invalid, ReconcileMode.REPLACE));

            assertTrue(fixture.audit.getAllEntries().isEmpty());
            assertEquals(1L, fixture.registry.get("archive.reconcile.duration")
                    .tag("outcome", "rolled_back").timer().count());
        }
    }

    @Test
    @DisplayName("Should create one city when two entries declare it concurrently")
    void testConcurrentSharedCity() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Callable<ReconciliationReport>> tasks = List.of(
                    () -> {
                        start.await();
                        return reconciler.reconcile(EntryDescriptor.builder(MARCH_1).city("Paris").build(),
                                ReconcileMode.REPLACE);
                    },
                    () -> {
                        start.await();
                        return reconciler.reconcile(EntryDescriptor.builder(MARCH_10).city("paris").build(),
                                ReconcileMode.REPLACE);
                    });
            List<Future<ReconciliationReport>> futures = tasks.stream().map(executor::submit).toList();
            start.countDown();
            for (Future<ReconciliationReport> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<Entity> cities = fixture.entities(EntityKind.CITY);
        assertEquals(1, cities.size());
        assertEquals(2, fixture.referenceCount(cities.get(0).getId()));
    }

    @Test
    @DisplayName("Should expose aggregates for the note page")
    void testAggregates() {
        reconciler.reconcile(EntryDescriptor.builder(MARCH_10).person("Alice").build(), ReconcileMode.REPLACE);
        reconciler.reconcile(EntryDescriptor.builder(MARCH_1).person("Alice").build(), ReconcileMode.REPLACE);

        Entity alice = fixture.entity(EntityKind.PERSON, "Alice");
        Map<String, Object> state = reader.storeState(alice);

        assertEquals(2L, state.get("mention_count"));
        assertEquals("2024-03-01", state.get("first_appearance"));
        assertEquals("2024-03-10", state.get("last_appearance"));
        assertEquals(List.of(MARCH_1, MARCH_10), reader.aggregates(alice.getId()).entries());
    }
}
