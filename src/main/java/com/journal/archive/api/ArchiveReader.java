package com.journal.archive.api;

import com.journal.archive.core.error.AmbiguousReferenceException;
import com.journal.archive.core.model.Association;
import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityAggregates;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.EntityRef;
import com.journal.archive.core.model.Entry;
import com.journal.archive.core.model.PoemVersion;
import com.journal.archive.relation.RelationKind;
import com.journal.archive.resolve.EntityResolver;
import com.journal.archive.resolve.NaturalKey;
import com.journal.archive.store.AssociationRepository;
import com.journal.archive.store.Database;
import com.journal.archive.store.EntityRepository;
import com.journal.archive.store.EntryRepository;
import com.journal.archive.store.PoemVersionRepository;
import com.journal.archive.sync.EntityStateAssembler;

import java.sql.Connection;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only queries used by the note-page generator. Every call runs on its own
 * auto-commit connection and never blocks a reconciliation.
 */
public class ArchiveReader {

    private final Database database;
    private final EntityResolver resolver;
    private final EntityStateAssembler assembler;

    public ArchiveReader(Database database, EntityResolver resolver, EntityStateAssembler assembler) {
        this.database = database;
        this.resolver = resolver;
        this.assembler = assembler;
    }

    public Optional<Entity> entity(EntityRef ref) {
        return entity(ref.getId()).filter(entity -> entity.getKind() == ref.getKind());
    }

    public Optional<Entity> entity(long id) {
        return database.read(conn -> entities(conn).findById(id));
    }

    /**
     * Finds a live entity by its natural key, normalized the same way resolution does.
     *
     * @throws AmbiguousReferenceException if no disambiguator is given and several live entities share the name
     */
    public Optional<Entity> findEntity(EntityKind kind, String name, String disambiguator) {
        NaturalKey key = resolver.naturalKey(kind, name, disambiguator);
        List<Entity> candidates = database.read(conn -> key.hasDisambiguator()
                ? entities(conn).findByKey(kind, key.nameKey(), key.disambiguatorKey())
                : entities(conn).findByName(kind, key.nameKey()))
                .stream()
                .filter(Entity::isActive)
                .toList();
        if (candidates.size() > 1) {
            throw new AmbiguousReferenceException(kind, name, candidates.stream().map(Entity::displayKey).toList());
        }
        return candidates.stream().findFirst();
    }

    public Optional<Entity> findEntity(EntityKind kind, String name) {
        return findEntity(kind, name, null);
    }

    public List<Entity> entities(EntityKind kind, boolean includeTombstoned) {
        return database.read(conn -> entities(conn).findAll(kind, includeTombstoned));
    }

    public Optional<Entry> entry(LocalDate date) {
        return database.read(conn -> new EntryRepository(conn).findByDate(date));
    }

    public List<Entry> entries() {
        return database.read(conn -> new EntryRepository(conn).findAll(false));
    }

    /**
     * Every association owned by the entry on {@code date}, entry- and scene-level.
     */
    public List<Association> associations(LocalDate date) {
        return database.read(conn -> new EntryRepository(conn).findByDate(date)
                .map(entry -> new AssociationRepository(conn).findAllForEntry(entry.id()))
                .orElse(List.of()));
    }

    public List<Association> associations(LocalDate date, RelationKind kind) {
        return database.read(conn -> new EntryRepository(conn).findByDate(date)
                .map(entry -> new AssociationRepository(conn).findForEntry(entry.id(), kind.associationName()))
                .orElse(List.of()));
    }

    public EntityAggregates aggregates(long entityId) {
        return EntityAggregates.of(database.read(conn -> new AssociationRepository(conn).entryDates(entityId)));
    }

    /**
     * Entries of a thread or arc in chronological order, with their sequence numbers.
     *
     * @throws IllegalArgumentException if the entity is neither a thread nor an arc
     */
    public List<AssociationRepository.Member> members(long threadOrArcId) {
        return database.read(conn -> {
            Entity entity = entities(conn).findById(threadOrArcId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown entity " + threadOrArcId));
            RelationKind relation = switch (entity.getKind()) {
                case THREAD -> RelationKind.THREADS;
                case ARC -> RelationKind.ARCS;
                default -> throw new IllegalArgumentException(entity + " is neither a thread nor an arc");
            };
            return new AssociationRepository(conn).members(threadOrArcId, relation.associationName());
        });
    }

    /**
     * Versions of a poem, oldest first.
     */
    public List<PoemVersion> poemVersions(long poemId) {
        return database.read(conn -> new PoemVersionRepository(conn).findForPoem(poemId));
    }

    /**
     * Store-side field map of the entity as the note-page generator renders it.
     */
    public Map<String, Object> storeState(Entity entity) {
        return database.read(conn -> assembler.storeState(entity, entities(conn), new AssociationRepository(conn),
                new PoemVersionRepository(conn)));
    }

    private EntityRepository entities(Connection conn) {
        return new EntityRepository(conn, database.json());
    }
}
