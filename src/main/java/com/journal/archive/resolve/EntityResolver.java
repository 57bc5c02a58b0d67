package com.journal.archive.resolve;

import com.journal.archive.audit.AuditAction;
import com.journal.archive.audit.AuditService;
import com.journal.archive.audit.AuditSubject;
import com.journal.archive.cache.ResolutionCache;
import com.journal.archive.core.error.AmbiguousReferenceException;
import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.EntityLifecycle;
import com.journal.archive.core.model.EntityStatus;
import com.journal.archive.core.model.FieldOwnershipRegistry;
import com.journal.archive.lock.DistributedLock;
import com.journal.archive.metrics.MetricsService;
import com.journal.archive.rules.NormalizationEngine;
import com.journal.archive.store.EntityRepository;
import com.journal.archive.store.JsonCodec;
import com.journal.archive.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves natural-key descriptors to canonical entities, creating or resurrecting
 * them when needed.
 *
 * <p>Resolution runs inside the caller's {@link UnitOfWork} and holds the lock
 * {@code entity:<KIND>:<nameKey>} only for the resolve-or-create step. It inserts
 * or updates at most one entity row and never touches associations.</p>
 *
 * <ol>
 *   <li>Normalize name and disambiguator into a {@link NaturalKey}.</li>
 *   <li>Look up a live entity with that key. Without a disambiguator every live
 *       entity sharing the name is a candidate; more than one candidate is an
 *       {@link AmbiguousReferenceException}.</li>
 *   <li>For kinds with an {@code alias} field, a bare name that matches no live
 *       entity is looked up among live aliases. One owner resolves; an alias
 *       shared by several entities is ambiguous.</li>
 *   <li>On a match, update only the editable attributes that differ.</li>
 *   <li>Otherwise resurrect a tombstoned entity with the same key.</li>
 *   <li>Otherwise create.</li>
 * </ol>
 */
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);
    private static final String ACTOR = "resolver";

    private final NormalizationEngine normalizer;
    private final FieldOwnershipRegistry ownership;
    private final DistributedLock lock;
    private final ResolutionCache cache;
    private final MetricsService metrics;
    private final AuditService audit;

    public EntityResolver(NormalizationEngine normalizer, FieldOwnershipRegistry ownership, DistributedLock lock,
                          ResolutionCache cache, MetricsService metrics, AuditService audit) {
        this.normalizer = normalizer;
        this.ownership = ownership;
        this.lock = lock;
        this.cache = cache;
        this.metrics = metrics;
        this.audit = audit;
    }

    public NaturalKey naturalKey(EntityKind kind, EntityDescriptor descriptor) {
        return naturalKey(kind, descriptor.name(), descriptor.disambiguator());
    }

    public NaturalKey naturalKey(EntityKind kind, String name, String disambiguator) {
        return new NaturalKey(kind, normalizer.normalize(name, kind), normalizer.normalize(disambiguator, kind));
    }

    /**
     * Returns the canonical entity for {@code descriptor}, creating or resurrecting it if needed.
     *
     * @throws AmbiguousReferenceException if the name alone matches several live entities
     * @throws IllegalArgumentException    if the name normalizes to an empty key
     */
    public Resolution resolve(UnitOfWork uow, EntityKind kind, EntityDescriptor descriptor) {
        NaturalKey key = validKey(kind, descriptor);
        return lock.withLock(DistributedLock.entityKey(kind, key.nameKey()),
                () -> resolveLocked(uow, key, descriptor));
    }

    /**
     * Looks up a live entity without creating anything.
     *
     * @throws AmbiguousReferenceException if the name alone matches several live entities
     */
    public Optional<Entity> find(UnitOfWork uow, EntityKind kind, EntityDescriptor descriptor) {
        NaturalKey key = validKey(kind, descriptor);
        return lock.withLock(DistributedLock.entityKey(kind, key.nameKey()),
                () -> findLive(uow.entities(), key, descriptor));
    }

    /**
     * Tombstones the entity if it is live and nothing references it any more.
     * Called by reconciliation after removing associations in the same unit of work.
     *
     * @return the tombstoned entity, or empty if it is still referenced or already tombstoned
     */
    public Optional<Entity> tombstoneIfOrphan(UnitOfWork uow, long entityId) {
        EntityRepository repo = uow.entities();
        Optional<Entity> found = repo.findById(entityId).filter(Entity::isActive);
        if (found.isEmpty() || repo.referenceCount(entityId) > 0) {
            return Optional.empty();
        }
        Entity entity = found.get();
        EntityStatus next = EntityLifecycle.next(entity.getStatus(), EntityLifecycle.Transition.TOMBSTONE);
        if (!repo.tombstone(entityId, uow.now())) {
            return Optional.empty();
        }
        cache.invalidate(entityId);
        Entity tombstoned = Entity.builder(entity).status(next).deletedAt(uow.now()).updatedAt(uow.now()).build();
        uow.afterCommit(() -> {
            metrics.incrementEntityTombstoned(tombstoned.getKind());
            audit.record(AuditAction.ENTITY_TOMBSTONED, AuditSubject.entity(tombstoned), ACTOR,
                    Map.of("reason", "last reference removed"));
        });
        log.info("resolve.tombstoned entity={}", tombstoned);
        return Optional.of(tombstoned);
    }

    // ========== Resolution steps ==========

    private Resolution resolveLocked(UnitOfWork uow, NaturalKey key, EntityDescriptor descriptor) {
        EntityRepository repo = uow.entities();

        Optional<Entity> live = findLive(repo, key, descriptor);
        if (live.isPresent()) {
            return matchOrUpdate(uow, live.get(), descriptor);
        }

        Optional<Entity> tombstoned = findTombstoned(repo, key);
        if (tombstoned.isPresent()) {
            return resurrect(uow, tombstoned.get(), descriptor);
        }

        return create(uow, key, descriptor);
    }

    private Optional<Entity> findLive(EntityRepository repo, NaturalKey key, EntityDescriptor descriptor) {
        if (key.hasDisambiguator()) {
            Optional<Entity> cached = cachedLive(repo, key);
            if (cached.isPresent()) {
                return cached;
            }
            return repo.findByKey(key.kind(), key.nameKey(), key.disambiguatorKey()).stream()
                    .filter(Entity::isActive)
                    .findFirst();
        }

        List<Entity> candidates = repo.findByName(key.kind(), key.nameKey()).stream()
                .filter(Entity::isActive)
                .toList();
        if (candidates.isEmpty() && ownership.isEditable(key.kind(), FieldOwnershipRegistry.ALIAS)) {
            candidates = repo.findLiveWithAttribute(key.kind(), FieldOwnershipRegistry.ALIAS).stream()
                    .filter(entity -> aliasKeys(entity).contains(key.nameKey()))
                    .toList();
            if (candidates.size() == 1) {
                log.debug("resolve.aliasMatched kind={} alias={} entity={}",
                        key.kind(), descriptor.name(), candidates.get(0));
            }
        }
        if (candidates.size() > 1) {
            List<String> names = candidates.stream().map(Entity::displayKey).toList();
            log.warn("resolve.ambiguous kind={} name={} candidates={}", key.kind(), descriptor.name(), names);
            throw new AmbiguousReferenceException(key.kind(), descriptor.name(), names);
        }
        return candidates.stream().findFirst();
    }

    private Set<String> aliasKeys(Entity entity) {
        Object value = entity.getAttributes().get(FieldOwnershipRegistry.ALIAS);
        Set<String> keys = new LinkedHashSet<>();
        if (value instanceof Collection<?> aliases) {
            aliases.forEach(alias -> keys.add(normalizer.normalize(String.valueOf(alias), entity.getKind())));
        } else if (value != null) {
            keys.add(normalizer.normalize(String.valueOf(value), entity.getKind()));
        }
        keys.remove("");
        return keys;
    }

    private Optional<Entity> cachedLive(EntityRepository repo, NaturalKey key) {
        Optional<Long> hint = cache.get(key.kind(), key.nameKey(), key.disambiguatorKey());
        if (hint.isEmpty()) {
            metrics.recordCacheMiss();
            return Optional.empty();
        }
        Optional<Entity> entity = repo.findById(hint.get())
                .filter(Entity::isActive)
                .filter(e -> e.getNameKey().equals(key.nameKey())
                        && e.getDisambiguatorKey().equals(key.disambiguatorKey()));
        if (entity.isPresent()) {
            metrics.recordCacheHit();
        } else {
            cache.invalidate(hint.get());
            metrics.recordCacheMiss();
        }
        return entity;
    }

    private Optional<Entity> findTombstoned(EntityRepository repo, NaturalKey key) {
        Optional<Entity> exact = repo.findByKey(key.kind(), key.nameKey(), key.disambiguatorKey()).stream()
                .filter(Entity::isTombstoned)
                .max(Comparator.comparing(Entity::getDeletedAt));
        if (exact.isPresent() || key.hasDisambiguator()) {
            return exact;
        }
        List<Entity> sameName = repo.findByName(key.kind(), key.nameKey()).stream()
                .filter(Entity::isTombstoned)
                .toList();
        return sameName.size() == 1 ? Optional.of(sameName.get(0)) : Optional.empty();
    }

    private Resolution matchOrUpdate(UnitOfWork uow, Entity entity, EntityDescriptor descriptor) {
        Map<String, Object> merged = mergeAttributes(uow.json(), entity, descriptor);
        remember(uow, entity);
        if (merged == null) {
            return new Resolution(entity, ResolutionOutcome.MATCHED);
        }
        uow.entities().updateAttributes(entity.getId(), merged, uow.now());
        Entity updated = Entity.builder(entity).attributes(merged).updatedAt(uow.now()).build();
        uow.afterCommit(() -> audit.record(AuditAction.ENTITY_UPDATED, AuditSubject.entity(updated), ACTOR,
                Map.of("attributes", merged.keySet())));
        log.debug("resolve.updated entity={} attributes={}", updated, merged.keySet());
        return new Resolution(updated, ResolutionOutcome.UPDATED);
    }

    private Resolution resurrect(UnitOfWork uow, Entity tombstoned, EntityDescriptor descriptor) {
        EntityStatus next = EntityLifecycle.next(tombstoned.getStatus(), EntityLifecycle.Transition.RESURRECT);
        uow.entities().resurrect(tombstoned.getId(), uow.now());
        Map<String, Object> merged = mergeAttributes(uow.json(), tombstoned, descriptor);
        if (merged != null) {
            uow.entities().updateAttributes(tombstoned.getId(), merged, uow.now());
        }
        Entity entity = Entity.builder(tombstoned)
                .status(next)
                .deletedAt(null)
                .attributes(merged != null ? merged : tombstoned.getAttributes())
                .updatedAt(uow.now())
                .build();
        remember(uow, entity);
        uow.afterCommit(() -> {
            metrics.incrementEntityResurrected(entity.getKind());
            audit.record(AuditAction.ENTITY_RESURRECTED, AuditSubject.entity(entity), ACTOR,
                    Map.of("deletedAt", String.valueOf(tombstoned.getDeletedAt())));
        });
        log.info("resolve.resurrected entity={}", entity);
        return new Resolution(entity, ResolutionOutcome.RESURRECTED);
    }

    private Resolution create(UnitOfWork uow, NaturalKey key, EntityDescriptor descriptor) {
        Map<String, Object> attributes = editableSubset(key.kind(), descriptor);
        Entity candidate = Entity.builder()
                .kind(key.kind())
                .name(descriptor.name())
                .nameKey(key.nameKey())
                .disambiguator(descriptor.disambiguator())
                .disambiguatorKey(key.disambiguatorKey())
                .parentId(descriptor.parentId())
                .ownerEntryId(descriptor.ownerEntryId())
                .attributes(attributes)
                .build();
        Entity created = uow.entities().insert(candidate, uow.now());
        remember(uow, created);
        uow.afterCommit(() -> {
            metrics.incrementEntityCreated(created.getKind());
            audit.record(AuditAction.ENTITY_CREATED, AuditSubject.entity(created), ACTOR,
                    Map.of("name", created.displayKey()));
        });
        log.debug("resolve.created entity={}", created);
        return new Resolution(created, ResolutionOutcome.CREATED);
    }

    // ========== Helpers ==========

    private NaturalKey validKey(EntityKind kind, EntityDescriptor descriptor) {
        NaturalKey key = naturalKey(kind, descriptor);
        if (key.nameKey().isEmpty()) {
            throw new IllegalArgumentException(kind.getLabel() + " name is blank: " + descriptor);
        }
        return key;
    }

    /**
     * Editable attributes of the descriptor merged over the stored ones, or
     * {@code null} when nothing changes.
     */
    private Map<String, Object> mergeAttributes(JsonCodec json, Entity entity, EntityDescriptor descriptor) {
        Map<String, Object> incoming = editableSubset(entity.getKind(), descriptor);
        Map<String, Object> merged = new LinkedHashMap<>(entity.getAttributes());
        boolean changed = false;
        for (Map.Entry<String, Object> attribute : incoming.entrySet()) {
            Object current = merged.get(attribute.getKey());
            if (current == null || !json.write(current).equals(json.write(attribute.getValue()))) {
                merged.put(attribute.getKey(), attribute.getValue());
                changed = true;
            }
        }
        return changed ? merged : null;
    }

    private Map<String, Object> editableSubset(EntityKind kind, EntityDescriptor descriptor) {
        Set<String> payload = ownership.payloadFields(kind);
        Map<String, Object> subset = new LinkedHashMap<>();
        descriptor.attributes().forEach((name, value) -> {
            if (payload.contains(name)) {
                subset.put(name, value);
            } else {
                log.debug("resolve.ignoredAttribute kind={} attribute={} ownership={}",
                        kind, name, ownership.ownership(kind, name).map(Enum::name).orElse("UNKNOWN"));
            }
        });
        return subset;
    }

    private void remember(UnitOfWork uow, Entity entity) {
        cache.put(entity.getKind(), entity.getNameKey(), entity.getDisambiguatorKey(), entity.getId());
        uow.onRollback("uncache " + entity.getId(), () -> cache.invalidate(entity.getId()));
    }
}
