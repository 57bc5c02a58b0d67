package com.journal.archive.relation;

import com.journal.archive.core.error.AmbiguousReferenceException;
import com.journal.archive.core.model.Association;
import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.SceneSpec;
import com.journal.archive.resolve.EntityDescriptor;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scenes of the entry. A scene is owned by its entry and keyed by name and entry
 * date. Its people, locations and dates are stored as scene-level associations
 * and must refer to entities the entry itself declares.
 */
public class SceneProcessor extends AbstractRelationshipProcessor<SceneSpec> {

    public static final String SCENE_PERSON = "scene_person";
    public static final String SCENE_LOCATION = "scene_location";
    public static final String SCENE_DATE = "scene_date";

    private static final List<String> LINKS = List.of(SCENE_PERSON, SCENE_LOCATION, SCENE_DATE);

    public SceneProcessor() {
        super(RelationKind.SCENES);
    }

    @Override
    public List<SceneSpec> declaredSpecs(EntryDescriptor descriptor) {
        return descriptor.scenes();
    }

    @Override
    protected List<AssociationTarget> targetsFor(ReconciliationContext context, SceneSpec spec) {
        if (isBlank(spec.name())) {
            throw invalid(spec, "scene name is blank");
        }
        Map<String, Object> attributes = new HashMap<>();
        if (spec.description() != null) {
            attributes.put("description", spec.description());
        }
        if (spec.timeOfDay() != null) {
            attributes.put("time_of_day", spec.timeOfDay());
        }
        long entryId = context.entry().id();
        Entity scene = context.resolve(EntityKind.SCENE, new EntityDescriptor(
                spec.name(), context.entry().date().toString(), null, entryId, attributes)).entity();
        if (scene.getOwnerEntryId() != null && scene.getOwnerEntryId() != entryId) {
            throw invalid(spec, "scene belongs to entry " + scene.getOwnerEntryId());
        }

        Map<String, Map<Association.Key, AssociationTarget>> links = new LinkedHashMap<>();
        links.put(SCENE_PERSON, linkTargets(context, scene, spec, RelationKind.PEOPLE, spec.people()));
        links.put(SCENE_LOCATION, linkTargets(context, scene, spec, RelationKind.LOCATIONS, spec.locations()));
        links.put(SCENE_DATE, linkTargets(context, scene, spec, RelationKind.NARRATED_DATES, spec.dates()));
        return List.of(AssociationTarget.of(scene, new ResolvedScene(spec, links)));
    }

    @Override
    protected void beforeRemove(ReconciliationContext context, Association association, Changes changes) {
        for (Association link : context.uow().associations().findForScene(association.entityId())) {
            remove(context, link, changes);
        }
    }

    @Override
    protected void afterSync(ReconciliationContext context, Collection<AssociationTarget> targets,
                             ReconcileMode mode, Changes changes) {
        for (AssociationTarget target : targets) {
            ResolvedScene resolved = (ResolvedScene) target.spec();
            List<Association> stored = context.uow().associations().findForScene(target.entity().getId());
            for (String relation : LINKS) {
                List<Association> current = stored.stream()
                        .filter(a -> a.relation().equals(relation))
                        .toList();
                sync(context, relation, resolved.links().get(relation), current, mode, changes);
            }
        }
    }

    private Map<Association.Key, AssociationTarget> linkTargets(ReconciliationContext context, Entity scene,
                                                                SceneSpec spec, RelationKind kind,
                                                                List<String> references) {
        Map<Association.Key, AssociationTarget> targets = new LinkedHashMap<>();
        for (String reference : references) {
            if (isBlank(reference)) {
                throw invalid(spec, "blank " + kind.targetKind().getLabel().toLowerCase(Locale.ROOT) + " reference");
            }
            List<Entity> matches = context.matchTargets(kind, reference.strip());
            if (matches.isEmpty()) {
                throw invalid(spec, kind.targetKind().getLabel().toLowerCase(Locale.ROOT) + " '" + reference
                        + "' is not declared on the entry");
            }
            if (matches.size() > 1) {
                throw new AmbiguousReferenceException(kind.targetKind(), reference,
                        matches.stream().map(Entity::displayKey).toList());
            }
            AssociationTarget target = AssociationTarget.of(matches.get(0), spec).inScene(scene.getId());
            targets.putIfAbsent(target.key(), target);
        }
        return targets;
    }

    /**
     * A resolved scene with its scene-level link targets keyed by relation name.
     */
    record ResolvedScene(SceneSpec spec, Map<String, Map<Association.Key, AssociationTarget>> links) {

        @Override
        public String toString() {
            return spec.toString();
        }
    }
}
