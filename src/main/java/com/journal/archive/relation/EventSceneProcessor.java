package com.journal.archive.relation;

import com.journal.archive.core.model.Association;
import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.EventSpec;
import com.journal.archive.resolve.EntityDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Links scenes of the entry to the events they belong to. A scene belongs to at most one event.
 */
public class EventSceneProcessor extends AbstractRelationshipProcessor<EventSceneProcessor.SceneLink> {

    public EventSceneProcessor() {
        super(RelationKind.EVENT_SCENES);
    }

    @Override
    public List<SceneLink> declaredSpecs(EntryDescriptor descriptor) {
        List<SceneLink> links = new ArrayList<>();
        for (EventSpec event : descriptor.events()) {
            if (event != null) {
                event.scenes().forEach(scene -> links.add(new SceneLink(event, scene)));
            }
        }
        return links;
    }

    @Override
    protected List<AssociationTarget> targetsFor(ReconciliationContext context, SceneLink link) {
        if (isBlank(link.event().name())) {
            throw invalid(link, "event name is blank");
        }
        if (isBlank(link.scene())) {
            throw invalid(link, "blank scene reference");
        }
        List<Entity> scenes = context.matchTargets(RelationKind.SCENES, link.scene().strip());
        if (scenes.isEmpty()) {
            throw invalid(link, "scene '" + link.scene() + "' is not declared on the entry");
        }
        Entity event = context.resolve(EntityKind.EVENT,
                new EntityDescriptor(link.event().name(), null, null, null, link.event().attributes())).entity();
        return List.of(AssociationTarget.of(event, link).inScene(scenes.get(0).getId()));
    }

    @Override
    protected void validate(ReconciliationContext context, Collection<AssociationTarget> targets,
                            List<Association> current, ReconcileMode mode) {
        Map<Long, Long> eventByScene = new HashMap<>();
        for (AssociationTarget target : targets) {
            Long previous = eventByScene.putIfAbsent(target.sceneId(), target.entity().getId());
            if (previous != null && previous != target.entity().getId()) {
                throw invalid(target.spec(), "scene is claimed by two events");
            }
        }
        if (mode == ReconcileMode.MERGE) {
            for (Association stored : current) {
                Long declared = eventByScene.get(stored.sceneId());
                if (declared != null && declared != stored.entityId()) {
                    throw invalid(stored, "scene already belongs to event " + stored.entityId());
                }
            }
        }
    }

    /**
     * One (event, scene) pair declared by the entry.
     */
    public record SceneLink(EventSpec event, String scene) {
    }
}
