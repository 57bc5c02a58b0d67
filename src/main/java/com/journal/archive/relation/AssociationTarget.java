package com.journal.archive.relation;

import com.journal.archive.core.model.Association;
import com.journal.archive.core.model.Entity;

import java.util.Objects;

/**
 * One association a processor wants to exist, together with the spec that asked for it.
 */
public record AssociationTarget(Entity entity, Long sceneId, String role, Integer ordinal, String locator, Object spec) {

    public AssociationTarget {
        Objects.requireNonNull(entity, "entity is required");
        locator = locator != null ? locator : "";
    }

    public static AssociationTarget of(Entity entity, Object spec) {
        return new AssociationTarget(entity, null, null, null, "", spec);
    }

    public AssociationTarget withRole(String newRole) {
        return new AssociationTarget(entity, sceneId, newRole, ordinal, locator, spec);
    }

    public AssociationTarget withOrdinal(Integer newOrdinal) {
        return new AssociationTarget(entity, sceneId, role, newOrdinal, locator, spec);
    }

    public AssociationTarget withLocator(String newLocator) {
        return new AssociationTarget(entity, sceneId, role, ordinal, newLocator, spec);
    }

    public AssociationTarget inScene(long scene) {
        return new AssociationTarget(entity, scene, role, ordinal, locator, spec);
    }

    public Association.Key key() {
        return new Association.Key(sceneId, entity.getId(), locator);
    }

    Association toAssociation(String relation, long entryId) {
        return new Association(0L, relation, entryId, sceneId, entity.getId(), role, ordinal, locator);
    }
}
