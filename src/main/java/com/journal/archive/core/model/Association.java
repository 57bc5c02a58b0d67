package com.journal.archive.core.model;

import java.util.Objects;

/**
 * A persisted link between an entry (or one of its scenes) and an entity.
 *
 * @param id       surrogate id, 0 when not yet persisted
 * @param relation relation name as stored, see {@code RelationKind#associationName()}
 * @param entryId  owning entry
 * @param sceneId  source scene for scene-level links, otherwise {@code null}
 * @param entityId target entity
 * @param role     optional role metadata (relation type, speaker)
 * @param ordinal  optional ordering metadata (thread/arc sequence)
 * @param locator  textual locator, empty when unused
 */
public record Association(
        long id,
        String relation,
        long entryId,
        Long sceneId,
        long entityId,
        String role,
        Integer ordinal,
        String locator
) {
    public Association {
        Objects.requireNonNull(relation, "relation is required");
        locator = locator != null ? locator : "";
    }

    public Key key() {
        return new Key(sceneId, entityId, locator);
    }

    /**
     * Identity of an association within one relation of one entry.
     */
    public record Key(Long sceneId, long entityId, String locator) {
    }

    /**
     * True when role and ordinal metadata match.
     */
    public boolean sameMetadata(String otherRole, Integer otherOrdinal) {
        return Objects.equals(role, otherRole) && Objects.equals(ordinal, otherOrdinal);
    }
}
