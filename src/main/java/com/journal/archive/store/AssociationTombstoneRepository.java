package com.journal.archive.store;

import com.journal.archive.core.model.Association;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Record of associations removed by reconciliation, kept until they expire.
 */
public class AssociationTombstoneRepository {

    private final Connection conn;

    public AssociationTombstoneRepository(Connection conn) {
        this.conn = conn;
    }

    public void record(Association removed, Instant removedAt, Instant expiresAt) {
        String sql = """
                INSERT INTO association_tombstones (relation, entry_id, scene_id, entity_id, removed_at, expires_at)
                VALUES (?, ?, ?, ?, ?, ?)""";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, removed.relation());
            ps.setLong(2, removed.entryId());
            EntityRepository.setNullableLong(ps, 3, removed.sceneId());
            ps.setLong(4, removed.entityId());
            ps.setString(5, Timestamps.format(removedAt));
            ps.setString(6, Timestamps.format(expiresAt));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to record association tombstone", e);
        }
    }

    /**
     * Forgets earlier removals of an association that has been added again.
     */
    public void clear(Association added) {
        String sql = """
                DELETE FROM association_tombstones
                 WHERE relation = ? AND entry_id = ? AND IFNULL(scene_id, 0) = ? AND entity_id = ?""";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, added.relation());
            ps.setLong(2, added.entryId());
            ps.setLong(3, added.sceneId() != null ? added.sceneId() : 0L);
            ps.setLong(4, added.entityId());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to clear association tombstone", e);
        }
    }

    public List<RemovedAssociation> findForEntry(long entryId) {
        String sql = """
                SELECT relation, entry_id, scene_id, entity_id, removed_at, expires_at
                  FROM association_tombstones WHERE entry_id = ? ORDER BY id""";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, entryId);
            try (ResultSet rs = ps.executeQuery()) {
                List<RemovedAssociation> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(new RemovedAssociation(
                            rs.getString("relation"),
                            rs.getLong("entry_id"),
                            EntityRepository.nullableLong(rs, "scene_id"),
                            rs.getLong("entity_id"),
                            Timestamps.parse(rs.getString("removed_at")),
                            Timestamps.parse(rs.getString("expires_at"))));
                }
                return result;
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Association tombstone query failed", e);
        }
    }

    /**
     * Deletes tombstones that expired at or before {@code now}.
     */
    public int expire(Instant now) {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM association_tombstones WHERE expires_at <= ?")) {
            ps.setString(1, Timestamps.format(now));
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to expire association tombstones", e);
        }
    }

    public record RemovedAssociation(String relation, long entryId, Long sceneId, long entityId,
                                     Instant removedAt, Instant expiresAt) {
    }
}
