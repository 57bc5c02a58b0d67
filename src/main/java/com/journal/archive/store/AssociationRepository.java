package com.journal.archive.store;

import com.journal.archive.core.model.Association;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Repository for association rows. Associations are owned by their entry.
 */
public class AssociationRepository {

    private static final String COLUMNS = "id, relation, entry_id, scene_id, entity_id, role, ordinal, locator";

    private final Connection conn;

    public AssociationRepository(Connection conn) {
        this.conn = conn;
    }

    /**
     * Associations of one relation owned by {@code entryId}, entry- and scene-level.
     */
    public List<Association> findForEntry(long entryId, String relation) {
        return query("SELECT " + COLUMNS + " FROM associations WHERE entry_id = ? AND relation = ? ORDER BY id",
                ps -> {
                    ps.setLong(1, entryId);
                    ps.setString(2, relation);
                });
    }

    public List<Association> findAllForEntry(long entryId) {
        return query("SELECT " + COLUMNS + " FROM associations WHERE entry_id = ? ORDER BY relation, id",
                ps -> ps.setLong(1, entryId));
    }

    /**
     * Scene-level associations whose source is {@code sceneId}.
     */
    public List<Association> findForScene(long sceneId) {
        return query("SELECT " + COLUMNS + " FROM associations WHERE scene_id = ? ORDER BY relation, id",
                ps -> ps.setLong(1, sceneId));
    }

    public List<Association> findForEntity(long entityId) {
        return query("SELECT " + COLUMNS + " FROM associations WHERE entity_id = ? ORDER BY entry_id, id",
                ps -> ps.setLong(1, entityId));
    }

    /**
     * Entry-level members of a thread or arc, in entry date order.
     */
    public List<Member> members(long entityId, String relation) {
        String sql = """
                SELECT a.entry_id, e.entry_date, a.ordinal
                  FROM associations a
                  JOIN entries e ON e.id = a.entry_id
                 WHERE a.entity_id = ? AND a.relation = ? AND a.scene_id IS NULL
                 ORDER BY e.entry_date""";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, entityId);
            ps.setString(2, relation);
            try (ResultSet rs = ps.executeQuery()) {
                List<Member> members = new ArrayList<>();
                while (rs.next()) {
                    members.add(new Member(
                            rs.getLong("entry_id"),
                            LocalDate.parse(rs.getString("entry_date")),
                            EntityRepository.nullableInt(rs, "ordinal")));
                }
                return members;
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to list members of entity " + entityId, e);
        }
    }

    /**
     * Distinct dates of the live entries that reference the entity, oldest first.
     */
    public List<LocalDate> entryDates(long entityId) {
        String sql = """
                SELECT DISTINCT e.entry_date
                  FROM associations a
                  JOIN entries e ON e.id = a.entry_id
                 WHERE a.entity_id = ? AND e.deleted_at IS NULL
                 ORDER BY e.entry_date""";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, entityId);
            try (ResultSet rs = ps.executeQuery()) {
                List<LocalDate> dates = new ArrayList<>();
                while (rs.next()) {
                    dates.add(LocalDate.parse(rs.getString("entry_date")));
                }
                return dates;
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to list entries of entity " + entityId, e);
        }
    }

    public Association insert(Association association, Instant now) {
        String sql = """
                INSERT INTO associations (relation, entry_id, scene_id, entity_id, role, ordinal, locator, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)""";
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, association.relation());
            ps.setLong(2, association.entryId());
            EntityRepository.setNullableLong(ps, 3, association.sceneId());
            ps.setLong(4, association.entityId());
            ps.setString(5, association.role());
            if (association.ordinal() == null) {
                ps.setNull(6, Types.INTEGER);
            } else {
                ps.setInt(6, association.ordinal());
            }
            ps.setString(7, association.locator());
            ps.setString(8, Timestamps.format(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new ArchiveStoreException("No id generated for " + association);
                }
                return new Association(keys.getLong(1), association.relation(), association.entryId(),
                        association.sceneId(), association.entityId(), association.role(),
                        association.ordinal(), association.locator());
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to insert " + association + ": " + e.getMessage(), e);
        }
    }

    public void updateMetadata(long id, String role, Integer ordinal) {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE associations SET role = ?, ordinal = ? WHERE id = ?")) {
            ps.setString(1, role);
            if (ordinal == null) {
                ps.setNull(2, Types.INTEGER);
            } else {
                ps.setInt(2, ordinal);
            }
            ps.setLong(3, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to update association " + id, e);
        }
    }

    public void delete(long id) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM associations WHERE id = ?")) {
            ps.setLong(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to delete association " + id, e);
        }
    }

    private Association map(ResultSet rs) throws SQLException {
        return new Association(
                rs.getLong("id"),
                rs.getString("relation"),
                rs.getLong("entry_id"),
                EntityRepository.nullableLong(rs, "scene_id"),
                rs.getLong("entity_id"),
                rs.getString("role"),
                EntityRepository.nullableInt(rs, "ordinal"),
                rs.getString("locator"));
    }

    private List<Association> query(String sql, EntityRepository.Binder binder) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<Association> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(map(rs));
                }
                return result;
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Association query failed: " + e.getMessage(), e);
        }
    }

    /**
     * One entry's membership in a thread or arc.
     */
    public record Member(long entryId, LocalDate entryDate, Integer sequence) {
    }
}
