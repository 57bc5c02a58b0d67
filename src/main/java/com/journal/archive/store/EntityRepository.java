package com.journal.archive.store;

import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.EntityStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for canonical entity rows.
 */
public class EntityRepository {

    private static final String COLUMNS = """
            id, kind, name, name_key, disambiguator, disambiguator_key, parent_id, owner_entry_id,
            attributes, status, deleted_at, created_at, updated_at""";

    private static final String REFERENCE_COUNT = """
            (SELECT COUNT(*) FROM associations a WHERE a.entity_id = e.id)
              + (SELECT COUNT(*) FROM entities c WHERE c.parent_id = e.id)""";

    private final Connection conn;
    private final JsonCodec json;

    public EntityRepository(Connection conn, JsonCodec json) {
        this.conn = conn;
        this.json = json;
    }

    // ========== Lookups ==========

    public Optional<Entity> findById(long id) {
        return queryOne("SELECT " + COLUMNS + " FROM entities WHERE id = ?", ps -> ps.setLong(1, id));
    }

    /**
     * All rows of {@code kind} with the exact natural key, live or tombstoned.
     */
    public List<Entity> findByKey(EntityKind kind, String nameKey, String disambiguatorKey) {
        return queryList("SELECT " + COLUMNS + """
                 FROM entities
                WHERE kind = ? AND name_key = ? AND disambiguator_key = ?
                ORDER BY status, id""", ps -> {
            ps.setString(1, kind.name());
            ps.setString(2, nameKey);
            ps.setString(3, disambiguatorKey);
        });
    }

    /**
     * All rows of {@code kind} sharing {@code nameKey}, whatever their disambiguator.
     */
    public List<Entity> findByName(EntityKind kind, String nameKey) {
        return queryList("SELECT " + COLUMNS + """
                 FROM entities
                WHERE kind = ? AND name_key = ?
                ORDER BY status, id""", ps -> {
            ps.setString(1, kind.name());
            ps.setString(2, nameKey);
        });
    }

    /**
     * Live rows of {@code kind} whose {@code attribute} is set. Used for alias lookup, where the
     * stored values still have to be normalized by the caller.
     */
    public List<Entity> findLiveWithAttribute(EntityKind kind, String attribute) {
        return queryList("SELECT " + COLUMNS + """
                 FROM entities
                WHERE kind = ? AND status = 'ACTIVE' AND json_extract(attributes, ?) IS NOT NULL
                ORDER BY id""", ps -> {
            ps.setString(1, kind.name());
            ps.setString(2, "$." + attribute);
        });
    }

    public List<Entity> findAll(EntityKind kind, boolean includeTombstoned) {
        String sql = "SELECT " + COLUMNS + " FROM entities WHERE kind = ?"
                + (includeTombstoned ? "" : " AND status = 'ACTIVE'")
                + " ORDER BY name_key, disambiguator_key, id";
        return queryList(sql, ps -> ps.setString(1, kind.name()));
    }

    public List<Entity> findChildren(long parentId) {
        return queryList("SELECT " + COLUMNS + " FROM entities WHERE parent_id = ? ORDER BY id",
                ps -> ps.setLong(1, parentId));
    }

    /**
     * Number of associations targeting the entity plus entities naming it as parent.
     * Tombstoned children still count until they are purged.
     */
    public long referenceCount(long id) {
        String sql = "SELECT " + REFERENCE_COUNT + " AS refs FROM entities e WHERE e.id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong("refs") : 0;
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to count references of entity " + id, e);
        }
    }

    /**
     * Status, deletion timestamp and reference count of every entity, read in one statement.
     */
    public List<ReferenceCount> referenceSnapshot() {
        String sql = "SELECT e.id, e.kind, e.name, e.name_key, e.status, e.deleted_at, "
                + REFERENCE_COUNT + " AS refs FROM entities e ORDER BY e.id";
        List<ReferenceCount> counts = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                counts.add(new ReferenceCount(
                        rs.getLong("id"),
                        EntityKind.valueOf(rs.getString("kind")),
                        rs.getString("name"),
                        rs.getString("name_key"),
                        EntityStatus.valueOf(rs.getString("status")),
                        Timestamps.parse(rs.getString("deleted_at")),
                        rs.getLong("refs")));
            }
            return counts;
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to snapshot reference counts", e);
        }
    }

    // ========== Mutations ==========

    public Entity insert(Entity entity, Instant now) {
        String sql = """
                INSERT INTO entities (kind, name, name_key, disambiguator, disambiguator_key, parent_id,
                                      owner_entry_id, attributes, status, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, 'ACTIVE', ?, ?)""";
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, entity.getKind().name());
            ps.setString(2, entity.getName());
            ps.setString(3, entity.getNameKey());
            ps.setString(4, entity.getDisambiguator());
            ps.setString(5, entity.getDisambiguatorKey());
            setNullableLong(ps, 6, entity.getParentId());
            setNullableLong(ps, 7, entity.getOwnerEntryId());
            ps.setString(8, json.write(entity.getAttributes()));
            ps.setString(9, Timestamps.format(now));
            ps.setString(10, Timestamps.format(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new ArchiveStoreException("No id generated for " + entity);
                }
                return Entity.builder(entity)
                        .id(keys.getLong(1))
                        .status(EntityStatus.ACTIVE)
                        .deletedAt(null)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to insert " + entity + ": " + e.getMessage(), e);
        }
    }

    public void updateAttributes(long id, Map<String, Object> attributes, Instant now) {
        update("UPDATE entities SET attributes = ?, updated_at = ? WHERE id = ?", ps -> {
            ps.setString(1, json.write(attributes));
            ps.setString(2, Timestamps.format(now));
            ps.setLong(3, id);
        });
    }

    /**
     * Changes the disambiguator and parent of an entity, moving it to a new natural key.
     */
    public void updateKey(long id, String disambiguator, String disambiguatorKey, Long parentId, Instant now) {
        update("""
                UPDATE entities SET disambiguator = ?, disambiguator_key = ?, parent_id = ?, updated_at = ?
                 WHERE id = ?""", ps -> {
            ps.setString(1, disambiguator);
            ps.setString(2, disambiguatorKey);
            setNullableLong(ps, 3, parentId);
            ps.setString(4, Timestamps.format(now));
            ps.setLong(5, id);
        });
    }

    public boolean tombstone(long id, Instant at) {
        return update("""
                UPDATE entities SET status = 'TOMBSTONED', deleted_at = ?, updated_at = ?
                 WHERE id = ? AND status = 'ACTIVE'""", ps -> {
            ps.setString(1, Timestamps.format(at));
            ps.setString(2, Timestamps.format(at));
            ps.setLong(3, id);
        }) == 1;
    }

    public boolean resurrect(long id, Instant now) {
        return update("""
                UPDATE entities SET status = 'ACTIVE', deleted_at = NULL, updated_at = ?
                 WHERE id = ? AND status = 'TOMBSTONED'""", ps -> {
            ps.setString(1, Timestamps.format(now));
            ps.setLong(2, id);
        }) == 1;
    }

    /**
     * Physically removes a tombstoned entity.
     */
    public boolean delete(long id) {
        return update("DELETE FROM entities WHERE id = ? AND status = 'TOMBSTONED'",
                ps -> ps.setLong(1, id)) == 1;
    }

    // ========== Row mapping ==========

    private Entity map(ResultSet rs) throws SQLException {
        return Entity.builder()
                .id(rs.getLong("id"))
                .kind(EntityKind.valueOf(rs.getString("kind")))
                .name(rs.getString("name"))
                .nameKey(rs.getString("name_key"))
                .disambiguator(rs.getString("disambiguator"))
                .disambiguatorKey(rs.getString("disambiguator_key"))
                .parentId(nullableLong(rs, "parent_id"))
                .ownerEntryId(nullableLong(rs, "owner_entry_id"))
                .attributes(json.readMap(rs.getString("attributes")))
                .status(EntityStatus.valueOf(rs.getString("status")))
                .deletedAt(Timestamps.parse(rs.getString("deleted_at")))
                .createdAt(Timestamps.parse(rs.getString("created_at")))
                .updatedAt(Timestamps.parse(rs.getString("updated_at")))
                .build();
    }

    private Optional<Entity> queryOne(String sql, Binder binder) {
        List<Entity> rows = queryList(sql, binder);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private List<Entity> queryList(String sql, Binder binder) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<Entity> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(map(rs));
                }
                return result;
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Entity query failed: " + e.getMessage(), e);
        }
    }

    private int update(String sql, Binder binder) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new ArchiveStoreException("Entity update failed: " + e.getMessage(), e);
        }
    }

    static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    @FunctionalInterface
    interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
