package com.journal.archive.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-entity merge baselines and the conflicts detected against them.
 */
public class SyncStateRepository {

    private final Connection conn;
    private final JsonCodec json;

    public SyncStateRepository(Connection conn, JsonCodec json) {
        this.conn = conn;
        this.json = json;
    }

    // ========== Baselines ==========

    public Optional<SyncState> find(long entityId) {
        String sql = "SELECT entity_id, fingerprint, baseline, last_merged_at FROM sync_states WHERE entity_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, entityId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new SyncState(
                        rs.getLong("entity_id"),
                        rs.getString("fingerprint"),
                        json.readMap(rs.getString("baseline")),
                        Timestamps.parse(rs.getString("last_merged_at"))));
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to read sync state of entity " + entityId, e);
        }
    }

    public void save(long entityId, Map<String, Object> baseline, Instant mergedAt) {
        String sql = """
                INSERT INTO sync_states (entity_id, fingerprint, baseline, last_merged_at)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (entity_id) DO UPDATE
                   SET fingerprint = excluded.fingerprint,
                       baseline = excluded.baseline,
                       last_merged_at = excluded.last_merged_at""";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, entityId);
            ps.setString(2, json.fingerprint(baseline));
            ps.setString(3, json.write(baseline));
            ps.setString(4, Timestamps.format(mergedAt));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to save sync state of entity " + entityId, e);
        }
    }

    // ========== Conflicts ==========

    public void insertConflict(long entityId, String field, Object storeValue, Object noteValue,
                               Object baselineValue, Instant detectedAt) {
        String sql = """
                INSERT INTO sync_conflicts (entity_id, field, store_value, note_value, baseline_value, detected_at)
                VALUES (?, ?, ?, ?, ?, ?)""";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, entityId);
            ps.setString(2, field);
            ps.setString(3, json.write(storeValue));
            ps.setString(4, json.write(noteValue));
            ps.setString(5, json.write(baselineValue));
            ps.setString(6, Timestamps.format(detectedAt));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to record conflict on entity " + entityId, e);
        }
    }

    public List<StoredConflict> openConflicts() {
        return queryConflicts("SELECT * FROM sync_conflicts WHERE resolved_at IS NULL ORDER BY id", null);
    }

    public List<StoredConflict> openConflicts(long entityId) {
        return queryConflicts(
                "SELECT * FROM sync_conflicts WHERE resolved_at IS NULL AND entity_id = ? ORDER BY id", entityId);
    }

    /**
     * Marks the open conflicts of one field as resolved.
     *
     * @return number of conflicts closed
     */
    public int resolveConflicts(long entityId, String field, Instant resolvedAt) {
        String sql = """
                UPDATE sync_conflicts SET resolved_at = ?
                 WHERE entity_id = ? AND field = ? AND resolved_at IS NULL""";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Timestamps.format(resolvedAt));
            ps.setLong(2, entityId);
            ps.setString(3, field);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to resolve conflicts on entity " + entityId, e);
        }
    }

    private List<StoredConflict> queryConflicts(String sql, Long entityId) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (entityId != null) {
                ps.setLong(1, entityId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<StoredConflict> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(new StoredConflict(
                            rs.getLong("id"),
                            rs.getLong("entity_id"),
                            rs.getString("field"),
                            json.readValue(rs.getString("store_value")),
                            json.readValue(rs.getString("note_value")),
                            json.readValue(rs.getString("baseline_value")),
                            Timestamps.parse(rs.getString("detected_at"))));
                }
                return result;
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Conflict query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Last merged editable state of an entity.
     *
     * @param fingerprint SHA-256 of the canonical JSON baseline
     */
    public record SyncState(long entityId, String fingerprint, Map<String, Object> baseline, Instant lastMergedAt) {
    }

    public record StoredConflict(long id, long entityId, String field, Object storeValue, Object noteValue,
                                 Object baselineValue, Instant detectedAt) {
    }
}
