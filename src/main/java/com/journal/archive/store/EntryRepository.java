package com.journal.archive.store;

import com.journal.archive.core.model.Entry;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Repository for entry rows.
 */
public class EntryRepository {

    private static final String COLUMNS =
            "id, entry_date, content_digest, metadata_digest, word_count, deleted_at, created_at, updated_at";

    private final Connection conn;

    public EntryRepository(Connection conn) {
        this.conn = conn;
    }

    public Optional<Entry> findByDate(LocalDate date) {
        List<Entry> rows = query("SELECT " + COLUMNS + " FROM entries WHERE entry_date = ?",
                ps -> ps.setString(1, date.toString()));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Entry> findById(long id) {
        List<Entry> rows = query("SELECT " + COLUMNS + " FROM entries WHERE id = ?", ps -> ps.setLong(1, id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Entry> findAll(boolean includeDeleted) {
        return query("SELECT " + COLUMNS + " FROM entries"
                + (includeDeleted ? "" : " WHERE deleted_at IS NULL")
                + " ORDER BY entry_date", ps -> {
        });
    }

    /**
     * Soft-deleted entries whose deletion happened at or before {@code cutoff}.
     */
    public List<Entry> findDeletedBefore(Instant cutoff) {
        return query("SELECT " + COLUMNS + " FROM entries WHERE deleted_at IS NOT NULL AND deleted_at <= ?"
                + " ORDER BY entry_date", ps -> ps.setString(1, Timestamps.format(cutoff)));
    }

    public Entry insert(LocalDate date, String contentDigest, String metadataDigest, int wordCount, Instant now) {
        String sql = """
                INSERT INTO entries (entry_date, content_digest, metadata_digest, word_count, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?)""";
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, date.toString());
            ps.setString(2, contentDigest);
            ps.setString(3, metadataDigest);
            ps.setInt(4, wordCount);
            ps.setString(5, Timestamps.format(now));
            ps.setString(6, Timestamps.format(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new ArchiveStoreException("No id generated for entry " + date);
                }
                return new Entry(keys.getLong(1), date, contentDigest, metadataDigest, wordCount, null, now, now);
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to insert entry " + date + ": " + e.getMessage(), e);
        }
    }

    /**
     * Overwrites the entry's scalar fields and clears any soft delete.
     */
    public void update(long id, String contentDigest, String metadataDigest, int wordCount, Instant now) {
        execute("""
                UPDATE entries
                   SET content_digest = ?, metadata_digest = ?, word_count = ?, deleted_at = NULL, updated_at = ?
                 WHERE id = ?""", ps -> {
            ps.setString(1, contentDigest);
            ps.setString(2, metadataDigest);
            ps.setInt(3, wordCount);
            ps.setString(4, Timestamps.format(now));
            ps.setLong(5, id);
        });
    }

    public boolean softDelete(long id, Instant at) {
        return execute("UPDATE entries SET deleted_at = ?, updated_at = ? WHERE id = ? AND deleted_at IS NULL", ps -> {
            ps.setString(1, Timestamps.format(at));
            ps.setString(2, Timestamps.format(at));
            ps.setLong(3, id);
        }) == 1;
    }

    /**
     * Physically removes a soft-deleted entry that no association or scene still points at.
     */
    public boolean purge(long id) {
        return execute("""
                DELETE FROM entries
                 WHERE id = ?
                   AND deleted_at IS NOT NULL
                   AND NOT EXISTS (SELECT 1 FROM associations a WHERE a.entry_id = entries.id)
                   AND NOT EXISTS (SELECT 1 FROM entities e WHERE e.owner_entry_id = entries.id)""",
                ps -> ps.setLong(1, id)) == 1;
    }

    private Entry map(ResultSet rs) throws SQLException {
        return new Entry(
                rs.getLong("id"),
                LocalDate.parse(rs.getString("entry_date")),
                rs.getString("content_digest"),
                rs.getString("metadata_digest"),
                rs.getInt("word_count"),
                Timestamps.parse(rs.getString("deleted_at")),
                Timestamps.parse(rs.getString("created_at")),
                Timestamps.parse(rs.getString("updated_at")));
    }

    private List<Entry> query(String sql, EntityRepository.Binder binder) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<Entry> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(map(rs));
                }
                return result;
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Entry query failed: " + e.getMessage(), e);
        }
    }

    private int execute(String sql, EntityRepository.Binder binder) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new ArchiveStoreException("Entry update failed: " + e.getMessage(), e);
        }
    }
}
