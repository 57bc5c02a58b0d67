package com.journal.archive.store;

import com.journal.archive.core.model.PoemVersion;

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
 * Append-only storage for poem versions. There is no update statement; a content hash is
 * stored at most once per poem.
 */
public class PoemVersionRepository {

    private final Connection conn;

    public PoemVersionRepository(Connection conn) {
        this.conn = conn;
    }

    /**
     * The stored version of {@code poemId} with {@code contentHash}, whichever entry wrote it.
     */
    public Optional<PoemVersion> findByHash(long poemId, String contentHash) {
        String sql = "SELECT * FROM poem_versions WHERE poem_id = ? AND content_hash = ? ORDER BY id LIMIT 1";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, poemId);
            ps.setString(2, contentHash);
            List<PoemVersion> versions = read(ps);
            return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(0));
        } catch (SQLException e) {
            throw new ArchiveStoreException("Poem version lookup failed: " + e.getMessage(), e);
        }
    }

    public List<PoemVersion> findForPoem(long poemId) {
        return query("SELECT * FROM poem_versions WHERE poem_id = ? ORDER BY id", poemId);
    }

    public PoemVersion append(long poemId, Long entryId, String content, String contentHash,
                              LocalDate revisionDate, Instant now) {
        String sql = """
                INSERT INTO poem_versions (poem_id, entry_id, content, content_hash, revision_date, created_at)
                VALUES (?, ?, ?, ?, ?, ?)""";
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, poemId);
            EntityRepository.setNullableLong(ps, 2, entryId);
            ps.setString(3, content);
            ps.setString(4, contentHash);
            ps.setString(5, revisionDate != null ? revisionDate.toString() : null);
            ps.setString(6, Timestamps.format(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new ArchiveStoreException("No id generated for version of poem " + poemId);
                }
                return new PoemVersion(keys.getLong(1), poemId, entryId, content, contentHash, revisionDate, now);
            }
        } catch (SQLException e) {
            throw new ArchiveStoreException("Failed to append version of poem " + poemId, e);
        }
    }

    private List<PoemVersion> query(String sql, long poemId) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, poemId);
            return read(ps);
        } catch (SQLException e) {
            throw new ArchiveStoreException("Poem version query failed: " + e.getMessage(), e);
        }
    }

    private static List<PoemVersion> read(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            List<PoemVersion> result = new ArrayList<>();
            while (rs.next()) {
                String revision = rs.getString("revision_date");
                result.add(new PoemVersion(
                        rs.getLong("id"),
                        rs.getLong("poem_id"),
                        EntityRepository.nullableLong(rs, "entry_id"),
                        rs.getString("content"),
                        rs.getString("content_hash"),
                        revision != null ? LocalDate.parse(revision) : null,
                        Timestamps.parse(rs.getString("created_at"))));
            }
            return result;
        }
    }
}
