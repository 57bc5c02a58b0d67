package com.journal.archive.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * One database write transaction plus the in-memory side effects tied to it.
 *
 * <p>Store mutations go through the repositories obtained here and commit or roll
 * back together. Side effects outside the store register either a compensation
 * (run in reverse order if the transaction does not commit) or an after-commit
 * action (run only once the commit succeeded).</p>
 *
 * <pre>
 * try (UnitOfWork uow = database.begin()) {
 *     Entity created = uow.entities().insert(entity);
 *     uow.onRollback("uncache " + key, () -> cache.invalidate(created.getId()));
 *     uow.afterCommit(() -> audit.record(...));
 *     uow.commit();
 * }
 * </pre>
 */
public class UnitOfWork implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    private final Connection connection;
    private final Instant now;
    private final JsonCodec json;
    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private final List<Runnable> afterCommit = new ArrayList<>();
    private boolean committed = false;
    private boolean closed = false;

    private EntityRepository entities;
    private EntryRepository entries;
    private AssociationRepository associations;
    private PoemVersionRepository poemVersions;
    private AssociationTombstoneRepository associationTombstones;
    private SyncStateRepository syncStates;

    UnitOfWork(Connection connection, Instant now, JsonCodec json) {
        this.connection = connection;
        this.now = now;
        this.json = json;
    }

    /**
     * Transaction timestamp. Every row written in this unit of work uses it.
     */
    public Instant now() {
        return now;
    }

    public Connection connection() {
        return connection;
    }

    public JsonCodec json() {
        return json;
    }

    public EntityRepository entities() {
        if (entities == null) {
            entities = new EntityRepository(connection, json);
        }
        return entities;
    }

    public EntryRepository entries() {
        if (entries == null) {
            entries = new EntryRepository(connection);
        }
        return entries;
    }

    public AssociationRepository associations() {
        if (associations == null) {
            associations = new AssociationRepository(connection);
        }
        return associations;
    }

    public PoemVersionRepository poemVersions() {
        if (poemVersions == null) {
            poemVersions = new PoemVersionRepository(connection);
        }
        return poemVersions;
    }

    public AssociationTombstoneRepository associationTombstones() {
        if (associationTombstones == null) {
            associationTombstones = new AssociationTombstoneRepository(connection);
        }
        return associationTombstones;
    }

    public SyncStateRepository syncStates() {
        if (syncStates == null) {
            syncStates = new SyncStateRepository(connection, json);
        }
        return syncStates;
    }

    /**
     * Registers an undo action for an in-memory side effect already performed.
     */
    public void onRollback(String description, Runnable compensation) {
        ensureOpen();
        compensationStack.push(new CompensatingAction(description, compensation));
    }

    /**
     * Registers an action that runs once the transaction has committed.
     */
    public void afterCommit(Runnable action) {
        ensureOpen();
        afterCommit.add(action);
    }

    public void commit() {
        ensureOpen();
        try {
            connection.commit();
            connection.setAutoCommit(true);
            committed = true;
        } catch (SQLException e) {
            throw new ArchiveStoreException("Commit failed: " + e.getMessage(), e);
        }
        compensationStack.clear();
        for (Runnable action : afterCommit) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("uow.afterCommitFailed error={}", e.getMessage(), e);
            }
        }
        afterCommit.clear();
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!committed) {
                rollback();
            }
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("uow.closeFailed error={}", e.getMessage());
            }
        }
    }

    private void rollback() {
        try {
            connection.rollback();
            log.debug("uow.rolledBack compensations={}", compensationStack.size());
        } catch (SQLException e) {
            log.error("uow.rollbackFailed error={}", e.getMessage(), e);
        }
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("uow.compensating step={}", action.description());
                action.compensation().run();
            } catch (RuntimeException e) {
                log.error("Compensation '{}' failed (best-effort): {}", action.description(), e.getMessage());
            }
        }
        afterCommit.clear();
    }

    private void ensureOpen() {
        if (closed || committed) {
            throw new IllegalStateException("Unit of work is already " + (closed ? "closed" : "committed"));
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {
    }
}
