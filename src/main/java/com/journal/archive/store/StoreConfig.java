package com.journal.archive.store;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Connection settings for the SQLite store.
 *
 * @param jdbcUrl       {@code jdbc:sqlite:} URL of the archive database
 * @param busyTimeoutMs how long a writer waits for the database write lock
 * @param walEnabled    whether to use write-ahead logging (readers never block the writer)
 */
public record StoreConfig(String jdbcUrl, int busyTimeoutMs, boolean walEnabled) {

    public StoreConfig {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl is required");
        if (!jdbcUrl.startsWith("jdbc:sqlite:")) {
            throw new IllegalArgumentException("jdbcUrl must be a jdbc:sqlite: URL");
        }
        if (busyTimeoutMs <= 0) {
            throw new IllegalArgumentException("busyTimeoutMs must be > 0");
        }
    }

    public static StoreConfig forFile(Path file) {
        return new StoreConfig("jdbc:sqlite:" + file.toAbsolutePath(), 10_000, true);
    }

    public StoreConfig withBusyTimeoutMs(int timeoutMs) {
        return new StoreConfig(jdbcUrl, timeoutMs, walEnabled);
    }
}
