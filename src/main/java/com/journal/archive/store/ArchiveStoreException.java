package com.journal.archive.store;

import com.journal.archive.core.error.ArchiveException;

/**
 * Wraps a {@link java.sql.SQLException} raised by the relational store.
 */
public class ArchiveStoreException extends ArchiveException {

    public ArchiveStoreException(String message) {
        super(message);
    }

    public ArchiveStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
