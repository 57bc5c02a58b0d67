package com.journal.archive.core.error;

/**
 * Base class for failures raised by the archive engine.
 * All subclasses are scoped to a single entry or entity and abort only the
 * transaction they occur in.
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
