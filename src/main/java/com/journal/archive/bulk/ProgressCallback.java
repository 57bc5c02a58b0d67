package com.journal.archive.bulk;

/**
 * Callback for tracking progress of bulk operations.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed number of items handled so far
     * @param total     total number of items, or -1 if unknown
     * @param message   optional progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {
    };
}
