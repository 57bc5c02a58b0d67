package com.journal.archive.lock;

/**
 * Lock that never blocks. Only safe when a single thread drives the archive.
 */
public class NoOpDistributedLock implements DistributedLock {

    @Override
    public void lock(String key) {
        // nothing to acquire
    }

    @Override
    public void unlock(String key) {
        // nothing to release
    }
}
