package com.journal.archive.lock;

import com.journal.archive.core.model.EntityKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DistributedLockTest {

    @Nested
    @DisplayName("Lock keys")
    class KeyTests {

        @Test
        @DisplayName("Should build entry keys from the ISO date")
        void testEntryKey() {
            assertEquals("entry:2024-03-15", DistributedLock.entryKey(LocalDate.of(2024, 3, 15)));
        }

        @Test
        @DisplayName("Should build entity keys from kind and name key")
        void testEntityKey() {
            assertEquals("entity:PERSON:clara", DistributedLock.entityKey(EntityKind.PERSON, "clara"));
        }
    }

    @Nested
    @DisplayName("NoOpDistributedLock")
    class NoOpTests {

        @Test
        @DisplayName("Should run the action without blocking")
        void testWithLock() {
            NoOpDistributedLock lock = new NoOpDistributedLock();
            assertEquals("done", lock.withLock("any-key", () -> "done"));
            assertDoesNotThrow(() -> lock.unlock("any-key"));
        }
    }

    @Nested
    @DisplayName("LocalDistributedLock")
    class LocalLockTests {

        @Test
        @DisplayName("Should acquire and release lock")
        void testAcquireRelease() {
            LocalDistributedLock lock = new LocalDistributedLock();
            lock.lock("test-key");
            assertTrue(lock.isLocked("test-key"));
            lock.unlock("test-key");
            assertFalse(lock.isLocked("test-key"));
        }

        @Test
        @DisplayName("Should allow re-entrant locking from same thread")
        void testReentrant() {
            LocalDistributedLock lock = new LocalDistributedLock();
            String result = lock.withLock("entry:2024-01-01",
                    () -> lock.withLock("entry:2024-01-01", () -> "nested"));
            assertEquals("nested", result);
            assertFalse(lock.isLocked("entry:2024-01-01"));
        }

        @Test
        @DisplayName("Should release the lock when the action throws")
        void testReleaseOnFailure() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertThrows(IllegalStateException.class, () -> lock.withLock("k", () -> {
                throw new IllegalStateException("boom");
            }));
            assertFalse(lock.isLocked("k"));
        }

        @Test
        @DisplayName("Should ignore unlock of a key never locked")
        void testUnlockUnknown() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertDoesNotThrow(() -> lock.unlock("never-locked"));
        }

        @Test
        @DisplayName("Should time out when another thread holds the key")
        void testTimeout() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(50, true));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<?> holder = executor.submit(() -> {
                    lock.lock("busy");
                    held.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        lock.unlock("busy");
                    }
                });
                assertTrue(held.await(5, TimeUnit.SECONDS));
                assertThrows(LockAcquisitionException.class, () -> lock.lock("busy"));
                release.countDown();
                holder.get(5, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should serialize concurrent holders of one key")
        void testMutualExclusion() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock();
            AtomicInteger inside = new AtomicInteger();
            AtomicInteger maxInside = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                for (int i = 0; i < 20; i++) {
                    executor.submit(() -> lock.withLock("shared", () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        inside.decrementAndGet();
                        return null;
                    }));
                }
                executor.shutdown();
                assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }
            assertEquals(1, maxInside.get());
        }

        @Test
        @DisplayName("Should forget keys once released")
        void testKeysReleased() {
            LocalDistributedLock lock = new LocalDistributedLock();
            for (int day = 1; day <= 28; day++) {
                lock.withLock(DistributedLock.entryKey(LocalDate.of(2024, 2, day)),
                        () -> lock.withLock("entity:PERSON:clara", () -> null));
            }
            assertEquals(0, lock.activeKeys());

            lock.lock("held");
            lock.lock("held");
            lock.unlock("held");
            assertEquals(1, lock.activeKeys());
            assertTrue(lock.isLocked("held"));
            lock.unlock("held");
            assertEquals(0, lock.activeKeys());
        }

        @Test
        @DisplayName("Should forget a key after a timed-out waiter gives up")
        void testKeyReleasedAfterTimeout() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(50, true));
            lock.lock("busy");
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<?> waiter = executor.submit(() -> assertThrows(LockAcquisitionException.class,
                        () -> lock.lock("busy")));
                waiter.get(5, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }
            assertEquals(1, lock.activeKeys());
            lock.unlock("busy");
            assertEquals(0, lock.activeKeys());
        }

        @Test
        @DisplayName("Should keep one holder per key while entries come and go")
        void testExclusionWithEviction() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock();
            AtomicInteger inside = new AtomicInteger();
            AtomicInteger maxInside = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                for (int i = 0; i < 500; i++) {
                    executor.submit(() -> lock.withLock("churn", () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        inside.decrementAndGet();
                        return null;
                    }));
                }
                executor.shutdown();
                assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }
            assertEquals(1, maxInside.get());
            assertEquals(0, lock.activeKeys());
        }

        @Test
        @DisplayName("Should reject a non-positive timeout")
        void testInvalidConfig() {
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(0, true));
        }
    }
}
