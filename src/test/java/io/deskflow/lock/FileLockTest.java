package io.deskflow.lock;

import io.deskflow.TempDirs;
import io.deskflow.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class FileLockTest {

    @Test
    void secondAcquirerSeesLockBusyAndMarkerIsGoneAfterRelease() throws Exception {
        Path root = Files.createTempDirectory("deskflow-lock-busy-");
        try {
            Path marker = root.resolve("runs").resolve("runner.lock");
            FileLock lock = new FileLock("test");
            try (LockHandle handle = lock.acquire(marker)) {
                Assertions.assertTrue(Files.exists(marker));
                LockBusyException busy = Assertions.assertThrows(LockBusyException.class, () -> lock.acquire(marker));
                Assertions.assertEquals("lock_busy", busy.reason());
                Assertions.assertEquals("test", busy.holder().holder());
                Assertions.assertFalse(handle.isReleased());
            }
            Assertions.assertFalse(Files.exists(marker));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void concurrentAcquirersHaveExactlyOneWinner() throws Exception {
        Path root = Files.createTempDirectory("deskflow-lock-race-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Path marker = root.resolve("race.lock");
            FileLock lock = new FileLock("racer");
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return lock.tryAcquire(marker).isPresent();
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    winners++;
                }
            }
            Assertions.assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void releaseIsIdempotent() throws Exception {
        Path root = Files.createTempDirectory("deskflow-lock-idem-");
        try {
            Path marker = root.resolve("a.lock");
            FileLock lock = new FileLock("test");
            LockHandle handle = lock.acquire(marker);
            handle.release();
            handle.release();
            Assertions.assertTrue(handle.isReleased());
            Assertions.assertFalse(lock.isHeld(marker));
            Assertions.assertEquals(-1L, lock.ageMs(marker));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void staleMarkerIsClearedAndReacquiredButFreshOneIsNot() throws Exception {
        Path root = Files.createTempDirectory("deskflow-lock-stale-");
        try {
            Path stale = root.resolve("stale.lock");
            Path fresh = root.resolve("fresh.lock");
            long now = System.currentTimeMillis();
            writeStamp(stale, new LockStamp("crashed", 1L, "host", now - 120_000L, "old-token"));
            writeStamp(fresh, new LockStamp("alive", 2L, "host", now, "fresh-token"));

            FileLock lock = new FileLock("recovering", 60_000L);
            try (LockHandle handle = lock.acquire(stale)) {
                Assertions.assertEquals("recovering", lock.readStamp(stale).orElseThrow().holder());
                Assertions.assertNotEquals("old-token", handle.stamp().token());
            }
            Assertions.assertThrows(LockBusyException.class, () -> lock.acquire(fresh));
            Assertions.assertEquals("alive", lock.readStamp(fresh).orElseThrow().holder());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void recoveryDisabledByDefaultAndStrictModeReportsStaleness() throws Exception {
        Path root = Files.createTempDirectory("deskflow-lock-strict-");
        try {
            Path stale = root.resolve("stale.lock");
            writeStamp(stale, new LockStamp("crashed", 1L, "host", System.currentTimeMillis() - 120_000L, "t"));

            Assertions.assertThrows(LockBusyException.class, () -> new FileLock("default").acquire(stale));
            Assertions.assertThrows(StaleLockException.class, () -> new FileLock("strict", 1_000L).acquireStrict(stale));
            Assertions.assertTrue(Files.exists(stale));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void handleDoesNotDeleteMarkerRecreatedByAnotherHolder() throws Exception {
        Path root = Files.createTempDirectory("deskflow-lock-token-");
        try {
            Path marker = root.resolve("shared.lock");
            FileLock lock = new FileLock("first");
            LockHandle first = lock.acquire(marker);
            lock.release(marker);
            LockHandle second = new FileLock("second").acquire(marker);

            first.release();
            Assertions.assertTrue(Files.exists(marker));
            second.release();
            Assertions.assertFalse(Files.exists(marker));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void concurrentRecoveryOfStaleMarkerKeepsSingleHolder() throws Exception {
        Path root = Files.createTempDirectory("deskflow-lock-stale-race-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Path marker = root.resolve("run.lock");
            FileLock lock = new FileLock("recovering", 60_000L);
            for (int round = 0; round < 10; round++) {
                writeStamp(marker, new LockStamp("crashed", 1L, "host", 1L, "dead-" + round));
                CountDownLatch start = new CountDownLatch(1);
                AtomicInteger holding = new AtomicInteger();
                AtomicInteger maxHolding = new AtomicInteger();
                AtomicInteger acquired = new AtomicInteger();
                List<Future<?>> results = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        try (LockHandle ignored = lock.acquire(marker)) {
                            acquired.incrementAndGet();
                            maxHolding.accumulateAndGet(holding.incrementAndGet(), Math::max);
                            Thread.sleep(30L);
                            holding.decrementAndGet();
                        } catch (LockBusyException busy) {
                            Assertions.assertEquals("lock_busy", busy.reason());
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> result : results) {
                    result.get(10, TimeUnit.SECONDS);
                }
                Assertions.assertEquals(1, maxHolding.get(), "round " + round);
                Assertions.assertTrue(acquired.get() >= 1, "round " + round);
                Assertions.assertFalse(Files.exists(marker));
                Assertions.assertFalse(Files.exists(FileLock.guardPath(marker)));
            }
        } finally {
            pool.shutdownNow();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void clearingWaitsForRecoveryGuardAndRemovesAbandonedOne() throws Exception {
        Path root = Files.createTempDirectory("deskflow-lock-guard-");
        try {
            Path marker = root.resolve("run.lock");
            writeStamp(marker, new LockStamp("crashed", 1L, "host", 1L, "dead"));
            Path guard = FileLock.guardPath(marker);
            Files.createFile(guard);
            FileLock lock = new FileLock("recovering", 60_000L);

            Assertions.assertFalse(lock.clearIfStale(marker, 60_000L));
            Assertions.assertTrue(Files.exists(marker));

            Files.setLastModifiedTime(guard, FileTime.fromMillis(
                    System.currentTimeMillis() - FileLock.GUARD_STALE_MS - 1_000L));
            Assertions.assertFalse(lock.clearIfStale(marker, 60_000L));
            Assertions.assertFalse(Files.exists(guard));
            Assertions.assertTrue(lock.clearIfStale(marker, 60_000L));
            Assertions.assertFalse(Files.exists(marker));
            Assertions.assertFalse(Files.exists(guard));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    private static void writeStamp(Path file, LockStamp stamp) throws Exception {
        Files.writeString(file, Jsons.toCompactJson(stamp), StandardCharsets.UTF_8);
    }
}
