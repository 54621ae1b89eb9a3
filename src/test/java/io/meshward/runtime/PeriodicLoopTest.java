package io.meshward.runtime;

import io.meshward.observability.AuditLogger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class PeriodicLoopTest {

    @Test
    void failingTickIsLoggedAndLoopKeepsGoing() throws Exception {
        Path root = Files.createTempDirectory("meshward-test-loop-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"), "node-a");
            AtomicInteger calls = new AtomicInteger();
            CountDownLatch thirdTick = new CountDownLatch(3);
            PeriodicLoop loop = new PeriodicLoop("flaky", 10L, () -> {
                thirdTick.countDown();
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("boom");
                }
            }, audit);

            loop.start();
            Assertions.assertTrue(thirdTick.await(5, TimeUnit.SECONDS));
            loop.stop();

            Assertions.assertFalse(loop.isRunning());
            Assertions.assertEquals(1L, loop.errors());
            Assertions.assertTrue(loop.ticks() >= 2);
            String log = Files.readString(root.resolve("audit.log"));
            Assertions.assertTrue(log.contains("\"action\":\"loop.error\""));
            Assertions.assertTrue(log.contains("boom"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unwritableAuditLogDoesNotStopTheLoop() throws Exception {
        Path root = Files.createTempDirectory("meshward-test-loop-");
        try {
            Path auditFile = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(auditFile, "node-a");
            Files.delete(auditFile);
            Files.createDirectory(auditFile);
            AtomicInteger calls = new AtomicInteger();
            CountDownLatch thirdTick = new CountDownLatch(3);
            PeriodicLoop loop = new PeriodicLoop("flaky", 10L, () -> {
                thirdTick.countDown();
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("boom");
                }
            }, audit);

            loop.start();
            boolean reachedThirdTick = thirdTick.await(5, TimeUnit.SECONDS);
            Assertions.assertTrue(loop.isRunning());
            loop.stop();

            Assertions.assertTrue(reachedThirdTick, "loop stopped after its first failing tick: calls=" + calls.get());
            Assertions.assertEquals(1L, loop.errors());
            Assertions.assertTrue(loop.ticks() >= 2);
            Assertions.assertEquals(1L, audit.failedWrites());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stopLetsRunningTickFinish() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();
        PeriodicLoop loop = new PeriodicLoop("slow", 1_000L, () -> {
            entered.countDown();
            try {
                Thread.sleep(200L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            finished.incrementAndGet();
        }, null);

        loop.start();
        Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));
        loop.stop();
        Assertions.assertEquals(1, finished.get());
        Assertions.assertEquals(1L, loop.ticks());
    }

    @Test
    void runOnceReportsFailureWithoutThrowing() {
        PeriodicLoop loop = new PeriodicLoop("once", 1_000L, () -> {
            throw new IllegalArgumentException("bad tick");
        }, null);
        Assertions.assertFalse(loop.runOnce());
        Assertions.assertEquals(1L, loop.errors());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PeriodicLoop("zero", 0L, () -> { }, null));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
