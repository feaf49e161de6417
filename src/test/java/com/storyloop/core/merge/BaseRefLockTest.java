package com.storyloop.core.merge;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class BaseRefLockTest {

    @TempDir
    Path tempDir;

    @Test
    void lockFileNameIsSanitized() {
        var lock = new BaseRefLock(tempDir);

        assertEquals(tempDir.resolve("feature_x.lock"), lock.lockFile("feature/x"));
    }

    @Test
    void acquireCreatesLockFile() throws Exception {
        var lock = new BaseRefLock(tempDir.resolve("locks"));

        try (var lease = lock.acquire("main", Duration.ofSeconds(1))) {
            assertEquals("main", lease.ref());
            assertTrue(Files.exists(lock.lockFile("main")));
        }
    }

    @Test
    void secondHolderTimesOutUntilRelease() throws Exception {
        var lock = new BaseRefLock(tempDir);
        var lease = lock.acquire("main", Duration.ofSeconds(1));

        var blocked = CompletableFuture.supplyAsync(() -> tryAcquire(lock, Duration.ofMillis(200)));
        assertEquals("timeout", blocked.get(5, TimeUnit.SECONDS));

        lease.close();
        var after = CompletableFuture.supplyAsync(() -> tryAcquire(lock, Duration.ofSeconds(1)));
        assertEquals("acquired", after.get(5, TimeUnit.SECONDS));
    }

    @Test
    void differentRefsDoNotBlockEachOther() throws Exception {
        var lock = new BaseRefLock(tempDir);

        try (var main = lock.acquire("main", Duration.ofSeconds(1))) {
            var other = CompletableFuture.supplyAsync(() -> tryAcquire(lock, "develop", Duration.ofMillis(200)));
            assertEquals("acquired", other.get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void closingTwiceIsHarmless() throws Exception {
        var lock = new BaseRefLock(tempDir);
        var lease = lock.acquire("main", Duration.ofSeconds(1));

        lease.close();
        assertDoesNotThrow(lease::close);
    }

    private static String tryAcquire(BaseRefLock lock, Duration timeout) {
        return tryAcquire(lock, "main", timeout);
    }

    private static String tryAcquire(BaseRefLock lock, String ref, Duration timeout) {
        try (var lease = lock.acquire(ref, timeout)) {
            return "acquired";
        } catch (TimeoutException e) {
            return "timeout";
        }
    }
}
