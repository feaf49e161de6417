package com.storyloop.core.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive advisory lock on a base reference, held for the duration of one merge.
 *
 * <p>Threads in this JVM queue on a fair {@link ReentrantLock}; other processes are
 * excluded by an OS file lock on {@code <locksDir>/<ref>.lock}. A {@link Lease} must be
 * closed by the thread that acquired it.
 */
public class BaseRefLock {

    private static final Logger log = LoggerFactory.getLogger(BaseRefLock.class);

    private static final long POLL_MILLIS = 100;

    private final Path locksDir;
    private final ConcurrentHashMap<String, ReentrantLock> localLocks = new ConcurrentHashMap<>();

    public BaseRefLock(Path locksDir) {
        this.locksDir = locksDir;
    }

    /**
     * @throws TimeoutException if the lock could not be obtained within {@code timeout}
     */
    public Lease acquire(String ref, Duration timeout) throws TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        ReentrantLock local = localLocks.computeIfAbsent(ref, r -> new ReentrantLock(true));
        try {
            if (!local.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new TimeoutException("Timed out waiting for merge lock on " + ref);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for merge lock on " + ref, e);
        }

        FileChannel channel = null;
        try {
            Files.createDirectories(locksDir);
            channel = FileChannel.open(lockFile(ref), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            while (true) {
                FileLock fileLock = channel.tryLock();
                if (fileLock != null) {
                    log.debug("Acquired merge lock on {}", ref);
                    return new Lease(ref, local, channel, fileLock);
                }
                if (System.nanoTime() >= deadline) {
                    throw new TimeoutException("Merge lock on " + ref + " is held by another process");
                }
                Thread.sleep(POLL_MILLIS);
            }
        } catch (IOException e) {
            closeQuietly(channel, ref);
            local.unlock();
            throw new UncheckedIOException("Could not open merge lock for " + ref, e);
        } catch (InterruptedException e) {
            closeQuietly(channel, ref);
            local.unlock();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for merge lock on " + ref, e);
        } catch (TimeoutException e) {
            closeQuietly(channel, ref);
            local.unlock();
            throw e;
        }
    }

    Path lockFile(String ref) {
        return locksDir.resolve(ref.replaceAll("[^A-Za-z0-9._-]", "_") + ".lock");
    }

    private static void closeQuietly(FileChannel channel, String ref) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock file for {}: {}", ref, e.getMessage());
        }
    }

    /**
     * Held merge lock. Closing releases both the file lock and the in-process lock.
     */
    public static final class Lease implements AutoCloseable {

        private final String ref;
        private final ReentrantLock local;
        private final FileChannel channel;
        private final FileLock fileLock;
        private boolean released;

        private Lease(String ref, ReentrantLock local, FileChannel channel, FileLock fileLock) {
            this.ref = ref;
            this.local = local;
            this.channel = channel;
            this.fileLock = fileLock;
        }

        public String ref() {
            return ref;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                fileLock.release();
            } catch (IOException e) {
                log.warn("Failed to release file lock for {}: {}", ref, e.getMessage());
            } finally {
                closeQuietly(channel, ref);
                local.unlock();
                log.debug("Released merge lock on {}", ref);
            }
        }
    }
}
