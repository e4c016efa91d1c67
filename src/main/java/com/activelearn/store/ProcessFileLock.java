package com.activelearn.store;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive lock on a lock file, held across processes through an OS file lock and across threads of this JVM
 * through a shared {@link ReentrantLock}. Reentrant for the owning thread.
 */
public final class ProcessFileLock {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final long RETRY_MILLIS = 10L;
    private static final ConcurrentMap<Path, Holder> HOLDERS = new ConcurrentHashMap<>();

    private final Path lockFile;
    private final Duration timeout;
    private final Holder holder;

    public ProcessFileLock(Path lockFile) {
        this(lockFile, DEFAULT_TIMEOUT);
    }

    public ProcessFileLock(Path lockFile, Duration timeout) {
        this.lockFile = Objects.requireNonNull(lockFile, "lockFile").toAbsolutePath().normalize();
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.holder = HOLDERS.computeIfAbsent(this.lockFile, ignored -> new Holder());
    }

    public Path lockFile() {
        return lockFile;
    }

    public boolean isHeldByCurrentThread() {
        return holder.threadLock.isHeldByCurrentThread();
    }

    public <T> T withLock(LockedCall<T> action) throws IOException {
        long deadline = System.nanoTime() + timeout.toNanos();
        acquireThreadLock();
        try {
            boolean outermost = holder.threadLock.getHoldCount() == 1;
            if (outermost) {
                acquireFileLock(deadline);
            }
            try {
                return action.call();
            } finally {
                if (outermost) {
                    releaseFileLock();
                }
            }
        } finally {
            holder.threadLock.unlock();
        }
    }

    private void acquireThreadLock() throws IOException {
        try {
            if (!holder.threadLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IOException("Timed out after " + timeout + " waiting for lock " + lockFile);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for lock " + lockFile);
        }
    }

    private void acquireFileLock(long deadline) throws IOException {
        if (lockFile.getParent() != null) {
            Files.createDirectories(lockFile.getParent());
        }
        FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        try {
            while (true) {
                FileLock lock = channel.tryLock();
                if (lock != null) {
                    holder.channel = channel;
                    return;
                }
                if (System.nanoTime() >= deadline) {
                    throw new IOException("Timed out after " + timeout + " waiting for lock " + lockFile);
                }
                Thread.sleep(RETRY_MILLIS);
            }
        } catch (InterruptedException e) {
            channel.close();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for lock " + lockFile);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    private void releaseFileLock() throws IOException {
        FileChannel channel = holder.channel;
        holder.channel = null;
        if (channel != null) {
            // closing the channel releases the lock
            channel.close();
        }
    }

    @FunctionalInterface
    public interface LockedCall<T> {
        T call() throws IOException;
    }

    private static final class Holder {
        final ReentrantLock threadLock = new ReentrantLock();
        FileChannel channel;
    }
}
