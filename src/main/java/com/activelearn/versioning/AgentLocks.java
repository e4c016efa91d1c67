package com.activelearn.versioning;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import com.activelearn.store.ProcessFileLock;

/**
 * One exclusive lock per agent. Every slot or weight mutation for an agent runs under its lock; different agents
 * never contend. With a lock directory the lock also excludes other processes using the same directory.
 */
public final class AgentLocks {
    private final Path lockDirectory;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ProcessFileLock> fileLocks = new ConcurrentHashMap<>();

    public AgentLocks() {
        this(null);
    }

    public AgentLocks(Path lockDirectory) {
        this.lockDirectory = lockDirectory;
    }

    public <T> T withLock(String agent, LockedAction<T> action) throws IOException {
        if (lockDirectory != null) {
            return fileLocks.computeIfAbsent(agent, this::fileLockFor).withLock(action::run);
        }
        ReentrantLock lock = locks.computeIfAbsent(agent, ignored -> new ReentrantLock());
        lock.lock();
        try {
            return action.run();
        } finally {
            lock.unlock();
        }
    }

    boolean isHeld(String agent) {
        ProcessFileLock fileLock = fileLocks.get(agent);
        if (fileLock != null) {
            return fileLock.isHeldByCurrentThread();
        }
        ReentrantLock lock = locks.get(agent);
        return lock != null && lock.isLocked();
    }

    private ProcessFileLock fileLockFor(String agent) {
        return new ProcessFileLock(lockDirectory.resolve("agent-" + agent.replaceAll("[^A-Za-z0-9._-]", "_") + ".lock"));
    }

    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }
}
