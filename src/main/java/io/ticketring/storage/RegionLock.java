package io.ticketring.storage;

import io.ticketring.error.ErrorCode;
import io.ticketring.error.TicketRingException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Exclusive per-region lock. An OS file lock keeps other processes out; the JVM-local lock is
 * needed on top of it because {@link FileChannel#lock()} is held per process, not per thread.
 * JVM-local locks are dropped once no thread holds or waits for them.
 */
final class RegionLock {
    private static final ConcurrentMap<Path, LocalLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private RegionLock() {
    }

    static <T> T withLock(Path lockFile, Supplier<T> action) {
        Path key = lockFile.toAbsolutePath().normalize();
        LocalLock held = LOCAL_LOCKS.get(key);
        if (held != null && held.lock.isHeldByCurrentThread()) {
            return action.get();
        }
        LocalLock local = LOCAL_LOCKS.compute(key, (path, existing) -> {
            LocalLock entry = existing == null ? new LocalLock() : existing;
            entry.users++;
            return entry;
        });
        local.lock.lock();
        try {
            if (key.getParent() != null) {
                Files.createDirectories(key.getParent());
            }
            try (FileChannel channel = FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.get();
            }
        } catch (IOException e) {
            throw new TicketRingException(ErrorCode.PERSISTENCE_ERROR, "Failed to lock region: " + key, e);
        } finally {
            local.lock.unlock();
            LOCAL_LOCKS.computeIfPresent(key, (path, entry) -> --entry.users == 0 ? null : entry);
        }
    }

    static boolean isTracked(Path lockFile) {
        return LOCAL_LOCKS.containsKey(lockFile.toAbsolutePath().normalize());
    }

    private static final class LocalLock {
        private final ReentrantLock lock = new ReentrantLock();
        // Threads holding or waiting; only changed inside ConcurrentHashMap.compute.
        private int users;
    }
}
