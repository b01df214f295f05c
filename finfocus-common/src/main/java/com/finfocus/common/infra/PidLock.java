package com.finfocus.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Advisory, cross-process try-lock keyed by name: {@code <lockDir>/<name>.lock}
 * holding the owner's decimal process id.
 * <p>
 * The lock file is the only source of truth, so separate CLI processes
 * exclude each other. A lock whose owner is gone (or whose content is
 * unusable) is stale and reclaimed by the next acquirer. Acquisition never
 * waits: a live lock fails immediately with {@link LockHeldError}.
 */
@Slf4j
public class PidLock {

    /** Largest pid a Linux kernel can hand out (PID_MAX_LIMIT). */
    public static final long MAX_PLAUSIBLE_PID = 4_194_304L;

    private static final String LOCK_SUFFIX = ".lock";
    private static final String RECLAIM_SUFFIX = ".reclaim";
    private static final Duration RECLAIM_GUARD_TTL = Duration.ofSeconds(30);

    private final Path lockDir;
    private final ProcessChecker processChecker;
    private final long ownPid;

    public PidLock(Path lockDir) {
        this(lockDir, ProcessChecker.system(), ProcessHandle.current().pid());
    }

    public PidLock(Path lockDir, ProcessChecker processChecker, long ownPid) {
        this.lockDir = lockDir;
        this.processChecker = processChecker;
        this.ownPid = ownPid;
    }

    /**
     * Handle to a held lock. Call {@link #release()} (or close it) on every
     * exit path.
     */
    public static class LockHandle implements Closeable {
        private final Path lockPath;
        private final AtomicBoolean released = new AtomicBoolean(false);

        LockHandle(Path lockPath) {
            this.lockPath = lockPath;
        }

        public Path getLockPath() {
            return lockPath;
        }

        public void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                Files.deleteIfExists(lockPath);
            } catch (IOException e) {
                log.warn("Failed to delete lock file {}: {}", lockPath, e.getMessage());
            }
        }

        @Override
        public void close() {
            release();
        }
    }

    /**
     * Thrown when the lock is held by a live process.
     */
    public static class LockHeldError extends RuntimeException {
        private final Path lockPath;

        public LockHeldError(Path lockPath, String message) {
            super(message);
            this.lockPath = lockPath;
        }

        public Path getLockPath() {
            return lockPath;
        }
    }

    public Path lockPath(String name) {
        return lockDir.resolve(name + LOCK_SUFFIX);
    }

    /**
     * Try to take the lock for {@code name}, reclaiming it if stale.
     *
     * @throws LockHeldError if another live process holds it
     * @throws IOException   if the lock directory or file cannot be written
     */
    public LockHandle acquire(String name) throws IOException {
        Files.createDirectories(lockDir);
        Path lockPath = lockPath(name);

        if (tryCreate(lockPath, name)) {
            log.debug("Acquired lock {}", lockPath);
            return new LockHandle(lockPath);
        }

        if (isLockStale(lockPath) && reclaimAndCreate(lockPath, name)) {
            log.warn("Reclaimed stale lock {}", lockPath);
            return new LockHandle(lockPath);
        }

        throw new LockHeldError(lockPath, "lock " + lockPath.getFileName()
                + " is held by another process");
    }

    /**
     * A lock is stale when its content is empty, not a number, an implausible
     * pid, or the pid of a process that is no longer running. A missing file
     * is not stale.
     */
    public boolean isLockStale(Path lockPath) {
        String content;
        try {
            content = Files.readString(lockPath, StandardCharsets.US_ASCII);
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            log.debug("Cannot read lock file {}: {}", lockPath, e.getMessage());
            return false;
        }

        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        long pid;
        try {
            pid = Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            return true;
        }
        if (pid <= 0 || pid > MAX_PLAUSIBLE_PID) {
            return true;
        }
        return !processChecker.isRunning(pid);
    }

    // =========================================================================
    // Internals
    // =========================================================================

    /**
     * Publish a fully written lock file atomically: the pid goes into a
     * private temp file which is then hard-linked to the lock name. Linking
     * fails if the name exists, so a visible lock file is never half written.
     */
    private boolean tryCreate(Path lockPath, String name) throws IOException {
        byte[] payload = Long.toString(ownPid).getBytes(StandardCharsets.US_ASCII);
        Path temp = lockDir.resolve("." + name + LOCK_SUFFIX + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(temp, payload, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            JsonFile.restrictToOwner(temp);
            try {
                Files.createLink(lockPath, temp);
                return true;
            } catch (FileAlreadyExistsException e) {
                return false;
            } catch (UnsupportedOperationException | FileSystemException e) {
                log.debug("Hard links unavailable in {}, creating lock directly", lockDir);
                return createDirectly(lockPath, payload);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private boolean createDirectly(Path lockPath, byte[] payload) throws IOException {
        try {
            Files.write(lockPath, payload, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            JsonFile.restrictToOwner(lockPath);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    /**
     * Replace a stale lock while holding the short-lived reclaim guard, so
     * that deleting an existing lock file is serialized between processes.
     * Staleness is re-checked under the guard.
     */
    private boolean reclaimAndCreate(Path lockPath, String name) throws IOException {
        Path guard = lockDir.resolve("." + name + LOCK_SUFFIX + RECLAIM_SUFFIX);
        if (!tryCreateGuard(guard)) {
            return false;
        }
        try {
            if (Files.exists(lockPath) && !isLockStale(lockPath)) {
                return false;
            }
            Files.deleteIfExists(lockPath);
            return tryCreate(lockPath, name);
        } finally {
            Files.deleteIfExists(guard);
        }
    }

    private boolean tryCreateGuard(Path guard) throws IOException {
        try {
            Files.createFile(guard);
            return true;
        } catch (FileAlreadyExistsException e) {
            if (!isGuardExpired(guard)) {
                return false;
            }
        }
        // left behind by a reclaimer that died mid-way
        log.warn("Removing abandoned reclaim guard {}", guard);
        Files.deleteIfExists(guard);
        try {
            Files.createFile(guard);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    private boolean isGuardExpired(Path guard) throws IOException {
        try {
            Instant modified = Files.getLastModifiedTime(guard).toInstant();
            return modified.isBefore(Instant.now().minus(RECLAIM_GUARD_TTL));
        } catch (NoSuchFileException e) {
            return false;
        }
    }
}
