package com.finfocus.common.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Enumeration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Archive extraction for plugin release payloads ({@code .tar.gz} and
 * {@code .zip}), with zip-slip and oversized-entry protection.
 * <p>
 * Any error leaves {@code destDir} in an undefined state; callers remove it.
 */
@Slf4j
public final class Archive {

    private Archive() {
    }

    /** Largest single entry accepted (500 MiB). */
    public static final long MAX_ENTRY_SIZE = 500L * 1024 * 1024;

    private static final int BUFFER_SIZE = 32 * 1024;
    private static final Set<PosixFilePermission> DIR_PERMS = PosixFilePermissions.fromString("rwxr-x---");

    public enum ArchiveKind {
        TAR_GZ, ZIP
    }

    // =========================================================================
    // Errors
    // =========================================================================

    public enum Reason {
        UNSUPPORTED_FORMAT, PATH_TRAVERSAL, ENTRY_TOO_LARGE, INVALID_BINARY
    }

    /**
     * Validation or security failure while extracting or checking a binary.
     */
    public static class ArchiveError extends RuntimeException {
        private final Reason reason;

        public ArchiveError(Reason reason, String message) {
            super(message);
            this.reason = reason;
        }

        public Reason getReason() {
            return reason;
        }
    }

    // =========================================================================
    // Kind detection
    // =========================================================================

    /**
     * Determine the kind of archive from the file extension, or null.
     */
    public static ArchiveKind resolveArchiveKind(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".zip")) {
            return ArchiveKind.ZIP;
        }
        if (lower.endsWith(".tar.gz") || lower.endsWith(".tgz")) {
            return ArchiveKind.TAR_GZ;
        }
        return null;
    }

    // =========================================================================
    // Extraction
    // =========================================================================

    /**
     * Extract an archive (format chosen by extension) into {@code destDir}.
     *
     * @throws ArchiveError on unsupported format, traversal or oversized entries
     * @throws InterruptedIOException if the calling thread is interrupted
     * @throws IOException on read/write failure
     */
    public static void extractArchive(Path archivePath, Path destDir) throws IOException {
        ArchiveKind kind = resolveArchiveKind(archivePath.getFileName().toString());
        if (kind == null) {
            throw new ArchiveError(Reason.UNSUPPORTED_FORMAT,
                    "unsupported archive format: " + archivePath.getFileName());
        }
        if (!Files.isRegularFile(archivePath)) {
            throw new IOException("archive not found: " + archivePath);
        }
        Files.createDirectories(destDir);
        if (kind == ArchiveKind.TAR_GZ) {
            extractTarGz(archivePath, destDir);
        } else {
            extractZip(archivePath, destDir);
        }
        log.debug("Extracted {} into {}", archivePath.getFileName(), destDir);
    }

    static void extractTarGz(Path archivePath, Path destDir) throws IOException {
        try (TarArchiveInputStream tar = new TarArchiveInputStream(new GzipCompressorInputStream(
                new BufferedInputStream(Files.newInputStream(archivePath))))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                checkInterrupted();
                Path outPath = sanitizePath(destDir, entry.getName());

                if (entry.isSymbolicLink() || entry.isLink()) {
                    throw new ArchiveError(Reason.PATH_TRAVERSAL,
                            "link entries are not allowed: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    createDirectory(outPath);
                    continue;
                }
                if (!entry.isFile()) {
                    log.debug("Skipping special tar entry {}", entry.getName());
                    continue;
                }
                checkDeclaredSize(entry.getName(), entry.getSize());
                writeEntry(tar, outPath, entry.getName());
                applyMode(outPath, entry.getMode());
            }
        }
    }

    static void extractZip(Path archivePath, Path destDir) throws IOException {
        try (ZipFile zip = ZipFile.builder().setPath(archivePath).get()) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                checkInterrupted();
                ZipArchiveEntry entry = entries.nextElement();
                Path outPath = sanitizePath(destDir, entry.getName());

                if (entry.isUnixSymlink()) {
                    throw new ArchiveError(Reason.PATH_TRAVERSAL,
                            "link entries are not allowed: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    createDirectory(outPath);
                    continue;
                }
                checkDeclaredSize(entry.getName(), entry.getSize());
                try (InputStream in = zip.getInputStream(entry)) {
                    writeEntry(in, outPath, entry.getName());
                }
                applyMode(outPath, entry.getUnixMode());
            }
        }
    }

    // =========================================================================
    // Path safety
    // =========================================================================

    /**
     * Resolve an archive entry name inside {@code destDir}.
     * Absolute names are treated as relative; names that would resolve outside
     * {@code destDir} are rejected.
     *
     * @throws ArchiveError with {@link Reason#PATH_TRAVERSAL}
     */
    public static Path sanitizePath(Path destDir, String entryName) {
        String name = entryName.replace('\\', '/');
        name = name.replaceFirst("^[A-Za-z]:", "");
        while (name.startsWith("/")) {
            name = name.substring(1);
        }
        Path base = destDir.toAbsolutePath().normalize();
        Path target = base.resolve(name).normalize();
        if (!target.startsWith(base)) {
            throw new ArchiveError(Reason.PATH_TRAVERSAL,
                    "archive entry escapes destination: " + entryName);
        }
        return target;
    }

    // =========================================================================
    // Binary validation
    // =========================================================================

    /**
     * Check that {@code path} is an existing, non-directory executable.
     *
     * @throws ArchiveError with {@link Reason#INVALID_BINARY}
     */
    public static void validateBinary(Path path, ExecutabilityChecker checker) {
        if (!Files.exists(path)) {
            throw new ArchiveError(Reason.INVALID_BINARY, "binary not found: " + path);
        }
        if (Files.isDirectory(path)) {
            throw new ArchiveError(Reason.INVALID_BINARY, "binary path is a directory: " + path);
        }
        if (!checker.isExecutable(path)) {
            throw new ArchiveError(Reason.INVALID_BINARY, "binary is not executable: " + path);
        }
    }

    public static void validateBinary(Path path) {
        validateBinary(path, ExecutabilityChecker.current());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static void checkDeclaredSize(String name, long size) {
        if (size > MAX_ENTRY_SIZE) {
            throw new ArchiveError(Reason.ENTRY_TOO_LARGE,
                    "archive entry " + name + " is " + size + " bytes, limit is " + MAX_ENTRY_SIZE);
        }
    }

    private static void writeEntry(InputStream in, Path outPath, String name) throws IOException {
        Files.createDirectories(outPath.getParent());
        byte[] buffer = new byte[BUFFER_SIZE];
        long written = 0;
        try (OutputStream out = Files.newOutputStream(outPath)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                checkInterrupted();
                written += read;
                // declared sizes can lie (zip data descriptors)
                if (written > MAX_ENTRY_SIZE) {
                    throw new ArchiveError(Reason.ENTRY_TOO_LARGE,
                            "archive entry " + name + " exceeds " + MAX_ENTRY_SIZE + " bytes");
                }
                out.write(buffer, 0, read);
            }
        }
    }

    private static void createDirectory(Path dir) throws IOException {
        Files.createDirectories(dir);
        try {
            Files.setPosixFilePermissions(dir, DIR_PERMS);
        } catch (UnsupportedOperationException e) {
            log.trace("POSIX permissions unsupported for {}", dir);
        }
    }

    private static void applyMode(Path file, int mode) throws IOException {
        if ((mode & 0777) == 0) {
            return;
        }
        try {
            Files.setPosixFilePermissions(file, toPermissions(mode));
        } catch (UnsupportedOperationException e) {
            log.trace("POSIX permissions unsupported for {}", file);
        }
    }

    static Set<PosixFilePermission> toPermissions(int mode) {
        Set<PosixFilePermission> perms = EnumSet.noneOf(PosixFilePermission.class);
        PosixFilePermission[] order = {
                PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_EXECUTE,
                PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE,
                PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE
        };
        for (int i = 0; i < order.length; i++) {
            if ((mode & (0400 >> i)) != 0) {
                perms.add(order[i]);
            }
        }
        // we must still be able to read and clean up what we wrote
        perms.add(PosixFilePermission.OWNER_READ);
        perms.add(PosixFilePermission.OWNER_WRITE);
        return perms;
    }

    private static void checkInterrupted() throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("archive extraction cancelled");
        }
    }
}
