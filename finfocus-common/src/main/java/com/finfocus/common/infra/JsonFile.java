package com.finfocus.common.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Small JSON documents on disk: metadata files and install records.
 * Writes are owner-only and replace the previous file in one step.
 */
@Slf4j
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final Set<PosixFilePermission> OWNER_RW = PosixFilePermissions.fromString("rw-------");

    /**
     * @throws NoSuchFileException if the file does not exist
     * @throws com.fasterxml.jackson.core.JsonProcessingException if the content
     *         does not parse as {@code type}
     */
    public static <T> T read(Path path, TypeReference<T> type) throws IOException {
        byte[] raw = Files.readAllBytes(path);
        return MAPPER.readValue(raw, type);
    }

    /**
     * Lenient {@link #read}: null when the file is missing or unreadable.
     */
    public static <T> T load(Path path, TypeReference<T> type) {
        try {
            return read(path, type);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            log.warn("Ignoring unreadable JSON file {}: {}", path, e.getMessage());
            return null;
        }
    }

    /**
     * Serialize {@code data} to {@code path} with a trailing newline. The
     * content goes to a sibling temp file that is restricted before it is
     * written, then renamed over the target.
     */
    public static void save(Path path, Object data) throws IOException {
        byte[] json = (MAPPER.writeValueAsString(data) + "\n").getBytes(StandardCharsets.UTF_8);
        Path dir = path.toAbsolutePath().getParent();
        Files.createDirectories(dir);

        Path temp = Files.createTempFile(dir, "." + path.getFileName(), ".tmp");
        try {
            restrictToOwner(temp);
            Files.write(temp, json);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Owner-only read/write where the file system has POSIX permissions.
     */
    public static void restrictToOwner(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, OWNER_RW);
        } catch (UnsupportedOperationException e) {
            log.debug("No POSIX permissions on {}", path);
        }
    }
}
