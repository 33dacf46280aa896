package com.openclaw.wechat.common.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * JSON file load/save with owner-only permissions and atomic replacement.
 */
@Slf4j
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Load and parse a JSON file. Returns null if the file does not exist or is
     * invalid.
     */
    public static <T> T load(Path path, Class<T> type) {
        if (!Files.exists(path))
            return null;
        try {
            return MAPPER.readValue(Files.readString(path), type);
        } catch (IOException e) {
            log.warn("Ignoring unreadable JSON file {}: {}", path, e.getMessage());
            return null;
        }
    }

    /**
     * Generic variant of {@link #load(Path, Class)}.
     */
    public static <T> T load(Path path, TypeReference<T> type) {
        if (!Files.exists(path))
            return null;
        try {
            return MAPPER.readValue(Files.readString(path), type);
        } catch (IOException e) {
            log.warn("Ignoring unreadable JSON file {}: {}", path, e.getMessage());
            return null;
        }
    }

    /**
     * Strict variant: a missing file yields null, a malformed one throws.
     */
    public static <T> T read(Path path, Class<T> type) throws IOException {
        if (!Files.exists(path))
            return null;
        return MAPPER.readValue(Files.readString(path), type);
    }

    /**
     * Save data as a JSON file. The content is written to a sibling temp file
     * first and then moved over the target, so readers never see a partial file.
     */
    public static void save(Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        String json = MAPPER.writeValueAsString(data) + "\n";
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json);
        restrictPermissions(tmp);
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Delete a JSON file if present.
     *
     * @return true when a file was removed
     */
    public static boolean delete(Path path) throws IOException {
        return Files.deleteIfExists(path);
    }

    private static void restrictPermissions(Path path) throws IOException {
        if (!path.getFileSystem().supportedFileAttributeViews().contains("posix"))
            return;
        Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-------");
        Files.setPosixFilePermissions(path, perms);
    }
}
