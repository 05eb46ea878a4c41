package com.bastion.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Full-snapshot JSON persistence for the in-memory stores.
 *
 * The document is a JSON array of objects. Reads are tolerant: a missing file
 * yields an empty list, a corrupt document is logged and yields an empty list,
 * and individual elements that fail to bind are skipped. Writes go to a sibling
 * temp file which is then moved over the target.
 */
public class SnapshotFile<T> {

    private static final Logger log = LoggerFactory.getLogger(SnapshotFile.class);

    private final Path path;
    private final Class<T> type;
    private final ObjectMapper objectMapper;

    public SnapshotFile(Path path, Class<T> type, ObjectMapper objectMapper) {
        this.path = path;
        this.type = type;
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper for snapshot documents: ISO-8601 timestamps, unknown fields ignored.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<T> read() {
        List<T> items = new ArrayList<>();
        if (path == null || !Files.exists(path)) {
            log.debug("No snapshot at {}, starting empty", path);
            return items;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            log.warn("Could not read {} snapshot from {}: {}", type.getSimpleName(), path, e.getMessage());
            return items;
        }

        if (root == null || !root.isArray()) {
            log.warn("Snapshot {} is not a JSON array, starting empty", path);
            return items;
        }

        int skipped = 0;
        for (JsonNode element : root) {
            try {
                items.add(objectMapper.treeToValue(element, type));
            } catch (IOException | IllegalArgumentException e) {
                skipped++;
                log.debug("Skipping unreadable {} entry: {}", type.getSimpleName(), e.getMessage());
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} unreadable {} entries in {}", skipped, type.getSimpleName(), path);
        }
        return items;
    }

    public void write(Collection<T> items) throws IOException {
        if (path == null) {
            return;
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), items);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public Path getPath() {
        return path;
    }
}
