package org.caureq.opsinsights.service.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One JSON document on disk, replaced atomically: the new content is written to a sibling
 * temp file which is then renamed over the target, so a crash mid-write leaves the previous
 * version intact.
 */
@Slf4j
public class JsonStateFile {
    private final Path path;
    private final ObjectMapper om;
    private final Object writeLock = new Object();

    JsonStateFile(Path path, ObjectMapper om) {
        this.path = path;
        this.om = om;
    }

    public Path path() { return path; }

    public ObjectMapper mapper() { return om; }

    public void write(Object state) {
        synchronized (writeLock) {
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            try {
                Files.createDirectories(path.toAbsolutePath().getParent());
                om.writeValue(tmp.toFile(), state);
                try {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
                throw new StateFileException("failed to write " + path, e);
            }
        }
    }

    /** Parsed document, or empty when the file does not exist yet. */
    public Optional<JsonNode> readTree() {
        if (!Files.exists(path)) return Optional.empty();
        try {
            return Optional.ofNullable(om.readTree(path.toFile()));
        } catch (IOException e) {
            throw new StateFileException("failed to read " + path, e);
        }
    }
}
