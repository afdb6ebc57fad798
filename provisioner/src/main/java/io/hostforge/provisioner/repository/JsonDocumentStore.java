package io.hostforge.provisioner.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes whole JSON documents on the operator's machine.
 *
 * Writes go to a temp file in the target directory and are then moved over
 * the target in one step, so a crash mid-write leaves either the old
 * document or the new one, never a truncated mix.
 */
@Component
public class JsonDocumentStore {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentStore.class);

    private final ObjectMapper json;

    public JsonDocumentStore(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    /** @return empty when the file does not exist */
    public <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(json.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new StateStoreException("Unreadable state document", file, e);
        }
    }

    public void write(Path file, Object document) {
        Path dir = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            json.writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StateStoreException("Could not write state document", file, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
