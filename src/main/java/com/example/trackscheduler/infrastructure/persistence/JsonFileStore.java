package com.example.trackscheduler.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and atomically writes small JSON documents. Missing or unreadable
 * files read as {@code null} so callers fall back to defaults.
 */
@Component
public class JsonFileStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final ObjectMapper objectMapper;

    public JsonFileStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> T read(Path file, Class<T> type) {
        if (file == null || !Files.isRegularFile(file)) {
            return null;
        }
        try {
            byte[] bytes = Files.readAllBytes(file);
            if (bytes.length == 0) {
                return null;
            }
            return objectMapper.readValue(bytes, type);
        } catch (JsonProcessingException e) {
            log.warn("PERSISTENCE_EVENT event=load_corrupt file={} reason={}", file, e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            log.warn("PERSISTENCE_EVENT event=load_failed file={} reason={}", file, e.getMessage());
            return null;
        }
    }

    public void write(Path file, Object document) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
