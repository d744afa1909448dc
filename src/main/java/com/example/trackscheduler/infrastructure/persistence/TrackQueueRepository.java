package com.example.trackscheduler.infrastructure.persistence;

import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.infrastructure.persistence.model.TrackQueueDocument;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.stereotype.Repository;

@Repository
public class TrackQueueRepository {

    static final String FILE_NAME = "track-queue.json";

    private final JsonFileStore jsonFileStore;
    private final Path file;

    public TrackQueueRepository(JsonFileStore jsonFileStore, AppSchedulerProperties properties) {
        this.jsonFileStore = jsonFileStore;
        this.file = Paths.get(properties.getDataDir()).resolve(FILE_NAME);
    }

    /**
     * @return the stored document, or {@code null} when absent, corrupt or of
     *         an unsupported version
     */
    public TrackQueueDocument load() {
        TrackQueueDocument document = jsonFileStore.read(file, TrackQueueDocument.class);
        if (document == null || document.getVersion() != TrackQueueDocument.CURRENT_VERSION) {
            return null;
        }
        return document;
    }

    public void save(TrackQueueDocument document) throws IOException {
        jsonFileStore.write(file, document);
    }
}
