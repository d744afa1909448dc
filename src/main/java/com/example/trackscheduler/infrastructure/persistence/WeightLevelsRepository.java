package com.example.trackscheduler.infrastructure.persistence;

import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.infrastructure.persistence.model.WeightLevelsDocument;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.stereotype.Repository;

@Repository
public class WeightLevelsRepository {

    static final String FILE_NAME = "playback-weights.json";

    private final JsonFileStore jsonFileStore;
    private final Path file;

    public WeightLevelsRepository(JsonFileStore jsonFileStore, AppSchedulerProperties properties) {
        this.jsonFileStore = jsonFileStore;
        this.file = Paths.get(properties.getDataDir()).resolve(FILE_NAME);
    }

    /**
     * @return the stored document, or {@code null} when absent, corrupt or of
     *         an unsupported version
     */
    public WeightLevelsDocument load() {
        WeightLevelsDocument document = jsonFileStore.read(file, WeightLevelsDocument.class);
        if (document == null || document.getVersion() != WeightLevelsDocument.CURRENT_VERSION) {
            return null;
        }
        return document;
    }

    public void save(WeightLevelsDocument document) throws IOException {
        jsonFileStore.write(file, document);
    }
}
