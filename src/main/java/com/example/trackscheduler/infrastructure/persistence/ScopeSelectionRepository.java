package com.example.trackscheduler.infrastructure.persistence;

import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.infrastructure.persistence.model.ScopeSelectionDocument;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.stereotype.Repository;

@Repository
public class ScopeSelectionRepository {

    static final String FILE_NAME = "playback-scope.json";

    private final JsonFileStore jsonFileStore;
    private final Path file;

    public ScopeSelectionRepository(JsonFileStore jsonFileStore, AppSchedulerProperties properties) {
        this.jsonFileStore = jsonFileStore;
        this.file = Paths.get(properties.getDataDir()).resolve(FILE_NAME);
    }

    public ScopeSelectionDocument load() {
        return jsonFileStore.read(file, ScopeSelectionDocument.class);
    }

    public void save(ScopeSelectionDocument document) throws IOException {
        jsonFileStore.write(file, document);
    }
}
