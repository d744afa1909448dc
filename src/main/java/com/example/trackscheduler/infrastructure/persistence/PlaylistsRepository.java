package com.example.trackscheduler.infrastructure.persistence;

import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.infrastructure.persistence.model.PlaylistsDocument;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.stereotype.Repository;

@Repository
public class PlaylistsRepository {

    static final String FILE_NAME = "playlists.json";

    private final JsonFileStore jsonFileStore;
    private final Path file;

    public PlaylistsRepository(JsonFileStore jsonFileStore, AppSchedulerProperties properties) {
        this.jsonFileStore = jsonFileStore;
        this.file = Paths.get(properties.getDataDir()).resolve(FILE_NAME);
    }

    /**
     * @return the stored document, or {@code null} when absent, corrupt or of
     *         an unsupported version
     */
    public PlaylistsDocument load() {
        PlaylistsDocument document = jsonFileStore.read(file, PlaylistsDocument.class);
        if (document == null || document.getVersion() != PlaylistsDocument.CURRENT_VERSION) {
            return null;
        }
        return document;
    }

    public void save(PlaylistsDocument document) throws IOException {
        jsonFileStore.write(file, document);
    }
}
