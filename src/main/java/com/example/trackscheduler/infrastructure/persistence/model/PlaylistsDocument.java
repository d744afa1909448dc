package com.example.trackscheduler.infrastructure.persistence.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-disk form of playlists.json. Playlists keep their creation order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlaylistsDocument {

    public static final int CURRENT_VERSION = 1;

    private int version;

    private List<Entry> playlists = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {

        private String id;

        private String name;

        private List<String> trackPaths = new ArrayList<>();

        /** epoch millis */
        private Long createdAt;

        private Long updatedAt;
    }
}
