package com.example.trackscheduler.infrastructure.persistence.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-disk form of track-queue.json: the physical collection in index order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackQueueDocument {

    public static final int CURRENT_VERSION = 1;

    private int version;

    private List<Track> tracks = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Track {

        private String path;

        private String title;

        private String artist;

        private String album;

        private Integer durationSec;

        private boolean hydrated;
    }
}
