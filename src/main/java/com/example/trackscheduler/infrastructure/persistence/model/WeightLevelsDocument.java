package com.example.trackscheduler.infrastructure.persistence.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-disk form of playback-weights.json.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WeightLevelsDocument {

    public static final int CURRENT_VERSION = 1;

    private int version;

    /** canonical key -> level */
    private Map<String, Integer> queueLevels = new LinkedHashMap<>();

    /** playlist id -> (canonical key -> level) */
    private Map<String, Map<String, Integer>> playlistLevels = new LinkedHashMap<>();
}
