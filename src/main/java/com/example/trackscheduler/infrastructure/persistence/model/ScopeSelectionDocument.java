package com.example.trackscheduler.infrastructure.persistence.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-disk form of playback-scope.json: the active scope plus the pointer to
 * the current track.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScopeSelectionDocument {

    /** "queue" or "playlist" */
    private String kind;

    @JsonProperty("playlistID")
    private String playlistId;

    private String currentKey;

    private Integer currentIndex;
}
