package com.example.trackscheduler.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current scope and track. {@code track} is null when nothing is selected
 * or a selection found no playable candidate.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NowPlayingResponse {

    private ScopeResponse scope;
    private TrackResponse track;
}
