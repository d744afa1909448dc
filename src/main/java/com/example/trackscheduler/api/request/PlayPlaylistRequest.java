package com.example.trackscheduler.api.request;

import lombok.Data;

@Data
public class PlayPlaylistRequest {

    /** Member to start with; first playable member when empty. */
    private String startPath;

    /** "sequential" (default) or "random". */
    private String mode;
}
