package com.example.trackscheduler.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayPlaylistResponse {

    private String playlistId;
    private Integer memberCount;
    private TrackResponse track;
}
