package com.example.trackscheduler.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddPlaylistTracksResponse {

    private String playlistId;
    private Integer requestedCount;
    private Integer addedCount;
    private Integer duplicateCount;
    private Integer trackCount;
}
