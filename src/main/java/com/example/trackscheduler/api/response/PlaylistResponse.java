package com.example.trackscheduler.api.response;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistResponse {

    private String id;
    private String name;
    private Integer trackCount;
    private List<String> trackPaths;
    private Boolean active;
    private Instant createdAt;
    private Instant updatedAt;
}
