package com.example.trackscheduler.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class UserPlaylist {

    private String id;

    private String name;

    /** Standardized file paths, case preserved, in playlist order. */
    private List<String> trackPaths = new ArrayList<>();

    private Instant createdAt;

    private Instant updatedAt;

    public UserPlaylist copy() {
        UserPlaylist copy = new UserPlaylist();
        copy.id = id;
        copy.name = name;
        copy.trackPaths = new ArrayList<>(trackPaths);
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
