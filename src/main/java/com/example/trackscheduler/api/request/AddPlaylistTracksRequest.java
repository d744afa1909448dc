package com.example.trackscheduler.api.request;

import java.util.List;
import javax.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class AddPlaylistTracksRequest {

    @NotEmpty
    private List<String> trackPaths;
}
