package com.example.trackscheduler.api.request;

import java.util.List;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class CreatePlaylistRequest {

    @NotBlank
    @Size(max = 128)
    private String name;

    private List<String> trackPaths;
}
