package com.example.trackscheduler.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SetWeightRequest {

    @NotBlank
    private String path;

    /** "queue" (default) or "playlist". */
    private String scope;

    private String playlistId;

    /** Clamped to 0..4. */
    @NotNull
    private Integer level;
}
