package com.example.trackscheduler.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SetScopeRequest {

    /** "queue" or "playlist". */
    @NotBlank
    private String kind;

    private String playlistId;
}
