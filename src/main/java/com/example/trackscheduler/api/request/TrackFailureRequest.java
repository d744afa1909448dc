package com.example.trackscheduler.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TrackFailureRequest {

    @NotBlank
    private String path;

    private String reason;
}
