package com.example.trackscheduler.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TrackPathRequest {

    @NotBlank
    private String path;
}
