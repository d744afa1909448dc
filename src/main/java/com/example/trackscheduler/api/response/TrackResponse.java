package com.example.trackscheduler.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrackResponse {

    private Integer index;
    private String path;
    private String title;
    private String artist;
    private String album;
    private Integer durationSec;
    private Boolean hydrated;
    private String unplayableReason;
}
