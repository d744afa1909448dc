package com.example.trackscheduler.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AddTracksResponse {

    private Integer requestedCount;
    private Integer appendedCount;
    private Integer focusIndex;
    private Integer queueSize;
}
