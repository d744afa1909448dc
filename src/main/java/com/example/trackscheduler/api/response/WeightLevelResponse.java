package com.example.trackscheduler.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WeightLevelResponse {

    private String path;
    private String scope;
    private Integer level;
    private Double multiplier;
    private Boolean changed;
}
