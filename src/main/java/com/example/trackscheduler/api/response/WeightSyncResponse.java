package com.example.trackscheduler.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WeightSyncResponse {

    private String playlistId;
    private Integer total;
    private Integer changed;
}
