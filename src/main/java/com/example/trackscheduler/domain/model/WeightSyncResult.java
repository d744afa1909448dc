package com.example.trackscheduler.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WeightSyncResult {

    /** Non-default overrides present in the source playlist. */
    private int total;

    /** Queue entries that actually changed. */
    private int changed;
}
