package com.example.trackscheduler.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A chosen record together with its physical index and the scope it was
 * chosen in.
 */
@Data
@AllArgsConstructor
public class TrackSelection {

    private int index;

    private TrackRecord record;

    private PlaybackScope scope;
}
