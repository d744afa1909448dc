package com.example.trackscheduler.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-fatal notice that in-memory state could not be written to disk.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PersistenceAdvisory {

    private String source;

    private String title;

    private String subtitle;

    private long occurredAtEpochMilli;
}
