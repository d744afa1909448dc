package com.example.trackscheduler.domain.model;

import lombok.Data;

@Data
public class AudioMetadata {

    private String title;

    private String artist;

    private String album;

    private Integer durationSec;
}
