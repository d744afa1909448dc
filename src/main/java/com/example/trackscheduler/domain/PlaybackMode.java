package com.example.trackscheduler.domain;

import java.util.Locale;

/**
 * Traversal order used by next/previous/peek.
 */
public enum PlaybackMode {

    SEQUENTIAL("sequential"),
    RANDOM("random");

    private final String value;

    PlaybackMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PlaybackMode fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("shuffle".equals(normalized)) {
            return RANDOM;
        }
        for (PlaybackMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        return null;
    }
}
