package com.example.trackscheduler.domain;

import java.util.Locale;

public enum ScopeKind {

    /** The flat playback queue, in physical collection order. */
    QUEUE("queue"),

    /** A user playlist, in the playlist's own order. */
    PLAYLIST("playlist");

    private final String value;

    ScopeKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ScopeKind fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ScopeKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
