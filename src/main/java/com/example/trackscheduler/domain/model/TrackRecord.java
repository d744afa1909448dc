package com.example.trackscheduler.domain.model;

import com.example.trackscheduler.common.util.PathKeys;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the physical track collection. The scheduler only chooses
 * records, it never edits them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackRecord {

    private String path;

    private String title;

    private String artist;

    private String album;

    private Integer durationSec;

    /**
     * True once tags were read from the file; placeholders carry only a
     * file-name title.
     */
    private boolean hydrated;

    public static TrackRecord placeholder(String path) {
        return new TrackRecord(path, fileBaseName(path), null, null, null, false);
    }

    public String canonicalKey() {
        return PathKeys.canonical(path);
    }

    private static String fileBaseName(String path) {
        String canonical = PathKeys.canonical(path);
        int slash = canonical.lastIndexOf('/');
        String name = slash >= 0 ? canonical.substring(slash + 1) : canonical;
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return name.isEmpty() ? "unknown-track" : name;
    }
}
