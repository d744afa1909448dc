package com.example.trackscheduler.domain.model;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Scope re-derived from disk at startup, with the member paths of a restored
 * playlist and the saved current-track key.
 */
@Getter
public class ScopeRestoration {

    private final PlaybackScope scope;
    private final List<String> memberPaths;
    private final String currentKey;

    public ScopeRestoration(PlaybackScope scope, List<String> memberPaths, String currentKey) {
        this.scope = scope;
        this.memberPaths = memberPaths == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(memberPaths);
        this.currentKey = currentKey;
    }
}
