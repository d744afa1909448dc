package com.example.trackscheduler.domain.model;

import java.util.Collections;
import java.util.List;

/**
 * Key-set difference between two member lists of the active playlist.
 */
public final class MemberDelta {

    private final List<String> addedKeys;
    private final List<String> removedKeys;

    public MemberDelta(List<String> addedKeys, List<String> removedKeys) {
        this.addedKeys = Collections.unmodifiableList(addedKeys);
        this.removedKeys = Collections.unmodifiableList(removedKeys);
    }

    public List<String> getAddedKeys() {
        return addedKeys;
    }

    public List<String> getRemovedKeys() {
        return removedKeys;
    }

    public boolean isEmpty() {
        return addedKeys.isEmpty() && removedKeys.isEmpty();
    }
}
