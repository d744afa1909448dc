package com.example.trackscheduler.domain.shuffle;

import java.util.List;

/**
 * The candidate pool the shuffle engine draws from, as seen by the active
 * scope at the moment of the call.
 */
public interface ShufflePopulation {

    /**
     * Canonical keys in scope order. May contain keys that are not currently
     * selectable.
     */
    List<String> candidateKeys();

    /**
     * True when the key resolves to a physical record and is not marked
     * unplayable.
     */
    boolean isSelectable(String key);

    double weightOf(String key);
}
