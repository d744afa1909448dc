package com.example.trackscheduler.domain.model;

/**
 * Outcome of a weight store write. A changed mutation invalidates any cached
 * shuffle permutation built from the previous weights.
 */
public final class WeightMutation {

    private static final WeightMutation UNCHANGED = new WeightMutation(false, -1L);

    private final boolean changed;
    private final long revision;

    private WeightMutation(boolean changed, long revision) {
        this.changed = changed;
        this.revision = revision;
    }

    public static WeightMutation unchanged() {
        return UNCHANGED;
    }

    public static WeightMutation changed(long revision) {
        return new WeightMutation(true, revision);
    }

    public boolean isChanged() {
        return changed;
    }

    public long getRevision() {
        return revision;
    }
}
