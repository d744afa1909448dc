package com.example.trackscheduler.infrastructure.library;

import com.example.trackscheduler.domain.model.TrackRecord;
import java.util.List;

/**
 * The physical track collection (the queue). Records are addressed by index;
 * keys resolve to indices through lookup-key matching, so a record stored
 * under a legacy key form is still found.
 */
public interface TrackCollection {

    List<TrackRecord> allRecords();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @return the record, or {@code null} when the index is out of range
     */
    TrackRecord get(int index);

    /**
     * @return the index of the record matching any lookup key of {@code key},
     *         or {@code null} when no record matches
     */
    Integer indexOfKey(String key);

    /**
     * Appends records whose key is not yet present. Duplicates, within the
     * batch or against existing records, are skipped.
     *
     * @return indices of the records actually appended
     */
    List<Integer> append(List<TrackRecord> records);

    TrackRecord remove(int index);

    void clear();

    /**
     * Replaces the record that matches {@code record}'s key, keeping its index.
     */
    boolean update(TrackRecord record);
}
