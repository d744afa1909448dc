package com.example.trackscheduler.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A precomputed permutation of canonical keys plus a cursor. Entries before
 * the cursor have been consumed; the entry at {@code cursor - 1} is the one
 * most recently handed out.
 *
 * <p>Not thread-safe. Confined to its owning scheduler.
 */
public class ShuffleState {

    private final List<String> order = new ArrayList<>();
    private int cursor;

    public void replace(List<String> permutation, int startCursor) {
        order.clear();
        order.addAll(permutation);
        cursor = Math.max(0, Math.min(startCursor, order.size()));
    }

    public void clear() {
        order.clear();
        cursor = 0;
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }

    public boolean isExhausted() {
        return cursor >= order.size();
    }

    public int size() {
        return order.size();
    }

    public int getCursor() {
        return cursor;
    }

    public void setCursor(int cursor) {
        this.cursor = Math.max(0, Math.min(cursor, order.size()));
    }

    public String keyAt(int index) {
        return order.get(index);
    }

    /**
     * Drops every occurrence of the given keys, consumed or not, keeping the
     * cursor on the same upcoming entry.
     *
     * @return number of entries removed
     */
    public int removeAll(Collection<String> keys) {
        if (keys == null || keys.isEmpty() || order.isEmpty()) {
            return 0;
        }
        int removed = 0;
        int removedBeforeCursor = 0;
        for (int i = order.size() - 1; i >= 0; i--) {
            if (keys.contains(order.get(i))) {
                order.remove(i);
                removed++;
                if (i < cursor) {
                    removedBeforeCursor++;
                }
            }
        }
        cursor = Math.min(cursor - removedBeforeCursor, order.size());
        return removed;
    }

    public void insert(int position, String key) {
        order.add(Math.max(0, Math.min(position, order.size())), key);
    }

    public boolean contains(String key) {
        return order.contains(key);
    }

    public List<String> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(order));
    }
}
