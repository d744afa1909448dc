package com.example.trackscheduler.domain.shuffle;

import com.example.trackscheduler.common.util.PathKeys;
import com.example.trackscheduler.domain.model.ShuffleState;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Builds, patches and walks a weighted random permutation of canonical keys.
 *
 * <p>A fresh build is an Efraimidis-Spirakis weighted sample without
 * replacement over the whole pool: each key draws {@code u ~ U(0,1]} and is
 * ordered by {@code -ln(u) / w}. Every prefix of the result therefore picks
 * the next key with probability proportional to its weight among the keys
 * still remaining.
 *
 * <p>Not thread-safe. The owning scheduler serializes every call.
 */
public class WeightedShuffleEngine {

    static final double MIN_WEIGHT = 1e-6;

    private final Random random;
    private final ShuffleState state = new ShuffleState();

    public WeightedShuffleEngine(Random random) {
        this.random = random;
    }

    /**
     * Next selectable key after the cursor, advancing past it. Rebuilds the
     * permutation when it is empty or exhausted, keeping {@code currentKey}
     * at the head so it does not play twice in a row.
     *
     * @return the key, or {@code null} when nothing is selectable
     */
    public String next(ShufflePopulation population, String currentKey) {
        return locate(population, currentKey, true);
    }

    /**
     * Same key {@link #next} would return, without moving the cursor.
     */
    public String peek(ShufflePopulation population, String currentKey) {
        return locate(population, currentKey, false);
    }

    /**
     * Walks back through consumed history. Never rebuilds.
     */
    public String previous(ShufflePopulation population) {
        if (state.isEmpty()) {
            return null;
        }
        for (int i = state.getCursor() - 2; i >= 0; i--) {
            String key = state.keyAt(i);
            if (population.isSelectable(key)) {
                state.setCursor(i + 1);
                return key;
            }
        }
        return null;
    }

    /**
     * Starts a fresh permutation and takes its first selectable key.
     */
    public String randomStart(ShufflePopulation population) {
        if (!rebuild(population, null)) {
            return null;
        }
        int index = scanForward(population);
        if (index < 0) {
            return null;
        }
        state.setCursor(index + 1);
        return state.keyAt(index);
    }

    /**
     * One-shot weighted draw over the selectable pool minus {@code currentKey}.
     * Leaves the permutation and cursor untouched.
     */
    public String randomExcludingCurrent(ShufflePopulation population, String currentKey) {
        List<String> pool = new ArrayList<>();
        for (String key : distinct(population.candidateKeys())) {
            if (currentKey != null && PathKeys.sameTrack(key, currentKey)) {
                continue;
            }
            if (population.isSelectable(key)) {
                pool.add(key);
            }
        }
        if (pool.isEmpty()) {
            return null;
        }
        double[] weights = new double[pool.size()];
        double total = 0D;
        for (int i = 0; i < pool.size(); i++) {
            weights[i] = sanitizeWeight(population.weightOf(pool.get(i)));
            total += weights[i];
        }
        if (Double.isNaN(total) || Double.isInfinite(total) || total <= 0D) {
            return pool.get(random.nextInt(pool.size()));
        }
        double target = random.nextDouble() * total;
        double cumulative = 0D;
        for (int i = 0; i < pool.size(); i++) {
            cumulative += weights[i];
            if (target < cumulative) {
                return pool.get(i);
            }
        }
        return pool.get(pool.size() - 1);
    }

    /**
     * Patches the live permutation instead of rebuilding it. Removed keys
     * leave both the consumed prefix and the pending suffix; added keys are
     * inserted into the pending suffix at {@code cursor + floor(u^w * (remaining + 1))},
     * so heavier keys tend to land earlier. Does nothing while no permutation
     * exists; the next build picks the new population up anyway.
     */
    public void integrate(ShufflePopulation population, Collection<String> addedKeys, Collection<String> removedKeys) {
        if (state.isEmpty()) {
            return;
        }
        if (removedKeys != null && !removedKeys.isEmpty()) {
            state.removeAll(new LinkedHashSet<>(removedKeys));
        }
        if (addedKeys == null) {
            return;
        }
        for (String key : distinct(addedKeys)) {
            if (state.contains(key) || !population.isSelectable(key)) {
                continue;
            }
            double weight = sanitizeWeight(population.weightOf(key));
            double fraction = Math.pow(random.nextDouble(), weight);
            int lower = Math.min(state.getCursor(), state.size());
            int remaining = state.size() - lower;
            int position = lower + (int) Math.floor(fraction * (remaining + 1));
            state.insert(Math.min(position, state.size()), key);
        }
    }

    public void invalidate() {
        state.clear();
    }

    public boolean isActive() {
        return !state.isEmpty();
    }

    public int cursor() {
        return state.getCursor();
    }

    public List<String> permutation() {
        return state.snapshot();
    }

    /**
     * Efraimidis-Spirakis ordering of {@code keys}. Weights below
     * {@link #MIN_WEIGHT} are floored so no key divides by zero.
     */
    public List<String> weightedPermutation(List<String> keys, ShufflePopulation population) {
        List<SortEntry> entries = new ArrayList<>(keys.size());
        for (String key : keys) {
            double weight = sanitizeWeight(population.weightOf(key));
            double u = 1D - random.nextDouble();
            entries.add(new SortEntry(key, -Math.log(u) / weight));
        }
        entries.sort(Comparator.comparingDouble(SortEntry::getSortKey));
        List<String> result = new ArrayList<>(entries.size());
        for (SortEntry entry : entries) {
            result.add(entry.getKey());
        }
        return result;
    }

    private String locate(ShufflePopulation population, String currentKey, boolean advance) {
        boolean fresh = false;
        if (state.isEmpty() || state.isExhausted()) {
            if (!rebuild(population, currentKey)) {
                return null;
            }
            fresh = true;
        }
        int index = scanForward(population);
        if (index < 0 && !fresh) {
            // stale tail: everything left was unplayable or gone
            if (!rebuild(population, currentKey)) {
                return null;
            }
            index = scanForward(population);
        }
        if (index < 0) {
            return null;
        }
        if (advance) {
            state.setCursor(index + 1);
        }
        return state.keyAt(index);
    }

    private int scanForward(ShufflePopulation population) {
        for (int i = state.getCursor(); i < state.size(); i++) {
            if (population.isSelectable(state.keyAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private boolean rebuild(ShufflePopulation population, String headKey) {
        List<String> candidates = new ArrayList<>();
        for (String key : distinct(population.candidateKeys())) {
            if (population.isSelectable(key)) {
                candidates.add(key);
            }
        }
        if (candidates.isEmpty()) {
            state.clear();
            return false;
        }
        String head = null;
        if (headKey != null && candidates.size() > 1) {
            for (String key : candidates) {
                if (PathKeys.sameTrack(key, headKey)) {
                    head = key;
                    break;
                }
            }
        }
        if (head == null) {
            state.replace(weightedPermutation(candidates, population), 0);
            return true;
        }
        candidates.remove(head);
        List<String> permutation = new ArrayList<>(candidates.size() + 1);
        permutation.add(head);
        permutation.addAll(weightedPermutation(candidates, population));
        state.replace(permutation, 1);
        return true;
    }

    private static double sanitizeWeight(double weight) {
        if (Double.isNaN(weight) || Double.isInfinite(weight)) {
            return 1D;
        }
        return Math.max(weight, MIN_WEIGHT);
    }

    private static List<String> distinct(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> unique = new LinkedHashSet<>(keys);
        unique.remove(null);
        return new ArrayList<>(unique);
    }

    private static final class SortEntry {

        private final String key;
        private final double sortKey;

        private SortEntry(String key, double sortKey) {
            this.key = key;
            this.sortKey = sortKey;
        }

        private String getKey() {
            return key;
        }

        private double getSortKey() {
            return sortKey;
        }
    }
}
