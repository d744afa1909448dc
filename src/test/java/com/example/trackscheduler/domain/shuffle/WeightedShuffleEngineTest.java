package com.example.trackscheduler.domain.shuffle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class WeightedShuffleEngineTest {

    @Test
    void shouldDrawFirstUniformlyWhenWeightsAreEqual() {
        FakePopulation population = new FakePopulation()
                .add("a", 1.0).add("b", 1.0).add("c", 1.0).add("d", 1.0).add("e", 1.0);
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(42L));
        int samples = 20000;

        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < samples; i++) {
            String first = engine.randomStart(population);
            counts.merge(first, 1, Integer::sum);
        }

        double expected = samples / 5.0;
        double chiSquare = 0D;
        for (String key : population.candidateKeys()) {
            int observed = counts.getOrDefault(key, 0);
            chiSquare += (observed - expected) * (observed - expected) / expected;
        }
        // df = 4, p = 0.001
        assertTrue(chiSquare < 18.47, "chi-square too large: " + chiSquare);
    }

    @Test
    void shouldDrawFirstProportionallyToWeight() {
        FakePopulation population = new FakePopulation().add("a", 1.0).add("b", 3.2).add("c", 6.4);
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(7L));
        int samples = 30000;

        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < samples; i++) {
            counts.merge(engine.randomStart(population), 1, Integer::sum);
        }

        double total = 1.0 + 3.2 + 6.4;
        assertEquals(1.0 / total, counts.get("a") / (double) samples, 0.015);
        assertEquals(3.2 / total, counts.get("b") / (double) samples, 0.015);
        assertEquals(6.4 / total, counts.get("c") / (double) samples, 0.015);
    }

    @Test
    void shouldVisitEveryCandidateOnceBeforeRepeating() {
        FakePopulation population = new FakePopulation();
        for (int i = 0; i < 12; i++) {
            population.add("track-" + i, 1.0 + (i % 5) * 1.4);
        }
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(3L));

        Set<String> seen = new HashSet<>();
        String current = null;
        for (int i = 0; i < 12; i++) {
            current = engine.next(population, current);
            assertNotNull(current);
            assertTrue(seen.add(current), "repeated before full traversal: " + current);
        }
        assertEquals(12, seen.size());
    }

    @Test
    void shouldNotRepeatCurrentRightAfterReshuffle() {
        FakePopulation population = new FakePopulation().add("a", 1.0).add("b", 1.0).add("c", 1.0);
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(11L));

        String current = null;
        for (int round = 0; round < 50; round++) {
            String next = engine.next(population, current);
            if (current != null) {
                assertNotEquals(current, next);
            }
            current = next;
        }
    }

    @Test
    void shouldSkipUnplayableAndTerminateWhenAllAreUnplayable() {
        FakePopulation population = new FakePopulation().add("a", 1.0).add("b", 6.4).add("c", 1.0);
        population.unplayable.add("b");
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(5L));

        for (int i = 0; i < 20; i++) {
            assertNotEquals("b", engine.next(population, null));
        }

        population.unplayable.addAll(Arrays.asList("a", "c"));
        assertNull(engine.next(population, "a"));
        assertNull(engine.peek(population, "a"));
        assertNull(engine.randomStart(population));
    }

    @Test
    void shouldReturnNoCandidateForEmptyPopulation() {
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(1L));
        FakePopulation empty = new FakePopulation();

        assertNull(engine.next(empty, null));
        assertNull(engine.previous(empty));
        assertNull(engine.randomExcludingCurrent(empty, null));
        assertFalse(engine.isActive());
    }

    @Test
    void shouldPeekWithoutAdvancing() {
        FakePopulation population = new FakePopulation().add("a", 1.0).add("b", 1.0).add("c", 1.0);
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(9L));

        String first = engine.next(population, null);
        int cursor = engine.cursor();
        String peeked = engine.peek(population, first);

        assertEquals(cursor, engine.cursor());
        assertEquals(peeked, engine.next(population, first));
    }

    @Test
    void shouldWalkBackThroughHistoryWithoutRebuilding() {
        FakePopulation population = new FakePopulation().add("a", 1.0).add("b", 1.0).add("c", 1.0).add("d", 1.0);
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(13L));

        String first = engine.next(population, null);
        String second = engine.next(population, first);
        String third = engine.next(population, second);
        List<String> before = engine.permutation();

        assertEquals(second, engine.previous(population));
        assertEquals(first, engine.previous(population));
        assertNull(engine.previous(population));
        assertEquals(before, engine.permutation());
        assertEquals(second, engine.next(population, first));
        assertNotNull(third);
    }

    @Test
    void shouldPreserveRelativeOrderWhenIntegratingAppendedKeys() {
        FakePopulation population = new FakePopulation();
        for (int i = 0; i < 8; i++) {
            population.add("k" + i, 1.0);
        }
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(17L));
        String current = engine.next(population, null);
        current = engine.next(population, current);
        current = engine.next(population, current);
        List<String> before = engine.permutation();
        int cursor = engine.cursor();

        population.add("new-1", 6.4).add("new-2", 1.0).add("new-3", 3.2);
        engine.integrate(population, Arrays.asList("new-1", "new-2", "new-3"), Collections.<String>emptyList());

        List<String> after = engine.permutation();
        assertEquals(before.size() + 3, after.size());
        assertEquals(cursor, engine.cursor());
        assertEquals(before.subList(0, cursor), after.subList(0, cursor));
        List<String> withoutNew = new ArrayList<>(after);
        withoutNew.removeAll(Arrays.asList("new-1", "new-2", "new-3"));
        assertEquals(before, withoutNew);
        for (String added : Arrays.asList("new-1", "new-2", "new-3")) {
            assertTrue(after.indexOf(added) >= cursor);
        }
    }

    @Test
    void shouldBiasHeavyInsertsTowardTheFront() {
        long heavySum = 0;
        long lightSum = 0;
        int rounds = 2000;
        for (int round = 0; round < rounds; round++) {
            FakePopulation population = new FakePopulation();
            for (int i = 0; i < 10; i++) {
                population.add("k" + i, 1.0);
            }
            WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(round));
            engine.next(population, null);
            population.add("heavy", 6.4).add("light", 1.0);
            engine.integrate(population, Arrays.asList("heavy", "light"), Collections.<String>emptyList());
            List<String> order = engine.permutation();
            heavySum += order.indexOf("heavy");
            lightSum += order.indexOf("light");
        }
        assertTrue(heavySum < lightSum, "heavy=" + heavySum + " light=" + lightSum);
    }

    @Test
    void shouldRemoveConsumedAndPendingKeysKeepingUpcomingEntry() {
        FakePopulation population = new FakePopulation().add("a", 1.0).add("b", 1.0).add("c", 1.0)
                .add("d", 1.0).add("e", 1.0);
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(19L));
        String first = engine.next(population, null);
        String second = engine.next(population, first);
        String upcoming = engine.peek(population, second);
        List<String> order = engine.permutation();
        String lastPending = order.get(order.size() - 1);

        engine.integrate(population, Collections.<String>emptyList(), Arrays.asList(first, lastPending));

        assertEquals(1, engine.cursor());
        assertEquals(3, engine.permutation().size());
        assertFalse(engine.permutation().contains(first));
        assertFalse(engine.permutation().contains(lastPending));
        assertEquals(upcoming, engine.peek(population, second));
    }

    @Test
    void shouldIgnoreIntegrateWhileNoPermutationExists() {
        FakePopulation population = new FakePopulation().add("a", 1.0);
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(23L));

        engine.integrate(population, Collections.singletonList("a"), Collections.<String>emptyList());

        assertFalse(engine.isActive());
    }

    @Test
    void shouldAlwaysPickOnlyOtherCandidateWhenExcludingCurrent() {
        FakePopulation population = new FakePopulation().add("A", 1.0).add("B", 6.4);
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(29L));

        for (int i = 0; i < 10000; i++) {
            assertEquals("B", engine.randomExcludingCurrent(population, "A"));
        }
    }

    @Test
    void shouldLeavePermutationUntouchedOnExcludingDraw() {
        FakePopulation population = new FakePopulation().add("a", 1.0).add("b", 3.2).add("c", 4.8);
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(31L));
        String current = engine.next(population, null);
        List<String> before = engine.permutation();
        int cursor = engine.cursor();

        String drawn = engine.randomExcludingCurrent(population, current);

        assertNotEquals(current, drawn);
        assertEquals(before, engine.permutation());
        assertEquals(cursor, engine.cursor());
    }

    @Test
    void shouldFloorZeroWeightInsteadOfDroppingKey() {
        FakePopulation population = new FakePopulation().add("zero", 0.0).add("one", 1.0).add("nan", Double.NaN);
        WeightedShuffleEngine engine = new WeightedShuffleEngine(new Random(37L));

        List<String> order = engine.weightedPermutation(population.candidateKeys(), population);

        assertEquals(3, order.size());
        assertTrue(order.containsAll(population.candidateKeys()));
    }

    private static final class FakePopulation implements ShufflePopulation {

        private final Map<String, Double> weights = new LinkedHashMap<>();
        private final Set<String> unplayable = new HashSet<>();

        private FakePopulation add(String key, double weight) {
            weights.put(key, weight);
            return this;
        }

        @Override
        public List<String> candidateKeys() {
            return new ArrayList<>(weights.keySet());
        }

        @Override
        public boolean isSelectable(String key) {
            return weights.containsKey(key) && !unplayable.contains(key);
        }

        @Override
        public double weightOf(String key) {
            Double weight = weights.get(key);
            return weight == null ? 1.0 : weight;
        }
    }
}
