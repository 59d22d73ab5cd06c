package org.Arcane.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ArrayPointingIdMappingTest {

    @Test
    @DisplayName("Baseline Correctness: ids enumerate matched times in order")
    void testEnumeration() {
        PointingIdMapping mapping = PointingIdMapping.fromMatchedTimes(new double[]{100.0d, 200.0d, 150.0d});

        assertEquals(3, mapping.size());
        assertEquals(100.0d, mapping.time(0));
        assertEquals(150.0d, mapping.time(2));
        assertEquals(200.0d, mapping.time(1));
        assertArrayEquals(new int[]{0, 1, 2}, mapping.ids());
        assertArrayEquals(new double[]{100.0d, 200.0d, 150.0d}, mapping.times());
        assertTrue(mapping.containsId(2));
        assertFalse(mapping.containsId(3));
        assertFalse(mapping.containsId(-1));
    }

    @Test
    @DisplayName("Exception Path: unknown ids")
    void testUnknownLookups() {
        PointingIdMapping mapping = PointingIdMapping.fromMatchedTimes(new double[]{100.0d});

        assertThrows(PointingIdMapping.UnknownPointingIdException.class, () -> mapping.time(1));
        assertThrows(PointingIdMapping.UnknownPointingIdException.class, () -> mapping.time(-1));
    }

    @Test
    @DisplayName("Duplicate and non-finite matched times are rejected")
    void testInvalidTimes() {
        assertThrows(IllegalArgumentException.class,
                () -> PointingIdMapping.fromMatchedTimes(new double[]{1.0d, 1.0d}));
        assertThrows(IllegalArgumentException.class,
                () -> PointingIdMapping.fromMatchedTimes(new double[]{Double.NaN}));
        assertThrows(IllegalArgumentException.class, () -> PointingIdMapping.fromMatchedTimes(null));
    }

    @Test
    @DisplayName("Persisted string-keyed form round trips in ascending id order")
    void testStringKeyedRoundTrip() {
        PointingIdMapping mapping = PointingIdMapping.fromMatchedTimes(new double[]{10.0d, 20.0d, 30.0d});

        Map<String, Double> persisted = mapping.toStringKeyedMap();
        assertEquals(List.of("0", "1", "2"), List.copyOf(persisted.keySet()));

        PointingIdMapping restored = PointingIdMapping.fromStringKeyed(persisted);
        assertArrayEquals(mapping.times(), restored.times());
    }

    @Test
    @DisplayName("Persisted form must be dense and 0-indexed")
    void testSparsePersistedIds() {
        Map<String, Double> sparse = new HashMap<>();
        sparse.put("0", 1.0d);
        sparse.put("2", 2.0d);
        assertThrows(IllegalArgumentException.class, () -> PointingIdMapping.fromStringKeyed(sparse));

        Map<String, Double> notInteger = Map.of("first", 1.0d);
        assertThrows(IllegalArgumentException.class, () -> PointingIdMapping.fromStringKeyed(notInteger));

        Map<String, Double> unordered = new HashMap<>();
        unordered.put("1", 5.0d);
        unordered.put("0", 4.0d);
        assertEquals(4.0d, PointingIdMapping.fromStringKeyed(unordered).time(0));
    }

    @Test
    @DisplayName("Concurrency: parallel reads are consistent")
    void testConcurrentReads() throws Exception {
        double[] times = new double[1_000];
        for (int i = 0; i < times.length; i++) {
            times[i] = 1_000.0d + i * 0.5d;
        }
        PointingIdMapping mapping = PointingIdMapping.fromMatchedTimes(times);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                results.add(pool.submit(() -> {
                    for (int id = 0; id < times.length; id++) {
                        if (mapping.time(id) != times[id]) {
                            return false;
                        }
                    }
                    return true;
                }));
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get());
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
    }
}
