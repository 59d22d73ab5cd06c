package org.Arcane.core.id;

import it.unimi.dsi.fastutil.doubles.DoubleOpenHashSet;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Array-backed {@link PointingIdMapping}.
 * <p>
 * Lookup (id to time) is a plain array read. This class is immutable and
 * thread-safe for concurrent reads.
 * </p>
 */
public final class ArrayPointingIdMapping implements PointingIdMapping {

    // Simple array for id -> time, zero allocation read
    private final double[] timesById;

    /**
     * Constructs the mapping by enumerating {@code matchedTimes} in order.
     * Rejects non-finite and duplicate times.
     */
    public ArrayPointingIdMapping(double[] matchedTimes) {
        if (matchedTimes == null) {
            throw new IllegalArgumentException("Matched times cannot be null");
        }
        int size = matchedTimes.length;
        this.timesById = new double[size];
        DoubleOpenHashSet seen = new DoubleOpenHashSet(size);

        for (int id = 0; id < size; id++) {
            double time = matchedTimes[id];
            if (!Double.isFinite(time)) {
                throw new IllegalArgumentException("Matched time for id " + id + " must be finite, got " + time);
            }
            if (!seen.add(time)) {
                throw new IllegalArgumentException("Duplicate matched time " + time + " at id " + id);
            }
            timesById[id] = time;
        }
    }

    /**
     * Rebuilds a mapping from {@code "id" -> time} entries.
     * Validates that the ids are dense and 0-indexed.
     */
    static ArrayPointingIdMapping fromStringKeyed(Map<String, ? extends Number> persisted) {
        if (persisted == null) {
            throw new IllegalArgumentException("Persisted mapping cannot be null");
        }
        int size = persisted.size();
        double[] times = new double[size];
        boolean[] seen = new boolean[size];

        for (Map.Entry<String, ? extends Number> entry : persisted.entrySet()) {
            int id = parseDenseId(entry.getKey(), size);
            if (seen[id]) {
                throw new IllegalArgumentException("Duplicate pointing id in persisted mapping: " + id);
            }
            Number value = entry.getValue();
            if (value == null) {
                throw new IllegalArgumentException("Pointing id " + id + " has no matched time");
            }
            seen[id] = true;
            times[id] = value.doubleValue();
        }
        return new ArrayPointingIdMapping(times);
    }

    private static int parseDenseId(String key, int size) {
        if (key == null) {
            throw new IllegalArgumentException("Pointing id key cannot be null");
        }
        int id;
        try {
            id = Integer.parseInt(key.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Pointing id key is not an integer: '" + key + "'", ex);
        }
        if (id < 0 || id >= size) {
            throw new IllegalArgumentException(
                    "Pointing ids must be dense and 0-indexed. Found out of bounds: " + id);
        }
        return id;
    }

    @Override
    public double time(int pointingId) {
        if (!containsId(pointingId)) {
            throw new UnknownPointingIdException(
                    "Pointing id not found: " + pointingId + " (mapping holds " + timesById.length + " ids)");
        }
        return timesById[pointingId];
    }

    @Override
    public boolean containsId(int pointingId) {
        return pointingId >= 0 && pointingId < timesById.length;
    }

    @Override
    public int size() {
        return timesById.length;
    }

    @Override
    public int[] ids() {
        int[] ids = new int[timesById.length];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = i;
        }
        return ids;
    }

    @Override
    public double[] times() {
        return timesById.clone();
    }

    @Override
    public Map<String, Double> toStringKeyedMap() {
        LinkedHashMap<String, Double> persisted = new LinkedHashMap<>();
        for (int id = 0; id < timesById.length; id++) {
            persisted.put(Integer.toString(id), timesById[id]);
        }
        return persisted;
    }

    @Override
    public String toString() {
        return "ArrayPointingIdMapping{size=" + timesById.length + "}";
    }
}
