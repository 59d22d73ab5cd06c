package org.Arcane.core.id;

import lombok.experimental.StandardException;

import java.util.Map;

/**
 * Immutable mapping contract between dense pointing ids and matched reference times.
 *
 * <p>Ids form the dense range {@code 0..size-1}. The mapping is created once per
 * pipeline run and shared read-only by every downstream stage.</p>
 */
public interface PointingIdMapping {

    /**
     * Returns the matched reference time of a pointing id.
     *
     * @param pointingId dense pointing id.
     * @return matched reference time in Unix seconds.
     * @throws UnknownPointingIdException if the id is outside the mapping.
     */
    double time(int pointingId) throws UnknownPointingIdException;

    /**
     * Checks whether a pointing id is within mapping bounds.
     *
     * @param pointingId id to test.
     * @return true when the id is present.
     */
    boolean containsId(int pointingId);

    /**
     * Returns number of pointing ids in the mapping.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Returns all ids in ascending order.
     */
    int[] ids();

    /**
     * Returns a copy of the matched times indexed by pointing id.
     */
    double[] times();

    /**
     * Returns the persisted form {@code "id" -> time}, iterated in ascending id order.
     */
    Map<String, Double> toStringKeyedMap();

    /**
     * Exception thrown when a pointing id cannot be found in the mapping.
     */
    @StandardException
    class UnknownPointingIdException extends RuntimeException {
    }

    /**
     * Enumerates matched times into ids {@code 0..K-1}, preserving input order.
     *
     * @param matchedTimes matched reference times in cross-match output order.
     * @return an immutable mapping.
     */
    static PointingIdMapping fromMatchedTimes(double[] matchedTimes) {
        return new ArrayPointingIdMapping(matchedTimes);
    }

    /**
     * Rebuilds a mapping from its persisted string-keyed form.
     *
     * @param persisted map of {@code "id" -> time}; ids must be a dense range from 0 to size-1.
     * @return an immutable mapping.
     */
    static PointingIdMapping fromStringKeyed(Map<String, ? extends Number> persisted) {
        return ArrayPointingIdMapping.fromStringKeyed(persisted);
    }
}
