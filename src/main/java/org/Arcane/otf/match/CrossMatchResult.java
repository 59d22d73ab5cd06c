package org.Arcane.otf.match;

import org.Arcane.core.id.PointingIdMapping;
import org.Arcane.core.time.TimeSeries;

import java.util.Objects;

/**
 * Injective cross-match outcome.
 *
 * <p>{@code referenceTimes.get(i)} matched exactly one dataset time,
 * {@code datasetTimes.get(i)}. Entries are in ascending reference order.</p>
 */
public final class CrossMatchResult {
    private final TimeSeries referenceTimes;
    private final TimeSeries datasetTimes;

    CrossMatchResult(TimeSeries referenceTimes, TimeSeries datasetTimes) {
        this.referenceTimes = Objects.requireNonNull(referenceTimes, "referenceTimes");
        this.datasetTimes = Objects.requireNonNull(datasetTimes, "datasetTimes");
        if (referenceTimes.size() != datasetTimes.size()) {
            throw new IllegalArgumentException("Matched reference and dataset times must have equal length");
        }
    }

    public TimeSeries referenceTimes() {
        return referenceTimes;
    }

    public TimeSeries datasetTimes() {
        return datasetTimes;
    }

    public int size() {
        return referenceTimes.size();
    }

    public boolean isEmpty() {
        return referenceTimes.isEmpty();
    }

    /**
     * Enumerates the matched reference times into pointing ids {@code 0..K-1} in result order.
     */
    public PointingIdMapping toPointingIdMapping() {
        return PointingIdMapping.fromMatchedTimes(referenceTimes.toArray());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CrossMatchResult)) {
            return false;
        }
        CrossMatchResult other = (CrossMatchResult) o;
        return referenceTimes.equals(other.referenceTimes) && datasetTimes.equals(other.datasetTimes);
    }

    @Override
    public int hashCode() {
        return 31 * referenceTimes.hashCode() + datasetTimes.hashCode();
    }

    @Override
    public String toString() {
        return "CrossMatchResult{matches=" + size() + "}";
    }
}
