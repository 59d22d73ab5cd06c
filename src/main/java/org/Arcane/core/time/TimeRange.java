package org.Arcane.core.time;

/**
 * Closed time interval {@code [start, end]} in Unix seconds.
 *
 * @param start inclusive lower bound.
 * @param end inclusive upper bound.
 */
public record TimeRange(double start, double end) {

    public TimeRange {
        if (!Double.isFinite(start) || !Double.isFinite(end)) {
            throw new IllegalArgumentException("Time range bounds must be finite: [" + start + ", " + end + "]");
        }
        if (start > end) {
            throw new IllegalArgumentException("Time range start must not exceed end: [" + start + ", " + end + "]");
        }
    }

    /**
     * Returns {@code true} when {@code time} lies inside the closed interval.
     */
    public boolean contains(double time) {
        return time >= start && time <= end;
    }

    /**
     * Returns the interval width {@code end - start}.
     */
    public double width() {
        return end - start;
    }
}
