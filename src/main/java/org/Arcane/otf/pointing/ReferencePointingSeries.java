package org.Arcane.otf.pointing;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Arcane.core.time.TimeSeries;

import java.util.Objects;

/**
 * Immutable reference-pointing series: three parallel arrays of equal length.
 */
public final class ReferencePointingSeries {
    public static final String DEFAULT_TIME_KEY = "time";
    public static final String DEFAULT_COORD_A_KEY = "ra";
    public static final String DEFAULT_COORD_B_KEY = "dec";

    private final double[] times;
    private final double[] coordA;
    private final double[] coordB;
    @Getter
    @Accessors(fluent = true)
    private final TimeSeries time;

    /**
     * Creates a series from defensive copies of the three arrays.
     *
     * @throws IllegalArgumentException when lengths differ.
     */
    public ReferencePointingSeries(double[] times, double[] coordA, double[] coordB) {
        Objects.requireNonNull(times, "times");
        Objects.requireNonNull(coordA, "coordA");
        Objects.requireNonNull(coordB, "coordB");
        if (times.length != coordA.length || times.length != coordB.length) {
            throw new IllegalArgumentException(
                    "Reference pointing arrays must have equal length: time=" + times.length
                            + ", coordA=" + coordA.length + ", coordB=" + coordB.length);
        }
        this.times = times.clone();
        this.coordA = coordA.clone();
        this.coordB = coordB.clone();
        this.time = TimeSeries.unix(this.times);
    }

    public int size() {
        return times.length;
    }

    public PointingRecord record(int index) {
        return new PointingRecord(times[index], coordA[index], coordB[index]);
    }

    public double[] coordA() {
        return coordA.clone();
    }

    public double[] coordB() {
        return coordB.clone();
    }

    /**
     * Single-value nearest-neighbour search over the reference times.
     *
     * @param target time to look up.
     * @return index of the minimal {@code |time - target|}; the first index wins ties.
     * @throws IllegalStateException when the series is empty.
     */
    public int nearest(double target) {
        if (times.length == 0) {
            throw new IllegalStateException("Reference pointing series is empty");
        }
        int best = 0;
        double bestDistance = Math.abs(times[0] - target);
        for (int i = 1; i < times.length; i++) {
            double distance = Math.abs(times[i] - target);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }
}
