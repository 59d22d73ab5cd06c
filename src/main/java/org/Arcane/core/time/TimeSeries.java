package org.Arcane.core.time;

import it.unimi.dsi.fastutil.doubles.DoubleArrays;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable collection of floating-point timestamps sharing one {@link TimeUtils.TimeEpoch}.
 *
 * <p>Construction copies the input; no ordering or uniqueness is implied unless
 * {@link #unique()} is called.</p>
 */
public final class TimeSeries {

    private final double[] values;
    @Getter
    @Accessors(fluent = true)
    private final TimeUtils.TimeEpoch epoch;

    private TimeSeries(double[] values, TimeUtils.TimeEpoch epoch) {
        this.values = values;
        this.epoch = Objects.requireNonNull(epoch, "epoch");
    }

    /**
     * Creates a series from a defensive copy of {@code values}.
     */
    public static TimeSeries of(TimeUtils.TimeEpoch epoch, double... values) {
        Objects.requireNonNull(values, "values");
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new IllegalArgumentException("values[" + i + "] must be finite, got " + values[i]);
            }
        }
        return new TimeSeries(values.clone(), epoch);
    }

    /**
     * Creates a Unix-seconds series from a defensive copy of {@code values}.
     */
    public static TimeSeries unix(double... values) {
        return of(TimeUtils.TimeEpoch.UNIX_SECONDS, values);
    }

    /**
     * Returns an empty series in {@code epoch}.
     */
    public static TimeSeries empty(TimeUtils.TimeEpoch epoch) {
        return new TimeSeries(new double[0], epoch);
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double get(int index) {
        return values[index];
    }

    /**
     * Returns a copy of the backing values.
     */
    public double[] toArray() {
        return values.clone();
    }

    /**
     * Returns the sorted, duplicate-free series (sort-based unique).
     */
    public TimeSeries unique() {
        if (values.length == 0) {
            return this;
        }
        double[] sorted = values.clone();
        DoubleArrays.quickSort(sorted);
        int write = 1;
        for (int read = 1; read < sorted.length; read++) {
            if (sorted[read] != sorted[write - 1]) {
                sorted[write++] = sorted[read];
            }
        }
        return new TimeSeries(Arrays.copyOf(sorted, write), epoch);
    }

    /**
     * Returns {@code true} when no value occurs more than once.
     */
    public boolean isUnique() {
        return unique().size() == values.length;
    }

    /**
     * Converts the series to Unix seconds.
     */
    public TimeSeries toUnix() {
        if (epoch == TimeUtils.TimeEpoch.UNIX_SECONDS) {
            return this;
        }
        double[] converted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            converted[i] = TimeUtils.toUnixSeconds(values[i], epoch);
        }
        return new TimeSeries(converted, TimeUtils.TimeEpoch.UNIX_SECONDS);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSeries)) {
            return false;
        }
        TimeSeries other = (TimeSeries) o;
        return epoch == other.epoch && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * epoch.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TimeSeries{epoch=" + epoch + ", size=" + values.length + "}";
    }
}
