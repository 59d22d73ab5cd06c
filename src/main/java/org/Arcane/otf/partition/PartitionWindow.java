package org.Arcane.otf.partition;

import org.Arcane.core.time.TimeRange;

/**
 * Symmetric time window of one pointing id.
 *
 * @param id pointing id.
 * @param startTime window start in Unix seconds.
 * @param endTime window end in Unix seconds.
 */
public record PartitionWindow(int id, double startTime, double endTime) {
    public PartitionWindow {
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0");
        }
        if (!(startTime <= endTime)) {
            throw new IllegalArgumentException("startTime must be <= endTime, got " + startTime + " > " + endTime);
        }
    }

    /**
     * Centres a window of width {@code timedelta} on {@code matchedTime}.
     */
    public static PartitionWindow around(int id, double matchedTime, double timedelta) {
        double half = timedelta / 2.0d;
        return new PartitionWindow(id, matchedTime - half, matchedTime + half);
    }

    public double width() {
        return endTime - startTime;
    }

    public boolean contains(double time) {
        return time >= startTime && time <= endTime;
    }

    public TimeRange toTimeRange() {
        return new TimeRange(startTime, endTime);
    }
}
