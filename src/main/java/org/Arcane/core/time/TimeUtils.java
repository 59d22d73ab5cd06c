package org.Arcane.core.time;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Shared deterministic time helpers for pointing and dataset time series.
 *
 * <p>All calendar conversions operate in UTC. Time values are floating-point
 * seconds in one of the {@link TimeEpoch} frames.</p>
 */
public final class TimeUtils {

    /**
     * Epochs that time series values can be expressed in.
     */
    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor
    public enum TimeEpoch {
        /** Seconds since 1970-01-01T00:00:00Z. */
        UNIX_SECONDS(0.0d),
        /** Seconds since the Modified Julian Date origin 1858-11-17T00:00:00Z. */
        MJD_SECONDS(MJD_TO_UNIX_OFFSET_SECONDS);

        /** Seconds to subtract from a value in this epoch to obtain Unix seconds. */
        private final double offsetToUnixSeconds;
    }

    /** 40587 days between the MJD origin and the Unix epoch. */
    public static final double MJD_TO_UNIX_OFFSET_SECONDS = 40_587.0d * 86_400.0d;

    private static final long TENTH_MILLIS_PER_SECOND = 10_000L;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Converts a value from {@code epoch} to Unix seconds.
     *
     * @param value time value in {@code epoch}.
     * @param epoch epoch of {@code value}.
     * @return value in Unix seconds.
     */
    public static double toUnixSeconds(double value, TimeEpoch epoch) {
        if (epoch == null) {
            throw new IllegalArgumentException("Epoch cannot be null");
        }
        return value - epoch.offsetToUnixSeconds();
    }

    /**
     * Converts MJD seconds (the native dataset TIME column) to Unix seconds.
     */
    public static double mjdSecondsToUnix(double mjdSeconds) {
        return mjdSeconds - MJD_TO_UNIX_OFFSET_SECONDS;
    }

    /**
     * Soft plausibility check for Unix wall-clock values.
     *
     * @param unixSeconds candidate value.
     * @param clock clock providing "now".
     * @return {@code true} when the value is finite, non-negative and not in the future.
     */
    public static boolean isPlausibleUnixTime(double unixSeconds, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        if (!Double.isFinite(unixSeconds) || unixSeconds < 0.0d) {
            return false;
        }
        double nowSeconds = clock.millis() / 1_000.0d;
        return unixSeconds <= nowSeconds;
    }

    /**
     * Validates that values are monotonically non-decreasing.
     *
     * @param values timeline to validate.
     * @return {@code true} when ordering is preserved; otherwise {@code false}.
     */
    public static boolean isNonDecreasing(double[] values) {
        if (values == null || values.length < 2) {
            return true;
        }

        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[i - 1]) {
                return false;
            }
        }

        return true;
    }

    /**
     * Formats Unix seconds as a CASA datetime {@code yyyy/mm/dd/hh:mm:ss.ssss}.
     *
     * <p>Seconds are rounded to 0.1 ms before the calendar split, so the seconds
     * field never reads {@code 60.0000}.</p>
     *
     * @param unixSeconds Unix timestamp in seconds.
     * @return CASA-compatible datetime string.
     */
    public static String unixToCasaDatetime(double unixSeconds) {
        if (!Double.isFinite(unixSeconds)) {
            throw new IllegalArgumentException("Time value must be finite: " + unixSeconds);
        }
        long tenthMillis = Math.round(unixSeconds * TENTH_MILLIS_PER_SECOND);
        long wholeSeconds = Math.floorDiv(tenthMillis, TENTH_MILLIS_PER_SECOND);
        long fraction = Math.floorMod(tenthMillis, TENTH_MILLIS_PER_SECOND);

        LocalDateTime dateTime = LocalDateTime.ofEpochSecond(wholeSeconds, 0, ZoneOffset.UTC);
        return String.format(
                Locale.ROOT,
                "%d/%02d/%02d/%02d:%02d:%02d.%04d",
                dateTime.getYear(),
                dateTime.getMonthValue(),
                dateTime.getDayOfMonth(),
                dateTime.getHour(),
                dateTime.getMinute(),
                dateTime.getSecond(),
                fraction
        );
    }

    /**
     * Parses a CASA datetime {@code yyyy/mm/dd/hh:mm:ss.ss} into Unix seconds.
     *
     * @param casaDatetime datetime string, fractional seconds allowed.
     * @return Unix timestamp in seconds.
     * @throws IllegalArgumentException when the string is malformed.
     */
    public static double casaDatetimeToUnix(String casaDatetime) {
        if (casaDatetime == null || casaDatetime.isBlank()) {
            throw new IllegalArgumentException("CASA datetime cannot be blank");
        }
        String normalized = casaDatetime.trim();
        String[] dateParts = normalized.split("/");
        if (dateParts.length != 4) {
            throw new IllegalArgumentException("Invalid CASA datetime: " + normalized);
        }
        String[] timeParts = dateParts[3].split(":");
        if (timeParts.length != 3) {
            throw new IllegalArgumentException("Invalid CASA datetime: " + normalized);
        }
        LocalDateTime minuteStart;
        double seconds;
        try {
            minuteStart = LocalDateTime.of(
                    Integer.parseInt(dateParts[0].trim()),
                    Integer.parseInt(dateParts[1].trim()),
                    Integer.parseInt(dateParts[2].trim()),
                    Integer.parseInt(timeParts[0].trim()),
                    Integer.parseInt(timeParts[1].trim())
            );
            seconds = Double.parseDouble(timeParts[2].trim());
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Invalid CASA datetime: " + normalized, ex);
        }
        if (!(seconds >= 0.0d && seconds < 60.0d)) {
            throw new IllegalArgumentException("Seconds out of range in CASA datetime: " + normalized);
        }
        return minuteStart.toEpochSecond(ZoneOffset.UTC) + seconds;
    }

    /**
     * Parses a single CASA time range selection {@code start~end}.
     *
     * @param selection selection string.
     * @return parsed range in Unix seconds.
     * @throws IllegalArgumentException when malformed or when start is not before end.
     */
    public static TimeRange parseCasaTimerange(String selection) {
        if (selection == null) {
            throw new IllegalArgumentException("Time range selection cannot be null");
        }
        int separator = selection.indexOf('~');
        if (separator < 0 || selection.indexOf('~', separator + 1) >= 0) {
            throw new IllegalArgumentException("Invalid time range selection string: " + selection);
        }
        double start = casaDatetimeToUnix(selection.substring(0, separator));
        double end = casaDatetimeToUnix(selection.substring(separator + 1));
        if (start >= end) {
            throw new IllegalArgumentException("Invalid time range selected: " + selection);
        }
        return new TimeRange(start, end);
    }

    /**
     * Formats a Unix time range as a CASA selection {@code start~end}.
     */
    public static String toCasaTimerange(double startUnixSeconds, double endUnixSeconds) {
        return unixToCasaDatetime(startUnixSeconds) + "~" + unixToCasaDatetime(endUnixSeconds);
    }
}
