package org.Arcane.otf.rename;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.Objects;

/**
 * Deterministic display names and direction strings from pointing coordinates.
 *
 * <p>Names follow {@code <acronym>J<HHMMSS.ss><+/-DDMMSS.ss>} with every {@code '.'}
 * replaced by {@code '_'}, e.g. {@code OTFaspJ100028_58+021227_36}.</p>
 */
@UtilityClass
public final class PointingNamer {
    public static final String DEFAULT_ACRONYM = "OTFasp";

    private static final int NAME_PRECISION = 2;
    private static final int DIRECTION_PRECISION = 4;

    /**
     * Builds the display name of a pointing.
     *
     * @param acronym name prefix.
     * @param raDegrees right ascension in degrees.
     * @param decDegrees declination in degrees.
     */
    public static String name(String acronym, double raDegrees, double decDegrees) {
        Objects.requireNonNull(acronym, "acronym");
        requireFinite(raDegrees, decDegrees);
        Sexagesimal ra = Sexagesimal.ofHours(raDegrees, NAME_PRECISION);
        Sexagesimal dec = Sexagesimal.ofDegrees(decDegrees, NAME_PRECISION);
        String raText = String.format(Locale.ROOT, "%02d%02d%s", ra.whole, ra.minutes, ra.seconds());
        String decText = String.format(Locale.ROOT, "%c%02d%02d%s", dec.sign, dec.whole, dec.minutes, dec.seconds());
        return (acronym + "J" + raText + decText).replace('.', '_');
    }

    /**
     * Builds the phase-centre string {@code HHhMMmSS.SSSSs +DDdMMmSS.SSSSs}.
     */
    public static String directionString(double raDegrees, double decDegrees) {
        requireFinite(raDegrees, decDegrees);
        Sexagesimal ra = Sexagesimal.ofHours(raDegrees, DIRECTION_PRECISION);
        Sexagesimal dec = Sexagesimal.ofDegrees(decDegrees, DIRECTION_PRECISION);
        return String.format(Locale.ROOT, "%02dh%02dm%ss %c%02dd%02dm%ss",
                ra.whole, ra.minutes, ra.seconds(), dec.sign, dec.whole, dec.minutes, dec.seconds());
    }

    private static void requireFinite(double raDegrees, double decDegrees) {
        if (!Double.isFinite(raDegrees) || !Double.isFinite(decDegrees)) {
            throw new IllegalArgumentException("Coordinates must be finite, got (" + raDegrees + ", " + decDegrees + ")");
        }
    }

    /**
     * Sexagesimal split rounded to a fixed number of second decimals, with carry.
     */
    private static final class Sexagesimal {
        private final char sign;
        private final long whole;
        private final long minutes;
        private final long secondUnits;
        private final int precision;

        private Sexagesimal(char sign, long whole, long minutes, long secondUnits, int precision) {
            this.sign = sign;
            this.whole = whole;
            this.minutes = minutes;
            this.secondUnits = secondUnits;
            this.precision = precision;
        }

        static Sexagesimal ofHours(double degrees, int precision) {
            double hours = ((degrees % 360.0d) + 360.0d) % 360.0d / 15.0d;
            Sexagesimal split = split(hours, precision, '+');
            return new Sexagesimal('+', split.whole % 24, split.minutes, split.secondUnits, precision);
        }

        static Sexagesimal ofDegrees(double degrees, int precision) {
            return split(Math.abs(degrees), precision, degrees < 0.0d ? '-' : '+');
        }

        private static Sexagesimal split(double value, int precision, char sign) {
            long scale = pow10(precision);
            long total = Math.round(value * 3600.0d * scale);
            long perMinute = 60L * scale;
            long perWhole = 3600L * scale;
            long whole = total / perWhole;
            long remainder = total % perWhole;
            return new Sexagesimal(sign, whole, remainder / perMinute, remainder % perMinute, precision);
        }

        String seconds() {
            long scale = pow10(precision);
            return String.format(Locale.ROOT, "%02d.%0" + precision + "d", secondUnits / scale, secondUnits % scale);
        }

        private static long pow10(int exponent) {
            long value = 1L;
            for (int i = 0; i < exponent; i++) {
                value *= 10L;
            }
            return value;
        }
    }
}
