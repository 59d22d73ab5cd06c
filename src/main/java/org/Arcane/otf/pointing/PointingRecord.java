package org.Arcane.otf.pointing;

/**
 * One reference-pointing sample.
 *
 * <p>The coordinates are opaque to the pipeline; by convention they are RA and
 * Dec in degrees.</p>
 *
 * @param time sample time in Unix seconds.
 * @param coordA first coordinate.
 * @param coordB second coordinate.
 */
public record PointingRecord(double time, double coordA, double coordB) {
}
