package org.Arcane.otf.match;

import org.Arcane.core.id.PointingIdMapping;
import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.pointing.PointingRecord;
import org.Arcane.otf.pointing.ReferencePointingSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Re-derives the reference-pointing record of a pointing id from the original series.
 *
 * <p>The mapped time is looked up with a single-value nearest-neighbour search and
 * re-validated against the threshold, so a mapping edited between stages is detected.</p>
 */
public final class NearestPointingLookup {

    private final ReferencePointingSeries series;
    private final PointingIdMapping mapping;
    private final double threshold;
    private final Logger log;

    public NearestPointingLookup(ReferencePointingSeries series, PointingIdMapping mapping, double threshold) {
        this(series, mapping, threshold, LoggerFactory.getLogger(NearestPointingLookup.class));
    }

    public NearestPointingLookup(ReferencePointingSeries series, PointingIdMapping mapping, double threshold,
                                 Logger log) {
        this.series = Objects.requireNonNull(series, "series");
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        if (!Double.isFinite(threshold) || threshold <= 0.0d) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "Lookup threshold must be finite and > 0, got " + threshold);
        }
        this.threshold = threshold;
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Resolves the reference record of {@code pointingId}.
     *
     * @throws OtfPipelineException {@code UNKNOWN_POINTING_ID} for an id outside the mapping,
     *                              {@code STALE_MATCH} when the nearest reference time is further
     *                              than the threshold from the mapped time.
     */
    public PointingRecord resolve(int pointingId) {
        double mapped = mappedTime(pointingId);
        if (series.size() == 0) {
            throw new OtfPipelineException(OtfPipelineException.STALE_MATCH,
                    "Pointing id " + pointingId + " maps to " + mapped + " but the reference series is empty");
        }
        int index = series.nearest(mapped);
        PointingRecord record = series.record(index);
        double difference = Math.abs(record.time() - mapped);
        if (difference > threshold) {
            throw new OtfPipelineException(OtfPipelineException.STALE_MATCH,
                    "Pointing id " + pointingId + " maps to " + mapped + " but the nearest reference time is "
                            + record.time() + " (difference " + difference + " > threshold " + threshold + ")");
        }
        log.debug("Pointing id {} resolved to reference index {} ({}, {}, {})",
                pointingId, index, record.time(), record.coordA(), record.coordB());
        return record;
    }

    /**
     * Returns the mapped time of {@code pointingId}.
     *
     * @throws OtfPipelineException {@code UNKNOWN_POINTING_ID} for an id outside the mapping.
     */
    public double mappedTime(int pointingId) {
        try {
            return mapping.time(pointingId);
        } catch (PointingIdMapping.UnknownPointingIdException ex) {
            throw new OtfPipelineException(OtfPipelineException.UNKNOWN_POINTING_ID, ex.getMessage(), ex);
        }
    }
}
