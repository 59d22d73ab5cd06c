package org.Arcane.otf.match;

import org.Arcane.core.id.PointingIdMapping;
import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.pointing.PointingRecord;
import org.Arcane.otf.pointing.ReferencePointingSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NearestPointingLookupTest {

    private final ReferencePointingSeries series = new ReferencePointingSeries(
            new double[]{100.0d, 100.5d, 101.0d},
            new double[]{150.0d, 150.1d, 150.2d},
            new double[]{2.0d, 2.1d, 2.2d});

    @Test
    @DisplayName("Mapped ids resolve to their reference record")
    void testResolve() {
        PointingIdMapping mapping = PointingIdMapping.fromMatchedTimes(new double[]{100.5d, 101.0d});
        NearestPointingLookup lookup = new NearestPointingLookup(series, mapping, 0.001d);

        assertEquals(new PointingRecord(100.5d, 150.1d, 2.1d), lookup.resolve(0));
        assertEquals(new PointingRecord(101.0d, 150.2d, 2.2d), lookup.resolve(1));
        assertEquals(101.0d, lookup.mappedTime(1));
    }

    @Test
    @DisplayName("Unknown pointing id is UNKNOWN_POINTING_ID")
    void testUnknownId() {
        NearestPointingLookup lookup = new NearestPointingLookup(series,
                PointingIdMapping.fromMatchedTimes(new double[]{100.0d}), 0.001d);

        OtfPipelineException ex = assertThrows(OtfPipelineException.class, () -> lookup.resolve(5));
        assertEquals(OtfPipelineException.UNKNOWN_POINTING_ID, ex.getReasonCode());
        assertTrue(ex.getMessage().contains("5"));
    }

    @Test
    @DisplayName("A reference series that no longer holds the mapped time is STALE_MATCH")
    void testStaleMatch() {
        PointingIdMapping mapping = PointingIdMapping.fromMatchedTimes(new double[]{100.25d});
        NearestPointingLookup lookup = new NearestPointingLookup(series, mapping, 0.1d);

        OtfPipelineException ex = assertThrows(OtfPipelineException.class, () -> lookup.resolve(0));
        assertEquals(OtfPipelineException.STALE_MATCH, ex.getReasonCode());

        NearestPointingLookup empty = new NearestPointingLookup(
                new ReferencePointingSeries(new double[0], new double[0], new double[0]), mapping, 0.1d);
        assertEquals(OtfPipelineException.STALE_MATCH,
                assertThrows(OtfPipelineException.class, () -> empty.resolve(0)).getReasonCode());
    }

    @Test
    @DisplayName("Lookup threshold must be finite and positive")
    void testInvalidThreshold() {
        PointingIdMapping mapping = PointingIdMapping.fromMatchedTimes(new double[]{100.0d});
        assertEquals(OtfPipelineException.INVALID_SELECTION, assertThrows(OtfPipelineException.class,
                () -> new NearestPointingLookup(series, mapping, 0.0d)).getReasonCode());
    }
}
