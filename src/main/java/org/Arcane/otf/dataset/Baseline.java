package org.Arcane.otf.dataset;

import org.Arcane.otf.OtfPipelineException;

/**
 * Cross-correlation antenna pair, always stored with {@code ant1 < ant2}.
 *
 * @param ant1 smaller antenna id.
 * @param ant2 larger antenna id.
 */
public record Baseline(int ant1, int ant2) {
    public static final Baseline DEFAULT = new Baseline(0, 1);

    public Baseline {
        if (ant1 < 0 || ant2 < 0) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "Antenna ids must be non-negative, got (" + ant1 + ", " + ant2 + ")");
        }
        if (ant1 >= ant2) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "Baseline must satisfy ant1 < ant2, got (" + ant1 + ", " + ant2 + ")");
        }
    }

    /**
     * Builds a normalised baseline from two antenna ids in either order.
     *
     * @throws OtfPipelineException {@code INVALID_SELECTION} when the ids are equal
     *                              (auto-correlation) or negative.
     */
    public static Baseline of(int a, int b) {
        if (a == b) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "Only cross-correlation baselines are allowed, got antenna " + a + " twice");
        }
        return a < b ? new Baseline(a, b) : new Baseline(b, a);
    }

    @Override
    public String toString() {
        return ant1 + "&" + ant2;
    }
}
