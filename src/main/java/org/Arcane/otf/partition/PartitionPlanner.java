package org.Arcane.otf.partition;

import org.Arcane.core.id.PointingIdMapping;
import org.Arcane.otf.OtfPipelineException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives partition windows from the pointing-id mapping. Windows are never stored.
 */
public final class PartitionPlanner {
    public static final double DEFAULT_SPLIT_TIMEDELTA = 0.5d;

    private final PointingIdMapping mapping;
    private final double timedelta;

    public PartitionPlanner(PointingIdMapping mapping, double timedelta) {
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        if (!Double.isFinite(timedelta) || timedelta <= 0.0d) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "Split timedelta must be finite and > 0, got " + timedelta);
        }
        this.timedelta = timedelta;
    }

    /**
     * Returns {@code [t - timedelta/2, t + timedelta/2]} for the matched time {@code t} of {@code id}.
     *
     * @throws OtfPipelineException {@code UNKNOWN_POINTING_ID} when the id is not mapped.
     */
    public PartitionWindow plan(int id) {
        if (!mapping.containsId(id)) {
            throw new OtfPipelineException(OtfPipelineException.UNKNOWN_POINTING_ID,
                    "Pointing id " + id + " is not in the mapping (size " + mapping.size() + ")");
        }
        return PartitionWindow.around(id, mapping.time(id), timedelta);
    }

    /**
     * Plans every mapped id in ascending id order.
     */
    public List<PartitionWindow> planAll() {
        List<PartitionWindow> windows = new ArrayList<>(mapping.size());
        for (int id : mapping.ids()) {
            windows.add(plan(id));
        }
        return windows;
    }

    public double timedelta() {
        return timedelta;
    }
}
