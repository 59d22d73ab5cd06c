package org.Arcane.otf.dataset;

import lombok.Builder;
import lombok.Value;
import org.Arcane.core.time.TimeRange;
import org.Arcane.otf.OtfPipelineException;

import java.util.List;
import java.util.Objects;

/**
 * Selection driving time extraction from a dataset.
 */
@Value
public class DatasetSelection {
    /**
     * Field names to select; must be non-empty.
     */
    List<String> fieldNames;
    /**
     * Scan numbers to select; {@code null} selects all scans of the fields.
     */
    List<Integer> scanIds;
    /**
     * Antenna pair used to avoid per-baseline duplicates of each timestamp.
     */
    Baseline baseline;
    /**
     * Optional inclusive Unix-seconds window applied after epoch normalisation.
     */
    TimeRange timeRange;

    @Builder(toBuilder = true)
    private DatasetSelection(List<String> fieldNames, List<Integer> scanIds, Baseline baseline, TimeRange timeRange) {
        if (fieldNames == null || fieldNames.isEmpty()) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "At least one field name must be selected");
        }
        for (String fieldName : fieldNames) {
            if (fieldName == null || fieldName.isBlank()) {
                throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                        "Field names must be non-blank, got " + fieldNames);
            }
        }
        if (scanIds != null && scanIds.isEmpty()) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "Scan id list must be null (all scans) or non-empty");
        }
        this.fieldNames = List.copyOf(fieldNames);
        this.scanIds = scanIds == null ? null : List.copyOf(scanIds);
        this.baseline = Objects.requireNonNullElse(baseline, Baseline.DEFAULT);
        this.timeRange = timeRange;
    }
}
