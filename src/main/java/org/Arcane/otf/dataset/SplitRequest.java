package org.Arcane.otf.dataset;

import org.Arcane.core.time.TimeRange;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Data-selection request producing a new dataset.
 *
 * @param source opened source dataset, read-only.
 * @param output destination path; must not exist when the request runs.
 * @param fieldNames field names to keep.
 * @param timeRange optional inclusive time window in Unix seconds, {@code null} keeps every time.
 * @param dataColumn data column to copy.
 */
public record SplitRequest(DatasetHandle source,
                           Path output,
                           List<String> fieldNames,
                           TimeRange timeRange,
                           String dataColumn) {
    public static final String DEFAULT_DATA_COLUMN = "data";

    public SplitRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(output, "output");
        fieldNames = List.copyOf(Objects.requireNonNull(fieldNames, "fieldNames"));
        if (fieldNames.isEmpty()) {
            throw new IllegalArgumentException("fieldNames must not be empty");
        }
        Objects.requireNonNull(dataColumn, "dataColumn");
    }

    public Optional<TimeRange> window() {
        return Optional.ofNullable(timeRange);
    }
}
