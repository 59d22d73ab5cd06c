package org.Arcane.otf.dataset;

import java.util.List;
import java.util.Objects;

/**
 * Raw {@code TIME} column query against the main table of a dataset.
 *
 * @param fieldIds catalog row ids to select, never empty.
 * @param scanIds scan numbers to select, {@code null} for all scans.
 * @param baseline antenna pair to select.
 */
public record TimeQuery(List<Integer> fieldIds, List<Integer> scanIds, Baseline baseline) {
    public TimeQuery {
        fieldIds = List.copyOf(Objects.requireNonNull(fieldIds, "fieldIds"));
        if (fieldIds.isEmpty()) {
            throw new IllegalArgumentException("fieldIds must not be empty");
        }
        scanIds = scanIds == null ? null : List.copyOf(scanIds);
        Objects.requireNonNull(baseline, "baseline");
    }

    public boolean allScans() {
        return scanIds == null;
    }
}
