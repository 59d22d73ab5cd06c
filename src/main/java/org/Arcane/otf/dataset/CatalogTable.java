package org.Arcane.otf.dataset;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Dataset catalog subtables carrying a {@code NAME} column.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum CatalogTable {
    FIELD("FIELD"),
    SOURCE("SOURCE"),
    POINTING("POINTING");

    private final String tableName;
}
