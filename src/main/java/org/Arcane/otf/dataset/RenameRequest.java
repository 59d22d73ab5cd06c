package org.Arcane.otf.dataset;

import java.util.Objects;

/**
 * Overwrites the {@code NAME} cell of one catalog row.
 *
 * @param dataset dataset to mutate.
 * @param table catalog subtable.
 * @param row row index.
 * @param name new name.
 */
public record RenameRequest(DatasetHandle dataset, CatalogTable table, int row, String name) {
    public RenameRequest {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(name, "name");
        if (row < 0) {
            throw new IllegalArgumentException("row must be >= 0");
        }
    }
}
