package org.Arcane.otf.dataset;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Opened dataset handle returned by {@link DatasetEngine#open(Path)}.
 *
 * @param path dataset location on disk.
 */
public record DatasetHandle(Path path) {
    public DatasetHandle {
        Objects.requireNonNull(path, "path");
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
