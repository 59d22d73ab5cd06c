package org.Arcane.otf.dataset;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Concatenates datasets into a new one, preserving list order.
 *
 * @param inputs input datasets in concatenation order.
 * @param output destination path; must not exist when the request runs.
 */
public record ConcatRequest(List<DatasetHandle> inputs, Path output) {
    public ConcatRequest {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("inputs must not be empty");
        }
        Objects.requireNonNull(output, "output");
    }
}
