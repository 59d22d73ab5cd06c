package org.Arcane.otf.dataset;

import java.util.Objects;

/**
 * Outcome of one engine write operation.
 *
 * @param exitCode engine exit status, zero on success.
 * @param diagnostics captured diagnostic text.
 */
public record EngineResult(int exitCode, String diagnostics) {
    public EngineResult {
        Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public static EngineResult success(String diagnostics) {
        return new EngineResult(0, diagnostics);
    }

    public static EngineResult failure(int exitCode, String diagnostics) {
        if (exitCode == 0) {
            throw new IllegalArgumentException("failure exit code must be non-zero");
        }
        return new EngineResult(exitCode, diagnostics);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
