package org.Arcane.otf.partition;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of one split or rename stage.
 *
 * @param id pointing id, or {@link #CALIBRATORS} for the calibrator split.
 * @param state final state.
 * @param outputPath dataset the stage produced or mutated.
 * @param diagnostics engine diagnostic text or failure reason.
 */
public record StageOutcome(int id, StageState state, Path outputPath, String diagnostics) {
    public static final int CALIBRATORS = -1;

    public StageOutcome {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public static StageOutcome planned(int id, Path outputPath) {
        return new StageOutcome(id, StageState.PLANNED, outputPath, "");
    }

    public boolean isComplete() {
        return state == StageState.COMPLETE;
    }

    public boolean isCalibrators() {
        return id == CALIBRATORS;
    }

    public String label() {
        return isCalibrators() ? "calibrators" : "pointing " + id;
    }
}
