package org.Arcane.otf.partition;

/**
 * Lifecycle of one per-id stage.
 */
public enum StageState {
    PLANNED,
    SELECTION_ISSUED,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
