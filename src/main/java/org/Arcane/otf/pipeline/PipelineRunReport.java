package org.Arcane.otf.pipeline;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Arcane.otf.partition.StageOutcome;
import org.Arcane.otf.partition.StageState;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of one {@link OtfPipeline#run} or {@link OtfPipeline#resume} call.
 */
@Getter
@Accessors(fluent = true)
public final class PipelineRunReport {
    /** Last stage outcome per pointing id, ascending id order. */
    private final SortedMap<Integer, StageOutcome> pointingOutcomes;
    /** Calibrator split outcome, {@code null} when calibrators are not split. */
    private final StageOutcome calibratorOutcome;
    /** Merged dataset, or the standalone per-id datasets when merging is skipped; empty when not reached. */
    private final List<Path> outputs;

    PipelineRunReport(Map<Integer, StageOutcome> pointingOutcomes, StageOutcome calibratorOutcome, List<Path> outputs) {
        this.pointingOutcomes = Collections.unmodifiableSortedMap(
                new TreeMap<>(Objects.requireNonNull(pointingOutcomes, "pointingOutcomes")));
        this.calibratorOutcome = calibratorOutcome;
        this.outputs = List.copyOf(Objects.requireNonNull(outputs, "outputs"));
    }

    public StageState stateOf(int id) {
        StageOutcome outcome = pointingOutcomes.get(id);
        if (outcome == null) {
            throw new IllegalArgumentException("Pointing id " + id + " is not part of this run");
        }
        return outcome.state();
    }

    /**
     * Ids whose last stage failed, ascending.
     */
    public List<Integer> failedIds() {
        return idsIn(StageState.FAILED);
    }

    /**
     * Ids that did not reach {@code COMPLETE}, ascending.
     */
    public List<Integer> incompleteIds() {
        List<Integer> ids = new ArrayList<>();
        for (Map.Entry<Integer, StageOutcome> entry : pointingOutcomes.entrySet()) {
            if (!entry.getValue().isComplete()) {
                ids.add(entry.getKey());
            }
        }
        return ids;
    }

    public boolean calibratorsComplete() {
        return calibratorOutcome == null || calibratorOutcome.isComplete();
    }

    /**
     * {@code true} when every stage completed and the outputs were produced.
     */
    public boolean isSuccessful() {
        return incompleteIds().isEmpty() && calibratorsComplete() && !outputs.isEmpty();
    }

    private List<Integer> idsIn(StageState state) {
        List<Integer> ids = new ArrayList<>();
        for (Map.Entry<Integer, StageOutcome> entry : pointingOutcomes.entrySet()) {
            if (entry.getValue().state() == state) {
                ids.add(entry.getKey());
            }
        }
        return ids;
    }

    @Override
    public String toString() {
        return "PipelineRunReport{pointings=" + pointingOutcomes.size()
                + ", failed=" + failedIds()
                + ", incomplete=" + incompleteIds()
                + ", calibrators=" + (calibratorOutcome == null ? "n/a" : calibratorOutcome.state())
                + ", outputs=" + outputs + "}";
    }
}
