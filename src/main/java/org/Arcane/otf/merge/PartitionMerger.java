package org.Arcane.otf.merge;

import org.Arcane.core.id.PointingIdMapping;
import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.dataset.ConcatRequest;
import org.Arcane.otf.dataset.DatasetEngine;
import org.Arcane.otf.dataset.DatasetHandle;
import org.Arcane.otf.dataset.EngineResult;
import org.Arcane.otf.partition.DatasetLayout;
import org.Arcane.otf.rename.PointingNameList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Concatenates the per-id datasets, in ascending id order, and optionally the calibrator
 * dataset into the merged output.
 */
public final class PartitionMerger {

    private final DatasetEngine engine;
    private final DatasetLayout layout;
    private final PointingIdMapping mapping;
    private final boolean includeCalibrators;
    private final boolean deepClean;
    private final Logger log;

    public PartitionMerger(DatasetEngine engine, DatasetLayout layout, PointingIdMapping mapping,
                           boolean includeCalibrators, boolean deepClean) {
        this(engine, layout, mapping, includeCalibrators, deepClean, LoggerFactory.getLogger(PartitionMerger.class));
    }

    public PartitionMerger(DatasetEngine engine, DatasetLayout layout, PointingIdMapping mapping,
                           boolean includeCalibrators, boolean deepClean, Logger log) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.includeCalibrators = includeCalibrators;
        this.deepClean = deepClean;
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Input paths in concatenation order: per-id datasets by ascending id, then calibrators.
     */
    public List<Path> expectedInputs() {
        List<Path> inputs = new ArrayList<>(mapping.size() + 1);
        for (int id : mapping.ids()) {
            inputs.add(layout.pointingPath(id));
        }
        if (includeCalibrators) {
            inputs.add(layout.calibratorPath());
        }
        return inputs;
    }

    /**
     * Runs the concatenation.
     *
     * @return merged dataset path.
     * @throws OtfPipelineException {@code INCOMPLETE_INPUT} when an input is missing,
     *                              {@code ENGINE_FAILURE} when the concatenation fails.
     */
    public Path merge() {
        List<DatasetHandle> inputs = new ArrayList<>();
        for (int id : mapping.ids()) {
            inputs.add(requireInput(layout.pointingPath(id), "pointing " + id));
        }
        if (includeCalibrators) {
            inputs.add(requireInput(layout.calibratorPath(), "calibrators"));
        }

        Path destination = layout.mergedPath();
        if (engine.exists(destination)) {
            log.info("Merged output {} exists, deleting it before the merge", destination);
            engine.delete(destination);
        }

        log.info("Merging {} datasets into {}", inputs.size(), destination);
        EngineResult result = engine.concat(new ConcatRequest(inputs, destination));
        if (!result.isSuccess()) {
            throw new OtfPipelineException(OtfPipelineException.ENGINE_FAILURE,
                    "Merge into " + destination + " failed with exit status " + result.exitCode()
                            + ": " + result.diagnostics().strip());
        }

        if (deepClean) {
            for (DatasetHandle input : inputs) {
                engine.delete(input.path());
            }
            log.info("Deep clean removed {} merged inputs", inputs.size());
        }
        return destination;
    }

    /**
     * Lists the per-id datasets named in {@code nameList} when merging is skipped.
     *
     * @throws OtfPipelineException {@code INCOMPLETE_INPUT} when a listed dataset is missing.
     */
    public List<Path> standaloneOutputs(PointingNameList nameList) {
        List<Path> outputs = new ArrayList<>(nameList.size());
        for (int id : nameList.names().keySet()) {
            Path path = layout.pointingPath(id);
            if (!engine.exists(path)) {
                throw new OtfPipelineException(OtfPipelineException.INCOMPLETE_INPUT,
                        "Dataset of pointing " + id + " (" + nameList.nameOf(id) + ") missing: " + path);
            }
            outputs.add(path);
        }
        return outputs;
    }

    private DatasetHandle requireInput(Path path, String label) {
        if (!engine.exists(path)) {
            throw new OtfPipelineException(OtfPipelineException.INCOMPLETE_INPUT,
                    "Merge input of " + label + " missing: " + path);
        }
        return engine.open(path);
    }
}
