package org.Arcane.otf.partition;

import org.Arcane.core.time.TimeRange;
import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.dataset.DatasetEngine;
import org.Arcane.otf.dataset.DatasetHandle;
import org.Arcane.otf.dataset.EngineResult;
import org.Arcane.otf.dataset.SplitRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Issues split requests for one pointing window or for the calibrator fields.
 *
 * <p>Each call owns its output path exclusively: a pre-existing output is deleted
 * before the request, and a failed request leaves no partial output behind.
 * Splits keep every baseline of the selected fields.</p>
 */
public final class PartitionExecutor {

    private final DatasetEngine engine;
    private final DatasetHandle source;
    private final DatasetLayout layout;
    private final List<String> targetFields;
    private final List<String> calibratorFields;
    private final Logger log;

    public PartitionExecutor(DatasetEngine engine, DatasetHandle source, DatasetLayout layout,
                             List<String> targetFields, List<String> calibratorFields) {
        this(engine, source, layout, targetFields, calibratorFields, LoggerFactory.getLogger(PartitionExecutor.class));
    }

    public PartitionExecutor(DatasetEngine engine, DatasetHandle source, DatasetLayout layout,
                             List<String> targetFields, List<String> calibratorFields, Logger log) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.source = Objects.requireNonNull(source, "source");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.targetFields = List.copyOf(Objects.requireNonNull(targetFields, "targetFields"));
        this.calibratorFields = calibratorFields == null ? List.of() : List.copyOf(calibratorFields);
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Splits the target fields restricted to {@code window} into the per-id dataset.
     */
    public StageOutcome splitPointing(PartitionWindow window) {
        Objects.requireNonNull(window, "window");
        if (targetFields.isEmpty()) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "No target fields configured for pointing " + window.id());
        }
        return split(window.id(), layout.pointingPath(window.id()), targetFields, window.toTimeRange());
    }

    /**
     * Splits the calibrator fields without any time restriction.
     */
    public StageOutcome splitCalibrators() {
        if (calibratorFields.isEmpty()) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "No calibrator fields configured for the calibrator split");
        }
        return split(StageOutcome.CALIBRATORS, layout.calibratorPath(), calibratorFields, null);
    }

    private StageOutcome split(int id, Path output, List<String> fields, TimeRange timeRange) {
        String label = StageOutcome.planned(id, output).label();
        if (engine.exists(output)) {
            log.info("Output {} of {} exists, deleting it before the split", output, label);
            engine.delete(output);
        }

        SplitRequest request = new SplitRequest(source, output, fields, timeRange, SplitRequest.DEFAULT_DATA_COLUMN);
        log.info("Splitting {} of {} into {} (fields {}, timerange {})",
                label, source, output, fields, timeRange == null ? "all" : timeRange);
        log.debug("{}: {} -> {}", label, StageState.PLANNED, StageState.SELECTION_ISSUED);

        EngineResult result = engine.split(request);
        if (!result.isSuccess()) {
            log.error("Split of {} failed with exit status {}", label, result.exitCode());
            engine.delete(output);
            return new StageOutcome(id, StageState.FAILED, output, result.diagnostics());
        }
        if (!engine.exists(output)) {
            log.error("Split of {} reported success but {} does not exist", label, output);
            return new StageOutcome(id, StageState.FAILED, output,
                    "Split of " + label + " reported success but produced no output at " + output);
        }
        log.info("Split of {} complete: {}", label, output);
        return new StageOutcome(id, StageState.COMPLETE, output, result.diagnostics());
    }
}
