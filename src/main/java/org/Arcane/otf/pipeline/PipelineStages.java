package org.Arcane.otf.pipeline;

import org.Arcane.core.id.PointingIdMapping;
import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.config.PipelineConfig;
import org.Arcane.otf.dataset.DatasetEngine;
import org.Arcane.otf.match.NearestPointingLookup;
import org.Arcane.otf.merge.PartitionMerger;
import org.Arcane.otf.partition.DatasetLayout;
import org.Arcane.otf.partition.PartitionExecutor;
import org.Arcane.otf.partition.PartitionPlanner;
import org.Arcane.otf.partition.StageOutcome;
import org.Arcane.otf.pointing.PointingRecord;
import org.Arcane.otf.pointing.ReferencePointingLoader;
import org.Arcane.otf.rename.PointingNameList;
import org.Arcane.otf.rename.PointingNamer;
import org.Arcane.otf.rename.PointingRenamer;
import org.Arcane.otf.state.RunState;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-id stage operations bound to one run state.
 *
 * <p>The reference series and the source dataset are opened on first use, so a stage
 * only touches the inputs it needs. Instances are safe to share between worker threads.</p>
 */
public final class PipelineStages {

    private final RunState state;
    private final PipelineConfig config;
    private final PointingIdMapping mapping;
    private final DatasetEngine engine;
    private final ReferencePointingLoader loader;
    private final DatasetLayout layout;
    private final PartitionPlanner planner;

    private PartitionExecutor executor;
    private PointingRenamer renamer;

    PipelineStages(RunState state, DatasetEngine engine, ReferencePointingLoader loader) {
        this.state = Objects.requireNonNull(state, "state");
        this.config = state.getConfig();
        this.mapping = state.mapping();
        this.engine = Objects.requireNonNull(engine, "engine");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.layout = config.layout();
        this.planner = new PartitionPlanner(mapping, config.getSplitTimedelta());
    }

    public RunState state() {
        return state;
    }

    public PointingIdMapping mapping() {
        return mapping;
    }

    public DatasetLayout layout() {
        return layout;
    }

    public PartitionPlanner planner() {
        return planner;
    }

    public StageOutcome splitPointing(int id) {
        return executor().splitPointing(planner.plan(id));
    }

    public StageOutcome splitCalibrators() {
        if (!config.isSplitCalibrators()) {
            throw new OtfPipelineException(OtfPipelineException.CONFIG,
                    "Calibrator split requested but 'splitCalibrators' is not set");
        }
        return executor().splitCalibrators();
    }

    public StageOutcome renamePointing(int id) {
        requireMapped(id);
        return renamer().rename(id);
    }

    /**
     * Resolves the reference record of {@code id}.
     */
    public PointingRecord resolve(int id) {
        requireMapped(id);
        return renamer().lookup().resolve(id);
    }

    public String directionString(int id) {
        PointingRecord record = resolve(id);
        return PointingNamer.directionString(record.coordA(), record.coordB());
    }

    /**
     * Names every mapped pointing, ascending id order.
     */
    public PointingNameList nameList() {
        Map<Integer, String> names = new LinkedHashMap<>();
        for (int id : mapping.ids()) {
            names.put(id, renamer().nameOf(id));
        }
        return new PointingNameList(names);
    }

    public Path merge() {
        if (config.isSkipMerge()) {
            throw new OtfPipelineException(OtfPipelineException.CONFIG,
                    "Merging is disabled for this run (skipMerge is set)");
        }
        return merger().merge();
    }

    public List<Path> standaloneOutputs(PointingNameList nameList) {
        return merger().standaloneOutputs(nameList);
    }

    public PartitionMerger merger() {
        return new PartitionMerger(engine, layout, mapping,
                config.isSplitCalibrators(), config.isDeepClean());
    }

    private void requireMapped(int id) {
        if (!mapping.containsId(id)) {
            throw new OtfPipelineException(OtfPipelineException.UNKNOWN_POINTING_ID,
                    "Pointing id " + id + " is not in the run state (size " + mapping.size() + ")");
        }
    }

    private synchronized PartitionExecutor executor() {
        if (executor == null) {
            executor = new PartitionExecutor(engine, engine.open(Path.of(config.getDatasetPath())), layout,
                    config.getTargetFields(), config.getCalibratorFields());
        }
        return executor;
    }

    private synchronized PointingRenamer renamer() {
        if (renamer == null) {
            NearestPointingLookup lookup = new NearestPointingLookup(
                    loader.load(Path.of(config.getPointingReferencePath())), mapping, config.getCrossmatchThreshold());
            renamer = new PointingRenamer(engine, layout, lookup, config.getAcronym(),
                    config.isRenameSource(), config.isRenamePointing(), config.isStrictCatalogRows());
        }
        return renamer;
    }
}
