package org.Arcane.otf.pipeline;

import org.Arcane.core.id.PointingIdMapping;
import org.Arcane.core.time.TimeSeries;
import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.config.PipelineConfig;
import org.Arcane.otf.dataset.DatasetEngine;
import org.Arcane.otf.dataset.DatasetHandle;
import org.Arcane.otf.dataset.DatasetTimeExtractor;
import org.Arcane.otf.match.CrossMatchResult;
import org.Arcane.otf.match.TemporalCrossMatcher;
import org.Arcane.otf.partition.StageOutcome;
import org.Arcane.otf.partition.StageState;
import org.Arcane.otf.pointing.ReferencePointingLoader;
import org.Arcane.otf.pointing.ReferencePointingSeries;
import org.Arcane.otf.rename.PointingNameList;
import org.Arcane.otf.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives initialisation and the split, rename and merge lifecycle of one OTF run.
 *
 * <p>Split and rename of distinct pointing ids, and the calibrator split, run
 * concurrently on a fixed pool. Merge is a barrier that starts only when every
 * stage is {@code COMPLETE}. Stage failures are captured in the returned
 * {@link PipelineRunReport} so that {@link #resume} can rerun only what is missing.</p>
 */
public final class OtfPipeline {

    private final DatasetEngine engine;
    private final ReferencePointingLoader loader;
    private final DatasetTimeExtractor extractor;
    private final TemporalCrossMatcher matcher;
    private final Logger log;

    public OtfPipeline(DatasetEngine engine) {
        this(engine, new ReferencePointingLoader(), new DatasetTimeExtractor(engine), new TemporalCrossMatcher(),
                LoggerFactory.getLogger(OtfPipeline.class));
    }

    public OtfPipeline(DatasetEngine engine, ReferencePointingLoader loader, DatasetTimeExtractor extractor,
                       TemporalCrossMatcher matcher, Logger log) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Cross-matches the reference pointing against the dataset and builds the run state.
     *
     * @throws OtfPipelineException {@code NO_POINTINGS_SELECTED} when nothing matched, or any
     *                              loader, extractor or matcher failure.
     */
    public RunState initialize(PipelineConfig config) {
        Objects.requireNonNull(config, "config").validate();
        ReferencePointingSeries series = loader.load(Path.of(config.getPointingReferencePath()));
        DatasetHandle dataset = engine.open(Path.of(config.getDatasetPath()));
        TimeSeries datasetTimes = extractor.extractTimes(dataset, config.selection());

        CrossMatchResult result = matcher.match(series.time(), datasetTimes, config.getCrossmatchThreshold());
        if (result.isEmpty()) {
            throw new OtfPipelineException(OtfPipelineException.NO_POINTINGS_SELECTED,
                    "No reference pointing matched a dataset time of " + dataset + " within "
                            + config.getCrossmatchThreshold() + " (fields " + config.getTargetFields() + ")");
        }
        PointingIdMapping mapping = result.toPointingIdMapping();
        log.info("Selected {} OTF pointings from {}", mapping.size(), dataset);
        return RunState.of(config, mapping);
    }

    /**
     * Binds the per-id stage operations to {@code state}.
     */
    public PipelineStages stages(RunState state) {
        return new PipelineStages(state, engine, loader);
    }

    public StageOutcome splitPointing(RunState state, int id) {
        return stages(state).splitPointing(id);
    }

    public StageOutcome renamePointing(RunState state, int id) {
        return stages(state).renamePointing(id);
    }

    public StageOutcome splitCalibrators(RunState state) {
        return stages(state).splitCalibrators();
    }

    public PointingNameList writeNameList(RunState state, Path path, Clock clock) {
        PointingNameList names = stages(state).nameList();
        try {
            names.write(path, clock);
        } catch (IOException ex) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE, "Cannot write name list " + path, ex);
        }
        log.info("Wrote {} pointing names to {}", names.size(), path);
        return names;
    }

    public Path merge(RunState state) {
        return stages(state).merge();
    }

    /**
     * Runs every stage of the run state, then merges.
     */
    public PipelineRunReport run(RunState state) {
        PipelineStages stages = stages(state);
        List<Integer> ids = new ArrayList<>();
        for (int id : stages.mapping().ids()) {
            ids.add(id);
        }
        return execute(stages, ids, state.getConfig().isSplitCalibrators(), Map.of(), null);
    }

    /**
     * Reruns the pointing ids (and the calibrator split) that {@code previous} did not complete,
     * then merges.
     */
    public PipelineRunReport resume(RunState state, PipelineRunReport previous) {
        Objects.requireNonNull(previous, "previous");
        PipelineStages stages = stages(state);
        List<Integer> ids = new ArrayList<>();
        for (int id : stages.mapping().ids()) {
            StageOutcome outcome = previous.pointingOutcomes().get(id);
            if (outcome == null || !outcome.isComplete()) {
                ids.add(id);
            }
        }
        boolean calibrators = state.getConfig().isSplitCalibrators()
                && (previous.calibratorOutcome() == null || !previous.calibratorOutcome().isComplete());
        log.info("Resuming {} pointing ids{}", ids.size(), calibrators ? " and the calibrator split" : "");
        return execute(stages, ids, calibrators, previous.pointingOutcomes(),
                state.getConfig().isSplitCalibrators() && !calibrators ? previous.calibratorOutcome() : null);
    }

    private PipelineRunReport execute(PipelineStages stages, List<Integer> ids, boolean calibrators,
                                      Map<Integer, StageOutcome> carried, StageOutcome carriedCalibrators) {
        PipelineConfig config = stages.state().getConfig();
        Map<Integer, StageOutcome> outcomes = new ConcurrentHashMap<>(carried);
        for (int id : ids) {
            outcomes.put(id, StageOutcome.planned(id, stages.layout().pointingPath(id)));
        }
        ConcurrentHashMap<Integer, StageOutcome> calibratorSlot = new ConcurrentHashMap<>();
        if (carriedCalibrators != null) {
            calibratorSlot.put(StageOutcome.CALIBRATORS, carriedCalibrators);
        } else if (calibrators) {
            calibratorSlot.put(StageOutcome.CALIBRATORS,
                    StageOutcome.planned(StageOutcome.CALIBRATORS, stages.layout().calibratorPath()));
        }

        AtomicBoolean failed = new AtomicBoolean(false);
        int tasks = ids.size() + (calibrators ? 1 : 0);
        if (tasks > 0) {
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.getParallelism(), tasks),
                    workerThreads());
            List<Future<?>> futures = new ArrayList<>(tasks);
            try {
                if (calibrators) {
                    futures.add(pool.submit(() -> runCalibrators(stages, calibratorSlot, failed, config)));
                }
                for (int id : ids) {
                    futures.add(pool.submit(() -> runPointing(stages, id, outcomes, failed, config)));
                }
                awaitAll(futures);
            } finally {
                pool.shutdownNow();
            }
        }

        StageOutcome calibratorOutcome = calibratorSlot.get(StageOutcome.CALIBRATORS);
        PipelineRunReport pending = new PipelineRunReport(outcomes, calibratorOutcome, List.of());
        if (!pending.incompleteIds().isEmpty() || !pending.calibratorsComplete()) {
            log.error("Not merging: failed ids {}, incomplete ids {}, calibrators {}",
                    pending.failedIds(), pending.incompleteIds(),
                    calibratorOutcome == null ? "n/a" : calibratorOutcome.state());
            return pending;
        }

        List<Path> outputs;
        if (config.isSkipMerge()) {
            outputs = stages.standaloneOutputs(stages.nameList());
            log.info("Merge skipped, {} standalone pointing datasets", outputs.size());
        } else {
            outputs = List.of(stages.merge());
        }
        return new PipelineRunReport(outcomes, calibratorOutcome, outputs);
    }

    private void runPointing(PipelineStages stages, int id, Map<Integer, StageOutcome> outcomes,
                             AtomicBoolean failed, PipelineConfig config) {
        if (config.isCancelOnFailure() && failed.get()) {
            log.info("Pointing {} cancelled after an earlier failure", id);
            return;
        }
        StageOutcome outcome;
        try {
            outcome = stages.splitPointing(id);
            if (outcome.isComplete()) {
                if (config.isCancelOnFailure() && failed.get()) {
                    log.info("Rename of pointing {} cancelled after an earlier failure", id);
                    return;
                }
                outcome = stages.renamePointing(id);
            }
        } catch (RuntimeException ex) {
            log.error("Pointing {} failed: {}", id, ex.getMessage(), ex);
            outcome = new StageOutcome(id, StageState.FAILED, stages.layout().pointingPath(id), ex.getMessage());
        }
        outcomes.put(id, outcome);
        if (!outcome.isComplete()) {
            failed.set(true);
        }
    }

    private void runCalibrators(PipelineStages stages, Map<Integer, StageOutcome> slot, AtomicBoolean failed,
                                PipelineConfig config) {
        if (config.isCancelOnFailure() && failed.get()) {
            log.info("Calibrator split cancelled after an earlier failure");
            return;
        }
        StageOutcome outcome;
        try {
            outcome = stages.splitCalibrators();
        } catch (RuntimeException ex) {
            log.error("Calibrator split failed: {}", ex.getMessage(), ex);
            outcome = new StageOutcome(StageOutcome.CALIBRATORS, StageState.FAILED,
                    stages.layout().calibratorPath(), ex.getMessage());
        }
        slot.put(StageOutcome.CALIBRATORS, outcome);
        if (!outcome.isComplete()) {
            failed.set(true);
        }
    }

    private void awaitAll(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (CancellationException ex) {
                log.debug("Stage task cancelled before completion");
            } catch (ExecutionException ex) {
                throw new OtfPipelineException(OtfPipelineException.ENGINE_FAILURE,
                        "Stage task failed unexpectedly: " + ex.getCause(), ex.getCause());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new OtfPipelineException(OtfPipelineException.ENGINE_FAILURE,
                        "Interrupted while waiting for pipeline stages", ex);
            }
        }
    }

    private ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "otf-stage-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Uncaught exception in worker thread {}: {}", t.getName(), e.getMessage(), e));
            return thread;
        };
    }
}
