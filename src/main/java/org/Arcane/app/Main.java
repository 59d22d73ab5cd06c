package org.Arcane.app;

import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.config.PipelineConfig;
import org.Arcane.otf.config.PipelineConfigLoader;
import org.Arcane.otf.dataset.DatasetEngine;
import org.Arcane.otf.dataset.ScriptedDatasetEngine;
import org.Arcane.otf.partition.StageOutcome;
import org.Arcane.otf.pipeline.OtfPipeline;
import org.Arcane.otf.pipeline.PipelineRunReport;
import org.Arcane.otf.rename.PointingNameList;
import org.Arcane.otf.state.RunState;
import org.Arcane.otf.state.RunStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.function.Function;

/**
 * Command-line entry point; one invocation runs one pipeline stage.
 *
 * <p>Exit status is 0 on success and 1 on failure, with the diagnostic logged.</p>
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    /**
     * Runs the requested stage and exits with its status.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out, Main::scriptedEngine, Clock.systemUTC()));
    }

    /**
     * Runs one stage.
     *
     * @param args command-line arguments.
     * @param out receives stage results (paths, names, direction strings).
     * @param engines builds the dataset engine of a configuration.
     * @param clock clock stamping generated files.
     * @return process exit status.
     */
    static int run(String[] args, PrintStream out, Function<PipelineConfig, DatasetEngine> engines, Clock clock) {
        try {
            return dispatch(CliArguments.parse(args), out, engines, clock);
        } catch (OtfPipelineException ex) {
            log.error("{}", ex.getMessage(), ex);
            return 1;
        }
    }

    private static int dispatch(CliArguments cli, PrintStream out, Function<PipelineConfig, DatasetEngine> engines,
                                Clock clock) {
        RunStateStore store = new RunStateStore();
        if ("init".equals(cli.stage())) {
            CliArguments.InitCommand init = cli.init();
            PipelineConfig config = new PipelineConfigLoader().load(Path.of(init.configPath));
            Path statePath = cli.statePath();
            if (!init.overwrite && Files.exists(statePath)) {
                throw new OtfPipelineException(OtfPipelineException.STATE_EXISTS,
                        "Run state already exists: " + statePath + " (pass --overwrite to replace it)");
            }
            RunState state = new OtfPipeline(engines.apply(config)).initialize(config);
            store.write(statePath, state, init.overwrite);
            out.println(state.getPointingIdMapping().size());
            return 0;
        }

        RunState state = store.read(cli.statePath());
        OtfPipeline pipeline = new OtfPipeline(engines.apply(state.getConfig()));
        switch (cli.stage()) {
            case "split":
                return report(pipeline.splitPointing(state, cli.pointingId()), out);
            case "split-calibrators":
                return report(pipeline.splitCalibrators(state), out);
            case "rename":
                return report(pipeline.renamePointing(state, cli.pointingId()), out);
            case "list-names":
                pipeline.writeNameList(state, cli.nameListOutput(), clock);
                out.println(cli.nameListOutput());
                return 0;
            case "direction":
                out.print(pipeline.stages(state).directionString(cli.pointingId()));
                return 0;
            case "merge":
                return merge(cli.merge(), state, pipeline, out);
            case "run":
                PipelineRunReport report = pipeline.run(state);
                log.info("Run finished: {}", report);
                report.outputs().forEach(out::println);
                return report.isSuccessful() ? 0 : 1;
            default:
                throw new IllegalStateException("No handler for stage " + cli.stage());
        }
    }

    private static int merge(CliArguments.MergeCommand merge, RunState state, OtfPipeline pipeline, PrintStream out) {
        if (!state.getConfig().isSkipMerge()) {
            out.println(pipeline.merge(state));
            return 0;
        }
        if (merge.nameListPath == null) {
            throw new OtfPipelineException(OtfPipelineException.CONFIG,
                    "Merging is skipped for this run; pass the name list with -n to list outputs");
        }
        List<Path> outputs = pipeline.stages(state).standaloneOutputs(PointingNameList.read(Path.of(merge.nameListPath)));
        outputs.forEach(out::println);
        return 0;
    }

    private static int report(StageOutcome outcome, PrintStream out) {
        if (!outcome.isComplete()) {
            log.error("{} {}: {}", outcome.label(), outcome.state(), outcome.diagnostics().strip());
            return 1;
        }
        out.println(outcome.outputPath());
        return 0;
    }

    private static DatasetEngine scriptedEngine(PipelineConfig config) {
        return new ScriptedDatasetEngine(Path.of(config.getWorkingDir()), config.getCasaAlias());
    }
}
