package org.Arcane.app;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Arcane.otf.OtfPipelineException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed command line: {@code <stage> [options]}, one JCommander command per stage.
 */
@Getter
@Accessors(fluent = true)
final class CliArguments {
    static final String PROGRAM_NAME = "arcane-otfms";

    /** Options shared by every stage. */
    static class StateCommand {
        @Parameter(names = "-c", description = "Run state JSON file", required = true)
        String statePath;
    }

    @Parameters(commandDescription = "Cross-match the reference pointing and write the run state")
    static final class InitCommand extends StateCommand {
        @Parameter(names = "-p", description = "Pipeline configuration (.properties)", required = true)
        String configPath;

        @Parameter(names = "--overwrite", description = "Replace an existing run state")
        boolean overwrite;
    }

    @Parameters(commandDescription = "Runs a stage for one pointing id")
    static final class PointingCommand extends StateCommand {
        @Parameter(names = "-i", description = "Pointing id", required = true)
        Integer pointingId;
    }

    @Parameters(commandDescription = "Write the pointing id and name list")
    static final class NameListCommand extends StateCommand {
        @Parameter(names = "-o", description = "Name list output file", required = true)
        String outputPath;
    }

    @Parameters(commandDescription = "Merge the per-id datasets, or list them when merging is skipped")
    static final class MergeCommand extends StateCommand {
        @Parameter(names = "-n", description = "Name list file, required when merging is skipped")
        String nameListPath;
    }

    @Parameters(commandDescription = "Split the calibrator fields")
    static final class CalibratorCommand extends StateCommand {
    }

    @Parameters(commandDescription = "Run every stage, then merge")
    static final class RunCommand extends StateCommand {
    }

    private final String stage;
    private final StateCommand command;

    private CliArguments(String stage, StateCommand command) {
        this.stage = stage;
        this.command = command;
    }

    static Map<String, StateCommand> commands() {
        Map<String, StateCommand> commands = new LinkedHashMap<>();
        commands.put("init", new InitCommand());
        commands.put("split", new PointingCommand());
        commands.put("split-calibrators", new CalibratorCommand());
        commands.put("rename", new PointingCommand());
        commands.put("list-names", new NameListCommand());
        commands.put("direction", new PointingCommand());
        commands.put("merge", new MergeCommand());
        commands.put("run", new RunCommand());
        return commands;
    }

    /**
     * @throws OtfPipelineException {@code CONFIG} carrying the usage text for any invalid command line.
     */
    static CliArguments parse(String[] args) {
        Objects.requireNonNull(args, "args");
        Map<String, StateCommand> commands = commands();
        JCommander jc = new JCommander();
        jc.setProgramName(PROGRAM_NAME);
        for (Map.Entry<String, StateCommand> entry : commands.entrySet()) {
            jc.addCommand(entry.getKey(), entry.getValue());
        }

        try {
            jc.parse(args);
        } catch (ParameterException ex) {
            throw usage(jc, ex.getMessage(), ex);
        }
        String stage = jc.getParsedCommand();
        if (stage == null) {
            throw usage(jc, "missing stage", null);
        }
        return new CliArguments(stage, commands.get(stage));
    }

    Path statePath() {
        return Path.of(command.statePath);
    }

    InitCommand init() {
        return (InitCommand) command;
    }

    int pointingId() {
        return ((PointingCommand) command).pointingId;
    }

    Path nameListOutput() {
        return Path.of(((NameListCommand) command).outputPath);
    }

    MergeCommand merge() {
        return (MergeCommand) command;
    }

    private static OtfPipelineException usage(JCommander jc, String reason, Throwable cause) {
        StringBuilder text = new StringBuilder();
        jc.getUsageFormatter().usage(text);
        return new OtfPipelineException(OtfPipelineException.CONFIG,
                "Invalid command line: " + reason + System.lineSeparator() + text, cause);
    }
}
