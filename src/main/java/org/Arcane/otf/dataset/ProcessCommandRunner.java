package org.Arcane.otf.dataset;

import org.Arcane.otf.OtfPipelineException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}, merging stderr into stdout.
 */
public final class ProcessCommandRunner implements CommandRunner {
    static final int LAUNCH_FAILURE_EXIT_CODE = 127;

    @Override
    public EngineResult run(List<String> command) {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            return EngineResult.failure(LAUNCH_FAILURE_EXIT_CODE,
                    "Cannot start " + command.get(0) + ": " + ex.getMessage());
        }

        String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            process.destroyForcibly();
            return EngineResult.failure(LAUNCH_FAILURE_EXIT_CODE,
                    "Cannot read output of " + command.get(0) + ": " + ex.getMessage());
        }

        try {
            int exitCode = process.waitFor();
            return new EngineResult(exitCode, output);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new OtfPipelineException(OtfPipelineException.ENGINE_FAILURE,
                    "Interrupted while waiting for " + command, ex);
        }
    }
}
