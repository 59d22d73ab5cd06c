package org.Arcane.otf.dataset;

import java.util.List;

/**
 * Runs an external command to completion.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Runs {@code command} and blocks until it exits.
     *
     * @param command program and arguments.
     * @return exit status and captured output.
     */
    EngineResult run(List<String> command);
}
