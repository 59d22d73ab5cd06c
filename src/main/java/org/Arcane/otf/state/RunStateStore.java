package org.Arcane.otf.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.Arcane.otf.OtfPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * JSON persistence of {@link RunState}.
 */
public final class RunStateStore {

    private final ObjectMapper mapper;
    private final Logger log;

    public RunStateStore() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT), LoggerFactory.getLogger(RunStateStore.class));
    }

    public RunStateStore(ObjectMapper mapper, Logger log) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Writes {@code state} to {@code path}.
     *
     * @param overwrite replace an existing state file.
     * @throws OtfPipelineException {@code STATE_EXISTS} when the file exists and {@code overwrite} is false.
     */
    public void write(Path path, RunState state, boolean overwrite) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(state, "state");
        if (Files.exists(path) && !overwrite) {
            throw new OtfPipelineException(OtfPipelineException.STATE_EXISTS,
                    "Run state already exists: " + path + " (request overwrite to replace it)");
        }
        Path absolute = path.toAbsolutePath();
        Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
            mapper.writeValue(temp.toFile(), state);
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new OtfPipelineException(OtfPipelineException.FORMAT, "Cannot write run state " + path, ex);
        }
        log.info("Wrote run state with {} pointing ids to {}", state.getPointingIdMapping().size(), path);
    }

    /**
     * Reads the state at {@code path}.
     *
     * @throws OtfPipelineException {@code MISSING_FILE} when absent, {@code FORMAT} when malformed.
     */
    public RunState read(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE, "Run state not found: " + path);
        }
        try {
            return mapper.readValue(path.toFile(), RunState.class);
        } catch (IOException ex) {
            throw new OtfPipelineException(OtfPipelineException.FORMAT, "Run state is malformed: " + path, ex);
        }
    }
}
