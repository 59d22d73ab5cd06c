package org.Arcane.otf.pointing;

import com.google.flatbuffers.FlexBuffers;
import org.Arcane.core.time.TimeUtils;
import org.Arcane.otf.OtfPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Reads a reference-pointing record store.
 *
 * <p>The store is a FlexBuffers map holding three numeric vectors: {@code time}
 * in Unix seconds and two caller-named coordinate vectors (by default
 * {@code ra} and {@code dec}).</p>
 */
public final class ReferencePointingLoader {

    private final Logger log;
    private final Clock clock;
    private final String coordAKey;
    private final String coordBKey;

    public ReferencePointingLoader() {
        this(LoggerFactory.getLogger(ReferencePointingLoader.class), Clock.systemUTC(),
                ReferencePointingSeries.DEFAULT_COORD_A_KEY, ReferencePointingSeries.DEFAULT_COORD_B_KEY);
    }

    /**
     * @param log logger receiving advisory warnings.
     * @param clock clock used by the soft epoch check.
     * @param coordAKey key of the first coordinate vector.
     * @param coordBKey key of the second coordinate vector.
     */
    public ReferencePointingLoader(Logger log, Clock clock, String coordAKey, String coordBKey) {
        this.log = Objects.requireNonNull(log, "log");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.coordAKey = Objects.requireNonNull(coordAKey, "coordAKey");
        this.coordBKey = Objects.requireNonNull(coordBKey, "coordBKey");
    }

    /**
     * Loads the store at {@code path}.
     *
     * @param path store location.
     * @return parsed series.
     * @throws OtfPipelineException {@code MISSING_FILE} when absent, {@code FORMAT} when malformed.
     */
    public ReferencePointingSeries load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE,
                    "Reference pointing file not found: " + path);
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE,
                    "Reference pointing file cannot be read: " + path, ex);
        }
        if (bytes.length == 0) {
            throw new OtfPipelineException(OtfPipelineException.FORMAT,
                    "Reference pointing file is empty: " + path);
        }

        FlexBuffers.Map root;
        try {
            FlexBuffers.Reference reference = FlexBuffers.getRoot(ByteBuffer.wrap(bytes));
            if (!reference.isMap()) {
                throw new OtfPipelineException(OtfPipelineException.FORMAT,
                        "Reference pointing root is not a keyed map: " + path);
            }
            root = reference.asMap();
        } catch (RuntimeException ex) {
            if (ex instanceof OtfPipelineException) {
                throw ex;
            }
            throw new OtfPipelineException(OtfPipelineException.FORMAT,
                    "Reference pointing file is not a valid record store: " + path, ex);
        }

        double[] times = readVector(root, ReferencePointingSeries.DEFAULT_TIME_KEY, path);
        double[] coordA = readVector(root, coordAKey, path);
        double[] coordB = readVector(root, coordBKey, path);

        if (times.length != coordA.length || times.length != coordB.length) {
            throw new OtfPipelineException(OtfPipelineException.FORMAT,
                    "Reference pointing arrays have unequal length in " + path + ": "
                            + ReferencePointingSeries.DEFAULT_TIME_KEY + "=" + times.length + ", "
                            + coordAKey + "=" + coordA.length + ", " + coordBKey + "=" + coordB.length);
        }

        if (times.length > 0 && !TimeUtils.isPlausibleUnixTime(times[0], clock)) {
            log.warn("Reference pointing times in {} do not look like Unix epoch seconds (first value {})",
                    path, times[0]);
        }

        if (!TimeUtils.isNonDecreasing(times)) {
            log.warn("Reference pointing times in {} are not in ascending order", path);
        }

        log.info("Loaded {} reference pointing samples from {}", times.length, path);
        return new ReferencePointingSeries(times, coordA, coordB);
    }

    private static double[] readVector(FlexBuffers.Map root, String key, Path path) {
        FlexBuffers.Reference reference = root.get(key);
        if (reference == null || reference.isNull()) {
            throw new OtfPipelineException(OtfPipelineException.FORMAT,
                    "Reference pointing array '" + key + "' missing in " + path);
        }
        if (reference.isMap() || !(reference.isVector() || reference.isTypedVector())) {
            throw new OtfPipelineException(OtfPipelineException.FORMAT,
                    "Reference pointing entry '" + key + "' is not an array in " + path);
        }
        FlexBuffers.Vector vector = reference.asVector();
        int size = vector.size();
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            FlexBuffers.Reference element = vector.get(i);
            if (!element.isNumeric()) {
                throw new OtfPipelineException(OtfPipelineException.FORMAT,
                        "Reference pointing array '" + key + "' holds a non-numeric value at index " + i
                                + " in " + path);
            }
            double value = element.asFloat();
            if (!Double.isFinite(value)) {
                throw new OtfPipelineException(OtfPipelineException.FORMAT,
                        "Reference pointing array '" + key + "' holds a non-finite value (" + value
                                + ") at index " + i + " in " + path);
            }
            values[i] = value;
        }
        return values;
    }
}
