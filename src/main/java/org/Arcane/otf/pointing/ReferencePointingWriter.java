package org.Arcane.otf.pointing;

import com.google.flatbuffers.FlexBuffersBuilder;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * FlexBuffers serializer for reference-pointing record stores.
 */
@UtilityClass
public final class ReferencePointingWriter {

    /**
     * Serializes the series into a FlexBuffers map keyed {@code time}, {@code ra}, {@code dec}.
     */
    public static ByteBuffer encode(ReferencePointingSeries series) {
        return encode(series, ReferencePointingSeries.DEFAULT_COORD_A_KEY, ReferencePointingSeries.DEFAULT_COORD_B_KEY);
    }

    /**
     * Serializes the series with caller-named coordinate keys.
     */
    public static ByteBuffer encode(ReferencePointingSeries series, String coordAKey, String coordBKey) {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(coordAKey, "coordAKey");
        Objects.requireNonNull(coordBKey, "coordBKey");

        double[] times = series.time().toArray();
        FlexBuffersBuilder builder = new FlexBuffersBuilder();
        int map = builder.startMap();
        putVector(builder, ReferencePointingSeries.DEFAULT_TIME_KEY, times);
        putVector(builder, coordAKey, series.coordA());
        putVector(builder, coordBKey, series.coordB());
        builder.endMap(null, map);
        return builder.finish();
    }

    /**
     * Writes the encoded series to {@code path}, replacing an existing file.
     */
    public static void write(Path path, ReferencePointingSeries series) throws IOException {
        Objects.requireNonNull(path, "path");
        ByteBuffer buffer = encode(series);
        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }
    }

    private static void putVector(FlexBuffersBuilder builder, String key, double[] values) {
        int vector = builder.startVector();
        for (double value : values) {
            builder.putFloat(value);
        }
        builder.endVector(key, vector, true, false);
    }
}
