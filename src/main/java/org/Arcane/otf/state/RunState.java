package org.Arcane.otf.state;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.Arcane.core.id.PointingIdMapping;
import org.Arcane.otf.config.PipelineConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted pipeline run state: the configuration and the pointing-id mapping.
 *
 * <p>Written once by initialisation and read by every later stage.</p>
 */
@Value
public class RunState {
    PipelineConfig config;
    /** Persisted mapping {@code "id" -> matched time}, ordered by id. */
    Map<String, Double> pointingIdMapping;

    @Builder
    @Jacksonized
    private RunState(PipelineConfig config, Map<String, Double> pointingIdMapping) {
        this.config = Objects.requireNonNull(config, "config");
        this.pointingIdMapping = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(pointingIdMapping, "pointingIdMapping")));
        PointingIdMapping.fromStringKeyed(this.pointingIdMapping);
    }

    public static RunState of(PipelineConfig config, PointingIdMapping mapping) {
        return new RunState(config, mapping.toStringKeyedMap());
    }

    /**
     * Rebuilds the immutable id mapping.
     */
    public PointingIdMapping mapping() {
        return PointingIdMapping.fromStringKeyed(pointingIdMapping);
    }
}
