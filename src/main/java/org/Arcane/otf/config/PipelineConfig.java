package org.Arcane.otf.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.Arcane.core.time.TimeRange;
import org.Arcane.core.time.TimeUtils;
import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.dataset.Baseline;
import org.Arcane.otf.dataset.DatasetSelection;
import org.Arcane.otf.dataset.ScriptedDatasetEngine;
import org.Arcane.otf.match.TemporalCrossMatcher;
import org.Arcane.otf.partition.DatasetLayout;
import org.Arcane.otf.partition.PartitionPlanner;
import org.Arcane.otf.rename.PointingNamer;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable pipeline configuration, persisted as part of the run state.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PipelineConfig {
    public static final String DEFAULT_BLOB_DIR_NAME = "otf_pointings";

    /** Source dataset path. */
    String datasetPath;
    /** Reference-pointing record store path. */
    String pointingReferencePath;
    /** Target field names. */
    List<String> targetFields;
    /** Calibrator field names, used when {@link #splitCalibrators} is set. */
    @Builder.Default
    List<String> calibratorFields = List.of();
    @Builder.Default
    boolean splitCalibrators = false;
    /** Scan numbers to select; {@code null} selects every scan. */
    List<Integer> scanIds;
    /** Optional CASA-syntax time range restricting the dataset times. */
    String timerange;
    @Builder.Default
    int antenna1 = Baseline.DEFAULT.ant1();
    @Builder.Default
    int antenna2 = Baseline.DEFAULT.ant2();
    @Builder.Default
    double crossmatchThreshold = TemporalCrossMatcher.DEFAULT_THRESHOLD;
    @Builder.Default
    double splitTimedelta = PartitionPlanner.DEFAULT_SPLIT_TIMEDELTA;
    @Builder.Default
    String acronym = PointingNamer.DEFAULT_ACRONYM;
    /** Working directory; engine scripts are written here. */
    String workingDir;
    /** Directory for per-id and calibrator datasets; defaults to {@code <workingDir>/otf_pointings}. */
    String blobDir;
    /** Directory for the merged dataset; defaults to {@code workingDir}. */
    String outputDir;
    /** File name of the merged dataset; required unless {@link #skipMerge}. */
    String msOutname;
    @Builder.Default
    boolean skipMerge = false;
    @Builder.Default
    boolean deepClean = false;
    @Builder.Default
    boolean renameSource = true;
    @Builder.Default
    boolean renamePointing = true;
    /** Fail on multi-row catalogs when renaming instead of warning. */
    @Builder.Default
    boolean strictCatalogRows = true;
    @Builder.Default
    int parallelism = Runtime.getRuntime().availableProcessors();
    @Builder.Default
    boolean cancelOnFailure = false;
    @Builder.Default
    String casaAlias = ScriptedDatasetEngine.DEFAULT_CASA_ALIAS;

    /**
     * Checks mandatory values and ranges.
     *
     * @throws OtfPipelineException {@code CONFIG} naming the first invalid parameter.
     */
    public PipelineConfig validate() {
        requireText(datasetPath, "datasetPath");
        requireText(pointingReferencePath, "pointingReferencePath");
        requireText(workingDir, "workingDir");
        if (targetFields == null || targetFields.isEmpty()) {
            throw invalid("targetFields", "at least one target field is required");
        }
        if (splitCalibrators && (calibratorFields == null || calibratorFields.isEmpty())) {
            throw invalid("calibratorFields", "required when splitCalibrators is set");
        }
        if (!skipMerge) {
            requireText(msOutname, "msOutname");
        }
        if (scanIds != null && scanIds.isEmpty()) {
            throw invalid("scanIds", "must be absent or non-empty");
        }
        if (antenna1 < 0 || antenna2 < 0 || antenna1 == antenna2) {
            throw invalid("antenna1/antenna2", "must be two distinct non-negative ids, got "
                    + antenna1 + " and " + antenna2);
        }
        if (!Double.isFinite(crossmatchThreshold) || crossmatchThreshold <= 0.0d) {
            throw invalid("crossmatchThreshold", "must be finite and > 0, got " + crossmatchThreshold);
        }
        if (!Double.isFinite(splitTimedelta) || splitTimedelta <= 0.0d) {
            throw invalid("splitTimedelta", "must be finite and > 0, got " + splitTimedelta);
        }
        requireText(acronym, "acronym");
        if (parallelism < 1) {
            throw invalid("parallelism", "must be >= 1, got " + parallelism);
        }
        if (timerange != null) {
            try {
                TimeUtils.parseCasaTimerange(timerange);
            } catch (IllegalArgumentException ex) {
                throw new OtfPipelineException(OtfPipelineException.CONFIG,
                        "Invalid configuration 'timerange': " + ex.getMessage(), ex);
            }
        }
        return this;
    }

    public Baseline baseline() {
        return Baseline.of(antenna1, antenna2);
    }

    public DatasetSelection selection() {
        return DatasetSelection.builder()
                .fieldNames(targetFields)
                .scanIds(scanIds)
                .baseline(baseline())
                .timeRange(timeRange())
                .build();
    }

    public DatasetLayout layout() {
        Path working = Path.of(workingDir);
        Path blob = blobDir == null ? working.resolve(DEFAULT_BLOB_DIR_NAME) : Path.of(blobDir);
        Path output = outputDir == null ? working : Path.of(outputDir);
        return new DatasetLayout(blob, output, msOutname);
    }

    public TimeRange timeRange() {
        return timerange == null ? null : TimeUtils.parseCasaTimerange(timerange);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw invalid(name, "missing mandatory value");
        }
    }

    private static OtfPipelineException invalid(String name, String reason) {
        return new OtfPipelineException(OtfPipelineException.CONFIG,
                "Invalid configuration '" + name + "': " + reason);
    }
}
