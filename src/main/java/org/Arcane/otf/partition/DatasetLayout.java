package org.Arcane.otf.partition;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.Arcane.otf.OtfPipelineException;

import java.nio.file.Path;

/**
 * Output locations of per-id, calibrator and merged datasets.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class DatasetLayout {
    public static final String CALIBRATOR_DATASET_NAME = "calibrators.ms";

    /** Directory holding per-id and calibrator datasets. */
    private final Path blobDir;
    /** Directory receiving the merged dataset. */
    private final Path outputDir;
    /** File name of the merged dataset; {@code null} when the run skips merging. */
    private final String mergedName;

    public Path pointingPath(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("Pointing id must be >= 0, got " + id);
        }
        return blobDir.resolve(pointingDatasetName(id));
    }

    public Path calibratorPath() {
        return blobDir.resolve(CALIBRATOR_DATASET_NAME);
    }

    /**
     * @throws OtfPipelineException {@code CONFIG} when the layout has no merged dataset name.
     */
    public Path mergedPath() {
        if (mergedName == null) {
            throw new OtfPipelineException(OtfPipelineException.CONFIG,
                    "Merging is disabled for this run: no merged dataset name is configured");
        }
        return outputDir.resolve(mergedName);
    }

    public static String pointingDatasetName(int id) {
        return "otf_pointing_no_" + id + ".ms";
    }
}
