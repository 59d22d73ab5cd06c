package org.Arcane.otf.dataset;

import java.nio.file.Path;
import java.util.List;

/**
 * Bridge to the external engine operating on columnar interferometric datasets.
 *
 * <p>Read operations return data or throw {@link org.Arcane.otf.OtfPipelineException};
 * write operations are blocking and report an {@link EngineResult} instead of throwing
 * on engine-side failures.</p>
 */
public interface DatasetEngine {

    /**
     * Opens an existing dataset.
     *
     * @param path dataset location.
     * @return opened handle.
     * @throws org.Arcane.otf.OtfPipelineException {@code MISSING_FILE} when the dataset does not exist.
     */
    DatasetHandle open(Path path);

    boolean exists(Path path);

    /**
     * Recursively deletes a dataset or file; a missing path is a no-op.
     */
    void delete(Path path);

    /**
     * Returns the {@code NAME} column of the field catalog, indexed by row id.
     */
    List<String> fieldCatalog(DatasetHandle dataset);

    /**
     * Returns the number of rows of a catalog subtable.
     */
    int catalogRowCount(DatasetHandle dataset, CatalogTable table);

    /**
     * Returns raw {@code TIME} values (dataset-native epoch) for the query.
     */
    double[] queryTimes(DatasetHandle dataset, TimeQuery query);

    /**
     * Returns the distinct scan numbers observed for the given field rows on one baseline,
     * in ascending order.
     */
    int[] scanNumbers(DatasetHandle dataset, List<Integer> fieldIds, Baseline baseline);

    EngineResult split(SplitRequest request);

    EngineResult rename(RenameRequest request);

    EngineResult concat(ConcatRequest request);
}
