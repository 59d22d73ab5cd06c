package org.Arcane.testutil;

import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.dataset.Baseline;
import org.Arcane.otf.dataset.CatalogTable;
import org.Arcane.otf.dataset.ConcatRequest;
import org.Arcane.otf.dataset.DatasetEngine;
import org.Arcane.otf.dataset.DatasetHandle;
import org.Arcane.otf.dataset.EngineResult;
import org.Arcane.otf.dataset.RenameRequest;
import org.Arcane.otf.dataset.SplitRequest;
import org.Arcane.otf.dataset.TimeQuery;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thread-safe in-memory {@link DatasetEngine} used by the pipeline tests.
 *
 * <p>Datasets are keyed by absolute path. Splits create a dataset whose catalogs hold
 * the requested field names (or a scripted row count), renames overwrite catalog cells,
 * and concat creates a dataset holding the catalog names of its inputs in order.</p>
 */
public final class InMemoryDatasetEngine implements DatasetEngine {

    public record MainRow(int fieldId, int scan, int ant1, int ant2, double time) {
    }

    /**
     * One in-memory dataset: catalog name columns and main table rows.
     */
    public static final class Dataset {
        private final Map<CatalogTable, List<String>> catalogs = new EnumMap<>(CatalogTable.class);
        private final List<MainRow> rows = new ArrayList<>();

        public Dataset row(int fieldId, int scan, int ant1, int ant2, double time) {
            rows.add(new MainRow(fieldId, scan, ant1, ant2, time));
            return this;
        }

        /**
         * Adds one row per time on baseline 0&1 of scan 1.
         */
        public Dataset times(int fieldId, double... times) {
            for (double time : times) {
                row(fieldId, 1, 0, 1, time);
            }
            return this;
        }

        public Dataset catalog(CatalogTable table, List<String> names) {
            catalogs.put(table, new ArrayList<>(names));
            return this;
        }

        public List<String> names(CatalogTable table) {
            return catalogs.getOrDefault(table, List.of());
        }
    }

    private final Map<Path, Dataset> datasets = new HashMap<>();
    private final Set<Path> failingSplits = new HashSet<>();
    private final Set<Path> splitsWithoutOutput = new HashSet<>();
    private final Map<CatalogTable, Integer> splitCatalogRows = new EnumMap<>(CatalogTable.class);
    private boolean failRenames;
    private boolean failConcat;

    private final List<TimeQuery> queries = Collections.synchronizedList(new ArrayList<>());
    private final List<SplitRequest> splits = Collections.synchronizedList(new ArrayList<>());
    private final List<RenameRequest> renames = Collections.synchronizedList(new ArrayList<>());
    private final List<ConcatRequest> concats = Collections.synchronizedList(new ArrayList<>());
    private final List<Path> deleted = Collections.synchronizedList(new ArrayList<>());

    /**
     * Registers a dataset whose FIELD and SOURCE catalogs hold {@code fieldNames}
     * and whose POINTING catalog holds one row.
     */
    public synchronized Dataset addDataset(Path path, List<String> fieldNames) {
        Dataset dataset = new Dataset()
                .catalog(CatalogTable.FIELD, fieldNames)
                .catalog(CatalogTable.SOURCE, fieldNames)
                .catalog(CatalogTable.POINTING, List.of(""));
        datasets.put(key(path), dataset);
        return dataset;
    }

    public synchronized Dataset dataset(Path path) {
        return datasets.get(key(path));
    }

    /** Split into {@code output} fails and leaves a partial dataset behind. */
    public synchronized void failSplitInto(Path output) {
        failingSplits.add(key(output));
    }

    /** Split into {@code output} reports success without creating the dataset. */
    public synchronized void splitWithoutOutput(Path output) {
        splitsWithoutOutput.add(key(output));
    }

    /** Datasets created by split get {@code rows} rows in {@code table}. */
    public synchronized void splitCatalogRows(CatalogTable table, int rows) {
        splitCatalogRows.put(table, rows);
    }

    /** Drops every scripted split, rename and concat failure. */
    public synchronized void clearFailures() {
        failingSplits.clear();
        splitsWithoutOutput.clear();
        failRenames = false;
        failConcat = false;
    }

    public synchronized void failRenames() {
        failRenames = true;
    }

    public synchronized void failConcat() {
        failConcat = true;
    }

    public List<TimeQuery> queries() {
        return snapshot(queries);
    }

    public List<SplitRequest> splits() {
        return snapshot(splits);
    }

    public List<RenameRequest> renames() {
        return snapshot(renames);
    }

    public List<ConcatRequest> concats() {
        return snapshot(concats);
    }

    public List<Path> deleted() {
        return snapshot(deleted);
    }

    @Override
    public synchronized DatasetHandle open(Path path) {
        if (!datasets.containsKey(key(path))) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE, "Dataset not found: " + path);
        }
        return new DatasetHandle(key(path));
    }

    @Override
    public synchronized boolean exists(Path path) {
        return datasets.containsKey(key(path));
    }

    @Override
    public synchronized void delete(Path path) {
        if (datasets.remove(key(path)) != null) {
            deleted.add(key(path));
        }
    }

    @Override
    public synchronized List<String> fieldCatalog(DatasetHandle dataset) {
        return List.copyOf(require(dataset).names(CatalogTable.FIELD));
    }

    @Override
    public synchronized int catalogRowCount(DatasetHandle dataset, CatalogTable table) {
        return require(dataset).names(table).size();
    }

    @Override
    public synchronized double[] queryTimes(DatasetHandle dataset, TimeQuery query) {
        queries.add(query);
        return require(dataset).rows.stream()
                .filter(row -> query.fieldIds().contains(row.fieldId()))
                .filter(row -> query.allScans() || query.scanIds().contains(row.scan()))
                .filter(row -> row.ant1() == query.baseline().ant1() && row.ant2() == query.baseline().ant2())
                .mapToDouble(MainRow::time)
                .toArray();
    }

    @Override
    public synchronized int[] scanNumbers(DatasetHandle dataset, List<Integer> fieldIds, Baseline baseline) {
        TreeSet<Integer> scans = new TreeSet<>();
        for (MainRow row : require(dataset).rows) {
            if (fieldIds.contains(row.fieldId()) && row.ant1() == baseline.ant1() && row.ant2() == baseline.ant2()) {
                scans.add(row.scan());
            }
        }
        return scans.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public synchronized EngineResult split(SplitRequest request) {
        splits.add(request);
        require(request.source());
        Path output = key(request.output());
        if (datasets.containsKey(output)) {
            return EngineResult.failure(1, "output exists: " + output);
        }
        if (failingSplits.contains(output)) {
            datasets.put(output, new Dataset());
            return EngineResult.failure(1, "split failed for " + output);
        }
        if (splitsWithoutOutput.contains(output)) {
            return EngineResult.success("split selected no rows");
        }
        Dataset created = new Dataset();
        for (CatalogTable table : CatalogTable.values()) {
            Integer rows = splitCatalogRows.get(table);
            if (rows != null) {
                created.catalog(table, Collections.nCopies(rows, "row"));
            } else if (table == CatalogTable.POINTING) {
                created.catalog(table, List.of(""));
            } else {
                created.catalog(table, request.fieldNames());
            }
        }
        datasets.put(output, created);
        return EngineResult.success("split ok");
    }

    @Override
    public synchronized EngineResult rename(RenameRequest request) {
        renames.add(request);
        if (failRenames) {
            return EngineResult.failure(2, "rename failed");
        }
        Dataset dataset = datasets.get(key(request.dataset().path()));
        if (dataset == null) {
            return EngineResult.failure(1, "no dataset " + request.dataset());
        }
        List<String> names = new ArrayList<>(dataset.names(request.table()));
        if (request.row() >= names.size()) {
            return EngineResult.failure(1, "row " + request.row() + " out of range");
        }
        names.set(request.row(), request.name());
        dataset.catalog(request.table(), names);
        return EngineResult.success("renamed");
    }

    @Override
    public synchronized EngineResult concat(ConcatRequest request) {
        concats.add(request);
        if (failConcat) {
            return EngineResult.failure(3, "concat failed");
        }
        Dataset merged = new Dataset();
        for (CatalogTable table : CatalogTable.values()) {
            List<String> names = new ArrayList<>();
            for (DatasetHandle input : request.inputs()) {
                names.addAll(require(input).names(table));
            }
            merged.catalog(table, names);
        }
        datasets.put(key(request.output()), merged);
        return EngineResult.success("concat ok");
    }

    private Dataset require(DatasetHandle handle) {
        Dataset dataset = datasets.get(key(handle.path()));
        if (dataset == null) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE, "Dataset not found: " + handle);
        }
        return dataset;
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static <T> List<T> snapshot(List<T> list) {
        synchronized (list) {
            return List.copyOf(list);
        }
    }
}
