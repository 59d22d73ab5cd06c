package org.Arcane.otf.dataset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.Arcane.core.time.TimeRange;
import org.Arcane.core.time.TimeUtils;
import org.Arcane.otf.OtfPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link DatasetEngine} that renders every request as a CASA script and runs it
 * through a {@link CommandRunner}.
 *
 * <p>Table queries dump their result as JSON next to the script; the file is read
 * back with Jackson and both files are removed afterwards.</p>
 */
public final class ScriptedDatasetEngine implements DatasetEngine {
    public static final String DEFAULT_CASA_ALIAS = "casa";

    private final Path scriptDir;
    private final String casaAlias;
    private final CommandRunner runner;
    private final ObjectMapper mapper;
    private final Logger log;
    private final AtomicLong sequence = new AtomicLong();

    public ScriptedDatasetEngine(Path scriptDir, String casaAlias) {
        this(scriptDir, casaAlias, new ProcessCommandRunner(), new ObjectMapper(),
                LoggerFactory.getLogger(ScriptedDatasetEngine.class));
    }

    public ScriptedDatasetEngine(Path scriptDir, String casaAlias, CommandRunner runner,
                                 ObjectMapper mapper, Logger log) {
        this.scriptDir = Objects.requireNonNull(scriptDir, "scriptDir");
        this.casaAlias = Objects.requireNonNull(casaAlias, "casaAlias");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public DatasetHandle open(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE, "Dataset not found: " + path);
        }
        return new DatasetHandle(path.toAbsolutePath().normalize());
    }

    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }

    @Override
    public void delete(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path entry : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(entry);
            }
        } catch (IOException ex) {
            throw new OtfPipelineException(OtfPipelineException.ENGINE_FAILURE, "Cannot delete " + path, ex);
        }
        log.info("Deleted {}", path);
    }

    @Override
    public List<String> fieldCatalog(DatasetHandle dataset) {
        String body = "tb.open(" + py(subtable(dataset, CatalogTable.FIELD)) + ")\n"
                + "values = [str(v) for v in tb.getcol('NAME')]\n"
                + "tb.close()\n";
        return query("field_catalog", body, new TypeReference<List<String>>() { });
    }

    @Override
    public int catalogRowCount(DatasetHandle dataset, CatalogTable table) {
        String body = "tb.open(" + py(subtable(dataset, table)) + ")\n"
                + "values = int(tb.nrows())\n"
                + "tb.close()\n";
        return query("row_count_" + table.tableName().toLowerCase(Locale.ROOT), body, new TypeReference<Integer>() { });
    }

    @Override
    public double[] queryTimes(DatasetHandle dataset, TimeQuery query) {
        String body = "tb.open(" + py(dataset.path().toString()) + ")\n"
                + "sub = tb.query(" + py(taqlSelection(query.fieldIds(), query.scanIds(), query.baseline()))
                + ", columns='TIME')\n"
                + "values = [float(v) for v in sub.getcol('TIME')] if sub.nrows() > 0 else []\n"
                + "sub.close()\n"
                + "tb.close()\n";
        return query("query_times", body, new TypeReference<double[]>() { });
    }

    @Override
    public int[] scanNumbers(DatasetHandle dataset, List<Integer> fieldIds, Baseline baseline) {
        String body = "tb.open(" + py(dataset.path().toString()) + ")\n"
                + "sub = tb.query(" + py(taqlSelection(fieldIds, null, baseline)) + ", columns='SCAN_NUMBER')\n"
                + "values = sorted(set(int(v) for v in sub.getcol('SCAN_NUMBER'))) if sub.nrows() > 0 else []\n"
                + "sub.close()\n"
                + "tb.close()\n";
        return query("scan_numbers", body, new TypeReference<int[]>() { });
    }

    @Override
    public EngineResult split(SplitRequest request) {
        createParent(request.output());
        return execute("split", renderSplit(request));
    }

    @Override
    public EngineResult rename(RenameRequest request) {
        return execute("rename_" + request.table().tableName().toLowerCase(Locale.ROOT), renderRename(request));
    }

    @Override
    public EngineResult concat(ConcatRequest request) {
        createParent(request.output());
        return execute("concat", renderConcat(request));
    }

    static String renderSplit(SplitRequest request) {
        StringBuilder script = new StringBuilder("split(vis=")
                .append(py(request.source().path().toString()))
                .append(",\n      outputvis=").append(py(request.output().toString()));
        if (request.timeRange() != null) {
            TimeRange range = request.timeRange();
            script.append(",\n      timerange=").append(py(TimeUtils.toCasaTimerange(range.start(), range.end())));
        }
        script.append(",\n      datacolumn=").append(py(request.dataColumn()))
                .append(",\n      field=").append(py(String.join(",", request.fieldNames())))
                .append(")\n");
        return script.toString();
    }

    static String renderRename(RenameRequest request) {
        return "tb.open(" + py(subtable(request.dataset(), request.table())) + ", nomodify=False)\n"
                + "tb.putcell('NAME', " + request.row() + ", " + py(request.name()) + ")\n"
                + "tb.flush()\n"
                + "tb.close()\n";
    }

    static String renderConcat(ConcatRequest request) {
        String inputs = request.inputs().stream()
                .map(handle -> py(handle.path().toString()))
                .collect(Collectors.joining(", ", "[", "]"));
        return "concat(vis=" + inputs + ",\n       concatvis=" + py(request.output().toString())
                + ",\n       respectname=True)\n";
    }

    static String taqlSelection(List<Integer> fieldIds, List<Integer> scanIds, Baseline baseline) {
        StringBuilder taql = new StringBuilder("FIELD_ID IN ").append(taqlSet(fieldIds));
        if (scanIds != null) {
            taql.append(" AND SCAN_NUMBER IN ").append(taqlSet(scanIds));
        }
        taql.append(" AND ANTENNA1 == ").append(baseline.ant1())
                .append(" AND ANTENNA2 == ").append(baseline.ant2());
        return taql.toString();
    }

    private static String taqlSet(List<Integer> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]"));
    }

    private static String subtable(DatasetHandle dataset, CatalogTable table) {
        return dataset.path().resolve(table.tableName()).toString();
    }

    /**
     * Renders {@code value} as a single-quoted Python string literal.
     */
    static String py(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private <T> T query(String name, String body, TypeReference<T> type) {
        Path resultFile = scriptDir.resolve(name + "_" + sequence.incrementAndGet() + ".json");
        String script = "import json\n" + body
                + "with open(" + py(resultFile.toString()) + ", 'w') as out:\n"
                + "    json.dump(values, out)\n";
        try {
            EngineResult result = execute(name, script);
            if (!result.isSuccess()) {
                throw new OtfPipelineException(OtfPipelineException.ENGINE_FAILURE,
                        "Engine query '" + name + "' exited with status " + result.exitCode());
            }
            if (!Files.isRegularFile(resultFile)) {
                throw new OtfPipelineException(OtfPipelineException.ENGINE_FAILURE,
                        "Engine query '" + name + "' produced no result file " + resultFile);
            }
            return mapper.readValue(resultFile.toFile(), type);
        } catch (IOException ex) {
            throw new OtfPipelineException(OtfPipelineException.FORMAT,
                    "Engine query '" + name + "' result is not valid JSON: " + resultFile, ex);
        } finally {
            removeQuietly(resultFile);
        }
    }

    private EngineResult execute(String name, String script) {
        Path scriptFile = scriptDir.resolve(name + "_" + sequence.incrementAndGet() + ".py");
        try {
            Files.createDirectories(scriptDir);
            Files.writeString(scriptFile, script, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new OtfPipelineException(OtfPipelineException.ENGINE_FAILURE,
                    "Cannot write engine script " + scriptFile, ex);
        }
        log.debug("Running engine script {}:\n{}", scriptFile, script);
        try {
            EngineResult result = runner.run(List.of(casaAlias, "--log2term", "--nogui", "--nologfile",
                    "--nocrashreport", "-c", scriptFile.toString()));
            if (result.isSuccess()) {
                log.info("Engine script {} finished: {}", name, result.diagnostics().strip());
            } else {
                log.error("Engine script {} exited with status {}: {}",
                        name, result.exitCode(), result.diagnostics().strip());
            }
            return result;
        } finally {
            removeQuietly(scriptFile);
        }
    }

    private static void createParent(Path output) {
        Path parent = output.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException ex) {
            throw new OtfPipelineException(OtfPipelineException.ENGINE_FAILURE,
                    "Cannot create output directory " + parent, ex);
        }
    }

    private void removeQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Cannot remove engine file {}: {}", file, ex.getMessage());
        }
    }
}
