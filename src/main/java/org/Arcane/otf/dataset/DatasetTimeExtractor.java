package org.Arcane.otf.dataset;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.Arcane.core.time.TimeRange;
import org.Arcane.core.time.TimeSeries;
import org.Arcane.core.time.TimeUtils;
import org.Arcane.otf.OtfPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extracts integration timestamps from a dataset for a field/scan/baseline selection.
 *
 * <p>Returned series are always in Unix seconds. Field names are resolved against the
 * field catalog before any time query is issued.</p>
 */
public final class DatasetTimeExtractor {

    private final DatasetEngine engine;
    private final Logger log;
    private final Clock clock;

    public DatasetTimeExtractor(DatasetEngine engine) {
        this(engine, LoggerFactory.getLogger(DatasetTimeExtractor.class), Clock.systemUTC());
    }

    public DatasetTimeExtractor(DatasetEngine engine, Logger log, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.log = Objects.requireNonNull(log, "log");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Extracts timestamps matching {@code selection}.
     *
     * @param dataset opened dataset.
     * @param selection field, scan, baseline and optional time-range selection.
     * @return timestamps in Unix seconds, possibly empty and possibly non-unique.
     * @throws OtfPipelineException {@code UNKNOWN_FIELD} for a field absent from the catalog,
     *                              {@code FORMAT} when the times are non-finite or in no recognised epoch.
     */
    public TimeSeries extractTimes(DatasetHandle dataset, DatasetSelection selection) {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(selection, "selection");

        IntList fieldIds = resolveFieldIds(dataset, selection.getFieldNames());
        TimeQuery query = new TimeQuery(fieldIds, selection.getScanIds(), selection.getBaseline());
        log.debug("Querying TIME of {} for field rows {}, scans {}, baseline {}",
                dataset, fieldIds, query.allScans() ? "all" : query.scanIds(), query.baseline());

        double[] raw = engine.queryTimes(dataset, query);
        if (raw.length == 0) {
            log.warn("No TIME data selected from {} for fields {}", dataset, selection.getFieldNames());
            return TimeSeries.empty(TimeUtils.TimeEpoch.UNIX_SECONDS);
        }
        for (int i = 0; i < raw.length; i++) {
            if (!Double.isFinite(raw[i])) {
                throw new OtfPipelineException(OtfPipelineException.FORMAT,
                        "TIME of " + dataset + " holds a non-finite value (" + raw[i] + ") at row " + i);
            }
        }

        TimeSeries nativeTimes = TimeSeries.of(detectEpoch(dataset, raw[0]), raw);
        if (!nativeTimes.isUnique()) {
            log.warn("Non-unique TIME data selected from {} for fields {}; check the dataset and selection",
                    dataset, selection.getFieldNames());
        }

        TimeSeries unix = nativeTimes.toUnix();
        TimeRange range = selection.getTimeRange();
        if (range == null) {
            return unix;
        }
        DoubleArrayList kept = new DoubleArrayList(unix.size());
        for (int i = 0; i < unix.size(); i++) {
            double t = unix.get(i);
            if (range.contains(t)) {
                kept.add(t);
            }
        }
        log.info("Time range {} kept {} of {} timestamps",
                TimeUtils.toCasaTimerange(range.start(), range.end()), kept.size(), unix.size());
        return TimeSeries.unix(kept.toDoubleArray());
    }

    /**
     * Maps every field name of the catalog to all catalog rows bearing it, in catalog order.
     */
    public Map<String, IntList> fieldRows(DatasetHandle dataset) {
        List<String> catalog = engine.fieldCatalog(dataset);
        Map<String, IntList> rows = new LinkedHashMap<>();
        for (int row = 0; row < catalog.size(); row++) {
            rows.computeIfAbsent(catalog.get(row), name -> new IntArrayList()).add(row);
        }
        return rows;
    }

    /**
     * Lists the scan numbers observed for each requested field on one baseline.
     *
     * @throws OtfPipelineException {@code UNKNOWN_FIELD} for a field absent from the catalog.
     */
    public Map<String, int[]> scansByField(DatasetHandle dataset, List<String> fieldNames, Baseline baseline) {
        Objects.requireNonNull(baseline, "baseline");
        Map<String, IntList> rows = fieldRows(dataset);
        requireKnownFields(dataset, fieldNames, rows);
        Map<String, int[]> scans = new LinkedHashMap<>();
        for (String fieldName : fieldNames) {
            scans.put(fieldName, engine.scanNumbers(dataset, rows.get(fieldName), baseline));
        }
        return scans;
    }

    private IntList resolveFieldIds(DatasetHandle dataset, List<String> fieldNames) {
        Map<String, IntList> rows = fieldRows(dataset);
        requireKnownFields(dataset, fieldNames, rows);
        IntList ids = new IntArrayList();
        for (String fieldName : fieldNames) {
            for (int row : rows.get(fieldName)) {
                if (!ids.contains(row)) {
                    ids.add(row);
                }
            }
        }
        return ids;
    }

    private static void requireKnownFields(DatasetHandle dataset, List<String> fieldNames, Map<String, IntList> rows) {
        if (fieldNames == null || fieldNames.isEmpty()) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "At least one field name must be selected");
        }
        for (String fieldName : fieldNames) {
            if (!rows.containsKey(fieldName)) {
                throw new OtfPipelineException(OtfPipelineException.UNKNOWN_FIELD,
                        "Field '" + fieldName + "' not found in field catalog of " + dataset
                                + "; available fields: " + new ArrayList<>(rows.keySet()));
            }
        }
    }

    private TimeUtils.TimeEpoch detectEpoch(DatasetHandle dataset, double firstRaw) {
        if (TimeUtils.isPlausibleUnixTime(TimeUtils.mjdSecondsToUnix(firstRaw), clock)) {
            return TimeUtils.TimeEpoch.MJD_SECONDS;
        }
        if (TimeUtils.isPlausibleUnixTime(firstRaw, clock)) {
            return TimeUtils.TimeEpoch.UNIX_SECONDS;
        }
        throw new OtfPipelineException(OtfPipelineException.FORMAT,
                "TIME values of " + dataset + " are neither MJD nor Unix seconds (first value " + firstRaw + ")");
    }
}
