package org.Arcane.otf.rename;

import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.dataset.CatalogTable;
import org.Arcane.otf.dataset.DatasetEngine;
import org.Arcane.otf.dataset.DatasetHandle;
import org.Arcane.otf.dataset.EngineResult;
import org.Arcane.otf.dataset.RenameRequest;
import org.Arcane.otf.match.NearestPointingLookup;
import org.Arcane.otf.partition.DatasetLayout;
import org.Arcane.otf.partition.StageOutcome;
import org.Arcane.otf.partition.StageState;
import org.Arcane.otf.pointing.PointingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Renames row 0 of the catalog tables of a per-id dataset after its pointing coordinates.
 *
 * <p>The field catalog is always renamed; source and pointing catalogs are optional.
 * A catalog with more than one row fails with {@code AMBIGUOUS_FIELD} in strict mode,
 * otherwise it only logs a warning since rows past 0 keep their old names.</p>
 */
public final class PointingRenamer {

    private final DatasetEngine engine;
    private final DatasetLayout layout;
    private final NearestPointingLookup lookup;
    private final String acronym;
    private final Set<CatalogTable> tables;
    private final boolean strictCatalogRows;
    private final Logger log;

    public PointingRenamer(DatasetEngine engine, DatasetLayout layout, NearestPointingLookup lookup,
                           String acronym, boolean renameSource, boolean renamePointing, boolean strictCatalogRows) {
        this(engine, layout, lookup, acronym, renameSource, renamePointing, strictCatalogRows,
                LoggerFactory.getLogger(PointingRenamer.class));
    }

    public PointingRenamer(DatasetEngine engine, DatasetLayout layout, NearestPointingLookup lookup,
                           String acronym, boolean renameSource, boolean renamePointing, boolean strictCatalogRows,
                           Logger log) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.acronym = Objects.requireNonNull(acronym, "acronym");
        this.tables = EnumSet.of(CatalogTable.FIELD);
        if (renameSource) {
            tables.add(CatalogTable.SOURCE);
        }
        if (renamePointing) {
            tables.add(CatalogTable.POINTING);
        }
        this.strictCatalogRows = strictCatalogRows;
        this.log = Objects.requireNonNull(log, "log");
    }

    public NearestPointingLookup lookup() {
        return lookup;
    }

    /**
     * Computes the display name of a pointing id.
     */
    public String nameOf(int id) {
        PointingRecord record = lookup.resolve(id);
        return PointingNamer.name(acronym, record.coordA(), record.coordB());
    }

    /**
     * Renames the per-id dataset of {@code id}.
     *
     * @return {@code COMPLETE}, or {@code FAILED} when an engine rename request failed.
     * @throws OtfPipelineException {@code MISSING_FILE} when the per-id dataset is absent,
     *                              {@code STALE_MATCH}/{@code UNKNOWN_POINTING_ID} from the lookup,
     *                              {@code AMBIGUOUS_FIELD} for a multi-row catalog in strict mode.
     */
    public StageOutcome rename(int id) {
        Path path = layout.pointingPath(id);
        if (!engine.exists(path)) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE,
                    "Dataset of pointing " + id + " not found: " + path);
        }
        DatasetHandle dataset = engine.open(path);
        String name = nameOf(id);
        log.info("Renaming pointing {} in {} to {}", id, path, name);

        List<CatalogTable> targets = new ArrayList<>();
        for (CatalogTable table : tables) {
            int rows = engine.catalogRowCount(dataset, table);
            if (rows == 0) {
                log.warn("{} catalog of {} is empty, not renaming it", table.tableName(), path);
                continue;
            }
            if (rows > 1) {
                String message = table.tableName() + " catalog of " + path + " has " + rows
                        + " rows; only row 0 would be renamed to " + name;
                if (strictCatalogRows) {
                    throw new OtfPipelineException(OtfPipelineException.AMBIGUOUS_FIELD, message);
                }
                log.warn(message);
            }
            targets.add(table);
        }

        StringBuilder diagnostics = new StringBuilder();
        for (CatalogTable table : targets) {
            EngineResult result = engine.rename(new RenameRequest(dataset, table, 0, name));
            diagnostics.append(result.diagnostics());
            if (!result.isSuccess()) {
                log.error("Renaming {} catalog of pointing {} failed with exit status {}",
                        table.tableName(), id, result.exitCode());
                return new StageOutcome(id, StageState.FAILED, path, diagnostics.toString());
            }
        }
        log.info("Pointing {} renamed to {}", id, name);
        return new StageOutcome(id, StageState.COMPLETE, path, diagnostics.toString());
    }
}
