package org.Arcane.otf.config;

import org.Arcane.core.time.TimeUtils;
import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.dataset.Baseline;
import org.Arcane.otf.dataset.ScriptedDatasetEngine;
import org.Arcane.otf.match.TemporalCrossMatcher;
import org.Arcane.otf.partition.PartitionPlanner;
import org.Arcane.otf.rename.PointingNamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Builds a {@link PipelineConfig} from a properties file with {@code data.*},
 * {@code output.*} and {@code env.*} keys.
 *
 * <p>Trailing {@code #} comments are stripped from every value. Optional values are
 * parsed with {@link ParseResult}; a value that does not parse logs a warning and
 * the default is used. Missing mandatory keys fail with {@code CONFIG}.</p>
 */
public final class PipelineConfigLoader {
    public static final String DATA_MS = "data.ms";
    public static final String DATA_POINTING_REF = "data.pointing_ref";
    public static final String DATA_TARGET_FIELDS = "data.target_field_list";
    public static final String DATA_CALIBRATORS = "data.calibrator_list";
    public static final String DATA_SPLIT_CALIBRATORS = "data.split_calibrators";
    public static final String DATA_SCANS = "data.scans";
    public static final String DATA_TIMERANGE = "data.timerange";
    public static final String DATA_ANT1 = "data.ant1_id";
    public static final String DATA_ANT2 = "data.ant2_id";
    public static final String DATA_THRESHOLD = "data.time_crossmatch_threshold";
    public static final String DATA_SPLIT_TIMEDELTA = "data.split_timedelta";
    public static final String OUTPUT_ACRONYM = "output.otf_acronym";
    public static final String OUTPUT_MS_OUTNAME = "output.ms_outname";
    public static final String OUTPUT_SKIP_MERGE = "output.skip_merge";
    public static final String OUTPUT_DEEP_CLEAN = "output.deep_clean";
    public static final String OUTPUT_RENAME_SOURCE = "output.rename_source";
    public static final String OUTPUT_RENAME_POINTING = "output.rename_pointing";
    public static final String OUTPUT_STRICT_CATALOG_ROWS = "output.strict_catalog_rows";
    public static final String OUTPUT_BLOB_DIR = "output.blob_dir";
    public static final String OUTPUT_DIR = "output.dir";
    public static final String ENV_WORKING_DIR = "env.working_dir";
    public static final String ENV_CASA_ALIAS = "env.casa_alias";
    public static final String ENV_PARALLELISM = "env.parallelism";
    public static final String ENV_CANCEL_ON_FAILURE = "env.cancel_on_failure";

    private final Logger log;

    public PipelineConfigLoader() {
        this(LoggerFactory.getLogger(PipelineConfigLoader.class));
    }

    public PipelineConfigLoader(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Reads and validates the configuration at {@code path}.
     *
     * @throws OtfPipelineException {@code MISSING_FILE} when absent, {@code CONFIG} when invalid.
     */
    public PipelineConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE, "Config file not found: " + path);
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException | IllegalArgumentException ex) {
            throw new OtfPipelineException(OtfPipelineException.CONFIG, "Config file cannot be parsed: " + path, ex);
        }
        log.info("Reading pipeline configuration from {}", path);
        return fromProperties(properties);
    }

    /**
     * Builds and validates the configuration from already loaded properties.
     */
    public PipelineConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");

        boolean splitCalibrators = optional(properties, DATA_SPLIT_CALIBRATORS, PipelineConfigLoader::parseBoolean, false);
        boolean skipMerge = optional(properties, OUTPUT_SKIP_MERGE, PipelineConfigLoader::parseBoolean, false);
        boolean deepClean = optional(properties, OUTPUT_DEEP_CLEAN, PipelineConfigLoader::parseBoolean, false);
        if (skipMerge && deepClean) {
            log.warn("'{}' has no effect when '{}' is set, disabling it", OUTPUT_DEEP_CLEAN, OUTPUT_SKIP_MERGE);
            deepClean = false;
        }

        PipelineConfig.PipelineConfigBuilder builder = PipelineConfig.builder()
                .datasetPath(mandatory(properties, DATA_MS))
                .pointingReferencePath(mandatory(properties, DATA_POINTING_REF))
                .targetFields(mandatoryList(properties, DATA_TARGET_FIELDS))
                .splitCalibrators(splitCalibrators)
                .calibratorFields(splitCalibrators ? mandatoryList(properties, DATA_CALIBRATORS) : List.of())
                .scanIds(optional(properties, DATA_SCANS, PipelineConfigLoader::parseIntList, null))
                .timerange(optional(properties, DATA_TIMERANGE, PipelineConfigLoader::parseTimerange, null))
                .crossmatchThreshold(optional(properties, DATA_THRESHOLD,
                        PipelineConfigLoader::parsePositiveDouble, TemporalCrossMatcher.DEFAULT_THRESHOLD))
                .splitTimedelta(optional(properties, DATA_SPLIT_TIMEDELTA,
                        PipelineConfigLoader::parsePositiveDouble, PartitionPlanner.DEFAULT_SPLIT_TIMEDELTA))
                .acronym(optional(properties, OUTPUT_ACRONYM, PipelineConfigLoader::parseToken,
                        PointingNamer.DEFAULT_ACRONYM))
                .skipMerge(skipMerge)
                .msOutname(skipMerge ? value(properties, OUTPUT_MS_OUTNAME) : mandatory(properties, OUTPUT_MS_OUTNAME))
                .deepClean(deepClean)
                .renameSource(optional(properties, OUTPUT_RENAME_SOURCE, PipelineConfigLoader::parseBoolean, true))
                .renamePointing(optional(properties, OUTPUT_RENAME_POINTING, PipelineConfigLoader::parseBoolean, true))
                .strictCatalogRows(optional(properties, OUTPUT_STRICT_CATALOG_ROWS,
                        PipelineConfigLoader::parseBoolean, true))
                .workingDir(mandatory(properties, ENV_WORKING_DIR))
                .blobDir(value(properties, OUTPUT_BLOB_DIR))
                .outputDir(value(properties, OUTPUT_DIR))
                .casaAlias(optional(properties, ENV_CASA_ALIAS, PipelineConfigLoader::parseToken,
                        ScriptedDatasetEngine.DEFAULT_CASA_ALIAS))
                .parallelism(optional(properties, ENV_PARALLELISM, PipelineConfigLoader::parsePositiveInt,
                        Runtime.getRuntime().availableProcessors()))
                .cancelOnFailure(optional(properties, ENV_CANCEL_ON_FAILURE, PipelineConfigLoader::parseBoolean, false));

        applyAntennas(properties, builder);
        return builder.build().validate();
    }

    private void applyAntennas(Properties properties, PipelineConfig.PipelineConfigBuilder builder) {
        int ant1 = optional(properties, DATA_ANT1, PipelineConfigLoader::parseNonNegativeInt, Baseline.DEFAULT.ant1());
        int ant2 = optional(properties, DATA_ANT2, PipelineConfigLoader::parseNonNegativeInt, Baseline.DEFAULT.ant2());
        if (ant1 == ant2) {
            int adjusted = ant1 != 0 ? 0 : 1;
            log.warn("'{}' and '{}' are both {}; auto-correlations cannot be selected, using {} for '{}'",
                    DATA_ANT1, DATA_ANT2, ant1, adjusted, DATA_ANT2);
            ant2 = adjusted;
        }
        Baseline baseline = Baseline.of(ant1, ant2);
        builder.antenna1(baseline.ant1()).antenna2(baseline.ant2());
    }

    /**
     * Reads an optional value with the single fallback policy: absent or blank returns the
     * default silently, unparsable returns the default with a warning.
     */
    <T> T optional(Properties properties, String key, Function<String, ParseResult<T>> parser, T fallback) {
        String raw = value(properties, key);
        if (raw == null) {
            return fallback;
        }
        ParseResult<T> parsed = parser.apply(raw);
        if (!parsed.isOk()) {
            log.warn("Invalid value for '{}' ({}), using default {}", key, parsed.error(), fallback);
        }
        return parsed.orElse(fallback);
    }

    private static String mandatory(Properties properties, String key) {
        String raw = value(properties, key);
        if (raw == null) {
            throw new OtfPipelineException(OtfPipelineException.CONFIG, "Missing mandatory parameter '" + key + "'");
        }
        return raw;
    }

    private static List<String> mandatoryList(Properties properties, String key) {
        List<String> values = splitList(mandatory(properties, key));
        if (values.isEmpty()) {
            throw new OtfPipelineException(OtfPipelineException.CONFIG, "Mandatory list '" + key + "' is empty");
        }
        return values;
    }

    /**
     * Returns the comment-stripped value of {@code key}, or {@code null} when absent or blank.
     */
    static String value(Properties properties, String key) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return null;
        }
        String stripped = stripComment(raw);
        return stripped.isEmpty() ? null : stripped;
    }

    static String stripComment(String raw) {
        int comment = raw.indexOf('#');
        return (comment < 0 ? raw : raw.substring(0, comment)).strip();
    }

    static List<String> splitList(String raw) {
        List<String> values = new ArrayList<>();
        for (String token : raw.split(",")) {
            String trimmed = token.strip();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    static ParseResult<Boolean> parseBoolean(String raw) {
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "on":
            case "1":
                return ParseResult.ok(Boolean.TRUE);
            case "false":
            case "no":
            case "off":
            case "0":
                return ParseResult.ok(Boolean.FALSE);
            default:
                return ParseResult.error("'" + raw + "' is not a boolean");
        }
    }

    static ParseResult<Double> parsePositiveDouble(String raw) {
        ParseResult<Double> parsed = ParseResult.attempt(raw, Double::valueOf);
        if (parsed.isOk() && !(Double.isFinite(parsed.value()) && parsed.value() > 0.0d)) {
            return ParseResult.error("'" + raw + "' is not a finite positive number");
        }
        return parsed;
    }

    static ParseResult<Integer> parseNonNegativeInt(String raw) {
        ParseResult<Integer> parsed = ParseResult.attempt(raw, Integer::valueOf);
        if (parsed.isOk() && parsed.value() < 0) {
            return ParseResult.error("'" + raw + "' is negative");
        }
        return parsed;
    }

    static ParseResult<Integer> parsePositiveInt(String raw) {
        ParseResult<Integer> parsed = ParseResult.attempt(raw, Integer::valueOf);
        if (parsed.isOk() && parsed.value() < 1) {
            return ParseResult.error("'" + raw + "' is not positive");
        }
        return parsed;
    }

    static ParseResult<List<Integer>> parseIntList(String raw) {
        List<Integer> values = new ArrayList<>();
        for (String token : splitList(raw)) {
            ParseResult<Integer> parsed = parseNonNegativeInt(token);
            if (!parsed.isOk()) {
                return ParseResult.error(parsed.error());
            }
            values.add(parsed.value());
        }
        return values.isEmpty() ? ParseResult.error("empty list") : ParseResult.ok(List.copyOf(values));
    }

    static ParseResult<String> parseTimerange(String raw) {
        return ParseResult.attempt(raw, TimeUtils::parseCasaTimerange).map(range -> raw);
    }

    static ParseResult<String> parseToken(String raw) {
        if (raw.chars().anyMatch(Character::isWhitespace)) {
            return ParseResult.error("'" + raw + "' must not contain whitespace");
        }
        return ParseResult.ok(raw);
    }
}
