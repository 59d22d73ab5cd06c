package org.Arcane.otf.pipeline;

import org.Arcane.otf.OtfPipelineException;
import org.Arcane.otf.config.PipelineConfig;
import org.Arcane.otf.dataset.CatalogTable;
import org.Arcane.otf.dataset.DatasetHandle;
import org.Arcane.otf.dataset.DatasetTimeExtractor;
import org.Arcane.otf.match.TemporalCrossMatcher;
import org.Arcane.otf.partition.DatasetLayout;
import org.Arcane.otf.partition.StageOutcome;
import org.Arcane.otf.partition.StageState;
import org.Arcane.otf.pointing.ReferencePointingLoader;
import org.Arcane.otf.pointing.ReferencePointingSeries;
import org.Arcane.otf.pointing.ReferencePointingWriter;
import org.Arcane.otf.rename.PointingNameList;
import org.Arcane.otf.state.RunState;
import org.Arcane.testutil.InMemoryDatasetEngine;
import org.Arcane.testutil.RecordingLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.event.Level;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class OtfPipelineTest {

    private static final Clock NOW = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
    private static final double T0 = 1_700_000_000.0d;
    private static final Path SOURCE = Path.of("/data/obs.ms");

    @TempDir
    Path tempDir;

    private InMemoryDatasetEngine engine;
    private RecordingLogger log;
    private OtfPipeline pipeline;
    private Path referencePath;

    @BeforeEach
    void setUp() throws IOException {
        engine = new InMemoryDatasetEngine();
        engine.addDataset(SOURCE, List.of("3C286", "OTF_TARGET"))
                .times(0, T0 - 100.0d, T0 - 99.0d)
                .times(1, T0 + 0.0002d, T0 + 10.0003d, T0 + 20.0001d);

        referencePath = tempDir.resolve("pointing.flex");
        ReferencePointingWriter.write(referencePath, new ReferencePointingSeries(
                new double[]{T0, T0 + 10.0d, T0 + 20.0d, T0 + 30.0d},
                new double[]{150.1191d, 150.2d, 150.3d, 150.4d},
                new double[]{2.2076d, 2.3d, 2.4d, 2.5d}));

        log = new RecordingLogger();
        pipeline = new OtfPipeline(engine,
                new ReferencePointingLoader(log, NOW, "ra", "dec"),
                new DatasetTimeExtractor(engine, log, NOW),
                new TemporalCrossMatcher(log),
                log);
    }

    private PipelineConfig.PipelineConfigBuilder config() {
        return PipelineConfig.builder()
                .datasetPath(SOURCE.toString())
                .pointingReferencePath(referencePath.toString())
                .targetFields(List.of("OTF_TARGET"))
                .calibratorFields(List.of("3C286"))
                .splitCalibrators(true)
                .msOutname("merged.ms")
                .workingDir(tempDir.toString())
                .parallelism(2);
    }

    @Test
    @DisplayName("Initialisation enumerates the matched reference times into ids")
    void testInitialize() {
        RunState state = pipeline.initialize(config().build());

        assertArrayEquals(new double[]{T0, T0 + 10.0d, T0 + 20.0d}, state.mapping().times());
        assertTrue(log.contains(Level.INFO, "Selected 3 OTF pointings"));
    }

    @Test
    @DisplayName("Initialisation without any match is NO_POINTINGS_SELECTED")
    void testNoPointingsSelected() {
        PipelineConfig config = config().targetFields(List.of("3C286")).build();

        OtfPipelineException ex = assertThrows(OtfPipelineException.class, () -> pipeline.initialize(config));
        assertEquals(OtfPipelineException.NO_POINTINGS_SELECTED, ex.getReasonCode());
    }

    @Test
    @DisplayName("Initialisation validates the configuration and its inputs")
    void testInitializeErrors() {
        assertEquals(OtfPipelineException.CONFIG, assertThrows(OtfPipelineException.class,
                () -> pipeline.initialize(config().msOutname(null).build())).getReasonCode());
        assertEquals(OtfPipelineException.MISSING_FILE, assertThrows(OtfPipelineException.class,
                () -> pipeline.initialize(config().datasetPath("/data/absent.ms").build())).getReasonCode());
        assertEquals(OtfPipelineException.UNKNOWN_FIELD, assertThrows(OtfPipelineException.class,
                () -> pipeline.initialize(config().targetFields(List.of("NGC1333")).build())).getReasonCode());
    }

    @Test
    @DisplayName("Full run splits, renames and merges in id order with calibrators last")
    void testRun() {
        RunState state = pipeline.initialize(config().build());
        DatasetLayout layout = state.getConfig().layout();

        PipelineRunReport report = pipeline.run(state);

        assertTrue(report.isSuccessful(), report.toString());
        assertEquals(List.of(layout.mergedPath()), report.outputs());
        assertEquals(StageState.COMPLETE, report.stateOf(2));
        assertTrue(report.calibratorOutcome().isComplete());

        List<Path> inputs = engine.concats().get(0).inputs().stream()
                .map(DatasetHandle::path).collect(Collectors.toList());
        assertEquals(List.of(layout.pointingPath(0), layout.pointingPath(1), layout.pointingPath(2),
                layout.calibratorPath()), inputs);
        assertEquals("OTFaspJ100028_58+021227_36",
                engine.dataset(layout.mergedPath()).names(CatalogTable.FIELD).get(0));
        assertEquals(9, engine.renames().size());
    }

    @Test
    @DisplayName("A failed split keeps the others and skips the merge")
    void testFailureSkipsMerge() {
        RunState state = pipeline.initialize(config().build());
        DatasetLayout layout = state.getConfig().layout();
        engine.failSplitInto(layout.pointingPath(1));

        PipelineRunReport report = pipeline.run(state);

        assertFalse(report.isSuccessful());
        assertEquals(List.of(1), report.failedIds());
        assertEquals(StageState.COMPLETE, report.stateOf(0));
        assertEquals(StageState.COMPLETE, report.stateOf(2));
        assertTrue(report.outputs().isEmpty());
        assertTrue(engine.concats().isEmpty());
        assertFalse(engine.exists(layout.pointingPath(1)));
        assertTrue(log.contains(Level.ERROR, "Not merging"));
    }

    @Test
    @DisplayName("Resume reruns only the incomplete ids, then merges")
    void testResume() {
        RunState state = pipeline.initialize(config().build());
        engine.failSplitInto(state.getConfig().layout().pointingPath(1));
        PipelineRunReport first = pipeline.run(state);
        int splitsBefore = engine.splits().size();
        engine.clearFailures();

        PipelineRunReport second = pipeline.resume(state, first);

        assertTrue(second.isSuccessful(), second.toString());
        assertEquals(splitsBefore + 1, engine.splits().size());
        assertEquals(state.getConfig().layout().pointingPath(1),
                engine.splits().get(engine.splits().size() - 1).output());
        assertEquals(1, engine.concats().size());
    }

    @Test
    @DisplayName("Cancel on failure leaves later ids planned")
    void testCancelOnFailure() {
        RunState state = pipeline.initialize(config().parallelism(1).cancelOnFailure(true).build());
        engine.failSplitInto(state.getConfig().layout().pointingPath(0));

        PipelineRunReport report = pipeline.run(state);

        assertEquals(List.of(0), report.failedIds());
        assertEquals(List.of(0, 1, 2), report.incompleteIds());
        assertEquals(StageState.PLANNED, report.stateOf(1));
        assertEquals(StageState.PLANNED, report.stateOf(2));
        assertTrue(report.calibratorsComplete());
    }

    @Test
    @DisplayName("Skipped merge reports the standalone per-id datasets")
    void testSkipMerge() {
        RunState state = pipeline.initialize(config().splitCalibrators(false).calibratorFields(List.of())
                .skipMerge(true).msOutname(null).build());
        DatasetLayout layout = state.getConfig().layout();

        PipelineRunReport report = pipeline.run(state);

        assertTrue(report.isSuccessful());
        assertNull(report.calibratorOutcome());
        assertEquals(List.of(layout.pointingPath(0), layout.pointingPath(1), layout.pointingPath(2)),
                report.outputs());
        assertTrue(engine.concats().isEmpty());

        OtfPipelineException ex = assertThrows(OtfPipelineException.class, () -> pipeline.merge(state));
        assertEquals(OtfPipelineException.CONFIG, ex.getReasonCode());
        assertEquals(OtfPipelineException.CONFIG,
                assertThrows(OtfPipelineException.class, layout::mergedPath).getReasonCode());
    }

    @Test
    @DisplayName("Single stages run independently against the run state")
    void testSingleStages() {
        RunState state = pipeline.initialize(config().build());

        StageOutcome split = pipeline.splitPointing(state, 0);
        StageOutcome rename = pipeline.renamePointing(state, 0);
        StageOutcome calibrators = pipeline.splitCalibrators(state);

        assertTrue(split.isComplete());
        assertTrue(rename.isComplete());
        assertTrue(calibrators.isCalibrators());
        assertEquals("10h00m28.5840s +02d12m27.3600s", pipeline.stages(state).directionString(0));

        assertEquals(OtfPipelineException.UNKNOWN_POINTING_ID, assertThrows(OtfPipelineException.class,
                () -> pipeline.splitPointing(state, 9)).getReasonCode());
        assertEquals(OtfPipelineException.UNKNOWN_POINTING_ID, assertThrows(OtfPipelineException.class,
                () -> pipeline.renamePointing(state, 9)).getReasonCode());
        assertEquals(OtfPipelineException.INCOMPLETE_INPUT, assertThrows(OtfPipelineException.class,
                () -> pipeline.merge(state)).getReasonCode());
    }

    @Test
    @DisplayName("Calibrator split requires calibrators in the configuration")
    void testCalibratorsNotConfigured() {
        RunState state = pipeline.initialize(config().splitCalibrators(false).build());

        assertEquals(OtfPipelineException.CONFIG, assertThrows(OtfPipelineException.class,
                () -> pipeline.splitCalibrators(state)).getReasonCode());
    }

    @Test
    @DisplayName("Name list covers every id in ascending order")
    void testWriteNameList() {
        RunState state = pipeline.initialize(config().build());
        Path file = tempDir.resolve("names.txt");

        pipeline.writeNameList(state, file, NOW);

        PointingNameList names = PointingNameList.read(file);
        assertEquals(List.of(0, 1, 2), List.copyOf(names.names().keySet()));
        assertEquals("OTFaspJ100028_58+021227_36", names.nameOf(0));
    }
}
