package org.Arcane.app;

import org.Arcane.otf.pointing.ReferencePointingSeries;
import org.Arcane.otf.pointing.ReferencePointingWriter;
import org.Arcane.testutil.InMemoryDatasetEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private static final Clock NOW = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
    private static final double T0 = 1_700_000_000.0d;

    @TempDir
    Path tempDir;

    private InMemoryDatasetEngine engine;
    private Path properties;
    private Path state;
    private ByteArrayOutputStream buffer;

    @BeforeEach
    void setUp() throws IOException {
        engine = new InMemoryDatasetEngine();
        Path dataset = tempDir.resolve("obs.ms");
        engine.addDataset(dataset, List.of("3C286", "OTF_TARGET"))
                .times(1, T0 + 0.0002d, T0 + 10.0003d, T0 + 20.0001d);

        Path reference = tempDir.resolve("pointing.flex");
        ReferencePointingWriter.write(reference, new ReferencePointingSeries(
                new double[]{T0, T0 + 10.0d, T0 + 20.0d},
                new double[]{150.1191d, 150.2d, 150.3d},
                new double[]{2.2076d, 2.3d, 2.4d}));

        properties = tempDir.resolve("otf.properties");
        Files.writeString(properties, String.join("\n",
                "data.ms = " + dataset,
                "data.pointing_ref = " + reference,
                "data.target_field_list = OTF_TARGET",
                "data.calibrator_list = 3C286",
                "data.split_calibrators = true",
                "output.ms_outname = merged.ms",
                "env.working_dir = " + tempDir,
                "env.parallelism = 2",
                ""), StandardCharsets.UTF_8);
        state = tempDir.resolve("run.json");
        buffer = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        buffer.reset();
        return Main.run(args, new PrintStream(buffer, true, StandardCharsets.UTF_8), config -> engine, NOW);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8).strip();
    }

    private void init() {
        assertEquals(0, run("init", "-p", properties.toString(), "-c", state.toString()));
    }

    @Test
    @DisplayName("Init prints the pointing count and refuses to overwrite without the flag")
    void testInit() {
        init();
        assertEquals("3", output());
        assertTrue(Files.exists(state));

        assertEquals(1, run("init", "-p", properties.toString(), "-c", state.toString()));
        assertEquals(0, run("init", "-p", properties.toString(), "-c", state.toString(), "--overwrite"));
    }

    @Test
    @DisplayName("Stage commands print the paths they produce")
    void testStages() {
        init();
        Path blob = tempDir.resolve("otf_pointings");

        assertEquals(0, run("split", "-c", state.toString(), "-i", "0"));
        assertEquals(blob.resolve("otf_pointing_no_0.ms").toString(), output());

        assertEquals(0, run("rename", "-c", state.toString(), "-i", "0"));
        assertEquals(blob.resolve("otf_pointing_no_0.ms").toString(), output());

        assertEquals(0, run("split-calibrators", "-c", state.toString()));
        assertEquals(blob.resolve("calibrators.ms").toString(), output());

        assertEquals(0, run("direction", "-c", state.toString(), "-i", "0"));
        assertEquals("10h00m28.5840s +02d12m27.3600s", output());

        Path names = tempDir.resolve("names.txt");
        assertEquals(0, run("list-names", "-c", state.toString(), "-o", names.toString()));
        assertEquals(names.toString(), output());
        assertTrue(Files.exists(names));
    }

    @Test
    @DisplayName("Merge fails until every per-id dataset exists")
    void testMerge() {
        init();
        assertEquals(1, run("merge", "-c", state.toString()));

        for (int id = 0; id < 3; id++) {
            assertEquals(0, run("split", "-c", state.toString(), "-i", String.valueOf(id)));
        }
        assertEquals(0, run("split-calibrators", "-c", state.toString()));
        assertEquals(0, run("merge", "-c", state.toString()));
        assertEquals(tempDir.resolve("merged.ms").toString(), output());
    }

    @Test
    @DisplayName("Run executes every stage and prints the merged dataset")
    void testRun() {
        init();
        assertEquals(0, run("run", "-c", state.toString()));
        assertEquals(tempDir.resolve("merged.ms").toString(), output());
        assertEquals(1, engine.concats().size());
    }

    @Test
    @DisplayName("Failed split exits with status 1")
    void testFailedStage() {
        init();
        engine.failSplitInto(tempDir.resolve("otf_pointings").resolve("otf_pointing_no_1.ms"));

        assertEquals(1, run("split", "-c", state.toString(), "-i", "1"));
        assertEquals(1, run("run", "-c", state.toString()));
    }

    @Test
    @DisplayName("Invalid command lines exit with status 1")
    void testInvalidCommandLines() {
        init();
        assertEquals(1, run());
        assertEquals(1, run("explode", "-c", state.toString()));
        assertEquals(1, run("split", "-c", state.toString()));
        assertEquals(1, run("split", "-c", state.toString(), "-i", "zero"));
        assertEquals(1, run("split", "-c", state.toString(), "-i", "7"));
        assertEquals(1, run("split", "-c", state.toString(), "-i"));
        assertEquals(1, run("split", "-c", state.toString(), "--force"));
        assertEquals(1, run("split", "-c", tempDir.resolve("absent.json").toString(), "-i", "0"));
    }
}
