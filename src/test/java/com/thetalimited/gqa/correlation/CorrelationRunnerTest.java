package com.thetalimited.gqa.correlation;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.thetalimited.gqa.GqaConfig;
import com.thetalimited.gqa.GranuleScene;
import com.thetalimited.gqa.SceneBand;
import com.thetalimited.gqa.geotiff.BandExtractor;
import com.thetalimited.gqa.process.CommandRunner;
import com.thetalimited.gqa.process.ProcessCommandRunner;
import com.thetalimited.gqa.reference.Footprint;
import com.thetalimited.gqa.reference.MosaicBuilder;
import com.thetalimited.gqa.reference.RasterOperations;
import com.thetalimited.gqa.reference.ReferenceImageRecord;
import com.thetalimited.gqa.reference.ReferenceImageryResolver;
import com.thetalimited.gqa.reference.SceneIndex;
import com.thetalimited.gqa.reference.SpatialReferenceKey;
import com.thetalimited.gqa.reference.SpatialReferenceReader;

import static org.junit.Assert.*;

public class CorrelationRunnerTest
{
    private static final SpatialReferenceKey UTM55 = new SpatialReferenceKey("EPSG:32755", 25.0, -25.0);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path references;
    private Path fixRoot;
    private Path oceanList;
    private Path workDir;
    private SceneIndex sceneIndex;

    private final List<Path> extractedFrom = new ArrayList<>();

    /** Records the command and leaves a results file behind, like gverify. */
    private static final class FakeGverify implements CommandRunner
    {
        List<String> command;
        Map<String, String> environment;
        long timeout;

        @Override
        public void run(List<String> command, Path workDir, Map<String, String> environment, long timeoutSeconds)
            throws IOException
        {
            this.command = command;
            this.environment = environment;
            this.timeout = timeoutSeconds;
            Files.write(workDir.resolve(CorrelationRunner.RESULTS_FILE), List.of("results"));
        }
    }

    private static final class NoRasterOperations implements RasterOperations
    {
        @Override
        public void reproject(Path source, ReferenceImageRecord template, Path destination)
        {
            throw new AssertionError("single reference needs no reprojection");
        }

        @Override
        public void buildMosaic(List<Path> images, Path destination) throws IOException
        {
            Files.write(destination, List.of("<VRTDataset/>"));
        }
    }

    @Before
    public void setUp() throws IOException
    {
        references = folder.newFolder("references").toPath();
        Path dir = references.resolve("090").resolve("081");
        Files.createDirectories(dir);
        Files.createFile(dir.resolve("p090r081_7dt20000822_z55_30.tif"));
        Files.createFile(dir.resolve("p090r081_7dt20000822_z55_10.tif"));

        fixRoot = folder.newFolder("fixed").toPath();
        Path points = fixRoot.resolve("090").resolve("081");
        Files.createDirectories(points);
        Files.write(points.resolve("points.txt"), List.of("148.75 -30.25", "149.10 -30.60"));

        oceanList = folder.newFile("ocean_tiles.txt").toPath();
        Files.write(oceanList, List.of("52KGA"));

        workDir = folder.getRoot().toPath().resolve("work").resolve("gverify");

        JSONObject fc = new JSONObject("{\"type\":\"FeatureCollection\",\"features\":[{\"type\":\"Feature\","
            + "\"properties\":{\"PATH\":90,\"ROW\":81},\"geometry\":{\"type\":\"Polygon\",\"coordinates\":"
            + "[[[148,-30],[150,-30],[150,-32],[148,-32],[148,-30]]]}}]}");
        sceneIndex = SceneIndex.parse(fc);
    }

    private GqaConfig config(String executable, int timeoutSeconds)
    {
        JSONObject overrides = new JSONObject();
        overrides.put("gverify", new JSONObject().put("executable", executable)
                                                 .put("timeout_seconds", timeoutSeconds));
        overrides.put("references", new JSONObject()
                      .put("root_fix_qa_location", fixRoot.toString())
                      .put("ocean_tile_list", oceanList.toString())
                      .put("directories", new JSONArray().put(references.toString())));
        return GqaConfig.fromJson(overrides);
    }

    private CorrelationRunner runner(GqaConfig config, CommandRunner commandRunner) throws IOException
    {
        SpatialReferenceReader reader = file -> new ReferenceImageRecord(file, UTM55);
        BandExtractor extractor = new BandExtractor() {
                @Override
                public long extract(Path source, Path destination) throws IOException
                {
                    extractedFrom.add(source);
                    Files.write(destination, new byte[] { 0 });
                    return 0;
                }
            };
        return new CorrelationRunner(config, new ReferenceImageryResolver(sceneIndex, config, reader),
                                     new MosaicBuilder(new NoRasterOperations(), reader),
                                     TileClassifier.load(config.getReferences().getOceanTileList()),
                                     new GcpCollector(), extractor, commandRunner);
    }

    private static GranuleScene scene(String granule, double lon, double lat)
    {
        Footprint footprint = Footprint.fromCorners(new double[] { lon, lat }, new double[] { lon + 0.5, lat },
                                                    new double[] { lon + 0.5, lat - 0.5 },
                                                    new double[] { lon, lat - 0.5 });
        return new GranuleScene(granule, "SENTINEL_2A", OffsetDateTime.of(2000, 8, 25, 0, 55, 0, 0, ZoneOffset.UTC),
                                footprint, new SceneBand("4", Paths.get("/l2/B04.tif")),
                                new SceneBand("2", Paths.get("/l2/B02.tif")));
    }

    @Test
    public void testLandGranuleRunsGridCorrelation() throws Exception
    {
        FakeGverify gverify = new FakeGverify();
        RunRecord record = runner(config("gverify", 300), gverify)
            .run(scene(TileClassifierTest.LAND_GRANULE, 148.5, -30.5), workDir);

        assertTrue(record.getErrorMsg(), record.isSuccess());
        int g = gverify.command.indexOf("-g");
        assertTrue(g > 0);
        assertEquals("66", gverify.command.get(g + 1));
        assertFalse(gverify.command.contains("FIXED_LOCATION"));
        assertEquals(workDir.resolve("reference.vrt").toAbsolutePath().toString(),
                     gverify.command.get(gverify.command.indexOf("-b") + 1));
        assertEquals(300L, gverify.timeout);
        assertEquals(List.of(Paths.get("/l2/B04.tif")), extractedFrom);
        assertFalse(Files.exists(workDir.resolve(GcpCollector.POINTS_FILE)));

        assertEquals("2000-08-22T00:00:00+00:00", record.getRefDate());
        assertEquals(List.of(25.0, 25.0), record.getRefResolution());
        assertTrue(record.getRefSourcePath().endsWith("p090r081_7dt20000822_z55_30.tif"));
        assertEquals(TileClassifierTest.LAND_GRANULE, record.getGranule());

        RunRecord written = RunRecord.read(workDir.resolve(RunRecord.FILE_NAME));
        assertEquals(record.toMap(), written.toMap());
    }

    @Test
    public void testOceanGranuleRunsFixedLocationCorrelation() throws Exception
    {
        FakeGverify gverify = new FakeGverify();
        RunRecord record = runner(config("gverify", 300), gverify)
            .run(scene(TileClassifierTest.OCEAN_GRANULE, 148.5, -30.5), workDir);

        assertTrue(record.getErrorMsg(), record.isSuccess());
        Path points = workDir.resolve(GcpCollector.POINTS_FILE);
        int t = gverify.command.indexOf("-t");
        assertEquals(List.of("-t", "FIXED_LOCATION", "-t_file", points.toAbsolutePath().toString()),
                     gverify.command.subList(t, t + 4));
        assertFalse(gverify.command.contains("-g"));
        assertEquals(List.of("148.75 -30.25", "149.10 -30.60"), Files.readAllLines(points));
        // the ocean band is correlated, so band 2 references are used
        assertEquals(List.of(Paths.get("/l2/B02.tif")), extractedFrom);
        assertTrue(record.getRefSourcePath().endsWith("p090r081_7dt20000822_z55_10.tif"));
    }

    @Test
    public void testTimeoutIsCaptured() throws Exception
    {
        Assume.assumeTrue(new File("/bin/sh").canExecute());

        File script = folder.newFile("slow-gverify.sh");
        Files.write(script.toPath(), List.of("#!/bin/sh",
                                             "echo partial > " + CorrelationRunner.RESULTS_FILE,
                                             "exec sleep 30"), StandardCharsets.UTF_8);
        assertTrue(script.setExecutable(true));

        long start = System.nanoTime();
        RunRecord record = runner(config(script.getAbsolutePath(), 1), new ProcessCommandRunner())
            .run(scene(TileClassifierTest.LAND_GRANULE, 148.5, -30.5), workDir);
        long seconds = (System.nanoTime() - start) / 1_000_000_000L;

        assertFalse(record.isSuccess());
        assertTrue(record.getErrorMsg(), record.getErrorMsg().contains("timed out after 1 seconds"));
        assertTrue(seconds < 20);
        assertFalse(Files.exists(workDir.resolve(CorrelationRunner.RESULTS_FILE)));

        RunRecord written = RunRecord.read(workDir.resolve(RunRecord.FILE_NAME));
        assertEquals(record.getErrorMsg(), written.getErrorMsg());
        // the reference was resolved before gverify ran
        assertEquals("2000-08-22T00:00:00+00:00", written.getRefDate());
    }

    @Test
    public void testMissingExecutableIsCaptured() throws Exception
    {
        File missing = new File(folder.getRoot(), "no-such-dir/gverify");

        RunRecord record = runner(config(missing.getAbsolutePath(), 300), new ProcessCommandRunner())
            .run(scene(TileClassifierTest.LAND_GRANULE, 148.5, -30.5), workDir);

        assertFalse(record.isSuccess());
        assertTrue(record.getErrorMsg(), record.getErrorMsg().startsWith("Cannot run 'gverify'"));
        assertFalse(Files.exists(workDir.resolve(CorrelationRunner.RESULTS_FILE)));

        RunRecord written = RunRecord.read(workDir.resolve(RunRecord.FILE_NAME));
        assertEquals(record.getErrorMsg(), written.getErrorMsg());
    }

    @Test
    public void testResolutionFailureIsCaptured() throws Exception
    {
        FakeGverify gverify = new FakeGverify();
        RunRecord record = runner(config("gverify", 300), gverify)
            .run(scene(TileClassifierTest.LAND_GRANULE, 20.0, 20.0), workDir);

        assertFalse(record.isSuccess());
        assertTrue(record.getErrorMsg().startsWith("No intersecting scenes"));
        assertNull(gverify.command);
        assertEquals("", record.getRefDate());
        assertEquals("", record.getRefSourcePath());
        assertTrue(Files.exists(workDir.resolve(RunRecord.FILE_NAME)));
    }

    @Test
    public void testMissingFixedPointsAreCaptured() throws Exception
    {
        Files.delete(fixRoot.resolve("090").resolve("081").resolve("points.txt"));
        FakeGverify gverify = new FakeGverify();
        RunRecord record = runner(config("gverify", 300), gverify)
            .run(scene(TileClassifierTest.OCEAN_GRANULE, 148.5, -30.5), workDir);

        assertFalse(record.isSuccess());
        assertTrue(record.getErrorMsg(), record.getErrorMsg().contains("points.txt"));
        assertNull(gverify.command);
    }
}
