package com.thetalimited.gqa;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.OffsetDateTime;
import java.util.List;

import org.json.JSONObject;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.thetalimited.gqa.correlation.CorrelationRunner;
import com.thetalimited.gqa.correlation.RunRecord;
import com.thetalimited.gqa.reference.Footprint;
import com.thetalimited.gqa.report.GqaReport;
import com.thetalimited.gqa.report.GqaReportAssembler;
import com.thetalimited.gqa.report.ReportWriter;
import com.thetalimited.gqa.results.NoGcpException;
import com.thetalimited.gqa.results.ResultParser;
import com.thetalimited.gqa.stats.RobustStatisticsEngine;

import static org.junit.Assert.*;

public class GqaPipelineTest
{
    static final String GRANULE = "S2A_OPER_MSI_L1C_TL_SGS__20160101T005512_A002870_T55HFA_N02.01";
    static final String RESULTS_FIXTURE = "/com/thetalimited/gqa/results/image-gverify.res";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path workRoot;
    private Path outDir;

    /**
     * Stands in for gverify: copies a canned results file, or an empty one,
     * into the scratch directory.
     */
    static class CannedRunner extends CorrelationRunner
    {
        private final String errorMsg;
        private final boolean emptyTable;

        CannedRunner(GqaConfig config, String errorMsg, boolean emptyTable)
        {
            super(config, null, null, null, null, null, null);
            this.errorMsg = errorMsg;
            this.emptyTable = emptyTable;
        }

        @Override
        public RunRecord run(GranuleScene scene, Path workDir) throws IOException
        {
            Files.createDirectories(workDir);
            Path results = workDir.resolve(RESULTS_FILE);
            try (InputStream in = GqaPipelineTest.class.getResourceAsStream(RESULTS_FIXTURE)) {
                Files.copy(in, results, StandardCopyOption.REPLACE_EXISTING);
            }
            if (emptyTable) {
                List<String> lines = Files.readAllLines(results);
                Files.write(results, lines.subList(0, 22));
            }
            RunRecord record = new RunRecord("gverify", List.of(25.0, 25.0), "2000-08-22T00:00:00+00:00",
                                             "/refs/090/081/LE70900812000235ASA00_B3.TIF", scene.getGranule(),
                                             errorMsg);
            record.write(workDir.resolve(RunRecord.FILE_NAME));
            return record;
        }
    }

    static GranuleScene scene(String granule)
    {
        Footprint footprint = Footprint.fromCorners(new double[] { 147.0, -30.0 }, new double[] { 148.0, -30.0 },
                                                    new double[] { 148.0, -31.0 }, new double[] { 147.0, -31.0 });
        return new GranuleScene(granule, "SENTINEL_2A", OffsetDateTime.parse("2016-01-01T00:55:12Z"), footprint,
                                new SceneBand("4", Paths.get("B04.tif")), new SceneBand("2", Paths.get("B02.tif")));
    }

    static GqaPipeline pipeline(GqaConfig config, CorrelationRunner runner)
    {
        return new GqaPipeline(config, runner, new ResultParser(),
                               new RobustStatisticsEngine(config.getStatistics()),
                               new GqaReportAssembler(config.getStatistics().getPrecision()), new ReportWriter());
    }

    @Before
    public void setUp() throws IOException
    {
        workRoot = folder.newFolder("work").toPath();
        outDir = folder.getRoot().toPath().resolve("out");
    }

    @Test
    public void testFullReport() throws Exception
    {
        GqaConfig config = GqaConfig.defaults();
        GqaReport report = pipeline(config, new CannedRunner(config, "", false))
            .process(scene(GRANULE), workRoot, outDir);

        assertFalse(report.isNan());
        assertEquals(2, report.getFinalGcpCount());
        assertEquals(List.of(2, 2), report.getStatistics().getInlierCounts());
        assertEquals(0.41, report.getStatistics().getAbs().getX(), 0.0);
        assertEquals(0.31, report.getColors().get("near_infrared"), 0.0);

        Path published = outDir.resolve(GRANULE + ".gqa.yaml");
        assertTrue(Files.isRegularFile(published));
        assertFalse(Files.exists(workRoot.resolve(GRANULE).resolve(GqaPipeline.SCRATCH_DIRECTORY)
                                          .resolve(GRANULE + ".gqa.yaml")));
        assertTrue(Files.readString(published).contains("ref_source: GQA_v3"));
    }

    @Test
    public void testFailedRunGivesNanReport() throws Exception
    {
        GqaConfig config = GqaConfig.defaults();
        GqaReport report = pipeline(config, new CannedRunner(config, "No reference found for 090/081", false))
            .process(scene(GRANULE), workRoot, outDir);

        assertTrue(report.isNan());
        assertEquals("No reference found for 090/081", report.getErrorMessage());
        assertEquals(0, report.getFinalGcpCount());
        assertTrue(Double.isNaN(report.getStatistics().getMean().getX()));
        assertTrue(Files.isRegularFile(outDir.resolve(GRANULE + ".gqa.yaml")));
    }

    @Test
    public void testEmptyPointTable() throws Exception
    {
        GqaConfig config = GqaConfig.defaults();
        GqaReport report = pipeline(config, new CannedRunner(config, "", true))
            .process(scene(GRANULE), workRoot, outDir);

        assertTrue(report.isNan());
        assertEquals(NoGcpException.MESSAGE, report.getErrorMessage());
    }

    @Test
    public void testUnexpectedFailurePublishesNanReport() throws Exception
    {
        GqaConfig config = GqaConfig.defaults();
        CorrelationRunner broken = new CannedRunner(config, "", false) {
                @Override
                public RunRecord run(GranuleScene scene, Path workDir)
                {
                    throw new IllegalStateException("scratch disk vanished");
                }
            };

        try {
            pipeline(config, broken).process(scene(GRANULE), workRoot, outDir);
            fail("unexpected failure swallowed");
        }
        catch (GranuleProcessingException e) {
            assertEquals(GRANULE, e.getGranule());
            assertTrue(e.getCause() instanceof IllegalStateException);
        }

        String yaml = Files.readString(outDir.resolve(GRANULE + ".gqa.yaml"));
        assertTrue(yaml, yaml.contains("error_message: scratch disk vanished"));
        assertTrue(yaml, yaml.contains(".NaN"));
    }

    @Test
    public void testCleanupRemovesScratch() throws Exception
    {
        GqaConfig config = GqaConfig.fromJson(new JSONObject().put("gqa", new JSONObject().put("cleanup", true)));
        pipeline(config, new CannedRunner(config, "", false)).process(scene(GRANULE), workRoot, outDir);

        assertFalse(Files.exists(workRoot.resolve(GRANULE).resolve(GqaPipeline.SCRATCH_DIRECTORY)));
        assertTrue(Files.isRegularFile(outDir.resolve(GRANULE + ".gqa.yaml")));
    }

    @Test
    public void testReportNameFromConfig() throws Exception
    {
        GqaConfig config = GqaConfig.fromJson(
            new JSONObject().put("gqa", new JSONObject().put("output_yaml", "gqa_{granule}.yaml")));
        pipeline(config, new CannedRunner(config, "", false)).process(scene(GRANULE), workRoot, outDir);

        assertTrue(Files.isRegularFile(outDir.resolve("gqa_" + GRANULE + ".yaml")));
    }
}
