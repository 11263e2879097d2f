// GqaPipeline.java
// one granule end to end:
//
//   CorrelationRunner -> ResultParser -> RobustStatisticsEngine -> GqaReportAssembler
//
// scratch files live in <workdir>/<granule>/gverify; the report is written
// there first and then moved to <outdir>/<report name>

package com.thetalimited.gqa;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.gqa.correlation.CorrelationRunner;
import com.thetalimited.gqa.correlation.GcpCollector;
import com.thetalimited.gqa.correlation.RunRecord;
import com.thetalimited.gqa.correlation.TileClassifier;
import com.thetalimited.gqa.geotiff.BandExtractor;
import com.thetalimited.gqa.geotiff.GeoTiffReferenceReader;
import com.thetalimited.gqa.process.CommandRunner;
import com.thetalimited.gqa.process.ProcessCommandRunner;
import com.thetalimited.gqa.reference.GdalRasterOperations;
import com.thetalimited.gqa.reference.MosaicBuilder;
import com.thetalimited.gqa.reference.ReferenceImageryResolver;
import com.thetalimited.gqa.reference.SceneIndex;
import com.thetalimited.gqa.reference.SpatialReferenceReader;
import com.thetalimited.gqa.report.GqaReport;
import com.thetalimited.gqa.report.GqaReportAssembler;
import com.thetalimited.gqa.report.ReportWriter;
import com.thetalimited.gqa.results.ColorResidualSummary;
import com.thetalimited.gqa.results.CorrelationResults;
import com.thetalimited.gqa.results.ResultParser;
import com.thetalimited.gqa.stats.GqaStatistics;
import com.thetalimited.gqa.stats.RobustStatisticsEngine;

public class GqaPipeline
{
    private static final Logger LOG = LoggerFactory.getLogger(GqaPipeline.class);

    public static final String SCRATCH_DIRECTORY = "gverify";

    private final GqaConfig config;
    private final CorrelationRunner runner;
    private final ResultParser parser;
    private final RobustStatisticsEngine engine;
    private final GqaReportAssembler assembler;
    private final ReportWriter writer;

    public GqaPipeline(GqaConfig config, CorrelationRunner runner, ResultParser parser,
                       RobustStatisticsEngine engine, GqaReportAssembler assembler, ReportWriter writer)
    {
        this.config = config;
        this.runner = runner;
        this.parser = parser;
        this.engine = engine;
        this.assembler = assembler;
        this.writer = writer;
    }

    /**
     * Wires the stages for real runs: GeoTIFF reference reading, GDAL
     * command line tools and the gverify subprocess.
     */
    public static GqaPipeline create(GqaConfig config) throws IOException
    {
        SceneIndex sceneIndex = SceneIndex.load(config.getReferences().getSceneIndex());
        TileClassifier classifier = TileClassifier.load(config.getReferences().getOceanTileList());
        CommandRunner commandRunner = new ProcessCommandRunner();
        SpatialReferenceReader reader = new GeoTiffReferenceReader();

        ReferenceImageryResolver resolver = new ReferenceImageryResolver(sceneIndex, config, reader);
        MosaicBuilder mosaicBuilder = new MosaicBuilder(new GdalRasterOperations(commandRunner), reader);
        CorrelationRunner runner = new CorrelationRunner(config, resolver, mosaicBuilder, classifier,
                                                         new GcpCollector(), new BandExtractor(), commandRunner);

        return new GqaPipeline(config, runner, new ResultParser(),
                               new RobustStatisticsEngine(config.getStatistics()),
                               new GqaReportAssembler(config.getStatistics().getPrecision()),
                               new ReportWriter());
    }

    public GqaReport process(GranuleScene scene, Path workRoot, Path outDir) throws GranuleProcessingException
    {
        String granule = scene.getGranule();
        Path scratch = workRoot.resolve(granule).resolve(SCRATCH_DIRECTORY);
        String reportName = config.getStatistics().reportFileName(granule);

        RunRecord record = null;
        GqaReport report;
        Exception unexpected = null;
        try {
            record = runner.run(scene, scratch);
            ColorResidualSummary colors = null;
            StageResult<GqaStatistics> statistics;
            if (record.isSuccess()) {
                StageResult<CorrelationResults> parsed = parser.read(scratch.resolve(CorrelationRunner.RESULTS_FILE));
                if (parsed.isSuccess()) {
                    colors = parsed.getValue().getColors();
                    statistics = StageResult.success(engine.compute(parsed.getValue(), record.resolution()));
                }
                else {
                    statistics = StageResult.failure(parsed.getFailure());
                }
            }
            else {
                statistics = StageResult.failure(record.getErrorMsg());
            }
            report = assembler.assemble(record, statistics, colors);
        }
        catch (IOException | RuntimeException e) {
            unexpected = e;
            String message = e.getMessage() == null ? e.toString() : e.getMessage();
            if (record == null) {
                record = RunRecord.failed(config.getCorrelation().getExecutable(), granule, message);
            }
            report = assembler.nan(record, message);
        }

        try {
            writer.publish(report, scratch.resolve(reportName), outDir.resolve(reportName));
        }
        catch (IOException e) {
            if (unexpected != null) {
                e.addSuppressed(unexpected);
            }
            throw new GranuleProcessingException(granule, e);
        }

        if (unexpected != null) {
            throw new GranuleProcessingException(granule, unexpected);
        }

        if (config.getStatistics().isCleanup()) {
            cleanup(scratch);
        }
        LOG.info("{}: {} GCPs, {}", granule, report.getFinalGcpCount(), report.getErrorMessage());
        return report;
    }

    static void cleanup(Path directory) throws GranuleProcessingException
    {
        LOG.debug("Cleaning up working directory {}", directory);
        try (Stream<Path> walk = Files.walk(directory)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path path : paths) {
                Files.delete(path);
            }
        }
        catch (IOException e) {
            throw new GranuleProcessingException(directory.toString(), e);
        }
    }
}
