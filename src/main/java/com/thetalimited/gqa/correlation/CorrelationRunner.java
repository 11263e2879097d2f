// CorrelationRunner.java
// prepares and runs gverify for one granule inside its scratch directory:
//
//   land granule:   land band, dense grid of candidate points (-g)
//   ocean granule:  ocean band, known GCPs of the intersecting path/rows
//
// expected failures (no reference, bad input, missing file, gverify
// failing or timing out) end up in the RunRecord's error message; the
// record is written in every case

package com.thetalimited.gqa.correlation;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import mil.nga.tiff.util.TiffException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.gqa.GqaConfig;
import com.thetalimited.gqa.GranuleScene;
import com.thetalimited.gqa.SceneBand;
import com.thetalimited.gqa.geotiff.BandExtractor;
import com.thetalimited.gqa.process.CommandException;
import com.thetalimited.gqa.process.CommandRunner;
import com.thetalimited.gqa.reference.MosaicBuilder;
import com.thetalimited.gqa.reference.ReferenceImageryResolver;
import com.thetalimited.gqa.reference.ResolutionException;
import com.thetalimited.gqa.reference.ResolvedReference;
import com.thetalimited.gqa.reference.SceneIndexEntry;

public class CorrelationRunner
{
    private static final Logger LOG = LoggerFactory.getLogger(CorrelationRunner.class);

    public static final String RESULTS_FILE = "image-gverify.res";
    public static final String SOURCE_BAND_FILE = "source.tif";

    private final GqaConfig config;
    private final ReferenceImageryResolver resolver;
    private final MosaicBuilder mosaicBuilder;
    private final TileClassifier classifier;
    private final GcpCollector gcpCollector;
    private final BandExtractor bandExtractor;
    private final CommandRunner commandRunner;
    private final CorrelationCommand command;

    public CorrelationRunner(GqaConfig config, ReferenceImageryResolver resolver, MosaicBuilder mosaicBuilder,
                             TileClassifier classifier, GcpCollector gcpCollector, BandExtractor bandExtractor,
                             CommandRunner commandRunner)
    {
        this.config = config;
        this.resolver = resolver;
        this.mosaicBuilder = mosaicBuilder;
        this.classifier = classifier;
        this.gcpCollector = gcpCollector;
        this.bandExtractor = bandExtractor;
        this.commandRunner = commandRunner;
        this.command = new CorrelationCommand(config.getCorrelation());
    }

    public RunRecord run(GranuleScene scene, Path workDir) throws IOException
    {
        Files.createDirectories(workDir);
        Path resultsFile = workDir.resolve(RESULTS_FILE);

        String errorMsg = "";
        OffsetDateTime refDate = null;
        String refSourcePath = "";
        List<Double> resolution = new ArrayList<>();

        RunRecord record;
        try {
            List<SceneIndexEntry> scenes = resolver.intersecting(scene.getFootprint());

            SceneBand band;
            List<String> mode;
            if (classifier.isLand(scene.getGranule())) {
                band = scene.getLandBand();
                mode = CorrelationCommand.gridMode(config.getCorrelation().getGridSize());
            }
            else {
                band = scene.getOceanBand();
                Path points = workDir.resolve(GcpCollector.POINTS_FILE);
                long count = gcpCollector.collect(config.getReferences().getRootFixQaLocation(), scenes, points);
                LOG.debug("{} is an ocean tile, {} fixed GCPs collected", scene.getGranule(), count);
                mode = CorrelationCommand.fixedLocationMode(points);
            }

            Path sourceBand = workDir.resolve(SOURCE_BAND_FILE);
            bandExtractor.extract(band.getPath(), sourceBand);

            ResolvedReference reference = resolver.resolve(scenes, scene.getAcquisitionTime(),
                                                           band.getBandId(), scene.getSensor());
            refDate = reference.getReferenceDate();
            refSourcePath = reference.getSourcePath().toString();
            for (double r : reference.getResolution()) {
                resolution.add(r);
            }

            Path mosaic = mosaicBuilder.build(reference.getImages(), workDir);

            List<String> arguments = command.arguments(mosaic, sourceBand, workDir, mode);
            LOG.info("Running gverify for {}", scene.getGranule());
            commandRunner.run(arguments, workDir, command.environment(System.getenv()),
                              config.getCorrelation().getTimeoutSeconds());
        }
        catch (ResolutionException | CommandException | IllegalArgumentException | TiffException
               | NoSuchFileException | FileNotFoundException e) {
            errorMsg = e.getMessage() == null || e.getMessage().isEmpty() ? e.toString() : e.getMessage();
            LOG.warn("gverify was not executed for {} because: {}", scene.getGranule(), errorMsg);
            // a half written results file must never be parsed
            Files.deleteIfExists(resultsFile);
        }
        finally {
            record = new RunRecord(config.getCorrelation().getExecutable(), resolution,
                                             RunRecord.formatDate(refDate), refSourcePath,
                                             scene.getGranule(), errorMsg);
            record.write(workDir.resolve(RunRecord.FILE_NAME));
        }

        return record;
    }
}
