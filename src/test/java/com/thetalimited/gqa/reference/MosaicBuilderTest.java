package com.thetalimited.gqa.reference;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

public class MosaicBuilderTest
{
    private static final SpatialReferenceKey UTM55 = new SpatialReferenceKey("EPSG:32755", 25.0, -25.0);
    private static final SpatialReferenceKey UTM54 = new SpatialReferenceKey("EPSG:32754", 25.0, -25.0);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static final class RecordingOperations implements RasterOperations
    {
        final List<String> calls = new ArrayList<>();
        List<Path> mosaicInputs;

        @Override
        public void reproject(Path source, ReferenceImageRecord template, Path destination)
        {
            calls.add("reproject " + source.getFileName() + " onto " + template.getFile().getFileName()
                      + " -> " + destination.getParent().getFileName() + "/" + destination.getFileName());
        }

        @Override
        public void buildMosaic(List<Path> images, Path destination)
        {
            calls.add("mosaic " + destination.getFileName());
            mosaicInputs = images;
        }
    }

    @Test
    public void testMinorityImagesAreReprojected() throws Exception
    {
        Path workDir = folder.getRoot().toPath();
        RecordingOperations operations = new RecordingOperations();
        // reprojected files come back on the majority key
        SpatialReferenceReader reader = file -> new ReferenceImageRecord(file, UTM55);

        List<ReferenceImageRecord> images = List.of(
            new ReferenceImageRecord(Paths.get("/ref/a.tif"), UTM54),
            new ReferenceImageRecord(Paths.get("/ref/b.tif"), UTM55),
            new ReferenceImageRecord(Paths.get("/ref/c.tif"), UTM55));

        Path mosaic = new MosaicBuilder(operations, reader).build(images, workDir);

        assertEquals(workDir.resolve("reference.vrt"), mosaic);
        assertTrue(Files.isDirectory(workDir.resolve("reprojected_references")));
        assertEquals(List.of("reproject a.tif onto b.tif -> reprojected_references/a.tif", "mosaic reference.vrt"),
                     operations.calls);
        assertEquals(List.of(workDir.resolve("reprojected_references").resolve("a.tif").toAbsolutePath(),
                             Paths.get("/ref/b.tif").toAbsolutePath(),
                             Paths.get("/ref/c.tif").toAbsolutePath()),
                     operations.mosaicInputs);
    }

    @Test
    public void testSingleSystemNeedsNoReprojection() throws Exception
    {
        RecordingOperations operations = new RecordingOperations();
        SpatialReferenceReader reader = file -> {
            throw new AssertionError("nothing to read back");
        };

        new MosaicBuilder(operations, reader).build(
            List.of(new ReferenceImageRecord(Paths.get("/ref/b.tif"), UTM55)), folder.getRoot().toPath());

        assertEquals(List.of("mosaic reference.vrt"), operations.calls);
    }
}
