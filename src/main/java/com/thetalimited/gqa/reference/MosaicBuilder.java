// MosaicBuilder.java
// reconciles the resolved reference images to the majority coordinate
// system and pixel size and combines them into <workdir>/reference.vrt;
// images on another key are warped into <workdir>/reprojected_references

package com.thetalimited.gqa.reference;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.gqa.process.CommandException;

public class MosaicBuilder
{
    private static final Logger LOG = LoggerFactory.getLogger(MosaicBuilder.class);

    public static final String MOSAIC_FILE = "reference.vrt";
    public static final String REPROJECTED_DIRECTORY = "reprojected_references";

    private final RasterOperations operations;
    private final SpatialReferenceReader reader;

    public MosaicBuilder(RasterOperations operations, SpatialReferenceReader reader)
    {
        this.operations = operations;
        this.reader = reader;
    }

    /**
     * @return path of the virtual mosaic
     */
    public Path build(List<ReferenceImageRecord> images, Path workDir)
        throws IOException, CommandException
    {
        SpatialReferenceKey common = SpatialReferenceKey.mostCommon(images);
        LOG.info("Chosen reference CRS {}", common);

        // the first image carrying the majority key is the warp template
        ReferenceImageRecord template = null;
        for (ReferenceImageRecord image : images) {
            if (image.sharesReferenceWith(common)) {
                template = image;
                break;
            }
        }

        Path reprojectedDir = workDir.resolve(REPROJECTED_DIRECTORY);
        Files.createDirectories(reprojectedDir);

        List<Path> members = new ArrayList<>();
        for (ReferenceImageRecord image : images) {
            if (image.sharesReferenceWith(common)) {
                members.add(image.getFile().toAbsolutePath());
                continue;
            }
            Path out = reprojectedDir.resolve(image.getFile().getFileName());
            operations.reproject(image.getFile(), template, out);
            ReferenceImageRecord warped = reader.read(out);
            if (!warped.sharesReferenceWith(common)) {
                LOG.warn("Reprojected {} still on {}, expected {}", out, warped.getKey(), common);
            }
            members.add(out.toAbsolutePath());
        }

        Path mosaic = workDir.resolve(MOSAIC_FILE);
        operations.buildMosaic(members, mosaic);
        LOG.debug("Built {} from {}", mosaic, members);
        return mosaic;
    }
}
