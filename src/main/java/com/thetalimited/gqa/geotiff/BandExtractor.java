// BandExtractor.java
// copies the first band of an upstream GeoTIFF into a standalone, deflate
// compressed float GeoTIFF for gverify, remapping the upstream no-data
// sentinel to the value gverify treats as null

package com.thetalimited.gqa.geotiff;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.SortedSet;
import java.util.TreeSet;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BandExtractor
{
    private static final Logger LOG = LoggerFactory.getLogger(BandExtractor.class);

    public static final double UPSTREAM_NODATA = -999.0;
    public static final double GVERIFY_NODATA = 0.0;

    // georeferencing tags carried over to the extracted band
    private static final int[] GEO_TAGS = {
        GeoTiffGeoreference.MODEL_PIXEL_SCALE_TAG,
        GeoTiffGeoreference.MODEL_TIEPOINT_TAG,
        GeoTiffGeoreference.GEOKEY_DIRECTORY_TAG,
        34736 // GeoDoubleParamsTag
    };

    /**
     * @return number of pixels remapped from the upstream no-data value
     */
    public long extract(Path source, Path destination) throws IOException
    {
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(source.toString());
        }

        TIFFImage tiffImage = TiffReader.readTiff(source.toFile());
        FileDirectory sourceDirectory = tiffImage.getFileDirectories().get(0);
        Rasters rasters = sourceDirectory.readRasters();
        if (rasters == null) {
            throw new IllegalArgumentException("No raster data found in " + source);
        }

        int width = rasters.getWidth();
        int height = rasters.getHeight();
        Rasters outputRasters = new Rasters(width, height, new FieldType[] { FieldType.FLOAT });

        long remapped = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double value = rasters.getFirstPixelSample(x, y).doubleValue();
                if (value == UPSTREAM_NODATA) {
                    value = GVERIFY_NODATA;
                    remapped++;
                }
                outputRasters.setFirstPixelSample(x, y, (float) value);
            }
        }

        // georeferencing carried over from the source, the rest is set below
        SortedSet<FileDirectoryEntry> entries = new TreeSet<>();
        for (FileDirectoryEntry entry : sourceDirectory.getEntries()) {
            for (int tag : GEO_TAGS) {
                if (entry.getFieldTag() == FieldTagType.getById(tag)) {
                    entries.add(entry);
                }
            }
        }

        FileDirectory outputDirectory = new FileDirectory(entries, outputRasters);
        outputDirectory.setImageWidth(width);
        outputDirectory.setImageHeight(height);
        outputDirectory.setBitsPerSample(FieldType.FLOAT.getBits());
        outputDirectory.setCompression(TiffConstants.COMPRESSION_DEFLATE);
        outputDirectory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        outputDirectory.setSamplesPerPixel(1);
        outputDirectory.setRowsPerStrip(outputRasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        outputDirectory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        outputDirectory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);

        TIFFImage outputTiff = new TIFFImage(outputDirectory);
        TiffWriter.writeTiff(destination.toFile(), outputTiff);

        LOG.debug("Extracted {}x{} band from {} into {}, {} no-data pixels remapped",
                  width, height, source, destination, remapped);
        return remapped;
    }

} // BandExtractor
