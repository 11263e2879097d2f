package com.thetalimited.gqa.geotiff;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;

/**
 * Writes small single band float GeoTIFFs for tests.
 */
public final class GeoTiffFixture
{
    public static final int RASTER_PIXEL_IS_AREA = 1;

    private GeoTiffFixture()
    {
    }

    /**
     * @param values row major, {@code width * height} samples
     */
    public static void write(File file, int width, int height, float[] values, int epsg, boolean projected,
                             double originX, double originY, double scale, int rasterType)
        throws IOException
    {
        Rasters rasters = new Rasters(width, height, new FieldType[] { FieldType.FLOAT });
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rasters.setFirstPixelSample(x, y, values[y * width + x]);
            }
        }

        SortedSet<FileDirectoryEntry> entries = new TreeSet<>();
        entries.add(doubles(GeoTiffGeoreference.MODEL_PIXEL_SCALE_TAG, scale, scale, 0.0));
        entries.add(doubles(GeoTiffGeoreference.MODEL_TIEPOINT_TAG, 0.0, 0.0, 0.0, originX, originY, 0.0));

        List<Integer> geoKeys = new ArrayList<>(List.of(1, 1, 0, 3,
                                                        1024, 0, 1, projected ? 1 : 2,
                                                        GeoTiffGeoreference.RASTER_TYPE_KEY, 0, 1, rasterType));
        geoKeys.addAll(List.of(projected ? GeoTiffGeoreference.PROJECTED_CRS_KEY
                                         : GeoTiffGeoreference.GEOGRAPHIC_CRS_KEY, 0, 1, epsg));
        entries.add(new FileDirectoryEntry(FieldTagType.getById(GeoTiffGeoreference.GEOKEY_DIRECTORY_TAG),
                                           FieldType.SHORT, geoKeys.size(), geoKeys));

        FileDirectory directory = new FileDirectory(entries, rasters);
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(FieldType.FLOAT.getBits());
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);

        TiffWriter.writeTiff(file, new TIFFImage(directory));
    }

    private static FileDirectoryEntry doubles(int tag, Double... values)
    {
        return new FileDirectoryEntry(FieldTagType.getById(tag), FieldType.DOUBLE, values.length, List.of(values));
    }
}
