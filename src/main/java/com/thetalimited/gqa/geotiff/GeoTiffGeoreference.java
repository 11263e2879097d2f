// GeoTiffGeoreference.java
// georeferencing of a GeoTIFF: size, pixel scale, tie point and the
// horizontal CRS from the GeoKey directory; corners can be transformed
// to WGS84 lon/lat with proj4j
//
// EPSG:4326 is WGS84 geographic
// EPSG:326zz / 327zz are WGS84 UTM north / south zone zz

package com.thetalimited.gqa.geotiff;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;

import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;

import com.thetalimited.gqa.reference.Footprint;
import com.thetalimited.gqa.reference.SpatialReferenceKey;

public final class GeoTiffGeoreference
{
    static final int MODEL_PIXEL_SCALE_TAG = 33550;
    static final int MODEL_TIEPOINT_TAG = 33922;
    static final int GEOKEY_DIRECTORY_TAG = 34735;

    // GeoKey ids
    static final int RASTER_TYPE_KEY = 1025;       // GTRasterTypeGeoKey
    static final int GEOGRAPHIC_CRS_KEY = 2048;    // GeographicTypeGeoKey
    static final int PROJECTED_CRS_KEY = 3072;     // ProjectedCSTypeGeoKey

    static final int RASTER_PIXEL_IS_POINT = 2;

    public static final String WGS84 = "EPSG:4326";

    private final int width, height;
    private final double pixelScaleX, pixelScaleY;
    private final double originX, originY;  // outer corner of pixel (0,0)
    private final String horizontalCRS;

    private GeoTiffGeoreference(int width, int height, double pixelScaleX, double pixelScaleY,
                                double originX, double originY, String horizontalCRS)
    {
        this.width = width;
        this.height = height;
        this.pixelScaleX = pixelScaleX;
        this.pixelScaleY = pixelScaleY;
        this.originX = originX;
        this.originY = originY;
        this.horizontalCRS = horizontalCRS;
    }

    public static GeoTiffGeoreference read(Path file) throws IOException
    {
        TIFFImage tiffImage = TiffReader.readTiff(file.toFile());
        return fromDirectory(tiffImage.getFileDirectories().get(0), file.toFile());
    }

    static GeoTiffGeoreference fromDirectory(FileDirectory directory, File source)
    {
        List<Double> modelPixelScale = getTagValues(directory, MODEL_PIXEL_SCALE_TAG, Double.class);
        if (modelPixelScale == null || modelPixelScale.size() < 2) {
            throw new IllegalArgumentException(source + ": ModelPixelScaleTag not found or invalid");
        }
        List<Double> modelTiepoints = getTagValues(directory, MODEL_TIEPOINT_TAG, Double.class);
        if (modelTiepoints == null || modelTiepoints.size() < 6) {
            throw new IllegalArgumentException(source + ": ModelTiepointTag not found or invalid");
        }
        List<Integer> geoKeyDirectory = getTagValues(directory, GEOKEY_DIRECTORY_TAG, Integer.class);
        String horizontalCRS = geoKeyDirectory == null ? null : extractHorizontalCRS(geoKeyDirectory);
        if (horizontalCRS == null) {
            throw new IllegalArgumentException(source + ": no geographic or projected CRS in GeoKey directory");
        }

        double pixelScaleX = modelPixelScale.get(0);
        double pixelScaleY = modelPixelScale.get(1);

        // tie point (I,J,K) -> (X,Y,Z); walk back to pixel (0,0)
        double originX = modelTiepoints.get(3) - modelTiepoints.get(0) * pixelScaleX;
        double originY = modelTiepoints.get(4) + modelTiepoints.get(1) * pixelScaleY;

        // PixelIsPoint: the tie point refers to the pixel centre
        if (geoKeyValue(geoKeyDirectory, RASTER_TYPE_KEY) == RASTER_PIXEL_IS_POINT) {
            originX -= pixelScaleX / 2.0;
            originY += pixelScaleY / 2.0;
        }

        return new GeoTiffGeoreference(directory.getImageWidth().intValue(),
                                       directory.getImageHeight().intValue(),
                                       pixelScaleX, pixelScaleY, originX, originY, horizontalCRS);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public double getPixelScaleX() { return pixelScaleX; }
    public double getPixelScaleY() { return pixelScaleY; }
    public String getHorizontalCRS() { return horizontalCRS; }

    public SpatialReferenceKey toKey()
    {
        return new SpatialReferenceKey(horizontalCRS, pixelScaleX, pixelScaleY);
    }

    /**
     * Outer corners in the native CRS, in the order UL, UR, LR, LL, each
     * as {x, y}.
     */
    public double[][] nativeCorners()
    {
        double ulX = originX;
        double ulY = originY;
        double lrX = originX + width * pixelScaleX;
        double lrY = originY - height * pixelScaleY;
        return new double[][] { {ulX, ulY}, {lrX, ulY}, {lrX, lrY}, {ulX, lrY} };
    }

    /**
     * Corners as WGS84 {lon, lat}, order UL, UR, LR, LL.
     */
    public double[][] wgs84Corners()
    {
        double[][] corners = nativeCorners();
        if (WGS84.equals(horizontalCRS)) {
            return corners;
        }

        CRSFactory crsFactory = new CRSFactory();
        CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
        CoordinateReferenceSystem tiffCRS = crsFactory.createFromName(horizontalCRS);
        CoordinateReferenceSystem wgs84CRS = crsFactory.createFromName(WGS84);
        CoordinateTransform transform = transformFactory.createTransform(tiffCRS, wgs84CRS);

        double[][] lonLat = new double[corners.length][];
        for (int i = 0; i < corners.length; i++) {
            ProjCoordinate src = new ProjCoordinate(corners[i][0], corners[i][1]);
            ProjCoordinate dst = new ProjCoordinate();
            transform.transform(src, dst);
            lonLat[i] = new double[] { dst.x, dst.y };
        }
        return lonLat;
    }

    public Footprint footprint()
    {
        double[][] c = wgs84Corners();
        return Footprint.fromCorners(c[0], c[1], c[2], c[3]);
    }

    /**
     * Extracts tag values from the FileDirectory as a List.  Pass in the expected
     * type that we want so we can avoid compiler and runtime warnings
     */
    static <T> List<T> getTagValues(FileDirectory directory, int tag, Class<T> type)
    {
        for (FileDirectoryEntry entry : directory.getEntries()) {
            if (entry.getFieldTag() == FieldTagType.getById(tag)) {
                Object values = entry.getValues();
                if (values instanceof List<?>) {
                    List<T> castedValues = new ArrayList<>();
                    for (Object item : (List<?>) values) {
                        if (type.isInstance(item)) {
                            castedValues.add(type.cast(item));
                        }
                    }
                    return castedValues;
                }
            }
        }
        return null;
    }

    // GeoKey directory: 4 header shorts then {keyId, location, count, value} quads
    static String extractHorizontalCRS(List<Integer> geoKeyDirectory)
    {
        int projected = geoKeyValue(geoKeyDirectory, PROJECTED_CRS_KEY);
        if (projected > 0) {
            return "EPSG:" + projected;
        }
        int geographic = geoKeyValue(geoKeyDirectory, GEOGRAPHIC_CRS_KEY);
        if (geographic > 0) {
            return "EPSG:" + geographic;
        }
        return null;
    }

    static int geoKeyValue(List<Integer> geoKeyDirectory, int keyId)
    {
        if (geoKeyDirectory == null) {
            return -1;
        }
        for (int i = 4; i + 3 < geoKeyDirectory.size(); i += 4) {
            // location 0 means the value is stored inline
            if (geoKeyDirectory.get(i) == keyId && geoKeyDirectory.get(i + 1) == 0) {
                return geoKeyDirectory.get(i + 3);
            }
        }
        return -1;
    }

} // GeoTiffGeoreference
