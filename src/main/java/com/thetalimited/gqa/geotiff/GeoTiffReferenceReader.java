package com.thetalimited.gqa.geotiff;

import java.io.IOException;
import java.nio.file.Path;

import com.thetalimited.gqa.reference.ReferenceImageRecord;
import com.thetalimited.gqa.reference.SpatialReferenceReader;

/**
 * Spatial reference of GeoTIFF reference images.
 */
public class GeoTiffReferenceReader implements SpatialReferenceReader
{
    @Override
    public ReferenceImageRecord read(Path raster) throws IOException
    {
        return new ReferenceImageRecord(raster, GeoTiffGeoreference.read(raster).toKey());
    }
}
