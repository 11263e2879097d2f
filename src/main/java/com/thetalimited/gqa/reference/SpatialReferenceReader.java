package com.thetalimited.gqa.reference;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the coordinate system and pixel size of a raster file.
 */
public interface SpatialReferenceReader
{
    ReferenceImageRecord read(Path raster) throws IOException;
}
