package com.thetalimited.gqa.reference;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.thetalimited.gqa.process.CommandException;

/**
 * Raster primitives used to reconcile reference images into one mosaic.
 */
public interface RasterOperations
{
    /**
     * Warps {@code source} into the coordinate system and pixel size of
     * {@code template}, writing {@code destination}.
     */
    void reproject(Path source, ReferenceImageRecord template, Path destination)
        throws IOException, CommandException;

    /**
     * Combines the images into a single virtual mosaic at {@code destination};
     * the value 0 is no-data in inputs and output.
     */
    void buildMosaic(List<Path> images, Path destination)
        throws IOException, CommandException;
}
