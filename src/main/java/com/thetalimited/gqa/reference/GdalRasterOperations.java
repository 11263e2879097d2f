// GdalRasterOperations.java
// RasterOperations on top of the GDAL command line utilities

package com.thetalimited.gqa.reference;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.thetalimited.gqa.process.CommandException;
import com.thetalimited.gqa.process.CommandRunner;

public class GdalRasterOperations implements RasterOperations
{
    private final CommandRunner runner;
    private final Map<String, String> environment;

    public GdalRasterOperations(CommandRunner runner)
    {
        this(runner, Collections.emptyMap());
    }

    public GdalRasterOperations(CommandRunner runner, Map<String, String> environment)
    {
        this.runner = runner;
        this.environment = Map.copyOf(environment);
    }

    @Override
    public void reproject(Path source, ReferenceImageRecord template, Path destination)
        throws IOException, CommandException
    {
        double[] res = template.getKey().absoluteResolution();
        List<String> command = List.of(
            "gdalwarp", "-overwrite",
            "-t_srs", template.getKey().getCrs(),
            "-tr", Double.toString(res[0]), Double.toString(res[1]),
            "-r", "bilinear",
            "-srcnodata", "0", "-dstnodata", "0",
            source.toAbsolutePath().toString(),
            destination.toAbsolutePath().toString());
        runner.run(command, workDirOf(destination), environment, CommandRunner.NO_TIMEOUT);
    }

    @Override
    public void buildMosaic(List<Path> images, Path destination)
        throws IOException, CommandException
    {
        List<String> command = new ArrayList<>(List.of(
            "gdalbuildvrt", "-srcnodata", "0", "-vrtnodata", "0",
            destination.toAbsolutePath().toString()));
        for (Path image : images) {
            command.add(image.toAbsolutePath().toString());
        }
        runner.run(command, workDirOf(destination), environment, CommandRunner.NO_TIMEOUT);
    }

    private static Path workDirOf(Path destination)
    {
        return destination.toAbsolutePath().getParent();
    }
}
