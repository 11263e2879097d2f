package com.thetalimited.gqa;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One standardised band of a granule: its band id and the GeoTIFF holding it.
 */
public final class SceneBand
{
    private final String bandId;
    private final Path path;

    public SceneBand(String bandId, Path path)
    {
        this.bandId = Objects.requireNonNull(bandId, "bandId");
        this.path = Objects.requireNonNull(path, "path");
    }

    public String getBandId() { return bandId; }
    public Path getPath() { return path; }

    @Override
    public String toString()
    {
        return "band " + bandId + " (" + path + ")";
    }
}
