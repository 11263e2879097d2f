package com.thetalimited.gqa;

import java.time.OffsetDateTime;
import java.util.Objects;

import com.thetalimited.gqa.reference.Footprint;

/**
 * Everything the pipeline needs to know about one granule.
 */
public final class GranuleScene
{
    private final String granule;
    private final String sensor;
    private final OffsetDateTime acquisitionTime;
    private final Footprint footprint;
    private final SceneBand landBand;
    private final SceneBand oceanBand;

    public GranuleScene(String granule, String sensor, OffsetDateTime acquisitionTime, Footprint footprint,
                        SceneBand landBand, SceneBand oceanBand)
    {
        this.granule = Objects.requireNonNull(granule, "granule");
        this.sensor = Objects.requireNonNull(sensor, "sensor");
        this.acquisitionTime = Objects.requireNonNull(acquisitionTime, "acquisitionTime");
        this.footprint = Objects.requireNonNull(footprint, "footprint");
        this.landBand = Objects.requireNonNull(landBand, "landBand");
        this.oceanBand = Objects.requireNonNull(oceanBand, "oceanBand");
    }

    public String getGranule() { return granule; }
    public String getSensor() { return sensor; }
    public OffsetDateTime getAcquisitionTime() { return acquisitionTime; }
    public Footprint getFootprint() { return footprint; }
    public SceneBand getLandBand() { return landBand; }
    public SceneBand getOceanBand() { return oceanBand; }

    @Override
    public String toString()
    {
        return granule + " [" + sensor + " " + acquisitionTime + "]";
    }
}
