// SpatialReferenceKey.java
// coordinate system + pixel size of a reference image; two images with
// the same key can share a mosaic without reprojection

package com.thetalimited.gqa.reference;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class SpatialReferenceKey
{
    private final String crs;        // e.g. "EPSG:32755"
    private final double xResolution;
    private final double yResolution;

    public SpatialReferenceKey(String crs, double xResolution, double yResolution)
    {
        this.crs = Objects.requireNonNull(crs, "crs");
        this.xResolution = xResolution;
        this.yResolution = yResolution;
    }

    public String getCrs() { return crs; }
    public double getXResolution() { return xResolution; }
    public double getYResolution() { return yResolution; }

    /**
     * Pixel size as positive {x, y} values, the units residuals are
     * converted with.
     */
    public double[] absoluteResolution()
    {
        return new double[] { Math.abs(xResolution), Math.abs(yResolution) };
    }

    /**
     * Most frequent key among the records. Ties go to the key encountered
     * first.
     */
    public static SpatialReferenceKey mostCommon(Collection<ReferenceImageRecord> records)
    {
        if (records.isEmpty()) {
            throw new IllegalArgumentException("No reference images to vote on");
        }
        Map<SpatialReferenceKey, Integer> counts = new LinkedHashMap<>();
        for (ReferenceImageRecord record : records) {
            counts.merge(record.getKey(), 1, Integer::sum);
        }

        SpatialReferenceKey best = null;
        int bestCount = 0;
        for (Map.Entry<SpatialReferenceKey, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpatialReferenceKey)) {
            return false;
        }
        SpatialReferenceKey other = (SpatialReferenceKey) o;
        return crs.equals(other.crs)
            && Double.compare(xResolution, other.xResolution) == 0
            && Double.compare(yResolution, other.yResolution) == 0;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(crs, xResolution, yResolution);
    }

    @Override
    public String toString()
    {
        return crs + " (" + xResolution + ", " + yResolution + ")";
    }
}
