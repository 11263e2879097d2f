// Footprint.java
// lon/lat polygon of a scene built from its four corners

package com.thetalimited.gqa.reference;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

public final class Footprint
{
    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private final Polygon polygon;

    private Footprint(Polygon polygon)
    {
        this.polygon = polygon;
    }

    /**
     * Builds the footprint from corner coordinates given as {lon, lat} pairs.
     *
     * @param ul upper left
     * @param ur upper right
     * @param lr lower right
     * @param ll lower left
     */
    public static Footprint fromCorners(double[] ul, double[] ur, double[] lr, double[] ll)
    {
        Coordinate[] ring = new Coordinate[] {
            toCoordinate(ul), toCoordinate(ur), toCoordinate(lr), toCoordinate(ll), toCoordinate(ul)
        };
        return new Footprint(GEOMETRY_FACTORY.createPolygon(ring));
    }

    public boolean intersects(Geometry other)
    {
        return polygon.intersects(other);
    }

    public Polygon getPolygon() { return polygon; }

    private static Coordinate toCoordinate(double[] lonLat)
    {
        if (lonLat == null || lonLat.length < 2) {
            throw new IllegalArgumentException("Corner must be a {lon, lat} pair");
        }
        return new Coordinate(lonLat[0], lonLat[1]);
    }

    @Override
    public String toString()
    {
        return polygon.toText();
    }
}
