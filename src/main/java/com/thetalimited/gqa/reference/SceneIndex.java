// SceneIndex.java
// vector index of the reference archive's tile footprints, read from a
// GeoJSON FeatureCollection whose features carry integer PATH and ROW
// properties; only Polygon and MultiPolygon geometries are used

package com.thetalimited.gqa.reference;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SceneIndex
{
    private static final Logger LOG = LoggerFactory.getLogger(SceneIndex.class);

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private final List<Tile> tiles;

    private SceneIndex(List<Tile> tiles)
    {
        this.tiles = Collections.unmodifiableList(tiles);
    }

    public static SceneIndex load(Path geojson) throws IOException
    {
        String text = Files.readString(geojson, StandardCharsets.UTF_8);
        try {
            SceneIndex index = parse(new JSONObject(text));
            LOG.debug("Loaded {} scene index tiles from {}", index.size(), geojson);
            return index;
        }
        catch (JSONException e) {
            throw new IllegalArgumentException("Malformed scene index " + geojson + ": " + e.getMessage(), e);
        }
    }

    public static SceneIndex parse(JSONObject featureCollection)
    {
        List<Tile> tiles = new ArrayList<>();
        JSONArray features = featureCollection.getJSONArray("features");
        for (int i = 0; i < features.length(); i++) {
            JSONObject feature = features.getJSONObject(i);
            JSONObject properties = feature.getJSONObject("properties");
            SceneIndexEntry entry = new SceneIndexEntry(properties.getInt("PATH"), properties.getInt("ROW"));
            tiles.add(new Tile(entry, toGeometry(feature.getJSONObject("geometry"))));
        }
        return new SceneIndex(tiles);
    }

    /**
     * Path/rows of every tile whose geometry intersects the footprint, in
     * index order.
     */
    public List<SceneIndexEntry> intersecting(Footprint footprint)
    {
        List<SceneIndexEntry> result = new ArrayList<>();
        for (Tile tile : tiles) {
            if (footprint.intersects(tile.geometry)) {
                result.add(tile.entry);
            }
        }
        return result;
    }

    public int size() { return tiles.size(); }

    private static Geometry toGeometry(JSONObject geometry)
    {
        String type = geometry.getString("type");
        JSONArray coordinates = geometry.getJSONArray("coordinates");
        switch (type) {
        case "Polygon":
            return toPolygon(coordinates);
        case "MultiPolygon":
            Polygon[] parts = new Polygon[coordinates.length()];
            for (int i = 0; i < parts.length; i++) {
                parts[i] = toPolygon(coordinates.getJSONArray(i));
            }
            return GEOMETRY_FACTORY.createMultiPolygon(parts);
        default:
            throw new IllegalArgumentException("Unsupported scene index geometry " + type);
        }
    }

    private static Polygon toPolygon(JSONArray rings)
    {
        LinearRing shell = toRing(rings.getJSONArray(0));
        LinearRing[] holes = new LinearRing[rings.length() - 1];
        for (int i = 1; i < rings.length(); i++) {
            holes[i - 1] = toRing(rings.getJSONArray(i));
        }
        return GEOMETRY_FACTORY.createPolygon(shell, holes);
    }

    private static LinearRing toRing(JSONArray positions)
    {
        Coordinate[] coords = new Coordinate[positions.length()];
        for (int i = 0; i < coords.length; i++) {
            JSONArray position = positions.getJSONArray(i);
            coords[i] = new Coordinate(position.getDouble(0), position.getDouble(1));
        }
        return GEOMETRY_FACTORY.createLinearRing(coords);
    }

    private static final class Tile
    {
        final SceneIndexEntry entry;
        final Geometry geometry;

        Tile(SceneIndexEntry entry, Geometry geometry)
        {
            this.entry = entry;
            this.geometry = geometry;
        }
    }
}
