// GranuleManifest.java
// reads a granule description from JSON:
//
// {
//   "granule": "...",
//   "sensor": "SENTINEL_2A",
//   "acquisition_time": "2016-01-01T00:55:12Z",
//   "land_band":  { "band_id": "4", "path": "B04.tif" },
//   "ocean_band": { "band_id": "2", "path": "B02.tif" },
//   "footprint": [[lon, lat], [lon, lat], [lon, lat], [lon, lat]]   (optional; UL, UR, LR, LL)
// }
//
// relative band paths resolve against the manifest's directory; without a
// footprint the land band's georeferencing supplies the corners

package com.thetalimited.gqa;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import com.thetalimited.gqa.geotiff.GeoTiffGeoreference;
import com.thetalimited.gqa.reference.Footprint;

public final class GranuleManifest
{
    private GranuleManifest()
    {
    }

    public static GranuleScene load(Path manifest) throws IOException
    {
        String text = Files.readString(manifest, StandardCharsets.UTF_8);
        Path base = manifest.toAbsolutePath().getParent();
        try {
            return parse(new JSONObject(text), base);
        }
        catch (JSONException | DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed granule manifest " + manifest + ": " + e.getMessage(), e);
        }
    }

    public static GranuleScene parse(JSONObject json, Path base) throws IOException
    {
        String granule = json.getString("granule");
        String sensor = json.getString("sensor");
        OffsetDateTime acquired = OffsetDateTime.parse(json.getString("acquisition_time"));
        SceneBand land = band(json.getJSONObject("land_band"), base);
        SceneBand ocean = band(json.getJSONObject("ocean_band"), base);

        Footprint footprint;
        JSONArray corners = json.optJSONArray("footprint");
        if (corners != null) {
            if (corners.length() != 4) {
                throw new IllegalArgumentException("footprint needs 4 corners, got " + corners.length());
            }
            footprint = Footprint.fromCorners(lonLat(corners, 0), lonLat(corners, 1),
                                              lonLat(corners, 2), lonLat(corners, 3));
        }
        else {
            footprint = GeoTiffGeoreference.read(land.getPath()).footprint();
        }

        return new GranuleScene(granule, sensor, acquired, footprint, land, ocean);
    }

    private static SceneBand band(JSONObject json, Path base)
    {
        Path path = Paths.get(json.getString("path"));
        if (!path.isAbsolute() && base != null) {
            path = base.resolve(path);
        }
        return new SceneBand(json.get("band_id").toString(), path);
    }

    private static double[] lonLat(JSONArray corners, int i)
    {
        JSONArray corner = corners.getJSONArray(i);
        return new double[] { corner.getDouble(0), corner.getDouble(1) };
    }
}
