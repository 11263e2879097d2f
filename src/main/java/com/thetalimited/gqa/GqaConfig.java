// GqaConfig.java
// configuration for one GQA run; built-in defaults come from the
// gqa-defaults.json classpath resource and a user JSON file is merged
// over the top of them

package com.thetalimited.gqa;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import com.thetalimited.gqa.reference.GeographicDomain;

public final class GqaConfig
{
    public static final String DEFAULTS_RESOURCE = "/gqa-defaults.json";

    // resampling codes understood by gverify -r
    public static final List<String> RESAMPLING_CODES = List.of("NN", "BI", "CI");

    private final CorrelationSettings correlation;
    private final ReferenceSettings references;
    private final BandMaps bandMaps;
    private final StatisticsSettings statistics;

    private GqaConfig(JSONObject root)
    {
        try {
            this.correlation = new CorrelationSettings(root.getJSONObject("gverify"));
            this.references = new ReferenceSettings(root.getJSONObject("references"));
            this.bandMaps = new BandMaps(root.getJSONObject("band_maps"));
            this.statistics = new StatisticsSettings(root.getJSONObject("gqa"));
        }
        catch (JSONException e) {
            throw new IllegalArgumentException("Invalid GQA configuration: " + e.getMessage(), e);
        }
    }

    public static GqaConfig defaults()
    {
        return new GqaConfig(readDefaults());
    }

    public static GqaConfig load(Path configFile) throws IOException
    {
        String text = Files.readString(configFile, StandardCharsets.UTF_8);
        return fromJson(new JSONObject(text));
    }

    // overrides are merged key by key over the defaults
    public static GqaConfig fromJson(JSONObject overrides)
    {
        JSONObject merged = readDefaults();
        deepMerge(merged, overrides);
        return new GqaConfig(merged);
    }

    public CorrelationSettings getCorrelation() { return correlation; }
    public ReferenceSettings getReferences() { return references; }
    public BandMaps getBandMaps() { return bandMaps; }
    public StatisticsSettings getStatistics() { return statistics; }

    private static JSONObject readDefaults()
    {
        try (InputStream in = GqaConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return new JSONObject(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    private static void deepMerge(JSONObject target, JSONObject source)
    {
        for (String key : source.keySet()) {
            Object value = source.get(key);
            if (value instanceof JSONObject && target.optJSONObject(key) != null) {
                deepMerge(target.getJSONObject(key), (JSONObject) value);
            }
            else {
                target.put(key, value);
            }
        }
    }

    private static int positive(JSONObject json, String key)
    {
        int value = json.getInt(key);
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
        return value;
    }

    private static double unitInterval(JSONObject json, String key)
    {
        double value = json.getDouble(key);
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(key + " must lie in [0, 1], got " + value);
        }
        return value;
    }

    /**
     * Settings for the external gverify correlation tool.
     */
    public static final class CorrelationSettings
    {
        private final String executable;
        private final String ldLibraryPath;
        private final String gdalData;
        private final String geotiffCsv;
        private final int pyramidLevels;
        private final int threadCount;
        private final double nullValue;
        private final int chipSize;
        private final int gridSize;
        private final double correlationCoefficient;
        private final String resampling;
        private final long timeoutSeconds;

        CorrelationSettings(JSONObject json)
        {
            executable = json.getString("executable");
            if (executable.isEmpty()) {
                throw new IllegalArgumentException("gverify executable must not be empty");
            }
            ldLibraryPath = json.optString("ld_library_path", "");
            gdalData = json.optString("gdal_data", "");
            geotiffCsv = json.optString("geotiff_csv", "");
            pyramidLevels = positive(json, "pyramid_levels");
            threadCount = positive(json, "thread_count");
            nullValue = json.getDouble("null_value");
            chipSize = positive(json, "chip_size");
            gridSize = positive(json, "grid_size");
            correlationCoefficient = unitInterval(json, "correlation_coefficient");
            resampling = json.getString("resampling");
            if (!RESAMPLING_CODES.contains(resampling)) {
                throw new IllegalArgumentException("resampling must be one of " + RESAMPLING_CODES
                                                   + ", got " + resampling);
            }
            timeoutSeconds = positive(json, "timeout_seconds");
        }

        public String getExecutable() { return executable; }
        public String getLdLibraryPath() { return ldLibraryPath; }
        public String getGdalData() { return gdalData; }
        public String getGeotiffCsv() { return geotiffCsv; }
        public int getPyramidLevels() { return pyramidLevels; }
        public int getThreadCount() { return threadCount; }
        public double getNullValue() { return nullValue; }
        public int getChipSize() { return chipSize; }
        public int getGridSize() { return gridSize; }
        public double getCorrelationCoefficient() { return correlationCoefficient; }
        public String getResampling() { return resampling; }
        public long getTimeoutSeconds() { return timeoutSeconds; }
    }

    /**
     * Where reference imagery, the scene index and the fixed GCP lists live.
     */
    public static final class ReferenceSettings
    {
        private final String sceneIndex;
        private final String oceanTileList;
        private final String rootFixQaLocation;
        private final List<Path> directories;
        private final Pattern extensions;
        private final GeographicDomain domain;

        ReferenceSettings(JSONObject json)
        {
            sceneIndex = json.optString("scene_index", "");
            oceanTileList = json.optString("ocean_tile_list", "");
            rootFixQaLocation = json.optString("root_fix_qa_location", "");

            JSONArray dirs = json.getJSONArray("directories");
            List<Path> paths = new ArrayList<>();
            for (int i = 0; i < dirs.length(); i++) {
                paths.add(Paths.get(dirs.getString(i)));
            }
            directories = Collections.unmodifiableList(paths);

            extensions = Pattern.compile(json.getString("extensions"), Pattern.CASE_INSENSITIVE);

            JSONObject d = json.getJSONObject("domain");
            domain = new GeographicDomain(d.getInt("min_path"), d.getInt("max_path"),
                                          d.getInt("min_row"), d.getInt("max_row"));
        }

        public Path getSceneIndex() { return required("scene_index", sceneIndex); }
        public Path getOceanTileList() { return required("ocean_tile_list", oceanTileList); }
        public Path getRootFixQaLocation() { return required("root_fix_qa_location", rootFixQaLocation); }
        public List<Path> getDirectories() { return directories; }
        public Pattern getExtensions() { return extensions; }
        public GeographicDomain getDomain() { return domain; }

        private static Path required(String key, String value)
        {
            if (value.isEmpty()) {
                throw new IllegalStateException("references." + key + " is not configured");
            }
            return Paths.get(value);
        }
    }

    /**
     * Translation of an acquisition band id into the band token embedded in
     * reference file names, for the primary and backup naming conventions.
     */
    public static final class BandMaps
    {
        // reference satellite -> sensor tag -> band id -> band token
        private final Map<String, Map<String, Map<String, String>>> primary = new HashMap<>();
        // sensor tag -> band id -> band token
        private final Map<String, Map<String, String>> backup = new HashMap<>();

        BandMaps(JSONObject json)
        {
            JSONObject p = json.getJSONObject("primary");
            for (String satellite : p.keySet()) {
                JSONObject sensors = p.getJSONObject(satellite);
                Map<String, Map<String, String>> bySensor = new HashMap<>();
                for (String sensor : sensors.keySet()) {
                    bySensor.put(sensor, toStringMap(sensors.getJSONObject(sensor)));
                }
                primary.put(satellite, bySensor);
            }

            JSONObject b = json.getJSONObject("backup");
            for (String sensor : b.keySet()) {
                backup.put(sensor, toStringMap(b.getJSONObject(sensor)));
            }
        }

        public String primaryBand(String referenceSatellite, String sensor, String bandId)
        {
            Map<String, Map<String, String>> bySensor = primary.get(referenceSatellite);
            if (bySensor == null || !bySensor.containsKey(sensor)) {
                return null;
            }
            return bySensor.get(sensor).get(bandId);
        }

        public String backupBand(String sensor, String bandId)
        {
            Map<String, String> bands = backup.get(sensor);
            return bands == null ? null : bands.get(bandId);
        }

        private static Map<String, String> toStringMap(JSONObject json)
        {
            Map<String, String> map = new HashMap<>();
            for (String key : json.keySet()) {
                map.put(key, json.getString(key));
            }
            return map;
        }
    }

    /**
     * Parameters of the iterative GQA statistics and the report.
     */
    public static final class StatisticsSettings
    {
        private final double correlationCoefficient;
        private final double standardDeviations;
        private final int iterations;
        private final int precision;
        private final String outputYaml;
        private final boolean cleanup;

        StatisticsSettings(JSONObject json)
        {
            correlationCoefficient = unitInterval(json, "correlation_coefficient");
            standardDeviations = json.getDouble("standard_deviations");
            if (!(standardDeviations > 0.0)) {
                throw new IllegalArgumentException("standard_deviations must be positive, got "
                                                   + standardDeviations);
            }
            iterations = json.getInt("iterations");
            if (iterations < 0) {
                throw new IllegalArgumentException("iterations must not be negative, got " + iterations);
            }
            precision = json.getInt("precision");
            if (precision < 0) {
                throw new IllegalArgumentException("precision must not be negative, got " + precision);
            }
            outputYaml = json.getString("output_yaml");
            if (!outputYaml.contains("{granule}")) {
                throw new IllegalArgumentException("output_yaml must contain {granule}: " + outputYaml);
            }
            cleanup = json.getBoolean("cleanup");
        }

        public double getCorrelationCoefficient() { return correlationCoefficient; }
        public double getStandardDeviations() { return standardDeviations; }
        public int getIterations() { return iterations; }
        public int getPrecision() { return precision; }
        public boolean isCleanup() { return cleanup; }

        public String reportFileName(String granule)
        {
            return outputYaml.replace("{granule}", granule);
        }
    }

} // GqaConfig
