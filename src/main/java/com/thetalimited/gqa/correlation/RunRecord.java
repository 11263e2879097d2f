// RunRecord.java
// what a gverify run was given and how it ended; written as
// gverify_run.yaml next to the results whatever the outcome
//
//   executable:       gverify binary
//   ref_resolution:   [x, y] pixel size of the reference, empty when unresolved
//   ref_date:         ISO-8601 date of the first reference image, or ''
//   ref_source_path:  first reference image, or ''
//   granule:          granule id
//   error_msg:        '' on success

package com.thetalimited.gqa.correlation;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

public final class RunRecord
{
    public static final String FILE_NAME = "gverify_run.yaml";

    // 2000-08-22T00:00:00+00:00
    public static final DateTimeFormatter ISO_DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx");

    private final String executable;
    private final List<Double> refResolution;
    private final String refDate;
    private final String refSourcePath;
    private final String granule;
    private final String errorMsg;

    public RunRecord(String executable, List<Double> refResolution, String refDate, String refSourcePath,
                     String granule, String errorMsg)
    {
        this.executable = Objects.requireNonNull(executable, "executable");
        this.refResolution = List.copyOf(refResolution);
        this.refDate = Objects.requireNonNull(refDate, "refDate");
        this.refSourcePath = Objects.requireNonNull(refSourcePath, "refSourcePath");
        this.granule = Objects.requireNonNull(granule, "granule");
        this.errorMsg = Objects.requireNonNull(errorMsg, "errorMsg");
    }

    /**
     * Record of a run that failed before any reference was known.
     */
    public static RunRecord failed(String executable, String granule, String errorMsg)
    {
        return new RunRecord(executable, List.of(), "", "", granule, errorMsg);
    }

    public static String formatDate(OffsetDateTime date)
    {
        return date == null ? "" : ISO_DATE_TIME.format(date);
    }

    public String getExecutable() { return executable; }
    public List<Double> getRefResolution() { return refResolution; }
    public String getRefDate() { return refDate; }
    public String getRefSourcePath() { return refSourcePath; }
    public String getGranule() { return granule; }
    public String getErrorMsg() { return errorMsg; }

    public boolean isSuccess() { return errorMsg.isEmpty(); }

    /**
     * Reference pixel size as {x, y}.
     *
     * @throws IllegalStateException when the run never resolved a reference
     */
    public double[] resolution()
    {
        if (refResolution.size() != 2) {
            throw new IllegalStateException("No reference resolution recorded for " + granule);
        }
        return new double[] { refResolution.get(0), refResolution.get(1) };
    }

    public Map<String, Object> toMap()
    {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("executable", executable);
        map.put("ref_resolution", new ArrayList<>(refResolution));
        map.put("ref_date", refDate);
        map.put("ref_source_path", refSourcePath);
        map.put("granule", granule);
        map.put("error_msg", errorMsg);
        return map;
    }

    public void write(Path file) throws IOException
    {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(4);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            new Yaml(options).dump(toMap(), out);
        }
    }

    public static RunRecord read(Path file) throws IOException
    {
        Object loaded;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new IllegalArgumentException(file + " is not a run record");
        }
        Map<?, ?> map = (Map<?, ?>) loaded;

        List<Double> resolution = new ArrayList<>();
        Object res = map.get("ref_resolution");
        if (res instanceof List<?>) {
            for (Object value : (List<?>) res) {
                resolution.add(((Number) value).doubleValue());
            }
        }

        return new RunRecord(text(map, "executable"), resolution, text(map, "ref_date"),
                             text(map, "ref_source_path"), text(map, "granule"), text(map, "error_msg"));
    }

    private static String text(Map<?, ?> map, String key)
    {
        Object value = map.get(key);
        return value == null ? "" : value.toString();
    }

    @Override
    public String toString()
    {
        return toMap().toString();
    }
}
