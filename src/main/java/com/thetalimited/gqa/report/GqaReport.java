// GqaReport.java
// the per-granule GQA document; the same keys are present whether the
// statistics were computed or replaced by NaN

package com.thetalimited.gqa.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import com.thetalimited.gqa.correlation.RunRecord;
import com.thetalimited.gqa.stats.GqaStatistics;
import com.thetalimited.gqa.stats.ResidualStatistics;

public final class GqaReport
{
    public static final String NO_ERRORS = "no errors";

    static final String GLS_MARKER = "GLS2000_GCP_SCENE";

    private final RunRecord runRecord;
    private final Provenance provenance;
    private final GqaStatistics statistics;
    private final Map<String, Double> colors;
    private final String errorMessage;

    GqaReport(RunRecord runRecord, Provenance provenance, GqaStatistics statistics, Map<String, Double> colors,
              String errorMessage)
    {
        this.runRecord = runRecord;
        this.provenance = provenance;
        this.statistics = statistics;
        this.colors = Collections.unmodifiableMap(new LinkedHashMap<>(colors));
        this.errorMessage = errorMessage;
    }

    public String getGranule() { return runRecord.getGranule(); }
    public int getFinalGcpCount() { return statistics.getFinalGcpCount(); }
    public GqaStatistics getStatistics() { return statistics; }
    public Map<String, Double> getColors() { return colors; }
    public String getErrorMessage() { return errorMessage; }
    public Provenance getProvenance() { return provenance; }

    public boolean isNan()
    {
        return !NO_ERRORS.equals(errorMessage);
    }

    /**
     * Version of the reference archive a path belongs to; empty for no path.
     */
    public static String referenceSource(String refSourcePath)
    {
        if (refSourcePath == null || refSourcePath.isEmpty()) {
            return "";
        }
        return refSourcePath.contains(GLS_MARKER) ? "GLS_v1" : "GQA_v3";
    }

    public Map<String, Object> toMap()
    {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("software_versions", provenance.softwareVersions());
        doc.put("system_information", provenance.systemInformation());
        doc.put("granule", runRecord.getGranule());
        doc.put("ref_source_path", runRecord.getRefSourcePath());
        doc.put("ref_source", referenceSource(runRecord.getRefSourcePath()));
        doc.put("ref_date", runRecord.getRefDate());
        doc.put("final_gcp_count", statistics.getFinalGcpCount());
        doc.put("error_message", errorMessage);

        Map<String, Object> residual = new LinkedHashMap<>();
        residual.put("mean", point(statistics.getMean()));
        residual.put("stddev", point(statistics.getStddev()));
        residual.put("iterative_mean", point(statistics.getIterativeMean()));
        residual.put("iterative_stddev", point(statistics.getIterativeStddev()));
        residual.put("abs_iterative_mean", point(statistics.getAbsIterativeMean()));
        residual.put("abs", point(statistics.getAbs()));
        residual.put("cep90", statistics.getCep90());
        doc.put("residual", residual);

        doc.put("colors", new LinkedHashMap<>(colors));
        return doc;
    }

    public String toYaml()
    {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(4);
        return new Yaml(options).dump(toMap());
    }

    private static Map<String, Object> point(ResidualStatistics stat)
    {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("x", stat.getX());
        p.put("y", stat.getY());
        p.put("xy", stat.getXy());
        return p;
    }
}
