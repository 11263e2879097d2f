package com.thetalimited.gqa.report;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.gqa.StageResult;
import com.thetalimited.gqa.correlation.RunRecord;
import com.thetalimited.gqa.results.ColorResidualSummary;
import com.thetalimited.gqa.results.ResidualTable;
import com.thetalimited.gqa.stats.GqaStatistics;
import com.thetalimited.gqa.stats.ResidualStatistics;
import com.thetalimited.gqa.stats.Rounding;

/**
 * Builds the report of a granule from the outcome of its statistics stage.
 * A failed stage gives the NaN report: zero GCPs, every residual NaN, no
 * colours, and the captured failure as error message.
 */
public class GqaReportAssembler
{
    private static final Logger LOG = LoggerFactory.getLogger(GqaReportAssembler.class);

    private final int precision;
    private final Clock clock;

    public GqaReportAssembler(int precision)
    {
        this(precision, Clock.systemUTC());
    }

    public GqaReportAssembler(int precision, Clock clock)
    {
        this.precision = precision;
        this.clock = clock;
    }

    /**
     * @param colors colour residuals of the parsed results; ignored when the stage failed
     */
    public GqaReport assemble(RunRecord record, StageResult<GqaStatistics> outcome, ColorResidualSummary colors)
    {
        if (outcome.isSuccess()) {
            return full(record, outcome.getValue(), colors);
        }
        return nan(record, outcome.getFailure());
    }

    public GqaReport full(RunRecord record, GqaStatistics statistics, ColorResidualSummary colors)
    {
        Map<String, Double> cleaned = new LinkedHashMap<>();
        for (Map.Entry<String, Double> row : colors.asMap().entrySet()) {
            cleaned.put(ResidualTable.cleanName(row.getKey()), Rounding.round(row.getValue(), precision));
        }
        return new GqaReport(record, provenance(record), statistics.rounded(precision), cleaned,
                             GqaReport.NO_ERRORS);
    }

    public GqaReport nan(RunRecord record, String errorMessage)
    {
        LOG.debug("Writing NaNs for residuals of {}: {}", record.getGranule(), errorMessage);
        ResidualStatistics nan = ResidualStatistics.nan();
        GqaStatistics statistics = new GqaStatistics(0, nan, nan, nan, nan, nan, nan, Double.NaN, List.of());
        return new GqaReport(record, provenance(record), statistics, Map.of(), errorMessage);
    }

    private Provenance provenance(RunRecord record)
    {
        return Provenance.capture(record.getExecutable(), clock);
    }
}
