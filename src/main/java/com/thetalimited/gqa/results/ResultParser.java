// ResultParser.java
// reads the fixed layout image-gverify.res file (0 based line numbers):
//
//   3-4    absolute residuals, "<label>=<value>"
//   6-10   colour residuals, "<colour> <value>"
//   22-    one GCP per line, 10 whitespace separated columns:
//          point id, chip, line, sample, map x, map y,
//          correlation, y residual, x residual, outlier flag

package com.thetalimited.gqa.results;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.gqa.StageResult;

public class ResultParser
{
    private static final Logger LOG = LoggerFactory.getLogger(ResultParser.class);

    static final int ABSOLUTE_FIRST_LINE = 3;
    static final int ABSOLUTE_ROWS = 2;
    static final int COLOR_FIRST_LINE = 6;
    static final int COLOR_ROWS = 5;
    static final int POINTS_FIRST_LINE = 22;
    static final int POINT_COLUMNS = 10;

    /**
     * Parse failures that mean "no usable GCPs" come back as a failed
     * result; a malformed file still throws.
     */
    public StageResult<CorrelationResults> read(Path resultsFile) throws IOException
    {
        try {
            return StageResult.success(parse(resultsFile));
        }
        catch (NoGcpException e) {
            LOG.warn("gverify results contain no tabulated data: {}", resultsFile);
            return StageResult.failure(NoGcpException.MESSAGE);
        }
    }

    public CorrelationResults parse(Path resultsFile) throws IOException, NoGcpException
    {
        if (!Files.isRegularFile(resultsFile)) {
            throw new NoGcpException("missing " + resultsFile);
        }
        List<String> lines = Files.readAllLines(resultsFile, StandardCharsets.UTF_8);
        return parse(lines, resultsFile.toString());
    }

    CorrelationResults parse(List<String> lines, String source) throws NoGcpException
    {
        if (lines.size() <= POINTS_FIRST_LINE) {
            throw new NoGcpException(source + " has no point table");
        }

        Map<String, Double> absolute = new LinkedHashMap<>();
        for (int i = ABSOLUTE_FIRST_LINE; i < ABSOLUTE_FIRST_LINE + ABSOLUTE_ROWS; i++) {
            String line = lines.get(i);
            int eq = line.indexOf('=');
            if (eq < 0) {
                throw malformed(source, i, "expected <label>=<value>");
            }
            absolute.put(line.substring(0, eq).strip(), number(line.substring(eq + 1), source, i));
        }

        Map<String, Double> colors = new LinkedHashMap<>();
        for (int i = COLOR_FIRST_LINE; i < COLOR_FIRST_LINE + COLOR_ROWS; i++) {
            String line = lines.get(i).strip();
            int split = lastWhitespace(line);
            if (split < 0) {
                throw malformed(source, i, "expected <colour> <value>");
            }
            colors.put(line.substring(0, split).strip(), number(line.substring(split + 1), source, i));
        }

        List<CorrelationPoint> points = new ArrayList<>();
        for (int i = POINTS_FIRST_LINE; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) {
                continue;
            }
            String[] c = line.split("\\s+");
            if (c.length != POINT_COLUMNS) {
                throw malformed(source, i, "expected " + POINT_COLUMNS + " columns, got " + c.length);
            }
            points.add(new CorrelationPoint(c[0],
                                            (int) number(c[1], source, i),
                                            number(c[2], source, i),
                                            number(c[3], source, i),
                                            number(c[4], source, i),
                                            number(c[5], source, i),
                                            number(c[6], source, i),
                                            number(c[7], source, i),
                                            number(c[8], source, i),
                                            (int) number(c[9], source, i)));
        }

        if (points.isEmpty()) {
            throw new NoGcpException(source + " has an empty point table");
        }

        LOG.debug("Parsed {} GCPs from {}", points.size(), source);
        return new CorrelationResults(new ColorResidualSummary(colors), new AbsoluteResidualSummary(absolute),
                                      points);
    }

    private static int lastWhitespace(String line)
    {
        for (int i = line.length() - 1; i >= 0; i--) {
            if (Character.isWhitespace(line.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static double number(String text, String source, int line)
    {
        try {
            return Double.parseDouble(text.strip());
        }
        catch (NumberFormatException e) {
            throw malformed(source, line, "not a number: '" + text.strip() + "'");
        }
    }

    private static IllegalArgumentException malformed(String source, int line, String detail)
    {
        return new IllegalArgumentException(source + " line " + (line + 1) + ": " + detail);
    }
}
