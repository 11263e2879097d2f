package com.thetalimited.gqa.results;

import java.util.Collections;
import java.util.List;

/**
 * The three tables of a gverify results file.
 */
public final class CorrelationResults
{
    private final ColorResidualSummary colors;
    private final AbsoluteResidualSummary absolute;
    private final List<CorrelationPoint> points;

    public CorrelationResults(ColorResidualSummary colors, AbsoluteResidualSummary absolute,
                              List<CorrelationPoint> points)
    {
        this.colors = colors;
        this.absolute = absolute;
        this.points = Collections.unmodifiableList(points);
    }

    public ColorResidualSummary getColors() { return colors; }
    public AbsoluteResidualSummary getAbsolute() { return absolute; }
    public List<CorrelationPoint> getPoints() { return points; }

    @Override
    public String toString()
    {
        return points.size() + " points, colors " + colors + ", absolute " + absolute;
    }
}
