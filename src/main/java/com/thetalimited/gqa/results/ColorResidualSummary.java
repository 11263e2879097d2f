package com.thetalimited.gqa.results;

import java.util.Map;

/**
 * Residual per colour band, five rows.
 */
public final class ColorResidualSummary extends ResidualTable
{
    public ColorResidualSummary(Map<String, Double> rows)
    {
        super(rows);
    }
}
