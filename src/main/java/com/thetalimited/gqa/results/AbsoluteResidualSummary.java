package com.thetalimited.gqa.results;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Absolute residuals gverify computed over its own point set, one row per
 * axis.
 */
public final class AbsoluteResidualSummary extends ResidualTable
{
    public AbsoluteResidualSummary(Map<String, Double> rows)
    {
        super(rows);
    }

    /**
     * Rows keyed by axis: the cleaned label's last '_' token, e.g. "x".
     */
    public Map<String, Double> byAxis()
    {
        Map<String, Double> axes = new LinkedHashMap<>();
        for (Map.Entry<String, Double> row : asMap().entrySet()) {
            String cleaned = cleanName(row.getKey());
            axes.put(cleaned.substring(cleaned.lastIndexOf('_') + 1), row.getValue());
        }
        return axes;
    }

    public double axis(String axis)
    {
        Double value = byAxis().get(axis);
        if (value == null) {
            throw new IllegalArgumentException("No absolute residual for axis " + axis + " in " + this);
        }
        return value;
    }
}
