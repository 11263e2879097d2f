package com.thetalimited.gqa.results;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Label to residual rows in the order gverify printed them.
 */
public abstract class ResidualTable
{
    private final Map<String, Double> rows;

    ResidualTable(Map<String, Double> rows)
    {
        this.rows = Collections.unmodifiableMap(new LinkedHashMap<>(rows));
    }

    public Map<String, Double> asMap() { return rows; }

    public int size() { return rows.size(); }

    /**
     * Trims, lower-cases and joins inner whitespace with '_', so
     * "Absolute Residual X" becomes "absolute_residual_x".
     */
    public static String cleanName(String label)
    {
        return label.strip().toLowerCase().replaceAll("\\s+", "_");
    }

    @Override
    public String toString()
    {
        return rows.toString();
    }
}
