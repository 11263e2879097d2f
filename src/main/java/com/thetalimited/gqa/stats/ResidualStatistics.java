package com.thetalimited.gqa.stats;

/**
 * A per-axis statistic with its composite: xy is the Euclidean norm of x
 * and y.
 */
public final class ResidualStatistics
{
    private final double x;
    private final double y;
    private final double xy;

    private ResidualStatistics(double x, double y, double xy)
    {
        this.x = x;
        this.y = y;
        this.xy = xy;
    }

    public static ResidualStatistics of(double x, double y)
    {
        return new ResidualStatistics(x, y, Math.sqrt(x * x + y * y));
    }

    public static ResidualStatistics nan()
    {
        return new ResidualStatistics(Double.NaN, Double.NaN, Double.NaN);
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getXy() { return xy; }

    public ResidualStatistics rounded(int precision)
    {
        return new ResidualStatistics(Rounding.round(x, precision), Rounding.round(y, precision),
                                      Rounding.round(xy, precision));
    }

    @Override
    public String toString()
    {
        return "{x=" + x + ", y=" + y + ", xy=" + xy + "}";
    }
}
