package com.thetalimited.gqa.stats;

import java.util.Collections;
import java.util.List;

/**
 * Residual statistics of one granule, in pixels.
 *
 * {@code mean} and {@code stddev} describe the points that passed the
 * correlation and outlier filter; the iterative values, the absolute mean
 * and CEP90 describe the final inlier set.
 */
public final class GqaStatistics
{
    private final int finalGcpCount;
    private final ResidualStatistics mean;
    private final ResidualStatistics stddev;
    private final ResidualStatistics iterativeMean;
    private final ResidualStatistics iterativeStddev;
    private final ResidualStatistics absIterativeMean;
    private final ResidualStatistics abs;
    private final double cep90;
    private final List<Integer> inlierCounts;

    public GqaStatistics(int finalGcpCount, ResidualStatistics mean, ResidualStatistics stddev,
                         ResidualStatistics iterativeMean, ResidualStatistics iterativeStddev,
                         ResidualStatistics absIterativeMean, ResidualStatistics abs, double cep90,
                         List<Integer> inlierCounts)
    {
        this.finalGcpCount = finalGcpCount;
        this.mean = mean;
        this.stddev = stddev;
        this.iterativeMean = iterativeMean;
        this.iterativeStddev = iterativeStddev;
        this.absIterativeMean = absIterativeMean;
        this.abs = abs;
        this.cep90 = cep90;
        this.inlierCounts = Collections.unmodifiableList(inlierCounts);
    }

    public int getFinalGcpCount() { return finalGcpCount; }
    public ResidualStatistics getMean() { return mean; }
    public ResidualStatistics getStddev() { return stddev; }
    public ResidualStatistics getIterativeMean() { return iterativeMean; }
    public ResidualStatistics getIterativeStddev() { return iterativeStddev; }
    public ResidualStatistics getAbsIterativeMean() { return absIterativeMean; }
    public ResidualStatistics getAbs() { return abs; }
    public double getCep90() { return cep90; }

    /**
     * Size of the point set after the correlation and outlier filter,
     * followed by its size after each refinement iteration.
     */
    public List<Integer> getInlierCounts() { return inlierCounts; }

    public GqaStatistics rounded(int precision)
    {
        return new GqaStatistics(finalGcpCount,
                                 mean.rounded(precision),
                                 stddev.rounded(precision),
                                 iterativeMean.rounded(precision),
                                 iterativeStddev.rounded(precision),
                                 absIterativeMean.rounded(precision),
                                 abs.rounded(precision),
                                 Rounding.round(cep90, precision),
                                 inlierCounts);
    }

    @Override
    public String toString()
    {
        return "final_gcp_count=" + finalGcpCount + " mean=" + mean + " stddev=" + stddev
            + " iterative_mean=" + iterativeMean + " iterative_stddev=" + iterativeStddev
            + " cep90=" + cep90;
    }
}
