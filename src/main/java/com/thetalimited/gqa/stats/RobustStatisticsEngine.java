// RobustStatisticsEngine.java
// residual statistics of a gverify point table:
//
//  1. keep points with correlation > threshold and outlier flag 1
//  2. residuals to pixels: x / x_res, y / y_res
//  3. mean and sample standard deviation per axis (the "original" values)
//  4. for each iteration keep the points with
//       |x - mean_x| < k * std_x  and  |y - mean_y| < k * std_y
//     and recompute mean and standard deviation
//  5. CEP90: 0.9 quantile of sqrt(x^2 + y^2) over the final points
//
// empty point sets give NaN statistics, never an exception

package com.thetalimited.gqa.stats;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.gqa.GqaConfig.StatisticsSettings;
import com.thetalimited.gqa.results.AbsoluteResidualSummary;
import com.thetalimited.gqa.results.CorrelationPoint;
import com.thetalimited.gqa.results.CorrelationResults;

public class RobustStatisticsEngine
{
    private static final Logger LOG = LoggerFactory.getLogger(RobustStatisticsEngine.class);

    static final double CEP_QUANTILE = 90.0;

    private final double correlationThreshold;
    private final double stddevMultiplier;
    private final int iterations;

    public RobustStatisticsEngine(StatisticsSettings settings)
    {
        this(settings.getCorrelationCoefficient(), settings.getStandardDeviations(), settings.getIterations());
    }

    public RobustStatisticsEngine(double correlationThreshold, double stddevMultiplier, int iterations)
    {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must not be negative, got " + iterations);
        }
        this.correlationThreshold = correlationThreshold;
        this.stddevMultiplier = stddevMultiplier;
        this.iterations = iterations;
    }

    public GqaStatistics compute(CorrelationResults results, double[] resolution)
    {
        return compute(results.getPoints(), results.getAbsolute(), resolution);
    }

    /**
     * @param resolution reference pixel size {x, y}, positive
     */
    public GqaStatistics compute(List<CorrelationPoint> points, AbsoluteResidualSummary absolute,
                                 double[] resolution)
    {
        double xRes = resolution[0];
        double yRes = resolution[1];

        List<double[]> subset = new ArrayList<>();
        for (CorrelationPoint point : points) {
            if (point.getCorrelation() > correlationThreshold && point.isReliable()) {
                subset.add(new double[] { point.getXResidual() / xRes, point.getYResidual() / yRes });
            }
        }

        List<Integer> counts = new ArrayList<>();
        counts.add(subset.size());

        Moments original = Moments.of(subset);
        Moments current = original;

        for (int i = 0; i < iterations; i++) {
            List<double[]> kept = new ArrayList<>();
            for (double[] r : subset) {
                // NaN on either side fails the comparison and drops the point
                if (Math.abs(r[0] - current.mean.getX()) < stddevMultiplier * current.stddev.getX()
                    && Math.abs(r[1] - current.mean.getY()) < stddevMultiplier * current.stddev.getY()) {
                    kept.add(r);
                }
            }
            subset = kept;
            counts.add(subset.size());
            current = Moments.of(subset);
        }

        double[] radial = new double[subset.size()];
        double[] absX = new double[subset.size()];
        double[] absY = new double[subset.size()];
        for (int i = 0; i < radial.length; i++) {
            double[] r = subset.get(i);
            radial[i] = Math.sqrt(r[0] * r[0] + r[1] * r[1]);
            absX[i] = Math.abs(r[0]);
            absY[i] = Math.abs(r[1]);
        }

        double cep90 = quantile90(radial);
        ResidualStatistics absMean = ResidualStatistics.of(StatUtils.mean(absX), StatUtils.mean(absY));
        ResidualStatistics abs = ResidualStatistics.of(absolute.axis("x"), absolute.axis("y"));

        LOG.debug("GCP counts through refinement {}, CEP90 {}", counts, cep90);
        return new GqaStatistics(subset.size(), original.mean, original.stddev, current.mean, current.stddev,
                                 absMean, abs, cep90, counts);
    }

    /**
     * 0.9 quantile with linear interpolation between order statistics
     * (R-7); NaN for no values.
     */
    static double quantile90(double[] values)
    {
        if (values.length == 0) {
            return Double.NaN;
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(values, CEP_QUANTILE);
    }

    /**
     * Sample standard deviation (n - 1 denominator); NaN below two values.
     */
    static double sampleStddev(double[] values)
    {
        if (values.length < 2) {
            return Double.NaN;
        }
        return new StandardDeviation(true).evaluate(values);
    }

    private static final class Moments
    {
        final ResidualStatistics mean;
        final ResidualStatistics stddev;

        private Moments(ResidualStatistics mean, ResidualStatistics stddev)
        {
            this.mean = mean;
            this.stddev = stddev;
        }

        static Moments of(List<double[]> residuals)
        {
            double[] xs = new double[residuals.size()];
            double[] ys = new double[residuals.size()];
            for (int i = 0; i < xs.length; i++) {
                xs[i] = residuals.get(i)[0];
                ys[i] = residuals.get(i)[1];
            }
            // StatUtils.mean is NaN for an empty array
            return new Moments(ResidualStatistics.of(StatUtils.mean(xs), StatUtils.mean(ys)),
                               ResidualStatistics.of(sampleStddev(xs), sampleStddev(ys)));
        }
    }
}
