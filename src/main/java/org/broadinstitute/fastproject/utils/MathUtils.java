package org.broadinstitute.fastproject.utils;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.util.FastMath;

import java.util.Arrays;
import java.util.Collection;

/**
 * MathUtils is a static class (no instantiation allowed!) with some useful math methods.
 */
public final class MathUtils {

    /**
     * Scale factor that makes the median absolute deviation a consistent estimator of the standard deviation
     * under normality.
     */
    public static final double MAD_NORMAL_SCALE = 1.4826;

    private static final double ROOT_TWO_PI = Math.sqrt(2.0 * Math.PI);

    private MathUtils() { }

    public static double sum(final double[] values) {
        Utils.nonNull(values);
        double s = 0.0;
        for (double v : values)
            s += v;
        return s;
    }

    public static double mean(final double[] values) {
        Utils.nonNull(values);
        Utils.validateArg(values.length > 0, "cannot take the mean of an empty array");
        return sum(values) / values.length;
    }

    /**
     * Population variance (denominator n).
     */
    public static double variance(final double[] values) {
        final double mean = mean(values);
        double s = 0.0;
        for (final double v : values) {
            s += square(v - mean);
        }
        return s / values.length;
    }

    public static double median(final double[] values) {
        Utils.nonNull(values);
        Utils.validateArg(values.length > 0, "cannot take the median of an empty array");
        return new Median().evaluate(values);
    }

    public static double median(final Collection<Double> values) {
        Utils.nonEmpty(values, "cannot take the median of a collection with no values.");
        return median(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /**
     * Unscaled median absolute deviation around the median.
     */
    public static double medianAbsoluteDeviation(final double[] values) {
        final double median = median(values);
        return median(Arrays.stream(values).map(v -> Math.abs(v - median)).toArray());
    }

    public static double square(final double x) {
        return x * x;
    }

    public static double distanceSquared(final double[] x, final double[] y) {
        Utils.nonNull(x);
        Utils.nonNull(y);
        Utils.validateArg(x.length == y.length, "arrays must have the same length");
        double result = 0.0;
        for (int i = 0; i < x.length; i++) {
            result += square(x[i] - y[i]);
        }
        return result;
    }

    /**
     * Calculate f(x) = Normal(x | mu = mean, sigma = sd)
     */
    public static double normalDistribution(final double mean, final double sd, final double x) {
        Utils.validateArg(Double.isFinite(mean) && Double.isFinite(sd) && Double.isFinite(x),
                          "mean, sd, or, x : Normal parameters must be well formatted (non-INF, non-NAN)");
        return Math.exp(-(x - mean) * (x - mean) / (2.0 * sd * sd)) / (sd * ROOT_TWO_PI);
    }

    /**
     * Logistic function 1 / (1 + exp(-x)), evaluated without overflow for large |x|.
     */
    public static double logistic(final double x) {
        if (x >= 0) {
            return 1.0 / (1.0 + FastMath.exp(-x));
        }
        final double e = FastMath.exp(x);
        return e / (1.0 + e);
    }

    public static double[] rowMeans(final RealMatrix matrix) {
        Utils.nonNull(matrix);
        final double[] result = new double[matrix.getRowDimension()];
        for (int i = 0; i < result.length; i++) {
            result[i] = mean(matrix.getRow(i));
        }
        return result;
    }

    /**
     * Population standard deviation of each row.
     */
    public static double[] rowStandardDeviations(final RealMatrix matrix) {
        Utils.nonNull(matrix);
        final double[] result = new double[matrix.getRowDimension()];
        for (int i = 0; i < result.length; i++) {
            result[i] = Math.sqrt(variance(matrix.getRow(i)));
        }
        return result;
    }

    public static double[] columnMeans(final RealMatrix matrix) {
        Utils.nonNull(matrix);
        final double[] result = new double[matrix.getColumnDimension()];
        for (int j = 0; j < result.length; j++) {
            result[j] = mean(matrix.getColumn(j));
        }
        return result;
    }
}
