package org.broadinstitute.fastproject.tools.signatures.scoring;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.exceptions.UserException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Ways of collapsing the normalized values of a signature's genes into one score per sample.
 *
 * <p>
 *     All methods receive the normalized data, the row index and sign of each signature gene present in the data,
 *     the zero mask of the un-normalized data and an optional weight matrix (missing weights count as 1).
 * </p>
 */
public enum ScoringMethod {
    /** Mean of sign * x. */
    NAIVE("naive") {
        @Override
        double scoreSample(final RealMatrix data, final int[] rows, final double[] signs, final boolean[][] zeros,
                           final RealMatrix weights, final double[] nonzeroMeans, final int sample) {
            double sum = 0;
            for (int g = 0; g < rows.length; g++) {
                sum += signs[g] * data.getEntry(rows[g], sample);
            }
            return sum / rows.length;
        }
    },
    /** Sum of sign * w * x divided by the sum of w. */
    WEIGHTED_AVG("weighted_avg") {
        @Override
        double scoreSample(final RealMatrix data, final int[] rows, final double[] signs, final boolean[][] zeros,
                           final RealMatrix weights, final double[] nonzeroMeans, final int sample) {
            double sum = 0;
            double totalWeight = 0;
            for (int g = 0; g < rows.length; g++) {
                final double w = weight(weights, rows[g], sample);
                sum += signs[g] * w * data.getEntry(rows[g], sample);
                totalWeight += w;
            }
            return totalWeight > 0 ? sum / totalWeight : 0.0;
        }
    },
    /** Mean of sign * (w * x + (1 - w) * mu), mu being the gene's mean over its originally nonzero entries. */
    IMPUTED("imputed") {
        @Override
        boolean needsNonzeroMeans() {
            return true;
        }

        @Override
        double scoreSample(final RealMatrix data, final int[] rows, final double[] signs, final boolean[][] zeros,
                           final RealMatrix weights, final double[] nonzeroMeans, final int sample) {
            double sum = 0;
            for (int g = 0; g < rows.length; g++) {
                final double w = weight(weights, rows[g], sample);
                sum += signs[g] * (w * data.getEntry(rows[g], sample) + (1 - w) * nonzeroMeans[g]);
            }
            return sum / rows.length;
        }
    },
    /** Mean of sign * x over the entries that were nonzero before normalization; 0 when there are none. */
    ONLY_NONZERO("only_nonzero") {
        @Override
        double scoreSample(final RealMatrix data, final int[] rows, final double[] signs, final boolean[][] zeros,
                           final RealMatrix weights, final double[] nonzeroMeans, final int sample) {
            double sum = 0;
            int count = 0;
            for (int g = 0; g < rows.length; g++) {
                if (!zeros[rows[g]][sample]) {
                    sum += signs[g] * data.getEntry(rows[g], sample);
                    count++;
                }
            }
            return count > 0 ? sum / count : 0.0;
        }
    };

    private final String methodName;

    ScoringMethod(final String methodName) {
        this.methodName = methodName;
    }

    public String getMethodName() {
        return methodName;
    }

    /**
     * Scores every sample.
     * @param rows row index in {@code data} of each signature gene
     * @param signs sign of each signature gene, parallel to {@code rows}
     * @param zeros zero mask of the un-normalized data, same shape as {@code data}
     * @param weights per-entry weights or {@code null}
     */
    public double[] score(final RealMatrix data, final int[] rows, final double[] signs,
                          final boolean[][] zeros, final RealMatrix weights) {
        final double[] nonzeroMeans = needsNonzeroMeans() ? nonzeroMeans(data, rows, zeros) : null;
        final double[] result = new double[data.getColumnDimension()];
        for (int j = 0; j < result.length; j++) {
            result[j] = scoreSample(data, rows, signs, zeros, weights, nonzeroMeans, j);
        }
        return result;
    }

    boolean needsNonzeroMeans() {
        return false;
    }

    abstract double scoreSample(RealMatrix data, int[] rows, double[] signs, boolean[][] zeros,
                                RealMatrix weights, double[] nonzeroMeans, int sample);

    private static double weight(final RealMatrix weights, final int row, final int sample) {
        return weights == null ? 1.0 : weights.getEntry(row, sample);
    }

    private static double[] nonzeroMeans(final RealMatrix data, final int[] rows, final boolean[][] zeros) {
        final double[] result = new double[rows.length];
        for (int g = 0; g < rows.length; g++) {
            double sum = 0;
            int count = 0;
            for (int j = 0; j < data.getColumnDimension(); j++) {
                if (!zeros[rows[g]][j]) {
                    sum += data.getEntry(rows[g], j);
                    count++;
                }
            }
            result[g] = count > 0 ? sum / count : 0.0;
        }
        return result;
    }

    /**
     * @throws UserException.BadArgumentValue if {@code name} is not a known method name.
     */
    public static ScoringMethod fromName(final String argumentName, final String name) {
        for (final ScoringMethod method : values()) {
            if (method.methodName.equals(name)) {
                return method;
            }
        }
        throw new UserException.BadArgumentValue(argumentName, String.valueOf(name), "Expected one of " + names());
    }

    public static String names() {
        return Arrays.stream(values()).map(ScoringMethod::getMethodName).collect(Collectors.joining(", "));
    }
}
