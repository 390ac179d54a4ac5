package org.broadinstitute.fastproject.tools.signatures.scoring;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Normalizations applied to a genes x samples matrix before scoring signatures.
 *
 * <p>
 *     Z-scores use the population standard deviation. Where it is zero the values are centered but not scaled.
 *     Row-wise methods accept reference row statistics so that additional samples can be normalized
 *     exactly as the samples the statistics were computed on.
 * </p>
 */
public enum NormalizationMethod {
    NONE("none") {
        @Override
        public RealMatrix normalize(final RealMatrix data, final double[] rowMeans, final double[] rowStandardDeviations) {
            return data.copy();
        }
    },
    ZNORM_COLUMNS("znorm_columns") {
        @Override
        public RealMatrix normalize(final RealMatrix data, final double[] rowMeans, final double[] rowStandardDeviations) {
            return zNormalizeColumns(data.copy());
        }
    },
    ZNORM_ROWS("znorm_rows") {
        @Override
        public RealMatrix normalize(final RealMatrix data, final double[] rowMeans, final double[] rowStandardDeviations) {
            return zNormalizeRows(data.copy(), rowMeans, rowStandardDeviations);
        }
    },
    ZNORM_ROWS_THEN_COLUMNS("znorm_rows_then_columns") {
        @Override
        public RealMatrix normalize(final RealMatrix data, final double[] rowMeans, final double[] rowStandardDeviations) {
            return zNormalizeColumns(zNormalizeRows(data.copy(), rowMeans, rowStandardDeviations));
        }
    },
    /**
     * Replaces each column by the ranks of its values (ties averaged) divided by the number of rows.
     */
    RANK_NORM_COLUMNS("rank_norm_columns") {
        @Override
        public RealMatrix normalize(final RealMatrix data, final double[] rowMeans, final double[] rowStandardDeviations) {
            final RealMatrix result = data.copy();
            final NaturalRanking ranking = new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.AVERAGE);
            final int rows = result.getRowDimension();
            for (int j = 0; j < result.getColumnDimension(); j++) {
                final double[] ranks = ranking.rank(result.getColumn(j));
                for (int i = 0; i < ranks.length; i++) {
                    ranks[i] /= rows;
                }
                result.setColumn(j, ranks);
            }
            return result;
        }
    };

    private final String methodName;

    NormalizationMethod(final String methodName) {
        this.methodName = methodName;
    }

    public String getMethodName() {
        return methodName;
    }

    /**
     * Normalizes {@code data} using its own row statistics.
     * @return a new matrix.
     */
    public RealMatrix normalize(final RealMatrix data) {
        Utils.nonNull(data);
        return normalize(data, MathUtils.rowMeans(data), MathUtils.rowStandardDeviations(data));
    }

    /**
     * Normalizes {@code data} using the given row statistics for any row-wise step.
     * @return a new matrix.
     */
    public abstract RealMatrix normalize(RealMatrix data, double[] rowMeans, double[] rowStandardDeviations);

    /**
     * @throws UserException.BadArgumentValue if {@code name} is not a known method name.
     */
    public static NormalizationMethod fromName(final String argumentName, final String name) {
        for (final NormalizationMethod method : values()) {
            if (method.methodName.equals(name)) {
                return method;
            }
        }
        throw new UserException.BadArgumentValue(argumentName, String.valueOf(name), "Expected one of " + names());
    }

    public static String names() {
        return Arrays.stream(values()).map(NormalizationMethod::getMethodName).collect(Collectors.joining(", "));
    }

    private static RealMatrix zNormalizeRows(final RealMatrix matrix, final double[] rowMeans, final double[] rowStandardDeviations) {
        Utils.validateArg(rowMeans.length == matrix.getRowDimension() && rowStandardDeviations.length == matrix.getRowDimension(),
                "row statistics do not match the number of rows");
        for (int i = 0; i < matrix.getRowDimension(); i++) {
            final double scale = rowStandardDeviations[i] > 0 ? rowStandardDeviations[i] : 1.0;
            for (int j = 0; j < matrix.getColumnDimension(); j++) {
                matrix.setEntry(i, j, (matrix.getEntry(i, j) - rowMeans[i]) / scale);
            }
        }
        return matrix;
    }

    private static RealMatrix zNormalizeColumns(final RealMatrix matrix) {
        for (int j = 0; j < matrix.getColumnDimension(); j++) {
            final double[] column = matrix.getColumn(j);
            final double mean = MathUtils.mean(column);
            final double sd = Math.sqrt(MathUtils.variance(column));
            final double scale = sd > 0 ? sd : 1.0;
            for (int i = 0; i < column.length; i++) {
                column[i] = (column[i] - mean) / scale;
            }
            matrix.setColumn(j, column);
        }
        return matrix;
    }
}
