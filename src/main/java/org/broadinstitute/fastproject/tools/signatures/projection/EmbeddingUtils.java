package org.broadinstitute.fastproject.tools.signatures.projection;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.utils.MathUtils;

import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Distance and eigenvector helpers shared by the embedding methods.
 */
final class EmbeddingUtils {

    private EmbeddingUtils() { }

    /**
     * Squared Euclidean distances between the columns of {@code data}.
     */
    static double[][] squaredColumnDistances(final RealMatrix data) {
        final int n = data.getColumnDimension();
        final double[][] columns = new double[n][];
        for (int j = 0; j < n; j++) {
            columns[j] = data.getColumn(j);
        }
        final double[][] result = new double[n][n];
        for (int a = 0; a < n; a++) {
            for (int b = a + 1; b < n; b++) {
                final double d = MathUtils.distanceSquared(columns[a], columns[b]);
                result[a][b] = d;
                result[b][a] = d;
            }
        }
        return result;
    }

    /**
     * Eigen decomposition of a symmetric matrix with the eigenvalue indices sorted.
     * @param descending whether the largest eigenvalue comes first
     * @return the decomposition and, in {@code order}, the sorted indices
     */
    static SortedEigen sortedEigen(final double[][] symmetric, final boolean descending) {
        final EigenDecomposition eigen = new EigenDecomposition(new Array2DRowRealMatrix(symmetric, false));
        final double[] values = eigen.getRealEigenvalues();
        final Comparator<Integer> byValue = Comparator.comparingDouble(i -> values[i]);
        final int[] order = IntStream.range(0, values.length).boxed()
                .sorted(descending ? byValue.reversed() : byValue)
                .mapToInt(Integer::intValue).toArray();
        return new SortedEigen(eigen, values, order);
    }

    static final class SortedEigen {
        final EigenDecomposition decomposition;
        final double[] values;
        final int[] order;

        private SortedEigen(final EigenDecomposition decomposition, final double[] values, final int[] order) {
            this.decomposition = decomposition;
            this.values = values;
            this.order = order;
        }

        double value(final int rank) {
            return values[order[rank]];
        }

        double[] vector(final int rank) {
            return decomposition.getEigenvector(order[rank]).toArray();
        }
    }
}
