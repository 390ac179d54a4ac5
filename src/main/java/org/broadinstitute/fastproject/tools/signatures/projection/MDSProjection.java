package org.broadinstitute.fastproject.tools.signatures.projection;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.utils.Utils;

/**
 * Classical (Torgerson) multidimensional scaling on Euclidean distances between samples.
 */
public final class MDSProjection implements ProjectionMethod {

    public static final String NAME = "MDS";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double[][] embed(final RealMatrix data) {
        Utils.nonNull(data);
        final double[][] d2 = EmbeddingUtils.squaredColumnDistances(data);
        final int n = d2.length;
        // double centering: B = -1/2 J D2 J
        final double[] rowMeans = new double[n];
        double grandMean = 0;
        for (int a = 0; a < n; a++) {
            for (int b = 0; b < n; b++) {
                rowMeans[a] += d2[a][b];
            }
            rowMeans[a] /= n;
            grandMean += rowMeans[a];
        }
        grandMean /= n;
        final double[][] centered = new double[n][n];
        for (int a = 0; a < n; a++) {
            for (int b = a; b < n; b++) {
                centered[a][b] = -0.5 * (d2[a][b] - rowMeans[a] - rowMeans[b] + grandMean);
                centered[b][a] = centered[a][b];
            }
        }
        final EmbeddingUtils.SortedEigen eigen = EmbeddingUtils.sortedEigen(centered, true);
        final double[][] result = new double[n][2];
        for (int c = 0; c < Math.min(2, n); c++) {
            final double scale = Math.sqrt(Math.max(eigen.value(c), 0.0));
            final double[] vector = eigen.vector(c);
            for (int j = 0; j < n; j++) {
                result[j][c] = vector[j] * scale;
            }
        }
        return result;
    }
}
