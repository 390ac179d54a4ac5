package org.broadinstitute.fastproject.tools.signatures.projection;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.Arrays;

/**
 * Laplacian eigenmap of a Gaussian affinity between samples.
 *
 * <p>
 *     The kernel bandwidth is the median pairwise distance. Coordinates are the eigenvectors of the
 *     symmetric normalized Laplacian with the second and third smallest eigenvalues, rescaled by D<sup>-1/2</sup>.
 * </p>
 */
public final class SpectralEmbeddingProjection implements ProjectionMethod {

    public static final String NAME = "Spectral Embedding";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double[][] embed(final RealMatrix data) {
        Utils.nonNull(data);
        final double[][] d2 = EmbeddingUtils.squaredColumnDistances(data);
        final int n = d2.length;
        final double[] offDiagonal = new double[n * (n - 1) / 2];
        int k = 0;
        for (int a = 0; a < n; a++) {
            for (int b = a + 1; b < n; b++) {
                offDiagonal[k++] = d2[a][b];
            }
        }
        final double medianSquared = offDiagonal.length > 0 ? MathUtils.median(offDiagonal) : 0.0;
        final double bandwidth = medianSquared > 0 ? medianSquared : 1.0;

        final double[][] affinity = new double[n][n];
        final double[] degree = new double[n];
        for (int a = 0; a < n; a++) {
            for (int b = 0; b < n; b++) {
                if (a != b) {
                    affinity[a][b] = Math.exp(-d2[a][b] / bandwidth);
                    degree[a] += affinity[a][b];
                }
            }
        }
        final double[] inverseRootDegree = Arrays.stream(degree).map(d -> d > 0 ? 1.0 / Math.sqrt(d) : 0.0).toArray();
        final double[][] laplacian = new double[n][n];
        for (int a = 0; a < n; a++) {
            laplacian[a][a] = 1.0;
            for (int b = a + 1; b < n; b++) {
                laplacian[a][b] = -affinity[a][b] * inverseRootDegree[a] * inverseRootDegree[b];
                laplacian[b][a] = laplacian[a][b];
            }
        }
        final EmbeddingUtils.SortedEigen eigen = EmbeddingUtils.sortedEigen(laplacian, false);
        final double[][] result = new double[n][2];
        for (int c = 0; c < 2 && c + 1 < n; c++) {
            final double[] vector = eigen.vector(c + 1);
            for (int j = 0; j < n; j++) {
                result[j][c] = vector[j] * inverseRootDegree[j];
            }
        }
        return result;
    }
}
