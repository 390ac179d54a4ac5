package org.broadinstitute.fastproject.tools.signatures.projection;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.utils.Utils;
import org.broadinstitute.fastproject.utils.pca.PCA;

/**
 * First two principal components of the samples.
 */
public final class PCAProjection implements ProjectionMethod {

    public static final String NAME = "PCA";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double[][] embed(final RealMatrix data) {
        Utils.nonNull(data);
        final PCA pca = PCA.createPCA(null, null, data);
        final int components = Math.min(2, pca.getNumberOfComponents());
        final RealMatrix scores = pca.getSampleScores(components);
        final double[][] result = new double[data.getColumnDimension()][2];
        for (int j = 0; j < result.length; j++) {
            for (int c = 0; c < components; c++) {
                result[j][c] = scores.getEntry(c, j);
            }
        }
        return result;
    }
}
