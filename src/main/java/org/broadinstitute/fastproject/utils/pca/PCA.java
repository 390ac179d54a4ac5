package org.broadinstitute.fastproject.utils.pca;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;
import org.broadinstitute.fastproject.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.DoubleStream;

/**
 * Principal component analysis.
 *
 * <p>
 *     Rows of the input are variables (genes), columns are samples. Each variable is centered across samples
 *     before the singular value decomposition.
 * </p>
 */
public final class PCA {

    /**
     * Array of variable centers subtracted from the data-matrix before PCA.
     */
    private final double[] centers;

    /**
     * Principal component directions or eigenVectors, one per column in the same order
     * as in {@link #variances}.
     */
    private final RealMatrix eigenVectors;

    /**
     * Sample coordinates on each component, one row per component, one column per sample.
     */
    private final RealMatrix sampleScores;

    /**
     * Principal component variances sorted by magnitude (large variance comes first).
     */
    private final double[] variances;

    private final List<String> variables;

    private final List<String> samples;

    /**
     * Creates a new PCA result using SVD.
     *
     * <p>
     *     This operation will do all required computation, thus it might take long to complete for
     *     large matrices.
     * </p>
     *
     * @param variables  variable names following the same order as the row in the data-matrix; can be {@code null}.
     * @param samples    sample names following the same order as the columns in the data-matrix; can be {@code null}.
     * @param dataMatrix the input data matrix.
     * @throws IllegalArgumentException if {@code dataMatrix} is {@code null} or has fewer than two columns, or if
     *          either name list is inconsistent with the input data matrix, contains a {@code null} or repeats.
     */
    public static PCA createPCA(final List<String> variables, final List<String> samples, final RealMatrix dataMatrix) {
        Utils.nonNull(dataMatrix, "the input matrix cannot be null");
        final List<String> variableNames = checkNonNullUniqueNames(variables, "variable");
        final List<String> sampleNames = checkNonNullUniqueNames(samples, "sample");
        final int rowCount = dataMatrix.getRowDimension();
        final int columnCount = dataMatrix.getColumnDimension();
        Utils.validateArg(columnCount >= 2, "PCA requires at least two samples");
        Utils.validateArg(variableNames == null || variableNames.size() == rowCount, "variable names do not match the number of rows");
        Utils.validateArg(sampleNames == null || sampleNames.size() == columnCount, "sample names do not match the number of columns");

        final double[] centers = new double[rowCount];
        final RealMatrix centered = new Array2DRowRealMatrix(rowCount, columnCount);
        for (int i = 0; i < rowCount; i++) {
            final double[] row = dataMatrix.getRow(i);
            final double center = MathUtils.mean(row);
            for (int j = 0; j < columnCount; j++) {
                row[j] -= center;
            }
            centered.setRow(i, row);
            centers[i] = center;
        }
        final SingularValueDecomposition svd = new SingularValueDecomposition(centered);
        final double[] singularValues = svd.getSingularValues();
        final RealMatrix eigenVectors = svd.getU();
        // S * V^T
        final RealMatrix sampleScores = svd.getVT().copy();
        for (int c = 0; c < singularValues.length; c++) {
            sampleScores.setRowVector(c, sampleScores.getRowVector(c).mapMultiply(singularValues[c]));
        }
        final double inverseDenominator = 1.0 / (columnCount - 1.0);
        final double[] variances = DoubleStream.of(singularValues).map(d -> d * d * inverseDenominator).toArray();
        return new PCA(variableNames, sampleNames, centers, eigenVectors, sampleScores, variances);
    }

    private static List<String> checkNonNullUniqueNames(final List<String> input, final String roleName) {
        if (input == null) {
            return null;
        } else if (input.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException(String.format("the input %s list must not contain nulls", roleName));
        } else if (input.stream().distinct().count() != input.size()) {
            throw new IllegalArgumentException(String.format("the input %s list must not contain repeats", roleName));
        } else {
            return Collections.unmodifiableList(new ArrayList<>(input));
        }
    }

    private PCA(final List<String> variables, final List<String> samples, final double[] centers,
                final RealMatrix eigenVectors, final RealMatrix sampleScores, final double[] variances) {
        this.variables = variables;
        this.samples = samples;
        this.centers = centers;
        this.eigenVectors = eigenVectors;
        this.sampleScores = sampleScores;
        this.variances = variances;
    }

    public int getNumberOfComponents() {
        return variances.length;
    }

    /**
     * Returns the eigen-vectors for the principal components, one column per component.
     * Each row holds the contributions of the corresponding input variable to that component.
     */
    public RealMatrix getEigenVectors() {
        return eigenVectors;
    }

    /**
     * Loadings of the first {@code k} components (variables x k).
     */
    public RealMatrix getLoadings(final int k) {
        ParamUtils.inRange(k, 1, getNumberOfComponents(), "number of components out of range");
        return eigenVectors.getSubMatrix(0, eigenVectors.getRowDimension() - 1, 0, k - 1);
    }

    /**
     * Sample coordinates on the first {@code k} components (k x samples).
     */
    public RealMatrix getSampleScores(final int k) {
        ParamUtils.inRange(k, 1, getNumberOfComponents(), "number of components out of range");
        return sampleScores.getSubMatrix(0, k - 1, 0, sampleScores.getColumnDimension() - 1);
    }

    public RealVector getCenters() {
        return new ArrayRealVector(centers);
    }

    public RealVector getVariances() {
        return new ArrayRealVector(variances);
    }

    /**
     * @return the variable names, or {@code null} if none were given.
     */
    public List<String> getVariables() {
        return variables;
    }

    /**
     * @return the sample names, or {@code null} if none were given.
     */
    public List<String> getSamples() {
        return samples;
    }
}
