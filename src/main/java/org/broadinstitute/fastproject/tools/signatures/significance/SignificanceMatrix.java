package org.broadinstitute.fastproject.tools.signatures.significance;

import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Consistency statistics and log10 empirical p-values, one row per signature and one column per projection.
 */
public final class SignificanceMatrix {

    private final List<String> signatureKeys;
    private final List<String> projectionKeys;
    private final double[][] consistency;
    private final double[][] logPValues;

    public SignificanceMatrix(final List<String> signatureKeys, final List<String> projectionKeys,
                              final double[][] consistency, final double[][] logPValues) {
        Utils.nonNull(signatureKeys);
        Utils.nonNull(projectionKeys);
        Utils.nonNull(consistency);
        Utils.nonNull(logPValues);
        Utils.checkForDuplicatesAndReturnSet(signatureKeys, "signature keys contain duplicates.");
        Utils.checkForDuplicatesAndReturnSet(projectionKeys, "projection keys contain duplicates.");
        Utils.validateArg(consistency.length == signatureKeys.size() && logPValues.length == signatureKeys.size(),
                "the number of matrix rows does not match the signature keys");
        for (int i = 0; i < signatureKeys.size(); i++) {
            Utils.validateArg(consistency[i].length == projectionKeys.size() && logPValues[i].length == projectionKeys.size(),
                    "the number of matrix columns does not match the projection keys");
        }
        this.signatureKeys = Collections.unmodifiableList(new ArrayList<>(signatureKeys));
        this.projectionKeys = Collections.unmodifiableList(new ArrayList<>(projectionKeys));
        this.consistency = deepCopy(consistency);
        this.logPValues = deepCopy(logPValues);
    }

    public List<String> getSignatureKeys() {
        return signatureKeys;
    }

    public List<String> getProjectionKeys() {
        return projectionKeys;
    }

    public double[][] getConsistency() {
        return deepCopy(consistency);
    }

    public double[][] getLogPValues() {
        return deepCopy(logPValues);
    }

    public int numSignatures() {
        return signatureKeys.size();
    }

    public int numProjections() {
        return projectionKeys.size();
    }

    public double getConsistency(final int signature, final int projection) {
        return consistency[signature][projection];
    }

    public double getLogPValue(final int signature, final int projection) {
        return logPValues[signature][projection];
    }

    /**
     * Smallest log10 p-value of a signature across projections.
     */
    public double minimumLogPValue(final int signature) {
        double result = Double.POSITIVE_INFINITY;
        for (final double p : logPValues[signature]) {
            result = Math.min(result, p);
        }
        return result;
    }

    /**
     * Keeps the rows of the given signatures, in their current order.
     */
    public SignificanceMatrix retainSignatures(final Collection<String> keep) {
        Utils.nonNull(keep);
        final Set<String> keepSet = new HashSet<>(keep);
        final int[] rows = IntStream.range(0, signatureKeys.size()).filter(i -> keepSet.contains(signatureKeys.get(i))).toArray();
        final List<String> keys = new ArrayList<>(rows.length);
        final double[][] c = new double[rows.length][];
        final double[][] p = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            keys.add(signatureKeys.get(rows[r]));
            c[r] = consistency[rows[r]];
            p[r] = logPValues[rows[r]];
        }
        return new SignificanceMatrix(keys, projectionKeys, c, p);
    }

    private static double[][] deepCopy(final double[][] matrix) {
        final double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }
}
