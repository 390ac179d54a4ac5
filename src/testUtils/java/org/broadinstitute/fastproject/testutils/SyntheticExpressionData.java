package org.broadinstitute.fastproject.testutils;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.broadinstitute.fastproject.tools.signatures.data.DataKind;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.tools.signatures.scoring.Signature;
import org.broadinstitute.fastproject.utils.MathUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Seeded generator of expression matrices with two sample groups and dropouts, for tests.
 *
 * <p>
 *     Gene {@code GENE_i} has a baseline level between 1 and 5 that increases with {@code i}. The first
 *     {@link #MARKER_GENES} genes are raised by 3 in the samples of group A (even columns) and the next
 *     {@link #MARKER_GENES} in group B (odd columns). Each entry drops out to 0 with a probability that
 *     decreases with its level.
 * </p>
 */
public final class SyntheticExpressionData {

    public static final int MARKER_GENES = 10;

    private SyntheticExpressionData() { }

    public static String gene(final int index) {
        return "GENE_" + index;
    }

    public static String sample(final int index) {
        return "SAMPLE_" + index;
    }

    public static List<String> genes(final int count) {
        return IntStream.range(0, count).mapToObj(SyntheticExpressionData::gene).collect(Collectors.toList());
    }

    public static List<String> samples(final int count) {
        return IntStream.range(0, count).mapToObj(SyntheticExpressionData::sample).collect(Collectors.toList());
    }

    public static ExpressionMatrix create(final int numGenes, final int numSamples, final long seed) {
        final RandomGenerator random = RandomGeneratorFactory.createRandomGenerator(new Random(seed));
        final double[][] values = new double[numGenes][numSamples];
        for (int i = 0; i < numGenes; i++) {
            final double baseline = 1 + 4.0 * i / Math.max(numGenes - 1, 1);
            for (int j = 0; j < numSamples; j++) {
                double level = baseline;
                if (i < MARKER_GENES && j % 2 == 0 || i >= MARKER_GENES && i < 2 * MARKER_GENES && j % 2 == 1) {
                    level += 3;
                }
                final double dropout = MathUtils.logistic(1 - level);
                values[i][j] = random.nextDouble() < dropout ? 0 : Math.abs(level + 0.5 * random.nextGaussian());
            }
        }
        return new ExpressionMatrix(DataKind.EXPRESSION, genes(numGenes), samples(numSamples), new Array2DRowRealMatrix(values, false));
    }

    /**
     * Positive-sign signature over the given gene indices.
     */
    public static Signature signature(final String name, final int... geneIndices) {
        final Map<String, Integer> signs = new LinkedHashMap<>();
        for (final int index : geneIndices) {
            signs.put(gene(index), 1);
        }
        return new Signature(name, signs, false, "test");
    }

    /**
     * Signature of the group A markers with positive sign and the group B markers with negative sign.
     */
    public static Signature groupSignature(final String name) {
        final Map<String, Integer> signs = new LinkedHashMap<>();
        for (int i = 0; i < 2 * MARKER_GENES; i++) {
            signs.put(gene(i), i < MARKER_GENES ? 1 : -1);
        }
        return new Signature(name, signs, true, "test");
    }
}
