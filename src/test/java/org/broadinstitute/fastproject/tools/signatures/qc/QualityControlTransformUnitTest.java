package org.broadinstitute.fastproject.tools.signatures.qc;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.testutils.SyntheticExpressionData;
import org.broadinstitute.fastproject.tools.signatures.data.DataKind;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public final class QualityControlTransformUnitTest extends BaseTest {

    private static final int NUM_GENES = 40;
    private static final int NUM_SAMPLES = 24;

    private static final List<String> HOUSEKEEPING = SyntheticExpressionData.genes(NUM_GENES).subList(20, 40);

    @Test
    public void testApply() {
        final ExpressionMatrix data = SyntheticExpressionData.create(NUM_GENES, NUM_SAMPLES, 11);
        final QualityControlResult result = new QualityControlTransform().apply(data, data, HOUSEKEEPING, null);
        final ExpressionMatrix probability = result.getProbabilityData();
        Assert.assertEquals(probability.kind(), DataKind.PROBABILITY);
        Assert.assertEquals(probability.genes(), data.genes());
        Assert.assertEquals(probability.samples(), data.samples());
        Assert.assertTrue(probability.hasWeights());
        final RealMatrix weights = result.getWeights();
        for (int i = 0; i < NUM_GENES; i++) {
            for (int j = 0; j < NUM_SAMPLES; j++) {
                final double p = probability.values().getEntry(i, j);
                final double w = weights.getEntry(i, j);
                Assert.assertTrue(p >= 0 && p <= 1, "probability " + p);
                Assert.assertTrue(w >= 0 && w <= 1, "weight " + w);
                if (data.values().getEntry(i, j) > 0) {
                    Assert.assertEquals(w, 1.0);
                }
            }
        }
        Assert.assertEquals(result.getReport().getSamples(), data.samples());
        Assert.assertTrue(result.getReport().isEnabled());
        Assert.assertEquals(result.getFalseNegativeModel().getFitGenes(), HOUSEKEEPING);
    }

    @Test
    public void testInputWeightsAreAligned() {
        final ExpressionMatrix data = SyntheticExpressionData.create(NUM_GENES, NUM_SAMPLES, 11);
        final List<String> reversedGenes = IntStream.range(0, NUM_GENES).mapToObj(i -> data.genes().get(NUM_GENES - 1 - i)).collect(Collectors.toList());
        final double[][] values = new double[NUM_GENES][NUM_SAMPLES];
        for (int i = 0; i < NUM_GENES; i++) {
            Arrays.fill(values[i], (NUM_GENES - 1 - i) / (double) NUM_GENES);
        }
        final ExpressionMatrix inputWeights = new ExpressionMatrix(DataKind.EXPRESSION, reversedGenes, data.samples(), new Array2DRowRealMatrix(values));
        final QualityControlResult result = new QualityControlTransform().apply(data, data, HOUSEKEEPING, inputWeights);
        for (int i = 0; i < NUM_GENES; i++) {
            Assert.assertEquals(result.getWeights().getEntry(i, 0), i / (double) NUM_GENES, 1e-12);
        }
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testInputWeightsMissingGene() {
        final ExpressionMatrix data = SyntheticExpressionData.create(NUM_GENES, NUM_SAMPLES, 11);
        final ExpressionMatrix partial = new ExpressionMatrix(DataKind.EXPRESSION, data.genes().subList(0, 5), data.samples(),
                new Array2DRowRealMatrix(5, NUM_SAMPLES));
        QualityControlTransform.alignWeights(data, partial);
    }

    @Test
    public void testAdjustProbabilities() {
        final ExpressionMatrix data = SyntheticExpressionData.create(NUM_GENES, NUM_SAMPLES, 5);
        final ProbabilityFit fit = new ExpressionProbabilityModel().fit(data);
        final double[][] ones = new double[NUM_GENES][NUM_SAMPLES];
        Arrays.stream(ones).forEach(row -> Arrays.fill(row, 1.0));
        final RealMatrix unchanged = QualityControlTransform.adjustProbabilities(data, fit, new Array2DRowRealMatrix(ones));
        final RealMatrix prior = QualityControlTransform.adjustProbabilities(data, fit, new Array2DRowRealMatrix(NUM_GENES, NUM_SAMPLES));
        for (int i = 0; i < NUM_GENES; i++) {
            Assert.assertEquals(unchanged.getEntry(i, 3), fit.getProbabilities().getEntry(i, 3), 1e-12);
            Assert.assertEquals(prior.getEntry(i, 3), fit.getMixtureWeight(data.genes().get(i)), 1e-12);
        }
    }

    @Test
    public void testApplyToAdditionalSamples() {
        final ExpressionMatrix data = SyntheticExpressionData.create(NUM_GENES, NUM_SAMPLES, 17);
        final boolean[] working = new boolean[NUM_SAMPLES];
        for (int j = 0; j < NUM_SAMPLES; j++) {
            working[j] = j < 20;
        }
        final boolean[] holdout = new boolean[NUM_SAMPLES];
        for (int j = 0; j < NUM_SAMPLES; j++) {
            holdout[j] = !working[j];
        }
        final ExpressionMatrix workingData = data.subsetSamples(working);
        final ExpressionMatrix holdoutData = data.subsetSamples(holdout);
        final QualityControlResult workingResult = new QualityControlTransform().apply(workingData, workingData, HOUSEKEEPING, null);
        final QualityControlResult holdoutResult = QualityControlTransform.applyToAdditionalSamples(holdoutData, holdoutData, workingResult, null);
        Assert.assertEquals(holdoutResult.getProbabilityData().samples(), holdoutData.samples());
        Assert.assertEquals(holdoutResult.getReport().getSamples(), holdoutData.samples());
        Assert.assertEquals(holdoutResult.getReport().getCutoff(), workingResult.getReport().getCutoff());
        Assert.assertSame(holdoutResult.getProbabilityFit(), workingResult.getProbabilityFit());
    }
}
