package org.broadinstitute.fastproject.tools.signatures.qc;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.tools.signatures.data.DataKind;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public final class FalseNegativeModelUnitTest extends BaseTest {

    private static final int NUM_GENES = 12;
    private static final List<String> GENES = IntStream.range(0, NUM_GENES).mapToObj(i -> "HK" + i).collect(Collectors.toList());
    private static final List<String> SAMPLES = Arrays.asList("good1", "good2", "bad");

    /**
     * Gene HK{i} has value i + 1 wherever detected. The good samples detect every gene, the bad sample only genes
     * with value 7 or more.
     */
    private static ExpressionMatrix createMatrix() {
        final double[][] values = new double[NUM_GENES][SAMPLES.size()];
        for (int i = 0; i < NUM_GENES; i++) {
            values[i][0] = i + 1;
            values[i][1] = i + 1;
            values[i][2] = i + 1 >= 7 ? i + 1 : 0;
        }
        return new ExpressionMatrix(DataKind.EXPRESSION, GENES, SAMPLES, new Array2DRowRealMatrix(values));
    }

    @Test
    public void testMidpointsSeparatePoorSamples() {
        final FalseNegativeModel model = FalseNegativeModel.fit(createMatrix(), GENES);
        Assert.assertEquals(model.getFitGenes(), GENES);
        final double[] midpoints = model.getMidpoints();
        Assert.assertTrue(midpoints[0] < 0, "good sample midpoint " + midpoints[0]);
        Assert.assertEquals(midpoints[0], midpoints[1]);
        Assert.assertTrue(midpoints[2] > 0, "bad sample midpoint " + midpoints[2]);
        Assert.assertTrue(model.getSlope(2) > 0);
        Assert.assertTrue(model.detectionProbability(2, 12) > model.detectionProbability(2, 1));

        final SampleQualityReport report = model.qualityCheck();
        Assert.assertEquals(report.passingSamples(), Arrays.asList("good1", "good2"));
    }

    @Test
    public void testFallsBackToAllGenes() {
        final FalseNegativeModel model = FalseNegativeModel.fit(createMatrix(), Arrays.asList("HK0", "HK1", "unknown"));
        Assert.assertEquals(model.getFitGenes(), GENES);
    }

    @Test
    public void testComputeWeights() {
        final ExpressionMatrix data = createMatrix();
        final FalseNegativeModel model = FalseNegativeModel.fit(data, GENES);
        final ProbabilityFit fit = new ExpressionProbabilityModel().fit(data);
        final RealMatrix weights = model.computeWeights(data, fit);
        for (int i = 0; i < NUM_GENES; i++) {
            Assert.assertEquals(weights.getEntry(i, 0), 1.0);
            final double w = weights.getEntry(i, 2);
            if (i + 1 >= 7) {
                Assert.assertEquals(w, 1.0);
            } else {
                Assert.assertTrue(w >= 0 && w < 1, "weight " + w);
            }
        }
    }

    @Test
    public void testFitAdditionalSamples() {
        final FalseNegativeModel model = FalseNegativeModel.fit(createMatrix(), GENES);
        final ExpressionMatrix holdout = createMatrix().subsetSamples(new boolean[] {false, false, true});
        final FalseNegativeModel holdoutModel = model.fitAdditionalSamples(holdout);
        Assert.assertEquals(holdoutModel.getSamples(), Arrays.asList("bad"));
        Assert.assertEquals(holdoutModel.getMidpoints()[0], model.getMidpoints()[2], 1e-9);
    }

    @Test
    public void testFitLogisticIsFiniteForConstantResponse() {
        final FalseNegativeModel.LogisticCurve curve = FalseNegativeModel.fitLogistic(
                new double[] {1, 2, 3, 4}, new double[] {1, 1, 1, 1}, FalseNegativeModel.MAX_ITERATIONS);
        Assert.assertTrue(curve.converged);
        Assert.assertTrue(Double.isFinite(curve.intercept) && Double.isFinite(curve.slope));
        Assert.assertTrue(curve.slope > 0);
    }

    @Test
    public void testIterationCapIsReported() {
        final FalseNegativeModel.LogisticCurve curve = FalseNegativeModel.fitLogistic(
                new double[] {1, 2, 3, 4}, new double[] {0, 0, 1, 1}, 1);
        Assert.assertFalse(curve.converged);
        Assert.assertTrue(Double.isFinite(curve.intercept) && Double.isFinite(curve.slope));

        Assert.assertEquals(FalseNegativeModel.fit(createMatrix(), GENES).getNonConvergedSamples(), 0);
        final FalseNegativeModel capped = FalseNegativeModel.fit(createMatrix(), GENES, 1);
        Assert.assertEquals(capped.getNonConvergedSamples(), SAMPLES.size());
        Assert.assertEquals(capped.getSamples(), SAMPLES);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testNoExpressedGenes() {
        final ExpressionMatrix data = new ExpressionMatrix(DataKind.EXPRESSION, Arrays.asList("a", "b"), Arrays.asList("x", "y"),
                new Array2DRowRealMatrix(2, 2));
        FalseNegativeModel.fit(data, Arrays.asList("a", "b"));
    }
}
