package org.broadinstitute.fastproject.tools.signatures.significance;

import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.testutils.SyntheticExpressionData;
import org.broadinstitute.fastproject.tools.signatures.projection.Projection;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class NeighborhoodGraphUnitTest extends BaseTest {

    private static final int NUM_SAMPLES = 20;

    /**
     * Samples evenly spaced on the x axis.
     */
    static Projection line(final int numSamples) {
        final double[][] coordinates = new double[numSamples][];
        for (int j = 0; j < numSamples; j++) {
            coordinates[j] = new double[] {j, 0};
        }
        return Projection.of("line", SyntheticExpressionData.samples(numSamples), coordinates);
    }

    @DataProvider(name = "neighborCounts")
    public Object[][] neighborCounts() {
        return new Object[][] {
                {2, 1},
                {4, 3},
                {5, 3},
                {16, 4},
                {100, 10},
                {3000, 55},
        };
    }

    @Test(dataProvider = "neighborCounts")
    public void testNeighborCount(final int numSamples, final int expected) {
        Assert.assertEquals(NeighborhoodGraph.neighborCount(numSamples), expected);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSingleSample() {
        NeighborhoodGraph.neighborCount(1);
    }

    @Test
    public void testContinuousConsistency() {
        final NeighborhoodGraph graph = NeighborhoodGraph.fromProjection(line(NUM_SAMPLES));
        Assert.assertEquals(graph.numSamples(), NUM_SAMPLES);
        final double[] smooth = new double[NUM_SAMPLES];
        final double[] alternating = new double[NUM_SAMPLES];
        for (int j = 0; j < NUM_SAMPLES; j++) {
            smooth[j] = j;
            alternating[j] = j % 2;
        }
        Assert.assertTrue(graph.continuousConsistency(smooth) > 0.9);
        Assert.assertTrue(graph.continuousConsistency(alternating) < graph.continuousConsistency(smooth));
        Assert.assertEquals(graph.continuousConsistency(new double[NUM_SAMPLES]), 0.0);
    }

    @Test
    public void testFactorConsistency() {
        final NeighborhoodGraph graph = NeighborhoodGraph.fromProjection(line(NUM_SAMPLES));
        final int[] halves = new int[NUM_SAMPLES];
        for (int j = NUM_SAMPLES / 2; j < NUM_SAMPLES; j++) {
            halves[j] = 1;
        }
        final double consistency = graph.factorConsistency(halves, 2);
        Assert.assertTrue(consistency > 0.3 && consistency <= 0.5, "consistency " + consistency);
        Assert.assertEquals(graph.factorConsistency(new int[NUM_SAMPLES], 1), 0.0, 1e-12);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testValuesMustMatchSamples() {
        NeighborhoodGraph.fromProjection(line(NUM_SAMPLES)).continuousConsistency(new double[3]);
    }
}
