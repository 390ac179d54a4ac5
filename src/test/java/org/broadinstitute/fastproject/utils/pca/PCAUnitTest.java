package org.broadinstitute.fastproject.utils.pca;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public final class PCAUnitTest extends BaseTest {

    private static final double TOLERANCE = 1e-9;

    // the second variable is twice the first plus an offset
    private static final RealMatrix COLLINEAR = new Array2DRowRealMatrix(new double[][] {
            {1, 2, 3, 4},
            {12, 14, 16, 18}});

    @Test
    public void testCollinearData() {
        final PCA pca = PCA.createPCA(Arrays.asList("g1", "g2"), Arrays.asList("a", "b", "c", "d"), COLLINEAR);
        Assert.assertEquals(pca.getNumberOfComponents(), 2);
        assertEqualsDoubleArray(pca.getCenters().toArray(), new double[] {2.5, 15}, TOLERANCE);
        // total variance (5/3 + 20/3) all on the first component
        Assert.assertEquals(pca.getVariances().getEntry(0), 25.0 / 3, TOLERANCE);
        Assert.assertEquals(pca.getVariances().getEntry(1), 0.0, TOLERANCE);

        final RealMatrix loadings = pca.getLoadings(1);
        Assert.assertEquals(loadings.getRowDimension(), 2);
        Assert.assertEquals(Math.abs(loadings.getEntry(1, 0) / loadings.getEntry(0, 0)), 2.0, TOLERANCE);

        final RealMatrix scores = pca.getSampleScores(1);
        Assert.assertEquals(scores.getColumnDimension(), 4);
        final double step = scores.getEntry(0, 1) - scores.getEntry(0, 0);
        Assert.assertEquals(Math.abs(step), Math.sqrt(5), TOLERANCE);
        Assert.assertEquals(scores.getEntry(0, 3) - scores.getEntry(0, 2), step, TOLERANCE);
    }

    @Test
    public void testNamesAreOptional() {
        final PCA pca = PCA.createPCA(null, null, COLLINEAR);
        Assert.assertNull(pca.getVariables());
        Assert.assertNull(pca.getSamples());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRepeatedNames() {
        final List<String> samples = Arrays.asList("a", "b", "a", "d");
        PCA.createPCA(null, samples, COLLINEAR);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSingleSample() {
        PCA.createPCA(null, null, new Array2DRowRealMatrix(new double[][] {{1}, {2}}));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testTooManyComponents() {
        PCA.createPCA(null, null, COLLINEAR).getLoadings(3);
    }
}
