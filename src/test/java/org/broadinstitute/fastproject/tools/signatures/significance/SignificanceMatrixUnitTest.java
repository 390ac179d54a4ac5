package org.broadinstitute.fastproject.tools.signatures.significance;

import org.broadinstitute.fastproject.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;

public final class SignificanceMatrixUnitTest extends BaseTest {

    private static SignificanceMatrix createMatrix() {
        return new SignificanceMatrix(Arrays.asList("a", "b", "c"), Arrays.asList("P1", "P2"),
                new double[][] {{0.1, 0.2}, {0.3, 0.4}, {0.5, 0.6}},
                new double[][] {{-1, -2}, {-0.5, -0.1}, {-3, 0}});
    }

    @Test
    public void testMinimumLogPValue() {
        final SignificanceMatrix matrix = createMatrix();
        Assert.assertEquals(matrix.minimumLogPValue(0), -2.0);
        Assert.assertEquals(matrix.minimumLogPValue(1), -0.5);
        Assert.assertEquals(matrix.minimumLogPValue(2), -3.0);
    }

    @Test
    public void testRetainSignaturesKeepsOrder() {
        final SignificanceMatrix retained = createMatrix().retainSignatures(Arrays.asList("c", "a", "unknown"));
        Assert.assertEquals(retained.getSignatureKeys(), Arrays.asList("a", "c"));
        Assert.assertEquals(retained.getLogPValues()[0], new double[] {-1, -2});
        Assert.assertEquals(retained.getLogPValues()[1], new double[] {-3, 0});
        Assert.assertEquals(retained.getConsistency()[1], new double[] {0.5, 0.6});
        Assert.assertEquals(retained.getProjectionKeys(), Arrays.asList("P1", "P2"));
    }

    @Test
    public void testAccessorsReturnCopies() {
        final SignificanceMatrix matrix = createMatrix();
        matrix.getLogPValues()[0][0] = 100;
        Assert.assertEquals(matrix.getLogPValue(0, 0), -1.0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDuplicateSignatureKeys() {
        new SignificanceMatrix(Arrays.asList("a", "a"), Arrays.asList("P"), new double[][] {{0}, {0}}, new double[][] {{0}, {0}});
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testShapeMismatch() {
        new SignificanceMatrix(Arrays.asList("a", "b"), Arrays.asList("P"), new double[][] {{0}, {0}}, new double[][] {{0}});
    }
}
