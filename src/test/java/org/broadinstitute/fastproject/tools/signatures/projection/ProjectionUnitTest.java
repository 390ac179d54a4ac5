package org.broadinstitute.fastproject.tools.signatures.projection;

import org.broadinstitute.fastproject.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class ProjectionUnitTest extends BaseTest {

    private static final List<String> SAMPLES = Arrays.asList("A", "B", "C");

    @Test
    public void testNormalizedIsCenteredWithUnitRadius() {
        final Projection projection = Projection.normalized("p", SAMPLES, new double[][] {{1, 1}, {3, 1}, {2, 4}});
        double sumX = 0;
        double sumY = 0;
        double maxRadius = 0;
        for (int j = 0; j < 3; j++) {
            sumX += projection.getX(j);
            sumY += projection.getY(j);
            maxRadius = Math.max(maxRadius, Math.hypot(projection.getX(j), projection.getY(j)));
        }
        Assert.assertEquals(sumX, 0, 1e-12);
        Assert.assertEquals(sumY, 0, 1e-12);
        Assert.assertEquals(maxRadius, 1, 1e-12);
    }

    @Test
    public void testNormalizedDegenerate() {
        final Projection projection = Projection.normalized("p", SAMPLES, new double[][] {{2, 2}, {2, 2}, {2, 2}});
        for (final double[] point : projection.getCoordinates()) {
            Assert.assertEquals(point, new double[] {0, 0});
        }
    }

    @Test
    public void testOfKeepsCoordinates() {
        final double[][] coordinates = {{1, 2}, {3, 4}, {5, 6}};
        final Projection projection = Projection.of("p", SAMPLES, coordinates);
        coordinates[0][0] = 100;
        Assert.assertEquals(projection.getX(0), 1.0);
        Assert.assertEquals(projection.getY(2), 6.0);
    }

    @Test
    public void testSubsetAndAppend() {
        final Projection projection = Projection.of("p", SAMPLES, new double[][] {{1, 2}, {3, 4}, {5, 6}});
        final Projection subset = projection.subsetSamples(Arrays.asList("C", "A"));
        Assert.assertEquals(subset.getCoordinates(), new double[][] {{5, 6}, {1, 2}});
        final Projection appended = subset.appendSamples(Collections.singletonList("D"), new double[][] {{7, 8}});
        Assert.assertEquals(appended.getSamples(), Arrays.asList("C", "A", "D"));
        Assert.assertEquals(appended.getX(2), 7.0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSubsetUnknownSample() {
        Projection.of("p", SAMPLES, new double[][] {{1, 2}, {3, 4}, {5, 6}}).subsetSamples(Collections.singletonList("Z"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCoordinatesMustBeTwoDimensional() {
        Projection.of("p", SAMPLES, new double[][] {{1, 2}, {3, 4, 5}, {5, 6}});
    }
}
