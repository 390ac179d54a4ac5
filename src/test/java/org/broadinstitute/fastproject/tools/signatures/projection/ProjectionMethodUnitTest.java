package org.broadinstitute.fastproject.tools.signatures.projection;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Random;

/**
 * Checks every {@link ProjectionMethod} on features x samples data with two well separated groups of samples.
 */
public final class ProjectionMethodUnitTest extends BaseTest {

    private static final int NUM_FEATURES = 6;
    private static final int GROUP_SIZE = 8;

    /**
     * The first {@link #GROUP_SIZE} samples sit around +5 on every feature, the rest around -5.
     */
    private static RealMatrix createGroups() {
        final RandomGenerator random = RandomGeneratorFactory.createRandomGenerator(new Random(31));
        final double[][] values = new double[NUM_FEATURES][2 * GROUP_SIZE];
        for (int i = 0; i < NUM_FEATURES; i++) {
            for (int j = 0; j < 2 * GROUP_SIZE; j++) {
                values[i][j] = (j < GROUP_SIZE ? 5 : -5) + 0.3 * random.nextGaussian();
            }
        }
        return new Array2DRowRealMatrix(values, false);
    }

    @DataProvider(name = "methods")
    public Object[][] methods() {
        return new Object[][] {
                {new PCAProjection()},
                {new MDSProjection()},
                {new SpectralEmbeddingProjection()},
        };
    }

    @Test(dataProvider = "methods")
    public void testSeparatesGroupsOnFirstCoordinate(final ProjectionMethod method) {
        final double[][] embedding = method.embed(createGroups());
        Assert.assertEquals(embedding.length, 2 * GROUP_SIZE);
        double first = 0;
        double second = 0;
        for (int j = 0; j < embedding.length; j++) {
            Assert.assertEquals(embedding[j].length, 2);
            Assert.assertTrue(Double.isFinite(embedding[j][0]) && Double.isFinite(embedding[j][1]));
            if (j < GROUP_SIZE) {
                first += embedding[j][0];
            } else {
                second += embedding[j][0];
            }
        }
        Assert.assertTrue(first * second < 0, method.getName() + " does not separate the groups");
        for (int j = 0; j < embedding.length; j++) {
            final double groupMean = j < GROUP_SIZE ? first : second;
            Assert.assertTrue(embedding[j][0] * groupMean > 0, method.getName() + " misplaces sample " + j);
        }
    }

    @Test
    public void testMDSPreservesPlanarDistances() {
        final RealMatrix planar = new Array2DRowRealMatrix(new double[][] {
                {0, 4, 0, 1, 3},
                {0, 0, 3, 2, -1}});
        final double[][] embedding = new MDSProjection().embed(planar);
        for (int a = 0; a < 5; a++) {
            for (int b = a + 1; b < 5; b++) {
                Assert.assertEquals(MathUtils.distanceSquared(embedding[a], embedding[b]),
                        MathUtils.distanceSquared(planar.getColumn(a), planar.getColumn(b)), 1e-8);
            }
        }
    }

    @Test
    public void testPCAMatchesMDSDistances() {
        final RealMatrix data = createGroups();
        final double[][] pca = new PCAProjection().embed(data);
        final double[][] mds = new MDSProjection().embed(data);
        for (int a = 0; a < pca.length; a++) {
            for (int b = a + 1; b < pca.length; b++) {
                Assert.assertEquals(MathUtils.distanceSquared(pca[a], pca[b]), MathUtils.distanceSquared(mds[a], mds[b]), 1e-6);
            }
        }
    }
}
