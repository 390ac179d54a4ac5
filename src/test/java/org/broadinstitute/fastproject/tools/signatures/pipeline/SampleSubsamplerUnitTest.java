package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.testutils.SyntheticExpressionData;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

public final class SampleSubsamplerUnitTest extends BaseTest {

    private static SampleSubsampler createSubsampler(final long seed) {
        return new SampleSubsampler(RandomGeneratorFactory.createRandomGenerator(new Random(seed)));
    }

    @Test
    public void testNoSplit() {
        final ExpressionMatrix data = SyntheticExpressionData.create(20, 8, 1);
        final SampleSubsampler.Split split = createSubsampler(1).split(data, 8);
        Assert.assertFalse(split.isSplit());
        Assert.assertNull(split.getHoldout());
        Assert.assertSame(split.getWorking(), data);
    }

    @Test
    public void testSplit() {
        final ExpressionMatrix data = SyntheticExpressionData.create(20, 30, 1);
        final SampleSubsampler.Split split = createSubsampler(9).split(data, 10);
        Assert.assertTrue(split.isSplit());
        Assert.assertEquals(split.getWorking().numSamples(), 10);
        Assert.assertEquals(split.getHoldout().numSamples(), 20);
        final Set<String> all = new HashSet<>(split.getWorking().samples());
        all.addAll(split.getHoldout().samples());
        Assert.assertEquals(all, new HashSet<>(data.samples()));
        assertInInputOrder(split.getWorking().samples(), data.samples());
        assertInInputOrder(split.getHoldout().samples(), data.samples());
        Assert.assertEquals(createSubsampler(9).split(data, 10).getWorking().samples(), split.getWorking().samples());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonPositiveSize() {
        createSubsampler(1).split(SyntheticExpressionData.create(20, 8, 1), 0);
    }

    private static void assertInInputOrder(final List<String> subset, final List<String> all) {
        final List<Integer> positions = new ArrayList<>();
        subset.forEach(s -> positions.add(all.indexOf(s)));
        for (int i = 1; i < positions.size(); i++) {
            Assert.assertTrue(positions.get(i - 1) < positions.get(i));
        }
    }
}
