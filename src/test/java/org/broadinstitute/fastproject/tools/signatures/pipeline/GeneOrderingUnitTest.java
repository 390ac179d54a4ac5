package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.testutils.SyntheticExpressionData;
import org.broadinstitute.fastproject.tools.signatures.data.DataKind;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

public final class GeneOrderingUnitTest extends BaseTest {

    @Test
    public void testCloseGenesAreAdjacent() {
        final ExpressionMatrix data = new ExpressionMatrix(DataKind.EXPRESSION, Arrays.asList("A", "B", "C", "D"), Arrays.asList("s1", "s2"),
                new Array2DRowRealMatrix(new double[][] {{0, 0}, {10, 10}, {0.1, 0}, {10, 10.1}}));
        Assert.assertEquals(GeneOrdering.leafOrder(data), Arrays.asList("B", "D", "A", "C"));
    }

    @Test
    public void testSingleGene() {
        final ExpressionMatrix data = new ExpressionMatrix(DataKind.EXPRESSION, Collections.singletonList("A"), Arrays.asList("s1", "s2"),
                new Array2DRowRealMatrix(new double[][] {{1, 2}}));
        Assert.assertEquals(GeneOrdering.leafOrder(data), Collections.singletonList("A"));
    }

    @Test
    public void testIsPermutation() {
        final ExpressionMatrix data = SyntheticExpressionData.create(60, 12, 4);
        final List<String> order = GeneOrdering.leafOrder(data);
        Assert.assertEquals(order.size(), 60);
        Assert.assertEquals(new HashSet<>(order), new HashSet<>(data.genes()));
        Assert.assertEquals(GeneOrdering.leafOrder(data), order);
    }
}
