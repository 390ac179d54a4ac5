package org.broadinstitute.fastproject.tools.signatures.projection;

import com.google.common.collect.ImmutableMap;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.testutils.SyntheticExpressionData;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class ProjectionGeneratorUnitTest extends BaseTest {

    private static final ExpressionMatrix DATA = SyntheticExpressionData.create(40, 16, 23);

    @Test
    public void testMethodSets() {
        Assert.assertEquals(new ProjectionGenerator(true).getMethods().size(), 2);
        Assert.assertEquals(new ProjectionGenerator(false).getMethods().size(), 3);
    }

    @Test
    public void testGenerate() {
        final ProjectionResult result = new ProjectionGenerator(false).generate(DATA, Collections.emptyMap());
        Assert.assertEquals(new ArrayList<>(result.getProjections().keySet()),
                Arrays.asList(PCAProjection.NAME, MDSProjection.NAME, SpectralEmbeddingProjection.NAME));
        for (final Projection projection : result.getProjections().values()) {
            Assert.assertEquals(projection.getSamples(), DATA.samples());
        }
        final ReducedRepresentation reduced = result.getReduced();
        Assert.assertEquals(reduced.getSamples(), DATA.samples());
        Assert.assertEquals(reduced.getGenes(), DATA.genes());
        Assert.assertTrue(reduced.numComponents() <= ProjectionGenerator.MAX_PCA_COMPONENTS);
        Assert.assertEquals(reduced.getLeadingLoadings(3).getColumnDimension(), 3);
        Assert.assertEquals(reduced.getLeadingLoadings(3).getRowDimension(), DATA.numGenes());
    }

    @Test
    public void testGenerateOnReducedRepresentation() {
        final ProjectionGenerator generator = new ProjectionGenerator(true);
        final ReducedRepresentation reduced = ProjectionGenerator.reduce(DATA);
        final ProjectionResult result = generator.generate(reduced);
        Assert.assertSame(result.getReduced(), reduced);
        Assert.assertEquals(new ArrayList<>(result.getProjections().keySet()), Arrays.asList(PCAProjection.NAME, MDSProjection.NAME));
    }

    @Test
    public void testInputProjectionsAreAlignedAndNormalized() {
        final List<String> reversed = new ArrayList<>(DATA.samples());
        Collections.reverse(reversed);
        final double[][] coordinates = new double[reversed.size()][];
        for (int j = 0; j < coordinates.length; j++) {
            coordinates[j] = new double[] {10 * j, 0};
        }
        final Projection input = Projection.of("tSNE", reversed, coordinates);
        final ProjectionResult result = new ProjectionGenerator(true).generate(DATA, ImmutableMap.of("tSNE", input));
        final Projection aligned = result.getProjections().get("tSNE");
        Assert.assertEquals(aligned.getSamples(), DATA.samples());
        // the last input row belongs to the first sample
        Assert.assertEquals(aligned.getX(0), 1.0, 1e-12);
        Assert.assertEquals(aligned.getX(DATA.numSamples() - 1), -1.0, 1e-12);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInputProjectionNameClash() {
        final Projection input = Projection.of(PCAProjection.NAME, DATA.samples(), new double[DATA.numSamples()][2]);
        new ProjectionGenerator(true).generate(DATA, ImmutableMap.of(PCAProjection.NAME, input));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInputProjectionMissingSample() {
        final Projection input = Projection.of("partial", DATA.samples().subList(1, DATA.numSamples()), new double[DATA.numSamples() - 1][2]);
        new ProjectionGenerator(true).generate(DATA, ImmutableMap.of("partial", input));
    }
}
