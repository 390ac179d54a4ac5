package org.broadinstitute.fastproject.tools.signatures.scoring;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.tools.signatures.data.DataKind;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public final class SignatureScorerUnitTest extends BaseTest {

    private static final double EPSILON = 1e-9;

    private static ExpressionMatrix createMatrix() {
        return new ExpressionMatrix(DataKind.EXPRESSION, Arrays.asList("A", "B", "C"), Arrays.asList("S1", "S2"),
                new Array2DRowRealMatrix(new double[][] {{1, 2}, {3, 4}, {5, 9}}));
    }

    @Test
    public void testScoreIgnoresMissingGenes() {
        final SignatureScorer scorer = new SignatureScorer(NormalizationMethod.NONE, ScoringMethod.NAIVE, 2);
        final Signature signature = new Signature("sig", ImmutableMap.of("A", 1, "B", -1, "Z", 1), true, "test");
        final ScoringOutcome outcome = scorer.score(scorer.prepare(createMatrix()), signature);
        Assert.assertFalse(outcome.isSkipped());
        final SignatureScore score = outcome.getScore();
        Assert.assertEquals(score.getName(), "sig");
        Assert.assertEquals(score.getNumGenes(), 2);
        Assert.assertFalse(score.isPrecomputed());
        assertEqualsDoubleArray(score.getValues(), new double[] {-1, -1}, EPSILON);
    }

    @Test
    public void testSkipsSignaturesWithoutEnoughGenes() {
        final SignatureScorer scorer = new SignatureScorer(NormalizationMethod.NONE, ScoringMethod.NAIVE, 2);
        final ScoringOutcome noGenes = scorer.score(scorer.prepare(createMatrix()),
                new Signature("none", ImmutableMap.of("X", 1), false, "test"));
        Assert.assertTrue(noGenes.isSkipped());
        Assert.assertEquals(noGenes.getSignatureName(), "none");
        final ScoringOutcome oneGene = scorer.score(scorer.prepare(createMatrix()),
                new Signature("one", ImmutableMap.of("A", 1, "X", 1), false, "test"));
        Assert.assertTrue(oneGene.isSkipped());
        Assert.assertNotNull(oneGene.getSkipReason());
    }

    @Test
    public void testPrepareWithReferenceStatistics() {
        final SignatureScorer scorer = new SignatureScorer(NormalizationMethod.ZNORM_ROWS, ScoringMethod.NAIVE, 1);
        final SignatureScorer.PreparedData prepared = scorer.prepare(createMatrix(), new double[] {0, 0, 0}, new double[] {1, 1, 1});
        Assert.assertEquals(prepared.getNormalized(), createMatrix().values());
    }

    @Test
    public void testScoreAllKeepsOrder() {
        final SignatureScorer scorer = new SignatureScorer(NormalizationMethod.ZNORM_COLUMNS, ScoringMethod.WEIGHTED_AVG, 1);
        final List<Signature> signatures = Arrays.asList(
                new Signature("first", ImmutableMap.of("A", 1), false, "test"),
                new Signature("missing", ImmutableMap.of("Q", 1), false, "test"),
                new Signature("third", ImmutableMap.of("B", 1, "C", -1), true, "test"));
        final ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            final List<ScoringOutcome> outcomes = scorer.scoreAll(scorer.prepare(createMatrix()), signatures, executor, "signatures");
            Assert.assertEquals(outcomes.size(), 3);
            Assert.assertEquals(outcomes.get(0).getSignatureName(), "first");
            Assert.assertTrue(outcomes.get(1).isSkipped());
            Assert.assertEquals(outcomes.get(2).getScore().getNumGenes(), 2);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMinimumGenesMustBePositive() {
        new SignatureScorer(NormalizationMethod.NONE, ScoringMethod.NAIVE, 0);
    }
}
