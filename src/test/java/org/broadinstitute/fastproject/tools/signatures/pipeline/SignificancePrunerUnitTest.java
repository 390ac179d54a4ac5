package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.broadinstitute.fastproject.exceptions.FastProjectException;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.testutils.SyntheticExpressionData;
import org.broadinstitute.fastproject.tools.signatures.data.DataKind;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.tools.signatures.projection.Projection;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;
import org.broadinstitute.fastproject.tools.signatures.significance.SignificanceMatrix;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class SignificancePrunerUnitTest extends BaseTest {

    private static final int NUM_SAMPLES = 10;
    private static final String PRECOMPUTED = "batch";

    /**
     * Model with one projection data whose log10 p-values are given per score name.
     */
    static Model createModel(final Map<String, Double> logPValues, final Set<String> precomputed) {
        return createModel(Collections.singletonList(logPValues), precomputed);
    }

    /**
     * Model with one projection data per map of log10 p-values. Every map must have the same keys in the same order.
     */
    static Model createModel(final List<Map<String, Double>> logPValuesPerProjectionData, final Set<String> precomputed) {
        final ExpressionMatrix data = SyntheticExpressionData.create(20, NUM_SAMPLES, 3);
        final List<String> samples = data.samples();
        final List<SignatureScore> scores = new ArrayList<>();
        for (final String name : logPValuesPerProjectionData.get(0).keySet()) {
            final boolean isPrecomputed = precomputed.contains(name);
            scores.add(SignatureScore.continuous(name, samples, new double[NUM_SAMPLES], isPrecomputed, isPrecomputed ? 0 : 5));
        }
        final List<ProjectionData> projectionData = new ArrayList<>();
        for (final Map<String, Double> logPValues : logPValuesPerProjectionData) {
            projectionData.add(createProjectionData(data, logPValues));
        }
        return new Model(DataKind.EXPRESSION, data).withSignatureScores(scores).withProjectionData(projectionData);
    }

    private static ProjectionData createProjectionData(final ExpressionMatrix data, final Map<String, Double> logPValues) {
        final List<String> samples = data.samples();
        final double[][] consistency = new double[logPValues.size()][1];
        final double[][] p = new double[logPValues.size()][1];
        int row = 0;
        for (final double value : logPValues.values()) {
            p[row++][0] = value;
        }
        final double[][] coordinates = new double[NUM_SAMPLES][];
        for (int j = 0; j < NUM_SAMPLES; j++) {
            coordinates[j] = new double[] {j, -j};
        }
        final Map<String, Projection> projections = new LinkedHashMap<>();
        projections.put("PCA", Projection.of("PCA", samples, coordinates));
        final SignificanceMatrix significance = new SignificanceMatrix(new ArrayList<>(logPValues.keySet()),
                Collections.singletonList("PCA"), consistency, p);
        return new ProjectionData("No_Filter", data.genes(), false, projections, Collections.emptyMap(), significance, null);
    }

    /**
     * {@code numSignificant} signatures at log p -5 and {@code numInsignificant} at 0.
     */
    private static Map<String, Double> logPValues(final int numSignificant, final int numInsignificant) {
        final Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < numSignificant; i++) {
            result.put(String.format("SIG_%03d", i), -5.0);
        }
        for (int i = 0; i < numInsignificant; i++) {
            result.put(String.format("NOISE_%03d", i), 0.0);
        }
        return result;
    }

    @Test
    public void testKeepsEverySignificantSignature() {
        final Map<String, Double> logP = logPValues(250, 50);
        logP.put(PRECOMPUTED, 0.0);
        final PruneDecision decision = new SignificancePruner().decide(createModel(logP, Collections.singleton(PRECOMPUTED)), NUM_SAMPLES, false);
        Assert.assertFalse(decision.isStrictTopK());
        Assert.assertEquals(decision.getThreshold(), SignificancePruner.LOG10_SIGNIFICANCE);
        Assert.assertEquals(decision.getRetained().size(), 251);
        Assert.assertTrue(decision.getRetained().contains(PRECOMPUTED));
        Assert.assertEquals(decision.getPruned().size(), 50);
        Assert.assertTrue(decision.getPruned().stream().allMatch(name -> name.startsWith("NOISE_")));
    }

    @Test
    public void testKeepsAtLeastTheTopRanked() {
        final Map<String, Double> logP = new LinkedHashMap<>();
        logP.put("a", -3.0);
        logP.put("b", -0.1);
        logP.put("c", 0.0);
        final PruneDecision decision = new SignificancePruner().decide(createModel(logP, Collections.emptySet()), NUM_SAMPLES, false);
        Assert.assertEquals(new ArrayList<>(decision.getRetained()), new ArrayList<>(logP.keySet()));
        Assert.assertTrue(decision.getPruned().isEmpty());
    }

    @Test
    public void testStrictTopKForLargeDatasets() {
        final Map<String, Double> logP = logPValues(250, 50);
        logP.put(PRECOMPUTED, 0.0);
        final PruneDecision decision = new SignificancePruner().decide(createModel(logP, Collections.singleton(PRECOMPUTED)), 3000, false);
        Assert.assertTrue(decision.isStrictTopK());
        Assert.assertEquals(decision.getRetained().size(), SignificancePruner.MAX_RETAINED + 1);
        Assert.assertTrue(decision.getRetained().contains(PRECOMPUTED));
        // ties are ranked by name
        Assert.assertTrue(decision.getRetained().contains("SIG_199"));
        Assert.assertFalse(decision.getRetained().contains("SIG_200"));
    }

    @Test
    public void testAllSignatures() {
        final Map<String, Double> logP = logPValues(1, 3);
        final PruneDecision decision = new SignificancePruner().decide(createModel(logP, Collections.emptySet()), NUM_SAMPLES, true);
        Assert.assertEquals(decision.getRetained(), logP.keySet());
        Assert.assertTrue(decision.getPruned().isEmpty());
    }

    @Test
    public void testPruneIsConsistentAndIdempotent() {
        final SignificancePruner pruner = new SignificancePruner();
        final Model pruned = pruner.prune(createModel(logPValues(250, 50), Collections.emptySet()), NUM_SAMPLES, false);
        Assert.assertEquals(pruned.getSignatureScores().size(), 250);
        final ProjectionData pd = pruned.getProjectionData().get(0);
        Assert.assertEquals(pd.getSignatureKeys(), new ArrayList<>(pruned.getSignatureScores().keySet()));
        Assert.assertEquals(pd.getSigProjMatrixP().length, 250);

        final Model again = pruner.prune(pruned, NUM_SAMPLES, false);
        Assert.assertEquals(again.getSignatureScores().keySet(), pruned.getSignatureScores().keySet());
        Assert.assertEquals(again.getProjectionData().get(0).getSignatureKeys(), pd.getSignatureKeys());
    }

    @Test
    public void testSignificanceInAnyProjectionDataKeepsSignature() {
        final String lateOnly = "LATE_ONLY";
        final Map<String, Double> first = logPValues(250, 50);
        first.put(lateOnly, 0.0);
        final Map<String, Double> second = new LinkedHashMap<>();
        first.keySet().forEach(name -> second.put(name, 0.0));
        second.put(lateOnly, -4.0);

        final Model pruned = new SignificancePruner().prune(createModel(Arrays.asList(first, second), Collections.emptySet()), NUM_SAMPLES, false);
        final List<String> keys = new ArrayList<>(pruned.getSignatureScores().keySet());
        Assert.assertEquals(keys.size(), 251);
        Assert.assertTrue(keys.contains(lateOnly));
        Assert.assertTrue(keys.stream().noneMatch(name -> name.startsWith("NOISE_")));

        Assert.assertEquals(pruned.getProjectionData().size(), 2);
        final List<Map<String, Double>> expected = Arrays.asList(first, second);
        for (int d = 0; d < 2; d++) {
            final ProjectionData pd = pruned.getProjectionData().get(d);
            Assert.assertEquals(pd.getSignatureKeys(), keys);
            final double[][] p = pd.getSigProjMatrixP();
            Assert.assertEquals(p.length, keys.size());
            for (int s = 0; s < keys.size(); s++) {
                Assert.assertEquals(p[s][0], expected.get(d).get(keys.get(s)), 0.0, keys.get(s));
            }
        }
    }

    @Test(expectedExceptions = FastProjectException.InconsistentSignatureStateException.class)
    public void testSignatureWithoutSignificance() {
        final Model model = createModel(logPValues(2, 0), Collections.emptySet());
        final List<SignatureScore> scores = new ArrayList<>(model.getSignatureScores().values());
        scores.add(SignatureScore.continuous("unseen", model.getSampleLabels(), new double[NUM_SAMPLES], false, 5));
        new SignificancePruner().decide(model.withSignatureScores(scores), NUM_SAMPLES, false);
    }
}
