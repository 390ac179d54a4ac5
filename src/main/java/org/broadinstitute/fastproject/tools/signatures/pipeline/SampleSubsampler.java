package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.FastProjectException;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.tools.signatures.projection.Projection;
import org.broadinstitute.fastproject.tools.signatures.scoring.ScoringOutcome;
import org.broadinstitute.fastproject.tools.signatures.scoring.Signature;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScorer;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;
import org.broadinstitute.fastproject.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Splits samples into a working set and held-out samples, and merges held-out samples back into finished models.
 */
public final class SampleSubsampler {
    private static final Logger logger = LogManager.getLogger(SampleSubsampler.class);

    public static final int HOLDOUT_NEIGHBORS = 10;

    private final RandomGenerator random;

    public SampleSubsampler(final RandomGenerator random) {
        this.random = Utils.nonNull(random);
    }

    /**
     * Working set and held-out samples. {@link #getHoldout()} is {@code null} when no split happened.
     */
    public static final class Split {
        private final ExpressionMatrix working;
        private final ExpressionMatrix holdout;

        Split(final ExpressionMatrix working, final ExpressionMatrix holdout) {
            this.working = working;
            this.holdout = holdout;
        }

        public ExpressionMatrix getWorking() {
            return working;
        }

        public ExpressionMatrix getHoldout() {
            return holdout;
        }

        public boolean isSplit() {
            return holdout != null;
        }
    }

    /**
     * Draws {@code subsampleSize} samples at random for the working set; both parts keep the input sample order.
     * A size of at least the number of samples means no split.
     */
    public Split split(final ExpressionMatrix data, final int subsampleSize) {
        Utils.nonNull(data);
        ParamUtils.isPositive(subsampleSize, "the sub-sample size must be > 0");
        final int n = data.numSamples();
        if (subsampleSize >= n) {
            return new Split(data, null);
        }
        final int[] indices = IntStream.range(0, n).toArray();
        for (int i = 0; i < subsampleSize; i++) {
            final int j = i + random.nextInt(n - i);
            final int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        final boolean[] working = new boolean[n];
        for (int i = 0; i < subsampleSize; i++) {
            working[indices[i]] = true;
        }
        final boolean[] holdout = new boolean[n];
        for (int j = 0; j < n; j++) {
            holdout[j] = !working[j];
        }
        logger.info(String.format("Using %d of %d samples as the working set", subsampleSize, n));
        return new Split(data.subsetSamples(working), data.subsetSamples(holdout));
    }

    /**
     * Adds held-out samples to a finished model.
     *
     * <ul>
     *     <li>Signature scores are recomputed on the held-out data, normalized with the working set's row statistics.</li>
     *     <li>Precomputed scores are extended with {@code holdoutPrecomputed}.</li>
     *     <li>Each held-out sample is placed at the inverse-distance weighted mean of its {@value #HOLDOUT_NEIGHBORS}
     *     nearest working samples, measured over the filter's genes, and takes the cluster labels of its nearest
     *     working sample.</li>
     *     <li>Significance matrices are kept as they are.</li>
     * </ul>
     *
     * @param holdoutData held-out samples with the model's kind, genes and weights
     * @param scorer scorer configured as for the model
     * @param signatures signatures by name; must contain every score of the model that is not precomputed
     * @param holdoutPrecomputed precomputed scores over the held-out samples, by name
     */
    public Model merge(final Model model, final ExpressionMatrix holdoutData, final SignatureScorer scorer,
                       final Map<String, Signature> signatures, final Map<String, SignatureScore> holdoutPrecomputed) {
        Utils.nonNull(model);
        Utils.nonNull(holdoutData);
        Utils.nonNull(scorer);
        Utils.nonNull(signatures);
        Utils.nonNull(holdoutPrecomputed);
        final ExpressionMatrix working = model.getData();
        final ExpressionMatrix holdout = holdoutData.genes().equals(working.genes()) ? holdoutData : holdoutData.arrangeGenes(working.genes());

        final SignatureScorer.PreparedData prepared = scorer.prepare(holdout,
                MathUtils.rowMeans(working.values()), MathUtils.rowStandardDeviations(working.values()));
        final List<SignatureScore> mergedScores = new ArrayList<>();
        for (final SignatureScore score : model.getSignatureScores().values()) {
            final SignatureScore holdoutScore;
            if (score.isPrecomputed()) {
                holdoutScore = holdoutPrecomputed.get(score.getName());
                Utils.validateArg(holdoutScore != null,
                        () -> String.format("no held-out values for precomputed score %s", score.getName()));
            } else {
                final Signature signature = signatures.get(score.getName());
                Utils.validateArg(signature != null, () -> String.format("unknown signature %s", score.getName()));
                final ScoringOutcome outcome = scorer.score(prepared, signature);
                if (outcome.isSkipped()) {
                    throw new FastProjectException(String.format("signature %s could not be scored on held-out samples: %s",
                            score.getName(), outcome.getSkipReason()));
                }
                holdoutScore = outcome.getScore();
            }
            mergedScores.add(score.appendSamples(holdoutScore.subsetSamples(holdout.samples())));
        }

        final List<ProjectionData> mergedProjectionData = new ArrayList<>();
        for (final ProjectionData pd : model.getProjectionData()) {
            mergedProjectionData.add(mergeProjectionData(pd, working, holdout));
        }
        final Model result = model.withData(working.appendSamples(holdout))
                .withSignatureScores(mergedScores)
                .withProjectionData(mergedProjectionData);
        result.validateConsistency();
        logger.info(String.format("Merged %d held-out samples into model %s", holdout.numSamples(), model.getName()));
        return result;
    }

    private static ProjectionData mergeProjectionData(final ProjectionData pd, final ExpressionMatrix working, final ExpressionMatrix holdout) {
        final int[] rows = pd.getGenes().stream().mapToInt(working::geneIndex).toArray();
        final double[][] workingPoints = columnsOnRows(working.values(), rows);
        final double[][] holdoutPoints = columnsOnRows(holdout.values(), rows);
        final int k = Math.min(HOLDOUT_NEIGHBORS, workingPoints.length);

        final int[][] neighbors = new int[holdoutPoints.length][];
        final double[][] neighborWeights = new double[holdoutPoints.length][];
        for (int h = 0; h < holdoutPoints.length; h++) {
            final double[] distances = new double[workingPoints.length];
            for (int w = 0; w < workingPoints.length; w++) {
                distances[w] = Math.sqrt(MathUtils.distanceSquared(holdoutPoints[h], workingPoints[w]));
            }
            neighbors[h] = IntStream.range(0, workingPoints.length).boxed()
                    .sorted(Comparator.<Integer>comparingDouble(w -> distances[w]).thenComparing(w -> w))
                    .limit(k).mapToInt(Integer::intValue).toArray();
            neighborWeights[h] = inverseDistanceWeights(neighbors[h], distances);
        }

        final Map<String, Projection> projections = new LinkedHashMap<>();
        for (final Projection projection : pd.getProjections().values()) {
            final double[][] coordinates = new double[holdoutPoints.length][2];
            for (int h = 0; h < coordinates.length; h++) {
                for (int m = 0; m < neighbors[h].length; m++) {
                    coordinates[h][0] += neighborWeights[h][m] * projection.getX(neighbors[h][m]);
                    coordinates[h][1] += neighborWeights[h][m] * projection.getY(neighbors[h][m]);
                }
            }
            projections.put(projection.getName(), projection.appendSamples(holdout.samples(), coordinates));
        }
        final Map<String, Map<String, int[]>> clusters = new LinkedHashMap<>();
        pd.getClusters().forEach((projectionName, byMethod) -> {
            final Map<String, int[]> extended = new LinkedHashMap<>();
            byMethod.forEach((method, labels) -> {
                final int[] result = Arrays.copyOf(labels, labels.length + holdoutPoints.length);
                for (int h = 0; h < holdoutPoints.length; h++) {
                    result[labels.length + h] = labels[neighbors[h][0]];
                }
                extended.put(method, result);
            });
            clusters.put(projectionName, extended);
        });
        return pd.withSamples(projections, clusters);
    }

    /**
     * Weights proportional to 1 / distance; an exact match takes all the weight.
     */
    private static double[] inverseDistanceWeights(final int[] neighbors, final double[] distances) {
        final double[] weights = new double[neighbors.length];
        if (distances[neighbors[0]] == 0) {
            weights[0] = 1.0;
            return weights;
        }
        for (int m = 0; m < neighbors.length; m++) {
            weights[m] = 1.0 / distances[neighbors[m]];
        }
        final double total = MathUtils.sum(weights);
        for (int m = 0; m < weights.length; m++) {
            weights[m] /= total;
        }
        return weights;
    }

    /**
     * One point per column, restricted to the given rows.
     */
    private static double[][] columnsOnRows(final RealMatrix matrix, final int[] rows) {
        final double[][] result = new double[matrix.getColumnDimension()][rows.length];
        for (int j = 0; j < result.length; j++) {
            for (int r = 0; r < rows.length; r++) {
                result[j][r] = matrix.getEntry(rows[r], j);
            }
        }
        return result;
    }
}
