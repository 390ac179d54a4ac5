package org.broadinstitute.fastproject.tools.signatures.significance;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.FastProjectException;
import org.broadinstitute.fastproject.tools.signatures.projection.Projection;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;
import org.broadinstitute.fastproject.utils.Utils;
import org.broadinstitute.fastproject.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Measures how consistent each signature score is with each projection and how that compares to a null.
 *
 * <p>
 *     Continuous scores are compared against the consistency of background signature scores of similar size.
 *     Factor scores are compared against random permutations of their own labels. The p-value is
 *     (1 + #null &ge; statistic) / (1 + null size) and is stored on the log10 scale.
 * </p>
 */
public final class SignatureProjectionSignificance {
    private static final Logger logger = LogManager.getLogger(SignatureProjectionSignificance.class);

    public static final int DEFAULT_FACTOR_PERMUTATIONS = 200;

    private final RandomGenerator random;
    private final int factorPermutations;
    private final ExecutorService executor;

    /**
     * @param random random source for factor label permutations
     * @param executor pool used to evaluate background statistics
     */
    public SignatureProjectionSignificance(final RandomGenerator random, final int factorPermutations, final ExecutorService executor) {
        this.random = Utils.nonNull(random);
        this.factorPermutations = ParamUtils.isPositive(factorPermutations, "the number of factor permutations must be > 0");
        this.executor = Utils.nonNull(executor);
    }

    /**
     * @param projections projections, all over the same samples
     * @param scores real and precomputed signature scores, aligned with the projection samples
     * @param backgroundScores background signature scores, aligned with the projection samples
     * @throws IllegalArgumentException if any score's samples differ from a projection's samples.
     */
    public SignificanceMatrix compute(final Map<String, Projection> projections, final List<SignatureScore> scores,
                                      final List<SignatureScore> backgroundScores) {
        Utils.nonNull(projections);
        Utils.nonNull(scores);
        Utils.nonNull(backgroundScores);
        final List<String> projectionKeys = new ArrayList<>(projections.keySet());
        final List<String> signatureKeys = scores.stream().map(SignatureScore::getName).collect(Collectors.toList());
        final double[][] consistency = new double[scores.size()][projectionKeys.size()];
        final double[][] logPValues = new double[scores.size()][projectionKeys.size()];
        boolean warnedEmptyNull = false;

        for (int p = 0; p < projectionKeys.size(); p++) {
            final Projection projection = projections.get(projectionKeys.get(p));
            checkAlignment(projection, scores);
            checkAlignment(projection, backgroundScores);
            final NeighborhoodGraph graph = NeighborhoodGraph.fromProjection(projection);
            final BackgroundNull backgroundNull = new BackgroundNull(backgroundStatistics(graph, backgroundScores));

            for (int s = 0; s < scores.size(); s++) {
                final SignatureScore score = scores.get(s);
                final double statistic;
                final double[] nullStatistics;
                if (score.isFactor()) {
                    final int[] codes = score.getLevelCodes();
                    statistic = graph.factorConsistency(codes, score.numLevels());
                    nullStatistics = permutationNull(graph, codes, score.numLevels());
                } else {
                    statistic = graph.continuousConsistency(score.getValues());
                    nullStatistics = backgroundNull.forSize(score.getNumGenes());
                }
                if (nullStatistics.length == 0 && !warnedEmptyNull) {
                    logger.warn("No background statistics are available; reporting p = 1 for the affected signatures");
                    warnedEmptyNull = true;
                }
                consistency[s][p] = statistic;
                logPValues[s][p] = Math.log10(empiricalPValue(statistic, nullStatistics));
            }
        }
        return new SignificanceMatrix(signatureKeys, projectionKeys, consistency, logPValues);
    }

    /**
     * (1 + #{null &ge; statistic}) / (1 + |null|); 1 for an empty null.
     */
    public static double empiricalPValue(final double statistic, final double[] nullStatistics) {
        int atLeast = 0;
        for (final double v : nullStatistics) {
            if (v >= statistic) {
                atLeast++;
            }
        }
        return (1.0 + atLeast) / (1.0 + nullStatistics.length);
    }

    private static void checkAlignment(final Projection projection, final List<SignatureScore> scores) {
        for (final SignatureScore score : scores) {
            Utils.validateArg(score.getSamples().equals(projection.getSamples()),
                    () -> String.format("the samples of score %s do not match the samples of projection %s", score.getName(), projection.getName()));
        }
    }

    private Map<Integer, double[]> backgroundStatistics(final NeighborhoodGraph graph, final List<SignatureScore> backgroundScores) {
        final List<Future<Double>> futures = new ArrayList<>(backgroundScores.size());
        for (final SignatureScore score : backgroundScores) {
            futures.add(executor.submit(() -> graph.continuousConsistency(score.getValues())));
        }
        final Map<Integer, List<Double>> bySize = new TreeMap<>();
        try {
            for (int b = 0; b < futures.size(); b++) {
                bySize.computeIfAbsent(backgroundScores.get(b).getNumGenes(), size -> new ArrayList<>()).add(futures.get(b).get());
            }
        } catch (final InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new FastProjectException("interrupted while evaluating background signatures", e);
        } catch (final ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new FastProjectException("failed to evaluate a background signature", e.getCause());
        }
        final Map<Integer, double[]> result = new TreeMap<>();
        bySize.forEach((size, values) -> result.put(size, values.stream().mapToDouble(Double::doubleValue).toArray()));
        return result;
    }

    private double[] permutationNull(final NeighborhoodGraph graph, final int[] codes, final int numLevels) {
        final double[] result = new double[factorPermutations];
        final int[] permuted = codes.clone();
        for (int r = 0; r < factorPermutations; r++) {
            for (int i = permuted.length - 1; i > 0; i--) {
                final int j = random.nextInt(i + 1);
                final int tmp = permuted[i];
                permuted[i] = permuted[j];
                permuted[j] = tmp;
            }
            result[r] = graph.factorConsistency(permuted, numLevels);
        }
        return result;
    }

    /**
     * Background statistics binned by signature size.
     */
    static final class BackgroundNull {
        private final int[] sizes;
        private final double[][] statistics;
        private final double[] pooled;

        BackgroundNull(final Map<Integer, double[]> bySize) {
            sizes = bySize.keySet().stream().mapToInt(Integer::intValue).toArray();
            statistics = bySize.values().toArray(new double[0][]);
            pooled = Arrays.stream(statistics).flatMapToDouble(Arrays::stream).toArray();
        }

        /**
         * Statistics of the bin whose size is nearest to {@code numGenes} in log space; ties go to the smaller size.
         * Scores without a gene count use all bins.
         */
        double[] forSize(final int numGenes) {
            if (sizes.length == 0) {
                return new double[0];
            }
            if (numGenes <= 0) {
                return pooled;
            }
            int best = 0;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int b = 0; b < sizes.length; b++) {
                final double distance = Math.abs(Math.log(sizes[b]) - Math.log(numGenes));
                if (distance < bestDistance) {
                    best = b;
                    bestDistance = distance;
                }
            }
            return statistics[best];
        }
    }
}
