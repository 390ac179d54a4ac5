package org.broadinstitute.fastproject.tools.signatures.significance;

import org.broadinstitute.fastproject.tools.signatures.projection.Projection;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Gaussian-weighted k-nearest-neighbor graph over the samples of a projection.
 *
 * <p>
 *     Each sample keeps its k nearest neighbors with weights exp(-d<sup>2</sup> / sigma<sup>2</sup>), sigma being the
 *     distance to its k-th neighbor, normalized to sum to 1.
 * </p>
 */
public final class NeighborhoodGraph {

    public static final int MIN_NEIGHBORS = 3;

    private final int[][] neighbors;
    private final double[][] weights;

    private NeighborhoodGraph(final int[][] neighbors, final double[][] weights) {
        this.neighbors = neighbors;
        this.weights = weights;
    }

    /**
     * k = round(sqrt(n)) bounded to [{@value #MIN_NEIGHBORS}, n - 1].
     */
    public static int neighborCount(final int numSamples) {
        Utils.validateArg(numSamples >= 2, "at least two samples are required to build a neighborhood graph");
        final int k = (int) Math.round(Math.sqrt(numSamples));
        return Math.min(Math.max(k, MIN_NEIGHBORS), numSamples - 1);
    }

    public static NeighborhoodGraph fromProjection(final Projection projection) {
        Utils.nonNull(projection);
        final int n = projection.numSamples();
        final int k = neighborCount(n);
        final double[][] coordinates = projection.getCoordinates();
        final int[][] neighbors = new int[n][];
        final double[][] weights = new double[n][];
        for (int i = 0; i < n; i++) {
            final double[] d2 = new double[n];
            for (int j = 0; j < n; j++) {
                d2[j] = MathUtils.distanceSquared(coordinates[i], coordinates[j]);
            }
            final int self = i;
            neighbors[i] = IntStream.range(0, n).filter(j -> j != self).boxed()
                    .sorted(Comparator.<Integer>comparingDouble(j -> d2[j]).thenComparing(j -> j))
                    .limit(k).mapToInt(Integer::intValue).toArray();
            final double sigma2 = d2[neighbors[i][k - 1]];
            final double[] w = new double[k];
            for (int m = 0; m < k; m++) {
                w[m] = sigma2 > 0 ? Math.exp(-d2[neighbors[i][m]] / sigma2) : 1.0;
            }
            final double total = MathUtils.sum(w);
            for (int m = 0; m < k; m++) {
                w[m] /= total;
            }
            weights[i] = w;
        }
        return new NeighborhoodGraph(neighbors, weights);
    }

    public int numSamples() {
        return neighbors.length;
    }

    /**
     * 1 - Geary's C of {@code values} over the graph; 0 when the values have no variance.
     */
    public double continuousConsistency(final double[] values) {
        Utils.validateArg(values.length == neighbors.length, "the number of values does not match the graph");
        final int n = values.length;
        final double mean = MathUtils.mean(values);
        double squares = 0;
        for (final double v : values) {
            squares += MathUtils.square(v - mean);
        }
        if (squares <= 0) {
            return 0.0;
        }
        double local = 0;
        for (int i = 0; i < n; i++) {
            for (int m = 0; m < neighbors[i].length; m++) {
                local += weights[i][m] * MathUtils.square(values[i] - values[neighbors[i][m]]);
            }
        }
        // the total edge weight equals n since every row sums to 1
        final double geary = (n - 1) * local / (2.0 * n * squares);
        return 1.0 - geary;
    }

    /**
     * Mean weighted fraction of same-level neighbors minus the chance level sum(p_l^2).
     */
    public double factorConsistency(final int[] codes, final int numLevels) {
        Utils.validateArg(codes.length == neighbors.length, "the number of labels does not match the graph");
        final int n = codes.length;
        final double[] frequencies = new double[numLevels];
        for (final int c : codes) {
            frequencies[c] += 1.0 / n;
        }
        final double chance = Arrays.stream(frequencies).map(MathUtils::square).sum();
        double same = 0;
        for (int i = 0; i < n; i++) {
            for (int m = 0; m < neighbors[i].length; m++) {
                if (codes[neighbors[i][m]] == codes[i]) {
                    same += weights[i][m];
                }
            }
        }
        return same / n - chance;
    }
}
