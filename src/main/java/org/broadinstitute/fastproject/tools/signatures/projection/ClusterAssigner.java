package org.broadinstitute.fastproject.tools.signatures.projection;

import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.RandomGenerator;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * K-means++ clusterings of every projection for k = {@value #MIN_CLUSTERS}..{@value #MAX_CLUSTERS}.
 */
public final class ClusterAssigner {

    public static final int MIN_CLUSTERS = 2;
    public static final int MAX_CLUSTERS = 5;
    public static final int MAX_ITERATIONS = 100;

    private final RandomGenerator random;

    public ClusterAssigner(final RandomGenerator random) {
        this.random = Utils.nonNull(random);
    }

    public static String clusteringName(final int k) {
        return "K-Means, k=" + k;
    }

    /**
     * @return projection name to clustering name to one cluster label per sample. Values of k that are not
     *         smaller than the number of samples are left out.
     */
    public Map<String, Map<String, int[]>> defineClusters(final Map<String, Projection> projections) {
        Utils.nonNull(projections);
        final Map<String, Map<String, int[]>> result = new LinkedHashMap<>();
        for (final Projection projection : projections.values()) {
            final List<IndexedPoint> points = new ArrayList<>(projection.numSamples());
            for (int j = 0; j < projection.numSamples(); j++) {
                points.add(new IndexedPoint(j, projection.getX(j), projection.getY(j)));
            }
            final Map<String, int[]> clusterings = new LinkedHashMap<>();
            for (int k = MIN_CLUSTERS; k <= MAX_CLUSTERS && k < points.size(); k++) {
                final KMeansPlusPlusClusterer<IndexedPoint> clusterer =
                        new KMeansPlusPlusClusterer<>(k, MAX_ITERATIONS, new EuclideanDistance(), random);
                final List<CentroidCluster<IndexedPoint>> clusters = clusterer.cluster(points);
                final int[] labels = new int[points.size()];
                for (int c = 0; c < clusters.size(); c++) {
                    for (final IndexedPoint point : clusters.get(c).getPoints()) {
                        labels[point.index] = c;
                    }
                }
                clusterings.put(clusteringName(k), labels);
            }
            result.put(projection.getName(), Collections.unmodifiableMap(clusterings));
        }
        return Collections.unmodifiableMap(result);
    }

    private static final class IndexedPoint implements Clusterable {
        private final int index;
        private final double[] point;

        IndexedPoint(final int index, final double x, final double y) {
            this.index = index;
            this.point = new double[]{x, y};
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
