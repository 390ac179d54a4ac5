package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Leaf order of a single-linkage hierarchical clustering of genes on Euclidean distance.
 *
 * <p>
 *     The minimum spanning tree is built with Prim's algorithm. Its edges, taken by increasing length, are the
 *     single-linkage merges; each merge places the cluster holding the lower-indexed endpoint first.
 * </p>
 */
public final class GeneOrdering {

    private GeneOrdering() { }

    public static List<String> leafOrder(final ExpressionMatrix data) {
        Utils.nonNull(data);
        final int n = data.numGenes();
        if (n <= 1) {
            return new ArrayList<>(data.genes());
        }
        final RealMatrix values = data.values();
        final double[][] rows = new double[n][];
        for (int i = 0; i < n; i++) {
            rows[i] = values.getRow(i);
        }

        // Prim
        final boolean[] inTree = new boolean[n];
        final double[] best = new double[n];
        final int[] parent = new int[n];
        Arrays.fill(best, Double.POSITIVE_INFINITY);
        Arrays.fill(parent, -1);
        best[0] = 0;
        final int[][] edges = new int[n - 1][];
        final double[] edgeLengths = new double[n - 1];
        int edgeCount = 0;
        for (int step = 0; step < n; step++) {
            int next = -1;
            for (int i = 0; i < n; i++) {
                if (!inTree[i] && (next < 0 || best[i] < best[next])) {
                    next = i;
                }
            }
            inTree[next] = true;
            if (parent[next] >= 0) {
                edges[edgeCount] = new int[]{parent[next], next};
                edgeLengths[edgeCount] = best[next];
                edgeCount++;
            }
            for (int i = 0; i < n; i++) {
                if (!inTree[i]) {
                    final double d = MathUtils.distanceSquared(rows[next], rows[i]);
                    if (d < best[i]) {
                        best[i] = d;
                        parent[i] = next;
                    }
                }
            }
        }

        // merges in order of increasing length; clusters are linked lists of genes
        final int[] order = IntStream.range(0, n - 1).boxed()
                .sorted(Comparator.<Integer>comparingDouble(e -> edgeLengths[e]).thenComparing(e -> e))
                .mapToInt(Integer::intValue).toArray();
        final int[] root = IntStream.range(0, n).toArray();
        final int[] head = IntStream.range(0, n).toArray();
        final int[] tail = IntStream.range(0, n).toArray();
        final int[] nextLeaf = new int[n];
        Arrays.fill(nextLeaf, -1);
        for (final int e : order) {
            final int a = find(root, Math.min(edges[e][0], edges[e][1]));
            final int b = find(root, Math.max(edges[e][0], edges[e][1]));
            nextLeaf[tail[a]] = head[b];
            tail[a] = tail[b];
            root[b] = a;
        }
        final List<String> result = new ArrayList<>(n);
        for (int leaf = head[find(root, 0)]; leaf >= 0; leaf = nextLeaf[leaf]) {
            result.add(data.genes().get(leaf));
        }
        return result;
    }

    private static int find(final int[] root, final int i) {
        int r = i;
        while (root[r] != r) {
            r = root[r];
        }
        int c = i;
        while (root[c] != r) {
            final int next = root[c];
            root[c] = r;
            c = next;
        }
        return r;
    }
}
