package org.broadinstitute.fastproject.tools.signatures.filters;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;
import org.broadinstitute.fastproject.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Gene filters attached to an expression matrix before QC and projection.
 *
 * <ul>
 *     <li>{@value #NO_FILTER}: every gene with nonzero variance.</li>
 *     <li>{@value #THRESHOLD}: genes detected (value &gt; 0) in at least {@code threshold} samples.</li>
 *     <li>{@value #FANO}: threshold genes whose Fano factor is high relative to genes of similar mean.</li>
 * </ul>
 */
public final class GeneFilters {
    private static final Logger logger = LogManager.getLogger(GeneFilters.class);

    public static final String NO_FILTER = "No_Filter";
    public static final String THRESHOLD = "Threshold";
    public static final String FANO = "Fano";

    public static final int FANO_BIN_COUNT = 30;
    public static final double FANO_MAD_MULTIPLIER = 1.6;

    private GeneFilters() { }

    /**
     * Drops zero-variance genes and attaches the filters.
     *
     * @param threshold minimum number of samples a gene must be detected in for the {@value #THRESHOLD} filter
     * @param nofilter attach only {@value #NO_FILTER}
     * @param lean skip {@value #FANO}
     * @return a new matrix restricted to genes with nonzero variance, carrying the non-empty filters.
     * @throws UserException.BadInput if every gene has zero variance.
     */
    public static ExpressionMatrix apply(final ExpressionMatrix data, final int threshold,
                                         final boolean nofilter, final boolean lean) {
        Utils.nonNull(data);
        ParamUtils.isPositiveOrZero(threshold, "threshold must be >= 0");
        final RealMatrix values = data.values();
        final Set<String> variable = new HashSet<>();
        for (int i = 0; i < data.numGenes(); i++) {
            if (MathUtils.variance(values.getRow(i)) > 0) {
                variable.add(data.genes().get(i));
            }
        }
        if (variable.isEmpty()) {
            throw new UserException.BadInput("every gene has zero variance across the samples");
        }
        logger.info(String.format("Removed %d genes with zero variance; %d remain", data.numGenes() - variable.size(), variable.size()));
        final ExpressionMatrix retained = data.subsetGenes(variable);

        final Map<String, List<String>> filters = new LinkedHashMap<>();
        filters.put(NO_FILTER, retained.genes());
        if (!nofilter) {
            final List<String> thresholdGenes = thresholdFilter(retained, threshold);
            attachIfNotEmpty(filters, THRESHOLD, thresholdGenes);
            if (!lean && !thresholdGenes.isEmpty()) {
                attachIfNotEmpty(filters, FANO, fanoFilter(retained, thresholdGenes));
            }
        }
        filters.forEach((name, genes) -> logger.info(String.format("Filter %s: %d genes", name, genes.size())));
        return retained.withFilters(filters);
    }

    private static void attachIfNotEmpty(final Map<String, List<String>> filters, final String name, final List<String> genes) {
        if (genes.isEmpty()) {
            logger.warn(String.format("Filter %s selected no genes and is not used", name));
        } else {
            filters.put(name, genes);
        }
    }

    static List<String> thresholdFilter(final ExpressionMatrix data, final int threshold) {
        final RealMatrix values = data.values();
        final List<String> result = new ArrayList<>();
        for (int i = 0; i < data.numGenes(); i++) {
            int detected = 0;
            for (int j = 0; j < data.numSamples(); j++) {
                if (values.getEntry(i, j) > 0) {
                    detected++;
                }
            }
            if (detected >= threshold) {
                result.add(data.genes().get(i));
            }
        }
        return result;
    }

    /**
     * Sorts the candidate genes by mean, splits them into {@value #FANO_BIN_COUNT} bins of equal size and keeps,
     * within each bin, the genes whose Fano factor exceeds the bin median by more than
     * {@value #FANO_MAD_MULTIPLIER} median absolute deviations.
     */
    static List<String> fanoFilter(final ExpressionMatrix data, final List<String> candidates) {
        final int n = candidates.size();
        final double[] means = new double[n];
        final double[] fanos = new double[n];
        for (int g = 0; g < n; g++) {
            final double[] row = data.values().getRow(data.geneIndex(candidates.get(g)));
            means[g] = MathUtils.mean(row);
            fanos[g] = means[g] != 0 ? MathUtils.variance(row) / means[g] : 0.0;
        }
        final int[] byMean = IntStream.range(0, n).boxed()
                .sorted(Comparator.<Integer>comparingDouble(g -> means[g]).thenComparing(g -> g))
                .mapToInt(Integer::intValue).toArray();
        final Set<Integer> keep = new HashSet<>();
        final int bins = Math.min(FANO_BIN_COUNT, n);
        for (int b = 0; b < bins; b++) {
            final int from = (int) ((long) b * n / bins);
            final int to = (int) ((long) (b + 1) * n / bins);
            final double[] binFanos = IntStream.range(from, to).mapToDouble(k -> fanos[byMean[k]]).toArray();
            final double median = MathUtils.median(binFanos);
            final double mad = MathUtils.medianAbsoluteDeviation(binFanos);
            final double cutoff = median + FANO_MAD_MULTIPLIER * mad;
            for (int k = from; k < to; k++) {
                if (fanos[byMean[k]] > cutoff) {
                    keep.add(byMean[k]);
                }
            }
        }
        return IntStream.range(0, n).filter(keep::contains).mapToObj(candidates::get).collect(Collectors.toList());
    }
}
