package org.broadinstitute.fastproject.tools.signatures.data;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Labeled genes x samples matrix with optional per-entry weights and a set of named gene filters.
 *
 * <p>
 *     Instances are immutable: every transformation returns a new matrix. Accessors that return a
 *     {@link RealMatrix} hand out the live internal object, which callers must not modify.
 * </p>
 *
 * Developer note: any public constructor of this class must verify that genes and samples do not contain duplicates.
 */
public final class ExpressionMatrix {

    private final DataKind kind;

    /**
     * Unmodifiable gene list in the row order of {@link #values}.
     */
    private final List<String> genes;

    /**
     * Unmodifiable sample list in the column order of {@link #values}.
     */
    private final List<String> samples;

    private final RealMatrix values;

    /**
     * Per-entry weights with the same shape as {@link #values}, or {@code null}.
     */
    private final RealMatrix weights;

    /**
     * Filter name to ordered gene subset, in insertion order.
     */
    private final Map<String, List<String>> filters;

    private final Object2IntMap<String> geneIndex;

    private final Object2IntMap<String> sampleIndex;

    /**
     * Creates a new matrix without weights or filters.
     *
     * <p>
     *     The new instance will have its own copy of the labels and values, so the arguments can be modified
     *     after this call safely.
     * </p>
     *
     * @throws IllegalArgumentException if any argument is {@code null}, the labels contain {@code null}s or
     *          duplicates, or the matrix dimensions do not match the labels.
     */
    public ExpressionMatrix(final DataKind kind, final List<String> genes, final List<String> samples, final RealMatrix values) {
        this(kind, genes, samples, values, null, Collections.emptyMap(), true);
    }

    private ExpressionMatrix(final DataKind kind, final List<String> genes, final List<String> samples,
                             final RealMatrix values, final RealMatrix weights,
                             final Map<String, List<String>> filters, final boolean verifyInput) {
        if (verifyInput) {
            Utils.nonNull(kind, "the data kind cannot be null");
            Utils.nonNull(genes, "the genes cannot be null");
            Utils.nonNull(samples, "the samples cannot be null");
            Utils.nonNull(values, "the values cannot be null");
            Utils.containsNoNull(genes, "there are some null genes");
            Utils.containsNoNull(samples, "there are some null samples");
            Utils.validateArg(values.getRowDimension() == genes.size(), "number of rows does not match the number of genes");
            Utils.validateArg(values.getColumnDimension() == samples.size(), "number of columns does not match the number of samples");
            Utils.validateArg(new HashSet<>(genes).size() == genes.size(), "genes contain duplicates");
            Utils.validateArg(new HashSet<>(samples).size() == samples.size(), "samples contain duplicates");
            this.genes = Collections.unmodifiableList(new ArrayList<>(genes));
            this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
            this.values = values.copy();
        } else {
            this.genes = genes;
            this.samples = samples;
            this.values = values;
        }
        this.kind = kind;
        this.weights = weights;
        this.filters = filters;
        this.geneIndex = createIndexMap(this.genes);
        this.sampleIndex = createIndexMap(this.samples);
    }

    private static Object2IntMap<String> createIndexMap(final List<String> labels) {
        final Object2IntMap<String> result = new Object2IntOpenHashMap<>(labels.size());
        result.defaultReturnValue(-1);
        for (int i = 0; i < labels.size(); i++) {
            result.put(labels.get(i), i);
        }
        return result;
    }

    public DataKind kind() {
        return kind;
    }

    public List<String> genes() {
        return genes;
    }

    public List<String> samples() {
        return samples;
    }

    public int numGenes() {
        return genes.size();
    }

    public int numSamples() {
        return samples.size();
    }

    public RealMatrix values() {
        return values;
    }

    /**
     * @return the weight matrix, or {@code null} if no weights were attached.
     */
    public RealMatrix weights() {
        return weights;
    }

    public boolean hasWeights() {
        return weights != null;
    }

    /**
     * @return unmodifiable map from filter name to its genes, in the order the filters were attached.
     */
    public Map<String, List<String>> filters() {
        return filters;
    }

    /**
     * @return the row index of {@code gene}, or -1 if absent.
     */
    public int geneIndex(final String gene) {
        return geneIndex.getInt(gene);
    }

    /**
     * @return the column index of {@code sample}, or -1 if absent.
     */
    public int sampleIndex(final String sample) {
        return sampleIndex.getInt(sample);
    }

    /**
     * Returns the genes of a filter.
     * @throws IllegalArgumentException if no filter with that name is attached.
     */
    public List<String> filteredGenes(final String filterName) {
        Utils.nonNull(filterName);
        final List<String> result = filters.get(filterName);
        Utils.validateArg(result != null, () -> String.format("unknown filter '%s'; attached filters are %s", filterName, filters.keySet()));
        return result;
    }

    /**
     * Replaces the attached filters.
     * @throws IllegalArgumentException if any filter references a gene that is not in this matrix.
     */
    public ExpressionMatrix withFilters(final Map<String, List<String>> newFilters) {
        Utils.nonNull(newFilters);
        final Map<String, List<String>> copy = new LinkedHashMap<>();
        for (final Map.Entry<String, List<String>> entry : newFilters.entrySet()) {
            Utils.containsNoNull(entry.getValue(), "filter genes cannot contain null");
            for (final String gene : entry.getValue()) {
                Utils.validateArg(geneIndex(gene) >= 0, () -> String.format("filter '%s' contains unknown gene '%s'", entry.getKey(), gene));
            }
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        return new ExpressionMatrix(kind, genes, samples, values, weights, Collections.unmodifiableMap(copy), false);
    }

    /**
     * Attaches a weight matrix of the same shape; {@code null} removes the weights.
     */
    public ExpressionMatrix withWeights(final RealMatrix newWeights) {
        if (newWeights != null) {
            Utils.validateArg(newWeights.getRowDimension() == genes.size() && newWeights.getColumnDimension() == samples.size(),
                    "the weight matrix dimensions do not match the data");
        }
        return new ExpressionMatrix(kind, genes, samples, values, newWeights == null ? null : newWeights.copy(), filters, false);
    }

    /**
     * Returns a matrix of kind {@link DataKind#PROBABILITY} with the same labels, weights and filters.
     */
    public ExpressionMatrix asProbability(final RealMatrix probabilities) {
        Utils.nonNull(probabilities);
        Utils.validateArg(probabilities.getRowDimension() == genes.size() && probabilities.getColumnDimension() == samples.size(),
                "the probability matrix dimensions do not match the data");
        return new ExpressionMatrix(DataKind.PROBABILITY, genes, samples, probabilities.copy(), weights, filters, false);
    }

    /**
     * Same labels, weights and filters with replaced values.
     */
    public ExpressionMatrix withValues(final RealMatrix newValues) {
        Utils.nonNull(newValues);
        Utils.validateArg(newValues.getRowDimension() == genes.size() && newValues.getColumnDimension() == samples.size(),
                "the value matrix dimensions do not match the data");
        return new ExpressionMatrix(kind, genes, samples, newValues.copy(), weights, filters, false);
    }

    /**
     * Subsets the samples, keeping the original column order.
     * @throws IllegalArgumentException if {@code samplesToKeep} is empty or contains unknown samples.
     */
    public ExpressionMatrix subsetSamples(final Set<String> samplesToKeep) {
        Utils.nonEmpty(samplesToKeep, "the number of samples to keep must be greater than 0");
        if (!sampleIndex.keySet().containsAll(samplesToKeep)) {
            throw unknownLabels("samples", samplesToKeep, sampleIndex.keySet());
        }
        final boolean[] mask = new boolean[samples.size()];
        for (int j = 0; j < mask.length; j++) {
            mask[j] = samplesToKeep.contains(samples.get(j));
        }
        return subsetSamples(mask);
    }

    /**
     * Subsets the samples whose mask entry is {@code true}, keeping the original column order.
     */
    public ExpressionMatrix subsetSamples(final boolean[] mask) {
        Utils.nonNull(mask);
        Utils.validateArg(mask.length == samples.size(), "the mask length does not match the number of samples");
        final int[] keep = IntStream.range(0, mask.length).filter(j -> mask[j]).toArray();
        Utils.validateArg(keep.length > 0, "the number of samples to keep must be greater than 0");
        if (keep.length == samples.size()) {
            return this;
        }
        final List<String> resultSamples = Arrays.stream(keep).mapToObj(samples::get).collect(Collectors.toList());
        return new ExpressionMatrix(kind, genes, Collections.unmodifiableList(resultSamples),
                selectColumns(values, keep), weights == null ? null : selectColumns(weights, keep), filters, false);
    }

    /**
     * Subsets the genes, keeping the original row order. Filters are restricted to the kept genes and
     * filters left empty are removed.
     */
    public ExpressionMatrix subsetGenes(final Set<String> genesToKeep) {
        Utils.nonEmpty(genesToKeep, "the number of genes to keep must be greater than 0");
        if (!geneIndex.keySet().containsAll(genesToKeep)) {
            throw unknownLabels("genes", genesToKeep, geneIndex.keySet());
        }
        final int[] keep = IntStream.range(0, genes.size()).filter(i -> genesToKeep.contains(genes.get(i))).toArray();
        final List<String> resultGenes = Arrays.stream(keep).mapToObj(genes::get).collect(Collectors.toList());
        final Map<String, List<String>> resultFilters = new LinkedHashMap<>();
        for (final Map.Entry<String, List<String>> entry : filters.entrySet()) {
            final List<String> kept = entry.getValue().stream().filter(genesToKeep::contains).collect(Collectors.toList());
            if (!kept.isEmpty()) {
                resultFilters.put(entry.getKey(), Collections.unmodifiableList(kept));
            }
        }
        return new ExpressionMatrix(kind, Collections.unmodifiableList(resultGenes), samples,
                selectRows(values, keep), weights == null ? null : selectRows(weights, keep),
                Collections.unmodifiableMap(resultFilters), false);
    }

    /**
     * Restricts the rows to the genes of a filter, in the filter's order.
     */
    public ExpressionMatrix restrictToFilter(final String filterName) {
        final List<String> filterGenes = filteredGenes(filterName);
        return arrangeGenes(filterGenes, false);
    }

    /**
     * Rearranges all genes so that they follow {@code genesInOrder}.
     * @throws IllegalArgumentException if {@code genesInOrder} is not a permutation of this matrix's genes.
     */
    public ExpressionMatrix arrangeGenes(final List<String> genesInOrder) {
        Utils.nonNull(genesInOrder);
        Utils.validateArg(genesInOrder.size() == genes.size() && new HashSet<>(genesInOrder).equals(geneIndex.keySet()),
                "the new gene order must be a permutation of the current genes");
        return arrangeGenes(genesInOrder, true);
    }

    private ExpressionMatrix arrangeGenes(final List<String> genesInOrder, final boolean keepFilters) {
        final int[] rows = new int[genesInOrder.size()];
        for (int i = 0; i < rows.length; i++) {
            final String gene = genesInOrder.get(i);
            rows[i] = geneIndex(gene);
            Utils.validateArg(rows[i] >= 0, () -> String.format("gene '%s' is not present in the matrix", gene));
        }
        final Map<String, List<String>> resultFilters;
        if (keepFilters) {
            resultFilters = filters;
        } else {
            final Set<String> kept = new HashSet<>(genesInOrder);
            final Map<String, List<String>> restricted = new LinkedHashMap<>();
            filters.forEach((name, filterGenes) -> {
                final List<String> g = filterGenes.stream().filter(kept::contains).collect(Collectors.toList());
                if (!g.isEmpty()) {
                    restricted.put(name, Collections.unmodifiableList(g));
                }
            });
            resultFilters = Collections.unmodifiableMap(restricted);
        }
        return new ExpressionMatrix(kind, Collections.unmodifiableList(new ArrayList<>(genesInOrder)), samples,
                selectRows(values, rows), weights == null ? null : selectRows(weights, rows), resultFilters, false);
    }

    /**
     * @return genes x samples mask of the entries equal to zero.
     */
    public boolean[][] zeroMask() {
        final boolean[][] result = new boolean[genes.size()][samples.size()];
        for (int i = 0; i < result.length; i++) {
            for (int j = 0; j < result[i].length; j++) {
                result[i][j] = values.getEntry(i, j) == 0.0;
            }
        }
        return result;
    }

    /**
     * Appends the columns of {@code other}, which must have the same kind and genes (in any order)
     * and disjoint samples. The result keeps weights only when both inputs have them.
     */
    public ExpressionMatrix appendSamples(final ExpressionMatrix other) {
        Utils.nonNull(other);
        Utils.validateArg(other.kind == kind, "cannot append samples of a different data kind");
        Utils.validateArg(other.numGenes() == numGenes() && other.geneIndex.keySet().containsAll(genes),
                "cannot append samples with different genes");
        for (final String sample : other.samples) {
            Utils.validateArg(sampleIndex(sample) < 0, () -> String.format("sample '%s' is already present", sample));
        }
        final ExpressionMatrix aligned = other.genes.equals(genes) ? other : other.arrangeGenes(genes);
        final List<String> resultSamples = new ArrayList<>(samples);
        resultSamples.addAll(aligned.samples);
        final RealMatrix resultValues = concatenateColumns(values, aligned.values);
        final RealMatrix resultWeights = weights != null && aligned.weights != null
                ? concatenateColumns(weights, aligned.weights) : null;
        return new ExpressionMatrix(kind, genes, Collections.unmodifiableList(resultSamples), resultValues, resultWeights, filters, false);
    }

    private static RealMatrix concatenateColumns(final RealMatrix left, final RealMatrix right) {
        final RealMatrix result = new Array2DRowRealMatrix(left.getRowDimension(), left.getColumnDimension() + right.getColumnDimension());
        result.setSubMatrix(left.getData(), 0, 0);
        result.setSubMatrix(right.getData(), 0, left.getColumnDimension());
        return result;
    }

    private static RealMatrix selectRows(final RealMatrix matrix, final int[] rows) {
        final double[][] result = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            result[i] = matrix.getRow(rows[i]);
        }
        return new Array2DRowRealMatrix(result, false);
    }

    private static RealMatrix selectColumns(final RealMatrix matrix, final int[] columns) {
        final RealMatrix result = new Array2DRowRealMatrix(matrix.getRowDimension(), columns.length);
        for (int j = 0; j < columns.length; j++) {
            result.setColumn(j, matrix.getColumn(columns[j]));
        }
        return result;
    }

    private static IllegalArgumentException unknownLabels(final String role, final Collection<String> requested, final Set<String> present) {
        return new IllegalArgumentException(String.format("some %s to keep are not part of this matrix: e.g. %s", role,
                requested.stream().filter(name -> !present.contains(name)).limit(5).collect(Collectors.joining(", "))));
    }
}
