package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.tools.signatures.projection.Projection;
import org.broadinstitute.fastproject.tools.signatures.significance.SignificanceMatrix;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projections, clusters and signature significance for one (filter, representation) pair of a model.
 */
public final class ProjectionData {

    private final String filterName;
    private final List<String> genes;
    private final boolean pca;
    private final Map<String, Projection> projections;
    private final Map<String, Map<String, int[]>> clusters;
    private final SignificanceMatrix significance;
    private final RealMatrix loadings;

    /**
     * @param genes genes of the filter the projections were computed on
     * @param pca whether the projections were computed on the PCA-reduced representation
     * @param clusters projection name to clustering name to a label per sample
     * @param loadings leading PCA loading vectors (genes x up to 3), {@code null} unless {@code pca}
     * @throws IllegalArgumentException if the projections do not share samples, the clusters or the significance
     *          columns do not match the projections, or loadings are given for a raw representation.
     */
    public ProjectionData(final String filterName, final List<String> genes, final boolean pca,
                          final Map<String, Projection> projections, final Map<String, Map<String, int[]>> clusters,
                          final SignificanceMatrix significance, final RealMatrix loadings) {
        Utils.nonEmpty(filterName, "filter name");
        Utils.nonEmpty(genes, "filter genes");
        Utils.nonEmpty(projections.keySet(), "projections");
        Utils.nonNull(clusters);
        Utils.nonNull(significance);
        Utils.validateArg(pca || loadings == null, "loadings are only defined for the PCA representation");
        final List<String> samples = projections.values().iterator().next().getSamples();
        for (final Projection projection : projections.values()) {
            Utils.validateArg(projection.getSamples().equals(samples), "all projections must share the same samples");
        }
        for (final Map.Entry<String, Map<String, int[]>> entry : clusters.entrySet()) {
            Utils.validateArg(projections.containsKey(entry.getKey()), () -> String.format("clusters refer to unknown projection %s", entry.getKey()));
            for (final int[] labels : entry.getValue().values()) {
                Utils.validateArg(labels.length == samples.size(), "cluster labels do not match the number of samples");
            }
        }
        Utils.validateArg(significance.getProjectionKeys().equals(new ArrayList<>(projections.keySet())),
                "significance columns must match the projections");
        if (loadings != null) {
            Utils.validateArg(loadings.getRowDimension() == genes.size(), "loadings do not match the filter genes");
        }
        this.filterName = filterName;
        this.genes = Collections.unmodifiableList(new ArrayList<>(genes));
        this.pca = pca;
        this.projections = Collections.unmodifiableMap(new LinkedHashMap<>(projections));
        final Map<String, Map<String, int[]>> clustersCopy = new LinkedHashMap<>();
        clusters.forEach((projection, byMethod) -> clustersCopy.put(projection, Collections.unmodifiableMap(new LinkedHashMap<>(byMethod))));
        this.clusters = Collections.unmodifiableMap(clustersCopy);
        this.significance = significance;
        this.loadings = loadings == null ? null : loadings.copy();
    }

    public String getFilterName() {
        return filterName;
    }

    public List<String> getGenes() {
        return genes;
    }

    public boolean isPca() {
        return pca;
    }

    public Map<String, Projection> getProjections() {
        return projections;
    }

    public Map<String, Map<String, int[]>> getClusters() {
        return clusters;
    }

    public List<String> getSamples() {
        return projections.values().iterator().next().getSamples();
    }

    public SignificanceMatrix getSignificance() {
        return significance;
    }

    public List<String> getSignatureKeys() {
        return significance.getSignatureKeys();
    }

    public List<String> getProjectionKeys() {
        return significance.getProjectionKeys();
    }

    /**
     * Consistency statistics, one row per signature key.
     */
    public double[][] getSigProjMatrix() {
        return significance.getConsistency();
    }

    /**
     * log10 empirical p-values, one row per signature key.
     */
    public double[][] getSigProjMatrixP() {
        return significance.getLogPValues();
    }

    /**
     * @return the leading PCA loadings, or {@code null} for the raw representation.
     */
    public RealMatrix getLoadings() {
        return loadings;
    }

    /**
     * Signature name to its smallest log10 p-value across projections.
     */
    public Map<String, Double> minimumLogPValues() {
        final Map<String, Double> result = new LinkedHashMap<>();
        for (int s = 0; s < significance.numSignatures(); s++) {
            result.put(significance.getSignatureKeys().get(s), significance.minimumLogPValue(s));
        }
        return result;
    }

    /**
     * Keeps only the significance rows of the given signatures.
     */
    public ProjectionData retainSignatures(final Collection<String> keep) {
        return new ProjectionData(filterName, genes, pca, projections, clusters, significance.retainSignatures(keep), loadings);
    }

    /**
     * Same significance with extended projections and clusters.
     */
    public ProjectionData withSamples(final Map<String, Projection> newProjections, final Map<String, Map<String, int[]>> newClusters) {
        return new ProjectionData(filterName, genes, pca, newProjections, newClusters, significance, loadings);
    }

    /**
     * Short description such as "Fano, PCA".
     */
    public String describe() {
        return filterName + (pca ? ", PCA" : ", raw");
    }
}
