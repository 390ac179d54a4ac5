package org.broadinstitute.fastproject.tools.signatures.projection;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Samples expressed on the leading principal components of a filtered matrix.
 */
public final class ReducedRepresentation {

    private final List<String> genes;
    private final List<String> samples;
    private final RealMatrix sampleScores;
    private final RealMatrix loadings;

    /**
     * @param sampleScores components x samples
     * @param loadings genes x components
     */
    public ReducedRepresentation(final List<String> genes, final List<String> samples,
                                 final RealMatrix sampleScores, final RealMatrix loadings) {
        Utils.nonNull(genes);
        Utils.nonNull(samples);
        Utils.nonNull(sampleScores);
        Utils.nonNull(loadings);
        Utils.validateArg(sampleScores.getColumnDimension() == samples.size(), "sample scores do not match the samples");
        Utils.validateArg(loadings.getRowDimension() == genes.size(), "loadings do not match the genes");
        Utils.validateArg(loadings.getColumnDimension() == sampleScores.getRowDimension(), "loadings and sample scores disagree on the number of components");
        this.genes = Collections.unmodifiableList(new ArrayList<>(genes));
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
        this.sampleScores = sampleScores.copy();
        this.loadings = loadings.copy();
    }

    public List<String> getGenes() {
        return genes;
    }

    public List<String> getSamples() {
        return samples;
    }

    public int numComponents() {
        return sampleScores.getRowDimension();
    }

    public RealMatrix getSampleScores() {
        return sampleScores;
    }

    public RealMatrix getLoadings() {
        return loadings;
    }

    /**
     * @return genes x min(k, components) matrix with the leading loading vectors.
     */
    public RealMatrix getLeadingLoadings(final int k) {
        Utils.validateArg(k > 0, "k must be > 0");
        final int columns = Math.min(k, numComponents());
        return loadings.getSubMatrix(0, loadings.getRowDimension() - 1, 0, columns - 1);
    }
}
