package org.broadinstitute.fastproject.tools.signatures.qc;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-gene parameters of the detected / non-detected mixture fitted by {@link ExpressionProbabilityModel},
 * and the probability-of-expression matrix of the samples it was fitted on.
 */
public final class ProbabilityFit {

    private final List<String> genes;
    private final Object2IntMap<String> geneIndex;
    private final double[] muHigh;
    private final double[] sigmaHigh;
    private final double[] muLow;
    private final double[] mixtureWeight;
    private final boolean[] detectable;
    private final RealMatrix probabilities;
    private final int nonConvergedGenes;

    ProbabilityFit(final List<String> genes, final double[] muHigh, final double[] sigmaHigh, final double[] muLow,
                   final double[] mixtureWeight, final boolean[] detectable, final RealMatrix probabilities,
                   final int nonConvergedGenes) {
        this.genes = Collections.unmodifiableList(new ArrayList<>(genes));
        this.muHigh = muHigh;
        this.sigmaHigh = sigmaHigh;
        this.muLow = muLow;
        this.mixtureWeight = mixtureWeight;
        this.detectable = detectable;
        this.probabilities = probabilities;
        this.nonConvergedGenes = nonConvergedGenes;
        this.geneIndex = new Object2IntOpenHashMap<>(genes.size());
        this.geneIndex.defaultReturnValue(-1);
        for (int i = 0; i < genes.size(); i++) {
            geneIndex.put(genes.get(i), i);
        }
    }

    public List<String> getGenes() {
        return genes;
    }

    public double getMuHigh(final String gene) {
        return muHigh[index(gene)];
    }

    public double getSigmaHigh(final String gene) {
        return sigmaHigh[index(gene)];
    }

    public double getMuLow(final String gene) {
        return muLow[index(gene)];
    }

    /**
     * @return the prior probability of the detected component for {@code gene}.
     */
    public double getMixtureWeight(final String gene) {
        return mixtureWeight[index(gene)];
    }

    /**
     * Posterior probability of the detected component for each entry of the matrix the model was fitted on.
     */
    public RealMatrix getProbabilities() {
        return probabilities;
    }

    public int getNonConvergedGenes() {
        return nonConvergedGenes;
    }

    /**
     * Evaluates the fitted posterior on other samples; {@code data} rows must be a subset of the fitted genes.
     */
    public RealMatrix posterior(final ExpressionMatrix data) {
        Utils.nonNull(data);
        final RealMatrix result = new Array2DRowRealMatrix(data.numGenes(), data.numSamples());
        for (int i = 0; i < data.numGenes(); i++) {
            final int g = index(data.genes().get(i));
            for (int j = 0; j < data.numSamples(); j++) {
                result.setEntry(i, j, posterior(g, data.values().getEntry(i, j)));
            }
        }
        return result;
    }

    double posterior(final int g, final double x) {
        if (!detectable[g]) {
            return 0.0;
        }
        return ExpressionProbabilityModel.posterior(x, muHigh[g], sigmaHigh[g], muLow[g], mixtureWeight[g]);
    }

    private int index(final String gene) {
        final int g = geneIndex.getInt(gene);
        Utils.validateArg(g >= 0, () -> String.format("gene '%s' was not part of the probability model", gene));
        return g;
    }
}
