package org.broadinstitute.fastproject.tools.signatures.qc;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.Collection;
import java.util.Collections;

/**
 * Probability-of-expression transform with false-negative correction and per-sample quality scores.
 */
public final class QualityControlTransform {
    private static final Logger logger = LogManager.getLogger(QualityControlTransform.class);

    private final ExpressionProbabilityModel probabilityModel;

    public QualityControlTransform() {
        this(new ExpressionProbabilityModel());
    }

    public QualityControlTransform(final ExpressionProbabilityModel probabilityModel) {
        this.probabilityModel = Utils.nonNull(probabilityModel);
    }

    /**
     * @param filtered filtered expression matrix
     * @param original unfiltered matrix over the same samples, used for the false-negative curves
     * @param housekeepingGenes genes used to fit the false-negative curves
     * @param inputWeights externally supplied weights covering every gene and sample of {@code filtered}, or {@code null}
     *                     to compute them from the false-negative curves
     * @throws UserException.BadInput if {@code inputWeights} lacks a gene or sample of {@code filtered}.
     */
    public QualityControlResult apply(final ExpressionMatrix filtered, final ExpressionMatrix original,
                                      final Collection<String> housekeepingGenes, final ExpressionMatrix inputWeights) {
        Utils.nonNull(filtered);
        Utils.nonNull(original);
        Utils.validateArg(filtered.samples().equals(original.samples()), "the filtered and original matrices must have the same samples");

        logger.info(String.format("Fitting the expression model on %d genes and %d samples", filtered.numGenes(), filtered.numSamples()));
        final ProbabilityFit fit = probabilityModel.fit(filtered);
        final FalseNegativeModel falseNegativeModel = FalseNegativeModel.fit(original, housekeepingGenes);

        final RealMatrix weights = inputWeights == null
                ? falseNegativeModel.computeWeights(filtered, fit)
                : alignWeights(filtered, inputWeights);
        final RealMatrix adjusted = adjustProbabilities(filtered, fit, weights);
        final ExpressionMatrix probabilityData = filtered.withWeights(weights).asProbability(adjusted);
        final SampleQualityReport report = falseNegativeModel.qualityCheck();
        logger.info(String.format("%d of %d samples pass quality control", report.passingSamples().size(), filtered.numSamples()));
        return new QualityControlResult(fit, falseNegativeModel, weights, probabilityData, report);
    }

    /**
     * p' = w * p + (1 - w) * mixtureWeight, per gene.
     */
    public static RealMatrix adjustProbabilities(final ExpressionMatrix data, final ProbabilityFit fit, final RealMatrix weights) {
        Utils.nonNull(data);
        Utils.nonNull(fit);
        Utils.nonNull(weights);
        Utils.validateArg(weights.getRowDimension() == data.numGenes() && weights.getColumnDimension() == data.numSamples(),
                "the weight matrix dimensions do not match the data");
        final RealMatrix probabilities = fit.posterior(data);
        for (int i = 0; i < data.numGenes(); i++) {
            final double prior = fit.getMixtureWeight(data.genes().get(i));
            for (int j = 0; j < data.numSamples(); j++) {
                final double w = weights.getEntry(i, j);
                probabilities.setEntry(i, j, w * probabilities.getEntry(i, j) + (1 - w) * prior);
            }
        }
        return probabilities;
    }

    /**
     * Reorders externally supplied weights to the labels of {@code data}.
     * @throws UserException.BadInput if a gene or sample of {@code data} is missing.
     */
    public static RealMatrix alignWeights(final ExpressionMatrix data, final ExpressionMatrix inputWeights) {
        Utils.nonNull(data);
        Utils.nonNull(inputWeights);
        final int[] rows = new int[data.numGenes()];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = inputWeights.geneIndex(data.genes().get(i));
            if (rows[i] < 0) {
                throw new UserException.BadInput(String.format("the input weights have no row for gene %s", data.genes().get(i)));
            }
        }
        final int[] columns = new int[data.numSamples()];
        for (int j = 0; j < columns.length; j++) {
            columns[j] = inputWeights.sampleIndex(data.samples().get(j));
            if (columns[j] < 0) {
                throw new UserException.BadInput(String.format("the input weights have no column for sample %s", data.samples().get(j)));
            }
        }
        final RealMatrix result = new Array2DRowRealMatrix(rows.length, columns.length);
        for (int i = 0; i < rows.length; i++) {
            for (int j = 0; j < columns.length; j++) {
                result.setEntry(i, j, inputWeights.values().getEntry(rows[i], columns[j]));
            }
        }
        return result;
    }

    /**
     * Transforms held-out samples with parameters fitted on the working set: weights come from false-negative curves
     * fitted per held-out sample, probabilities from the working-set mixture.
     *
     * @param holdoutFiltered held-out samples restricted to the working set's filtered genes
     * @param holdoutOriginal held-out samples over all genes
     * @param workingSet result of {@link #apply} on the working set
     * @param inputWeights externally supplied weights, used instead of the curves when not {@code null}
     */
    public static QualityControlResult applyToAdditionalSamples(final ExpressionMatrix holdoutFiltered,
                                                               final ExpressionMatrix holdoutOriginal,
                                                               final QualityControlResult workingSet,
                                                               final ExpressionMatrix inputWeights) {
        Utils.nonNull(holdoutFiltered);
        Utils.nonNull(holdoutOriginal);
        Utils.nonNull(workingSet);
        final FalseNegativeModel holdoutModel = workingSet.getFalseNegativeModel().fitAdditionalSamples(holdoutOriginal);
        final RealMatrix weights = inputWeights == null
                ? holdoutModel.computeWeights(holdoutFiltered, workingSet.getProbabilityFit())
                : alignWeights(holdoutFiltered, inputWeights);
        final RealMatrix adjusted = adjustProbabilities(holdoutFiltered, workingSet.getProbabilityFit(), weights);
        final ExpressionMatrix probabilityData = holdoutFiltered.withWeights(weights).asProbability(adjusted);
        final SampleQualityReport report = workingSet.getReport().subsetSamples(Collections.emptyList())
                .appendSamples(holdoutModel.getSamples(), holdoutModel.getMidpoints());
        return new QualityControlResult(workingSet.getProbabilityFit(), holdoutModel, weights, probabilityData, report);
    }
}
