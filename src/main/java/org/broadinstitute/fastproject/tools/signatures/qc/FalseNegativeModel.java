package org.broadinstitute.fastproject.tools.signatures.qc;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.FastProjectException;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-sample false-negative curves: the probability that a gene is detected in a sample as a logistic function
 * of the gene's expected expression, fitted on housekeeping genes.
 *
 * <p>
 *     The expected expression of a gene is the mean of its nonzero values over the samples the model was fitted on.
 *     Each sample's curve is fitted by iteratively reweighted least squares with a small ridge penalty, which keeps
 *     the coefficients finite for samples where every gene, or no gene, is detected.
 * </p>
 */
public final class FalseNegativeModel {
    private static final Logger logger = LogManager.getLogger(FalseNegativeModel.class);

    public static final int MIN_HOUSEKEEPING_GENES = 10;

    static final double RIDGE = 1e-2;
    static final int MAX_ITERATIONS = 50;
    static final double TOLERANCE = 1e-8;

    private final List<String> samples;
    private final double[] intercepts;
    private final double[] slopes;
    private final double[] midpoints;
    private final Map<String, Double> geneExpectations;
    private final List<String> fitGenes;
    private final int nonConvergedSamples;

    private FalseNegativeModel(final List<String> samples, final double[] intercepts, final double[] slopes,
                               final double[] midpoints, final Map<String, Double> geneExpectations, final List<String> fitGenes,
                               final int nonConvergedSamples) {
        this.samples = samples;
        this.intercepts = intercepts;
        this.slopes = slopes;
        this.midpoints = midpoints;
        this.geneExpectations = geneExpectations;
        this.fitGenes = fitGenes;
        this.nonConvergedSamples = nonConvergedSamples;
    }

    /**
     * Intercept and slope of one sample's curve.
     */
    static final class LogisticCurve {
        final double intercept;
        final double slope;
        final boolean converged;

        LogisticCurve(final double intercept, final double slope, final boolean converged) {
            this.intercept = intercept;
            this.slope = slope;
            this.converged = converged;
        }
    }

    /**
     * Fits a curve for every sample of {@code data}.
     *
     * @param data unfiltered expression matrix
     * @param housekeepingGenes genes expected to be expressed in every sample; if fewer than
     *                          {@value #MIN_HOUSEKEEPING_GENES} are present in the data, all genes are used.
     * @throws UserException.BadInput if no gene has a nonzero value.
     */
    public static FalseNegativeModel fit(final ExpressionMatrix data, final Collection<String> housekeepingGenes) {
        return fit(data, housekeepingGenes, MAX_ITERATIONS);
    }

    static FalseNegativeModel fit(final ExpressionMatrix data, final Collection<String> housekeepingGenes, final int maxIterations) {
        Utils.nonNull(data);
        Utils.nonNull(housekeepingGenes);
        final Map<String, Double> expectations = new LinkedHashMap<>();
        for (int i = 0; i < data.numGenes(); i++) {
            double sum = 0;
            int count = 0;
            for (int j = 0; j < data.numSamples(); j++) {
                final double v = data.values().getEntry(i, j);
                if (v != 0) {
                    sum += v;
                    count++;
                }
            }
            if (count > 0) {
                expectations.put(data.genes().get(i), sum / count);
            }
        }
        if (expectations.isEmpty()) {
            throw new UserException.BadInput("no gene has a nonzero expression value");
        }

        final Set<String> housekeeping = new HashSet<>(housekeepingGenes);
        final List<String> fitGenes = new ArrayList<>();
        for (final String gene : expectations.keySet()) {
            if (housekeeping.contains(gene)) {
                fitGenes.add(gene);
            }
        }
        if (fitGenes.size() < MIN_HOUSEKEEPING_GENES) {
            logger.warn(String.format("Only %d housekeeping genes are present in the data (at least %d are needed); " +
                    "fitting false-negative curves on all %d genes", fitGenes.size(), MIN_HOUSEKEEPING_GENES, expectations.size()));
            fitGenes.clear();
            fitGenes.addAll(expectations.keySet());
        }
        return fitWithExpectations(data, Collections.unmodifiableMap(expectations), Collections.unmodifiableList(fitGenes), maxIterations);
    }

    /**
     * Fits curves for additional samples, reusing the gene expectations and genes of this model.
     */
    public FalseNegativeModel fitAdditionalSamples(final ExpressionMatrix data) {
        Utils.nonNull(data);
        final List<String> presentGenes = new ArrayList<>();
        for (final String gene : fitGenes) {
            if (data.geneIndex(gene) >= 0) {
                presentGenes.add(gene);
            }
        }
        Utils.validateArg(!presentGenes.isEmpty(), "none of the false-negative genes are present in the additional samples");
        return fitWithExpectations(data, geneExpectations, Collections.unmodifiableList(presentGenes), MAX_ITERATIONS);
    }

    private static FalseNegativeModel fitWithExpectations(final ExpressionMatrix data, final Map<String, Double> expectations,
                                                          final List<String> fitGenes, final int maxIterations) {
        final int[] rows = fitGenes.stream().mapToInt(data::geneIndex).toArray();
        final double[] x = fitGenes.stream().mapToDouble(expectations::get).toArray();
        double xMin = Double.POSITIVE_INFINITY;
        double xMax = Double.NEGATIVE_INFINITY;
        for (final double v : x) {
            xMin = Math.min(xMin, v);
            xMax = Math.max(xMax, v);
        }
        final double range = Math.max(xMax - xMin, 1.0);

        final int numSamples = data.numSamples();
        final double[] intercepts = new double[numSamples];
        final double[] slopes = new double[numSamples];
        final double[] midpoints = new double[numSamples];
        int nonConverged = 0;
        for (int j = 0; j < numSamples; j++) {
            final double[] y = new double[rows.length];
            for (int g = 0; g < rows.length; g++) {
                y[g] = data.values().getEntry(rows[g], j) > 0 ? 1.0 : 0.0;
            }
            final LogisticCurve curve = fitLogistic(x, y, maxIterations);
            if (!Double.isFinite(curve.intercept) || !Double.isFinite(curve.slope)) {
                throw new FastProjectException(String.format("the false-negative curve of sample %s is not finite", data.samples().get(j)));
            }
            if (!curve.converged) {
                nonConverged++;
                logger.debug(String.format("The false-negative curve of sample %s did not converge", data.samples().get(j)));
            }
            intercepts[j] = curve.intercept;
            slopes[j] = curve.slope;
            // a flat or decreasing curve has no meaningful midpoint; clamp to the edges of the expectation range
            final double midpoint = curve.slope > 0 ? -curve.intercept / curve.slope
                    : (curve.intercept >= 0 ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
            midpoints[j] = Math.min(Math.max(midpoint, xMin - range), xMax + range);
        }
        if (nonConverged > 0) {
            logger.warn(String.format("The false-negative curves did not converge within %d iterations for %d of %d samples",
                    maxIterations, nonConverged, numSamples));
        }
        return new FalseNegativeModel(data.samples(), intercepts, slopes, midpoints, expectations, fitGenes, nonConverged);
    }

    /**
     * Ridge-penalized logistic regression of {@code y} on {@code x} by Newton iterations.
     */
    static LogisticCurve fitLogistic(final double[] x, final double[] y, final int maxIterations) {
        RealVector beta = new ArrayRealVector(2);
        boolean converged = false;
        for (int iteration = 0; iteration < maxIterations && !converged; iteration++) {
            final RealMatrix hessian = new Array2DRowRealMatrix(2, 2);
            final RealVector gradient = new ArrayRealVector(2);
            for (int g = 0; g < x.length; g++) {
                final double p = MathUtils.logistic(beta.getEntry(0) + beta.getEntry(1) * x[g]);
                final double w = p * (1 - p);
                final double r = y[g] - p;
                gradient.addToEntry(0, r);
                gradient.addToEntry(1, r * x[g]);
                hessian.addToEntry(0, 0, w);
                hessian.addToEntry(0, 1, w * x[g]);
                hessian.addToEntry(1, 0, w * x[g]);
                hessian.addToEntry(1, 1, w * x[g] * x[g]);
            }
            gradient.setEntry(0, gradient.getEntry(0) - RIDGE * beta.getEntry(0));
            gradient.setEntry(1, gradient.getEntry(1) - RIDGE * beta.getEntry(1));
            hessian.addToEntry(0, 0, RIDGE);
            hessian.addToEntry(1, 1, RIDGE);
            final RealVector step = new LUDecomposition(hessian).getSolver().solve(gradient);
            beta = beta.add(step);
            converged = step.getLInfNorm() < TOLERANCE;
        }
        return new LogisticCurve(beta.getEntry(0), beta.getEntry(1), converged);
    }

    public List<String> getSamples() {
        return samples;
    }

    public List<String> getFitGenes() {
        return fitGenes;
    }

    /**
     * Number of samples whose curve reached the iteration cap.
     */
    public int getNonConvergedSamples() {
        return nonConvergedSamples;
    }

    public double getIntercept(final int sampleIndex) {
        return intercepts[sampleIndex];
    }

    public double getSlope(final int sampleIndex) {
        return slopes[sampleIndex];
    }

    public double[] getMidpoints() {
        return midpoints.clone();
    }

    /**
     * Probability that a gene with expected expression {@code expectation} is detected in the sample.
     */
    public double detectionProbability(final int sampleIndex, final double expectation) {
        return MathUtils.logistic(intercepts[sampleIndex] + slopes[sampleIndex] * expectation);
    }

    /**
     * Weights for {@code data}: 1 where the value is positive, otherwise the probability of detecting the gene
     * at its fitted detected-population mean.
     *
     * @param data matrix whose samples were fitted by this model and whose genes are part of {@code fit}
     */
    public RealMatrix computeWeights(final ExpressionMatrix data, final ProbabilityFit fit) {
        Utils.nonNull(data);
        Utils.nonNull(fit);
        final int[] sampleIndices = new int[data.numSamples()];
        for (int j = 0; j < sampleIndices.length; j++) {
            final String sample = data.samples().get(j);
            sampleIndices[j] = samples.indexOf(sample);
            Utils.validateArg(sampleIndices[j] >= 0, () -> String.format("sample '%s' was not fitted by the false-negative model", sample));
        }
        final RealMatrix weights = new Array2DRowRealMatrix(data.numGenes(), data.numSamples());
        for (int i = 0; i < data.numGenes(); i++) {
            final double muHigh = fit.getMuHigh(data.genes().get(i));
            for (int j = 0; j < data.numSamples(); j++) {
                weights.setEntry(i, j, data.values().getEntry(i, j) > 0 ? 1.0 : detectionProbability(sampleIndices[j], muHigh));
            }
        }
        return weights;
    }

    /**
     * Quality scores are the curve midpoints; a high midpoint means genes must be highly expressed to be detected.
     */
    public SampleQualityReport qualityCheck() {
        return SampleQualityReport.fromScores(samples, midpoints);
    }
}
