package org.broadinstitute.fastproject.tools.signatures.qc;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.FastProjectException;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;
import org.broadinstitute.fastproject.utils.param.ParamUtils;

import java.util.Arrays;

/**
 * Fits, for each gene independently, a two-component mixture by expectation maximization: a detected population
 * Normal(muHigh, sigmaHigh) and a non-detected population Exponential with mean muLow.
 *
 * <p>
 *     Genes without any nonzero value are given probability 0 everywhere. Non-finite input is rejected.
 *     Genes that reach the iteration cap keep their last estimates and are counted in the fit.
 * </p>
 */
public final class ExpressionProbabilityModel {
    private static final Logger logger = LogManager.getLogger(ExpressionProbabilityModel.class);

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 1e-6;

    static final double MIN_MIXTURE_WEIGHT = 1e-6;
    static final double MIN_SIGMA_HIGH = 0.1;
    static final double MIN_MU_LOW = 1e-3;

    private static final double LOG_ROOT_TWO_PI = 0.5 * FastMath.log(2 * FastMath.PI);

    private final int maxIterations;
    private final double tolerance;

    public ExpressionProbabilityModel() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    public ExpressionProbabilityModel(final int maxIterations, final double tolerance) {
        this.maxIterations = ParamUtils.isPositive(maxIterations, "maxIterations must be > 0");
        this.tolerance = ParamUtils.isPositive(tolerance, "tolerance must be > 0");
    }

    public ProbabilityFit fit(final ExpressionMatrix data) {
        Utils.nonNull(data);
        final int numGenes = data.numGenes();
        final int numSamples = data.numSamples();
        final double[] muHigh = new double[numGenes];
        final double[] sigmaHigh = new double[numGenes];
        final double[] muLow = new double[numGenes];
        final double[] mixtureWeight = new double[numGenes];
        final boolean[] detectable = new boolean[numGenes];
        final RealMatrix probabilities = new Array2DRowRealMatrix(numGenes, numSamples);
        int nonConverged = 0;

        for (int g = 0; g < numGenes; g++) {
            final double[] x = data.values().getRow(g);
            for (final double v : x) {
                if (!Double.isFinite(v)) {
                    throw new UserException.BadInput(String.format("gene %s has a non-finite expression value", data.genes().get(g)));
                }
            }
            final double[] nonzero = Arrays.stream(x).filter(v -> v != 0).toArray();
            if (nonzero.length == 0) {
                muHigh[g] = 0;
                sigmaHigh[g] = MIN_SIGMA_HIGH;
                muLow[g] = MIN_MU_LOW;
                mixtureWeight[g] = MIN_MIXTURE_WEIGHT;
                continue;
            }
            detectable[g] = true;
            final double[] params = {
                    MathUtils.mean(nonzero),
                    Math.max(Math.sqrt(MathUtils.variance(nonzero)), MIN_SIGMA_HIGH),
                    Math.max(0.1 * Math.abs(MathUtils.mean(nonzero)), MIN_MU_LOW),
                    clampWeight((double) nonzero.length / numSamples)
            };
            if (!runEM(x, params)) {
                nonConverged++;
            }
            for (final double p : params) {
                if (!Double.isFinite(p)) {
                    throw new FastProjectException(String.format("the expression model for gene %s did not produce finite parameters", data.genes().get(g)));
                }
            }
            muHigh[g] = params[0];
            sigmaHigh[g] = params[1];
            muLow[g] = params[2];
            mixtureWeight[g] = params[3];
            for (int j = 0; j < numSamples; j++) {
                probabilities.setEntry(g, j, posterior(x[j], muHigh[g], sigmaHigh[g], muLow[g], mixtureWeight[g]));
            }
        }
        if (nonConverged > 0) {
            logger.warn(String.format("The expression model did not converge within %d iterations for %d of %d genes",
                    maxIterations, nonConverged, numGenes));
        }
        return new ProbabilityFit(data.genes(), muHigh, sigmaHigh, muLow, mixtureWeight, detectable, probabilities, nonConverged);
    }

    /**
     * Runs EM in place on {muHigh, sigmaHigh, muLow, mixtureWeight}.
     * @return whether the log-likelihood converged before the iteration cap.
     */
    private boolean runEM(final double[] x, final double[] params) {
        final double[] responsibility = new double[x.length];
        double previous = Double.NEGATIVE_INFINITY;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double logLikelihood = 0;
            for (int j = 0; j < x.length; j++) {
                final double high = logHigh(x[j], params[0], params[1], params[3]);
                final double low = logLow(x[j], params[2], params[3]);
                final double max = Math.max(high, low);
                logLikelihood += max + FastMath.log(FastMath.exp(high - max) + FastMath.exp(low - max));
                responsibility[j] = MathUtils.logistic(high - low);
            }

            double weightHigh = 0;
            double sumHigh = 0;
            double sumLow = 0;
            for (int j = 0; j < x.length; j++) {
                weightHigh += responsibility[j];
                sumHigh += responsibility[j] * x[j];
                sumLow += (1 - responsibility[j]) * Math.abs(x[j]);
            }
            final double weightLow = x.length - weightHigh;
            if (weightHigh > 0) {
                params[0] = sumHigh / weightHigh;
                double squares = 0;
                for (int j = 0; j < x.length; j++) {
                    squares += responsibility[j] * MathUtils.square(x[j] - params[0]);
                }
                params[1] = Math.max(Math.sqrt(squares / weightHigh), MIN_SIGMA_HIGH);
            }
            if (weightLow > 0) {
                params[2] = Math.max(sumLow / weightLow, MIN_MU_LOW);
            }
            params[3] = clampWeight(weightHigh / x.length);

            if (Math.abs(logLikelihood - previous) <= tolerance * (1 + Math.abs(logLikelihood))) {
                return true;
            }
            previous = logLikelihood;
        }
        return false;
    }

    static double posterior(final double x, final double muHigh, final double sigmaHigh, final double muLow, final double mixtureWeight) {
        return MathUtils.logistic(logHigh(x, muHigh, sigmaHigh, mixtureWeight) - logLow(x, muLow, mixtureWeight));
    }

    private static double logHigh(final double x, final double mu, final double sigma, final double weight) {
        return FastMath.log(weight) - LOG_ROOT_TWO_PI - FastMath.log(sigma) - MathUtils.square(x - mu) / (2 * sigma * sigma);
    }

    /**
     * Exponential log-density; the support is extended to negative values by symmetry.
     */
    private static double logLow(final double x, final double mu, final double weight) {
        return FastMath.log(1 - weight) - FastMath.log(mu) - Math.abs(x) / mu;
    }

    private static double clampWeight(final double weight) {
        return Math.min(Math.max(weight, MIN_MIXTURE_WEIGHT), 1 - MIN_MIXTURE_WEIGHT);
    }
}
