package org.broadinstitute.fastproject.tools.signatures.qc;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;

/**
 * Output of {@link QualityControlTransform#apply}.
 */
public final class QualityControlResult {

    private final ProbabilityFit probabilityFit;
    private final FalseNegativeModel falseNegativeModel;
    private final RealMatrix weights;
    private final ExpressionMatrix probabilityData;
    private final SampleQualityReport report;

    QualityControlResult(final ProbabilityFit probabilityFit, final FalseNegativeModel falseNegativeModel,
                         final RealMatrix weights, final ExpressionMatrix probabilityData, final SampleQualityReport report) {
        this.probabilityFit = probabilityFit;
        this.falseNegativeModel = falseNegativeModel;
        this.weights = weights;
        this.probabilityData = probabilityData;
        this.report = report;
    }

    public ProbabilityFit getProbabilityFit() {
        return probabilityFit;
    }

    public FalseNegativeModel getFalseNegativeModel() {
        return falseNegativeModel;
    }

    /**
     * Weights aligned to the rows and columns of the filtered matrix.
     */
    public RealMatrix getWeights() {
        return weights;
    }

    /**
     * Adjusted probabilities of expression, with the filtered matrix's labels, filters and weights.
     */
    public ExpressionMatrix getProbabilityData() {
        return probabilityData;
    }

    public SampleQualityReport getReport() {
        return report;
    }
}
