package org.broadinstitute.fastproject.tools.signatures.projection;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Embeds samples into two dimensions.
 */
public interface ProjectionMethod {

    /**
     * @return the name the projection is reported under.
     */
    String getName();

    /**
     * @param data features x samples matrix
     * @return one {x, y} pair per sample (column), not yet normalized
     */
    double[][] embed(RealMatrix data);
}
