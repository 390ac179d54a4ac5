package org.broadinstitute.fastproject.tools.signatures.projection;

import java.util.Map;

/**
 * Projections of one filtered matrix together with its PCA-reduced representation.
 */
public final class ProjectionResult {

    private final Map<String, Projection> projections;
    private final ReducedRepresentation reduced;

    ProjectionResult(final Map<String, Projection> projections, final ReducedRepresentation reduced) {
        this.projections = projections;
        this.reduced = reduced;
    }

    /**
     * @return unmodifiable map from projection name to projection, in generation order.
     */
    public Map<String, Projection> getProjections() {
        return projections;
    }

    public ReducedRepresentation getReduced() {
        return reduced;
    }
}
