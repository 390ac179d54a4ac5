package org.broadinstitute.fastproject.tools.signatures.projection;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.utils.Utils;
import org.broadinstitute.fastproject.utils.pca.PCA;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the projection methods on a filtered matrix or on its PCA-reduced representation.
 */
public final class ProjectionGenerator {
    private static final Logger logger = LogManager.getLogger(ProjectionGenerator.class);

    public static final int MAX_PCA_COMPONENTS = 30;

    private final List<ProjectionMethod> methods;

    /**
     * @param lean if true, spectral embedding is left out
     */
    public ProjectionGenerator(final boolean lean) {
        final List<ProjectionMethod> result = new ArrayList<>();
        result.add(new PCAProjection());
        result.add(new MDSProjection());
        if (!lean) {
            result.add(new SpectralEmbeddingProjection());
        }
        this.methods = Collections.unmodifiableList(result);
    }

    public ProjectionGenerator(final List<ProjectionMethod> methods) {
        Utils.nonEmpty(methods, "at least one projection method is required");
        this.methods = Collections.unmodifiableList(new ArrayList<>(methods));
    }

    public List<ProjectionMethod> getMethods() {
        return methods;
    }

    /**
     * Projects the samples of {@code data} (genes x samples) and computes its reduced representation.
     *
     * @param inputProjections externally supplied projections added after the computed ones; may be empty
     */
    public ProjectionResult generate(final ExpressionMatrix data, final Map<String, Projection> inputProjections) {
        Utils.nonNull(data);
        Utils.nonNull(inputProjections);
        final Map<String, Projection> projections = project(data.values(), data.samples());
        for (final Projection input : inputProjections.values()) {
            Utils.validateArg(!projections.containsKey(input.getName()),
                    () -> String.format("input projection %s clashes with a computed projection", input.getName()));
            projections.put(input.getName(), Projection.normalized(input.getName(), data.samples(),
                    input.subsetSamples(data.samples()).getCoordinates()));
        }
        return new ProjectionResult(Collections.unmodifiableMap(projections), reduce(data));
    }

    /**
     * Projects the samples of a reduced representation (components x samples).
     */
    public ProjectionResult generate(final ReducedRepresentation reduced) {
        Utils.nonNull(reduced);
        return new ProjectionResult(Collections.unmodifiableMap(project(reduced.getSampleScores(), reduced.getSamples())), reduced);
    }

    /**
     * PCA with up to {@value #MAX_PCA_COMPONENTS} components.
     */
    public static ReducedRepresentation reduce(final ExpressionMatrix data) {
        final PCA pca = PCA.createPCA(data.genes(), data.samples(), data.values());
        final int k = Math.min(MAX_PCA_COMPONENTS, pca.getNumberOfComponents());
        return new ReducedRepresentation(data.genes(), data.samples(), pca.getSampleScores(k), pca.getLoadings(k));
    }

    private Map<String, Projection> project(final RealMatrix data, final List<String> samples) {
        final Map<String, Projection> result = new LinkedHashMap<>();
        for (final ProjectionMethod method : methods) {
            logger.debug(String.format("Running projection %s on %d samples", method.getName(), samples.size()));
            result.put(method.getName(), Projection.normalized(method.getName(), samples, method.embed(data)));
        }
        return result;
    }
}
