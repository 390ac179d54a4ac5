package org.broadinstitute.fastproject.tools.signatures.pipeline;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Signatures a model keeps after significance pruning.
 */
public final class PruneDecision {

    private final Set<String> retained;
    private final Set<String> pruned;
    private final double threshold;
    private final boolean strictTopK;

    PruneDecision(final Set<String> retained, final Set<String> pruned, final double threshold, final boolean strictTopK) {
        this.retained = Collections.unmodifiableSet(new LinkedHashSet<>(retained));
        this.pruned = Collections.unmodifiableSet(new LinkedHashSet<>(pruned));
        this.threshold = threshold;
        this.strictTopK = strictTopK;
    }

    /**
     * @return retained score names, in the model's order.
     */
    public Set<String> getRetained() {
        return retained;
    }

    public Set<String> getPruned() {
        return pruned;
    }

    /**
     * @return the log10 p-value cutoff that was applied; positive infinity when nothing is pruned by threshold.
     */
    public double getThreshold() {
        return threshold;
    }

    /**
     * @return whether exactly the top-ranked signatures were kept rather than every signature under a threshold.
     */
    public boolean isStrictTopK() {
        return strictTopK;
    }
}
