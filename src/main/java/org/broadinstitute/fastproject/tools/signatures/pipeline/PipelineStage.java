package org.broadinstitute.fastproject.tools.signatures.pipeline;

/**
 * Stages of {@link FastProjectPipeline}, in execution order.
 */
public enum PipelineStage {
    INIT,
    SUBSAMPLE,
    FILTER,
    QC,
    SCORE,
    PROJECT,
    CLUSTER,
    SIGNIFICANCE,
    PRUNE,
    MERGE_HOLDOUTS,
    REORDER_GENES,
    DONE
}
