package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.broadinstitute.fastproject.exceptions.FastProjectException;

/**
 * A pipeline stage failed.
 */
public class PipelineStageException extends FastProjectException {
    private static final long serialVersionUID = 0L;

    private final PipelineStage stage;

    public PipelineStageException(final PipelineStage stage, final String message) {
        super(String.format("Stage %s failed: %s", stage, message));
        this.stage = stage;
    }

    public PipelineStageException(final PipelineStage stage, final Throwable cause) {
        super(String.format("Stage %s failed: %s", stage, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName()), cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
