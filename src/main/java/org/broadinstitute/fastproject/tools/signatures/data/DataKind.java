package org.broadinstitute.fastproject.tools.signatures.data;

/**
 * Kind of values held by an {@link ExpressionMatrix}, which also names the model built on it.
 */
public enum DataKind {
    EXPRESSION("Expression"),
    PROBABILITY("Probability");

    private final String modelName;

    DataKind(final String modelName) {
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
