package org.broadinstitute.fastproject.exceptions;

/**
 * Errors that are beyond the user's control: failed internal pre/post conditions and broken invariants.
 */
public class FastProjectException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public FastProjectException( final String msg ) {
        super(msg);
    }

    public FastProjectException( final String message, final Throwable throwable ) {
        super(message, throwable);
    }

    /**
     * Signature labels and the rows of the signature-projection matrices went out of alignment.
     * <p>
     *     This is an invariant breach within a model, never a recoverable input problem.
     * </p>
     */
    public static class InconsistentSignatureStateException extends FastProjectException {
        private static final long serialVersionUID = 0L;

        public InconsistentSignatureStateException( final String modelName, final String message ) {
            super(String.format("Signature state of model \"%s\" is inconsistent: %s", modelName, message));
        }
    }
}
