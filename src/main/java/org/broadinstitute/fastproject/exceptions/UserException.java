package org.broadinstitute.fastproject.exceptions;

import java.io.File;

/**
 * Errors caused by the user: unreadable or malformed input files, inconsistent inputs, bad argument values.
 * {@code Main} reports these without a stack trace and exits with its user-error code.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String describe(final Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    /**
     * An input file could not be opened or read.
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final File file, final Exception e) {
            super(String.format("Couldn't read file %s. Error was: %s", file.getAbsolutePath(), describe(e)), e);
        }
    }

    /**
     * An argument value, or a combination of arguments, the analysis cannot run with.
     */
    public static class BadArgumentValue extends UserException {
        private static final long serialVersionUID = 0L;

        public BadArgumentValue(final String arg, final String value, final String message) {
            super(String.format("Argument %s has a bad value: %s. %s", arg, value, message));
        }

        public BadArgumentValue(final String arg, final String message) {
            super(String.format("Argument %s has a bad value: %s", arg, message));
        }
    }

    /**
     * Inputs that parse but disagree with each other or cannot be analyzed.
     */
    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super("Bad input: " + message);
        }
    }

    /**
     * A file whose contents do not follow its expected layout.
     */
    public static class MalformedFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedFile(final File f, final String message) {
            super(String.format("File %s is malformed: %s", f.getAbsolutePath(), message));
        }

        public MalformedFile(final File f, final String message, final Exception e) {
            super(String.format("File %s is malformed: %s caused by %s", f.getAbsolutePath(), message, describe(e)), e);
        }
    }
}
