package org.broadinstitute.fastproject.utils.param;

/**
 * Range checks for numeric tool and model parameters. Each check returns its argument so it can be used inline
 * in a field assignment, and throws {@link IllegalArgumentException} with the given message otherwise.
 *
 * NaN fails every check.
 */
public final class ParamUtils {
    private ParamUtils() {}

    public static int isPositive(final int val, final String message) {
        if (val <= 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    public static double isPositive(final double val, final String message) {
        if (!(val > 0)) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    public static int isPositiveOrZero(final int val, final String message) {
        if (val < 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * @return {@code val} if {@code min <= val <= max}.
     */
    public static int inRange(final int val, final int min, final int max, final String message) {
        if (val < min || val > max) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }
}
