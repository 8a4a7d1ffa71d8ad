package org.broadinstitute.numtfinder.utils.param;

/**
 * Range checks for numeric tool parameters. Each returns its input or throws {@link IllegalArgumentException};
 * NaN fails every check.
 */
public final class ParamUtils {
    private ParamUtils() {}

    /**
     * For thresholds given in percent.
     */
    public static double isPercentage(final double value, final String message) {
        if (!(value >= 0 && value <= 100)) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * For distances and lengths in bases.
     */
    public static int isNonNegative(final int value, final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }
}
