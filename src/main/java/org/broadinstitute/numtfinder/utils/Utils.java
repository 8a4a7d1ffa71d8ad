package org.broadinstitute.numtfinder.utils;

import java.util.Collection;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Argument checks and number formatting used throughout NUMTFinder.
 * <p>
 * The {@code validateArg} family throws {@link IllegalArgumentException} for bad caller input; {@code validate}
 * throws {@link IllegalStateException} for conditions the code itself must guarantee.
 * </p>
 */
public final class Utils {

    private Utils() {}

    public static <T> T nonNull(final T object) {
        return nonNull(object, "null is not allowed here");
    }

    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    public static String nonEmpty(final String string, final String message) {
        if (nonNull(string, message + " is null").isEmpty()) {
            throw new IllegalArgumentException(message + " is empty");
        }
        return string;
    }

    public static void containsNoNull(final Collection<?> collection, final String message) {
        // Collection.contains(null) throws for some sets
        if (nonNull(collection, message).stream().anyMatch(v -> v == null)) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void validateArg(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> message) {
        if (!condition) {
            throw new IllegalArgumentException(message.get());
        }
    }

    public static void validate(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    public static void validate(final boolean condition, final Supplier<String> message) {
        if (!condition) {
            throw new IllegalStateException(message.get());
        }
    }

    /**
     * @return {@code 100 * x / total} with two decimals, or {@code NA} for an empty total.
     */
    public static String formattedPercent(final long x, final long total) {
        return total == 0 ? "NA" : formattedDouble(100.0 * x / total);
    }

    /**
     * Two decimals with a dot separator whatever the default locale; every percentage and depth column uses it.
     */
    public static String formattedDouble(final double value) {
        return String.format(Locale.US, "%.2f", value);
    }
}
