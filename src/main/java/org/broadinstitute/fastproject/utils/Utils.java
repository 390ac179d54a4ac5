package org.broadinstitute.fastproject.utils;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Argument and state checks shared by the data types and the pipeline.
 *
 * The {@code validateArg} family throws {@link IllegalArgumentException} for bad caller input, {@code validate}
 * throws {@link IllegalStateException} for violated internal invariants.
 */
public final class Utils {

    private Utils() {}

    public static <T> T nonNull(final T object) {
        return nonNull(object, "Null object is not allowed here.");
    }

    public static <T> T nonNull(final T object, final String message) {
        validateArg(object != null, message);
        return object;
    }

    public static <T> T nonNull(final T object, final Supplier<String> message) {
        validateArg(object != null, message);
        return object;
    }

    /**
     * @return {@code collection}, after checking it is neither null nor empty.
     */
    public static <I, T extends Collection<I>> T nonEmpty(final T collection, final String what) {
        nonNull(collection, () -> "The collection is null: " + what);
        validateArg(!collection.isEmpty(), () -> "The collection is empty: " + what);
        return collection;
    }

    public static String nonEmpty(final String string, final String what) {
        nonNull(string, () -> "The string is null: " + what);
        validateArg(!string.isEmpty(), () -> "The string is empty: " + what);
        return string;
    }

    public static void containsNoNull(final Collection<?> collection, final String message) {
        nonNull(collection, message);
        // Collection.contains(null) throws on some Set implementations
        validateArg(collection.stream().allMatch(v -> v != null), message);
    }

    /**
     * @return the elements of {@code c} in encounter order.
     * @throws IllegalArgumentException naming the first repeated element.
     */
    public static <E> Set<E> checkForDuplicatesAndReturnSet(final Collection<E> c, final String message) {
        final Set<E> set = new LinkedHashSet<>();
        for (final E element : c) {
            validateArg(set.add(element), () -> String.format("%s  Value %s appears more than once.", message, element));
        }
        return set;
    }

    public static void validateArg(final boolean condition, final String msg) {
        if (!condition) {
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> msg) {
        if (!condition) {
            throw new IllegalArgumentException(msg.get());
        }
    }

    public static void validate(final boolean condition, final String msg) {
        if (!condition) {
            throw new IllegalStateException(msg);
        }
    }

    public static void validate(final boolean condition, final Supplier<String> msg) {
        if (!condition) {
            throw new IllegalStateException(msg.get());
        }
    }
}
