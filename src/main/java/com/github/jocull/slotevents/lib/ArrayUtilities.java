package com.github.jocull.slotevents.lib;

import org.apache.commons.lang3.Validate;

import java.util.Arrays;

/**
 * Copy-based helpers for fixed length arrays. None of these methods mutate their input.
 */
public final class ArrayUtilities {
    public static final int NOT_FOUND = -1;

    private ArrayUtilities() {
    }

    public static <T> int find(T[] source, T element) {
        return find(source, element, 0);
    }

    /**
     * Locates the first element at or after {@code offset} which is equal to {@code element}.
     * <p>
     * {@code null} is never considered equal to anything, itself included. Repeated calls with
     * {@code previousHit + 1} walk every occurrence of a value.
     *
     * @return the element index or {@link #NOT_FOUND}
     */
    public static <T> int find(T[] source, T element, int offset) {
        Validate.notNull(source, "source");
        if (element == null) {
            return NOT_FOUND;
        }
        for (int i = Math.max(offset, 0); i < source.length; i++) {
            final T existing = source[i];
            if (existing != null && existing.equals(element)) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    public static <T> T[] append(T[] source, T element) {
        final T[] copy = Arrays.copyOf(source, source.length + 1);
        copy[source.length] = element;
        return copy;
    }

    /**
     * Callers must pass an index inside the array; anything else fails with the usual
     * {@link ArrayIndexOutOfBoundsException}.
     */
    public static <T> T[] removeAt(T[] source, int index) {
        if (index < 0 || index >= source.length) {
            throw new ArrayIndexOutOfBoundsException(index);
        }
        final T[] copy = Arrays.copyOf(source, source.length - 1);
        System.arraycopy(source, index + 1, copy, index, source.length - index - 1);
        return copy;
    }
}
