package com.xpdustry.roster.common.sort;

import com.google.common.base.Preconditions;
import java.util.Comparator;

/**
 * In-place partition sort using the middle element as pivot.
 *
 * <p>Not stable: equal elements may be reordered, callers needing a deterministic order must pass a
 * comparator that is a total order on the elements.
 */
public final class QuickSort {

    private QuickSort() {}

    public static <T> void sort(final T[] array, final Comparator<? super T> comparator) {
        Preconditions.checkNotNull(array, "array");
        Preconditions.checkNotNull(comparator, "comparator");
        if (array.length > 1) {
            sort(array, 0, array.length - 1, comparator);
        }
    }

    private static <T> void sort(final T[] array, final int lo, final int hi, final Comparator<? super T> comparator) {
        final var pivot = array[(lo + hi) >>> 1];
        int i = lo;
        int j = hi;
        while (i <= j) {
            while (comparator.compare(array[i], pivot) < 0) {
                i++;
            }
            while (comparator.compare(array[j], pivot) > 0) {
                j--;
            }
            if (i <= j) {
                swap(array, i, j);
                i++;
                j--;
            }
        }
        if (lo < j) {
            sort(array, lo, j, comparator);
        }
        if (i < hi) {
            sort(array, i, hi, comparator);
        }
    }

    private static <T> void swap(final T[] array, final int i, final int j) {
        final var temp = array[i];
        array[i] = array[j];
        array[j] = temp;
    }
}
