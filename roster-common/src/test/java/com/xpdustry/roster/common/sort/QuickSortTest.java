package com.xpdustry.roster.common.sort;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

final class QuickSortTest {

    @Test
    void test_sort_random() {
        final var random = new Random(42L);
        for (int size = 0; size < 64; size++) {
            final var array =
                    IntStream.range(0, size).map(i -> random.nextInt(10)).boxed().toArray(Integer[]::new);
            final var expected = array.clone();
            Arrays.sort(expected);
            QuickSort.sort(array, Comparator.naturalOrder());
            assertThat(array).containsExactly(expected);
        }
    }

    @Test
    void test_sort_descending_comparator() {
        final var array = new String[] {"b", "d", "a", "c"};
        QuickSort.sort(array, Comparator.reverseOrder());
        assertThat(array).containsExactly("d", "c", "b", "a");
    }

    @Test
    void test_sort_sorted_and_reversed() {
        final var sorted = IntStream.range(0, 100).boxed().toArray(Integer[]::new);
        QuickSort.sort(sorted, Comparator.naturalOrder());
        assertThat(sorted).isSorted();

        final var reversed =
                IntStream.range(0, 100).map(i -> 99 - i).boxed().toArray(Integer[]::new);
        QuickSort.sort(reversed, Comparator.naturalOrder());
        assertThat(reversed).isSorted().hasSize(100);
    }
}
