/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.series;

import java.util.List;

import org.junit.jupiter.api.Test;

import dev.timber.TimberContext;
import dev.timber.error.CastException;
import dev.timber.error.EmptyInputException;
import dev.timber.error.ValueException;
import dev.timber.metadata.DType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SeriesTest {

    // ==================== Construction ====================

    @Test
    void testArangeLengthAndSum() {
        Series<Integer> series = Series.arange(3, 10);

        assertThat(series.size()).isEqualTo(7);
        assertThat(series.sum()).isEqualTo(3 + 4 + 5 + 6 + 7 + 8 + 9);
        assertThat(series.dtype()).isEqualTo(DType.INT32);
    }

    @Test
    void testArangeLong() {
        Series<Long> series = Series.arange(0L, 5L);

        assertThat(series.dtype()).isEqualTo(DType.INT64);
        assertThat(series.values()).containsExactly(0L, 1L, 2L, 3L, 4L);
    }

    @Test
    void testArangeWithStopBeforeStartIsEmpty() {
        assertThat(Series.arange(5, 2).isEmpty()).isTrue();
    }

    @Test
    void testArangeBeyondMaximumLength() {
        assertThatThrownBy(() -> Series.arange(0L, 1L << 40))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maximum series length");
        assertThatThrownBy(() -> Series.arange(Long.MIN_VALUE, Long.MAX_VALUE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(Series.arange(Long.MAX_VALUE - 2, Long.MAX_VALUE).values())
                .containsExactly(Long.MAX_VALUE - 2, Long.MAX_VALUE - 1);
    }

    @Test
    void testUnmodifiableView() {
        Series<Integer> series = Series.of(1, 2, 3).named("n");
        Series<Integer> view = series.unmodifiableView();

        assertThatThrownBy(() -> view.append(4)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> view.set(0, 9)).isInstanceOf(UnsupportedOperationException.class);

        view.setName("other");
        assertThat(series.name()).isEqualTo("n");

        series.append(4);
        assertThat(view.values()).containsExactly(1, 2, 3, 4);
    }

    @Test
    void testOfInfersDTypeFromFirstElement() {
        assertThat(Series.of(1.5, 2.5).dtype()).isEqualTo(DType.FLOAT64);
        assertThat(Series.of(1L).dtype()).isEqualTo(DType.INT64);
        assertThat(Series.of(1.5f).dtype()).isEqualTo(DType.FLOAT32);
        assertThat(Series.of(1).dtype()).isEqualTo(DType.INT32);
        assertThat(Series.of("a").dtype()).isEqualTo(DType.TEXT);
    }

    @Test
    void testEmptyInputHasUnknownDTypeUntilFirstAppend() {
        Series<Double> series = Series.of(List.of());
        assertThat(series.dtype()).isNull();

        series.append(2.0);
        assertThat(series.dtype()).isEqualTo(DType.FLOAT64);
        assertThat(series.values()).containsExactly(2.0);
    }

    @Test
    void testOfRejectsMixedTypes() {
        List<Number> mixed = List.of(1, 2.0);
        assertThatThrownBy(() -> Series.of(mixed))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("INT32");
    }

    // ==================== Element Access ====================

    @Test
    void testWriteThenReadAtPosition() {
        Series<Integer> series = Series.arange(0, 5);
        for (int i = 0; i < series.size(); i++) {
            series.set(i, i * 10);
            assertThat(series.get(i)).isEqualTo(i * 10);
        }
    }

    @Test
    void testIndexBeyondLengthFails() {
        Series<Integer> series = Series.arange(0, 3);

        assertThatThrownBy(() -> series.get(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> series.set(3, 1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testAppend() {
        Series<String> series = Series.of("a", "b");
        series.append("c");

        assertThat(series.values()).containsExactly("a", "b", "c");
    }

    // ==================== Transformations ====================

    @Test
    void testAstypeIntegerFloatIntegerRoundTrip() {
        Series<Integer> series = Series.arange(-5, 5).named("ints");

        Series<Double> floats = series.astype(ElementTypes.FLOAT64);
        assertThat(floats.get(0)).isEqualTo(-5.0);

        assertThat(floats.astype(ElementTypes.INT32)).isEqualTo(series);
    }

    @Test
    void testAstypeToTextAndBack() {
        Series<Long> series = Series.of(10L, 20L);

        Series<String> text = series.astype(ElementTypes.TEXT);
        assertThat(text.values()).containsExactly("10", "20");
        assertThat(text.astype(ElementTypes.INT64)).isEqualTo(series);
    }

    @Test
    void testAstypeFailsOnUnparsableValue() {
        Series<String> series = Series.of("1", "two", "3");

        assertThatThrownBy(() -> series.astype(ElementTypes.INT64))
                .isInstanceOf(CastException.class)
                .hasMessageContaining("two");
    }

    @Test
    void testAstypeFractionalToIntegerFails() {
        assertThatThrownBy(() -> Series.of(1.5).astype(ElementTypes.INT64))
                .isInstanceOf(CastException.class);
    }

    @Test
    void testDropPositions() {
        Series<Integer> series = Series.of(0, 1, 2, 3, 4, 5);

        series.dropPositions(List.of(0, 4));

        assertThat(series.values()).containsExactly(1, 2, 3, 5);
    }

    @Test
    void testDropPositionsOutOfRangeLeavesSeriesUnchanged() {
        Series<Integer> series = Series.of(0, 1, 2);

        assertThatThrownBy(() -> series.dropPositions(List.of(1, 3)))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(series.values()).containsExactly(0, 1, 2);
    }

    @Test
    void testUniqueIsSortedNotFirstSeenOrder() {
        Series<Integer> series = Series.of(3, 1, 3, 2, 1);

        assertThat(series.unique().values()).containsExactly(1, 2, 3);
    }

    @Test
    void testIsna() {
        Series<Double> series = Series.of(1.0, Double.NaN, 3.0);

        assertThat(series.isna()).containsExactly(false, true, false);
        assertThat(Series.of(1, 2).isna()).containsExactly(false, false);
    }

    @Test
    void testMap() {
        Series<Integer> series = Series.of(1, 2, 3).named("n");

        Series<String> mapped = series.map(ElementTypes.TEXT, v -> "#" + v);

        assertThat(mapped.values()).containsExactly("#1", "#2", "#3");
        assertThat(mapped.name()).isEqualTo("n");
    }

    @Test
    void testParallelMapKeepsOrder() {
        Series<Long> series = Series.arange(0L, 10_000L);

        try (TimberContext context = TimberContext.create(4)) {
            Series<Long> squared = series.map(ElementTypes.INT64, v -> v * v, context);

            assertThat(squared.size()).isEqualTo(10_000);
            assertThat(squared.get(0)).isEqualTo(0L);
            assertThat(squared.get(9_999)).isEqualTo(9_999L * 9_999L);
            assertThat(squared.get(1234)).isEqualTo(1234L * 1234L);
        }
    }

    @Test
    void testParallelMapPropagatesFailure() {
        Series<Integer> series = Series.arange(0, 100);

        try (TimberContext context = TimberContext.create(2)) {
            assertThatThrownBy(() -> series.map(ElementTypes.INT32, v -> {
                if (v == 77) {
                    throw new IllegalStateException("boom at 77");
                }
                return v;
            }, context))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("boom at 77");
        }
    }

    // ==================== Arithmetic ====================

    @Test
    void testScalarArithmetic() {
        Series<Integer> series = Series.of(2, 4);

        assertThat(series.add(1.0).values()).containsExactly(3.0, 5.0);
        assertThat(series.subtract(1.0).values()).containsExactly(1.0, 3.0);
        assertThat(series.multiply(1.5).values()).containsExactly(3.0, 6.0);
        assertThat(series.divide(4.0).values()).containsExactly(0.5, 1.0);
        assertThat(series.plus(1).values()).containsExactly(3, 5);
    }

    @Test
    void testArithmeticOnTextFails() {
        assertThatThrownBy(() -> Series.of("a").multiply(2.0))
                .isInstanceOf(ValueException.class);
        assertThat(Series.of("a", "b").plus("!").values()).containsExactly("a!", "b!");
    }

    // ==================== Aggregations ====================

    @Test
    void testAggregations() {
        Series<Integer> series = Series.of(4, 1, 3, 2);

        assertThat(series.sum()).isEqualTo(10);
        assertThat(series.mean()).isEqualTo(2.5);
        assertThat(series.median()).isEqualTo(2.5);
        assertThat(series.min()).isEqualTo(1);
        assertThat(series.max()).isEqualTo(4);
        assertThat(series.var(0)).isEqualTo(1.25);
        assertThat(series.std(0)).isEqualTo(Math.sqrt(1.25));
    }

    @Test
    void testModeReturnsAllMostFrequentValues() {
        Series<Integer> series = Series.of(0, 0, 0, 1, 1, 1, 2);

        assertThat(series.mode().values()).containsExactlyInAnyOrder(0, 1);
    }

    @Test
    void testQuantileOfOddInclusiveRange() {
        assertThat(Series.arange(0, 101).quantile(0.5)).isEqualTo(50.0);
    }

    @Test
    void testSampleVarianceOfSingleValueFails() {
        assertThatThrownBy(() -> Series.of(5.0).var(1)).isInstanceOf(ValueException.class);
    }

    @Test
    void testAggregationOfEmptySeriesFails() {
        Series<Double> series = Series.empty(ElementTypes.FLOAT64);

        assertThatThrownBy(series::sum).isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(series::max).isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(series::median).isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(series::mode).isInstanceOf(EmptyInputException.class);
    }

    @Test
    void testTextSumConcatenates() {
        assertThat(Series.of("a", "b", "c").sum()).isEqualTo("abc");
        assertThatThrownBy(() -> Series.of("a").mean()).isInstanceOf(ValueException.class);
    }

    // ==================== Equality ====================

    @Test
    void testEqualityIncludesNameAndType() {
        assertThat(Series.of(1, 2)).isEqualTo(Series.of(1, 2));
        assertThat(Series.of(1, 2).named("a")).isNotEqualTo(Series.of(1, 2));
        assertThat(Series.of(1, 2)).isNotEqualTo(Series.of(1L, 2L));
    }

    @Test
    void testCopyIsIndependent() {
        Series<Integer> series = Series.of(1, 2);
        Series<Integer> copy = series.copy();
        copy.set(0, 9);

        assertThat(series.get(0)).isEqualTo(1);
    }
}
