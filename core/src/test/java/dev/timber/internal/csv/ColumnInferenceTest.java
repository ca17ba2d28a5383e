/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal.csv;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.timber.metadata.DType;
import dev.timber.series.Series;

import static org.assertj.core.api.Assertions.assertThat;

public class ColumnInferenceTest {

    private static List<Object> valuesOf(Series<?> series) {
        return new ArrayList<>(series.values());
    }

    @Test
    void testIntegers() {
        Series<?> series = ColumnInference.infer("n", List.of("1", "-2", " 3 "));

        assertThat(series.dtype()).isEqualTo(DType.INT64);
        assertThat(valuesOf(series)).containsExactly(1L, -2L, 3L);
        assertThat(series.name()).isEqualTo("n");
    }

    @Test
    void testOneFloatingValueMakesColumnFloating() {
        Series<?> series = ColumnInference.infer("x", List.of("1", "2.5", "3"));

        assertThat(series.dtype()).isEqualTo(DType.FLOAT64);
        assertThat(valuesOf(series)).containsExactly(1.0, 2.5, 3.0);
    }

    @Test
    void testDecimalForms() {
        Series<?> series = ColumnInference.infer("x", List.of("-1.5e3", ".5", "7.", "+2E-1", "NaN", "-Infinity"));

        assertThat(series.dtype()).isEqualTo(DType.FLOAT64);
        assertThat(valuesOf(series)).containsExactly(-1500.0, 0.5, 7.0, 0.2, Double.NaN, Double.NEGATIVE_INFINITY);
    }

    @Test
    void testOneTextValueMakesColumnText() {
        Series<?> series = ColumnInference.infer("t", List.of("1", "2.5", "n/a"));

        assertThat(series.dtype()).isEqualTo(DType.TEXT);
        assertThat(series.toStrings()).containsExactly("1", "2.5", "n/a");
    }

    @Test
    void testJavaNumberLiteralsStayText() {
        Series<?> series = ColumnInference.infer("code", List.of("1d", "2f", "0x1p3"));

        assertThat(series.dtype()).isEqualTo(DType.TEXT);
        assertThat(series.toStrings()).containsExactly("1d", "2f", "0x1p3");
    }

    @Test
    void testSingleJavaLiteralForcesText() {
        assertThat(ColumnInference.infer("c", List.of("1.5", "3D")).dtype()).isEqualTo(DType.TEXT);
        assertThat(ColumnInference.infer("c", List.of("1.5", "0x10")).dtype()).isEqualTo(DType.TEXT);
    }

    @Test
    void testBlankValueMakesColumnText() {
        assertThat(ColumnInference.infer("b", List.of("1", "")).dtype()).isEqualTo(DType.TEXT);
    }

    @Test
    void testEmptyColumnIsText() {
        Series<?> series = ColumnInference.infer("e", List.of());

        assertThat(series.dtype()).isEqualTo(DType.TEXT);
        assertThat(series.isEmpty()).isTrue();
    }
}
