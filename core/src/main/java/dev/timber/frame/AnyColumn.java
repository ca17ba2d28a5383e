/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.frame;

import java.util.List;

import dev.timber.error.ValueException;
import dev.timber.metadata.DType;
import dev.timber.series.Series;

/**
 * A data frame column whose element type is only known at runtime.
 * <p>
 * There is one record per {@link DType}, so code that must handle any
 * column switches on {@link #dtype()} and unwraps the matching record to
 * get a typed series.
 * </p>
 * <pre>{@code
 * AnyColumn column = frame.column("price");
 * switch (column.dtype()) {
 *     case FLOAT64 -> handle(((AnyColumn.Float64Column) column).series());
 *     ...
 * }
 * }</pre>
 */
public sealed interface AnyColumn permits AnyColumn.Float64Column, AnyColumn.Int64Column,
        AnyColumn.Float32Column, AnyColumn.Int32Column, AnyColumn.TextColumn {

    DType dtype();

    Series<?> series();

    default String name() {
        return series().name();
    }

    default int size() {
        return series().size();
    }

    /** Get the value at index, boxed. */
    default Object getValue(int index) {
        return series().get(index);
    }

    /** Text form of every value, as written to CSV. */
    default List<String> toStrings() {
        return series().toStrings();
    }

    /**
     * Wrap a series in the record matching its dtype.
     *
     * @throws ValueException if the series dtype is still unknown
     */
    @SuppressWarnings("unchecked")
    static AnyColumn of(Series<?> series) {
        DType dtype = series.dtype();
        if (dtype == null) {
            throw new ValueException("Series " + series.name() + " has no dtype yet");
        }
        return switch (dtype) {
            case FLOAT64 -> new Float64Column((Series<Double>) series);
            case INT64 -> new Int64Column((Series<Long>) series);
            case FLOAT32 -> new Float32Column((Series<Float>) series);
            case INT32 -> new Int32Column((Series<Integer>) series);
            case TEXT -> new TextColumn((Series<String>) series);
        };
    }

    record Float64Column(Series<Double> series) implements AnyColumn {
        public double get(int index) {
            return series.get(index);
        }

        @Override
        public DType dtype() {
            return DType.FLOAT64;
        }
    }

    record Int64Column(Series<Long> series) implements AnyColumn {
        public long get(int index) {
            return series.get(index);
        }

        @Override
        public DType dtype() {
            return DType.INT64;
        }
    }

    record Float32Column(Series<Float> series) implements AnyColumn {
        public float get(int index) {
            return series.get(index);
        }

        @Override
        public DType dtype() {
            return DType.FLOAT32;
        }
    }

    record Int32Column(Series<Integer> series) implements AnyColumn {
        public int get(int index) {
            return series.get(index);
        }

        @Override
        public DType dtype() {
            return DType.INT32;
        }
    }

    record TextColumn(Series<String> series) implements AnyColumn {
        public String get(int index) {
            return series.get(index);
        }

        @Override
        public DType dtype() {
            return DType.TEXT;
        }
    }
}
