/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.series;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import dev.timber.internal.stats.Aggregations;

/**
 * Fixed-size sliding-window aggregations over a series, created by {@link Series#rolling(int)}.
 * <p>
 * Every aggregation returns a FLOAT64 series of the same length as the input.
 * The first {@code window - 1} positions hold NaN; position {@code i} after that
 * holds the aggregation of the values at {@code i - window + 1} through {@code i}.
 * Each window is recomputed from scratch.
 * </p>
 *
 * @param <T> the element type of the source series
 */
public final class Rolling<T> {

    private final Series<T> series;
    private final int window;

    Rolling(Series<T> series, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Window size must be at least 1 but was " + window);
        }
        this.series = series;
        this.window = window;
    }

    public int window() {
        return window;
    }

    public Series<Double> mean() {
        return compute(values -> Aggregations.mean(values, series.elementType()));
    }

    public Series<Double> sum() {
        return compute(values -> series.elementType().toDouble(Aggregations.sum(values, series.elementType())));
    }

    /**
     * Variance of each window. Every position is NaN when the window holds no more than {@code ddof} values.
     */
    public Series<Double> var(int ddof) {
        Aggregations.checkDdof(ddof);
        return compute(values -> values.size() > ddof ? Aggregations.variance(values, series.elementType(), ddof) : Double.NaN);
    }

    /**
     * Standard deviation of each window, NaN where {@link #var(int)} is NaN.
     */
    public Series<Double> std(int ddof) {
        Aggregations.checkDdof(ddof);
        return compute(values -> values.size() > ddof ? Aggregations.std(values, series.elementType(), ddof) : Double.NaN);
    }

    public Series<Double> median() {
        return compute(values -> Aggregations.median(values, series.elementType()));
    }

    public Series<Double> quantile(double q) {
        return compute(values -> Aggregations.quantile(values, series.elementType(), q));
    }

    public Series<Double> min() {
        return compute(values -> series.elementType().toDouble(Aggregations.min(values, series.elementType())));
    }

    public Series<Double> max() {
        return compute(values -> series.elementType().toDouble(Aggregations.max(values, series.elementType())));
    }

    private Series<Double> compute(Function<List<T>, Double> aggregation) {
        List<T> values = series.values();
        List<Double> result = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            if (i < window - 1) {
                result.add(Double.NaN);
            }
            else {
                result.add(aggregation.apply(values.subList(i - window + 1, i + 1)));
            }
        }
        return Series.of(ElementTypes.FLOAT64, result).named(series.name());
    }
}
