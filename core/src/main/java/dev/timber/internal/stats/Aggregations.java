/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal.stats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.timber.error.EmptyInputException;
import dev.timber.error.ValueException;
import dev.timber.series.ElementType;

/**
 * Statistical reductions over a list of values of one element type.
 * <p>
 * All functions are pure. Every function throws {@link EmptyInputException}
 * for an empty input. Mean, variance, standard deviation, median and
 * quantile accumulate in double precision whatever the element width and
 * reject non-numeric element types with {@link ValueException}.
 * </p>
 */
public final class Aggregations {

    private Aggregations() {
    }

    /**
     * Sum in the element type itself. Integral sums wrap on overflow, text sums concatenate.
     */
    public static <T> T sum(List<T> values, ElementType<T> type) {
        requireNonEmpty(values, "sum");
        T total = type.zero();
        for (T value : values) {
            total = type.add(total, value);
        }
        return total;
    }

    public static <T> double mean(List<T> values, ElementType<T> type) {
        requireNonEmpty(values, "mean");
        requireNumeric(type, "mean");
        return total(values, type) / values.size();
    }

    /**
     * Variance with {@code ddof} delta degrees of freedom: 0 for population, 1 for sample.
     *
     * @throws IllegalArgumentException if ddof is neither 0 nor 1
     * @throws ValueException if the input has no more than {@code ddof} values
     */
    public static <T> double variance(List<T> values, ElementType<T> type, int ddof) {
        checkDdof(ddof);
        requireNonEmpty(values, "variance");
        requireNumeric(type, "variance");
        int denominator = values.size() - ddof;
        if (denominator == 0) {
            throw new ValueException("Variance with ddof=" + ddof + " needs more than " + ddof + " value(s)");
        }
        double mean = total(values, type) / values.size();
        double squares = 0.0;
        for (T value : values) {
            double deviation = type.toDouble(value) - mean;
            squares += deviation * deviation;
        }
        return squares / denominator;
    }

    /**
     * @throws IllegalArgumentException if ddof is neither 0 nor 1
     */
    public static void checkDdof(int ddof) {
        if (ddof != 0 && ddof != 1) {
            throw new IllegalArgumentException("ddof must be 0 or 1 but was " + ddof);
        }
    }

    public static <T> double std(List<T> values, ElementType<T> type, int ddof) {
        return Math.sqrt(variance(values, type, ddof));
    }

    /**
     * Middle value of the sorted input, or the mean of the two middle values for an even count.
     */
    public static <T> double median(List<T> values, ElementType<T> type) {
        requireNonEmpty(values, "median");
        requireNumeric(type, "median");
        double[] sorted = sortedDoubles(values, type);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Quantile by linear interpolation between the two closest ranks of the sorted input.
     *
     * @param q the quantile, between 0 and 1 inclusive
     */
    public static <T> double quantile(List<T> values, ElementType<T> type, double q) {
        if (!(q >= 0.0 && q <= 1.0)) {
            throw new IllegalArgumentException("Quantile must be within [0, 1] but was " + q);
        }
        requireNonEmpty(values, "quantile");
        requireNumeric(type, "quantile");
        double[] sorted = sortedDoubles(values, type);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    /**
     * Smallest value; the first one wins among equals.
     */
    public static <T> T min(List<T> values, ElementType<T> type) {
        requireNonEmpty(values, "min");
        T min = values.get(0);
        for (int i = 1; i < values.size(); i++) {
            T value = values.get(i);
            if (type.compare(value, min) < 0) {
                min = value;
            }
        }
        return min;
    }

    /**
     * Largest value; the first one wins among equals.
     */
    public static <T> T max(List<T> values, ElementType<T> type) {
        requireNonEmpty(values, "max");
        T max = values.get(0);
        for (int i = 1; i < values.size(); i++) {
            T value = values.get(i);
            if (type.compare(value, max) > 0) {
                max = value;
            }
        }
        return max;
    }

    /**
     * All values sharing the highest frequency, in ascending order.
     */
    public static <T> List<T> mode(List<T> values, ElementType<T> type) {
        requireNonEmpty(values, "mode");
        Map<T, Integer> counts = new LinkedHashMap<>();
        int highest = 0;
        for (T value : values) {
            int count = counts.merge(value, 1, Integer::sum);
            highest = Math.max(highest, count);
        }
        List<T> modes = new ArrayList<>();
        for (Map.Entry<T, Integer> entry : counts.entrySet()) {
            if (entry.getValue() == highest) {
                modes.add(entry.getKey());
            }
        }
        modes.sort(type::compare);
        return modes;
    }

    private static <T> double total(List<T> values, ElementType<T> type) {
        double total = 0.0;
        for (T value : values) {
            total += type.toDouble(value);
        }
        return total;
    }

    private static <T> double[] sortedDoubles(List<T> values, ElementType<T> type) {
        double[] sorted = new double[values.size()];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = type.toDouble(values.get(i));
        }
        Arrays.sort(sorted);
        return sorted;
    }

    private static void requireNonEmpty(List<?> values, String aggregation) {
        if (values.isEmpty()) {
            throw new EmptyInputException(aggregation);
        }
    }

    private static void requireNumeric(ElementType<?> type, String aggregation) {
        if (!type.isNumeric()) {
            throw new ValueException("Cannot compute " + aggregation + " of " + type.dtype() + " values");
        }
    }
}
