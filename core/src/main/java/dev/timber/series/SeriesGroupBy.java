/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.series;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import dev.timber.error.LengthMismatchException;

/**
 * Result of {@link Series#groupby(Series)}: the values of a series split into
 * one partition per distinct key.
 * <p>
 * Partitions are ordered by the first appearance of their key, not by key
 * value. Keys are compared by their text form, so {@code 1} as INT32 and
 * {@code 1} as INT64 fall into the same partition. Every partition holds at
 * least one value.
 * </p>
 *
 * <pre>{@code
 * Series<Integer> values = Series.of(1, 2, 3, 1, 2, 3);
 * Series<Integer> keys = Series.of(4, 5, 6, 4, 5, 6);
 * Series<Integer> sums = values.groupby(keys).sum();  // [2, 4, 6]
 * }</pre>
 *
 * @param <T> the element type of the grouped series
 */
public final class SeriesGroupBy<T> {

    private final String name;
    private final ElementType<T> elementType;
    private final List<String> keys;
    private final List<Series<T>> groups;

    private SeriesGroupBy(String name, ElementType<T> elementType, List<String> keys, List<Series<T>> groups) {
        this.name = name;
        this.elementType = elementType;
        this.keys = keys;
        this.groups = groups;
    }

    static <T, K> SeriesGroupBy<T> split(Series<T> series, Series<K> keys) {
        if (keys.size() != series.size()) {
            throw new LengthMismatchException("Group keys of series " + series.name(), series.size(), keys.size());
        }
        List<String> keyText = keys.toStrings();
        Map<String, List<T>> partitions = new LinkedHashMap<>();
        for (int i = 0; i < series.size(); i++) {
            partitions.computeIfAbsent(keyText.get(i), k -> new ArrayList<>()).add(series.get(i));
        }

        List<String> groupKeys = new ArrayList<>(partitions.size());
        List<Series<T>> groups = new ArrayList<>(partitions.size());
        for (Map.Entry<String, List<T>> partition : partitions.entrySet()) {
            groupKeys.add(partition.getKey());
            groups.add(Series.of(series.elementType(), partition.getValue()).named(series.name()));
        }
        return new SeriesGroupBy<>(series.name(), series.elementType(), groupKeys, groups);
    }

    /**
     * Text form of each distinct key, in order of first appearance.
     */
    public List<String> keys() {
        return Collections.unmodifiableList(keys);
    }

    /**
     * The partitions, aligned with {@link #keys()}.
     */
    public List<Series<T>> groups() {
        return Collections.unmodifiableList(groups);
    }

    public int size() {
        return groups.size();
    }

    /**
     * Reduce every partition to a single value of the grouped element type.
     */
    public Series<T> apply(Function<Series<T>, T> reduction) {
        return applyAs(elementType, reduction);
    }

    /**
     * Reduce every partition to a single value of the given element type.
     */
    public <U> Series<U> applyAs(ElementType<U> type, Function<Series<T>, ? extends U> reduction) {
        List<U> results = new ArrayList<>(groups.size());
        for (Series<T> group : groups) {
            results.add(reduction.apply(group));
        }
        Series<U> result = type == null ? Series.of(results) : Series.of(type, results);
        return result.named(name);
    }

    public Series<T> sum() {
        return apply(Series::sum);
    }

    public Series<T> min() {
        return apply(Series::min);
    }

    public Series<T> max() {
        return apply(Series::max);
    }

    public Series<Double> mean() {
        return applyAs(ElementTypes.FLOAT64, Series::mean);
    }

    public Series<Double> var(int ddof) {
        return applyAs(ElementTypes.FLOAT64, group -> group.var(ddof));
    }

    public Series<Double> std(int ddof) {
        return applyAs(ElementTypes.FLOAT64, group -> group.std(ddof));
    }

    public Series<Double> median() {
        return applyAs(ElementTypes.FLOAT64, Series::median);
    }

    /**
     * Number of values in each partition.
     */
    public Series<Long> count() {
        return applyAs(ElementTypes.INT64, group -> (long) group.size());
    }
}
