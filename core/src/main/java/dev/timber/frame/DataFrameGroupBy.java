/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Function;

import dev.timber.series.ElementTypes;
import dev.timber.series.Series;
import dev.timber.series.SeriesGroupBy;

/**
 * Result of {@link DataFrame#groupby(Series)}: every column split by the same keys.
 * <p>
 * Aggregations produce a new frame with one row per distinct key, in order
 * of first appearance. Its first column holds the text form of the keys and
 * is named after the key series, or {@code key} if that is unnamed. The
 * remaining columns are the aggregated source columns in their original
 * order, leaving out a source column of the key column's name, such as the
 * column the keys were taken from. An aggregation that cannot handle a column's element type fails
 * for the whole frame.
 * </p>
 */
public final class DataFrameGroupBy {

    private static final String DEFAULT_KEY_NAME = "key";

    private final String keyName;
    private final List<String> keys;
    private final List<SeriesGroupBy<?>> groups;

    private DataFrameGroupBy(String keyName, List<String> keys, List<SeriesGroupBy<?>> groups) {
        this.keyName = keyName;
        this.keys = keys;
        this.groups = groups;
    }

    /**
     * Split every column except the one sharing the key column's name, which the
     * key column replaces in the aggregated frames.
     */
    static DataFrameGroupBy split(DataFrame frame, Series<?> keys) {
        String keyName = keys.name() != null ? keys.name() : DEFAULT_KEY_NAME;
        List<SeriesGroupBy<?>> groups = new ArrayList<>(frame.nColumns());
        for (String column : frame.columns()) {
            if (!column.equals(keyName)) {
                groups.add(frame.column(column).series().groupby(keys));
            }
        }
        List<String> distinctKeys = new ArrayList<>(new LinkedHashSet<>(keys.toStrings()));
        return new DataFrameGroupBy(keyName, distinctKeys, groups);
    }

    /**
     * Text form of each distinct key, in order of first appearance.
     */
    public List<String> keys() {
        return Collections.unmodifiableList(keys);
    }

    /**
     * The per-column splits, in column order.
     */
    public List<SeriesGroupBy<?>> groups() {
        return Collections.unmodifiableList(groups);
    }

    public DataFrame sum() {
        return combine(group -> group.sum());
    }

    public DataFrame min() {
        return combine(group -> group.min());
    }

    public DataFrame max() {
        return combine(group -> group.max());
    }

    public DataFrame mean() {
        return combine(group -> group.mean());
    }

    public DataFrame var(int ddof) {
        return combine(group -> group.var(ddof));
    }

    public DataFrame count() {
        return combine(group -> group.count());
    }

    /**
     * Apply a per-column aggregation and reassemble the results into a frame.
     */
    public DataFrame combine(Function<SeriesGroupBy<?>, Series<?>> aggregation) {
        DataFrame result = new DataFrame();
        result.addColumn(Series.of(ElementTypes.TEXT, keys).named(keyName));
        for (SeriesGroupBy<?> group : groups) {
            result.addColumn(aggregation.apply(group));
        }
        return result;
    }
}
