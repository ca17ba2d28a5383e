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

import dev.timber.error.CastException;
import dev.timber.series.ElementType;
import dev.timber.series.ElementTypes;
import dev.timber.series.Series;

/**
 * Chooses the element type of a column read as text.
 * <p>
 * The column becomes INT64 if every value parses as a 64-bit integer,
 * otherwise FLOAT64 if every value parses as a double, otherwise TEXT.
 * A single value that does not parse, including an empty field, decides
 * for the whole column. A column without values is TEXT.
 * </p>
 */
public final class ColumnInference {

    private ColumnInference() {
    }

    public static Series<?> infer(String name, List<String> raw) {
        if (!raw.isEmpty()) {
            Series<Long> longs = parseAll(raw, ElementTypes.INT64);
            if (longs != null) {
                return longs.named(name);
            }
            Series<Double> doubles = parseAll(raw, ElementTypes.FLOAT64);
            if (doubles != null) {
                return doubles.named(name);
            }
        }
        return Series.of(ElementTypes.TEXT, raw).named(name);
    }

    /**
     * Parse every value, or return null as soon as one fails.
     */
    private static <T> Series<T> parseAll(List<String> raw, ElementType<T> type) {
        List<T> parsed = new ArrayList<>(raw.size());
        for (String text : raw) {
            try {
                parsed.add(type.parse(text));
            }
            catch (CastException e) {
                return null;
            }
        }
        return Series.of(type, parsed);
    }
}
