/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.series;

import dev.timber.metadata.DType;

/**
 * Capabilities every element type stored in a {@link Series} provides.
 * <p>
 * There is exactly one implementation per {@link DType}, available from
 * {@link ElementTypes}. Series, CSV type inference, binary snapshots and
 * the aggregation functions all go through this interface, so per-type
 * behavior lives in one place.
 * </p>
 *
 * @param <T> the boxed Java type of the elements
 */
public interface ElementType<T> {

    DType dtype();

    Class<T> javaType();

    /**
     * Parse the text form of a value.
     *
     * @throws dev.timber.error.CastException if the text is not a valid value of this type
     */
    T parse(String text);

    /**
     * Parse the text form of a value produced by another element type.
     * Differs from {@link #parse(String)} only for integral types, which also
     * accept floating text holding an integral value, such as {@code "3.0"}.
     *
     * @throws dev.timber.error.CastException if the text cannot be converted
     */
    default T coerce(String text) {
        return parse(text);
    }

    String format(T value);

    int compare(T a, T b);

    boolean isNumeric();

    /**
     * Widen a value to double precision.
     *
     * @throws dev.timber.error.ValueException for non-numeric types
     */
    double toDouble(T value);

    T add(T a, T b);

    T zero();

    default boolean isNaN(T value) {
        return false;
    }

    /**
     * Checked cast of an arbitrary object to this element type.
     *
     * @throws IllegalArgumentException if the value is null or of another type
     */
    default T cast(Object value) {
        if (!javaType().isInstance(value)) {
            throw new IllegalArgumentException("Value " + value + " is not of type " + dtype());
        }
        return javaType().cast(value);
    }
}
