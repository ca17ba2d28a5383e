/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.row;

import dev.timber.metadata.DType;

/**
 * One cell of a row: the column name, its dtype and the boxed value.
 */
public record Datum(String column, DType dtype, Object value) {

    /**
     * The value widened to double.
     *
     * @throws IllegalArgumentException if the value is not numeric
     */
    public double asDouble() {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException("Column " + column + " is " + dtype + ", not numeric");
    }

    public String asText() {
        return String.valueOf(value);
    }
}
