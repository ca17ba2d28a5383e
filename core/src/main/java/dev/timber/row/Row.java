/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.row;

import java.util.List;

/**
 * Read-only view of one row of a data frame, across all its columns.
 * <p>
 * Provides dedicated accessor methods for each element type, similar to JDBC ResultSet.
 * Values are read from the frame on each call; a row holds no data of its own
 * and reflects later changes to the frame's values.
 * </p>
 *
 * <pre>{@code
 * for (Row row : frame) {
 *     long id = row.getLong("id");
 *     String city = row.getString("city");
 *     Datum any = row.get("temperature");
 * }
 * }</pre>
 */
public interface Row {

    /** Position of the row within the frame. */
    int position();

    /** Index value of the row. */
    long index();

    List<String> columns();

    /**
     * Get a cell with its dtype.
     *
     * @throws dev.timber.error.ColumnNotFoundException if there is no such column
     */
    Datum get(String name);

    /**
     * Get a cell value, boxed.
     *
     * @throws dev.timber.error.ColumnNotFoundException if there is no such column
     */
    Object getValue(String name);

    /**
     * @throws IllegalArgumentException if the column is not INT64
     */
    long getLong(String name);

    /**
     * @throws IllegalArgumentException if the column is not INT32
     */
    int getInt(String name);

    /**
     * @throws IllegalArgumentException if the column is not FLOAT64
     */
    double getDouble(String name);

    /**
     * @throws IllegalArgumentException if the column is not FLOAT32
     */
    float getFloat(String name);

    /**
     * @throws IllegalArgumentException if the column is not TEXT
     */
    String getString(String name);
}
