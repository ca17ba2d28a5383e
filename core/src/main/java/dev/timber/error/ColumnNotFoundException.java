/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.error;

/**
 * Thrown when a data frame has no column of the requested name.
 */
public class ColumnNotFoundException extends TimberException {

    private final String column;

    public ColumnNotFoundException(String column) {
        super("Column not found: " + column);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
