/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.metadata;

/**
 * Registry entry describing one column of a data frame.
 */
public record SeriesMeta(String name, int length, DType dtype) {

    @Override
    public String toString() {
        return name + ": " + dtype.name().toLowerCase() + "[" + length + "]";
    }
}
