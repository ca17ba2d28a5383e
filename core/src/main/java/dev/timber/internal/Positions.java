/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal;

import java.util.Collection;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Validation of row positions shared by series and frames.
 */
public final class Positions {

    private Positions() {
    }

    /**
     * Sorted, de-duplicated positions, all within {@code [0, size)}.
     *
     * @throws IndexOutOfBoundsException if any position is outside that range
     */
    public static TreeSet<Integer> validate(Collection<Integer> positions, int size) {
        TreeSet<Integer> sorted = new TreeSet<>();
        for (Integer position : positions) {
            sorted.add(Objects.checkIndex(position, size));
        }
        return sorted;
    }
}
