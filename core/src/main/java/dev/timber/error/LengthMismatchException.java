/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.error;

/**
 * Thrown when two sequences that must line up row by row have different lengths.
 */
public class LengthMismatchException extends TimberException {

    private final int expected;
    private final int actual;

    public LengthMismatchException(String what, int expected, int actual) {
        super(what + ": expected length " + expected + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
