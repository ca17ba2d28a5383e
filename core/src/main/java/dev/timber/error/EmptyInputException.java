/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.error;

/**
 * Thrown by an aggregation applied to a zero-length input.
 */
public class EmptyInputException extends TimberException {

    public EmptyInputException(String aggregation) {
        super("Cannot compute " + aggregation + " of an empty input");
    }
}
