/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.error;

/**
 * Base class for all data-dependent failures reported by Timber.
 * <p>
 * Contract violations such as reading past the end of a series are reported
 * with the standard {@link IndexOutOfBoundsException} and
 * {@link IllegalArgumentException} instead.
 * </p>
 */
public abstract class TimberException extends RuntimeException {

    protected TimberException(String message) {
        super(message);
    }

    protected TimberException(String message, Throwable cause) {
        super(message, cause);
    }
}
