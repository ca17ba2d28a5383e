/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.error;

/**
 * Thrown when the header record of a delimited text source is missing or unusable.
 */
public class HeaderParseException extends TimberException {

    public HeaderParseException(String message) {
        super(message);
    }

    public HeaderParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
