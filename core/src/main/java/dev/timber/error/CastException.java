/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.error;

import dev.timber.metadata.DType;

/**
 * Thrown when a text value cannot be parsed as the requested element type.
 */
public class CastException extends ValueException {

    private final String text;
    private final DType target;

    public CastException(String text, DType target, Throwable cause) {
        super("Cannot parse '" + text + "' as " + target, cause);
        this.text = text;
        this.target = target;
    }

    /**
     * The offending text.
     */
    public String getText() {
        return text;
    }

    public DType getTarget() {
        return target;
    }
}
