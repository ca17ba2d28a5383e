/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.metadata;

/**
 * Element types a column can hold.
 * The tag identifies the type in binary column snapshots.
 */
public enum DType {
    FLOAT64(0),
    INT64(1),
    FLOAT32(2),
    INT32(3),
    TEXT(4);

    private final byte tag;

    DType(int tag) {
        this.tag = (byte) tag;
    }

    public byte getTag() {
        return tag;
    }

    public boolean isFloating() {
        return this == FLOAT64 || this == FLOAT32;
    }

    public boolean isNumeric() {
        return this != TEXT;
    }

    public static DType fromTag(byte tag) {
        for (DType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown dtype tag: " + tag);
    }
}
