/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal.compression;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Pass-through codec for plain text files.
 */
public class UncompressedStreamCodec implements StreamCodec {

    @Override
    public InputStream wrapInput(InputStream in) {
        return in;
    }

    @Override
    public OutputStream wrapOutput(OutputStream out) {
        return out;
    }

    @Override
    public String getName() {
        return "UNCOMPRESSED";
    }
}
